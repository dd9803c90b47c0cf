package com.cliffc.lambda;

/** Thrown when normalization uses up its beta-step budget without reaching a
 *  normal form. */
public class StepLimit extends RuntimeException {
  public final long _steps;
  public StepLimit( long steps ) {
    super("no normal form within "+steps+" steps");
    _steps = steps;
  }
}
