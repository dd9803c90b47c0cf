package com.cliffc.lambda;

import com.cliffc.lambda.term.Term;

import java.util.function.Supplier;

/** Parse; normalize; print.  One line of input in, one line of output out.
 */
public abstract class Exec {

  /** @return "input = normal form", or the error text.  Never throws for bad input. */
  public static String go( String line ) { return go(line,LC.STEPS); }
  public static String go( String line, long steps ) {
    return onBigStack(() -> run(line,steps));
  }

  static String run( String line, long steps ) {
    Parsed p = Parse.parse(line);
    if( !p.ok() ) return p._err.toString();
    Eval eval = new Eval(steps);
    try {
      Term t = eval.normalize(p._term);
      return LC.p(p._term+" = "+t,"steps: "+eval.steps());
    } catch( StepLimit sl ) {
      return ErrMsg.steps(sl._steps).toString();
    }
  }

  // Parsing, reduction and printing all recurse on term depth; give them a
  // big stack of their own.
  static String onBigStack( Supplier<String> work ) {
    String[] rez = new String[1];
    Throwable[] err = new Throwable[1];
    Thread thr = new Thread(null, () -> {
        try { rez[0] = work.get(); }
        catch( StackOverflowError soe ) { rez[0] = ErrMsg.TOO_DEEP.toString(); }
        catch( Throwable t ) { err[0] = t; }
      }, "lc-eval", LC.STACK);
    thr.start();
    try {
      thr.join();
    } catch( InterruptedException ie ) {
      thr.interrupt();
      Thread.currentThread().interrupt();
      throw new RuntimeException(ie);
    }
    if( err[0] instanceof RuntimeException re ) throw re;
    if( err[0] instanceof Error e ) throw e;
    return rez[0];
  }
}
