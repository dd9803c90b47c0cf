package com.cliffc.lambda;

import com.cliffc.lambda.term.*;
import org.jetbrains.annotations.NotNull;

/** Normal-order (leftmost-outermost) beta reduction.
 *
 *  Untyped terms need not have a normal form, so each beta contraction is
 *  charged against a step budget; running out throws {@link StepLimit}.  The
 *  tail-recursive cases (firing a head redex, retrying with an improved head)
 *  loop in place, so a divergent term burns steps rather than stack.
 *
 *  Not thread-safe; one Eval per reduction.
 */
public class Eval {
  public static final long UNBOUNDED = Long.MAX_VALUE;

  private final long _budget;
  private long _steps;          // Beta contractions so far

  public Eval() { this(UNBOUNDED); }
  public Eval( long budget ) {
    if( budget <= 0 ) throw new IllegalArgumentException("Step budget must be positive: "+budget);
    _budget = budget;
  }

  /** Reduce toward normal form with no step limit.  May not return. */
  public static @NotNull Term norm( Term t ) { return new Eval().normalize(t); }

  public long steps() { return _steps; }

  public @NotNull Term normalize( Term t ) {
    while( true ) {
      if( t instanceof Ref ) return t;
      if( t instanceof Lambda lam ) {
        Term body = normalize(lam._body);
        return body==lam._body ? lam : new Lambda(lam._var,body);
      }
      Apply app = (Apply)t;
      Term fun = app._fun, arg = app._arg;

      // Redex: contract and keep reducing the result
      if( fun instanceof Lambda redex ) {
        step();
        t = redex._body.subst(redex._var,arg);
        continue;
      }

      // Stuck on a variable head: reduce the argument
      if( fun instanceof Ref ) {
        Term arg2 = normalize(arg);
        return arg2==arg ? app : new Apply(fun,arg2);
      }

      Apply fapp = (Apply)fun;
      // Stuck on (v h) a: reduce only h, leave a for later
      if( fapp._fun instanceof Ref ) {
        Term h = normalize(fapp._arg);
        return h==fapp._arg ? app : new Apply(new Apply(fapp._fun,h),arg);
      }

      // Deeper head: normalize it; no change means we are stuck here
      Term fun2 = normalize(fun);
      if( fun2.equals(fun) ) return app;
      t = new Apply(fun2,arg);
    }
  }

  private void step() {
    if( _steps >= _budget ) throw new StepLimit(_budget);
    _steps++;
  }
}
