package com.cliffc.lambda.term;

import com.cliffc.lambda.util.SB;
import org.jetbrains.annotations.NotNull;

/** Untyped lambda-calculus terms.  A finite, immutable tree of Refs, Applys
 *  and Lambdas.  Substitution builds new trees sharing every unchanged
 *  subtree with the old one.
 *
 *  Binding is purely structural: a Ref is bound iff some enclosing Lambda
 *  binds an equal Var.  equals() is structural, NOT alpha-equivalence.
 */
public abstract class Term {
  Term() {}

  // Canonical display
  @Override public final String toString() { return str(new SB()).toString(); }
  public abstract SB str(SB sb);

  /** Capture-avoiding substitution.
   *  @param v Var being replaced
   *  @param e replacement; shared into the result, never copied
   *  @return this term with every free v replaced by e */
  public abstract @NotNull Term subst( Var v, Term e );

  /** @return true if v occurs free in this term */
  public abstract boolean free( Var v );
}
