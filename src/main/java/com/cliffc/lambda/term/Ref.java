package com.cliffc.lambda.term;

import com.cliffc.lambda.util.SB;
import org.jetbrains.annotations.NotNull;

/** A use of a variable, free or bound depending on the enclosing Lambdas. */
public final class Ref extends Term {
  public final Var _var;
  public Ref( Var var ) { _var=var; }
  public Ref( char c ) { this(new Var(c)); }

  @Override public SB str(SB sb) { return _var.str(sb); }

  @Override public @NotNull Term subst( Var v, Term e ) {
    return _var.equals(v) ? e : this;
  }

  @Override public boolean free( Var v ) { return _var.equals(v); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Ref ref && _var.equals(ref._var);
  }
  @Override public int hashCode() { return _var.hashCode(); }
}
