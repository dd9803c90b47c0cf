package com.cliffc.lambda.term;

import com.cliffc.lambda.util.SB;
import org.jetbrains.annotations.NotNull;

/** Function application; left-nested chains print flattened: (f a b c) */
public final class Apply extends Term {
  public final Term _fun, _arg;
  private final int _hash;
  public Apply( Term fun, Term arg ) {
    _fun=fun; _arg=arg;
    _hash = fun.hashCode()*37 + arg.hashCode()*7 + 1;
  }
  // Left-associative application of several args
  public static @NotNull Term make( Term fun, Term... args ) {
    for( Term arg : args ) fun = new Apply(fun,arg);
    return fun;
  }

  @Override public SB str(SB sb) {
    if( _fun instanceof Apply ) _fun.str(sb).unchar(); // Drop the close paren
    else _fun.str(sb.p('('));
    return _arg.str(sb.s()).p(')');
  }

  @Override public @NotNull Term subst( Var v, Term e ) {
    Term fun = _fun.subst(v,e);
    Term arg = _arg.subst(v,e);
    return fun==_fun && arg==_arg ? this : new Apply(fun,arg);
  }

  @Override public boolean free( Var v ) { return _fun.free(v) || _arg.free(v); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Apply app) || _hash!=app._hash ) return false;
    return _fun.equals(app._fun) && _arg.equals(app._arg);
  }
  @Override public int hashCode() { return _hash; }
}
