package com.cliffc.lambda.term;

import com.cliffc.lambda.util.SB;
import org.jetbrains.annotations.NotNull;

/** Abstraction of one parameter.  Nested chains print as one header: (λx y.b) */
public final class Lambda extends Term {
  public final Var _var;
  public final Term _body;
  private final int _hash;
  public Lambda( Var var, Term body ) {
    _var=var; _body=body;
    _hash = var.hashCode()*41 + body.hashCode()*3 + 2;
  }
  public Lambda( char c, Term body ) { this(new Var(c),body); }
  // Curried lambda of several params: make("xy",b) is (λx.(λy.b))
  public static @NotNull Term make( String params, Term body ) {
    for( int i=params.length()-1; i>=0; i-- )
      body = new Lambda(params.charAt(i),body);
    return body;
  }

  @Override public SB str(SB sb) {
    _var.str(sb.p("(λ"));
    Term body = _body;
    while( body instanceof Lambda lam ) {
      lam._var.str(sb.s());
      body = lam._body;
    }
    return body.str(sb.p('.')).p(')');
  }

  @Override public @NotNull Term subst( Var v, Term e ) {
    // Rename our binder if it shadows v or would capture a free var of e.
    // The shadow case needs no rename (v cannot be free below us) but we
    // rename anyways; the result is alpha-equivalent either way.
    if( _var.equals(v) || e.free(_var) ) {
      Var w = _var.rename();
      return new Lambda(w,_body.subst(_var,new Ref(w))).subst(v,e);
    }
    Term body = _body.subst(v,e);
    return body==_body ? this : new Lambda(_var,body);
  }

  @Override public boolean free( Var v ) { return !_var.equals(v) && _body.free(v); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Lambda lam) || _hash!=lam._hash ) return false;
    return _var.equals(lam._var) && _body.equals(lam._body);
  }
  @Override public int hashCode() { return _hash; }
}
