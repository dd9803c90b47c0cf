package com.cliffc.lambda.term;

import com.cliffc.lambda.util.SB;

/** A variable: a base char plus a generation index.  The generation only
 *  exists to make fresh names when alpha-renaming; two Vars are the same
 *  binding iff both fields match.
 */
public final class Var {
  public final char _c;
  public final int _gen;
  public Var( char c ) { this(c,0); }
  public Var( char c, int gen ) { assert gen >= 0; _c=c; _gen=gen; }

  // Locally fresh only: no check against other generations of _c already in
  // the term.
  public Var rename() { return new Var(_c,_gen+1); }

  // Generation 0 prints bare, generation i prints as c_(i-1)
  public SB str( SB sb ) {
    sb.p(_c);
    return _gen==0 ? sb : sb.p('_').p(_gen-1);
  }
  @Override public String toString() { return str(new SB()).toString(); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Var v && _c==v._c && _gen==v._gen;
  }
  @Override public int hashCode() { return _c*31+_gen; }
}
