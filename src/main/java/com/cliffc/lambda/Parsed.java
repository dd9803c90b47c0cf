package com.cliffc.lambda;

import com.cliffc.lambda.term.Term;

/** Result of a parse: exactly one of a term or an error. */
public class Parsed {
  public final Term _term;
  public final ErrMsg _err;
  private Parsed( Term term, ErrMsg err ) { assert (term==null) != (err==null); _term=term; _err=err; }
  static Parsed ok( Term term ) { return new Parsed(term,null); }
  static Parsed err( ErrMsg err ) { return new Parsed(null,err); }
  public boolean ok() { return _err==null; }
  @Override public String toString() { return ok() ? _term.toString() : _err.toString(); }
}
