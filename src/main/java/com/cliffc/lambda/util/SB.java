package com.cliffc.lambda.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB p( long   s ) { _sb.append(s); return this; }
  public SB s() { _sb.append(' '); return this; }
  public int len() { return _sb.length(); }
  public char last() { return _sb.charAt(_sb.length()-1); }
  // Delete last char; drops the close paren of a left-nested Apply
  public SB unchar() { _sb.setLength(_sb.length()-1); return this; }

  @Override public String toString() { return _sb.toString(); }
}
