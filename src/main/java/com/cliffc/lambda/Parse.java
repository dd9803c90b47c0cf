package com.cliffc.lambda;

import com.cliffc.lambda.term.Apply;
import com.cliffc.lambda.term.Lambda;
import com.cliffc.lambda.term.Ref;
import com.cliffc.lambda.util.SB;

/** Parser for the textual lambda syntax.
 *
 *  <pre>
 *  expr := VAR | (VAR) | (λVAR.expr) | (λVAR VAR....expr) | (expr expr+)
 *  VAR  := any single char, except digits and  _ space ( ) \
 *  </pre>
 *
 *  Both {@code λ} and {@code \} start a lambda.  Applications associate to
 *  the left: {@code (a b c)} is {@code ((a b) c)}.  Works on substrings:
 *  every recursive call gets one self-contained unit, re-wrapped in parens by
 *  {@link #addParens} where needed.
 */
public abstract class Parse {
  public static final char LAMBDA = 'λ';

  /** Normalize whitespace, then parse one whole line.
   *  @param line raw user text
   *  @return the term, or an error; never throws on bad input */
  public static Parsed parse( String line ) {
    String s = normalize(line);
    if( s.isEmpty() || !balanced(s) ) return Parsed.err(ErrMsg.NO_PARSE);
    return term(addParens(s));
  }

  // Collapse whitespace runs to a single space; drop spaces just inside parens
  static String normalize( String s ) {
    SB sb = new SB();
    for( String w : s.trim().split("\\s+") ) {
      if( w.isEmpty() ) continue;
      if( sb.len()>0 && sb.last()!='(' && w.charAt(0)!=')' ) sb.s();
      sb.p(w);
    }
    return sb.toString();
  }

  // Parens match, and never close below depth 0
  static boolean balanced( String s ) {
    int d=0;
    for( int i=0; i<s.length(); i++ ) {
      char c = s.charAt(i);
      if( c=='(' ) d++;
      if( c==')' && --d < 0 ) return false;
    }
    return d==0;
  }

  /** Wrap in parens if s is a lambda or has a top-level space, so the
   *  recursive parse sees a single unit. */
  static String addParens( String s ) {
    if( s.isEmpty() ) return s;
    return isLam(s.charAt(0)) || lastTopSpace(s) != -1 ? "("+s+")" : s;
  }

  // Index of the rightmost space at paren depth 0, or -1
  private static int lastTopSpace( String s ) {
    int d=0;
    for( int i=s.length()-1; i>=0; i-- ) {
      char c = s.charAt(i);
      if( c==')' ) d++;
      else if( c=='(' ) d--;
      else if( c==' ' && d==0 ) return i;
    }
    return -1;
  }

  static boolean isLam( char c ) { return c==LAMBDA || c=='\\'; }
  static boolean forbidden( char c ) { return "_ ()\\".indexOf(c) != -1 || Character.isDigit(c); }

  static Parsed term( String s ) {
    int len = s.length();
    if( len==0 ) return Parsed.err(ErrMsg.NO_PARSE);
    if( len==1 ) {              // Single variable
      char c = s.charAt(0);
      return forbidden(c) ? Parsed.err(ErrMsg.illegal(c)) : Parsed.ok(new Ref(c));
    }
    if( s.charAt(0)!='(' || s.charAt(len-1)!=')' ) return Parsed.err(ErrMsg.NO_PARSE);
    if( len==3 ) return term(s.substring(1,2)); // (v)
    return isLam(s.charAt(1)) ? lambda(s) : apply(s);
  }

  // (λx.body) or (λx y z.body); params are checked left to right before the body
  private static Parsed lambda( String s ) {
    int x=2, end=s.length()-1;
    SB params = new SB();
    while( true ) {
      if( x >= end ) return Parsed.err(ErrMsg.NO_PARSE);
      char c = s.charAt(x);
      if( c=='.' && params.len()>0 ) break;
      if( forbidden(c) ) return Parsed.err(ErrMsg.illegal(c));
      params.p(c);
      if( ++x < end && s.charAt(x)==' ' ) x++;
    }
    String body = s.substring(x+1,end);
    if( body.startsWith(" ") ) body = body.substring(1);
    Parsed pbody = term(addParens(body));
    return pbody.ok() ? Parsed.ok(Lambda.make(params.toString(),pbody._term)) : pbody;
  }

  // (e0 e1 ... en) is ((e0 ... en-1) en), split at the rightmost top-level
  // space.  The last argument is taken as is: a bare lambda there is no parse.
  private static Parsed apply( String s ) {
    String in = s.substring(1,s.length()-1);
    int split = lastTopSpace(in);
    if( split <= 0 ) return Parsed.err(ErrMsg.NO_PARSE);
    Parsed fun = term(addParens(in.substring(0,split)));
    if( !fun.ok() ) return fun;
    Parsed arg = term(in.substring(split+1));
    if( !arg.ok() ) return arg;
    return Parsed.ok(new Apply(fun._term,arg._term));
  }
}
