package com.cliffc.lambda;

import com.cliffc.lambda.util.SB;

// Error messages
public class ErrMsg {

  // Error levels
  public enum Level {
    IllegalChar,                // Variable name is reserved syntax or a digit
    Syntax,                     // Matches no production
    StepLimit,                  // Reduction ran out of budget
    StackOverflow,              // Term nests too deep for the eval stack
  }

  public final String _msg;     // Printable error message
  public final Level _lvl;
  public final char _c;         // Offending char, for IllegalChar
  private ErrMsg(String msg, Level lvl, char c) { _msg=msg; _lvl=lvl; _c=c; }

  public static final ErrMsg NO_PARSE = new ErrMsg("no parse",Level.Syntax,'\0');
  public static final ErrMsg TOO_DEEP = new ErrMsg("term too deep",Level.StackOverflow,'\0');
  public static ErrMsg illegal(char c) {
    return new ErrMsg(new SB().p("illegal use of character '").p(c).p('\'').toString(),Level.IllegalChar,c);
  }
  public static ErrMsg steps(long steps) {
    return new ErrMsg(new SB().p("no normal form within ").p(steps).p(" steps").toString(),Level.StepLimit,'\0');
  }

  @Override public String toString() { return "Error: "+_msg; }
  @Override public boolean equals(Object obj) {
    if( this==obj ) return true;
    return obj instanceof ErrMsg err && _lvl==err._lvl && _msg.equals(err._msg);
  }
  @Override public int hashCode() { return _msg.hashCode()+_lvl.hashCode(); }
}
