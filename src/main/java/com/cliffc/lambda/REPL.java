package com.cliffc.lambda;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Scanner;

/** Line-at-a-time lambda REPL.  Commands start with ':', anything else is a
 *  term to evaluate.  Bad input prints an error and the loop carries on.
 */

public abstract class REPL {
  public static final String prompt="λ> ";
  static final String CLEAR = "\u001B[2J\u001B[0;0H"; // Clear screen, cursor to top

  public static void go( ) {
    init();
    Scanner stdin = new Scanner(System.in,StandardCharsets.UTF_8);
    while( stdin.hasNextLine() )
      if( !go_one(stdin.nextLine()) )
        break;
  }

  static void init() {
    System.out.print(prompt);
    System.out.flush();
  }

  // Returns false to quit
  static boolean go_one( String line ) {
    String cmd = line.trim().split("\\s+")[0];
    switch( cmd ) {
    case "":                              break;
    case ":quit": case ":q":              return false;
    case ":help": case ":h":  System.out.print(help()); break;
    case ":clear": case ":cls": System.out.print(CLEAR); break;
    default: System.out.println(Exec.go(line));
    }
    System.out.print(prompt);
    System.out.flush();
    return true;
  }

  static String help() {
    try( InputStream is = REPL.class.getResourceAsStream("/help.txt") ) {
      if( is==null ) throw LC.TODO("Missing help.txt resource");
      return new String(is.readAllBytes(),StandardCharsets.UTF_8);
    } catch( IOException ioe ) {
      throw new UncheckedIOException(ioe);
    }
  }
}
