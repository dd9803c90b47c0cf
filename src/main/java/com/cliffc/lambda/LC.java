package com.cliffc.lambda;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/** An interpreter for the untyped lambda calculus
 */

public abstract class LC {
  public static RuntimeException TODO( String msg) { throw new RuntimeException(msg); }

  public static final String VERSION = "0.2.0";

  // Global tunables; set from -Dlc.* on the command line
  public static long STEPS = Long.getLong("lc.steps",1000000L);  // Beta-step budget per line
  public static long STACK = Long.getLong("lc.stack",1L<<29);    // Eval thread stack, in bytes
  public static boolean DEBUG = Boolean.getBoolean("lc.debug");

  public static void main( String[] args ) {
    // Lambdas print as λ no matter the platform encoding
    System.setOut(new PrintStream(new FileOutputStream(FileDescriptor.out),true,StandardCharsets.UTF_8));
    System.out.println("Lambda Calculus Interpreter");
    System.out.println("Version: "+VERSION);
    String bad = usage();
    if( bad != null ) { System.err.println(bad); return; }
    // Command line program
    if( args.length > 0 ) {
      System.out.println(Exec.go(String.join(" ",args)));
    } else {
      System.out.println("Type :help or :h for help and information on commands");
      REPL.go();
    }
  }

  // Check the tunables; null if all good, else the complaint
  static String usage() {
    if( STEPS <= 0 ) return "Error: -Dlc.steps must be a positive step count, not "+STEPS;
    if( STACK <= 0 ) return "Error: -Dlc.stack must be a positive byte count, not "+STACK;
    return null;
  }

  // Debug printer
  public static <T> T p(T x, String s) {
    if( !LC.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
