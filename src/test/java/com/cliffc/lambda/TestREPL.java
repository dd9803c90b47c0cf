package com.cliffc.lambda;

import org.junit.*;
import org.junit.contrib.java.lang.system.SystemErrRule;
import org.junit.contrib.java.lang.system.SystemOutRule;

import static org.junit.Assert.*;


public class TestREPL {
  // Replace STDIN/STDOUT and track them
  @Rule public final SystemOutRule sysOut = new SystemOutRule().enableLog().muteForSuccessfulTests();
  @Rule public final SystemErrRule sysErr = new SystemErrRule().enableLog().muteForSuccessfulTests();

  private long _steps;
  @Before public void open_repl() {
    _steps = LC.STEPS;
    REPL.init();
    // Drain the initial prompt string so tests do not expect one
    String actual = sysOut.getLog();
    String expected = REPL.prompt;
    assertEquals(expected,actual);
    sysOut.clearLog();
    assertTrue(sysErr.getLog().isEmpty());
  }

  @After public void close_repl() { LC.STEPS = _steps; }

  // Does the REPL test work?
  @Test public void testREPL00() {
    test("a", "a = a");
  }

  // Basic REPL, with errors & recovery
  @Test public void testREPL01() {
    test("(\\x.x)", "(λx.x) = (λx.x)");
    test("((\\x.x) (\\y.y))", "((λx.x) (λy.y)) = (λy.y)");
    test("1", "Error: illegal use of character '1'");
    test("(a b", "Error: no parse");
    test("((\\x.(\\y.x)) a b)", "((λx y.x) a b) = a");
    test("  f    (\\x.x)  ", "(f (λx.x)) = (f (λx.x))");
    test("(f \\x.x)", "Error: no parse");
    test("(f \\ x)", "Error: illegal use of character '\\'");
    test("((\\x.(\\y.x)) y)", "((λx y.x) y) = (λy_0.y)");
  }

  // Blank lines just re-prompt
  @Test public void testREPL02() {
    test("", null);
    test("   ", null);
  }

  // Divergence is reported, and the loop carries on
  @Test public void testREPL03() {
    LC.STEPS = 100;
    test("((\\x.(x x)) (\\x.(x x)))", "Error: no normal form within 100 steps");
    test("((\\x.x) a)", "((λx.x) a) = a");
  }

  // A bad step budget is a usage error, reported before the loop starts
  @Test public void testBadSteps() {
    assertNull(LC.usage());
    LC.STEPS = 0;
    assertEquals("Error: -Dlc.steps must be a positive step count, not 0",LC.usage());
    LC.STEPS = -5;
    assertNotNull(LC.usage());
  }

  @Test public void testCommands() {
    assertTrue(REPL.go_one(":help"));
    String help = REPL.help();
    assertTrue(help.contains(":quit"));
    assertEquals(help+REPL.prompt,sysOut.getLog());
    sysOut.clearLog();

    assertTrue(REPL.go_one(":h"));
    assertEquals(help+REPL.prompt,sysOut.getLog());
    sysOut.clearLog();

    assertTrue(REPL.go_one(":cls"));
    assertEquals(REPL.CLEAR+REPL.prompt,sysOut.getLog());
    sysOut.clearLog();
    assertTrue(REPL.go_one(":clear"));
    assertEquals(REPL.CLEAR+REPL.prompt,sysOut.getLog());
    sysOut.clearLog();

    // Not a command; parses as a term and fails
    test(":what", "Error: no parse");

    assertFalse(REPL.go_one(":quit"));
    assertFalse(REPL.go_one(" :q now"));
    assertEquals("",sysOut.getLog());
    assertTrue(sysErr.getLog().isEmpty());
  }

  // Jam the line into the REPL one-step, read the STDOUT and compare.
  private void test( String line, String expected ) {
    assertTrue(REPL.go_one(line));
    String actual = sysOut.getLog();
    String exp = (expected==null ? "" : expected+System.lineSeparator())+REPL.prompt;
    assertEquals(exp,actual);
    sysOut.clearLog();
    assertTrue(sysErr.getLog().isEmpty());
  }
}
