package com.cliffc.lambda;

import com.cliffc.lambda.term.*;
import org.jetbrains.annotations.NotNull;

/** Church encodings of booleans, pairs and numerals, built directly as Terms.
 *  Handy for driving the evaluator from code and tests.
 */
public abstract class Church {
  static Ref r( char c ) { return new Ref(c); }

  /** @return λf x.(f (f ... (f x))) with n applications of f */
  public static @NotNull Term num( int n ) {
    assert n >= 0;
    Term body = r('x');
    for( int i=0; i<n; i++ ) body = new Apply(r('f'),body);
    return Lambda.make("fx",body);
  }

  public static final Term TRUE  = Lambda.make("xy",r('x'));
  public static final Term FALSE = Lambda.make("xy",r('y'));

  // λn m f.(f n m)
  public static final Term PAIR = Lambda.make("nmf",Apply.make(r('f'),r('n'),r('m')));

  // λn m f.(m (n f))
  public static final Term MULT = Lambda.make("nmf",new Apply(r('m'),new Apply(r('n'),r('f'))));

  // λn f x.(n (λg h.(h (g f))) (λu.x) (λu.u))
  public static final Term PRED =
    Lambda.make("nfx",Apply.make(r('n'),
                                 Lambda.make("gh",new Apply(r('h'),new Apply(r('g'),r('f')))),
                                 new Lambda('u',r('x')),
                                 new Lambda('u',r('u'))));

  // λn.(n (λv.FALSE) TRUE)
  public static final Term ISZERO = new Lambda('n',Apply.make(r('n'),new Lambda('v',FALSE),TRUE));

  // Fixed-point combinator
  public static final Term Y = parse("(\\f.(\\x.f (x x)) (\\x.f (x x)))");

  // λf n.(ISZERO n 1 (MULT n (f (PRED n))))
  public static final Term H =
    Lambda.make("fn",Apply.make(ISZERO,r('n'),num(1),
                                Apply.make(MULT,r('n'),new Apply(r('f'),new Apply(PRED,r('n'))))));

  public static final Term FACTORIAL = new Apply(Y,H);

  private static Term parse( String s ) {
    Parsed p = Parse.parse(s);
    if( !p.ok() ) throw LC.TODO("Bad builtin term "+s+": "+p._err);
    return p._term;
  }
}
