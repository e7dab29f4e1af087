package com.cliffc.maclane.util;

import java.math.BigInteger;

public class Util {
  // Bits in the absolute value; 0 has none
  static public int nbits( BigInteger x ) { return x.abs().bitLength(); }

  static public BigInteger lcm( BigInteger a, BigInteger b ) {
    if( a.signum()==0 || b.signum()==0 ) return BigInteger.ZERO;
    return a.divide(a.gcd(b)).multiply(b).abs();
  }

  // Distinct prime factors, by trial division.  Only used on degrees.
  static public Ary<Integer> prime_factors( int n ) {
    assert n > 0;
    Ary<Integer> ps = new Ary<>();
    for( int p=2; p*p<=n; p++ )
      if( n%p==0 ) {
        ps.add(p);
        while( n%p==0 ) n /= p;
      }
    if( n>1 ) ps.add(n);
    return ps;
  }

  // Positive divisors of a non-zero integer, by trial division.  Rational
  // root candidates only, so inputs stay small.
  static public Ary<BigInteger> divisors( BigInteger n ) {
    n = n.abs();
    assert n.signum() > 0;
    if( n.bitLength() > 62 )
      throw new ArithmeticException("too large to enumerate divisors: "+n);
    long x = n.longValue();
    Ary<BigInteger> lo = new Ary<>(), hi = new Ary<>();
    for( long d=1; d*d<=x; d++ )
      if( x%d==0 ) {
        lo.add(BigInteger.valueOf(d));
        if( d*d!=x ) hi.add(BigInteger.valueOf(x/d));
      }
    for( int i=hi.len()-1; i>=0; i-- ) lo.add(hi.at(i));
    return lo;
  }

  // Largest e with p^e dividing x; x non-zero
  static public int val( BigInteger x, BigInteger p ) {
    assert x.signum()!=0;
    int e=0;
    BigInteger[] qr;
    while( (qr=x.divideAndRemainder(p))[1].signum()==0 ) { x = qr[0]; e++; }
    return e;
  }
}
