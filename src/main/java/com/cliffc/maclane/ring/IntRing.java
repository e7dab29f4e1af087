package com.cliffc.maclane.ring;

import java.math.BigInteger;

// The integers.  Elements are integral Rats, so ZZ sits inside QQ for free.
public final class IntRing extends Ring<Rat> {
  public static final IntRing ZZ = new IntRing();
  private IntRing() {}

  @Override public Rat zero() { return Rat.ZERO; }
  @Override public Rat one () { return Rat.ONE ; }
  @Override public Rat add( Rat a, Rat b ) { return a.add(b); }
  @Override public Rat neg( Rat a ) { return a.neg(); }
  @Override public Rat sub( Rat a, Rat b ) { return a.sub(b); }
  @Override public Rat mul( Rat a, Rat b ) { return a.mul(b); }
  @Override public boolean is_field() { return false; }
  @Override public Rat inv( Rat a ) {
    if( a.equals(Rat.ONE) || a.equals(Rat.ONE.neg()) ) return a;
    throw new ArithmeticException(a+" is not a unit in "+this);
  }
  @Override public Rat from_big( BigInteger x ) { return Rat.make(x); }
  @Override public Rat coerce( Object o ) {
    Rat r = RatField.QQ.coerce(o);
    if( !r.is_int() ) throw new ArithmeticException(r+" is not an integer");
    return r;
  }
  @Override public BigInteger size() { return null; }
  @Override public BigInteger characteristic() { return BigInteger.ZERO; }
  @Override public String toString() { return "Integer Ring"; }
}
