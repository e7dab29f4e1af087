package com.cliffc.maclane.ring;

import java.math.BigInteger;

// The rational field
public final class RatField extends Ring<Rat> {
  public static final RatField QQ = new RatField();
  private RatField() {}

  @Override public Rat zero() { return Rat.ZERO; }
  @Override public Rat one () { return Rat.ONE ; }
  @Override public Rat add( Rat a, Rat b ) { return a.add(b); }
  @Override public Rat neg( Rat a ) { return a.neg(); }
  @Override public Rat sub( Rat a, Rat b ) { return a.sub(b); }
  @Override public Rat mul( Rat a, Rat b ) { return a.mul(b); }
  @Override public boolean is_field() { return true; }
  @Override public Rat inv( Rat a ) { return a.inv(); }
  @Override public Rat from_big( BigInteger x ) { return Rat.make(x); }
  @Override public Rat coerce( Object o ) {
    if( o instanceof Rat r ) {
      if( r.is_inf() ) throw new ArithmeticException("infinity is not rational");
      return r;
    }
    if( o instanceof BigInteger b ) return Rat.make(b);
    if( o instanceof Integer || o instanceof Long ) return Rat.make(((Number)o).longValue());
    throw new ClassCastException("cannot coerce "+o+" into "+this);
  }
  @Override public BigInteger size() { return null; }
  @Override public BigInteger characteristic() { return BigInteger.ZERO; }
  @Override public String toString() { return "Rational Field"; }
}
