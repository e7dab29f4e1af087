package com.cliffc.maclane.ring;

import com.cliffc.maclane.util.Ary;

import java.math.BigInteger;
import java.util.Random;

/** A commutative ring with exact, immutable elements of type {@code E}.
 *
 *  Elements do not know their ring; all arithmetic goes through the ring
 *  object.  Element {@code equals} is ring equality.  Rings compare equal by
 *  structure, so two separately built {@code GF(2)[x]} agree.
 */
public abstract class Ring<E> {
  public abstract E zero();
  public abstract E one();
  public abstract E add( E a, E b );
  public abstract E neg( E a );
  public abstract E mul( E a, E b );
  public E sub( E a, E b ) { return add(a,neg(b)); }
  public boolean is_zero( E a ) { return a.equals(zero()); }
  public boolean is_one ( E a ) { return a.equals(one ()); }

  public abstract boolean is_field();
  // Multiplicative inverse; ArithmeticException if not a unit
  public abstract E inv( E a );
  public E div( E a, E b ) { return mul(a,inv(b)); }
  public boolean is_unit( E a ) {
    if( is_zero(a) ) return false;
    if( is_field() ) return true;
    try { inv(a); return true; }
    catch( ArithmeticException ae ) { return false; }
  }

  public abstract E from_big( BigInteger x );
  public E from_long( long x ) { return from_big(BigInteger.valueOf(x)); }
  // Accepts elements of this ring, integers, and elements of any ring this
  // one is built on.  ClassCastException or ArithmeticException otherwise.
  public abstract E coerce( Object o );

  // Number of elements, or null if infinite
  public abstract BigInteger size();
  public boolean is_finite() { return size()!=null; }
  public abstract BigInteger characteristic();
  // Uniform random element of a finite ring
  public E random( Random r ) { throw new UnsupportedOperationException("no random elements in "+this); }

  public E pow( E a, long n ) { return pow(a,BigInteger.valueOf(n)); }
  public E pow( E a, BigInteger n ) {
    if( n.signum() < 0 ) return pow(inv(a),n.negate());
    E r = one(), b = a;
    for( int i=0; i<n.bitLength(); i++ ) {
      if( n.testBit(i) ) r = mul(r,b);
      if( i+1 < n.bitLength() ) b = mul(b,b);
    }
    return r;
  }
  // The p-th root in a finite field of characteristic p: a^(q/p)
  public E pth_root( E a ) {
    BigInteger q = size();
    if( q==null ) throw new UnsupportedOperationException("p-th root in "+this);
    return pow(a,q.divide(characteristic()));
  }

  // Symbol names used by this ring and the rings it is built on
  public Ary<String> names() { return new Ary<>(); }
  // The ring this one is built on, or null for a prime ring
  public Ring<?> base() { return null; }

  public String str( E a ) { return a.toString(); }
}
