package com.cliffc.maclane.ring;

import java.math.BigInteger;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

// GF(p), elements are BigIntegers in [0,p)
public final class PrimeField extends Ring<BigInteger> {
  public final BigInteger _p;
  private PrimeField( BigInteger p ) { _p=p; }

  private static final ConcurrentHashMap<BigInteger,PrimeField> FIELDS = new ConcurrentHashMap<>();
  public static PrimeField make( long p ) { return make(BigInteger.valueOf(p)); }
  public static PrimeField make( BigInteger p ) {
    PrimeField f = FIELDS.get(p);
    if( f!=null ) return f;
    if( p.signum() <= 0 || !p.isProbablePrime(64) ) throw new ArithmeticException(p+" is not a prime");
    f = new PrimeField(p);
    PrimeField old = FIELDS.putIfAbsent(p,f);
    return old==null ? f : old;
  }

  @Override public BigInteger zero() { return BigInteger.ZERO; }
  @Override public BigInteger one () { return BigInteger.ONE ; }
  @Override public BigInteger add( BigInteger a, BigInteger b ) {
    BigInteger c = a.add(b);
    return c.compareTo(_p) >= 0 ? c.subtract(_p) : c;
  }
  @Override public BigInteger neg( BigInteger a ) { return a.signum()==0 ? a : _p.subtract(a); }
  @Override public BigInteger mul( BigInteger a, BigInteger b ) { return a.multiply(b).mod(_p); }
  @Override public boolean is_field() { return true; }
  @Override public BigInteger inv( BigInteger a ) {
    if( a.signum()==0 ) throw new ArithmeticException("division by zero in "+this);
    return a.modInverse(_p);
  }
  @Override public BigInteger from_big( BigInteger x ) { return x.mod(_p); }
  @Override public BigInteger coerce( Object o ) {
    if( o instanceof BigInteger b ) return b.mod(_p);
    if( o instanceof Integer || o instanceof Long ) return from_long(((Number)o).longValue());
    if( o instanceof Rat r ) {
      if( r.is_inf() || r._den.mod(_p).signum()==0 ) throw new ArithmeticException(r+" has no image in "+this);
      return r._num.multiply(r._den.modInverse(_p)).mod(_p);
    }
    throw new ClassCastException("cannot coerce "+o+" into "+this);
  }
  @Override public BigInteger size() { return _p; }
  @Override public BigInteger characteristic() { return _p; }
  @Override public BigInteger random( Random r ) {
    BigInteger x;
    do x = new BigInteger(_p.bitLength(),r);
    while( x.compareTo(_p) >= 0 );
    return x;
  }
  @Override public BigInteger pth_root( BigInteger a ) { return a; }

  @Override public boolean equals( Object o ) { return o instanceof PrimeField f && _p.equals(f._p); }
  @Override public int hashCode() { return _p.hashCode(); }
  @Override public String toString() { return "Finite Field of size "+_p; }
}
