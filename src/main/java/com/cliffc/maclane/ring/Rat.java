package com.cliffc.maclane.ring;

import com.cliffc.maclane.util.SB;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;

/** Exact rational numbers, plus a single positive infinity.
 *
 *  Used both as the elements of {@link RatField#QQ} and {@link IntRing#ZZ}
 *  and as valuation values.  Always normalized: {@code _den > 0} and
 *  {@code gcd(_num,_den)==1}.  Infinity is {@code 1/0}; it absorbs addition and
 *  is larger than every finite value.
 */
public final class Rat implements Comparable<Rat> {
  public final BigInteger _num, _den;
  private Rat( BigInteger num, BigInteger den ) { _num=num; _den=den; }

  public static final Rat ZERO = new Rat(BigInteger.ZERO,BigInteger.ONE);
  public static final Rat ONE  = new Rat(BigInteger.ONE ,BigInteger.ONE);
  public static final Rat INF  = new Rat(BigInteger.ONE ,BigInteger.ZERO);

  public static Rat make( long n ) { return make(BigInteger.valueOf(n)); }
  public static Rat make( long n, long d ) { return make(BigInteger.valueOf(n),BigInteger.valueOf(d)); }
  public static Rat make( BigInteger n ) {
    if( n.signum()==0 ) return ZERO;
    if( n.equals(BigInteger.ONE) ) return ONE;
    return new Rat(n,BigInteger.ONE);
  }
  public static Rat make( BigInteger n, BigInteger d ) {
    if( d.signum()==0 ) throw new ArithmeticException("division by zero");
    if( d.signum() < 0 ) { n = n.negate(); d = d.negate(); }
    BigInteger g = n.gcd(d);
    if( !g.equals(BigInteger.ONE) ) { n = n.divide(g); d = d.divide(g); }
    return d.equals(BigInteger.ONE) ? make(n) : new Rat(n,d);
  }
  // "3", "-3/4" or "+Infinity"
  public static Rat make( String s ) {
    if( s.equals("+Infinity") || s.equals("oo") ) return INF;
    int idx = s.indexOf('/');
    return idx == -1
      ? make(new BigInteger(s.trim()))
      : make(new BigInteger(s.substring(0,idx).trim()),new BigInteger(s.substring(idx+1).trim()));
  }

  public boolean is_inf () { return _den.signum()==0; }
  public boolean is_zero() { return _num.signum()==0; }
  public boolean is_int () { return _den.equals(BigInteger.ONE); }
  public int signum() { return _num.signum(); }

  public Rat add( Rat r ) {
    if( is_inf() || r.is_inf() ) return INF;
    if( r.is_zero() ) return this;
    if( is_zero() ) return r;
    if( is_int() && r.is_int() ) return make(_num.add(r._num));
    return make(_num.multiply(r._den).add(r._num.multiply(_den)),_den.multiply(r._den));
  }
  public Rat neg() {
    if( is_inf() ) throw new ArithmeticException("negating infinity");
    return is_zero() ? this : new Rat(_num.negate(),_den);
  }
  public Rat sub( Rat r ) {
    if( r.is_inf() ) throw new ArithmeticException("subtracting infinity");
    return add(r.neg());
  }
  public Rat mul( Rat r ) {
    if( is_inf() || r.is_inf() ) {
      Rat x = is_inf() ? r : this;
      if( x.signum() <= 0 && !x.is_inf() ) throw new ArithmeticException("infinity times "+x);
      return INF;
    }
    if( is_zero() || r.is_zero() ) return ZERO;
    return make(_num.multiply(r._num),_den.multiply(r._den));
  }
  public Rat mul( long x ) { return mul(make(x)); }
  public Rat inv() {
    if( is_inf() ) return ZERO;
    return make(_den,_num);
  }
  public Rat div( Rat r ) { return mul(r.inv()); }
  public Rat div( long x ) { return div(make(x)); }

  public BigInteger floor() {
    if( is_inf() ) throw new ArithmeticException("floor of infinity");
    BigInteger[] qr = _num.divideAndRemainder(_den);
    return qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
  }
  public BigInteger ceil() {
    if( is_inf() ) throw new ArithmeticException("ceil of infinity");
    BigInteger[] qr = _num.divideAndRemainder(_den);
    return qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
  }
  // Exact integer value; throws if not an integer
  public BigInteger as_int() {
    if( !is_int() ) throw new ArithmeticException(this+" is not an integer");
    return _num;
  }

  @Override public int compareTo( @NotNull Rat r ) {
    if( is_inf() ) return r.is_inf() ? 0 : 1;
    if( r.is_inf() ) return -1;
    return _num.multiply(r._den).compareTo(r._num.multiply(_den));
  }
  public boolean lt( Rat r ) { return compareTo(r) <  0; }
  public boolean le( Rat r ) { return compareTo(r) <= 0; }
  public boolean gt( Rat r ) { return compareTo(r) >  0; }
  public boolean ge( Rat r ) { return compareTo(r) >= 0; }
  public static Rat min( Rat a, Rat b ) { return a.compareTo(b) <= 0 ? a : b; }
  public static Rat max( Rat a, Rat b ) { return a.compareTo(b) >= 0 ? a : b; }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Rat r && _num.equals(r._num) && _den.equals(r._den);
  }
  @Override public int hashCode() { return _num.hashCode()*31+_den.hashCode(); }
  @Override public String toString() { return str(new SB()).toString(); }
  public SB str( SB sb ) {
    if( is_inf() ) return sb.p("+Infinity");
    sb.p(_num);
    return is_int() ? sb : sb.p('/').p(_den);
  }
}
