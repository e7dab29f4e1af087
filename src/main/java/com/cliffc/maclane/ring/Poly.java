package com.cliffc.maclane.ring;

import com.cliffc.maclane.util.Ary;
import com.cliffc.maclane.util.SB;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.function.Function;

/** Immutable dense univariate polynomial.
 *
 *  Coefficients are stored low degree first with no trailing zeros, so the
 *  zero polynomial has no coefficients and degree -1.  The ring does the
 *  coefficient arithmetic; the polynomial only knows its {@link PolyRing}.
 */
public final class Poly<E> {
  public final PolyRing<E> _pr;
  private final Object[] _cs;
  private int _hash;

  Poly( PolyRing<E> pr, Object[] cs ) {
    Ring<E> R = pr._base;
    int len = cs.length;
    while( len > 0 && R.is_zero(elem(cs[len-1])) ) len--;
    _pr = pr;
    _cs = len==cs.length ? cs : Arrays.copyOf(cs,len);
  }

  @SuppressWarnings("unchecked")
  private static <E> E elem( Object o ) { return (E)o; }
  private Ring<E> R() { return _pr._base; }

  public int degree() { return _cs.length-1; }
  public boolean is_zero() { return _cs.length==0; }
  public boolean is_constant() { return _cs.length<=1; }
  public boolean is_one() { return _cs.length==1 && R().is_one(at(0)); }
  // Coefficient of x^i, zero past the degree
  public E at( int i ) { return i < _cs.length ? elem(_cs[i]) : R().zero(); }
  public E lc() { return at(degree()); }
  public boolean is_monic() { return !is_zero() && R().is_one(lc()); }
  public boolean is_gen() { return _cs.length==2 && R().is_zero(at(0)) && R().is_one(at(1)); }
  public Object[] coef_array() { return _cs.clone(); }
  public Ary<E> coefs() {
    Ary<E> cs = new Ary<>();
    for( Object c : _cs ) cs.add(elem(c));
    return cs;
  }

  public Poly<E> add( Poly<E> p ) {
    Ring<E> R = R();
    Object[] cs = new Object[Math.max(_cs.length,p._cs.length)];
    for( int i=0; i<cs.length; i++ ) cs[i] = R.add(at(i),p.at(i));
    return new Poly<>(_pr,cs);
  }
  public Poly<E> neg() {
    Ring<E> R = R();
    Object[] cs = new Object[_cs.length];
    for( int i=0; i<cs.length; i++ ) cs[i] = R.neg(at(i));
    return new Poly<>(_pr,cs);
  }
  public Poly<E> sub( Poly<E> p ) {
    Ring<E> R = R();
    Object[] cs = new Object[Math.max(_cs.length,p._cs.length)];
    for( int i=0; i<cs.length; i++ ) cs[i] = R.sub(at(i),p.at(i));
    return new Poly<>(_pr,cs);
  }
  public Poly<E> mul( Poly<E> p ) {
    if( is_zero() || p.is_zero() ) return _pr.zero();
    Ring<E> R = R();
    Object[] cs = new Object[_cs.length+p._cs.length-1];
    Arrays.fill(cs,R.zero());
    for( int i=0; i<_cs.length; i++ ) {
      E a = at(i);
      if( R.is_zero(a) ) continue;
      for( int j=0; j<p._cs.length; j++ )
        cs[i+j] = R.add(elem(cs[i+j]),R.mul(a,p.at(j)));
    }
    return new Poly<>(_pr,cs);
  }
  // Multiply by a constant
  public Poly<E> scale( E c ) {
    Ring<E> R = R();
    Object[] cs = new Object[_cs.length];
    for( int i=0; i<cs.length; i++ ) cs[i] = R.mul(at(i),c);
    return new Poly<>(_pr,cs);
  }
  // f(c*x)
  public Poly<E> subs_scale( E c ) {
    Ring<E> R = R();
    Object[] cs = new Object[_cs.length];
    E ci = R.one();
    for( int i=0; i<cs.length; i++ ) { cs[i] = R.mul(at(i),ci); ci = R.mul(ci,c); }
    return new Poly<>(_pr,cs);
  }
  // Multiply by x^k
  public Poly<E> shift( int k ) {
    if( is_zero() || k==0 ) return this;
    Object[] cs = new Object[_cs.length+k];
    Arrays.fill(cs,0,k,R().zero());
    System.arraycopy(_cs,0,cs,k,_cs.length);
    return new Poly<>(_pr,cs);
  }
  public Poly<E> pow( long n ) {
    assert n >= 0;
    Poly<E> r = _pr.one(), b = this;
    while( n > 0 ) {
      if( (n&1)==1 ) r = r.mul(b);
      n >>= 1;
      if( n > 0 ) b = b.mul(b);
    }
    return r;
  }

  /** Division with remainder.  The divisor's leading coefficient must be a
   *  unit, so this works over the integers for monic divisors.
   *  @return {quotient, remainder} */
  @SuppressWarnings("unchecked")
  public Poly<E>[] divrem( Poly<E> g ) {
    if( g.is_zero() ) throw new ArithmeticException("polynomial division by zero");
    Ring<E> R = R();
    int dg = g.degree(), df = degree();
    if( df < dg ) return new Poly[]{_pr.zero(),this};
    E lcinv = R.inv(g.lc());
    Object[] r = _cs.clone();
    Object[] q = new Object[df-dg+1];
    for( int i=df; i>=dg; i-- ) {
      E c = R.mul(elem(r[i]),lcinv);
      q[i-dg] = c;
      if( R.is_zero(c) ) continue;
      for( int j=0; j<=dg; j++ )
        r[i-dg+j] = R.sub(elem(r[i-dg+j]),R.mul(c,g.at(j)));
    }
    return new Poly[]{new Poly<>(_pr,q),new Poly<>(_pr,Arrays.copyOf(r,dg))};
  }
  public Poly<E> div( Poly<E> g ) { return divrem(g)[0]; }
  public Poly<E> mod( Poly<E> g ) { return divrem(g)[1]; }
  public boolean divides( Poly<E> f ) { return f.mod(this).is_zero(); }

  public Poly<E> monic() {
    if( is_zero() || is_monic() ) return this;
    return scale(R().inv(lc()));
  }
  public Poly<E> derivative() {
    if( _cs.length <= 1 ) return _pr.zero();
    Ring<E> R = R();
    Object[] cs = new Object[_cs.length-1];
    for( int i=1; i<_cs.length; i++ ) cs[i-1] = R.mul(R.from_long(i),at(i));
    return new Poly<>(_pr,cs);
  }
  // Horner evaluation at a point of the coefficient ring
  public E eval( E x ) {
    Ring<E> R = R();
    E r = R.zero();
    for( int i=degree(); i>=0; i-- ) r = R.add(R.mul(r,x),at(i));
    return r;
  }
  // Coefficient-wise map into another polynomial ring
  public <F> Poly<F> map( PolyRing<F> pr, Function<E,F> f ) {
    Object[] cs = new Object[_cs.length];
    for( int i=0; i<cs.length; i++ ) cs[i] = f.apply(at(i));
    return new Poly<>(pr,cs);
  }

  // Monic gcd over a field
  public static <E> Poly<E> gcd( Poly<E> a, Poly<E> b ) {
    while( !b.is_zero() ) {
      Poly<E> r = a.mod(b);
      a = b; b = r;
    }
    return a.monic();
  }

  /** Extended gcd over a field.
   *  @return {g,s,t} with {@code g == s*a + t*b} and g monic */
  @SuppressWarnings("unchecked")
  public static <E> Poly<E>[] xgcd( Poly<E> a, Poly<E> b ) {
    PolyRing<E> pr = a._pr;
    Poly<E> r0=a, r1=b, s0=pr.one(), s1=pr.zero(), t0=pr.zero(), t1=pr.one();
    while( !r1.is_zero() ) {
      Poly<E>[] qr = r0.divrem(r1);
      Poly<E> tmp;
      r0 = r1; r1 = qr[1];
      tmp = s1; s1 = s0.sub(qr[0].mul(s1)); s0 = tmp;
      tmp = t1; t1 = t0.sub(qr[0].mul(t1)); t0 = tmp;
    }
    if( r0.is_zero() ) return new Poly[]{r0,s0,t0};
    E c = pr._base.inv(r0.lc());
    return new Poly[]{r0.scale(c),s0.scale(c),t0.scale(c)};
  }

  // f^n mod m
  public static <E> Poly<E> powmod( Poly<E> f, BigInteger n, Poly<E> m ) {
    Poly<E> r = f._pr.one().mod(m), b = f.mod(m);
    for( int i=0; i<n.bitLength(); i++ ) {
      if( n.testBit(i) ) r = r.mul(b).mod(m);
      if( i+1 < n.bitLength() ) b = b.mul(b).mod(m);
    }
    return r;
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Poly<?> p) ) return false;
    return Arrays.equals(_cs,p._cs) && _pr.equals(p._pr);
  }
  @Override public int hashCode() {
    if( _hash==0 ) _hash = Arrays.hashCode(_cs)*31 + _pr._var.hashCode();
    return _hash;
  }

  @Override public String toString() { return str(new SB()).toString(); }
  public SB str( SB sb ) {
    if( is_zero() ) return sb.p('0');
    SB terms = new SB();
    Ring<E> R = R();
    for( int i=degree(); i>=0; i-- ) {
      E c = at(i);
      if( R.is_zero(c) ) continue;
      String s = R.str(c);
      if( i==0 ) { terms.plus(s); continue; }
      String mon = i==1 ? _pr._var : _pr._var+"^"+i;
      if( s.equals("1") ) terms.plus(mon);
      else if( s.equals("-1") ) terms.plus("-"+mon);
      else if( s.indexOf(' ')== -1 ) terms.plus(s+"*"+mon);
      else terms.plus("("+s+")*"+mon);
    }
    return sb.p(terms.toString());
  }
}
