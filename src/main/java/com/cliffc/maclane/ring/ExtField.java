package com.cliffc.maclane.ring;

import com.cliffc.maclane.util.Ary;

import java.math.BigInteger;
import java.util.Random;

/** Simple algebraic extension {@code k[u]/(m)} of a field k, with m monic
 *  irreducible of degree at least 2.  Elements are the reduced polynomials in
 *  {@code u}.
 */
public final class ExtField<E> extends Ring<Poly<E>> {
  public final Ring<E> _base;
  public final PolyRing<E> _pr; // k[u]; elements live here
  public final Poly<E> _mod;

  public ExtField( Ring<E> base, Poly<?> mod, String name ) {
    assert base.is_field();
    _base = base;
    _pr = new PolyRing<>(base,name);
    Poly<E> m = _pr.make(mod.coef_array());
    if( m.degree() < 2 ) throw new ArithmeticException("extension by "+m+" is not proper");
    _mod = m.monic();
  }

  public String name() { return _pr._var; }
  public int degree() { return _mod.degree(); }
  public Poly<E> gen() { return _pr.gen(); }
  public Poly<E> embed( E c ) { return _pr.constant(c); }
  // Image of a polynomial over k, any variable, under u
  public Poly<E> from_poly( Poly<E> p ) { return _pr.make(p.coefs()).mod(_mod); }

  @Override public Poly<E> zero() { return _pr.zero(); }
  @Override public Poly<E> one () { return _pr.one (); }
  @Override public Poly<E> add( Poly<E> a, Poly<E> b ) { return a.add(b); }
  @Override public Poly<E> neg( Poly<E> a ) { return a.neg(); }
  @Override public Poly<E> sub( Poly<E> a, Poly<E> b ) { return a.sub(b); }
  @Override public Poly<E> mul( Poly<E> a, Poly<E> b ) { return a.mul(b).mod(_mod); }
  @Override public boolean is_zero( Poly<E> a ) { return a.is_zero(); }
  @Override public boolean is_one ( Poly<E> a ) { return a.is_one (); }
  @Override public boolean is_field() { return true; }
  @Override public Poly<E> inv( Poly<E> a ) {
    if( a.is_zero() ) throw new ArithmeticException("division by zero in "+this);
    Poly<E>[] gst = Poly.xgcd(a,_mod);
    assert gst[0].is_one();     // _mod irreducible
    return gst[1].mod(_mod);
  }
  @Override public Poly<E> from_big( BigInteger x ) { return _pr.constant(_base.from_big(x)); }
  @Override public Poly<E> coerce( Object o ) {
    if( o instanceof Poly<?> p && p._pr.equals(_pr) ) return _pr.coerce(p).mod(_mod);
    return _pr.constant(_base.coerce(o));
  }

  @Override public BigInteger size() {
    BigInteger q = _base.size();
    return q==null ? null : q.pow(degree());
  }
  @Override public BigInteger characteristic() { return _base.characteristic(); }
  @Override public Poly<E> random( Random r ) { return _pr.random(r,degree()); }
  @Override public Ary<String> names() { return _base.names().add(name()); }
  @Override public Ring<E> base() { return _base; }
  @Override public String str( Poly<E> a ) { return a.toString(); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof ExtField<?> f && _pr.equals(f._pr) && _mod.equals(f._mod);
  }
  @Override public int hashCode() { return _mod.hashCode()*17+_pr.hashCode(); }
  @Override public String toString() {
    return "Extension in "+name()+" of "+_base+" by "+_mod;
  }
}
