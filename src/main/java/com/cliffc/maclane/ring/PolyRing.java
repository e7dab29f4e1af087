package com.cliffc.maclane.ring;

import com.cliffc.maclane.util.Ary;

import java.math.BigInteger;
import java.util.Random;

/** Univariate polynomial ring {@code base[var]}. */
public final class PolyRing<E> extends Ring<Poly<E>> {
  public final Ring<E> _base;
  public final String _var;
  private final Poly<E> _zero, _one, _gen;

  public PolyRing( Ring<E> base, String var ) {
    _base = base;
    _var = var;
    _zero = new Poly<>(this,new Object[0]);
    _one  = new Poly<>(this,new Object[]{base.one()});
    _gen  = new Poly<>(this,new Object[]{base.zero(),base.one()});
  }
  public static <E> PolyRing<E> make( Ring<E> base, String var ) { return new PolyRing<>(base,var); }

  // Coefficients low degree first, each coerced into the base ring
  public Poly<E> make( Object... cs ) {
    Object[] es = new Object[cs.length];
    for( int i=0; i<cs.length; i++ ) es[i] = _base.coerce(cs[i]);
    return new Poly<>(this,es);
  }
  public Poly<E> make( Ary<E> cs ) {
    Object[] es = new Object[cs.len()];
    for( int i=0; i<es.length; i++ ) es[i] = cs.at(i);
    return new Poly<>(this,es);
  }
  public Poly<E> constant( E c ) { return new Poly<>(this,new Object[]{c}); }
  public Poly<E> monomial( E c, int d ) { return constant(c).shift(d); }
  public Poly<E> gen() { return _gen; }
  // Same variable over another coefficient ring
  public <F> PolyRing<F> change_ring( Ring<F> base ) { return new PolyRing<>(base,_var); }

  @Override public Poly<E> zero() { return _zero; }
  @Override public Poly<E> one () { return _one ; }
  @Override public Poly<E> add( Poly<E> a, Poly<E> b ) { return a.add(b); }
  @Override public Poly<E> neg( Poly<E> a ) { return a.neg(); }
  @Override public Poly<E> sub( Poly<E> a, Poly<E> b ) { return a.sub(b); }
  @Override public Poly<E> mul( Poly<E> a, Poly<E> b ) { return a.mul(b); }
  @Override public boolean is_zero( Poly<E> a ) { return a.is_zero(); }
  @Override public boolean is_one ( Poly<E> a ) { return a.is_one (); }
  @Override public boolean is_field() { return false; }
  @Override public Poly<E> inv( Poly<E> a ) {
    if( a.degree()!=0 ) throw new ArithmeticException(a+" is not a unit in "+this);
    return constant(_base.inv(a.at(0)));
  }
  @Override public Poly<E> from_big( BigInteger x ) { return constant(_base.from_big(x)); }

  // Polynomials in the same variable are mapped coefficient-wise, everything
  // else goes in as a constant.
  @Override public Poly<E> coerce( Object o ) {
    if( o instanceof Poly<?> p ) {
      if( p._pr.equals(this) ) return cast(p);
      if( p._pr._var.equals(_var) ) {
        Object[] cs = new Object[p.degree()+1];
        for( int i=0; i<cs.length; i++ ) cs[i] = _base.coerce(p.at(i));
        return new Poly<>(this,cs);
      }
    }
    return constant(_base.coerce(o));
  }
  @SuppressWarnings("unchecked")
  private Poly<E> cast( Poly<?> p ) { return (Poly<E>)p; }

  @Override public BigInteger size() { return null; }
  @Override public BigInteger characteristic() { return _base.characteristic(); }
  // Random polynomial of degree below d
  public Poly<E> random( Random r, int d ) {
    Object[] cs = new Object[d];
    for( int i=0; i<d; i++ ) cs[i] = _base.random(r);
    return new Poly<>(this,cs);
  }
  @Override public Ary<String> names() { return _base.names().add(_var); }
  @Override public Ring<E> base() { return _base; }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof PolyRing<?> pr && _var.equals(pr._var) && _base.equals(pr._base);
  }
  @Override public int hashCode() { return _base.hashCode()*31+_var.hashCode(); }
  @Override public String toString() { return "Univariate Polynomial Ring in "+_var+" over "+_base; }
}
