package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.Rat;
import com.cliffc.maclane.util.Util;

import java.math.BigInteger;

/** A finitely generated additive subgroup of the rationals.  These are all
 *  cyclic, so the group is just its non-negative generator; 0 for the trivial
 *  group. */
public final class ValueGroup {
  public final Rat _gen;
  private ValueGroup( Rat gen ) { _gen = gen; }

  public static final ValueGroup TRIVIAL = new ValueGroup(Rat.ZERO);
  public static final ValueGroup ZZ = new ValueGroup(Rat.ONE);

  public static ValueGroup make( Rat... gens ) {
    Rat g = Rat.ZERO;
    for( Rat r : gens ) g = gcd(g,r);
    if( g.is_zero() ) return TRIVIAL;
    return g.equals(Rat.ONE) ? ZZ : new ValueGroup(g);
  }
  // gcd(a/b,c/d) == gcd(a,c)/lcm(b,d)
  static Rat gcd( Rat a, Rat b ) {
    if( a.is_inf() || b.is_inf() ) throw new ArithmeticException("infinity does not generate a group");
    if( a.is_zero() ) return abs(b);
    if( b.is_zero() ) return abs(a);
    return Rat.make(a._num.gcd(b._num),Util.lcm(a._den,b._den));
  }
  private static Rat abs( Rat r ) { return r.signum() < 0 ? r.neg() : r; }

  public Rat gen() { return _gen; }
  public boolean is_trivial() { return _gen.is_zero(); }

  public boolean contains( Rat s ) {
    if( s.is_inf() ) return false;
    if( is_trivial() ) return s.is_zero();
    return s.div(_gen).is_int();
  }
  public boolean contains( ValueGroup g ) { return contains(g._gen); }

  // Index [this:sub]; sub must be a non-trivial subgroup or both trivial
  public int index( ValueGroup sub ) {
    if( !contains(sub) ) throw new ArithmeticException(sub+" is not a subgroup of "+this);
    if( sub.is_trivial() ) {
      if( is_trivial() ) return 1;
      throw new ArithmeticException("the index of the trivial group in "+this+" is infinite");
    }
    BigInteger i = sub._gen.div(_gen).as_int();
    return i.intValueExact();
  }

  public ValueGroup plus( Rat r ) { return make(_gen,r); }
  public ValueGroup plus( ValueGroup g ) { return make(_gen,g._gen); }
  public ValueGroup scale( Rat c ) { return make(_gen.mul(abs(c))); }

  @Override public boolean equals( Object o ) { return o instanceof ValueGroup g && _gen.equals(g._gen); }
  @Override public int hashCode() { return _gen.hashCode(); }
  @Override public String toString() {
    return is_trivial() ? "Trivial Additive Abelian Group" : "Additive Abelian Group generated by "+_gen;
  }
}
