package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.Rat;
import com.cliffc.maclane.util.Ary;
import com.cliffc.maclane.util.SB;
import com.cliffc.maclane.util.Util;

import java.math.BigInteger;

/** An additive subsemigroup of the rationals (with 0), generated by finitely
 *  many non-zero rationals.  With generators of both signs it is a group.
 *  Otherwise membership is a non-negative integer combination test. */
public final class ValueSemigroup {
  final Ary<Rat> _gens;         // Distinct, non-zero, sorted ascending
  private ValueSemigroup( Ary<Rat> gens ) { _gens = gens; }

  public static final ValueSemigroup TRIVIAL = new ValueSemigroup(new Ary<>());

  public static ValueSemigroup make( Rat... gens ) {
    Ary<Rat> gs = new Ary<>();
    for( Rat g : gens ) {
      if( g.is_inf() ) throw new ArithmeticException("infinity does not generate a semigroup");
      if( !g.is_zero() && gs.find(g::equals) == -1 ) gs.add(g);
    }
    gs.sort_update(Rat::compareTo);
    return new ValueSemigroup(gs);
  }
  public static ValueSemigroup make( ValueGroup g ) {
    return g.is_trivial() ? TRIVIAL : make(g._gen,g._gen.neg());
  }

  public boolean is_trivial() { return _gens.isEmpty(); }
  public boolean is_group() { return is_trivial() || (_gens.at(0).signum() < 0 && _gens.last().signum() > 0); }

  public boolean contains( Rat s ) {
    if( s.is_inf() ) return false;
    if( s.is_zero() ) return true;
    if( is_trivial() ) return false;
    if( is_group() ) return ValueGroup.make(_gens.asAry(new Rat[0])).contains(s);
    // All generators share a sign
    boolean neg = _gens.at(0).signum() < 0;
    if( neg ) s = s.neg();
    if( s.signum() < 0 ) return false;
    BigInteger D = s._den;
    for( Rat g : _gens ) D = Util.lcm(D,g._den);
    BigInteger t = s._num.multiply(D.divide(s._den));
    BigInteger[] as = new BigInteger[_gens.len()];
    BigInteger gcd = BigInteger.ZERO;
    for( int i=0; i<as.length; i++ ) {
      Rat g = neg ? _gens.at(i).neg() : _gens.at(i);
      as[i] = g._num.multiply(D.divide(g._den));
      gcd = gcd.gcd(as[i]);
    }
    if( t.mod(gcd).signum()!=0 ) return false;
    t = t.divide(gcd);
    BigInteger min = null, max = null;
    for( int i=0; i<as.length; i++ ) {
      as[i] = as[i].divide(gcd);
      if( min==null || as[i].compareTo(min) < 0 ) min = as[i];
      if( max==null || as[i].compareTo(max) > 0 ) max = as[i];
    }
    // Every integer past the Frobenius number is representable
    if( t.compareTo(min.multiply(max)) >= 0 ) return true;
    int T = t.intValueExact();
    boolean[] reach = new boolean[T+1];
    reach[0] = true;
    for( int x=1; x<=T; x++ )
      for( BigInteger a : as )
        if( a.intValueExact() <= x && reach[x-a.intValueExact()] ) { reach[x] = true; break; }
    return reach[T];
  }

  public ValueSemigroup plus( Rat r ) {
    Ary<Rat> gs = new Ary<Rat>().addAll(_gens).add(r);
    return make(gs.asAry(new Rat[0]));
  }
  public ValueSemigroup plus( ValueSemigroup s ) {
    Ary<Rat> gs = new Ary<Rat>().addAll(_gens).addAll(s._gens);
    return make(gs.asAry(new Rat[0]));
  }
  public ValueSemigroup scale( Rat c ) {
    Ary<Rat> gs = new Ary<>();
    for( Rat g : _gens ) gs.add(g.mul(c));
    return make(gs.asAry(new Rat[0]));
  }

  @Override public boolean equals( Object o ) { return o instanceof ValueSemigroup s && _gens.equals(s._gens); }
  @Override public int hashCode() { return _gens.hashCode(); }
  @Override public String toString() {
    if( is_trivial() ) return "Trivial Additive Abelian Semigroup";
    SB sb = new SB("Additive Abelian Semigroup generated by ");
    for( Rat g : _gens ) sb.pobj(g).p(", ");
    return sb.unchar(2).toString();
  }
}
