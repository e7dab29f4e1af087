package com.cliffc.maclane.val;

import com.cliffc.maclane.ML;
import com.cliffc.maclane.ring.*;
import com.cliffc.maclane.util.Ary;
import com.cliffc.maclane.util.SB;
import com.cliffc.maclane.util.Util;

import java.math.BigInteger;

/** The p-adic valuation on the rationals or the integers, optionally scaled so
 *  that {@code v(p) == scale}. */
public final class PAdicValuation extends DiscreteValuation<Rat> {
  public final BigInteger _p;
  public final Rat _scale;
  private final PrimeField _k;

  private PAdicValuation( Ring<Rat> domain, BigInteger p, Rat scale ) {
    super(domain);
    _p = p;
    _scale = scale;
    _k = PrimeField.make(p);
  }
  public static PAdicValuation make( Ring<Rat> domain, long p ) { return make(domain,BigInteger.valueOf(p),Rat.ONE); }
  public static PAdicValuation make( Ring<Rat> domain, BigInteger p, Rat scale ) {
    if( domain!=RatField.QQ && domain!=IntRing.ZZ ) throw ML.TODO("p-adic valuation on "+domain);
    if( scale.signum() <= 0 || scale.is_inf() ) throw new ArithmeticException("scale must be positive, not "+scale);
    return new PAdicValuation(domain,p,scale);
  }
  public static PAdicValuation QQ( long p ) { return make(RatField.QQ,p); }
  public static PAdicValuation ZZ( long p ) { return make(IntRing.ZZ,p); }

  // Unscaled valuation of a non-zero rational
  private int ord( Rat x ) { return Util.val(x._num,_p) - Util.val(x._den,_p); }

  @Override public Rat eval( Rat x ) {
    if( x.is_zero() ) return Rat.INF;
    return _scale.mul(ord(x));
  }
  @Override public ValueGroup value_group() { return ValueGroup.make(_scale); }
  @Override public ValueSemigroup value_semigroup() {
    return _domain==RatField.QQ ? ValueSemigroup.make(value_group()) : ValueSemigroup.make(_scale);
  }
  @Override public boolean is_trivial() { return false; }

  @Override public Ring<Object> residue_field() { return erase(_k); }
  @Override public Object reduce( Rat x ) {
    if( check_reduce(x).signum() > 0 ) return BigInteger.ZERO;
    return _k.coerce(x);
  }
  @Override public Rat lift( Object F ) { return Rat.make(_k.coerce(F)); }

  @Override public Rat element_with_valuation( Rat s ) {
    Rat e = s.div(_scale);
    if( !e.is_int() || (_domain==IntRing.ZZ && e.signum() < 0) )
      throw ValErr.not_in_group(s,value_semigroup());
    return ppow(e.as_int().intValueExact());
  }
  private Rat ppow( int e ) {
    return e >= 0 ? Rat.make(_p.pow(e)) : Rat.make(BigInteger.ONE,_p.pow(-e));
  }

  // Bits of numerator and denominator, relative to the bits of p
  @Override public int relative_size( Rat x ) {
    return (Util.nbits(x._num)+Util.nbits(x._den))/Util.nbits(_p);
  }
  private static int bits( Rat x ) { return Util.nbits(x._num)+Util.nbits(x._den); }

  /** Returns the smallest of x, its balanced residue and (over the rationals)
   *  its rational reconstruction modulo the power of p that still agrees with x
   *  beyond {@code error}. */
  @Override public Rat simplify( Rat x, Rat error, boolean force ) {
    if( !force && relative_size(x) <= ML.SIZE_HEURISTIC_BOUND ) return x;
    Rat v = eval(x);
    if( error==null ) error = v;
    if( error.is_inf() ) return x;
    if( error.lt(v) ) return Rat.ZERO;
    int e = ord(x);
    int prec = error.div(_scale).floor().add(BigInteger.ONE).intValueExact() - e;
    assert prec >= 1;
    BigInteger m = _p.pow(prec);
    Rat pe = ppow(e);
    Rat u = x.div(pe);
    BigInteger r = u._num.multiply(u._den.modInverse(m)).mod(m);
    Rat best = x;
    BigInteger bal = r.compareTo(m.shiftRight(1)) > 0 ? r.subtract(m) : r;
    Rat cand = Rat.make(bal).mul(pe);
    if( bits(cand) < bits(best) ) best = cand;
    if( _domain==RatField.QQ ) {
      Rat rr = rational_reconstruction(r,m);
      if( rr != null ) {
        cand = rr.mul(pe);
        if( bits(cand) < bits(best) && eval(x.sub(cand)).gt(error) ) best = cand;
      }
    }
    assert eval(x.sub(best)).gt(error);
    return best;
  }

  // a/b == r mod m with |a|,|b| <= sqrt(m/2), or null
  static Rat rational_reconstruction( BigInteger r, BigInteger m ) {
    BigInteger bound = m.shiftRight(1).sqrt();
    BigInteger r0 = m, r1 = r.mod(m), t0 = BigInteger.ZERO, t1 = BigInteger.ONE;
    while( r1.compareTo(bound) > 0 ) {
      BigInteger q = r0.divide(r1), tmp;
      tmp = r1; r1 = r0.subtract(q.multiply(r1)); r0 = tmp;
      tmp = t1; t1 = t0.subtract(q.multiply(t1)); t0 = tmp;
    }
    if( t1.signum()==0 || t1.abs().compareTo(bound) > 0 ) return null;
    if( !r1.gcd(t1).equals(BigInteger.ONE) ) return null;
    return Rat.make(r1,t1);
  }

  @Override public PAdicValuation scale( Rat c ) {
    if( c.equals(Rat.ONE) ) return this;
    return make(_domain,_p,_scale.mul(c));
  }

  @SuppressWarnings("unchecked")
  @Override public <D> Ary<DiscreteValuation<D>> extensions( Ring<D> ring ) {
    if( ring.equals(_domain) ) return Ary.of((DiscreteValuation<D>)(DiscreteValuation<?>)this);
    if( _domain==IntRing.ZZ && ring==RatField.QQ )
      return Ary.of((DiscreteValuation<D>)(DiscreteValuation<?>)make(RatField.QQ,_p,_scale));
    throw ML.TODO("extending "+this+" to "+ring);
  }
  @SuppressWarnings("unchecked")
  @Override public <D> DiscreteValuation<D> restriction( Ring<D> ring ) {
    if( ring.equals(_domain) ) return (DiscreteValuation<D>)(DiscreteValuation<?>)this;
    if( _domain==RatField.QQ && ring==IntRing.ZZ )
      return (DiscreteValuation<D>)(DiscreteValuation<?>)make(IntRing.ZZ,_p,_scale);
    throw ML.TODO("restricting "+this+" to "+ring);
  }
  @Override public boolean ge( DiscreteValuation<?> o ) {
    if( o.is_trivial() ) return !_domain.is_field();
    return o instanceof PAdicValuation pv && _p.equals(pv._p) && _scale.ge(pv._scale);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof PAdicValuation pv && _domain==pv._domain && _p.equals(pv._p) && _scale.equals(pv._scale);
  }
  @Override public int hashCode() { return _p.hashCode()*31+_scale.hashCode(); }
  @Override public String toString() {
    SB sb = new SB();
    if( !_scale.equals(Rat.ONE) ) sb.pobj(_scale).p(" * ");
    return sb.p(_p).p("-adic valuation").toString();
  }
}
