package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.*;
import com.cliffc.maclane.util.Ary;

/** A valuation on a univariate polynomial ring {@code K[x]} built from a
 *  discrete valuation on {@code K} by a Gauss valuation followed by a finite
 *  chain of augmentations.
 *
 *  Every such valuation has a distinguished key polynomial {@link #phi} (x for
 *  the Gauss valuation) and computes values through the phi-adic expansion
 *  {@code f == sum f_i*phi^i} with {@code deg(f_i) < deg(phi)}.  Residues are
 *  type-erased: the residue ring is a {@code Ring<Object>} and a residue is a
 *  plain Object.  For a non-final valuation the residue ring is a polynomial
 *  ring over the residue field and its elements are {@code Poly<Object>}.
 *
 *  Instances are immutable; derived quantities are computed lazily and
 *  recomputing them is harmless.
 */
public abstract class InductiveValuation<C> implements Valuation<Poly<C>> {
  final PolyRing<C> _domain;
  private InductiveValuation<Rat> _over; // Same valuation over the fraction field

  InductiveValuation( PolyRing<C> domain ) { _domain = domain; }

  @Override public PolyRing<C> domain() { return _domain; }

  // --- Chain structure
  public abstract Poly<C> phi();
  // Value of phi; 0 for a Gauss valuation
  public abstract Rat mu();
  // The valuation this one induces on the coefficients
  public abstract DiscreteValuation<C> constant_valuation();
  public abstract boolean is_gauss();
  // Final valuations admit no key polynomials and cannot be augmented
  public abstract boolean is_final();
  // [this, base, ..., gauss]
  public abstract Ary<InductiveValuation<C>> augmentation_chain();

  // --- Evaluation
  // Values of the terms f_i*phi^i of a phi-adic expansion
  public abstract Ary<Rat> valuations( Ary<Poly<C>> cs );
  public abstract Rat lower_bound( Poly<C> f );
  public abstract Rat upper_bound( Poly<C> f );

  // --- Residues
  public abstract Ring<Object> residue_ring();
  // Residue ring of a non-final valuation, as a polynomial ring
  public abstract PolyRing<Object> residue_poly_ring();
  public abstract Ring<Object> residue_field();
  public abstract Object reduce( Poly<C> f );
  public abstract Poly<C> lift( Object F );
  public abstract Poly<C> lift_to_key( Object F );

  // --- Units and elements
  public abstract Poly<C> equivalence_unit( Rat s, boolean reciprocal );
  public Poly<C> equivalence_unit( Rat s ) { return equivalence_unit(s,false); }
  public abstract Poly<C> element_with_valuation( Rat s );

  /** Returns g with {@code w(f-g) > error} and hopefully smaller coefficients.
   *  @param error defaults to {@link #upper_bound} when null
   *  @param force simplify even when the coefficients look small already
   *  @param effdeg drop phi-adic terms beyond this index; -1 for none */
  public abstract Poly<C> simplify( Poly<C> f, Rat error, boolean force, int effdeg );
  public Poly<C> simplify( Poly<C> f, Rat error ) { return simplify(f,error,false,-1); }
  public abstract int relative_size( Poly<C> f );

  // --- Invariants
  public abstract int E();
  public abstract int F();
  public abstract boolean is_minimal( Poly<C> f );

  // --- Ring changes and ordering
  public abstract InductiveValuation<C> scale( Rat c );
  public abstract <D> Ary<InductiveValuation<D>> extensions( PolyRing<D> ring );
  public abstract <D> InductiveValuation<D> restriction( PolyRing<D> ring );
  // Pointwise at least other
  public abstract boolean ge( InductiveValuation<?> other );
  // The same chain over another polynomial ring in the same variable; keys are
  // carried over unchecked
  public abstract <D> InductiveValuation<D> change_domain( PolyRing<D> ring );
  // A monic integral polynomial defining the same extension as G
  public abstract MonicIntegralModel<C> monic_integral_model( Poly<C> G );
  // No polynomial has value -infinity
  public boolean is_negative_pseudo_valuation() { return false; }

  public AugmentedValuation<C> augmentation( Poly<C> phi, Rat mu ) { return augmentation(phi,mu,true); }
  public AugmentedValuation<C> augmentation( Poly<C> phi, Rat mu, boolean check ) {
    return AugmentedValuation.make(this,phi,mu,check);
  }

  /** The phi-adic expansion, constant term first.  The zero polynomial
   *  expands to a single zero coefficient. */
  public Ary<Poly<C>> coefficients( Poly<C> f ) {
    Ary<Poly<C>> cs = new Ary<>();
    Poly<C> phi = phi();
    do {
      Poly<C>[] qr = f.divrem(phi);
      cs.add(qr[1]);
      f = qr[0];
    } while( !f.is_zero() );
    return cs;
  }
  public Ary<Rat> valuations( Poly<C> f ) { return valuations(coefficients(f)); }

  @Override public Rat eval( Poly<C> f ) {
    if( f.is_zero() ) return Rat.INF;
    return min(valuations(f));
  }

  // Last index of the expansion attaining the value
  public int effective_degree( Poly<C> f ) {
    if( f.is_zero() ) throw ValErr.undefined("the effective degree of zero",this);
    Ary<Rat> vs = valuations(f);
    Rat v = min(vs);
    int i = vs.len()-1;
    while( !vs.at(i).equals(v) ) i--;
    return i;
  }
  public boolean is_equivalence_unit( Poly<C> f ) {
    return !f.is_zero() && effective_degree(f)==0;
  }
  public boolean is_equivalent( Poly<C> f, Poly<C> g ) {
    Rat vf = eval(f), vg = eval(g);
    if( vf.is_inf() || vg.is_inf() ) return vf.is_inf() && vg.is_inf();
    return eval(f.sub(g)).gt(vf);
  }

  /** Some h with {@code reduce(f*h)==1}; f must be an equivalence unit.  The
   *  inverse of the constant phi-adic term modulo phi. */
  public Poly<C> equivalence_reciprocal( Poly<C> f ) {
    if( !_domain._base.is_field() ) throw ValErr.unsupported(_domain._base,"the equivalence reciprocal");
    if( !is_equivalence_unit(f) ) throw ValErr.undefined("an equivalence reciprocal of "+f,this);
    Poly<C> e0 = coefficients(f).at(0);
    Poly<C>[] gst = Poly.xgcd(e0,phi());
    assert gst[0].is_one();
    Poly<C> h = gst[1];
    assert is_equivalence_unit(h) && eval(h).equals(eval(f).neg());
    return h;
  }

  // f^e, simplified along the way
  Poly<C> _pow( Poly<C> f, int e, Rat error, int effdeg ) {
    if( e==0 ) return _domain.one();
    if( e==1 ) return simplify(f,error);
    if( (e&1)==0 )
      return _pow(simplify(f.mul(f),error.mul(2).div(e),false,effdeg),e/2,error,effdeg);
    return simplify(f.mul(_pow(f,e-1,error.mul(e-1).div(e),effdeg)),error,false,effdeg);
  }

  // f ~ phi^k * g with g of value v; F is the reduction of g scaled to value 0
  static final class Reduction {
    final Rat _v; final int _k; final Object _F;
    Reduction( Rat v, int k, Object F ) { _v=v; _k=k; _F=F; }
  }
  Reduction equivalence_reduction( Poly<C> f ) {
    Ary<Poly<C>> cs = coefficients(f);
    Ary<Rat> vs = valuations(cs);
    Rat v = min(vs);
    int k = 0;
    while( vs.at(k).gt(v) ) k++;
    if( k > 0 ) {
      f = horner(cs,k,phi());
      v = v.sub(eval(phi()).mul(k));
    }
    return new Reduction(v,k,reduce(f.mul(equivalence_unit(v,true))));
  }

  public boolean is_equivalence_irreducible( Poly<C> f ) {
    if( f.is_constant() ) throw ValErr.undefined("equivalence irreducibility of a constant",this);
    if( is_final() ) throw ValErr.no_keys(this);
    if( !_domain._base.is_field() ) return eq_irred(over_field(),f);
    Reduction r = equivalence_reduction(f);
    Poly<Object> F = rpoly(r._F);
    if( r._k > 0 ) return r._k==1 && F.is_constant();
    return Factor.is_irreducible(F);
  }
  private static <D> boolean eq_irred( InductiveValuation<D> v, Poly<?> f ) {
    return v.is_equivalence_irreducible(v.domain().coerce(f));
  }

  /** Why phi is not a key polynomial, or null if it is one. */
  public String is_key_reason( Poly<C> phi ) {
    if( is_final() ) throw ValErr.no_keys(this);
    if( !phi.is_monic() ) return "phi must be monic";
    if( is_equivalence_unit(phi) ) return "phi must not be an equivalence unit";
    if( !is_equivalence_irreducible(phi) ) return "phi must be equivalence irreducible";
    if( !is_minimal(phi) ) return "phi must be minimal";
    return null;
  }
  public boolean is_key( Poly<C> phi ) { return is_key_reason(phi)==null; }

  /** Factor f up to equivalence into key polynomials: reduce, factor the
   *  reduction and lift each irreducible factor to a key. */
  public EquivDecomp<C> equivalence_decomposition( Poly<C> f ) {
    if( f.is_zero() ) throw ValErr.undefined("the equivalence decomposition of zero",this);
    if( is_final() ) throw ValErr.no_keys(this);
    if( !_domain._base.is_field() ) throw ValErr.unsupported(_domain._base,"the equivalence decomposition");
    if( is_equivalence_unit(f) ) return new EquivDecomp<>(f);
    Reduction r = equivalence_reduction(f);
    Factor<Object> fac = Factor.factor(rpoly(r._F));
    Poly<C> unit = lift(fac._unit).mul(equivalence_unit(r._v.neg(),true));
    Ary<Poly<C>> keys = new Ary<>();
    Ary<Integer> exps = new Ary<>();
    for( int i=0; i<fac.len(); i++ ) {
      Poly<C> g = lift_to_key(fac.fac(i));
      int e = fac.exp(i);
      Rat vg = eval(g);
      unit = unit.mul(_pow(equivalence_unit(vg,true),e,vg.mul(e).neg(),0));
      keys.add(g);
      exps.add(e);
    }
    unit = simplify(unit,null,true,0);
    if( r._k > 0 ) {
      Poly<C> phi = phi();
      int idx = keys.find(phi::equals);
      if( idx == -1 ) { keys.add(phi); exps.add(r._k); }
      else exps.set(idx,exps.at(idx)+r._k);
    }
    EquivDecomp<C> ret = new EquivDecomp<>(unit,keys,exps);
    assert is_equivalent(ret.prod(),f);
    assert is_equivalence_unit(ret._unit);
    return ret;
  }

  public Poly<C> uniformizer() {
    ValueGroup g = value_group();
    if( g.is_trivial() ) throw ValErr.undefined("a uniformizer",this);
    return element_with_valuation(g.gen());
  }

  // This valuation over the rationals, for valuations over the integers
  InductiveValuation<Rat> over_field() {
    if( _over==null ) {
      if( !(_domain._base instanceof IntRing) )
        throw ValErr.unsupported(_domain._base,"passing to the fraction field");
      Ary<InductiveValuation<Rat>> exts = extensions(new PolyRing<>(RatField.QQ,_domain._var));
      assert exts.len()==1;
      _over = exts.at(0);
    }
    return _over;
  }

  // sum cs[i]*t^(i-from) for i >= from
  static <C> Poly<C> horner( Ary<Poly<C>> cs, int from, Poly<C> t ) {
    Poly<C> r = t._pr.zero();
    for( int i=cs.len()-1; i>=from; i-- ) r = r.mul(t).add(cs.at(i));
    return r;
  }
  static Rat min( Ary<Rat> vs ) {
    Rat m = Rat.INF;
    for( Rat v : vs ) m = Rat.min(m,v);
    return m;
  }
  @SuppressWarnings("unchecked")
  static Poly<Object> rpoly( Object o ) { return (Poly<Object>)o; }
  @SuppressWarnings("unchecked")
  static Ring<Object> erase( Ring<?> r ) { return (Ring<Object>)r; }
}
