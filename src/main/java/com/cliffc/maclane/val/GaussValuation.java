package com.cliffc.maclane.val;

import com.cliffc.maclane.ML;
import com.cliffc.maclane.ring.*;
import com.cliffc.maclane.util.Ary;

/** The Gauss valuation {@code v(sum a_i*x^i) == min v(a_i)} induced by a
 *  discrete valuation v on the coefficients.  The bottom of every augmentation
 *  chain; its key polynomial is x with value 0. */
public final class GaussValuation<C> extends InductiveValuation<C> {
  public final DiscreteValuation<C> _v;
  private PolyRing<Object> _rr;

  private GaussValuation( PolyRing<C> domain, DiscreteValuation<C> v ) {
    super(domain);
    _v = v;
  }
  public static <C> GaussValuation<C> make( PolyRing<C> domain, DiscreteValuation<C> v ) {
    if( !domain._base.equals(v.domain()) )
      throw new IllegalArgumentException(v+" is not a valuation on "+domain._base);
    return new GaussValuation<>(domain,v);
  }

  @Override public Poly<C> phi() { return _domain.gen(); }
  @Override public Rat mu() { return Rat.ZERO; }
  @Override public DiscreteValuation<C> constant_valuation() { return _v; }
  @Override public boolean is_gauss() { return true; }
  @Override public boolean is_final() { return false; }
  @Override public boolean is_trivial() { return _v.is_trivial(); }
  @Override public Ary<InductiveValuation<C>> augmentation_chain() { return Ary.<InductiveValuation<C>>of(this); }

  // The x-adic expansion is just the coefficient list
  @Override public Ary<Poly<C>> coefficients( Poly<C> f ) {
    Ary<Poly<C>> cs = new Ary<>();
    if( f.is_zero() ) return cs.add(f);
    for( int i=0; i<=f.degree(); i++ ) cs.add(_domain.constant(f.at(i)));
    return cs;
  }
  @Override public Ary<Rat> valuations( Ary<Poly<C>> cs ) {
    Ary<Rat> vs = new Ary<>();
    for( Poly<C> c : cs ) vs.add(_v.eval(c.at(0)));
    return vs;
  }
  @Override public Rat lower_bound( Poly<C> f ) {
    Rat r = Rat.INF;
    for( int i=0; i<=f.degree(); i++ )
      if( !_domain._base.is_zero(f.at(i)) ) r = Rat.min(r,_v.lower_bound(f.at(i)));
    return r;
  }
  @Override public Rat upper_bound( Poly<C> f ) {
    Rat r = Rat.INF;
    for( int i=0; i<=f.degree(); i++ )
      if( !_domain._base.is_zero(f.at(i)) ) r = Rat.min(r,_v.upper_bound(f.at(i)));
    return r;
  }

  @Override public ValueGroup value_group() { return _v.value_group(); }
  @Override public ValueSemigroup value_semigroup() { return _v.value_semigroup(); }

  @Override public Ring<Object> residue_field() { return _v.residue_field(); }
  @Override public PolyRing<Object> residue_poly_ring() {
    if( _rr==null ) _rr = new PolyRing<>(residue_field(),_domain._var);
    return _rr;
  }
  @Override public Ring<Object> residue_ring() { return erase(residue_poly_ring()); }

  @Override public Object reduce( Poly<C> f ) { return f.map(residue_poly_ring(),_v::reduce); }
  @Override public Poly<C> lift( Object F ) {
    return residue_poly_ring().coerce(F).map(_domain,_v::lift);
  }
  @Override public Poly<C> lift_to_key( Object F0 ) {
    Poly<Object> F = residue_poly_ring().coerce(F0);
    if( F.is_constant() ) throw ValErr.invalid_residue(F,"non-constant");
    if( !F.is_monic() ) throw ValErr.invalid_residue(F,"monic");
    if( !Factor.is_irreducible(F) ) throw ValErr.invalid_residue(F,"irreducible");
    return lift(F);
  }

  @Override public Poly<C> equivalence_unit( Rat s, boolean reciprocal ) {
    if( !reciprocal ) return _domain.constant(_v.element_with_valuation(s));
    C a = _v.element_with_valuation(s.neg());
    C b = _v.element_with_valuation(s);
    Ring<Object> k = residue_field();
    C c = _v.lift(k.inv(_v.reduce(_domain._base.mul(a,b))));
    return _domain.constant(_domain._base.mul(a,c));
  }
  @Override public Poly<C> element_with_valuation( Rat s ) {
    return _domain.constant(_v.element_with_valuation(s));
  }

  @Override public Poly<C> simplify( Poly<C> f, Rat error, boolean force, int effdeg ) {
    if( effdeg >= 0 && effdeg < f.degree() ) {
      Ary<C> cs = new Ary<>();
      for( int i=0; i<=effdeg; i++ ) cs.add(f.at(i));
      f = _domain.make(cs);
    }
    if( !force && relative_size(f) < ML.SIZE_HEURISTIC_BOUND ) return f;
    Rat err = error==null ? upper_bound(f) : error;
    return f.map(_domain,c -> _v.simplify(c,err,force));
  }
  @Override public int relative_size( Poly<C> f ) {
    int r = 1;
    for( int i=0; i<=f.degree(); i++ ) r = Math.max(r,_v.relative_size(f.at(i)));
    return r;
  }

  @Override public int E() { return 1; }
  @Override public int F() { return 1; }
  // Monic f is minimal iff its leading term attains the value
  @Override public boolean is_minimal( Poly<C> f ) {
    if( f.is_constant() ) throw ValErr.undefined("minimality of a constant",this);
    return _v.eval(f.lc()).equals(eval(f));
  }

  @Override public GaussValuation<C> scale( Rat c ) {
    if( c.equals(Rat.ONE) ) return this;
    return new GaussValuation<>(_domain,_v.scale(c));
  }
  @Override public <D> Ary<InductiveValuation<D>> extensions( PolyRing<D> ring ) {
    Ary<InductiveValuation<D>> ret = new Ary<>();
    for( DiscreteValuation<D> v : _v.extensions(ring._base) )
      ret.add(make(ring,v));
    return ret;
  }
  @Override public <D> InductiveValuation<D> restriction( PolyRing<D> ring ) {
    return make(ring,_v.restriction(ring._base));
  }
  @Override public <D> GaussValuation<D> change_domain( PolyRing<D> ring ) {
    if( !ring._var.equals(_domain._var) )
      throw new IllegalArgumentException("cannot move "+this+" to "+ring);
    if( !ring._base.is_field() || _domain._base.is_field() )
      return make(ring,_v.restriction(ring._base));
    Ary<DiscreteValuation<D>> vs = _v.extensions(ring._base);
    if( vs.len()!=1 ) throw ML.TODO("no unique extension of "+_v+" to "+ring._base);
    return make(ring,vs.at(0));
  }

  /** Divide G by its leading coefficient, then replace G by
   *  {@code pi^d*G(x/pi)} until every coefficient is integral. */
  @Override public MonicIntegralModel<C> monic_integral_model( Poly<C> G ) {
    if( G.is_constant() ) throw ValErr.undefined("a monic integral model of a constant",this);
    Ring<C> K = _domain._base;
    if( !G.is_monic() ) {
      if( !K.is_field() ) throw ValErr.unsupported(K,"a monic integral model");
      G = G.monic();
    }
    C u = K.one(), pi = null;
    while( !is_integral(G) ) {
      if( pi==null ) pi = _v.uniformizer();
      u = K.mul(u,pi);
      G = G.subs_scale(K.inv(pi)).scale(K.pow(pi,G.degree()));
    }
    assert G.is_monic();
    return new MonicIntegralModel<>(G,u);
  }
  private boolean is_integral( Poly<C> G ) {
    for( int i=0; i<=G.degree(); i++ )
      if( _v.eval(G.at(i)).signum() < 0 ) return false;
    return true;
  }

  @Override public boolean ge( InductiveValuation<?> o ) {
    return o instanceof GaussValuation<?> g && _v.ge(g._v);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof GaussValuation<?> g && _domain.equals(g._domain) && _v.equals(g._v);
  }
  @Override public int hashCode() { return _v.hashCode()*31+_domain.hashCode(); }
  @Override public String toString() { return "Gauss valuation induced by "+_v; }
}
