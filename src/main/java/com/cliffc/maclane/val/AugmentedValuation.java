package com.cliffc.maclane.val;

import com.cliffc.maclane.ML;
import com.cliffc.maclane.ring.*;
import com.cliffc.maclane.util.Ary;
import com.cliffc.maclane.util.SB;

import java.util.concurrent.ConcurrentHashMap;

/** MacLane's augmented valuation {@code [base, v(phi) = mu]}.
 *
 *  The value of {@code f == sum f_i*phi^i} (the phi-adic expansion) is
 *  {@code min base(f_i) + i*mu}.  phi must be a key polynomial for the base
 *  and mu must exceed {@code base(phi)}.  Augmenting with a key polynomial of
 *  the same degree as the base's own key polynomial replaces the base's last
 *  step, so the key degrees strictly increase along a chain.
 *
 *  Three shapes, by {@link Kind}: a finite mu over a non-trivial base can be
 *  augmented again and has a polynomial residue ring; a finite mu over a
 *  trivial base, or an infinite mu, is final and its residue ring is a field.
 *
 *  Let tau be the index of the base value group in this one.  Reduction
 *  scales the phi-adic terms at multiples of tau by powers of {@link #Q}, an
 *  equivalence unit of value {@code tau*mu}, reduces them in the base and
 *  evaluates at a root of {@link #psi}.  Lifting runs this backwards.
 */
public final class AugmentedValuation<C> extends InductiveValuation<C> {
  public enum Kind { NON_FINAL_FINITE, FINAL_FINITE, INFINITE }

  public final InductiveValuation<C> _base;
  public final Poly<C> _phi;
  public final Rat _mu;
  public final Kind _kind;

  // Lazily computed
  private Poly<Object> _psi;
  private Ring<Object> _k;
  private PolyRing<Object> _rr;
  private ValueGroup _group;
  private int _tau;
  private final ConcurrentHashMap<Integer,Poly<C>> _Qs = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Integer,Poly<C>> _Qrs = new ConcurrentHashMap<>();

  private AugmentedValuation( InductiveValuation<C> base, Poly<C> phi, Rat mu, Kind kind ) {
    super(base._domain);
    _base = base;
    _phi = phi;
    _mu = mu;
    _kind = kind;
  }

  /** Augment base by {@code v(phi) = mu}.
   *  @param check verify that phi is a key polynomial and that mu increases */
  public static <C> AugmentedValuation<C> make( Valuation<Poly<C>> base0, Poly<C> phi, Rat mu, boolean check ) {
    if( !(base0 instanceof InductiveValuation) ) throw ValErr.not_inductive(base0);
    InductiveValuation<C> base = (InductiveValuation<C>)base0;
    if( base.is_final() ) throw ValErr.no_keys(base);
    phi = base._domain.coerce(phi);
    if( check ) {
      String reason = base.is_key_reason(phi);
      if( reason != null ) throw ValErr.invalid_key(phi,base,reason);
      Rat vphi = base.eval(phi);
      if( !mu.gt(vphi) ) throw ValErr.non_increasing(mu,vphi);
    }
    if( base instanceof AugmentedValuation<C> aug && aug._phi.degree()==phi.degree() )
      return make(ML.p(aug._base,"dropping "+aug+" under the new key "+phi),phi,mu,check);
    Kind kind = mu.is_inf() ? Kind.INFINITE : (base.is_trivial() ? Kind.FINAL_FINITE : Kind.NON_FINAL_FINITE);
    return ML.p(new AugmentedValuation<>(base,phi,mu,kind),"augmented "+base+" by v("+phi+") = "+mu);
  }

  @Override public Poly<C> phi() { return _phi; }
  @Override public Rat mu() { return _mu; }
  @Override public DiscreteValuation<C> constant_valuation() { return _base.constant_valuation(); }
  @Override public boolean is_gauss() { return false; }
  @Override public boolean is_final() { return _kind!=Kind.NON_FINAL_FINITE; }
  @Override public boolean is_trivial() { return false; }
  @Override public Ary<InductiveValuation<C>> augmentation_chain() {
    return new Ary<InductiveValuation<C>>().add(this).addAll(_base.augmentation_chain());
  }

  // ------------------------------------------------------------------
  @Override public Ary<Rat> valuations( Ary<Poly<C>> cs ) {
    Ary<Rat> vs = new Ary<>();
    for( int i=0; i<cs.len(); i++ ) {
      if( _kind==Kind.INFINITE && i > 0 ) { vs.add(Rat.INF); continue; }
      Rat v = _base.eval(cs.at(i));
      vs.add(v.is_inf() || i==0 ? v : v.add(_mu.mul(i)));
    }
    return vs;
  }

  @Override public Rat lower_bound( Poly<C> f ) {
    if( _kind==Kind.INFINITE ) return _base.lower_bound(coefficients(f).at(0));
    if( !_phi.is_gen() ) return _base.lower_bound(f);
    // x-adic and phi-adic expansions agree
    DiscreteValuation<C> cv = constant_valuation();
    Rat r = Rat.INF;
    for( int i=0; i<=f.degree(); i++ )
      if( !_domain._base.is_zero(f.at(i)) )
        r = Rat.min(r,cv.lower_bound(f.at(i)).add(_mu.mul(i)));
    return r;
  }
  @Override public Rat upper_bound( Poly<C> f ) {
    if( f.is_zero() ) return Rat.INF;
    if( _kind==Kind.INFINITE ) return _base.upper_bound(coefficients(f).at(0));
    int n = Rat.make(f.degree(),_phi.degree()).ceil().intValueExact();
    return constant_valuation().upper_bound(f.lc()).add(_mu.mul(n));
  }

  @Override public ValueGroup value_group() {
    if( _group==null )
      _group = _kind==Kind.INFINITE ? _base.value_group() : _base.value_group().plus(_mu);
    return _group;
  }
  @Override public ValueSemigroup value_semigroup() {
    return _kind==Kind.INFINITE ? _base.value_semigroup() : _base.value_semigroup().plus(_mu);
  }
  // Index of the base value group in this one
  public int tau() {
    if( _tau==0 ) _tau = value_group().index(_base.value_group());
    return _tau;
  }

  @Override public int E() {
    if( augmentation_chain().last().is_trivial() )
      throw ValErr.undefined("the ramification index",this);
    return tau()*_base.E();
  }
  @Override public int F() { return _phi.degree()/_base.E(); }

  // ------------------------------------------------------------------
  /** The minimal polynomial over the base residue field of the residue field
   *  extension: the monic reduction of phi scaled to value 0. */
  public Poly<Object> psi() {
    if( _psi==null ) {
      Poly<Object> psi;
      if( !_domain._base.is_field() ) psi = ((AugmentedValuation<?>)over_field()).psi();
      else {
        Poly<C> R = _base.equivalence_unit(_base.eval(_phi).neg());
        psi = rpoly(_base.reduce(_phi.mul(R))).monic();
        assert (!psi._pr._base.is_finite() && psi.degree() > 3) || Factor.is_irreducible(psi);
      }
      _psi = psi;
    }
    return _psi;
  }

  @Override public Ring<Object> residue_field() {
    if( _k==null ) {
      Ring<Object> k0 = _base.residue_field();
      Poly<Object> psi = psi();
      _k = psi.degree() > 1 ? erase(new ExtField<>(k0,psi,gen_name())) : k0;
    }
    return _k;
  }
  // "u" plus the chain depth, avoiding names already in the residue tower
  private String gen_name() {
    Ary<String> taken = _base.residue_field().names().add(_domain._var);
    String name = "u"+(augmentation_chain().len()-1);
    while( taken.find(name::equals) != -1 ) name = "u"+name;
    return name;
  }
  @Override public PolyRing<Object> residue_poly_ring() {
    if( is_final() ) throw ValErr.undefined("a residue polynomial ring",this);
    if( !_domain._base.is_field() ) throw ValErr.unsupported(_domain._base,"the residue ring");
    if( _rr==null ) _rr = new PolyRing<>(residue_field(),_domain._var);
    return _rr;
  }
  @Override public Ring<Object> residue_ring() {
    return is_final() ? residue_field() : erase(residue_poly_ring());
  }

  // A root of psi in the residue field
  private Object zeta() {
    Poly<Object> psi = psi();
    return psi.degree()==1 ? residue_field().neg(psi.at(0)) : ext().gen();
  }
  @SuppressWarnings("unchecked")
  private ExtField<Object> ext() { return (ExtField<Object>)(Ring<?>)residue_field(); }
  // A base residue, evaluated at zeta
  private Object eval_at_gen( Poly<Object> G ) {
    return psi().degree()==1 ? G.eval(zeta()) : ext().from_poly(G);
  }
  // A residue field element written as a polynomial in zeta over the base residue field
  private Poly<Object> as_base_residue( Object c ) {
    PolyRing<Object> RR0 = _base.residue_poly_ring();
    return psi().degree()==1 ? RR0.constant(c) : RR0.make(rpoly(c).coefs());
  }

  @Override public Object reduce( Poly<C> f ) {
    if( is_final() ) {
      Rat v = eval(f);
      if( v.signum() < 0 ) throw ValErr.negative(f,v);
      if( v.signum() > 0 ) return residue_field().zero();
      return eval_at_gen(rpoly(_base.reduce(coefficients(f).at(0))));
    }
    PolyRing<Object> RR = residue_poly_ring();
    if( lower_bound(f).signum() > 0 ) return RR.zero();
    Ary<Poly<C>> cs = coefficients(f);
    Ary<Rat> vs = valuations(cs);
    Rat v = min(vs);
    if( v.signum() < 0 ) throw ValErr.negative(f,v);
    int tau = tau();
    Ary<Object> rs = new Ary<>();
    for( int i=0; i<cs.len(); i++ ) {
      Rat vi = vs.at(i);
      if( i%tau != 0 ) { assert !vi.is_zero(); continue; }
      rs.add(vi.is_zero()
             ? eval_at_gen(rpoly(_base.reduce(cs.at(i).mul(Q(i/tau)))))
             : RR._base.zero());
    }
    return RR.make(rs);
  }

  @Override public Poly<C> lift( Object F0 ) {
    if( is_final() ) {
      Object F = residue_field().coerce(F0);
      Ring<Object> k = residue_field();
      if( k.is_zero(F) ) return _domain.zero();
      if( k.is_one (F) ) return _domain.one ();
      return _base.lift(as_base_residue(F));
    }
    Poly<Object> F = residue_poly_ring().coerce(F0);
    if( F.is_zero() ) return _domain.zero();
    if( F.is_one () ) return _domain.one ();
    return horner(lift_coefficients(F),0,_phi.pow(tau()));
  }
  // Lifts of the coefficients of F, scaled back by the powers of Q
  private Ary<Poly<C>> lift_coefficients( Poly<Object> F ) {
    Ary<Poly<C>> cs = new Ary<>();
    for( int i=0; i<=F.degree(); i++ ) {
      Poly<C> c = _base.lift(as_base_residue(F.at(i)));
      cs.add(i==0 ? c : c.mul(Q_reciprocal(i)));
    }
    return cs;
  }

  /** A key polynomial f for this valuation whose reduction, scaled to value 0,
   *  is F.  F must be monic, irreducible and non-constant. */
  @Override public Poly<C> lift_to_key( Object F0 ) {
    if( is_final() ) throw ValErr.no_keys(this);
    Poly<Object> F = residue_poly_ring().coerce(F0);
    if( F.is_constant() ) throw ValErr.invalid_residue(F,"non-constant");
    if( !F.is_monic() ) throw ValErr.invalid_residue(F,"monic");
    if( !Factor.is_irreducible(F) ) throw ValErr.invalid_residue(F,"irreducible");
    if( F.is_gen() ) return _phi;
    int d = F.degree(), tau = tau();
    Ary<Poly<C>> cs = lift_coefficients(F);
    cs.pop();
    Poly<C> Qd = Q(d);
    cs.map_update(c -> c.mul(Qd));
    cs.add(_domain.one());
    // The next-to-leading term may spill into the leading one
    cs.set(cs.len()-2,cs.at(cs.len()-2).mod(_phi));
    Poly<C> f = horner(cs,0,_phi.pow(tau));
    f = simplify(f,_mu.mul(tau).mul(d),true,-1);
    assert is_key(f);
    return f;
  }

  // An equivalence unit of value tau*mu, to the power e
  Poly<C> Q( int e ) {
    Poly<C> q = _Qs.get(e);
    if( q==null ) {
      Rat v = _mu.mul(tau());
      q = _pow(equivalence_unit(v),e,v.mul(e),0);
      Poly<C> old = _Qs.putIfAbsent(e,q);
      if( old != null ) q = old;
    }
    return q;
  }
  // The equivalence reciprocal of Q(1), to the power e
  Poly<C> Q_reciprocal( int e ) {
    Poly<C> q = _Qrs.get(e);
    if( q==null ) {
      if( e==1 ) q = equivalence_reciprocal(Q(1));
      else {
        q = _pow(Q_reciprocal(1),e,_mu.mul(tau()).mul(e).neg(),0);
        assert is_equivalence_unit(q);
        assert residue_field().is_one(eval_at_gen(rpoly(_base.reduce(Q(e).mul(q)))));
      }
      Poly<C> old = _Qrs.putIfAbsent(e,q);
      if( old != null ) q = old;
    }
    return q;
  }

  // ------------------------------------------------------------------
  @Override public Poly<C> equivalence_unit( Rat s, boolean reciprocal ) {
    Rat t = reciprocal ? s.neg() : s;
    Poly<C> ret = _base.element_with_valuation(t);
    if( reciprocal ) {
      Object r = reduce(ret.mul(_base.element_with_valuation(s)));
      Ring<Object> k = residue_field();
      if( is_final() ) ret = ret.mul(lift(k.inv(r)));
      else {
        assert rpoly(r).is_constant();
        ret = ret.mul(lift(residue_poly_ring().constant(k.inv(rpoly(r).at(0)))));
      }
    }
    assert is_equivalence_unit(ret) && eval(ret).equals(t);
    return ret;
  }

  @Override public Poly<C> element_with_valuation( Rat s ) {
    ValueGroup g = value_group();
    if( !g.contains(s) ) throw ValErr.not_in_group(s,g);
    ValueGroup bg = _base.value_group();
    Rat t = s;
    int i = 0;
    if( bg.is_trivial() && !_mu.is_inf() ) {
      Rat q = s.div(_mu);
      if( !q.is_int() || q.signum() < 0 ) throw ValErr.not_in_group(s,value_semigroup());
      i = q.as_int().intValueExact();
      t = Rat.ZERO;
    } else {
      while( !bg.contains(t) ) { t = t.sub(_mu); i++; }
    }
    Poly<C> ret = _phi.pow(i).mul(_base.element_with_valuation(t));
    return simplify(ret,s,false,-1);
  }

  @Override public Poly<C> simplify( Poly<C> f, Rat error, boolean force, int effdeg ) {
    if( _kind==Kind.INFINITE ) {
      if( error==null ) error = upper_bound(f);
      if( error.is_inf() ) return f;
      return _base.simplify(coefficients(f).at(0),error,force,-1);
    }
    if( effdeg >= 0 && Rat.make(f.degree(),_phi.degree()).ceil().intValueExact() > effdeg ) {
      Ary<Poly<C>> cs = coefficients(f);
      while( cs.len() > effdeg+1 ) cs.pop();
      f = horner(cs,0,_phi);
    }
    if( !force && relative_size(f) < ML.SIZE_HEURISTIC_BOUND ) return f;
    if( error==null ) error = upper_bound(f);
    return _base.simplify(f,error,force,-1);
  }
  @Override public int relative_size( Poly<C> f ) { return _base.relative_size(f); }

  // MacLane's criterion for a monic equivalence-irreducible f
  @Override public boolean is_minimal( Poly<C> f ) {
    if( f.is_constant() ) throw ValErr.undefined("minimality of a constant",this);
    if( is_final() ) throw ValErr.no_keys(this);
    if( is_equivalent(_phi,f) ) return _phi.degree()==f.degree();
    Ary<Poly<C>> cs = coefficients(f);
    Ary<Rat> vs = valuations(cs);
    Rat v = min(vs);
    return vs.last().equals(v) && cs.last().is_constant() && vs.at(0).equals(v) && (cs.len()-1)%tau()==0;
  }

  // ------------------------------------------------------------------
  @Override public AugmentedValuation<C> scale( Rat c ) {
    if( c.signum() <= 0 || c.is_inf() ) throw new ArithmeticException("scale must be positive, not "+c);
    if( c.equals(Rat.ONE) ) return this;
    return _base.scale(c).augmentation(_phi,_mu.mul(c));
  }

  /** Extend to a polynomial ring over a larger coefficient ring.  phi stays a
   *  key polynomial or splits up to equivalence; each factor gets the value
   *  that keeps {@code v(phi) == mu}. */
  @SuppressWarnings("unchecked")
  @Override public <D> Ary<InductiveValuation<D>> extensions( PolyRing<D> ring ) {
    if( ring.equals(_domain) ) return Ary.of((InductiveValuation<D>)(InductiveValuation<?>)this);
    Poly<D> phi = ring.coerce(_phi);
    Ary<InductiveValuation<D>> ret = new Ary<>();
    for( InductiveValuation<D> v : _base.extensions(ring) ) {
      if( v.is_key(phi) ) { ret.add(make(v,phi,_mu,true)); continue; }
      EquivDecomp<D> F = v.equivalence_decomposition(phi);
      for( int i=0; i<F.len(); i++ ) {
        Rat mu = _mu.sub(v.eval(F._unit));
        for( int j=0; j<F.len(); j++ )
          if( j!=i ) mu = mu.sub(v.eval(F.key(j)).mul(F.exp(j)));
        ret.add(make(v,F.key(i),mu.div(F.exp(i)),true));
      }
    }
    return ret;
  }
  @Override public <D> InductiveValuation<D> restriction( PolyRing<D> ring ) {
    return _base.restriction(ring).augmentation(ring.coerce(_phi),_mu);
  }
  @Override public <D> AugmentedValuation<D> change_domain( PolyRing<D> ring ) {
    return _base.change_domain(ring).augmentation(ring.coerce(_phi),_mu,false);
  }
  @Override public MonicIntegralModel<C> monic_integral_model( Poly<C> G ) { return _base.monic_integral_model(G); }
  @Override public boolean ge( InductiveValuation<?> o ) {
    if( o instanceof GaussValuation<?> ) return _base.ge(o);
    AugmentedValuation<?> a = (AugmentedValuation<?>)o;
    return eval(_domain.coerce(a._phi)).ge(a._mu) && ge(a._base);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof AugmentedValuation<?> a && _mu.equals(a._mu) && _phi.equals(a._phi) && _base.equals(a._base);
  }
  @Override public int hashCode() { return (_base.hashCode()*31+_phi.hashCode())*31+_mu.hashCode(); }
  // Bottom-up: [ Gauss valuation induced by ..., v(phi1) = mu1, ... ]
  @Override public String toString() {
    Ary<InductiveValuation<C>> chain = augmentation_chain();
    SB sb = new SB("[ ").pobj(chain.last());
    for( int i=chain.len()-2; i>=0; i-- ) {
      InductiveValuation<C> v = chain.at(i);
      sb.p(", v(").pobj(v.phi()).p(") = ").pobj(v.mu());
    }
    return sb.p(" ]").toString();
  }
}
