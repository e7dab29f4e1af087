package com.cliffc.maclane.val;

import com.cliffc.maclane.ML;
import com.cliffc.maclane.ring.Rat;
import com.cliffc.maclane.ring.Ring;
import com.cliffc.maclane.util.Ary;

/** The valuation sending every non-zero element to 0 and zero to infinity. */
public final class TrivialValuation<E> extends DiscreteValuation<E> {
  public TrivialValuation( Ring<E> domain ) { super(domain); }
  public static <E> TrivialValuation<E> make( Ring<E> domain ) { return new TrivialValuation<>(domain); }

  @Override public Rat eval( E x ) { return _domain.is_zero(x) ? Rat.INF : Rat.ZERO; }
  @Override public ValueGroup value_group() { return ValueGroup.TRIVIAL; }
  @Override public ValueSemigroup value_semigroup() { return ValueSemigroup.TRIVIAL; }
  @Override public boolean is_trivial() { return true; }

  // The domain is its own residue field
  @Override public Ring<Object> residue_field() {
    if( !_domain.is_field() ) throw ValErr.unsupported(_domain,"the residue field of a trivial valuation");
    return erase(_domain);
  }
  @Override public Object reduce( E x ) { return x; }
  @Override public E lift( Object F ) { return _domain.coerce(F); }
  @Override public E element_with_valuation( Rat s ) {
    if( !s.is_zero() ) throw ValErr.not_in_group(s,value_group());
    return _domain.one();
  }

  @Override public TrivialValuation<E> scale( Rat c ) {
    if( c.signum() <= 0 ) throw new ArithmeticException("scale must be positive, not "+c);
    return this;
  }
  @SuppressWarnings("unchecked")
  @Override public <D> Ary<DiscreteValuation<D>> extensions( Ring<D> ring ) {
    if( ring.equals(_domain) ) return Ary.of((DiscreteValuation<D>)(DiscreteValuation<?>)this);
    if( ring.is_field() ) return Ary.<DiscreteValuation<D>>of(new TrivialValuation<D>(ring));
    throw ML.TODO("extending "+this+" to "+ring);
  }
  @Override public <D> DiscreteValuation<D> restriction( Ring<D> ring ) { return new TrivialValuation<>(ring); }
  @Override public boolean ge( DiscreteValuation<?> o ) { return o.is_trivial(); }

  @Override public boolean equals( Object o ) { return o instanceof TrivialValuation<?> t && _domain.equals(t._domain); }
  @Override public int hashCode() { return _domain.hashCode()+7; }
  @Override public String toString() { return "Trivial valuation on "+_domain; }
}
