package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.Rat;
import com.cliffc.maclane.ring.Ring;
import com.cliffc.maclane.util.Ary;

/** A discrete valuation on a ring of constants; the valuation a Gauss
 *  valuation is induced by.  Residues are type-erased: the residue field is a
 *  {@code Ring<Object>} and residues are plain Objects. */
public abstract class DiscreteValuation<C> implements Valuation<C> {
  final Ring<C> _domain;
  DiscreteValuation( Ring<C> domain ) { _domain = domain; }

  @Override public Ring<C> domain() { return _domain; }

  public abstract Ring<Object> residue_field();
  // Reduction of an element of non-negative valuation
  public abstract Object reduce( C x );
  // Some preimage of a residue
  public abstract C lift( Object F );
  public abstract C element_with_valuation( Rat s );
  public C uniformizer() {
    ValueGroup g = value_group();
    if( g.is_trivial() ) throw ValErr.undefined("a uniformizer",this);
    return element_with_valuation(g.gen());
  }

  // An element close to x with smaller representation; within error
  public C simplify( C x, Rat error, boolean force ) { return x; }
  public int relative_size( C x ) { return 1; }
  public Rat lower_bound( C x ) { return eval(x); }
  public Rat upper_bound( C x ) { return eval(x); }

  public abstract DiscreteValuation<C> scale( Rat c );
  public abstract <D> Ary<DiscreteValuation<D>> extensions( Ring<D> ring );
  public abstract <D> DiscreteValuation<D> restriction( Ring<D> ring );
  // Pointwise at least other
  public abstract boolean ge( DiscreteValuation<?> other );

  Rat check_reduce( C x ) {
    Rat v = eval(x);
    if( v.signum() < 0 ) throw ValErr.negative(x,v);
    return v;
  }
  @SuppressWarnings("unchecked")
  static Ring<Object> erase( Ring<?> r ) { return (Ring<Object>)r; }
}
