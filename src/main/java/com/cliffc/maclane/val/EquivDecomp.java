package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.Poly;
import com.cliffc.maclane.util.Ary;
import com.cliffc.maclane.util.SB;

/** An equivalence decomposition {@code f ~ unit * prod keys[i]^exps[i]}: the
 *  unit is an equivalence unit and the keys are key polynomials. */
public final class EquivDecomp<C> {
  public final Poly<C> _unit;
  public final Ary<Poly<C>> _keys;
  public final Ary<Integer> _exps;
  EquivDecomp( Poly<C> unit ) { this(unit,new Ary<>(),new Ary<>()); }
  EquivDecomp( Poly<C> unit, Ary<Poly<C>> keys, Ary<Integer> exps ) {
    assert keys.len()==exps.len();
    _unit = unit;
    _keys = keys;
    _exps = exps;
  }

  public int len() { return _keys.len(); }
  public Poly<C> key( int i ) { return _keys.at(i); }
  public int exp( int i ) { return _exps.at(i); }

  public Poly<C> prod() {
    Poly<C> r = _unit;
    for( int i=0; i<len(); i++ ) r = r.mul(key(i).pow(exp(i)));
    return r;
  }

  @Override public String toString() {
    SB sb = new SB().p('(').pobj(_unit).p(')');
    for( int i=0; i<len(); i++ ) {
      sb.p(" * (").pobj(key(i)).p(')');
      if( exp(i) > 1 ) sb.p('^').p(exp(i));
    }
    return sb.toString();
  }
}
