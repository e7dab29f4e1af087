package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.Rat;
import com.cliffc.maclane.ring.Ring;

/** A discrete (pseudo-)valuation on a ring, with values in the rationals and
 *  {@link Rat#INF}. */
public interface Valuation<D> {
  Ring<D> domain();
  Rat eval( D x );
  ValueGroup value_group();
  ValueSemigroup value_semigroup();
  boolean is_trivial();
}
