package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.Poly;
import com.cliffc.maclane.ring.PolyRing;
import com.cliffc.maclane.ring.Ring;

/** A monic polynomial with integral coefficients defining the same extension
 *  as some irreducible G.  The new polynomial is {@code u^d * G(x/u)} for the
 *  monic G of degree d, so {@link #from} substitutes {@code x/u} and
 *  {@link #to} substitutes {@code u*x}. */
public final class MonicIntegralModel<C> {
  public final Poly<C> _G;
  public final C _u;
  MonicIntegralModel( Poly<C> G, C u ) { _G = G; _u = u; }

  // Image of a polynomial under x -> x/u
  public Poly<C> from( Poly<C> f ) {
    Ring<C> K = f._pr._base;
    return K.is_one(_u) ? f : f.subs_scale(K.inv(_u));
  }
  // Image of a polynomial under x -> u*x
  public Poly<C> to( Poly<C> f ) {
    return f._pr._base.is_one(_u) ? f : f.subs_scale(_u);
  }
  public Poly<C> from_gen() { return from(ring().gen()); }
  public Poly<C> to_gen() { return to(ring().gen()); }
  private PolyRing<C> ring() { return _G._pr; }

  @Override public String toString() {
    return "(x -> "+from_gen()+", x -> "+to_gen()+", "+_G+")";
  }
}
