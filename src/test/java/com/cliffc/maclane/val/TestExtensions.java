package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.*;
import com.cliffc.maclane.util.Ary;
import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class TestExtensions {
  static final PolyRing<Rat> QQx = new PolyRing<>(RatField.QQ,"x");
  static final PolyRing<Rat> ZZx = new PolyRing<>(IntRing.ZZ,"x");

  // x^2 + x + 1 is a key over GF(2) but splits over GF(4)
  @Test public void testSplitKey() {
    PrimeField F2 = PrimeField.make(2);
    PolyRing<BigInteger> F2x = new PolyRing<>(F2,"x");
    ExtField<BigInteger> F4 = new ExtField<>(F2,F2x.make(1,1,1),"a");
    PolyRing<Poly<BigInteger>> F4x = new PolyRing<>(F4,"x");
    GaussValuation<BigInteger> Gt = GaussValuation.make(F2x,TrivialValuation.make(F2));
    AugmentedValuation<BigInteger> w = Gt.augmentation(F2x.make(1,1,1),Rat.ONE);
    assertTrue(w.is_final());

    Ary<InductiveValuation<Poly<BigInteger>>> exts = w.extensions(F4x);
    assertEquals(2,exts.len());
    Poly<BigInteger> a = F4.gen();
    Poly<Poly<BigInteger>> k0 = F4x.make(a,1), k1 = F4x.make(F4.add(a,F4.one()),1);
    for( InductiveValuation<Poly<BigInteger>> v : exts ) {
      assertEquals(Rat.ONE,v.mu());
      assertTrue(v.phi().equals(k0) || v.phi().equals(k1));
      assertEquals(Rat.ONE,v.eval(F4x.coerce(F2x.make(1,1,1))));
    }
    assertNotEquals(exts.at(0).phi(),exts.at(1).phi());
  }

  @Test public void testFractionField() {
    GaussValuation<Rat> GZ = GaussValuation.make(ZZx,PAdicValuation.ZZ(2));
    AugmentedValuation<Rat> w = GZ.augmentation(ZZx.gen(),Rat.ONE);
    Ary<InductiveValuation<Rat>> exts = w.extensions(QQx);
    assertEquals(1,exts.len());
    InductiveValuation<Rat> q = exts.at(0);
    assertEquals(GaussValuation.make(QQx,PAdicValuation.QQ(2)).augmentation(QQx.gen(),Rat.ONE),q);
    assertEquals(w,q.restriction(ZZx));
    assertSame(w,w.extensions(ZZx).at(0));
  }

  // Moving a chain to another ring carries the keys over unchecked
  @Test public void testChangeDomain() {
    GaussValuation<Rat> GZ = GaussValuation.make(ZZx,PAdicValuation.ZZ(2));
    AugmentedValuation<Rat> w = GZ.augmentation(ZZx.gen(),Rat.ONE);
    AugmentedValuation<Rat> q = w.change_domain(QQx);
    assertEquals(GaussValuation.make(QQx,PAdicValuation.QQ(2)).augmentation(QQx.gen(),Rat.ONE),q);
    assertEquals(w,q.change_domain(ZZx));
    assertEquals(GZ,GZ.change_domain(ZZx));
    assertFalse(q.is_negative_pseudo_valuation());
    assertThrows(IllegalArgumentException.class,() -> GZ.change_domain(new PolyRing<>(RatField.QQ,"y")));

    // x^2 + x + 1 splits over GF(4) but stays the last key
    PrimeField F2 = PrimeField.make(2);
    PolyRing<BigInteger> F2x = new PolyRing<>(F2,"x");
    ExtField<BigInteger> F4 = new ExtField<>(F2,F2x.make(1,1,1),"a");
    PolyRing<Poly<BigInteger>> F4x = new PolyRing<>(F4,"x");
    AugmentedValuation<BigInteger> t = GaussValuation.make(F2x,TrivialValuation.make(F2)).augmentation(F2x.make(1,1,1),Rat.ONE);
    AugmentedValuation<Poly<BigInteger>> t4 = t.change_domain(F4x);
    assertEquals(F4x.make(1,1,1),t4._phi);
    assertEquals(Rat.ONE,t4.eval(F4x.make(1,1,1)));
    assertEquals(AugmentedValuation.Kind.FINAL_FINITE,t4._kind);
  }
}
