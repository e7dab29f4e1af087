package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.*;
import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class TestAugmented {
  static final PolyRing<Rat> QQx = new PolyRing<>(RatField.QQ,"x");
  static final Poly<Rat> x = QQx.gen();
  static final Poly<Rat> phi1 = QQx.make(1,1,1);              // x^2 + x + 1
  static final Poly<Rat> phi2 = QQx.make(3,8,5,2,1);          // phi1^2 + 2*phi1 + 4x
  static final GaussValuation<Rat> G = GaussValuation.make(QQx,PAdicValuation.QQ(2));
  static Rat r( long n, long d ) { return Rat.make(n,d); }
  @SuppressWarnings("unchecked")
  static ExtField<Object> ext( Ring<Object> k ) { return (ExtField<Object>)(Ring<?>)k; }

  // [ G, v(x) = 1 ]: unramified, residue field stays GF(2)
  @Test public void testAugmentGen() {
    AugmentedValuation<Rat> w = G.augmentation(x,Rat.ONE);
    assertEquals(Rat.ONE ,w.eval(x));
    assertEquals(Rat.ZERO,w.eval(phi1));
    assertEquals(Rat.make(2),w.eval(QQx.make(0,2)));
    assertEquals(Rat.ONE ,w.lower_bound(QQx.make(2,1)));
    assertEquals(AugmentedValuation.Kind.NON_FINAL_FINITE,w._kind);
    assertEquals(2,w.augmentation_chain().len());
    assertEquals(PrimeField.make(2),w.residue_field());
    assertEquals(1,w.E());
    assertEquals(1,w.F());
    assertEquals(QQx.make(2),w.Q(1));
    assertEquals(QQx.make(r(1,2)),w.Q_reciprocal(1));
    assertEquals(QQx.make(2),w.uniformizer());
    assertEquals("[ Gauss valuation induced by 2-adic valuation, v(x) = 1 ]",w.toString());

    PolyRing<Object> RR = w.residue_poly_ring();
    assertEquals(RR.zero(),w.reduce(QQx.make(2,1)));
    assertEquals(RR.make(1,1),w.reduce(QQx.make(1,r(1,2))));
    assertEquals(QQx.make(1,r(1,2)),w.lift(RR.make(1,1)));
    Poly<Rat> key = w.lift_to_key(RR.make(1,1));
    assertEquals(QQx.make(2,1),key);
    assertTrue(w.is_key(key));
    assertSame(w._phi,w.lift_to_key(RR.gen()));

    // Same degree key replaces the last step
    AugmentedValuation<Rat> w2 = w.augmentation(x,Rat.make(2));
    assertEquals(G,w2._base);
    assertEquals(Rat.make(2),w2._mu);
    assertTrue (w2.ge(w));
    assertFalse(w.ge(w2));
  }

  // [ G, v(phi1) = 1/2 ]: ramified with a quadratic residue extension
  @Test public void testRamified() {
    AugmentedValuation<Rat> v = G.augmentation(phi1,r(1,2));
    assertEquals(r(1,2),v.value_group().gen());
    assertEquals(2,v.tau());
    assertEquals(2,v.E());
    assertEquals(2,v.F());
    assertEquals(G.residue_poly_ring().make(1,1,1),v.psi());
    assertEquals(Rat.ZERO,v.eval(x));
    assertEquals(r(1,2),v.eval(phi1));
    assertEquals(r(1,2),v.eval(phi1.mul(x).add(QQx.make(2))));
    assertTrue(v.value_semigroup().contains(r(-1,2)));

    ExtField<Object> k = ext(v.residue_field());
    assertEquals("u1",k.name());
    PolyRing<Object> RR = v.residue_poly_ring();
    Poly<Rat> t = phi1.pow(2).scale(r(1,2));
    assertEquals(RR.gen(),v.reduce(t));
    assertEquals(t,v.lift(RR.gen()));
    assertEquals(RR.constant(k.gen()),v.reduce(x));
    assertEquals(RR.zero(),v.reduce(phi1));
    assertEquals(x,v.lift(RR.constant(k.gen())));
    assertEquals(phi1,v.uniformizer());
    assertEquals(r(3,2),v.eval(v.element_with_valuation(r(3,2))));
    assertEquals(r(-1,2),v.eval(v.element_with_valuation(r(-1,2))));
    assertEquals("[ Gauss valuation induced by 2-adic valuation, v(x^2 + x + 1) = 1/2 ]",v.toString());
  }

  // [ G, v(phi1) = 1 ]: residue field GF(4), then a second step over it
  @Test public void testTwoSteps() {
    AugmentedValuation<Rat> w = G.augmentation(phi1,Rat.ONE);
    ExtField<Object> k = ext(w.residue_field());
    Poly<Object> u = k.gen();
    PolyRing<Object> RR = w.residue_poly_ring();
    assertEquals(QQx.make(2),w.Q(1));
    assertEquals(QQx.make(r(1,2)),w.Q_reciprocal(1));
    assertEquals(QQx.make(2),w.uniformizer());
    assertEquals(1,w.E());
    assertEquals(2,w.F());

    Poly<Object> F = RR.make(u,1);
    Poly<Rat> lf = w.lift(F);
    assertEquals(QQx.make(r(1,2),r(3,2),r(1,2)),lf);  // x + phi1/2
    assertEquals(F,w.reduce(lf));
    Poly<Rat> key = w.lift_to_key(F);
    assertEquals(QQx.make(1,-1,1),key);
    assertTrue(w.is_key(key));
    assertEquals(Rat.ONE,w.eval(key));

    assertEquals(Rat.make(2),w.eval(phi2));
    AugmentedValuation<Rat> ww = w.augmentation(phi2,r(16,3));
    assertEquals(r(16,3),ww.eval(phi2));
    assertEquals(Rat.ONE,ww.eval(phi1));
    assertEquals(r(1,3),ww.value_group().gen());
    assertEquals(3,ww.tau());
    assertEquals(3,ww.E());
    assertEquals(4,ww.F());
    assertEquals(2,ww.psi().degree());
    assertEquals("u2",ext(ww.residue_field()).name());
    assertEquals(3,ww.augmentation_chain().len());
    assertTrue (ww.ge(w));
    assertTrue (ww.ge(G));
    assertFalse(ww.ge(G.augmentation(phi1,Rat.make(2))));
    assertFalse(w.ge(ww));
    assertEquals("[ Gauss valuation induced by 2-adic valuation, v(x^2 + x + 1) = 1, v(x^4 + 2*x^3 + 5*x^2 + 8*x + 3) = 16/3 ]",ww.toString());

    // x^2 + x + 3 is also a key for w; augmenting by it drops phi1
    AugmentedValuation<Rat> w3 = w.augmentation(QQx.make(3,1,1),Rat.make(2));
    assertEquals(G,w3._base);
    assertEquals(QQx.make(3,1,1),w3._phi);
  }

  @Test public void testDecomposition() {
    AugmentedValuation<Rat> w = G.augmentation(phi1,Rat.ONE);
    EquivDecomp<Rat> d = w.equivalence_decomposition(phi1);
    assertEquals(1,d.len());
    assertEquals(phi1,d.key(0));
    assertEquals(1,d.exp(0));
    EquivDecomp<Rat> e = w.equivalence_decomposition(QQx.make(1,-1,1));
    assertEquals(1,e.len());
    assertEquals(QQx.make(1,-1,1),e.key(0));
    assertEquals(QQx.one(),e._unit);
    assertTrue(w.is_equivalent(e.prod(),QQx.make(1,-1,1)));
  }

  @Test public void testScale() {
    AugmentedValuation<Rat> v = G.augmentation(phi1,r(1,2));
    AugmentedValuation<Rat> v2 = v.scale(Rat.make(2));
    assertEquals(Rat.ONE,v2.eval(phi1));
    assertEquals(Rat.make(2),v2.eval(QQx.make(2)));
    assertSame(v,v.scale(Rat.ONE));
    assertTrue(v2.ge(v));
    assertThrows(ArithmeticException.class,() -> v.scale(Rat.ZERO));
  }

  // Over the trivial valuation on QQ a finite step is already final
  @Test public void testTrivialBase() {
    GaussValuation<Rat> Gt = GaussValuation.make(QQx,TrivialValuation.make(RatField.QQ));
    AugmentedValuation<Rat> v = Gt.augmentation(x,Rat.ONE);
    assertEquals(AugmentedValuation.Kind.FINAL_FINITE,v._kind);
    assertTrue(v.is_final());
    assertEquals(RatField.QQ,v.residue_ring());
    assertEquals(Rat.ONE ,v.reduce(phi1));
    assertEquals(Rat.ZERO,v.reduce(x));
    assertEquals(QQx.make(r(1,2)),v.lift(r(1,2)));
    assertEquals(Rat.make(2),v.eval(x.pow(2).add(x.pow(3))));
    assertEquals(ValErr.Kind.Undefined,assertThrows(ValErr.class,v::E)._kind);
    assertEquals(ValErr.Kind.NoKeysOverTerminalValuation,assertThrows(ValErr.class,() -> v.lift_to_key(Rat.ONE))._kind);
    assertEquals(ValErr.Kind.NoKeysOverTerminalValuation,assertThrows(ValErr.class,() -> v.augmentation(QQx.make(1,1),Rat.make(2)))._kind);

    AugmentedValuation<Rat> inf = Gt.augmentation(phi1,Rat.INF);
    assertEquals(AugmentedValuation.Kind.INFINITE,inf._kind);
    ExtField<Object> k = ext(inf.residue_field());
    Poly<Object> u = k.gen();
    assertEquals(u,inf.reduce(x));
    assertEquals(x,inf.lift(u));
    assertEquals(k.mul(u,u),inf.reduce(x.pow(2)));
    assertEquals(Rat.INF ,inf.eval(phi1.mul(x)));
    assertEquals(Rat.ZERO,inf.eval(QQx.make(1,1)));
    assertTrue(inf.value_group().is_trivial());
    assertEquals(ValErr.Kind.NoKeysOverTerminalValuation,assertThrows(ValErr.class,() -> inf.is_key(x))._kind);
  }

  // Infinite value over a p-adic base: the pseudo-valuation f -> v(f mod phi)
  @Test public void testInfinitePAdic() {
    AugmentedValuation<Rat> w = G.augmentation(x,Rat.INF);
    assertEquals(Rat.INF,w.eval(x));
    assertEquals(Rat.ONE,w.eval(QQx.make(2,1)));
    assertEquals(PrimeField.make(2),w.residue_ring());
    assertEquals(BigInteger.ONE,w.reduce(QQx.make(3,5)));
    assertEquals(QQx.make(1),w.lift(BigInteger.ONE));
    assertEquals(ValueGroup.ZZ,w.value_group());
    assertEquals(Rat.INF,w.upper_bound(QQx.make(0,4)));
  }
}
