package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.*;
import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class TestPAdic {
  static Rat r( long n, long d ) { return Rat.make(n,d); }

  @Test public void testEval() {
    PAdicValuation v2 = PAdicValuation.QQ(2);
    assertEquals(Rat.make(2),v2.eval(Rat.make(12)));
    assertEquals(Rat.make(-3),v2.eval(r(3,8)));
    assertEquals(Rat.ZERO,v2.eval(r(5,3)));
    assertEquals(Rat.INF,v2.eval(Rat.ZERO));
    assertEquals(ValueGroup.ZZ,v2.value_group());
    assertEquals("2-adic valuation",v2.toString());
    PAdicValuation v3 = v2.scale(Rat.make(3));
    assertEquals(Rat.make(3),v3.eval(Rat.make(2)));
    assertEquals("3 * 2-adic valuation",v3.toString());
    assertEquals(ValueGroup.make(Rat.make(3)),v3.value_group());
    assertTrue (v3.ge(v2));
    assertFalse(v2.ge(v3));
    assertFalse(v2.ge(PAdicValuation.QQ(3)));
  }

  @Test public void testResidues() {
    PAdicValuation v3 = PAdicValuation.QQ(3);
    assertEquals(PrimeField.make(3),v3.residue_field());
    assertEquals(BigInteger.ONE,v3.reduce(Rat.make(4)));
    assertEquals(BigInteger.TWO,v3.reduce(r(1,2)));
    assertEquals(BigInteger.ZERO,v3.reduce(Rat.make(6)));
    assertEquals(Rat.make(2),v3.lift(BigInteger.TWO));
    ValErr e = assertThrows(ValErr.class,() -> v3.reduce(r(1,3)));
    assertEquals(ValErr.Kind.NegativeValuation,e._kind);
    assertEquals(Rat.make(3),v3.uniformizer());
  }

  @Test public void testElements() {
    PAdicValuation q = PAdicValuation.QQ(2), z = PAdicValuation.ZZ(2);
    assertEquals(r(1,4),q.element_with_valuation(Rat.make(-2)));
    assertEquals(Rat.make(8),z.element_with_valuation(Rat.make(3)));
    assertEquals(ValErr.Kind.NotInValueGroup,assertThrows(ValErr.class,() -> z.element_with_valuation(Rat.make(-1)))._kind);
    assertEquals(ValErr.Kind.NotInValueGroup,assertThrows(ValErr.class,() -> q.element_with_valuation(r(1,2)))._kind);
    assertTrue(z.value_semigroup().contains(Rat.make(4)));
    assertFalse(z.value_semigroup().contains(Rat.make(-4)));
    assertTrue(q.value_semigroup().is_group());
  }

  // Balanced residues and rational reconstruction keep the value of the difference above the error
  @Test public void testSimplify() {
    PAdicValuation v = PAdicValuation.QQ(2);
    Rat x = r(1025,3);
    Rat s = v.simplify(x,Rat.make(3),true);
    assertEquals(Rat.make(-5),s);
    assertTrue(v.eval(x.sub(s)).gt(Rat.make(3)));
    // Already small
    assertEquals(r(1,3),v.simplify(r(1,3),Rat.make(3),true));
    // Error below the value: zero is close enough
    assertEquals(Rat.ZERO,v.simplify(Rat.make(16),Rat.make(2),true));
    assertEquals(x,v.simplify(x,Rat.INF,true));
    // Not forced and not large
    assertEquals(x,v.simplify(x,Rat.make(3),false));
    assertEquals(r(-1,3),PAdicValuation.rational_reconstruction(BigInteger.valueOf(21),BigInteger.valueOf(32)));
  }

  @Test public void testExtensions() {
    PAdicValuation z = PAdicValuation.ZZ(5);
    DiscreteValuation<Rat> q = z.extensions(RatField.QQ).at(0);
    assertEquals(PAdicValuation.QQ(5),q);
    assertEquals(z,q.restriction(IntRing.ZZ));
    assertEquals(1,z.extensions(IntRing.ZZ).len());
    assertTrue(z.ge(TrivialValuation.make(IntRing.ZZ)));
    assertFalse(q.ge(TrivialValuation.make(RatField.QQ)));
  }

  @Test public void testTrivial() {
    TrivialValuation<Rat> t = TrivialValuation.make(RatField.QQ);
    assertEquals(Rat.ZERO,t.eval(r(7,2)));
    assertEquals(Rat.INF,t.eval(Rat.ZERO));
    assertTrue(t.is_trivial());
    assertEquals(RatField.QQ,t.residue_field());
    assertEquals(r(7,2),t.reduce(r(7,2)));
    assertEquals(Rat.ONE,t.element_with_valuation(Rat.ZERO));
    assertEquals(ValErr.Kind.NotInValueGroup,assertThrows(ValErr.class,() -> t.element_with_valuation(Rat.ONE))._kind);
    assertEquals(ValErr.Kind.Undefined,assertThrows(ValErr.class,t::uniformizer)._kind);
    assertEquals(ValErr.Kind.UnsupportedCoefficientDomain,
                 assertThrows(ValErr.class,() -> TrivialValuation.make(IntRing.ZZ).residue_field())._kind);
    assertEquals("Trivial valuation on Rational Field",t.toString());
  }
}
