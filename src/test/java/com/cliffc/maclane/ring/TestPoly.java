package com.cliffc.maclane.ring;

import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class TestPoly {
  static final PolyRing<Rat> QQx = new PolyRing<>(RatField.QQ,"x");

  @Test public void testArith() {
    Poly<Rat> x = QQx.gen();
    Poly<Rat> f = QQx.make(1,1,1);              // x^2 + x + 1
    assertEquals(2,f.degree());
    assertEquals(-1,QQx.zero().degree());
    assertEquals(QQx.make(1,2,3,2,1),f.mul(f));
    assertEquals(QQx.make(0,0,1),f.sub(x).sub(QQx.one()));
    assertEquals(QQx.zero(),f.sub(f));
    assertEquals(QQx.make(1,2),f.derivative());
    assertEquals(Rat.make(7),f.eval(Rat.make(2)));
    assertEquals(QQx.make(0,1,1,1),f.shift(1));
    assertEquals(f.mul(f).mul(f),f.pow(3));
    assertTrue(x.is_gen());
    assertTrue(f.is_monic());
    assertEquals("x^2 + x + 1",f.toString());
    assertEquals("1/2*x^2 - x",QQx.make(0,-1,Rat.make(1,2)).toString());
  }

  @Test public void testDivision() {
    Poly<Rat> f = QQx.make(3,8,5,2,1);          // x^4+2x^3+5x^2+8x+3
    Poly<Rat> phi = QQx.make(1,1,1);
    Poly<Rat>[] qr = f.divrem(phi);
    assertEquals(f,qr[0].mul(phi).add(qr[1]));
    assertTrue(qr[1].degree() < phi.degree());
    assertEquals(QQx.make(3,1,1),qr[0]);
    assertEquals(QQx.make(0,4),qr[1]);
    assertThrows(ArithmeticException.class,() -> f.divrem(QQx.zero()));
  }

  // Monic divisors divide over the integers too
  @Test public void testDivisionOverZZ() {
    PolyRing<Rat> ZZx = new PolyRing<>(IntRing.ZZ,"x");
    Poly<Rat>[] qr = ZZx.make(5,0,0,1).divrem(ZZx.make(1,1));
    assertEquals(ZZx.make(1,-1,1),qr[0]);
    assertEquals(ZZx.make(4),qr[1]);
  }

  @Test public void testXgcd() {
    Poly<Rat> a = QQx.make(-1,0,1);             // (x-1)(x+1)
    Poly<Rat> b = QQx.make(-1,1);               // x-1
    Poly<Rat>[] gst = Poly.xgcd(a,b);
    assertEquals(b,gst[0]);
    assertEquals(gst[0],gst[1].mul(a).add(gst[2].mul(b)));
    Poly<Rat> c = QQx.make(2);
    Poly<Rat>[] inv = Poly.xgcd(c,QQx.make(1,1,1));
    assertTrue(inv[0].is_one());
    assertEquals(QQx.make(Rat.make(1,2)),inv[1]);
    assertEquals(QQx.make(1,1),Poly.gcd(QQx.make(1,2,1),QQx.make(-1,0,1)));
  }

  @Test public void testCoerce() {
    PrimeField F2 = PrimeField.make(2);
    PolyRing<BigInteger> F2x = new PolyRing<>(F2,"x");
    Poly<BigInteger> g = F2x.coerce(QQx.make(3,2,1));
    assertEquals(F2x.make(1,0,1),g);
    assertEquals(F2x.make(1),F2x.coerce(5));
    assertEquals(QQx.make(1,0,1),g.map(QQx,Rat::make));
    assertEquals("Univariate Polynomial Ring in x over Finite Field of size 2",F2x.toString());
  }

  @Test public void testExtField() {
    PrimeField F2 = PrimeField.make(2);
    ExtField<BigInteger> F4 = new ExtField<>(F2,new PolyRing<>(F2,"x").make(1,1,1),"a");
    Poly<BigInteger> a = F4.gen();
    Poly<BigInteger> a1 = F4.add(a,F4.one());
    assertEquals(a1,F4.mul(a,a));               // a^2 == a+1
    assertTrue(F4.is_one(F4.mul(a,a1)));
    assertEquals(a1,F4.inv(a));
    assertEquals(BigInteger.valueOf(4),F4.size());
    assertEquals(F4.one(),F4.pow(a,3));
    assertEquals("a",F4.names().at(0));
    assertThrows(ArithmeticException.class,() -> new ExtField<>(F2,new PolyRing<>(F2,"x").make(1,1),"b"));
  }
}
