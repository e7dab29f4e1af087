package com.cliffc.maclane.ring;

import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class TestRat {
  @Test public void testArith() {
    Rat h = Rat.make(1,2), t = Rat.make(1,3);
    assertEquals(Rat.make(5,6),h.add(t));
    assertEquals(Rat.make(1,6),h.sub(t));
    assertEquals(Rat.make(1,6),h.mul(t));
    assertEquals(Rat.make(3,2),h.div(t));
    assertEquals(Rat.make(-2),h.inv().neg());
    assertEquals(Rat.make(1,2),Rat.make(-2,-4));
    assertEquals(Rat.make("-3/4"),Rat.make(3,-4));
    assertSame(Rat.ZERO,Rat.make(0,5));
    assertSame(Rat.ONE ,Rat.make(7,7));
  }

  @Test public void testRounding() {
    assertEquals(BigInteger.valueOf( 2),Rat.make( 7,3).floor());
    assertEquals(BigInteger.valueOf( 3),Rat.make( 7,3).ceil ());
    assertEquals(BigInteger.valueOf(-3),Rat.make(-7,3).floor());
    assertEquals(BigInteger.valueOf(-2),Rat.make(-7,3).ceil ());
    assertEquals(BigInteger.valueOf( 4),Rat.make( 4  ).ceil ());
    assertThrows(ArithmeticException.class,() -> Rat.make(1,2).as_int());
  }

  // Infinity sits above every rational and absorbs positive products
  @Test public void testInfinity() {
    assertTrue(Rat.INF.gt(Rat.make(1000000)));
    assertEquals(0,Rat.INF.compareTo(Rat.INF));
    assertEquals(Rat.INF,Rat.INF.add(Rat.make(-5)));
    assertEquals(Rat.INF,Rat.INF.mul(Rat.make(2)));
    assertEquals(Rat.ZERO,Rat.INF.inv());
    assertEquals(Rat.make(3),Rat.min(Rat.INF,Rat.make(3)));
    assertThrows(ArithmeticException.class,() -> Rat.INF.mul(Rat.ZERO));
    assertThrows(ArithmeticException.class,() -> Rat.make(1).sub(Rat.INF));
    assertEquals("+Infinity",Rat.INF.toString());
    assertEquals(Rat.INF,Rat.make("oo"));
  }

  @Test public void testStr() {
    assertEquals("1/2",Rat.make(2,4).toString());
    assertEquals("-3",Rat.make(-3).toString());
    assertEquals("0",Rat.ZERO.toString());
  }
}
