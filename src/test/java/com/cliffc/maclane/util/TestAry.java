package com.cliffc.maclane.util;

import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class TestAry {
  @Test public void testAry() {
    Ary<String> ary = Ary.of("b","a");
    assertEquals(2,ary.len());
    ary.add("c").add("d");
    assertEquals("d",ary.pop());
    assertEquals("c",ary.last());
    assertEquals(1,ary.find("a"::equals));
    assertEquals(-1,ary.find("z"::equals));
    ary.sort_update(String::compareTo);
    assertEquals("[a, b, c]",ary.toString());
    assertEquals(Ary.of("A","B","C"),ary.map_update(String::toUpperCase));
    String[] ss = ary.asAry(new String[0]);
    assertEquals(3,ss.length);
    assertThrows(ArrayIndexOutOfBoundsException.class,() -> ary.at(3));
    int n=0;
    for( String s : ary ) n += s.length();
    assertEquals(3,n);
  }

  @Test public void testUtil() {
    assertEquals(BigInteger.valueOf(12),Util.lcm(BigInteger.valueOf(4),BigInteger.valueOf(-6)));
    assertEquals("[2, 3]",Util.prime_factors(12).toString());
    assertEquals("[1, 2, 3, 6]",Util.divisors(BigInteger.valueOf(-6)).toString());
    assertEquals(3,Util.val(BigInteger.valueOf(24),BigInteger.TWO));
    assertEquals(0,Util.nbits(BigInteger.ZERO));
    assertEquals("x + 1 - y",new SB().plus("x").plus("1").plus("-y").toString());
  }
}
