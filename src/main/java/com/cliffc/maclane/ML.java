package com.cliffc.maclane;

/** MacLane inductive valuations on univariate polynomial rings.
 */

public abstract class ML {
  public static RuntimeException TODO( String msg) { throw new RuntimeException(msg); }

  // Global random seed for the random splitting in equal-degree factoring.
  // Fixed, so every factorization (and hence every lift_to_key) is repeatable.
  public static long RSEED = Long.getLong("maclane.seed",0L);

  // Coefficient-size factor a simplify must expect to win before it bothers.
  public static int SIZE_HEURISTIC_BOUND = Integer.getInteger("maclane.size_bound",32);

  // Debug printers
  public static boolean DEBUG = Boolean.getBoolean("maclane.debug");
  public static <T> T p(T x, String s) {
    if( !ML.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
