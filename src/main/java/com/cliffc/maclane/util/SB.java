package com.cliffc.maclane.util;

import java.math.BigInteger;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing.
 *  Mostly used to print polynomials and valuation chains. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB(String s) { _sb = new StringBuilder(s); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB p( long   s ) { _sb.append(s); return this; }
  public SB p( BigInteger s ) { _sb.append(s); return this; }
  // Not spelled "p" on purpose: too easy to accidentally say "p(1)" and
  // suddenly call the autoboxed version.
  public SB pobj( Object s ) { _sb.append(s.toString()); return this; }
  // Separator between terms of a sum; eats a leading minus from the term
  public SB plus( String term ) {
    if( _sb.length()==0 ) return p(term);
    return term.startsWith("-") ? p(" - ").p(term.substring(1)) : p(" + ").p(term);
  }
  // Delete last char.  Useful when doing string-joins and JSON printing and an
  // extra separater char needs to be removed:
  //
  //   sb.p('[');
  //   for( Foo foo : foos )
  //     sb.p(foo).p(',');
  //   sb.unchar().p(']');  // remove extra trailing comma
  //
  public SB unchar() { return unchar(1); }
  public SB unchar(int x) { _sb.setLength(_sb.length()-x); return this; }
  public int len() { return _sb.length(); }

  @Override public String toString() { return _sb.toString(); }
}
