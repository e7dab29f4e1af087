package com.cliffc.maclane.val;

import com.cliffc.maclane.ring.Rat;

// Caller errors from building or using a valuation
public class ValErr extends RuntimeException {

  // Error kinds
  public enum Kind {
    InvalidKeyPolynomial,       // phi fails the key polynomial test
    NonIncreasingValue,         // mu <= base(phi)
    NotInductive,               // base cannot be augmented
    NotInValueGroup,            // requested value not reachable exactly
    NegativeValuation,          // input assumed non-negative is not
    InvalidResidue,             // not constant, monic and irreducible
    NoKeysOverTerminalValuation,// final valuations have no key polynomials
    UnsupportedCoefficientDomain,// needs a field of coefficients
    Undefined,                  // quantity not defined for this valuation
  }

  public final Kind _kind;
  public ValErr( Kind kind, String msg ) { super(msg); _kind = kind; }

  public static ValErr invalid_key( Object phi, Object v, String reason ) {
    return new ValErr(Kind.InvalidKeyPolynomial,phi+" is not a key polynomial for "+v+": "+reason);
  }
  public static ValErr non_increasing( Rat mu, Rat vphi ) {
    return new ValErr(Kind.NonIncreasingValue,"the value "+mu+" must exceed the current value "+vphi+" of the key polynomial");
  }
  public static ValErr not_inductive( Object v ) {
    return new ValErr(Kind.NotInductive,v+" is not an inductive valuation");
  }
  public static ValErr not_in_group( Rat s, Object group ) {
    return new ValErr(Kind.NotInValueGroup,s+" is not in "+group);
  }
  public static ValErr negative( Object f, Rat v ) {
    return new ValErr(Kind.NegativeValuation,f+" has negative valuation "+v);
  }
  public static ValErr invalid_residue( Object F, String reason ) {
    return new ValErr(Kind.InvalidResidue,F+" must be "+reason);
  }
  public static ValErr no_keys( Object v ) {
    return new ValErr(Kind.NoKeysOverTerminalValuation,"there are no key polynomials over "+v);
  }
  public static ValErr unsupported( Object ring, String what ) {
    return new ValErr(Kind.UnsupportedCoefficientDomain,what+" is only implemented over a field, not "+ring);
  }
  public static ValErr undefined( String what, Object v ) {
    return new ValErr(Kind.Undefined,what+" is not defined for "+v);
  }
}
