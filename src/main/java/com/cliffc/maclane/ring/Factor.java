package com.cliffc.maclane.ring;

import com.cliffc.maclane.ML;
import com.cliffc.maclane.util.Ary;
import com.cliffc.maclane.util.SB;
import com.cliffc.maclane.util.Util;

import java.math.BigInteger;
import java.util.Random;

/** Factorization of univariate polynomials: {@code f == unit * prod fs[i]^es[i]}
 *  with distinct monic irreducible {@code fs}.
 *
 *  Over finite fields (GF(p) and any tower of {@link ExtField}s on it) this
 *  is the usual square-free, distinct-degree, equal-degree pipeline with
 *  Cantor-Zassenhaus splitting.  The splitting draws from a Random seeded by
 *  {@link ML#RSEED}, so results are repeatable.  Over the rationals only
 *  rational roots are split off; a remaining cofactor of degree 4 or more is
 *  not supported.
 */
public final class Factor<E> {
  public final Poly<E> _unit;
  public final Ary<Poly<E>> _fs = new Ary<>();
  public final Ary<Integer> _es = new Ary<>();
  private Factor( Poly<E> unit ) { _unit = unit; }

  public int len() { return _fs.len(); }
  public Poly<E> fac( int i ) { return _fs.at(i); }
  public int exp( int i ) { return _es.at(i); }

  private void add( Poly<E> f, int e ) {
    assert f.is_monic() && f.degree() > 0;
    int idx = _fs.find(f::equals);
    if( idx == -1 ) { _fs.add(f); _es.add(e); }
    else _es.set(idx,_es.at(idx)+e);
  }

  // Product of the factorization
  public Poly<E> expand() {
    Poly<E> r = _unit;
    for( int i=0; i<len(); i++ ) r = r.mul(fac(i).pow(exp(i)));
    return r;
  }

  // By degree, then by printed form
  private Factor<E> sort() {
    for( int i=1; i<len(); i++ )
      for( int j=i; j>0 && cmp(fac(j-1),fac(j)) > 0; j-- ) {
        Poly<E> f = _fs.at(j); _fs.set(j,_fs.at(j-1)); _fs.set(j-1,f);
        Integer e = _es.at(j); _es.set(j,_es.at(j-1)); _es.set(j-1,e);
      }
    return this;
  }
  private static int cmp( Poly<?> a, Poly<?> b ) {
    int d = Integer.compare(a.degree(),b.degree());
    return d!=0 ? d : a.toString().compareTo(b.toString());
  }

  public static <E> Factor<E> factor( Poly<E> f ) {
    if( f.is_zero() ) throw new ArithmeticException("factorization of zero");
    Ring<E> K = f._pr._base;
    Factor<E> fac = new Factor<>(f._pr.constant(f.lc()));
    Poly<E> g = f.monic();
    if( g.degree() <= 0 ) return fac;
    if( g.degree() == 1 ) { fac.add(g,1); return fac; }
    if( K.is_finite() && K.is_field() ) {
      Random rnd = new Random(ML.RSEED);
      sff(g,1,fac,rnd);
    } else if( K instanceof RatField ) {
      by_roots(g,fac);
    } else throw ML.TODO("factoring over "+K);
    ML.p(fac,"factored "+f);
    return fac.sort();
  }

  // Square-free factorization; each square-free part goes on to DDF
  private static <E> void sff( Poly<E> f, int mult, Factor<E> acc, Random rnd ) {
    if( f.degree() < 1 ) return;
    Ring<E> K = f._pr._base;
    Poly<E> fp = f.derivative();
    if( fp.is_zero() ) {
      sff(pth_root(f),mult*K.characteristic().intValueExact(),acc,rnd);
      return;
    }
    Poly<E> c = Poly.gcd(f,fp);
    Poly<E> w = f.div(c);
    int i=1;
    while( !w.is_one() ) {
      Poly<E> y = Poly.gcd(w,c);
      Poly<E> fac = w.div(y);
      if( fac.degree() > 0 ) ddf(fac,i*mult,acc,rnd);
      w = y;
      c = c.div(y);
      i++;
    }
    if( !c.is_one() )
      sff(pth_root(c),mult*K.characteristic().intValueExact(),acc,rnd);
  }

  // f(x) == g(x)^p; recover g
  private static <E> Poly<E> pth_root( Poly<E> f ) {
    Ring<E> K = f._pr._base;
    int p = K.characteristic().intValueExact();
    Ary<E> cs = new Ary<>();
    for( int i=0; i<=f.degree(); i+=p ) cs.add(K.pth_root(f.at(i)));
    return f._pr.make(cs);
  }

  // Distinct-degree factorization of a monic square-free f
  private static <E> void ddf( Poly<E> f, int e, Factor<E> acc, Random rnd ) {
    BigInteger q = f._pr._base.size();
    Poly<E> x = f._pr.gen();
    Poly<E> h = x.mod(f);
    int i=1;
    while( f.degree() >= 2*i ) {
      h = Poly.powmod(h,q,f);
      Poly<E> g = Poly.gcd(f,h.sub(x));
      if( !g.is_one() ) {
        edf(g,i,e,acc,rnd);
        f = f.div(g);
        h = h.mod(f);
      }
      i++;
    }
    if( f.degree() > 0 ) acc.add(f,e);
  }

  // Equal-degree splitting of a product of distinct degree-d irreducibles
  private static <E> void edf( Poly<E> g, int d, int e, Factor<E> acc, Random rnd ) {
    int n = g.degree();
    Ary<Poly<E>> fs = Ary.of(g);
    BigInteger q = g._pr._base.size();
    while( fs.len() < n/d ) {
      Poly<E> h = g._pr.random(rnd,n);
      if( h.degree() < 1 ) continue;
      Poly<E> s = splitter(h,d,q,g);
      for( int j=0; j<fs.len(); j++ ) {
        Poly<E> u = fs.at(j);
        if( u.degree() == d ) continue;
        Poly<E> gg = Poly.gcd(u,s.mod(u));
        if( gg.is_one() || gg.degree()==u.degree() ) continue;
        ML.p(gg,"split "+u);
        fs.set(j,gg);
        fs.add(u.div(gg));
      }
    }
    for( Poly<E> u : fs ) acc.add(u,e);
  }

  // h^((q^d-1)/2) - 1 in odd characteristic, the trace of h in characteristic 2
  private static <E> Poly<E> splitter( Poly<E> h, int d, BigInteger q, Poly<E> g ) {
    if( q.testBit(0) ) {
      BigInteger exp = q.pow(d).subtract(BigInteger.ONE).shiftRight(1);
      return Poly.powmod(h,exp,g).sub(g._pr.one());
    }
    int k = (q.bitLength()-1)*d;
    Poly<E> t = h.mod(g), s = t;
    for( int i=1; i<k; i++ ) {
      t = t.mul(t).mod(g);
      s = s.add(t);
    }
    return s;
  }

  // Split off rational roots; whatever remains must have degree at most 3
  private static <E> void by_roots( Poly<E> f, Factor<E> acc ) {
    while( f.degree() > 0 ) {
      if( f.degree()==1 ) { acc.add(f,1); return; }
      Rat r = rational_root(f);
      if( r == null ) {
        if( f.degree() > 3 ) throw ML.TODO("factoring rational polynomials without roots of degree "+f.degree());
        acc.add(f,1);
        return;
      }
      Poly<E> lin = f._pr.make(r.neg(),1);
      f = f.div(lin);
      acc.add(lin,1);
    }
  }

  // Some rational root of f over QQ, or null
  static <E> Rat rational_root( Poly<E> f ) {
    Ary<Rat> cs = new Ary<>();
    for( int i=0; i<=f.degree(); i++ ) cs.add(RatField.QQ.coerce(f.at(i)));
    if( cs.at(0).is_zero() ) return Rat.ZERO;
    BigInteger den = BigInteger.ONE;
    for( Rat c : cs ) den = Util.lcm(den,c._den);
    BigInteger b0 = cs.at(0).mul(Rat.make(den)).as_int();
    BigInteger bn = cs.last().mul(Rat.make(den)).as_int();
    for( BigInteger p : Util.divisors(b0) )
      for( BigInteger q : Util.divisors(bn) )
        for( int sign=1; sign>=-1; sign-=2 ) {
          Rat r = Rat.make(p.multiply(BigInteger.valueOf(sign)),q);
          Rat v = Rat.ZERO;
          for( int i=cs.len()-1; i>=0; i-- ) v = v.mul(r).add(cs.at(i));
          if( v.is_zero() ) return r;
        }
    return null;
  }

  public static <E> boolean is_irreducible( Poly<E> f ) {
    int n = f.degree();
    if( n <= 0 ) return false;
    if( n == 1 ) return true;
    Ring<E> K = f._pr._base;
    if( K.is_finite() && K.is_field() ) return rabin(f.monic());
    if( K instanceof RatField ) {
      if( n > 3 ) throw ML.TODO("irreducibility over the rationals of degree "+n);
      return rational_root(f)==null;
    }
    throw ML.TODO("irreducibility over "+K);
  }

  // Rabin: x^(q^n)==x mod f, and gcd(f, x^(q^(n/r))-x)==1 for each prime r|n
  private static <E> boolean rabin( Poly<E> f ) {
    int n = f.degree();
    BigInteger q = f._pr._base.size();
    Poly<E> x = f._pr.gen();
    for( int r : Util.prime_factors(n) ) {
      Poly<E> h = frobenius(x,q,n/r,f);
      if( !Poly.gcd(f,h.sub(x)).is_one() ) return false;
    }
    return frobenius(x,q,n,f).equals(x.mod(f));
  }
  private static <E> Poly<E> frobenius( Poly<E> h, BigInteger q, int m, Poly<E> f ) {
    for( int i=0; i<m; i++ ) h = Poly.powmod(h,q,f);
    return h;
  }

  @Override public String toString() {
    SB sb = new SB();
    if( !_unit.is_one() ) sb.pobj(_unit).p(" * ");
    for( int i=0; i<len(); i++ ) {
      sb.p('(').pobj(fac(i)).p(')');
      if( exp(i) > 1 ) sb.p('^').p(exp(i));
      sb.p(" * ");
    }
    return sb.len()==0 ? "1" : sb.unchar(3).toString();
  }
}
