package com.cliffc.maclane.util;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

// ArrayList with saner syntax
public class Ary<E> implements Iterable<E> {
  public E[] _es;
  public int _len;
  public Ary(E[] es) { this(es,es.length); }
  public Ary(E[] es, int len) { _es=es; _len=len; }
  // Backed by an Object[]; do not hand out _es from these as an E[]
  @SuppressWarnings("unchecked")
  public Ary() { this((E[])new Object[2],0); }
  @SafeVarargs
  public static <E> Ary<E> of( E... es ) {
    Ary<E> ary = new Ary<>();
    for( E e : es ) ary.add(e);
    return ary;
  }

  /** @return list is empty */
  public boolean isEmpty() { return _len==0; }
  /** @return active list length */
  public int len() { return _len; }
  /** @param i element index
   *  @return element being returned; throws if OOB */
  public E at( int i ) {
    range_check(i);
    return _es[i];
  }
  /** @return last element */
  public E last( ) {
    range_check(0);
    return _es[_len-1];
  }

  /** @return remove and return last element */
  public E pop( ) {
    range_check(0);
    return _es[--_len];
  }

  /** Add element in amortized constant time
   *  @param e Element to add at end of list
   *  @return 'this' for flow-coding */
  public Ary<E> add( E e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    _es[_len++] = e;
    return this;
  }

  public E set( int i, E e ) {
    range_check(i);
    return (_es[i] = e);
  }

  /** @param c Collection to be added */
  public Ary<E> addAll( Ary<? extends E> c ) {
    for( int i=0; i<c._len; i++ ) add(c._es[i]);
    return this;
  }

  /** @param a array of the desired runtime type
   *  @return compact array copy of the active elements */
  @SuppressWarnings("unchecked")
  public E[] asAry( E[] a ) { return Arrays.copyOf(_es,_len,(Class<E[]>)a.getClass()); }

  /** Sorts in-place
   *  @param c Comparator to sort by */
  public void sort_update(Comparator<? super E> c ) { Arrays.sort(_es, 0, _len, c);  }

  /** @param f function to apply to each element.  Updates in-place. */
  public Ary<E> map_update( Function<E,E> f ) { for( int i = 0; i<_len; i++ ) _es[i] = f.apply(_es[i]); return this; }
  /** Find the first element matching predicate P, or -1 if none.
   *  @param P Predicate to match
   *  @return index of first matching element, or -1 if none */
  public int find( Predicate<E> P ) {
    for( int i=0; i<_len; i++ )  if( P.test(_es[i]) )  return i;
    return -1;
  }
  /** @return an iterator */
  @Override public Iterator<E> iterator() { return new Iter(); }
  private class Iter implements Iterator<E> {
    int _i=0;
    @Override public boolean hasNext() { return _i<_len; }
    @Override public E next() { return _es[_i++]; }
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Ary<?> ary) || _len != ary._len ) return false;
    for( int i=0; i<_len; i++ )
      if( !Objects.equals(_es[i],ary._es[i]) )
        return false;
    return true;
  }
  @Override public int hashCode() {
    int sum=_len;
    for( int i=0; i<_len; i++ )
      sum = sum*31 + (_es[i]==null ? 0 : _es[i].hashCode());
    return sum;
  }

  @Override public String toString() {
    SB sb = new SB().p('[');
    for( int i=0; i<_len; i++ ) {
      if( i>0 ) sb.p(", ");
      if( _es[i] != null ) sb.p(_es[i].toString());
    }
    return sb.p(']').toString();
  }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }

}
