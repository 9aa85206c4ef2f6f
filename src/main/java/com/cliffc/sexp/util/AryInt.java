package com.cliffc.sexp.util;

import java.util.Arrays;

// ArrayList of primitive ints; child-index paths through a parse tree
public class AryInt {
  public int[] _es;
  public int _len;
  public AryInt(int[] es, int len) { _es=es; _len=len; }
  public AryInt() { this(new int[4],0); }

  /** @return list is empty */
  public boolean isEmpty() { return _len==0; }
  /** @param i element index
   *  @return element being returned; throws if OOB */
  public int at( int i ) {
    range_check(i);
    return _es[i];
  }
  /** Add element in amortized constant time
   *  @param e element to add at end of list
   *  @return 'this' for flow-coding */
  public AryInt push( int e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    _es[_len++] = e;
    return this;
  }

  /** @return compact array version */
  public int[] asAry() { return Arrays.copyOf(_es,_len); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof AryInt ary) || _len != ary._len ) return false;
    for( int i=0; i<_len; i++ )
      if( _es[i] != ary._es[i] )
        return false;
    return true;
  }
  @Override public int hashCode() {
    int sum=_len;
    for( int i=0; i<_len; i++ ) sum = sum*31+_es[i];
    return sum;
  }

  @Override public String toString() {
    SB sb = new SB().p('[');
    for( int i=0; i<_len; i++ ) {
      if( i>0 ) sb.p(',');
      sb.p(_es[i]);
    }
    return sb.p(']').toString();
  }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }
}
