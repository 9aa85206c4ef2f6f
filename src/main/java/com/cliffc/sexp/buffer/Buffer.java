package com.cliffc.sexp.buffer;

import com.cliffc.sexp.util.Ary;
import org.jetbrains.annotations.NotNull;

import java.lang.ref.WeakReference;

/** Editable text with auto-adjusting marks.
 *
 *  Every live {@link Mark} moves with the edits made around it.  The buffer
 *  also records the region modified since the last {@link #clearModified},
 *  as a left-sticky low mark and a right-sticky high mark; the incremental
 *  reparser reads that region and clears it.
 *
 *  Marks are held weakly: parse-tree lexemes own their start marks, and a
 *  discarded subtree lets its marks go.
 */
@SuppressWarnings("unchecked")
public class Buffer {
  private final StringBuilder _text;
  private final Ary<WeakReference<Mark>> _marks = new Ary<>(new WeakReference[4],0);
  private final Mark _low, _high;   // Modified region; empty when low > high

  public Buffer( ) { this(""); }
  public Buffer( @NotNull String text ) {
    _text = new StringBuilder(text);
    _low  = mark(0,false);
    _high = mark(text.length(),true); // Fresh text is all modified
  }

  public int size() { return _text.length(); }
  public char charAt( int x ) { return _text.charAt(x); }
  public String substring( int a, int b ) { return _text.substring(a,b); }
  @Override public String toString() { return _text.toString(); }

  /** @return a new mark at offset, left- or right-sticky */
  public Mark mark( int offset, boolean right ) {
    check(offset);
    Mark m = new Mark(this,offset,right);
    _marks.push(new WeakReference<>(m));
    return m;
  }

  // --------------------------------------------------------------------------
  /** Insert text at offset.  Left-sticky marks at the offset stay before the
   *  text, right-sticky marks and all marks after move past it. */
  public void insert( int offset, @NotNull CharSequence s ) {
    check(offset);
    int n = s.length();
    if( n==0 ) return;
    _text.insert(offset,s);
    for( int i=0; i<_marks._len; i++ ) {
      Mark m = _marks._es[i].get();
      if( m==null ) { _marks.del(i--); continue; }
      if( m._off > offset || (m._off==offset && m._right) )
        m._off += n;
    }
    _low ._off = Math.min(_low ._off,offset  );
    _high._off = Math.max(_high._off,offset+n);
  }

  /** Delete len characters starting at offset.  Marks inside the deleted
   *  span collapse onto its start. */
  public void delete( int offset, int len ) {
    check(offset);
    check(offset+len);
    if( len==0 ) return;
    _text.delete(offset,offset+len);
    for( int i=0; i<_marks._len; i++ ) {
      Mark m = _marks._es[i].get();
      if( m==null ) { _marks.del(i--); continue; }
      if( m._off >= offset+len ) m._off -= len;
      else if( m._off > offset ) m._off = offset;
    }
    _low ._off = Math.min(_low ._off,offset);
    _high._off = Math.max(_high._off,offset);
  }

  /** Replace the whole text; everything is modified afterwards. */
  public void replace( @NotNull String text ) {
    delete(0,size());
    insert(0,text);
  }

  // --------------------------------------------------------------------------
  /** @return true if edited since the last clearModified */
  public boolean modified() { return _low._off <= _high._off; }
  /** @return start offset of the modified region */
  public int low () { return _low ._off; }
  /** @return end offset of the modified region */
  public int high() { return _high._off; }
  /** Empty the modified region, low above high */
  public void clearModified() { _low._off = size(); _high._off = 0; }

  /** @return count of live marks, for tests */
  public int liveMarks() {
    int cnt=0;
    for( WeakReference<Mark> w : _marks ) if( w.get()!=null ) cnt++;
    return cnt;
  }

  // --------------------------------------------------------------------------
  // Line helpers, used by marks and by indentation
  public int lineStart( int x ) {
    while( x > 0 && _text.charAt(x-1) != '\n' ) x--;
    return x;
  }
  public int lineEnd( int x ) {
    while( x < _text.length() && _text.charAt(x) != '\n' ) x++;
    return x;
  }
  /** @return display column of offset x, tabs expanded to tabWidth */
  public int column( int x, int tabWidth ) {
    int col=0;
    for( int i=lineStart(x); i<x; i++ )
      col = _text.charAt(i)=='\t' ? (col/tabWidth+1)*tabWidth : col+1;
    return col;
  }

  void check( int offset ) {
    if( offset < 0 || offset > _text.length() )
      throw new IndexOutOfBoundsException("offset "+offset+" outside buffer of size "+_text.length());
  }
}
