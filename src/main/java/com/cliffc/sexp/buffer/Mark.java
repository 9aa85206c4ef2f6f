package com.cliffc.sexp.buffer;

import com.cliffc.sexp.SEXP;

/** A position in a {@link Buffer} that follows edits.
 *  Left-sticky marks stay before text inserted at their offset; right-sticky
 *  marks end up after it. */
public final class Mark implements Comparable<Mark> {
  private final Buffer _buf;
  int _off;
  public final boolean _right;

  Mark( Buffer buf, int off, boolean right ) { _buf=buf; _off=off; _right=right; }

  public Buffer buffer() { return _buf; }
  public int offset() { return _off; }
  public void set( int off ) { _buf.check(off); _off=off; }

  /** @return a new mark at the same offset with the given stickiness */
  public Mark clone( boolean right ) { return _buf.mark(_off,right); }

  public Mark advance( ) { return advance(1); }
  public Mark advance( int n ) { set(_off+n); return this; }
  public Mark retreat( ) { return retreat(1); }
  public Mark retreat( int n ) { set(_off-n); return this; }

  /** @return the element just after the mark */
  public char at() {
    assert !atEnd();
    return _buf.charAt(_off);
  }

  public boolean atStart() { return _off==0; }
  public boolean atEnd  () { return _off==_buf.size(); }
  public boolean atLineStart() { return _off==0 || _buf.charAt(_off-1)=='\n'; }
  public boolean atLineEnd  () { return atEnd() || _buf.charAt(_off)=='\n'; }
  public int lineStart() { return _buf.lineStart(_off); }
  public int column() { return _buf.column(_off,SEXP.TAB_WIDTH); }

  @Override public int compareTo( Mark m ) { return Integer.compare(_off,m._off); }
  public int compareTo( int off ) { return Integer.compare(_off,off); }

  @Override public String toString() { return (_right ? ">" : "<")+_off; }
}
