package com.cliffc.sexp.tree;

import com.cliffc.sexp.buffer.Mark;

/** A terminal: kind, a left-sticky start mark and a length. */
public class Lexeme extends PNode {
  public final Mark _start;
  public final int _len;
  public Lexeme( Kind kind, Mark start, int len ) {
    super(kind);
    assert kind._lexeme && len > 0;
    _start = start;
    _len = len;
  }
  @Override public int start() { return _start.offset(); }
  @Override public int end() { return _start.offset()+_len; }
}
