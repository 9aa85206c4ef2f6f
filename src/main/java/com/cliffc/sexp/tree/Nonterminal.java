package com.cliffc.sexp.tree;

import com.cliffc.sexp.buffer.Mark;
import com.cliffc.sexp.util.Ary;

/** A reduction: owns its ordered children, takes its span from them. */
public class Nonterminal extends PNode {
  public final Ary<PNode> _kids;
  private final Mark _snap;     // Position of an empty reduction; null otherwise

  public Nonterminal( Kind kind, Ary<PNode> kids, Mark snap ) {
    super(kind);
    assert !kind._lexeme;
    assert kids.isEmpty() == (snap!=null);
    _kids = kids;
    _snap = snap;
    adopt();
  }

  /** Point every child back at this node */
  public void adopt() {
    for( int i=0; i<_kids._len; i++ ) {
      PNode k = _kids._es[i];
      k._par = this;
      k._idx = i;
    }
  }

  @Override public int start() { return _kids.isEmpty() ? _snap.offset() : _kids._es[0].start(); }
  @Override public int end() { return _kids.isEmpty() ? _snap.offset() : _kids.last().end(); }
  @Override public boolean isEmpty() { return _kids.isEmpty(); }
  @Override public int nkids() { return _kids._len; }
  @Override public PNode kid( int i ) { return _kids.at(i); }
  public PNode last() { return _kids.last(); }

  @Override public PNode firstLeaf() { return _kids.isEmpty() ? null : _kids._es[0].firstLeaf(); }
  @Override public PNode lastLeaf () { return _kids.isEmpty() ? null : _kids.last().lastLeaf(); }
}
