package com.cliffc.sexp.tree;

import com.cliffc.sexp.SEXP;
import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.parse.State;
import com.cliffc.sexp.util.SB;

/** A parse-tree node, lexeme or nonterminal.
 *
 *  Besides the usual parent/child edges every node remembers how it got on
 *  the parse stack: the automaton state active when it was pushed, and the
 *  node just below it at that moment.  The second link makes the parse stack
 *  a singly-linked history through the tree, so parsing can resume after
 *  any lexeme of an old tree without walking it.
 */
public abstract class PNode {
  // Source of unique ids, for printing and debugging
  private static int CNT=1;
  public final int _uid;

  public final Kind _kind;
  public State _state;          // Automaton state when pushed on the parse stack
  public PNode _pred;           // Node below this one on the parse stack when pushed
  public Nonterminal _par;      // Parent; null for the root and for nodes still on the stack
  public int _idx;              // Index in the parent's children

  PNode( Kind kind ) {
    if( CNT==SEXP.UID )
      System.out.print("");     // Handy break-at-UID
    _uid = CNT++;
    _kind = kind;
  }

  /** @return absolute start offset */
  abstract public int start();
  /** @return absolute end offset, exclusive */
  abstract public int end();
  public int length() { return end()-start(); }
  /** @return true for a reduction that matched nothing */
  public boolean isEmpty() { return false; }
  public boolean isForm() { return _kind._form; }

  public int nkids() { return 0; }
  public PNode kid( int i ) { throw new IndexOutOfBoundsException("lexemes have no children"); }
  public PNode firstLeaf() { return this; }
  public PNode lastLeaf () { return this; }

  public String text( Buffer buf ) { return buf.substring(start(),end()); }

  /** Reuse test: same kind, pushed in the same automaton state, and ending
   *  at the same offset.  Parsing on from two such nodes sees the same text in
   *  the same state, so it proceeds identically. */
  public boolean same( PNode n ) {
    return n!=null && _kind==n._kind && _state==n._state && end()==n.end();
  }
  /** Deep structural equality by the reuse test */
  public static boolean same_tree( PNode a, PNode b ) {
    if( a==b ) return true;
    if( a==null || b==null || !a.same(b) || a.start()!=b.start() || a.nkids()!=b.nkids() ) return false;
    for( int i=0; i<a.nkids(); i++ )
      if( !same_tree(a.kid(i),b.kid(i)) )
        return false;
    return true;
  }

  /** Check structural invariants under this node: parent and index links,
   *  ordered spans, stack-predecessor links and automaton states matching a
   *  left-to-right parse.  Called under assert. */
  public boolean check() {
    for( int i=0; i<nkids(); i++ ) {
      PNode k = kid(i);
      if( k._par!=this || k._idx!=i ) return fail(k,"bad parent link");
      PNode prev = i==0 ? null : kid(i-1);
      if( k._pred != (i==0 ? _pred : prev) ) return fail(k,"bad stack predecessor");
      if( k._state != (i==0 ? _state : prev._state.next(prev._kind)) ) return fail(k,"bad state");
      if( prev!=null && prev.end() > k.start() ) return fail(k,"overlapping spans");
      if( !k.check() ) return false;
    }
    return true;
  }
  private boolean fail( PNode k, String msg ) {
    SEXP.p(null,msg+": "+k+" in "+this);
    return false;
  }

  // --------------------------------------------------------------------------
  @Override public String toString() {
    return new SB().p(_kind.name()).p('[').p(start()).p(',').p(end()).p(')').toString();
  }
  /** Pretty-print the subtree, one node per line */
  public SB str( SB sb, Buffer buf ) {
    sb.i().p(_kind.name()).p(' ').p(start()).p("..").p(end());
    if( _kind._lexeme ) sb.s().pq(text(buf));
    sb.nl().ii(1);
    for( int i=0; i<nkids(); i++ )
      kid(i).str(sb,buf);
    return sb.di(1);
  }
}
