package com.cliffc.sexp.parse;

import com.cliffc.sexp.SEXP;
import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.tree.Nonterminal;
import com.cliffc.sexp.tree.PNode;
import org.jetbrains.annotations.NotNull;

/** The parse tree of one buffer, kept current by incremental reparsing.
 *
 *  After an edit, parsing resumes at the last lexeme wholly before the
 *  modified region, using that lexeme's stack-predecessor chain as the parse
 *  stack.  Each node the parser produces is compared with a reuse candidate
 *  from the old tree, starting at the first lexeme wholly after the region.
 *  On a match the old parse from there on is known to repeat, so the
 *  candidate's following siblings are spliced onto the new stack, the parser
 *  jumps over them, and matching moves up to the candidate's parent.
 *
 *  Old lexemes keep left-sticky start marks, so their offsets track the edit.
 *  Offsets of lexemes touched by the edit are not trusted: the region bounds
 *  are strict, and a candidate only matches if its last lexeme starts after
 *  the region.
 */
public class Syntax {
  private final Buffer _buf;
  private final Parser _P;
  private Nonterminal _root;
  private PNode _cand;          // Reuse candidate from the old tree
  private int _high;            // End of the modified region
  public int _steps, _reused;   // Stats for the last update

  public Syntax( @NotNull Buffer buf ) {
    _buf = buf;
    _P = new Parser(buf);
  }

  public Buffer buffer() { return _buf; }

  /** @return the current tree, reparsing first if the buffer was edited */
  public Nonterminal root() { return update(); }

  /** Bring the tree up to date with the buffer. */
  public Nonterminal update() {
    if( _root!=null && !_buf.modified() ) return _root;
    int low = _buf.low();
    _high = _buf.high();
    PNode top = null;
    _cand = null;
    if( _root != null ) {
      top   = last_valid(_root,low);
      _cand = first_potentially_valid(_root,_high);
    }
    if( top==null ) _P.resume(null,State.INITIAL,0);
    else            _P.resume(top,top._state.next(top._kind),top.end());
    _P._steps = _reused = 0;
    while( _P.step() )
      patch();
    _steps = _P._steps;
    _root = (Nonterminal)_P.top();
    _buf.clearModified();
    _cand = null;
    SEXP.p(null,"reparse ["+low+","+_high+"] took "+_steps+" steps, reused "+_reused+" nodes");
    assert _root.check();
    return _root;
  }

  /** Drop the old tree and parse from scratch */
  public Nonterminal reparse() {
    _root = null;
    return update();
  }

  // --------------------------------------------------------------------------
  // Compare the node just produced with the reuse candidate.
  private void patch() {
    if( _cand==null ) return;
    PNode fresh = _P.top(), c = _cand, ll = c.lastLeaf();
    if( !fresh.same(c) || ll==null || ll.start() <= _high ) {
      // Mismatch; skip candidates the parse has already passed
      while( _cand!=null && _cand.start() < fresh.end() )
        _cand = next_tree(_cand);
      return;
    }
    PNode keep = fresh;
    if( c.start() > _high && c.start()==fresh.start() ) {
      // Wholly after the edit: use the old node itself
      set_pred(c,fresh._pred);
      if( c instanceof Nonterminal nt ) relink(nt);
      _P.resume(c,_P.state(),_P.scan());
      keep = c;
      _reused++;
    }
    Nonterminal par = c._par;
    if( par!=null && c._idx < par.nkids()-1 ) {
      // The old siblings following c parse the same way again: splice them
      set_pred(par.kid(c._idx+1),keep);
      PNode last = par.last();
      _P.resume(last,last._state.next(last._kind),last.end());
      _reused += par.nkids()-1-c._idx;
    }
    _cand = par;
  }

  // Set the stack predecessor of n and of its first-descendant chain
  private static void set_pred( PNode n, PNode pred ) {
    for( ; n!=null; n = n.nkids()==0 ? null : n.kid(0) )
      n._pred = pred;
  }
  // Make an old node's children a consistent stack history again; some of
  // them may have been spliced onto other nodes during this update.
  private static void relink( Nonterminal nt ) {
    nt.adopt();
    for( int i=1; i<nt.nkids(); i++ )
      if( nt.kid(i)._pred != nt.kid(i-1) )
        set_pred(nt.kid(i),nt.kid(i-1));
  }

  /** @return the last lexeme ending strictly before low, or null */
  static PNode last_valid( PNode n, int low ) {
    while( n!=null ) {
      if( n.isEmpty() || n.start() > low ) n = n._pred;
      else if( n.nkids() > 0 ) n = n.kid(last_kid_from(n,low));
      else if( n.end() >= low ) n = n._pred;
      else return n;
    }
    return null;
  }
  // Index of the last child starting at or before x; the first child must
  private static int last_kid_from( PNode n, int x ) {
    int lo=0, hi=n.nkids()-1;
    while( lo < hi ) {
      int mid = (lo+hi+1)>>>1;
      if( n.kid(mid).start() <= x ) lo = mid; else hi = mid-1;
    }
    return lo;
  }

  /** @return the first node, in tree order, past the lexemes up to high */
  static PNode first_potentially_valid( PNode n, int high ) {
    while( true ) {
      if( n.nkids()==0 ) {
        if( n.isEmpty() ) return null;
        PNode t = n;
        while( t!=null && t.start() <= high )
          t = next_tree(t);
        return t;
      }
      // First child ending at or after high
      int lo=0, hi=n.nkids();
      while( lo < hi ) {
        int mid = (lo+hi)>>>1;
        if( n.kid(mid).end() < high ) lo = mid+1; else hi = mid;
      }
      if( lo==n.nkids() ) return null;
      n = n.kid(lo);
    }
  }

  /** The next node in tree order: the following sibling's first lexeme, or
   *  the parent after its last child. */
  static PNode next_tree( PNode n ) {
    Nonterminal p = n._par;
    if( p==null ) return null;
    if( n._idx == p.nkids()-1 ) return p;
    return p.kid(n._idx+1).firstLeaf();
  }
}
