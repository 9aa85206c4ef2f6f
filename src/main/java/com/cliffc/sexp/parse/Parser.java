package com.cliffc.sexp.parse;

import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.lex.Lexer;
import com.cliffc.sexp.tree.Kind;
import com.cliffc.sexp.tree.Lexeme;
import com.cliffc.sexp.tree.Nonterminal;
import com.cliffc.sexp.tree.PNode;
import com.cliffc.sexp.util.Ary;
import org.jetbrains.annotations.NotNull;

/** Shift-reduce driver for the {@link State} automaton.
 *
 *  The parse stack is not a separate structure: it is the top node and its
 *  chain of {@link PNode#_pred} links.  Parsing can therefore restart from any
 *  lexeme of an earlier tree by making it the top again, see {@link #resume}.
 *
 *  {@link #step} performs exactly one action, so a caller can inspect the top
 *  of the stack between actions.
 */
public class Parser {
  final Buffer _buf;
  final Lexer _lexer;
  PNode _top;                   // Parse stack top
  State _state;                 // Current automaton state
  int _scan;                    // Lexing resumes here
  public int _steps;            // Actions taken, for stats

  public Parser( @NotNull Buffer buf ) {
    _buf = buf;
    _lexer = new Lexer(buf);
    resume(null,State.INITIAL,0);
  }

  /** Parse the whole buffer from scratch */
  public static Nonterminal parse( @NotNull Buffer buf ) {
    Parser P = new Parser(buf);
    while( P.step() ) ;
    return (Nonterminal)P._top;
  }

  /** Continue parsing with top as the stack top, in state, lexing at scan */
  public void resume( PNode top, @NotNull State state, int scan ) {
    _top = top;
    _state = state;
    _scan = scan;
  }

  public PNode top() { return _top; }
  public State state() { return _state; }
  public int scan() { return _scan; }

  /** Perform one action: a reduction, a shift, or the end-of-input reduction.
   *  @return false when the parse is finished, with the top sequence on top */
  public boolean step() {
    _steps++;
    if( _state.reduces() ) { reduce(_state._reduce); return true; }
    Lexeme lex = _lexer.next(_state._mode,_scan);
    if( lex!=null ) {
      push(lex);
      _scan = lex.end();
      return true;
    }
    if( _state._eof==null ) return false;
    reduce(_state._eof);
    return true;
  }

  // Push n in the current state, and go to the next
  private void push( PNode n ) {
    n._state = _state;
    n._pred = _top;
    _top = n;
    _state = _state.next(n._kind);
  }

  private void reduce( Kind kind ) {
    State st = _state;
    Ary<PNode> kids = new Ary<>(PNode.class);
    while( _top != null ) {
      PNode n = _top;
      kids.push(n);
      _top = n._pred;
      if( st.opener(n) ) break;
    }
    kids.reverse();
    // An empty reduction has no children to take its position from
    Nonterminal nt = new Nonterminal(kind,kids,kids.isEmpty() ? _buf.mark(_scan,false) : null);
    if( !kids.isEmpty() ) _state = kids.at(0)._state;
    push(nt);
  }
}
