package com.cliffc.sexp.parse;

import com.cliffc.sexp.lex.Mode;
import com.cliffc.sexp.tree.Kind;
import com.cliffc.sexp.tree.PNode;

/** Parser automaton states.
 *
 *  A state either reduces unconditionally, without looking at the input, or
 *  lexes one lexeme in its mode and shifts it.  At end of input a lexing state
 *  reduces its end-of-input rule; {@link #DONE} instead finishes the parse.
 *  The goto function {@link #next} is total: anything unexpected goes to
 *  {@link #ERROR}, which wraps the offending node in an error form.
 *
 *  A reduction pops the parse stack up to and including the lexeme that opened
 *  the rule ({@code _until}).  The top sequence pops the whole stack; the error
 *  state pops one node.
 */
public enum State {
  //                 lexing mode          reduce                    end of input                   popped through
  INITIAL           (Mode.TOPLEVEL      , null                    , Kind.TOP_SEQUENCE            , null),
  DONE              (Mode.ERROR         , null                    , null                         , null),
  ERROR             (null               , Kind.ERROR_FORM         , null                         , null),
  LIST              (Mode.LIST          , null                    , Kind.INCOMPLETE_LIST         , Kind.LPAREN),
  LIST_DONE         (null               , Kind.LIST               , null                         , Kind.LPAREN),
  STRING_BODY       (Mode.STRING        , null                    , Kind.INCOMPLETE_STRING       , Kind.STRING_START),
  STRING_DONE       (null               , Kind.STRING             , null                         , Kind.STRING_START),
  LINE_COMMENT_BODY (Mode.LINE_COMMENT  , null                    , Kind.LINE_COMMENT            , Kind.LINE_COMMENT_START),
  LINE_COMMENT_DONE (null               , Kind.LINE_COMMENT       , null                         , Kind.LINE_COMMENT_START),
  BLOCK_COMMENT_BODY(Mode.BLOCK_COMMENT , null                    , Kind.INCOMPLETE_BLOCK_COMMENT, Kind.BLOCK_COMMENT_START),
  BLOCK_COMMENT_DONE(null               , Kind.BLOCK_COMMENT      , null                         , Kind.BLOCK_COMMENT_START),
  SYMBOL_BODY       (Mode.ESCAPED_SYMBOL, null                    , Kind.INCOMPLETE_SYMBOL       , Kind.SYMBOL_START),
  SYMBOL_DONE       (null               , Kind.SYMBOL             , null                         , Kind.SYMBOL_START),
  // Prefix forms.  Running out of input before the wrapped form is an error.
  QUOTE             (Mode.TOPLEVEL      , null                    , Kind.ERROR_FORM              , Kind.QUOTE),
  QUOTE_DONE        (null               , Kind.QUOTE_FORM         , null                         , Kind.QUOTE),
  BACKQUOTE         (Mode.TOPLEVEL      , null                    , Kind.ERROR_FORM              , Kind.BACKQUOTE),
  BACKQUOTE_DONE    (null               , Kind.BACKQUOTE_FORM     , null                         , Kind.BACKQUOTE),
  COMMA             (Mode.TOPLEVEL      , null                    , Kind.ERROR_FORM              , Kind.COMMA),
  COMMA_DONE        (null               , Kind.COMMA_FORM         , null                         , Kind.COMMA),
  FUNCTION          (Mode.TOPLEVEL      , null                    , Kind.ERROR_FORM              , Kind.FUNCTION),
  FUNCTION_DONE     (null               , Kind.FUNCTION_FORM      , null                         , Kind.FUNCTION),
  UNINTERNED        (Mode.TOPLEVEL      , null                    , Kind.ERROR_FORM              , Kind.UNINTERNED),
  UNINTERNED_DONE   (null               , Kind.UNINTERNED_FORM    , null                         , Kind.UNINTERNED),
  // Reader conditionals take a feature expression, then a form
  COND_POS          (Mode.TOPLEVEL      , null                    , Kind.ERROR_FORM              , Kind.READER_COND_POS),
  COND_POS_1        (Mode.TOPLEVEL      , null                    , Kind.ERROR_FORM              , Kind.READER_COND_POS),
  COND_POS_DONE     (null               , Kind.READER_COND_POS_FORM, null                        , Kind.READER_COND_POS),
  COND_NEG          (Mode.TOPLEVEL      , null                    , Kind.ERROR_FORM              , Kind.READER_COND_NEG),
  COND_NEG_1        (Mode.TOPLEVEL      , null                    , Kind.ERROR_FORM              , Kind.READER_COND_NEG),
  COND_NEG_DONE     (null               , Kind.READER_COND_NEG_FORM, null                        , Kind.READER_COND_NEG);

  public final Mode _mode;      // Lexing mode; null for reduce states
  public final Kind _reduce;    // Unconditional reduction, or null
  public final Kind _eof;       // Reduction at end of input, or null
  final Kind _until;            // Opener lexeme ending the pops
  State( Mode mode, Kind reduce, Kind eof, Kind until ) {
    assert (mode==null) == (reduce!=null);
    _mode = mode;  _reduce = reduce;  _eof = eof;  _until = until;
  }

  public boolean reduces() { return _reduce!=null; }

  /** @return true once popping n completes a reduction made in this state */
  boolean opener( PNode n ) {
    if( this==ERROR ) return true;
    if( _until==null ) return false;
    // Markers shifted inside a block comment do not open anything
    return n._kind==_until && (_until!=Kind.BLOCK_COMMENT_START || n._state!=BLOCK_COMMENT_BODY);
  }

  /** Goto: the state after pushing a node of kind k while in this state */
  public State next( Kind k ) {
    return switch( this ) {
    case INITIAL, LIST, QUOTE, BACKQUOTE, COMMA, FUNCTION, UNINTERNED,
      COND_POS, COND_POS_1, COND_NEG, COND_NEG_1 -> form_next(k);
    case STRING_BODY -> switch( k ) {
      case WORD, DELIMITER -> STRING_BODY;
      case STRING_END -> STRING_DONE;
      default -> ERROR;
      };
    case LINE_COMMENT_BODY -> switch( k ) {
      case WORD, DELIMITER -> LINE_COMMENT_BODY;
      case COMMENT_END -> LINE_COMMENT_DONE;
      default -> ERROR;
      };
    case BLOCK_COMMENT_BODY -> switch( k ) {
      case WORD, DELIMITER, BLOCK_COMMENT_START -> BLOCK_COMMENT_BODY;
      case BLOCK_COMMENT_END -> BLOCK_COMMENT_DONE;
      default -> ERROR;
      };
    case SYMBOL_BODY -> switch( k ) {
      case TEXT -> SYMBOL_BODY;
      case SYMBOL_END -> SYMBOL_DONE;
      default -> ERROR;
      };
    default -> ERROR;
    };
  }

  // Goto from a state expecting a form
  private State form_next( Kind k ) {
    if( k==Kind.TOP_SEQUENCE ) return this==INITIAL ? DONE : ERROR;
    if( k==Kind.RPAREN ) return this==LIST ? LIST_DONE : ERROR;
    if( k._form ) return after_form();
    if( k._comment ) return this; // Comments are skipped where forms are expected
    return switch( k ) {
    case LPAREN              -> LIST;
    case STRING_START        -> STRING_BODY;
    case LINE_COMMENT_START  -> LINE_COMMENT_BODY;
    case BLOCK_COMMENT_START -> BLOCK_COMMENT_BODY;
    case SYMBOL_START        -> SYMBOL_BODY;
    case QUOTE               -> QUOTE;
    case BACKQUOTE           -> BACKQUOTE;
    case COMMA               -> COMMA;
    case FUNCTION            -> FUNCTION;
    case UNINTERNED          -> UNINTERNED;
    case READER_COND_POS     -> COND_POS;
    case READER_COND_NEG     -> COND_NEG;
    default                  -> ERROR;
    };
  }

  private State after_form() {
    return switch( this ) {
    case QUOTE      -> QUOTE_DONE;
    case BACKQUOTE  -> BACKQUOTE_DONE;
    case COMMA      -> COMMA_DONE;
    case FUNCTION   -> FUNCTION_DONE;
    case UNINTERNED -> UNINTERNED_DONE;
    case COND_POS   -> COND_POS_1;
    case COND_POS_1 -> COND_POS_DONE;
    case COND_NEG   -> COND_NEG_1;
    case COND_NEG_1 -> COND_NEG_DONE;
    default         -> this;  // INITIAL and LIST take any number
    };
  }
}
