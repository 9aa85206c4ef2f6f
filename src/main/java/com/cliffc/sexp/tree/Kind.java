package com.cliffc.sexp.tree;

import static com.cliffc.sexp.tree.Kind.B.*;

/** Kind tag of every parse-tree node: the lexemes the lexer makes and the
 *  nonterminals the parser reduces to. */
public enum Kind {
  // Lexemes
  LPAREN             (LEX),
  RPAREN             (LEX),
  QUOTE              (LEX),       // '
  BACKQUOTE          (LEX),       // `
  COMMA              (LEX),       // , ,@ ,.
  FUNCTION           (LEX),       // #'
  STRING_START       (LEX),
  STRING_END         (LEX),
  LINE_COMMENT_START (LEX),       // run of ;
  COMMENT_END        (LEX),       // end of line closing a line comment
  BLOCK_COMMENT_START(LEX),       // #|
  BLOCK_COMMENT_END  (LEX),       // |#
  SYMBOL_START       (LEX),       // | opening an escaped symbol
  SYMBOL_END         (LEX),
  WORD               (LEX),       // constituent run inside strings and comments
  TEXT               (LEX),       // escaped symbol body
  DELIMITER          (LEX),
  TOKEN              (LEX|FORM),
  CHARACTER          (LEX|FORM),  // #\x
  READER_COND_POS    (LEX),       // #+
  READER_COND_NEG    (LEX),       // #-
  UNINTERNED         (LEX),       // #:
  ERROR              (LEX),

  // Nonterminals
  LIST                    (FORM),
  INCOMPLETE_LIST         (FORM|INC),
  STRING                  (FORM),
  INCOMPLETE_STRING       (FORM|INC),
  LINE_COMMENT            (CMNT),
  BLOCK_COMMENT           (CMNT),
  INCOMPLETE_BLOCK_COMMENT(CMNT|INC),
  SYMBOL                  (FORM),
  INCOMPLETE_SYMBOL       (FORM|INC),
  QUOTE_FORM              (FORM),
  BACKQUOTE_FORM          (FORM),
  COMMA_FORM              (FORM),
  FUNCTION_FORM           (FORM),
  READER_COND_POS_FORM    (FORM),
  READER_COND_NEG_FORM    (FORM),
  UNINTERNED_FORM         (FORM),
  ERROR_FORM              (FORM),
  TOP_SEQUENCE            (0);

  // Flag bits; nested so the constants above can name them
  static final class B { static final int LEX=1, FORM=2, CMNT=4, INC=8; }

  public final boolean _lexeme;     // Terminal, made by the lexer
  public final boolean _form;       // Counts as a form wherever one is expected
  public final boolean _comment;    // Skipped wherever a form is expected
  public final boolean _incomplete; // Force-reduced at end of input
  Kind( int flags ) {
    _lexeme     = (flags&LEX )!=0;
    _form       = (flags&FORM)!=0;
    _comment    = (flags&CMNT)!=0;
    _incomplete = (flags&INC )!=0;
  }

  public boolean isList  () { return this==LIST   || this==INCOMPLETE_LIST  ; }
  public boolean isString() { return this==STRING || this==INCOMPLETE_STRING; }
  public boolean isSymbol() { return this==SYMBOL || this==INCOMPLETE_SYMBOL; }
  public boolean isBlockComment() { return this==BLOCK_COMMENT || this==INCOMPLETE_BLOCK_COMMENT; }
  /** @return a prefix form, quote-like or reader conditional, wrapping other forms */
  public boolean isPrefix() {
    return switch( this ) {
    case QUOTE_FORM, BACKQUOTE_FORM, COMMA_FORM, FUNCTION_FORM,
      READER_COND_POS_FORM, READER_COND_NEG_FORM, UNINTERNED_FORM -> true;
    default -> false;
    };
  }
}
