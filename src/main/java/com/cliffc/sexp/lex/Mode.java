package com.cliffc.sexp.lex;

/** Lexical context; picks the lexeme kinds recognized and the filler skipped
 *  ahead of each lexeme. */
public enum Mode {
  TOPLEVEL,
  LIST,                 // TOPLEVEL plus the closing paren
  STRING,
  LINE_COMMENT,         // Filler never crosses a line end
  BLOCK_COMMENT,
  ESCAPED_SYMBOL,       // Filler is line ends only
  ERROR                 // Rest of the line is one error lexeme
}
