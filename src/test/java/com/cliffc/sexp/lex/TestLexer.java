package com.cliffc.sexp.lex;

import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.tree.Kind;
import com.cliffc.sexp.tree.Lexeme;
import com.cliffc.sexp.util.SB;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestLexer {
  // Lex all of text in one mode, printing KIND[text] per lexeme
  private static String lex( Mode mode, String text ) {
    Buffer buf = new Buffer(text);
    Lexer L = new Lexer(buf);
    SB sb = new SB();
    Lexeme l;
    for( int x=0; (l=L.next(mode,x))!=null; x = l.end() )
      sb.p(l._kind.name()).p('[').p(l.text(buf)).p("] ");
    return sb.toString().trim();
  }

  @Test public void testList() {
    assertEquals("LPAREN[(] TOKEN[foo] QUOTE['] TOKEN[bar] BACKQUOTE[`] LPAREN[(] TOKEN[a] COMMA[,] TOKEN[b] COMMA[,@] TOKEN[c] RPAREN[)] FUNCTION[#'] TOKEN[f] RPAREN[)]",
                 lex(Mode.LIST,"(foo 'bar `(a ,b ,@c) #'f)"));
    assertEquals("COMMA[,.] TOKEN[x]", lex(Mode.LIST,",.x"));
  }

  @Test public void testTopLevel() {
    // No closing paren outside a list
    assertEquals("TOKEN[a] ERROR[)] TOKEN[b]", lex(Mode.TOPLEVEL,"a ) b"));
    assertEquals("LINE_COMMENT_START[;;;] TOKEN[hi]", lex(Mode.TOPLEVEL,";;; hi"));
    assertEquals("STRING_START[\"] SYMBOL_START[|]", lex(Mode.TOPLEVEL,"\" |"));
    assertEquals("", lex(Mode.TOPLEVEL," \t\n\r\f"));
  }

  @Test public void testDispatch() {
    assertEquals("CHARACTER[#\\a] CHARACTER[#\\Space] CHARACTER[#\\(] READER_COND_POS[#+] TOKEN[sbcl] READER_COND_NEG[#-] TOKEN[x] UNINTERNED[#:] TOKEN[g] BLOCK_COMMENT_START[#|] ERROR[#x]",
                 lex(Mode.TOPLEVEL,"#\\a #\\Space #\\( #+sbcl #-x #:g #| #x"));
    assertEquals("ERROR[#] TOKEN[a]", lex(Mode.TOPLEVEL,"# a"));
    assertEquals("ERROR[#]", lex(Mode.TOPLEVEL,"#"));
    assertEquals("ERROR[#\\]", lex(Mode.TOPLEVEL,"#\\"));
  }

  @Test public void testTokens() {
    assertEquals("TOKEN[foo\\ bar] TOKEN[a#b] TOKEN[1.5e3] TOKEN[\\(x]",
                 lex(Mode.TOPLEVEL,"foo\\ bar a#b 1.5e3 \\(x"));
    assertEquals("TOKEN[ab] LPAREN[(] TOKEN[c] QUOTE[']", lex(Mode.TOPLEVEL,"ab(c'"));
  }

  @Test public void testString() {
    assertEquals("WORD[ab] DELIMITER[\\n] DELIMITER[(] WORD[c] DELIMITER[)] WORD[x] DELIMITER[;] WORD[y] STRING_END[\"]",
                 lex(Mode.STRING,"ab\\n(c) x;y\""));
    assertEquals("DELIMITER[\\\"] STRING_END[\"]", lex(Mode.STRING,"\\\"\""));
  }

  @Test public void testLineComment() {
    assertEquals("WORD[hello] DELIMITER[,] WORD[world] COMMENT_END[\n] WORD[foo]",
                 lex(Mode.LINE_COMMENT," hello, world\nfoo"));
    // Filler stops at the end of line
    Lexer L = new Lexer(new Buffer("   \n"));
    Lexeme l = L.next(Mode.LINE_COMMENT,0);
    assertEquals(Kind.COMMENT_END,l._kind);
    assertEquals(3,l.start());
    assertNull(L.next(Mode.LINE_COMMENT,4));
  }

  @Test public void testBlockComment() {
    assertEquals("WORD[a] BLOCK_COMMENT_START[#|] WORD[b] BLOCK_COMMENT_END[|#] WORD[c]",
                 lex(Mode.BLOCK_COMMENT,"a #| b |# c"));
    assertEquals("WORD[x] DELIMITER[|] WORD[y] DELIMITER[#] WORD[z]", lex(Mode.BLOCK_COMMENT,"x|y#z"));
  }

  @Test public void testEscapedSymbol() {
    assertEquals("TEXT[ab c\\|d] SYMBOL_END[|]", lex(Mode.ESCAPED_SYMBOL,"ab c\\|d|"));
    // An unclosed run stops at the end of line
    assertEquals("TEXT[ab] TEXT[ cd] SYMBOL_END[|]", lex(Mode.ESCAPED_SYMBOL,"ab\n cd|"));
  }

  @Test public void testErrorMode() {
    assertEquals("ERROR[junk here] ERROR[more]", lex(Mode.ERROR,"  junk here\nmore"));
  }

  @Test public void testStartMark() {
    Buffer buf = new Buffer("  foo");
    Lexeme l = new Lexer(buf).next(Mode.TOPLEVEL,0);
    assertEquals(2,l.start());
    assertEquals(5,l.end());
    buf.insert(2,"x");            // Left-sticky: text inserted at the start lands before it
    assertEquals(2,l.start());
    buf.insert(0,"y");
    assertEquals(3,l.start());
    assertEquals("xfo",l.text(buf)); // Stale until relexed
  }

  @Test public void testClasses() {
    assertTrue (Lexer.isConstituent('a'));
    assertTrue (Lexer.isConstituent('-'));
    assertTrue (Lexer.isConstituent('λ'));
    assertFalse(Lexer.isConstituent('('));
    assertFalse(Lexer.isConstituent('#'));
    assertFalse(Lexer.isConstituent('\f'));
    assertTrue (Lexer.isWS('\r'));
  }
}
