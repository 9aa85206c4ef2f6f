package com.cliffc.sexp.query;

import com.cliffc.sexp.NoExpression;
import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.parse.Parser;
import com.cliffc.sexp.tree.Kind;
import com.cliffc.sexp.tree.Nonterminal;
import com.cliffc.sexp.tree.PNode;
import com.cliffc.sexp.util.AryInt;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestForms {
  private static final String TEXT = "(foo (bar 1) \"s\") ; c\n'baz";
  private final Buffer _buf = new Buffer(TEXT);
  private final Nonterminal _root = Parser.parse(_buf);

  private String text( PNode n ) { return n.text(_buf); }

  @Test public void testEnclosing() {
    assertEquals("(foo (bar 1) \"s\")",text(Forms.enclosing(_root,4)));
    assertEquals("foo",text(Forms.enclosing(_root,3)));
    assertEquals("bar",text(Forms.enclosing(_root,7)));     // Inside a token
    assertEquals("(bar 1)",text(Forms.enclosing(_root,10)));
    assertEquals("(foo (bar 1) \"s\")",text(Forms.enclosing(_root,5))); // Right at "(bar": not strictly inside
    try { Forms.enclosing(_root,0); fail(); } catch( NoExpression e ) { assertEquals(0,e._offset); }
  }

  @Test public void testNextPrevious() {
    assertEquals("foo",text(Forms.next(_root,1)));
    assertEquals("(bar 1)",text(Forms.next(_root,4)));
    assertEquals("\"s\"",text(Forms.next(_root,12)));
    assertEquals("'baz",text(Forms.next(_root,17)));        // Skips the comment
    assertEquals("(bar 1)",text(Forms.previous(_root,13)));
    assertEquals("(foo (bar 1) \"s\")",text(Forms.previous(_root,22)));
    try { Forms.previous(_root,0); fail(); } catch( NoExpression e ) { assertTrue(e.getMessage().contains("before")); }
    try { Forms.next(_root,TEXT.length()); fail(); } catch( NoExpression e ) { assertTrue(e.getMessage().contains("after")); }
  }

  @Test public void testForwardBackward() {
    assertEquals(17,Forms.forward(_root,0));
    assertEquals(12,Forms.forward(_root,4));
    assertEquals(9,Forms.forward(_root,7));       // Inside bar: to its end
    assertEquals(17,Forms.forward(_root,16));     // Nothing left in the list: past its end
    assertEquals(0,Forms.backward(_root,17));
    assertEquals(5,Forms.backward(_root,12));
    assertEquals(1,Forms.backward(_root,2));      // Start of foo
    assertEquals(0,Forms.backward(_root,1));      // Nothing before: start of the list
  }

  @Test public void testUpAndTopLevel() {
    assertEquals(5,Forms.up(_root,7));
    assertEquals(0,Forms.up(_root,4));
    try { Forms.up(_root,19); fail(); } catch( NoExpression e ) { }
    assertEquals("(foo (bar 1) \"s\")",text(Forms.topLevel(_root,0)));
    assertEquals("'baz",text(Forms.topLevel(_root,23)));
    try { Forms.topLevel(_root,18); fail(); } catch( NoExpression e ) { }
  }

  @Test public void testFormsIn() {
    PNode list = _root.kid(0);
    assertEquals(3,Forms.formsIn(list)._len);
    assertEquals(2,Forms.formsIn(_root)._len);
    assertSame(Kind.QUOTE_FORM,Forms.formsIn(_root).at(1)._kind);
  }

  @Test public void testPath() {
    AryInt path = Forms.path(_root,8);
    assertArrayEquals(new int[]{0,2,1},path.asAry());    // List, (bar 1), bar
    assertEquals("(bar 1)",text(Forms.at(_root,new AryInt(new int[]{0,2},2))));
    assertTrue(Forms.path(_root,0).isEmpty());
    // An unclosed list holds the end of the text
    Buffer buf = new Buffer("(a (b");
    Nonterminal root = Parser.parse(buf);
    assertArrayEquals(new int[]{0,2},Forms.path(root,5).asAry());
  }
}
