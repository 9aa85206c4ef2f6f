package com.cliffc.sexp.buffer;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestBuffer {
  @Test public void testInsertMovesMarks() {
    Buffer buf = new Buffer("abcdef");
    Mark l = buf.mark(3,false), r = buf.mark(3,true), after = buf.mark(5,false), before = buf.mark(1,true);
    buf.insert(3,"XY");
    assertEquals("abcXYdef",buf.toString());
    assertEquals(3,l.offset());       // Left-sticky stays before inserted text
    assertEquals(5,r.offset());       // Right-sticky moves past it
    assertEquals(7,after.offset());
    assertEquals(1,before.offset());
  }

  @Test public void testDeleteCollapsesMarks() {
    Buffer buf = new Buffer("abcdefgh");
    Mark in = buf.mark(4,false), end = buf.mark(5,true), past = buf.mark(7,false), pre = buf.mark(2,false);
    buf.delete(2,3);
    assertEquals("abfgh",buf.toString());
    assertEquals(2,in.offset());
    assertEquals(2,end.offset());     // Exactly at the end of the span: shifted onto its start
    assertEquals(4,past.offset());
    assertEquals(2,pre.offset());
  }

  @Test public void testModifiedRegion() {
    Buffer buf = new Buffer("hello world");
    assertTrue(buf.modified());
    assertEquals(0,buf.low());
    assertEquals(11,buf.high());
    buf.clearModified();
    assertFalse(buf.modified());
    buf.insert(5,",");
    assertTrue(buf.modified());
    assertEquals(5,buf.low());
    assertEquals(6,buf.high());
    buf.delete(0,1);                 // Region grows to cover both edits
    assertEquals(0,buf.low());
    assertEquals(5,buf.high());
    buf.clearModified();
    buf.delete(3,2);
    assertEquals(3,buf.low());
    assertEquals(3,buf.high());
  }

  @Test public void testMarkMotion() {
    Buffer buf = new Buffer("ab\n\tcd");
    Mark m = buf.mark(0,false);
    assertTrue(m.atStart());
    assertTrue(m.atLineStart());
    assertEquals('a',m.at());
    m.advance(2);
    assertTrue(m.atLineEnd());
    m.advance();
    assertTrue(m.atLineStart());
    m.advance();
    assertEquals(8,m.column());       // Past one tab
    assertEquals(3,m.lineStart());
    Mark r = m.clone(true);
    assertTrue(r._right);
    assertEquals(0,r.compareTo(m));
    r.advance(2);
    assertTrue(r.atEnd());
    assertTrue(m.compareTo(r) < 0);
    assertEquals(0,m.retreat(4).offset());
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testBadOffset() {
    new Buffer("abc").insert(4,"x");
  }

  @Test public void testReplace() {
    Buffer buf = new Buffer("old text");
    Mark m = buf.mark(4,false);
    buf.clearModified();
    buf.replace("new");
    assertEquals("new",buf.toString());
    assertEquals(0,m.offset());
    assertEquals(0,buf.low());
    assertEquals(3,buf.high());
    assertEquals(3,buf.lineEnd(1));
    assertEquals(0,buf.lineStart(2));
  }
}
