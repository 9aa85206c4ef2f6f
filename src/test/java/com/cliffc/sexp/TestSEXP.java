package com.cliffc.sexp;

import org.junit.Test;

import static org.junit.Assert.assertTrue;

public class TestSEXP {
  @Test public void testDump() {
    String dump = SEXP.dump("(defun f ()\nx)\n");
    assertTrue(dump, dump.startsWith("TOP_SEQUENCE 0..14\n  LIST 0..14\n    LPAREN 0..1 \"(\"\n"));
    assertTrue(dump, dump.endsWith("1: 0\n2: 2\n3: 0\n"));
  }

  @Test public void testDumpEmpty() {
    assertTrue(SEXP.dump("").endsWith("TOP_SEQUENCE 0..0\n1: 0\n"));
  }
}
