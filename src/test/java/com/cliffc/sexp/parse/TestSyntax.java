package com.cliffc.sexp.parse;

import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.tree.Nonterminal;
import com.cliffc.sexp.tree.PNode;
import com.cliffc.sexp.util.SB;
import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.*;

public class TestSyntax {
  // The incremental tree must equal a from-scratch parse of the same text
  private static void check( Syntax syn ) {
    Nonterminal root = syn.update();
    Buffer fresh = new Buffer(syn.buffer().toString());
    Nonterminal full = Parser.parse(fresh);
    if( !PNode.same_tree(full,root) )
      fail("incremental:\n"+root.str(new SB(),syn.buffer())+"full:\n"+full.str(new SB(),fresh));
    assertTrue(root.check());
    assertFalse(syn.buffer().modified());
  }

  @Test public void testReuseIdentity() {
    Buffer buf = new Buffer("(a b)");
    Syntax syn = new Syntax(buf);
    PNode list = syn.root().kid(0);
    PNode lp = list.kid(0), a = list.kid(1), b = list.kid(2), rp = list.kid(3);
    buf.insert(3,"b");
    Nonterminal root = syn.update();
    assertEquals("(a bb)",buf.toString());
    PNode list2 = root.kid(0);
    assertSame(lp,list2.kid(0));
    assertSame(a ,list2.kid(1));
    assertSame(rp,list2.kid(3));
    assertNotSame(b,list2.kid(2));
    assertEquals("bb",list2.kid(2).text(buf));
    assertSame(list2,rp._par);
    assertEquals(3,rp._idx);
    check(syn);
  }

  @Test public void testIdempotent() {
    Syntax syn = new Syntax(new Buffer("(defun f (x) ; doc\n  \"str\" (g 'x #'h))\n#| c |# |sym|"));
    Nonterminal r1 = syn.update();
    assertSame(r1,syn.update());  // Unedited: nothing to do
    Nonterminal r2 = syn.reparse();
    assertNotSame(r1,r2);
    assertTrue(PNode.same_tree(r1,r2));
  }

  @Test public void testWholeSubtreesReused() {
    Buffer buf = new Buffer("(x (a b) (c d))");
    Syntax syn = new Syntax(buf);
    PNode l = syn.root().kid(0), i1 = l.kid(2), i2 = l.kid(3);
    buf.delete(1,1);
    buf.insert(1,"yy");
    Nonterminal root = syn.update();
    assertSame(i1,root.kid(0).kid(2));
    assertSame(i2,root.kid(0).kid(3));
    assertNotSame(l,root.kid(0));
    check(syn);
  }

  @Test public void testStructuralEdits() {
    Buffer buf = new Buffer("(a (b) c)");
    Syntax syn = new Syntax(buf);
    buf.delete(3,1);              // (a b) c)
    check(syn);
    buf.insert(0,"\"");           // String swallows everything
    check(syn);
    buf.delete(0,1);
    check(syn);
    buf.insert(buf.size(),"\n;; tail");
    check(syn);
    buf.insert(1,"#|");           // Unclosed block comment
    check(syn);
    buf.insert(4,"|#");
    check(syn);
    buf.delete(0,buf.size());
    check(syn);
    assertTrue(syn.root().isEmpty());
    buf.insert(0,"'");
    check(syn);
  }

  @Test public void testSeveralEditsOneUpdate() {
    Buffer buf = new Buffer("(one) (two) (three) (four)");
    Syntax syn = new Syntax(buf);
    syn.update();
    buf.insert(2,"x");
    buf.delete(14,2);
    buf.insert(22,")(");
    check(syn);
  }

  @Test public void testLocalEditIsCheap() {
    SB sb = new SB();
    for( int i=0; i<500; i++ )
      sb.p("(defun f").p(i).p(" (x) (+ x ").p(i).p("))\n");
    Buffer buf = new Buffer(sb.toString());
    Syntax syn = new Syntax(buf);
    syn.update();
    assertTrue(syn._steps > 500*10);
    int off = buf.toString().indexOf("(+ x 250)")+3;
    buf.insert(off,"y");
    syn.update();
    assertTrue("steps "+syn._steps,syn._steps < 30);
    assertTrue(syn._reused > 0);
    check(syn);
  }

  private static final String[] SNIPPETS = {
    "(", ")", "(a b)", "\"", "\"s t\"", ";", "; c\n", "\n", " ", "#|", "|#", "|", "'", "`", ",", ",@",
    "#'", "#+", "#-", "#:", "#\\", "\\", "foo", "x", "12", "#x", "(let ((a 1)) a)",
  };

  // Random edits, each followed by an incremental update
  @Test public void testRandomEdits() {
    for( int seed=0; seed<20; seed++ ) {
      Random R = new Random(seed);
      Buffer buf = new Buffer("(defun f (x)\n  ;; doc\n  (let ((y \"s\")) (g 'x #'h `(,y ,@x))))\n#| c |# |sym| #+sbcl (a) #\\b\n");
      Syntax syn = new Syntax(buf);
      for( int i=0; i<200; i++ ) {
        edit(R,buf);
        if( R.nextInt(4)==0 ) edit(R,buf); // Sometimes two edits per update
        check(syn);
      }
    }
  }
  private static void edit( Random R, Buffer buf ) {
    int off = R.nextInt(buf.size()+1);
    if( R.nextBoolean() || buf.size() < 10 ) buf.insert(off,SNIPPETS[R.nextInt(SNIPPETS.length)]);
    else buf.delete(off,Math.min(R.nextInt(4)+1,buf.size()-off));
  }
}
