package com.cliffc.sexp.query;

import com.cliffc.sexp.NoExpression;
import com.cliffc.sexp.tree.PNode;
import com.cliffc.sexp.util.Ary;
import com.cliffc.sexp.util.AryInt;
import org.jetbrains.annotations.NotNull;

/** Expression-wise navigation over a parse tree.
 *
 *  Only form nodes count; comments, delimiters and parens are skipped.  Queries
 *  with no answer throw {@link NoExpression}.
 */
public abstract class Forms {

  /** @return the deepest form strictly containing offset */
  public static PNode enclosing( @NotNull PNode root, int offset ) {
    PNode f = around(root,offset);
    if( f==null ) throw NoExpression.around(offset);
    return f;
  }
  private static PNode around( PNode n, int offset ) {
    PNode best = null;
    while( true ) {
      PNode k = kid_around(n,offset);
      if( k==null ) return best;
      if( k.isForm() ) best = k;
      n = k;
    }
  }
  private static PNode kid_around( PNode n, int offset ) {
    for( int i=0; i<n.nkids(); i++ ) {
      PNode k = n.kid(i);
      if( k.start() < offset && offset < k.end() ) return k;
      if( k.start() >= offset ) break;
    }
    return null;
  }

  /** @return the first form starting at or after offset, inside the innermost
   *  form containing offset */
  public static PNode next( @NotNull PNode root, int offset ) {
    PNode f = after(root,offset);
    if( f==null ) throw NoExpression.after(offset);
    return f;
  }
  private static PNode after( PNode n, int offset ) {
    for( int i=0; i<n.nkids(); i++ ) {
      PNode k = n.kid(i);
      if( k.start() < offset && offset < k.end() ) {
        if( k.isForm() ) return k.nkids()==0 ? null : after(k,offset);
        if( k.nkids() > 0 ) return null; // Inside a comment
      }
      if( k.isForm() && offset <= k.start() ) return k;
    }
    return null;
  }

  /** @return the last form ending at or before offset, inside the innermost
   *  form containing offset */
  public static PNode previous( @NotNull PNode root, int offset ) {
    PNode f = before(root,offset);
    if( f==null ) throw NoExpression.before(offset);
    return f;
  }
  private static PNode before( PNode n, int offset ) {
    for( int i=n.nkids()-1; i>=0; i-- ) {
      PNode k = n.kid(i);
      if( k.start() < offset && offset < k.end() ) {
        if( k.isForm() ) return k.nkids()==0 ? null : before(k,offset);
        if( k.nkids() > 0 ) return null;
      }
      if( k.isForm() && k.end() <= offset ) return k;
    }
    return null;
  }

  /** @return end of the form after offset, else end of the enclosing form */
  public static int forward( @NotNull PNode root, int offset ) {
    PNode f = after(root,offset);
    if( f==null ) f = around(root,offset);
    if( f==null ) throw NoExpression.after(offset);
    return f.end();
  }
  /** @return start of the form before offset, else start of the enclosing form */
  public static int backward( @NotNull PNode root, int offset ) {
    PNode f = before(root,offset);
    if( f==null ) f = around(root,offset);
    if( f==null ) throw NoExpression.before(offset);
    return f.start();
  }

  /** @return start of the innermost compound form (list, string, quote...)
   *  strictly containing offset */
  public static int up( @NotNull PNode root, int offset ) {
    PNode best = null;
    for( PNode n=root, k; (k = kid_around(n,offset))!=null; n = k )
      if( k.isForm() && k.nkids() > 0 )
        best = k;
    if( best==null ) throw NoExpression.around(offset);
    return best.start();
  }

  /** @return the top-level form whose span holds offset */
  public static PNode topLevel( @NotNull PNode root, int offset ) {
    for( int i=0; i<root.nkids(); i++ ) {
      PNode k = root.kid(i);
      if( k.isForm() && k.start() <= offset && (offset < k.end() || k._kind._incomplete) )
        return k;
    }
    throw NoExpression.around(offset);
  }

  /** @return the form children of n, in order */
  public static Ary<PNode> formsIn( @NotNull PNode n ) {
    Ary<PNode> fs = new Ary<>(PNode.class);
    for( int i=0; i<n.nkids(); i++ )
      if( n.kid(i).isForm() )
        fs.push(n.kid(i));
    return fs;
  }

  /** True if offset is inside n.  Unclosed nodes only occur at the end of
   *  the text, and hold everything up to it. */
  public static boolean contains( PNode n, int offset ) {
    return n.start() < offset && (offset < n.end() || n._kind._incomplete);
  }

  /** @return child indices from root to the deepest node containing offset */
  public static AryInt path( @NotNull PNode root, int offset ) {
    AryInt path = new AryInt();
    PNode n = root;
    outer:
    while( true ) {
      for( int i=0; i<n.nkids(); i++ ) {
        if( contains(n.kid(i),offset) ) {
          path.push(i);
          n = n.kid(i);
          continue outer;
        }
      }
      return path;
    }
  }
  /** @return the node reached by following path from root */
  public static PNode at( @NotNull PNode root, AryInt path ) {
    PNode n = root;
    for( int i=0; i<path._len; i++ )
      n = n.kid(path.at(i));
    return n;
  }
}
