package com.cliffc.sexp.query;

import com.cliffc.sexp.SEXP;
import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.parse.Syntax;
import com.cliffc.sexp.tree.Kind;
import com.cliffc.sexp.tree.Nonterminal;
import com.cliffc.sexp.tree.PNode;
import com.cliffc.sexp.util.Ary;
import com.cliffc.sexp.util.AryInt;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;

/** Line indentation from the parse tree.
 *
 *  The line is placed by the innermost node holding its start.  In a list the
 *  operator decides: operators with a body rule indent their first N
 *  arguments by {@link SEXP#SPECIAL_INDENT} and the rest by
 *  {@link SEXP#BODY_INDENT}; binding forms line up their bindings; any other
 *  known operator aligns arguments under the first argument, and an unknown
 *  one under the operator.
 */
public class Indenter {
  // Resolved operator name to count of distinguished arguments
  private static final HashMap<String,Integer> RULES = new HashMap<>();
  // Operators whose first argument is a binding list, LET style or FLET style
  private static final HashMap<String,Boolean> BINDERS = new HashMap<>();
  static {
    String[] zero = {"PROGN","TAGBODY","LOCALLY"};
    String[] one  = {"LET","LET*","FLET","LABELS","MACROLET","SYMBOL-MACROLET","WHEN","UNLESS",
                     "DOLIST","DOTIMES","LAMBDA","BLOCK","CATCH","PROG1","UNWIND-PROTECT",
                     "CASE","ECASE","CCASE","TYPECASE","ETYPECASE","CTYPECASE","EVAL-WHEN",
                     "HANDLER-CASE","HANDLER-BIND","DEFPACKAGE","DEFSTRUCT","WITH-OPEN-FILE",
                     "WITH-OPEN-STREAM","WITH-OUTPUT-TO-STRING","WITH-INPUT-FROM-STRING",
                     "PRINT-UNREADABLE-OBJECT","PROG2"};
    String[] two  = {"DEFUN","DEFMACRO","DEFMETHOD","DEFGENERIC","DEFCLASS","DEFTYPE",
                     "DEFINE-CONDITION","DEFINE-COMPILER-MACRO","DO","DO*","PROG","PROG*",
                     "MULTIPLE-VALUE-BIND","DESTRUCTURING-BIND","WITH-SLOTS","WITH-ACCESSORS"};
    for( String s : zero ) rule(Packages.CL+":"+s,0);
    for( String s : one  ) rule(Packages.CL+":"+s,1);
    for( String s : two  ) rule(Packages.CL+":"+s,2);
    for( String s : new String[]{"LET","LET*","SYMBOL-MACROLET"} ) BINDERS.put(Packages.CL+":"+s,false);
    for( String s : new String[]{"FLET","LABELS","MACROLET"}    ) BINDERS.put(Packages.CL+":"+s,true );
  }

  /** Add or change a body rule.
   *  @param name resolved operator name, PACKAGE:NAME
   *  @param nspecial count of distinguished arguments */
  public static void rule( @NotNull String name, int nspecial ) { RULES.put(name,nspecial); }

  private final Syntax _syn;
  private Nonterminal _root;    // Tree the packages below were scanned from
  private Packages _pkgs;

  public Indenter( @NotNull Syntax syn ) { _syn = syn; }

  /** @return the packages of the current tree, rescanned when the tree changes */
  public Packages packages() {
    Nonterminal root = _syn.root();
    if( root != _root ) { _root = root; _pkgs = Packages.scan(root,_syn.buffer()); }
    return _pkgs;
  }

  /** @return the symbol a token node reads as, resolved where it stands */
  public Sym resolve( @NotNull PNode token ) {
    Packages P = packages();
    return P.resolve(token.text(_syn.buffer()),P.packageAt(token.start()));
  }

  /** @return the column the line holding offset should start at */
  public int indentation( int offset ) {
    Nonterminal root = _syn.root();
    Buffer buf = _syn.buffer();
    int ls = buf.lineStart(offset);
    AryInt path = Forms.path(root,ls);
    if( path.isEmpty() ) return 0; // Top level
    PNode n = Forms.at(root,path);
    Kind k = n._kind;
    if( k.isList() ) return list(n,ls,buf);
    if( k.isPrefix() ) {
      // Line after a reader conditional's feature lines up with the conditional
      if( k==Kind.READER_COND_POS_FORM || k==Kind.READER_COND_NEG_FORM ) return col(n);
      return col(n)+n.kid(0).length();
    }
    // Strings, comments, escaped symbols: the text decides
    return current(ls,buf);
  }

  private int list( PNode list, int ls, Buffer buf ) {
    int col = col(list);
    Ary<PNode> es = Forms.formsIn(list);
    int k = 0;                  // Count of elements before the line
    while( k < es._len && es.at(k).start() < ls ) k++;
    if( k==0 ) return col+1;
    PNode e0 = es.at(0);
    PNode par = list._par;
    // Quoted data
    if( par!=null && (par._kind==Kind.QUOTE_FORM || par._kind==Kind.BACKQUOTE_FORM) )
      return col(e0);
    // Binding lists and single bindings
    Boolean style = binder(par,list);
    if( style != null ) return col(e0);     // Under the first binding
    if( par!=null && (style = binder(par._par,par)) != null )
      return style ? body(col,k,1) : col+1; // Inside one binding
    if( e0._kind!=Kind.TOKEN ) return col(e0);
    Sym op = resolve(e0);
    if( !op._found ) return col(e0);
    Integer n = RULES.get(op.key());
    if( n != null ) return body(col,k,n);
    // Plain call: under the first argument if it shares the operator's line
    if( k >= 2 && buf.lineStart(es.at(1).start())==buf.lineStart(e0.start()) )
      return col(es.at(1));
    return col(e0);
  }

  // The line's element is argument k-1; the first n arguments are distinguished
  private static int body( int col, int k, int n ) {
    return col + (k <= n ? SEXP.SPECIAL_INDENT : SEXP.BODY_INDENT);
  }

  /** If list is the binding list of a binding operator, true for FLET-style
   *  and false for LET-style; else null. */
  private Boolean binder( PNode op, PNode list ) {
    if( op==null || !op._kind.isList() || !list._kind.isList() ) return null;
    Ary<PNode> es = Forms.formsIn(op);
    if( es._len < 2 || es.at(1)!=list || es.at(0)._kind!=Kind.TOKEN ) return null;
    return BINDERS.get(resolve(es.at(0)).key());
  }

  private int col( PNode n ) { return _syn.buffer().column(n.start(),SEXP.TAB_WIDTH); }
  // Column of the first non-blank on the line
  private static int current( int ls, Buffer buf ) {
    int x = ls;
    while( x < buf.size() && (buf.charAt(x)==' ' || buf.charAt(x)=='\t') ) x++;
    return buf.column(x,SEXP.TAB_WIDTH);
  }
}
