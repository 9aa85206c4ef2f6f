package com.cliffc.sexp.query;

import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.tree.Kind;
import com.cliffc.sexp.tree.PNode;
import com.cliffc.sexp.util.Ary;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;

/** Package registry for one document.
 *
 *  Starts with the standard packages; {@link #scan} adds what the document's
 *  top-level forms declare: {@code defpackage} makes packages,
 *  {@code in-package} changes the package in effect for the text after it, and
 *  {@code def*} forms intern the names they define.  Resolution is then a pure
 *  function of a name and a package.
 */
public class Packages {
  public static final String CL = "COMMON-LISP", CL_USER = "COMMON-LISP-USER", KEYWORD = "KEYWORD";

  // Standard operators and functions known to indentation and resolution
  static final String[] CL_SYMBOLS = {
    "DEFUN", "DEFMACRO", "DEFMETHOD", "DEFGENERIC", "DEFVAR", "DEFPARAMETER", "DEFCONSTANT",
    "DEFSTRUCT", "DEFCLASS", "DEFPACKAGE", "DEFTYPE", "DEFSETF", "DEFINE-CONDITION",
    "DEFINE-COMPILER-MACRO", "DEFINE-MODIFY-MACRO", "DEFINE-SYMBOL-MACRO", "IN-PACKAGE",
    "LAMBDA", "LET", "LET*", "FLET", "LABELS", "MACROLET", "SYMBOL-MACROLET",
    "PROGN", "PROG1", "PROG2", "PROG", "PROG*", "BLOCK", "RETURN-FROM", "RETURN", "TAGBODY", "GO",
    "IF", "WHEN", "UNLESS", "COND", "CASE", "ECASE", "CCASE", "TYPECASE", "ETYPECASE", "CTYPECASE",
    "AND", "OR", "NOT", "DO", "DO*", "DOLIST", "DOTIMES", "LOOP", "CATCH", "THROW", "UNWIND-PROTECT",
    "HANDLER-CASE", "HANDLER-BIND", "RESTART-CASE", "IGNORE-ERRORS", "EVAL-WHEN", "LOCALLY",
    "MULTIPLE-VALUE-BIND", "MULTIPLE-VALUE-LIST", "MULTIPLE-VALUE-PROG1", "DESTRUCTURING-BIND",
    "WITH-OPEN-FILE", "WITH-OPEN-STREAM", "WITH-OUTPUT-TO-STRING", "WITH-INPUT-FROM-STRING",
    "WITH-SLOTS", "WITH-ACCESSORS", "WITH-STANDARD-IO-SYNTAX", "PRINT-UNREADABLE-OBJECT",
    "QUOTE", "FUNCTION", "SETQ", "SETF", "PSETF", "INCF", "DECF", "PUSH", "POP", "PUSHNEW",
    "DECLARE", "DECLAIM", "THE", "FUNCALL", "APPLY", "VALUES",
    "CAR", "CDR", "CONS", "LIST", "LIST*", "APPEND", "REVERSE", "NTH", "NTHCDR", "FIRST", "REST",
    "SECOND", "THIRD", "LAST", "LENGTH", "MEMBER", "ASSOC", "MAPCAR", "MAPC", "MAPCAN", "REDUCE",
    "REMOVE", "REMOVE-IF", "DELETE", "FIND", "FIND-IF", "POSITION", "COUNT", "SORT", "SUBSEQ",
    "CONCATENATE", "COERCE", "ELT", "AREF", "GETHASH", "MAKE-HASH-TABLE", "MAKE-ARRAY",
    "EQ", "EQL", "EQUAL", "EQUALP", "NULL", "ATOM", "CONSP", "LISTP", "NUMBERP", "STRINGP", "SYMBOLP",
    "+", "-", "*", "/", "=", "<", ">", "<=", ">=", "1+", "1-", "MIN", "MAX", "MOD", "ABS",
    "FORMAT", "PRINT", "PRINC", "PRIN1", "TERPRI", "READ", "READ-LINE", "WRITE-STRING", "ERROR",
    "WARN", "SIGNAL", "ASSERT", "CHECK-TYPE", "MAKE-INSTANCE", "SLOT-VALUE", "CALL-NEXT-METHOD",
    "T", "NIL", "&OPTIONAL", "&REST", "&KEY", "&BODY", "&AUX", "&ALLOW-OTHER-KEYS",
  };

  private final HashMap<String,Pkg> _pkgs = new HashMap<>(); // By name and nickname
  private final Ary<PNode> _switch = new Ary<>(PNode.class); // in-package forms, in text order
  private final Ary<Pkg> _in = new Ary<>(Pkg.class);          // Package in effect before the first switch, then after each

  public Packages() {
    Pkg cl = define(CL);
    nickname(cl,"CL");
    for( String s : CL_SYMBOLS ) cl.intern(s);
    Pkg user = define(CL_USER);
    nickname(user,"CL-USER");
    user.use(cl);
    define(KEYWORD);
    _in.push(user);
  }

  /** @return the package named or nicknamed name, or null */
  public Pkg find( @NotNull String name ) { return _pkgs.get(name); }

  /** @return the package named name, made if missing */
  public Pkg define( @NotNull String name ) {
    return _pkgs.computeIfAbsent(name,Pkg::new);
  }
  void nickname( Pkg p, String nick ) {
    p._nicks.push(nick);
    _pkgs.putIfAbsent(nick,p);
  }

  /** @return the package in effect at offset */
  public Pkg packageAt( int offset ) {
    int i = _switch._len;
    while( i > 0 && _switch.at(i-1).end() > offset ) i--;
    return _in.at(i);
  }

  /** Resolve a symbol read from a token against the package in effect */
  public Sym resolve( @NotNull Sym s, @NotNull Pkg in ) {
    if( s.isKeyword() ) return s.resolved(find(KEYWORD));
    if( s._prefix != null ) {
      Pkg p = find(s._prefix);
      return s.resolved(p==null ? null : p.accessible(s._name));
    }
    return s.resolved(in.accessible(s._name));
  }
  public Sym resolve( @NotNull String text, @NotNull Pkg in ) { return resolve(Sym.read(text),in); }

  // --------------------------------------------------------------------------
  /** @return the registry for a document: standard packages plus the effects
   *  of its top-level forms, in text order */
  public static Packages scan( @NotNull PNode root, @NotNull Buffer buf ) {
    Packages P = new Packages();
    for( int i=0; i<root.nkids(); i++ )
      if( root.kid(i)._kind==Kind.LIST )
        P.declare(root.kid(i),buf);
    return P;
  }

  private void declare( PNode list, Buffer buf ) {
    Ary<PNode> es = Forms.formsIn(list);
    if( es._len < 2 || es.at(0)._kind!=Kind.TOKEN ) return;
    Pkg in = _in.last();
    Sym op = resolve(es.at(0).text(buf),in);
    String name = designator(es.at(1),buf);
    if( name==null ) return;
    switch( op.key() ) {
    case CL+":DEFPACKAGE" -> {
      Pkg p = define(name);
      for( int i=2; i<es._len; i++ )
        option(p,es.at(i),buf);
    }
    case CL+":IN-PACKAGE" -> {
      Pkg p = find(name);
      if( p!=null && p!=in ) { _switch.push(list); _in.push(p); }
    }
    default -> {
      if( !op._name.startsWith("DEF") || es.at(1)._kind!=Kind.TOKEN ) return;
      Sym def = Sym.read(es.at(1).text(buf));
      Pkg home = def._prefix==null ? in : find(def._prefix);
      if( home!=null ) home.intern(def._name);
    }
    }
  }

  // One (:option ...) clause of a defpackage
  private void option( Pkg p, PNode opt, Buffer buf ) {
    if( opt._kind!=Kind.LIST ) return;
    Ary<PNode> es = Forms.formsIn(opt);
    if( es.isEmpty() ) return;
    String o = designator(es.at(0),buf);
    if( o==null ) return;
    for( int i=1; i<es._len; i++ ) {
      String d = designator(es.at(i),buf);
      if( d==null ) continue;
      switch( o ) {
      case "USE" -> { Pkg u = find(d); if( u!=null ) p.use(u); }
      case "NICKNAMES" -> nickname(p,d);
      case "EXPORT", "INTERN", "SHADOW" -> p.intern(d);
      default -> { }
      }
    }
  }

  /** @return the name a string designator form stands for: a symbol's name
   *  (keyword, uninterned or plain) or a string's contents; null otherwise */
  static String designator( PNode n, Buffer buf ) {
    switch( n._kind ) {
    case TOKEN: return Sym.read(n.text(buf))._name;
    case UNINTERNED_FORM:
      Ary<PNode> fs = Forms.formsIn(n);
      return fs._len==1 ? designator(fs.at(0),buf) : null;
    case STRING:
      String s = n.text(buf);
      return s.substring(1,s.length()-1);
    default: return null;
    }
  }
}
