package com.cliffc.sexp;

import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.parse.Syntax;
import com.cliffc.sexp.query.Indenter;
import com.cliffc.sexp.util.SB;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/** Incremental parsing of Lisp source text
 */

public abstract class SEXP {
  // Indentation tunables
  public static int TAB_WIDTH=8;      // Columns per tab stop
  public static int BODY_INDENT=2;    // Body forms, past the open paren
  public static int SPECIAL_INDENT=4; // Distinguished arguments, past the open paren

  public static void main( String[] args ) throws IOException {
    // Command line program
    if( args.length > 0 ) {
      String text = new String(Files.readAllBytes(Paths.get(args[0])),StandardCharsets.UTF_8);
      System.out.print(dump(text));
    } else {
      REPL.go();
    }
  }

  /** @return the parse tree of text, then the computed indentation of each line */
  public static String dump( String text ) {
    Syntax syn = new Syntax(new Buffer(text));
    Indenter ind = new Indenter(syn);
    SB sb = syn.root().str(new SB(),syn.buffer());
    int line=1;
    for( int x=0; x<=text.length(); x = syn.buffer().lineEnd(x)+1, line++ )
      sb.p(line).p(": ").p(ind.indentation(x)).nl();
    return sb.toString();
  }

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !SEXP.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
  public static int UID=-1;     // Used to breakpoint on a named node creation
}
