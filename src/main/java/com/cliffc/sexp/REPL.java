package com.cliffc.sexp;

import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.parse.Syntax;
import com.cliffc.sexp.query.Forms;
import com.cliffc.sexp.query.Indenter;
import com.cliffc.sexp.util.SB;

import java.util.Scanner;

/** Line-oriented edit shell over one buffer.  Every edit reparses
 *  incrementally.
 *  <pre>
 *  i OFF TEXT   insert TEXT at OFF; \n and \t escapes allowed
 *  d OFF LEN    delete LEN characters at OFF
 *  t            print the text
 *  p            print the tree
 *  n|b|u OFF    offset after moving forward, backward or up by expression
 *  ind OFF      indentation column of the line holding OFF
 *  </pre>
 */

public abstract class REPL {
  public static final String prompt="> ";
  static Syntax SYN;
  static Indenter IND;

  public static void go( ) {
    init("");
    Scanner stdin = new Scanner(System.in);
    while( stdin.hasNextLine() )
      go_one(stdin.nextLine());
  }

  static void init( String text ) {
    SYN = new Syntax(new Buffer(text));
    IND = new Indenter(SYN);
    SYN.update();
    System.out.print(prompt);
    System.out.flush();
  }

  static void go_one( String line ) {
    try {
      String rez = exec(line.trim());
      if( rez!=null ) System.out.println(rez);
    } catch( NoExpression | IndexOutOfBoundsException | NumberFormatException e ) {
      System.out.println("error: "+e.getMessage());
    }
    System.out.print(prompt);
    System.out.flush();
  }

  // Run one command, returning what to print
  private static String exec( String line ) {
    if( line.isEmpty() ) return null;
    String[] ws = line.split(" ",3);
    Buffer buf = SYN.buffer();
    switch( ws[0] ) {
    case "i":
      buf.insert(off(ws,1),ws.length > 2 ? unescape(ws[2]) : "");
      return reparsed();
    case "d":
      buf.delete(off(ws,1),off(ws,2));
      return reparsed();
    case "t": return new SB().pq(buf.toString()).toString();
    case "p": return SYN.root().str(new SB(),buf).unchar().toString();
    case "n": return Integer.toString(Forms.forward (SYN.root(),off(ws,1)));
    case "b": return Integer.toString(Forms.backward(SYN.root(),off(ws,1)));
    case "u": return Integer.toString(Forms.up      (SYN.root(),off(ws,1)));
    case "ind": return Integer.toString(IND.indentation(off(ws,1)));
    default: return "error: unknown command '"+ws[0]+"'";
    }
  }

  private static String reparsed() {
    SYN.update();
    return new SB().p(SYN._steps).p(" steps, ").p(SYN._reused).p(" reused").toString();
  }

  private static int off( String[] ws, int i ) {
    if( i >= ws.length ) throw new NumberFormatException("missing number");
    String s = i==2 && ws.length > 2 ? ws[2].trim() : ws[i];
    return Integer.parseInt(s);
  }

  private static String unescape( String s ) {
    return s.replace("\\n","\n").replace("\\t","\t");
  }
}
