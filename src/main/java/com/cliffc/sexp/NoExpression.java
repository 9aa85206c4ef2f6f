package com.cliffc.sexp;

/** Signalled by structural navigation when no form answers the query, e.g.
 *  asking for the previous form at the start of the document. */
public class NoExpression extends RuntimeException {
  public final int _offset;     // Offset the query was made at
  public NoExpression( String msg, int offset ) { super(msg+" at offset "+offset); _offset = offset; }

  public static NoExpression before( int offset ) { return new NoExpression("No expression before",offset); }
  public static NoExpression after ( int offset ) { return new NoExpression("No expression after" ,offset); }
  public static NoExpression around( int offset ) { return new NoExpression("No expression around",offset); }
}
