package com.cliffc.sexp.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  int _indent = 0;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB(String s) { _sb = new StringBuilder(s); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB p( long   s ) { _sb.append(s); return this; }
  public SB p( boolean s) { _sb.append(s); return this; }
  public SB i( int d ) { for( int i=0; i<d+_indent; i++ ) p("  "); return this; }
  public SB i( ) { return i(0); }
  public SB s() { _sb.append(' '); return this; }
  // Printable rendering of source text: escapes newlines and tabs
  public SB pq( CharSequence s ) {
    _sb.append('"');
    for( int i=0; i<s.length(); i++ ) {
      char c = s.charAt(i);
      switch( c ) {
      case '\n' -> _sb.append("\\n");
      case '\t' -> _sb.append("\\t");
      case '"'  -> _sb.append("\\\"");
      default   -> _sb.append(c);
      }
    }
    _sb.append('"');
    return this;
  }

  // Increase indentation
  public SB ii( int i) { _indent += i; return this; }
  // Decrease indentation
  public SB di( int i) { _indent -= i; return this; }

  public SB nl( ) { return p('\n'); }

  // Remove last char
  public SB unchar() { return unchar(1); }
  public SB unchar(int x) { _sb.setLength(_sb.length()-x); return this; }

  @Override public String toString() { return _sb.toString(); }
}
