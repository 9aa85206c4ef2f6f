package com.cliffc.sexp.query;

import com.cliffc.sexp.util.SB;
import org.jetbrains.annotations.NotNull;

/** A symbol as read from token text, and once resolved, where it lives.
 *
 *  Reading follows the standard readtable: unescaped characters upcase, a
 *  backslash escapes one character, vertical bars escape a run.  The first
 *  unescaped colon splits a package prefix off; a doubled colon marks an
 *  internal reference, a leading colon a keyword.
 */
public final class Sym {
  public final String _prefix;  // Package prefix as read, or null
  public final String _name;
  public final boolean _internal; // pkg::name
  public final Pkg _home;       // Package holding the symbol; null if not found
  public final boolean _found;

  private Sym( String prefix, String name, boolean internal, Pkg home, boolean found ) {
    _prefix = prefix; _name = name; _internal = internal; _home = home; _found = found;
  }

  /** Read token text; the result is not yet resolved */
  public static Sym read( @NotNull String text ) {
    SB sb = new SB();
    String prefix = null;
    boolean internal = false, bar = false;
    for( int i=0; i<text.length(); i++ ) {
      char c = text.charAt(i);
      if( c=='\\' && i+1 < text.length() ) { sb.p(text.charAt(++i)); continue; }
      if( c=='|' ) { bar = !bar; continue; }
      if( bar ) { sb.p(c); continue; }
      if( c==':' && prefix==null ) {
        prefix = sb.toString();
        sb = new SB();
        if( i+1 < text.length() && text.charAt(i+1)==':' ) { internal = true; i++; }
        continue;
      }
      sb.p(Character.toUpperCase(c));
    }
    if( prefix!=null && prefix.isEmpty() ) prefix = Packages.KEYWORD;
    return new Sym(prefix,sb.toString(),internal,null,false);
  }

  public boolean isKeyword() { return Packages.KEYWORD.equals(_prefix); }

  Sym resolved( Pkg home ) { return new Sym(_prefix,_name,_internal,home,home!=null); }

  /** @return "PACKAGE:NAME" for a found symbol, else the name as read */
  public String key() {
    return _found ? _home._name+":"+_name : _name;
  }

  @Override public String toString() {
    if( _found ) return key();
    return _prefix==null ? _name : _prefix+(_internal ? "::" : ":")+_name;
  }
}
