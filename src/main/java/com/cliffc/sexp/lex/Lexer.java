package com.cliffc.sexp.lex;

import com.cliffc.sexp.buffer.Buffer;
import com.cliffc.sexp.tree.Kind;
import com.cliffc.sexp.tree.Lexeme;
import org.jetbrains.annotations.NotNull;

import static com.cliffc.sexp.tree.Kind.*;

/** Modal lexer over a {@link Buffer}.
 *
 *  {@link #next} skips the mode's filler, runs the mode's rule and stamps the
 *  result with a left-sticky start mark and a length; the per-mode rules only
 *  move the cursor and pick a kind.
 */
public class Lexer {
  private final Buffer _buf;
  private int _x;               // Lexer cursor

  public Lexer( @NotNull Buffer buf ) { _buf = buf; }

  /** Lex one lexeme in the given mode, starting the filler skip at x.
   *  @return the lexeme, or null if no further lexeme exists */
  public Lexeme next( @NotNull Mode mode, int x ) {
    _x = x;
    if( skipWS(mode) == -1 ) return null;
    int start = _x;
    Kind k = switch( mode ) {
      case TOPLEVEL, LIST  -> toplevel(mode==Mode.LIST);
      case STRING          -> string();
      case LINE_COMMENT    -> line_comment();
      case BLOCK_COMMENT   -> block_comment();
      case ESCAPED_SYMBOL  -> escaped_symbol();
      case ERROR           -> error();
    };
    assert _x > start;
    return new Lexeme(k,_buf.mark(start,false),_x-start);
  }
  /** @return cursor after the last lexeme */
  public int cursor() { return _x; }

  // --------------------------------------------------------------------------
  private Kind toplevel( boolean list ) {
    char c = _buf.charAt(_x++);
    switch( c ) {
    case '(': return LPAREN;
    case ')': return list ? RPAREN : ERROR;
    case '\'': return QUOTE;
    case '`': return BACKQUOTE;
    case ',': if( !peek('@') ) peek('.');  return COMMA; // ,@ and ,.
    case '"': return STRING_START;
    case '|': return SYMBOL_START;
    case ';':
      while( peek(';') ) ;
      return LINE_COMMENT_START;
    case '#': return dispatch();
    case '\\': return token();
    default:
      if( isConstituent(c) ) return token();
      return ERROR;
    }
  }

  // Just past a '#'
  private Kind dispatch() {
    if( _x == _buf.size() ) return ERROR;
    char c = _buf.charAt(_x);
    switch( c ) {
    case '\\':
      _x++;
      if( _x == _buf.size() ) return ERROR;
      _x++;                     // The escaped character, whatever it is
      skipConstituents();       // Named characters, #\Space
      return CHARACTER;
    case '\'': _x++; return FUNCTION;
    case '|' : _x++; return BLOCK_COMMENT_START;
    case '+' : _x++; return READER_COND_POS;
    case '-' : _x++; return READER_COND_NEG;
    case ':' : _x++; return UNINTERNED;
    default:
      if( !isWS(c) ) _x++;      // Unknown dispatch pairs up with its character
      return ERROR;
    }
  }

  // Just past the first character of a token, which may have been a '\'
  private Kind token() {
    if( _buf.charAt(_x-1)=='\\' && _x < _buf.size() ) _x++;
    while( _x < _buf.size() ) {
      char c = _buf.charAt(_x);
      if( c=='\\' ) { _x = Math.min(_x+2,_buf.size()); continue; }
      if( !isConstituent(c) && c!='#' ) break;
      _x++;
    }
    return TOKEN;
  }

  private Kind string() {
    char c = _buf.charAt(_x++);
    if( c=='"' ) return STRING_END;
    if( c=='\\' ) {
      if( _x < _buf.size() ) _x++;
      return DELIMITER;
    }
    return word(c);
  }

  private Kind line_comment() {
    char c = _buf.charAt(_x++);
    if( c=='\n' ) return COMMENT_END;
    return word(c);
  }

  private Kind block_comment() {
    char c = _buf.charAt(_x++);
    if( c=='|' && peek('#') ) return BLOCK_COMMENT_END;
    if( c=='#' && peek('|') ) return BLOCK_COMMENT_START;
    return word(c);
  }

  private Kind escaped_symbol() {
    if( peek('|') ) return SYMBOL_END;
    while( _x < _buf.size() ) {
      char c = _buf.charAt(_x);
      if( c=='|' || c=='\n' ) break;
      _x = c=='\\' ? Math.min(_x+2,_buf.size()) : _x+1;
    }
    return TEXT;
  }

  private Kind error() {
    _x = _buf.lineEnd(_x);
    return ERROR;
  }

  // A constituent run after its first character, else a single delimiter
  private Kind word( char c ) {
    if( !isConstituent(c) ) return DELIMITER;
    skipConstituents();
    return WORD;
  }

  // --------------------------------------------------------------------------
  /** Advance the cursor past the mode's filler.
   *  @return the next character, or -1 if no lexeme follows */
  private int skipWS( Mode mode ) {
    while( _x < _buf.size() ) {
      char c = _buf.charAt(_x);
      boolean skip = switch( mode ) {
        case LINE_COMMENT   -> isWS(c) && c!='\n';
        case ESCAPED_SYMBOL -> c=='\n';
        default             -> isWS(c);
      };
      if( !skip ) return c;
      _x++;
    }
    return -1;
  }
  private void skipConstituents() {
    while( _x < _buf.size() && isConstituent(_buf.charAt(_x)) ) _x++;
  }
  // Return true & skip if match, false & do not skip if miss
  private boolean peek( char c ) {
    if( _x == _buf.size() || _buf.charAt(_x)!=c ) return false;
    _x++;
    return true;
  }

  /** Return true if `c` passes a test */
  public static boolean isWS( char c ) { return c==' ' || c=='\t' || c=='\n' || c=='\r' || c=='\f'; }
  public static boolean isConstituent( char c ) {
    if( isWS(c) ) return false;
    return switch( c ) {
      case '(', ')', '\'', '`', ',', '"', ';', '|', '#', '\\' -> false;
      default -> true;
    };
  }
}
