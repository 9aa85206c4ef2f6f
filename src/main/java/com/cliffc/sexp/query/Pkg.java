package com.cliffc.sexp.query;

import com.cliffc.sexp.util.Ary;

import java.util.HashSet;

/** A package: a name, its nicknames, the packages it uses and its own symbols. */
public final class Pkg {
  public final String _name;
  final Ary<String> _nicks = new Ary<>(String.class);
  final Ary<Pkg> _uses = new Ary<>(Pkg.class);
  private final HashSet<String> _syms = new HashSet<>();

  Pkg( String name ) { _name = name; }

  void intern( String name ) { _syms.add(name); }
  void use( Pkg p ) { if( p!=this && _uses.find(u -> u==p) == -1 ) _uses.push(p); }

  /** @return true if name is present directly in this package */
  public boolean present( String name ) { return _syms.contains(name); }

  /** @return the package a name is accessible from, searching used
   *  packages after this one; null if not accessible */
  public Pkg accessible( String name ) {
    if( present(name) ) return this;
    for( Pkg u : _uses )
      if( u.present(name) )
        return u;
    return null;
  }

  @Override public String toString() { return _name; }
}
