package edu.isi.cfgtools;

import java.util.Set;

// builds symbols from names. symbols are plain values, so unlike an interning
// factory nothing is remembered between calls
public class SymbolFactory {
	private SymbolFactory() {}

	static public TerminalSymbol getTerminal(String str) {
		return new TerminalSymbol(str);
	}

	static public NonterminalSymbol getNonterminal(String str) {
		return new NonterminalSymbol(str);
	}

	static public TripleSymbol getTriple(String p, String x, String q) {
		return new TripleSymbol(p, x, q);
	}

	// read a token in a context where the nonterminal names are known.
	// *e* is the epsilon marker, a quoted token is always a terminal
	static public Symbol getSymbol(String str, Set<String> nonterminals) {
		boolean debug = false;
		if (Symbol.EPSILON_STRING.equals(str))
			return Symbol.getEpsilon();
		if (str.length() > 2 && str.startsWith("\"") && str.endsWith("\"")) {
			if (debug) Debug.debug(debug, "forcing quoted "+str+" to be a terminal");
			return getTerminal(str.substring(1, str.length()-1));
		}
		if (nonterminals.contains(str))
			return getNonterminal(str);
		return getTerminal(str);
	}

	// a name built from base that is not in used: base, base', base'', ...
	static public String getFreshName(String base, Set<String> used) {
		String name = base;
		while (used.contains(name))
			name = name+"'";
		return name;
	}
}
