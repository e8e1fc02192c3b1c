package edu.isi.cfgtools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// CFG Rule. Nonterminal lhs, sequence of symbols rhs.
// an empty rhs is the epsilon alternative; the epsilon marker is only
// accepted on input as the entire rhs and is never stored
public class CFGRule {

	private final NonterminalSymbol lhs;
	private final List<Symbol> rhs;
	private int hsh;

	public CFGRule(NonterminalSymbol inlhs, List<? extends Symbol> inrhs) throws MalformedEpsilonException {
		if (inlhs == null)
			throw new IllegalArgumentException("rule needs a left hand side");
		lhs = inlhs;
		ArrayList<Symbol> v = new ArrayList<Symbol>(inrhs.size());
		for (Symbol s : inrhs) {
			if (s.isEpsilon()) {
				if (inrhs.size() > 1)
					throw new MalformedEpsilonException(inlhs+" -> "+join(inrhs));
				continue;
			}
			v.add(s);
		}
		rhs = Collections.unmodifiableList(v);
		setHashCode();
	}

	// the epsilon rule lhs -> *e*
	public CFGRule(NonterminalSymbol inlhs) {
		lhs = inlhs;
		rhs = Collections.emptyList();
		setHashCode();
	}

	private CFGRule(List<Symbol> checkedrhs, NonterminalSymbol inlhs) {
		lhs = inlhs;
		rhs = Collections.unmodifiableList(new ArrayList<Symbol>(checkedrhs));
		setHashCode();
	}

	// for rules built by the eliminators and the pda conversion, whose rhs
	// are assembled from stored rules and so never hold the epsilon marker
	static CFGRule derive(NonterminalSymbol inlhs, List<Symbol> inrhs) {
		return new CFGRule(inrhs, inlhs);
	}

	public NonterminalSymbol getLHS() { return lhs; }
	public List<Symbol> getRHS() { return rhs; }

	public boolean isEpsilonRule() { return rhs.isEmpty(); }

	// exactly one symbol and it is a nonterminal
	public boolean isUnitRule() {
		return rhs.size() == 1 && rhs.get(0).isNonterminal();
	}

	// nonterminals of the rhs, left to right, repeats kept
	public List<NonterminalSymbol> getNonterminals() {
		ArrayList<NonterminalSymbol> v = new ArrayList<NonterminalSymbol>();
		for (Symbol s : rhs)
			if (s.isNonterminal())
				v.add((NonterminalSymbol)s);
		return v;
	}

	private void setHashCode() {
		hsh = 31*lhs.hashCode() + rhs.hashCode();
	}
	public int hashCode() { return hsh; }

	// equal if lhs and rhs sequence are equal
	public boolean equals(Object o) {
		if (o == null || !o.getClass().equals(this.getClass()))
			return false;
		CFGRule r = (CFGRule)o;
		return lhs.equals(r.lhs) && rhs.equals(r.rhs);
	}

	// rhs only, as it appears after the arrow
	public String getRHSString() {
		if (rhs.isEmpty())
			return Symbol.EPSILON_STRING;
		return join(rhs);
	}

	public String toString() {
		return lhs+" -> "+getRHSString();
	}

	private static String join(List<? extends Symbol> syms) {
		StringBuilder sb = new StringBuilder();
		for (Symbol s : syms) {
			if (sb.length() > 0)
				sb.append(' ');
			sb.append(s);
		}
		return sb.toString();
	}
}
