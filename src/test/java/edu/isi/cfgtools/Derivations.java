package edu.isi.cfgtools;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

// the terminal strings of length at most maxLength a grammar derives, found by growing
// a string set per nonterminal until nothing changes. terminals are concatenated
// without separators, so tests use one-character terminal names.
final class Derivations {

	private Derivations() {}

	static Set<String> upTo(CFGRuleSet rs, int maxLength) {
		Map<NonterminalSymbol, Set<String>> lang = new HashMap<NonterminalSymbol, Set<String>>();
		for (NonterminalSymbol s : rs.getStates())
			lang.put(s, new TreeSet<String>());
		boolean changed;
		do {
			changed = false;
			for (CFGRule r : rs.getRules()) {
				Set<String> partial = new TreeSet<String>();
				partial.add("");
				for (Symbol sym : r.getRHS()) {
					Set<String> next = new TreeSet<String>();
					Set<String> pieces;
					if (sym.isTerminal()) {
						pieces = new TreeSet<String>();
						pieces.add(sym.getName());
					}
					else {
						pieces = lang.get(sym);
						if (pieces == null)
							pieces = new TreeSet<String>();
					}
					for (String pre : partial)
						for (String piece : pieces)
							if (pre.length()+piece.length() <= maxLength)
								next.add(pre+piece);
					partial = next;
				}
				if (lang.get(r.getLHS()).addAll(partial))
					changed = true;
			}
		} while (changed);
		return lang.get(rs.getStartState());
	}

	static Set<String> of(String... strings) {
		Set<String> ret = new TreeSet<String>();
		for (String s : strings)
			ret.add(s);
		return ret;
	}
}
