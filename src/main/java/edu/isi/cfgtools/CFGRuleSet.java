package edu.isi.cfgtools;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// A context-free grammar: nonterminals ("states"), terminals, rules indexed by lhs,
// and a start nonterminal. Instances never change once built; every transformation
// returns a new rule set. Iteration order everywhere is declaration order, so
// the same input always prints the same way.
public class CFGRuleSet {

	private final NonterminalSymbol startState;
	private final Set<NonterminalSymbol> states;
	private final Set<TerminalSymbol> terminals;
	private final Map<NonterminalSymbol, List<CFGRule>> rulesByLHS;
	private final List<CFGRule> rules;

	private CFGRuleSet(Builder b) {
		startState = b.startState;
		states = Collections.unmodifiableSet(new LinkedHashSet<NonterminalSymbol>(b.states));
		terminals = Collections.unmodifiableSet(new LinkedHashSet<TerminalSymbol>(b.terminals));
		LinkedHashMap<NonterminalSymbol, List<CFGRule>> byLHS = new LinkedHashMap<NonterminalSymbol, List<CFGRule>>();
		ArrayList<CFGRule> all = new ArrayList<CFGRule>();
		for (NonterminalSymbol s : states) {
			ArrayList<CFGRule> alts = new ArrayList<CFGRule>(b.rulesByLHS.get(s));
			byLHS.put(s, Collections.unmodifiableList(alts));
			all.addAll(alts);
		}
		rulesByLHS = Collections.unmodifiableMap(byLHS);
		rules = Collections.unmodifiableList(all);
	}

	// accessors

	public NonterminalSymbol getStartState() { return startState; }
	public Set<NonterminalSymbol> getStates() { return states; }
	public Set<TerminalSymbol> getTerminals() { return terminals; }
	public List<CFGRule> getRules() { return rules; }

	// alternatives of s in insertion order. empty if s has none or is not a nonterminal here
	public List<CFGRule> getRulesOfType(Symbol s) {
		List<CFGRule> v = rulesByLHS.get(s);
		if (v == null)
			return Collections.emptyList();
		return v;
	}

	public int getNumRules() { return rules.size(); }
	public int getNumStates() { return states.size(); }
	public int getNumTerminals() { return terminals.size(); }

	public boolean isState(Symbol s) { return states.contains(s); }

	// fixpoint sets, for inspection

	public Set<NonterminalSymbol> getNullableStates() {
		return EpsilonRemoval.getNullableStates(this);
	}
	public Set<NonterminalSymbol> getGeneratingStates() {
		return UselessPruning.getGeneratingStates(this);
	}
	public Set<NonterminalSymbol> getReachableStates() {
		return UselessPruning.getReachableStates(this);
	}

	// transformations. each returns a new rule set

	public CFGRuleSet removeEpsilons(boolean keepStartEpsilon) {
		return EpsilonRemoval.removeEpsilons(this, keepStartEpsilon);
	}
	public CFGRuleSet removeEpsilons() {
		return EpsilonRemoval.removeEpsilons(this);
	}
	public CFGRuleSet removeUnits() {
		return UnitRemoval.removeUnits(this);
	}
	public CFGRuleSet pruneUseless() {
		return UselessPruning.pruneUseless(this);
	}
	public CFGRuleSet normalize() {
		return new Normalizer().normalize(this);
	}

	// checks on the normalized form

	// no epsilon alternative, other than possibly start -> *e*
	public boolean isEpsilonFree() {
		for (CFGRule r : rules)
			if (r.isEpsilonRule() && !r.getLHS().equals(startState))
				return false;
		return true;
	}

	public boolean isUnitFree() {
		for (CFGRule r : rules)
			if (r.isUnitRule())
				return false;
		return true;
	}

	// every nonterminal mentioned by a rule, and every lhs, is reachable and generating
	public boolean isAllUseful() {
		Set<NonterminalSymbol> gen = getGeneratingStates();
		Set<NonterminalSymbol> reach = getReachableStates();
		for (CFGRule r : rules) {
			if (!gen.contains(r.getLHS()) || !reach.contains(r.getLHS()))
				return false;
			for (NonterminalSymbol s : r.getNonterminals())
				if (!gen.contains(s) || !reach.contains(s))
					return false;
		}
		return true;
	}

	public boolean isNormalized() {
		return isEpsilonFree() && isUnitFree() && isAllUseful();
	}

	// start on the first line, then the start's rules, then the rest grouped by lhs.
	// this is the file format GrammarReader reads
	public String toString() {
		StringWriter w = new StringWriter();
		try {
			print(w);
		}
		catch (IOException e) {
			throw new IllegalStateException("couldn't write to a string: "+e.getMessage(), e);
		}
		return w.toString();
	}

	// the same layout as toString, one alternative per line
	public void print(Writer w) throws IOException {
		Set<NonterminalSymbol> written = getWritableStates();
		Set<String> names = getNames(written);
		w.write(startState+"\n");
		for (NonterminalSymbol left : getPrintOrder()) {
			for (CFGRule r : getRulesOfType(left)) {
				if (isWritable(r, written))
					w.write(left+" -> "+getRHSString(r, names)+"\n");
			}
		}
		w.flush();
	}

	// alternatives folded as "A -> x | y", the way the original menu program printed results.
	// still readable by GrammarReader
	public String toAlternativesString() {
		Set<NonterminalSymbol> written = getWritableStates();
		Set<String> names = getNames(written);
		StringBuilder sb = new StringBuilder(startState.toString());
		sb.append("\n");
		for (NonterminalSymbol s : getPrintOrder()) {
			boolean first = true;
			for (CFGRule r : getRulesOfType(s)) {
				if (!isWritable(r, written))
					continue;
				sb.append(first ? s+" -> " : " | ");
				sb.append(getRHSString(r, names));
				first = false;
			}
			if (!first)
				sb.append("\n");
		}
		return sb.toString();
	}

	private List<NonterminalSymbol> getPrintOrder() {
		ArrayList<NonterminalSymbol> order = new ArrayList<NonterminalSymbol>();
		order.add(startState);
		for (NonterminalSymbol s : states)
			if (!s.equals(startState))
				order.add(s);
		return order;
	}

	// the reader only knows a nonterminal if it is the start or the lhs of a written
	// rule. so a rule is written only if every nonterminal it mentions will be known,
	// shrinking the set until it is stable. what is left out involves only
	// nonterminals that derive no terminal string, so the language is the same
	private Set<NonterminalSymbol> getWritableStates() {
		boolean debug = false;
		LinkedHashSet<NonterminalSymbol> written = new LinkedHashSet<NonterminalSymbol>();
		written.add(startState);
		for (NonterminalSymbol s : states)
			if (!getRulesOfType(s).isEmpty())
				written.add(s);
		int size;
		do {
			size = written.size();
			LinkedHashSet<NonterminalSymbol> next = new LinkedHashSet<NonterminalSymbol>();
			next.add(startState);
			for (CFGRule r : rules)
				if (isWritable(r, written))
					next.add(r.getLHS());
			written = next;
		} while (written.size() < size);
		if (debug) Debug.debug(debug, written.size()+" of "+states.size()+" nonterminals written");
		return written;
	}

	private static boolean isWritable(CFGRule r, Set<NonterminalSymbol> written) {
		if (!written.contains(r.getLHS()))
			return false;
		for (NonterminalSymbol s : r.getNonterminals())
			if (!written.contains(s))
				return false;
		return true;
	}

	private static Set<String> getNames(Set<NonterminalSymbol> written) {
		HashSet<String> ret = new HashSet<String>();
		for (NonterminalSymbol s : written)
			ret.add(s.getName());
		return ret;
	}

	// a terminal is quoted when the reader would otherwise take it for a nonterminal,
	// for the epsilon marker, or strip quotes it already has
	private static String getRHSString(CFGRule r, Set<String> names) {
		if (r.isEpsilonRule())
			return Symbol.EPSILON_STRING;
		StringBuilder sb = new StringBuilder();
		for (Symbol s : r.getRHS()) {
			if (sb.length() > 0)
				sb.append(' ');
			String name = s.getName();
			if (s.isTerminal() && (names.contains(name) || name.equals(Symbol.EPSILON_STRING) ||
					(name.length() > 2 && name.startsWith("\"") && name.endsWith("\""))))
				sb.append("\""+name+"\"");
			else
				sb.append(name);
		}
		return sb.toString();
	}

	// "clean" rule set that can be added to manually. rules must name declared
	// nonterminals on the lhs; rhs nonterminals are checked when the set is built,
	// rhs terminals are declared implicitly.
	public static class Builder {
		private NonterminalSymbol startState = null;
		private final LinkedHashSet<NonterminalSymbol> states = new LinkedHashSet<NonterminalSymbol>();
		private final LinkedHashSet<TerminalSymbol> terminals = new LinkedHashSet<TerminalSymbol>();
		private final LinkedHashMap<NonterminalSymbol, LinkedHashSet<CFGRule>> rulesByLHS =
			new LinkedHashMap<NonterminalSymbol, LinkedHashSet<CFGRule>>();

		public Builder() {}

		public Builder addState(NonterminalSymbol s) {
			if (states.add(s))
				rulesByLHS.put(s, new LinkedHashSet<CFGRule>());
			return this;
		}

		public Builder addState(String name) {
			return addState(SymbolFactory.getNonterminal(name));
		}

		public Builder addTerminal(TerminalSymbol s) {
			terminals.add(s);
			return this;
		}

		// duplicates of an existing alternative are ignored
		public Builder addRule(CFGRule r) throws UndefinedSymbolException {
			if (!states.contains(r.getLHS()))
				throw new UndefinedSymbolException(r.getLHS().toString(), r.toString());
			rulesByLHS.get(r.getLHS()).add(r);
			for (Symbol s : r.getRHS())
				if (s.isTerminal())
					terminals.add((TerminalSymbol)s);
			return this;
		}

		public Builder addRule(NonterminalSymbol lhs, Symbol... rhs) throws UndefinedSymbolException, MalformedEpsilonException {
			List<Symbol> v = new ArrayList<Symbol>();
			Collections.addAll(v, rhs);
			return addRule(new CFGRule(lhs, v));
		}

		public Builder addStartState(NonterminalSymbol s) throws UndefinedSymbolException {
			if (!states.contains(s))
				throw new UndefinedSymbolException(s.toString(), "start designation");
			startState = s;
			return this;
		}

		public boolean hasState(Symbol s) { return states.contains(s); }

		// for the transformations, which only ever add rules over nonterminals
		// they declared first
		void addDerivedRule(CFGRule r) {
			addState(r.getLHS());
			rulesByLHS.get(r.getLHS()).add(r);
			for (Symbol s : r.getRHS())
				if (s.isTerminal())
					terminals.add((TerminalSymbol)s);
		}

		void setStartState(NonterminalSymbol s) {
			addState(s);
			startState = s;
		}

		// validate and freeze
		public CFGRuleSet build() throws DataFormatException {
			if (startState == null)
				throw new NoStartSymbolException("start nonterminal");
			for (LinkedHashSet<CFGRule> alts : rulesByLHS.values()) {
				for (CFGRule r : alts) {
					for (NonterminalSymbol s : r.getNonterminals()) {
						if (!states.contains(s))
							throw new UndefinedSymbolException(s.toString(), r.toString());
					}
				}
			}
			return new CFGRuleSet(this);
		}

		// used by the transformations, whose output is valid by construction
		CFGRuleSet buildUnchecked() {
			return new CFGRuleSet(this);
		}
	}
}
