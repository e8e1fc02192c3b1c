package edu.isi.cfgtools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Removal of epsilon alternatives from a context-free grammar.
 * <p>
 * A nonterminal is <i>nullable</i> if it can derive the empty string. The nullable
 * set is grown until it stops changing, so that a nonterminal whose every
 * alternative is a chain of other nullable nonterminals is found no matter how
 * far it is from a literal epsilon rule. Each alternative is then replaced by
 * all the variants obtained by deleting any subset of its nullable occurrences,
 * and the epsilon alternatives are dropped. The start may keep its epsilon
 * alternative so the empty string stays in the language.
 */
public class EpsilonRemoval {

	private EpsilonRemoval() {}

	/**
	 * The nonterminals that derive the empty string: those with an epsilon
	 * alternative, and, until no more are added, those with an alternative made
	 * up entirely of nullable nonterminals.
	 */
	public static Set<NonterminalSymbol> getNullableStates(CFGRuleSet rs) {
		boolean debug = false;
		LinkedHashSet<NonterminalSymbol> ret = new LinkedHashSet<NonterminalSymbol>();
		int size;
		int iteration = 0;
		do {
			size = ret.size();
			iteration++;
			for (NonterminalSymbol s : rs.getStates()) {
				if (ret.contains(s))
					continue;
				for (CFGRule r : rs.getRulesOfType(s)) {
					if (r.isEpsilonRule()) {
						if (debug) Debug.debug(debug, "Found direct epsilon rule: "+r);
						ret.add(s);
						break;
					}
					boolean isEmpty = true;
					for (Symbol sym : r.getRHS()) {
						if (!ret.contains(sym)) {
							isEmpty = false;
							break;
						}
					}
					if (isEmpty) {
						if (debug) Debug.debug(debug, "All rhs in "+r+" go to eps");
						ret.add(s);
						break;
					}
				}
			}
			if (debug) Debug.debug(debug, 1, "pass "+iteration+": "+size+" -> "+ret.size()+" nullable");
		} while (ret.size() > size);
		return Collections.unmodifiableSet(ret);
	}

	/** same as {@link #removeEpsilons(CFGRuleSet, boolean)}, keeping start -&gt; *e* when the start is nullable */
	public static CFGRuleSet removeEpsilons(CFGRuleSet rs) {
		return removeEpsilons(rs, true);
	}

	/**
	 * A new rule set generating the same non-empty strings as rs, with no
	 * epsilon alternative except start -&gt; *e*, which is kept only if
	 * keepStartEpsilon is set and the start is nullable.
	 */
	public static CFGRuleSet removeEpsilons(CFGRuleSet rs, boolean keepStartEpsilon) {
		boolean debug = false;
		Set<NonterminalSymbol> nullable = getNullableStates(rs);
		if (debug) Debug.debug(debug, "Nullable: "+nullable);

		CFGRuleSet.Builder b = new CFGRuleSet.Builder();
		for (NonterminalSymbol s : rs.getStates())
			b.addState(s);
		for (TerminalSymbol t : rs.getTerminals())
			b.addTerminal(t);
		b.setStartState(rs.getStartState());

		for (NonterminalSymbol s : rs.getStates()) {
			for (CFGRule r : rs.getRulesOfType(s)) {
				if (r.isEpsilonRule())
					continue;
				ArrayList<List<Symbol>> variants = new ArrayList<List<Symbol>>();
				recursiveGetVariants(variants, new ArrayList<Symbol>(), r.getRHS(), 0, nullable);
				for (List<Symbol> v : variants) {
					// deleting every symbol leaves the epsilon alternative we are removing
					if (v.isEmpty())
						continue;
					CFGRule nr = CFGRule.derive(s, v);
					if (debug) Debug.debug(debug, "From "+r+" made "+nr);
					b.addDerivedRule(nr);
				}
			}
		}
		if (keepStartEpsilon && nullable.contains(rs.getStartState())) {
			if (debug) Debug.debug(debug, "Keeping epsilon at start "+rs.getStartState());
			b.addDerivedRule(new CFGRule(rs.getStartState()));
		}
		return b.buildUnchecked();
	}

	// walk the rhs left to right; at a nullable position branch on keeping and deleting it.
	// keeping is tried first so the unchanged rhs comes out first
	private static void recursiveGetVariants(List<List<Symbol>> variants, ArrayList<Symbol> prefix,
			List<Symbol> rhs, int pos, Set<NonterminalSymbol> nullable) {
		if (pos == rhs.size()) {
			variants.add(new ArrayList<Symbol>(prefix));
			return;
		}
		Symbol sym = rhs.get(pos);
		prefix.add(sym);
		recursiveGetVariants(variants, prefix, rhs, pos+1, nullable);
		prefix.remove(prefix.size()-1);
		if (nullable.contains(sym))
			recursiveGetVariants(variants, prefix, rhs, pos+1, nullable);
	}
}
