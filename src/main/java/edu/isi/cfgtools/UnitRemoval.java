package edu.isi.cfgtools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import gnu.trove.TObjectIntHashMap;

// removal of unit rules (A -> B, B a nonterminal) from an epsilon-free grammar.
// 0) map nonterminals to integers and back
// 1) build nonterminal x nonterminal matrix, seeded with the identity and the unit rules
// 2) close it under composition, repeating until a pass adds nothing
// 3) give each A the non-unit alternatives of everything it reaches
public class UnitRemoval {

	private UnitRemoval() {}

	// reach(A) for every A: the nonterminals A rewrites to by zero or more unit rules.
	// each set starts with A itself, the rest in declaration order
	public static Map<NonterminalSymbol, Set<NonterminalSymbol>> getUnitClosure(CFGRuleSet rs) {
		boolean debug = false;
		int numStates = rs.getNumStates();
		NonterminalSymbol[] i2s = new NonterminalSymbol[numStates];
		TObjectIntHashMap<NonterminalSymbol> s2i = new TObjectIntHashMap<NonterminalSymbol>();
		int nextid = 0;
		for (NonterminalSymbol s : rs.getStates()) {
			i2s[nextid] = s;
			s2i.put(s, nextid++);
		}
		boolean[][] arr = new boolean[numStates][numStates];
		for (int i = 0; i < numStates; i++) {
			arr[i][i] = true;
			for (CFGRule r : rs.getRulesOfType(i2s[i])) {
				if (r.isUnitRule()) {
					if (debug) Debug.debug(debug, "Saw unit rule "+r);
					arr[i][s2i.get(r.getNonterminals().get(0))] = true;
				}
			}
		}
		boolean changed;
		int pass = 0;
		do {
			changed = false;
			pass++;
			for (int beg = 0; beg < numStates; beg++) {
				for (int mid = 0; mid < numStates; mid++) {
					if (!arr[beg][mid] || beg == mid)
						continue;
					for (int end = 0; end < numStates; end++) {
						if (arr[mid][end] && !arr[beg][end]) {
							arr[beg][end] = true;
							changed = true;
						}
					}
				}
			}
			if (debug) Debug.debug(debug, 1, "closure pass "+pass+(changed ? " grew" : " stable"));
		} while (changed);

		LinkedHashMap<NonterminalSymbol, Set<NonterminalSymbol>> ret = new LinkedHashMap<NonterminalSymbol, Set<NonterminalSymbol>>();
		for (int i = 0; i < numStates; i++) {
			LinkedHashSet<NonterminalSymbol> reach = new LinkedHashSet<NonterminalSymbol>();
			reach.add(i2s[i]);
			for (int j = 0; j < numStates; j++)
				if (arr[i][j])
					reach.add(i2s[j]);
			ret.put(i2s[i], Collections.unmodifiableSet(reach));
		}
		return ret;
	}

	// A new rule set with no unit rules that generates the same language.
	// the start's epsilon alternative, if any, stays with the start: a nonterminal
	// that reaches the start through unit rules does not inherit it. In an
	// epsilon-removed grammar everything such a nonterminal could do with it
	// is already covered by the deletion variants.
	public static CFGRuleSet removeUnits(CFGRuleSet rs) {
		boolean debug = false;
		Map<NonterminalSymbol, Set<NonterminalSymbol>> closure = getUnitClosure(rs);
		NonterminalSymbol start = rs.getStartState();

		CFGRuleSet.Builder b = new CFGRuleSet.Builder();
		for (NonterminalSymbol s : rs.getStates())
			b.addState(s);
		for (TerminalSymbol t : rs.getTerminals())
			b.addTerminal(t);
		b.setStartState(start);

		for (NonterminalSymbol s : rs.getStates()) {
			ArrayList<CFGRule> adopted = new ArrayList<CFGRule>();
			for (NonterminalSymbol dst : closure.get(s)) {
				for (CFGRule r : rs.getRulesOfType(dst)) {
					if (r.isUnitRule())
						continue;
					if (r.isEpsilonRule() && dst.equals(start) && !s.equals(start)) {
						if (debug) Debug.debug(debug, "Not giving "+s+" the start's epsilon");
						continue;
					}
					adopted.add(dst.equals(s) ? r : CFGRule.derive(s, r.getRHS()));
				}
			}
			if (debug) Debug.debug(debug, s+" reaches "+closure.get(s)+"; "+adopted.size()+" alternatives");
			for (CFGRule r : adopted)
				b.addDerivedRule(r);
		}
		return b.buildUnchecked();
	}
}
