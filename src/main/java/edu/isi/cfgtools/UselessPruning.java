package edu.isi.cfgtools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.Stack;

// prune useless - two-pass algorithm, based on knuth. First go bottom up and mark all
// nonterminals that can be used to reach terminal strings, and throw the rest away. Then
// go top-down over what is left and mark all nonterminals that can be reached from the
// start symbol. Only nonterminals that survive both passes are kept.
//
// The order matters. A nonterminal reachable only through an alternative that also
// mentions a non-generating nonterminal is itself unreachable once that alternative
// is gone, which a top-down pass run first cannot see.
public class UselessPruning {

	private UselessPruning() {}

	// nonterminals with some alternative made only of terminals and generating
	// nonterminals, grown until nothing changes
	public static Set<NonterminalSymbol> getGeneratingStates(CFGRuleSet rs) {
		boolean debug = false;
		LinkedHashSet<NonterminalSymbol> bottomReachable = new LinkedHashSet<NonterminalSymbol>();
		int brSize;
		do {
			brSize = bottomReachable.size();
			for (NonterminalSymbol currState : rs.getStates()) {
				if (bottomReachable.contains(currState))
					continue;
				if (debug) Debug.debug(debug, "BU: Considering state "+currState);
				// look for at least one valid rule
				for (CFGRule currRule : rs.getRulesOfType(currState)) {
					if (isGenerating(currRule, bottomReachable)) {
						if (debug) Debug.debug(debug, "BU: "+currState+" thanks to "+currRule);
						bottomReachable.add(currState);
						break;
					}
				}
			}
			if (debug) Debug.debug(debug, "Gone from "+brSize+" to "+bottomReachable.size());
		} while (brSize < bottomReachable.size());
		return Collections.unmodifiableSet(bottomReachable);
	}

	// nonterminals that appear in some derivation from the start
	public static Set<NonterminalSymbol> getReachableStates(CFGRuleSet rs) {
		boolean debug = false;
		LinkedHashSet<NonterminalSymbol> checkedStates = new LinkedHashSet<NonterminalSymbol>();
		Stack<NonterminalSymbol> readyStates = new Stack<NonterminalSymbol>();
		readyStates.push(rs.getStartState());
		while (readyStates.size() > 0) {
			NonterminalSymbol currState = readyStates.pop();
			if (!checkedStates.add(currState))
				continue;
			if (debug) Debug.debug(debug, "TD: "+currState);
			for (CFGRule currRule : rs.getRulesOfType(currState)) {
				for (NonterminalSymbol leaf : currRule.getNonterminals()) {
					if (!checkedStates.contains(leaf))
						readyStates.push(leaf);
				}
			}
		}
		return Collections.unmodifiableSet(checkedStates);
	}

	// every symbol of the rule is a terminal or an already generating nonterminal.
	// the epsilon alternative qualifies
	private static boolean isGenerating(CFGRule r, Set<NonterminalSymbol> generating) {
		for (Symbol leaf : r.getRHS()) {
			if (leaf.isNonterminal() && !generating.contains(leaf))
				return false;
		}
		return true;
	}

	// A new rule set holding only the nonterminals that are both generating and reachable,
	// with the same language. The start is always declared, so a grammar whose start
	// generates nothing comes out as the start with no rules.
	public static CFGRuleSet pruneUseless(CFGRuleSet rs) {
		boolean debug = false;
		// phase 1: bottom up
		CFGRuleSet generating = restrict(rs, getGeneratingStates(rs));
		if (debug) Debug.debug(debug, "Generating pass kept "+generating.getNumRules()+" of "+rs.getNumRules()+" rules");
		// phase 2: top down, over what phase 1 left
		CFGRuleSet ret = restrict(generating, getReachableStates(generating));
		if (debug) Debug.debug(debug, "Reachable pass kept "+ret.getNumRules()+" rules");
		return ret;
	}

	// The two passes the other way round. This can leave nonterminals that are
	// reachable only through rules the generating pass later deletes; it is kept to
	// show why pruneUseless runs the generating pass first.
	public static CFGRuleSet pruneUnreachableFirst(CFGRuleSet rs) {
		CFGRuleSet reachable = restrict(rs, getReachableStates(rs));
		return restrict(reachable, getGeneratingStates(reachable));
	}

	// keep the nonterminals in keep (and the start), and the rules that mention no others
	private static CFGRuleSet restrict(CFGRuleSet rs, Set<NonterminalSymbol> keep) {
		boolean debug = false;
		CFGRuleSet.Builder b = new CFGRuleSet.Builder();
		for (NonterminalSymbol s : rs.getStates())
			if (keep.contains(s))
				b.addState(s);
		b.setStartState(rs.getStartState());
		List<CFGRule> dropped = new ArrayList<CFGRule>();
		for (NonterminalSymbol s : rs.getStates()) {
			if (!keep.contains(s))
				continue;
			for (CFGRule r : rs.getRulesOfType(s)) {
				boolean isOkay = true;
				for (NonterminalSymbol leaf : r.getNonterminals()) {
					if (!keep.contains(leaf)) {
						isOkay = false;
						break;
					}
				}
				if (isOkay)
					b.addDerivedRule(r);
				else
					dropped.add(r);
			}
		}
		if (debug) Debug.debug(debug, "Dropped "+dropped);
		return b.buildUnchecked();
	}
}
