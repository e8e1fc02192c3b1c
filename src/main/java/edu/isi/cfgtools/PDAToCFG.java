package edu.isi.cfgtools;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Conversion of a pushdown automaton into a context-free grammar for its language,
 * by the triple construction. The nonterminal [p,X,q] derives exactly the inputs
 * that take the automaton from state p with X on top of the stack to state q with
 * X (and nothing else) popped.
 * <p>
 * A move (p, a, X) -&gt; (r, Y1 ... Yk) contributes, for every choice of states
 * r1 ... rk, the rule [p,X,rk] -&gt; a [r,Y1,r1] [r1,Y2,r2] ... [r(k-1),Yk,rk].
 * Every tuple of states is tried, including for k = 1, because any of them may be
 * where the automaton lands after popping the pushed symbols. A move that pushes
 * nothing gives [p,X,r] -&gt; a.
 * <p>
 * Which triples the grammar starts from depends on how the automaton accepts,
 * which is never guessed from the automaton itself: see {@link AcceptanceMode}.
 */
public class PDAToCFG {

	private PDAToCFG() {}

	/**
	 * The grammar of the language pda accepts in the given mode. A null mode is only
	 * allowed when pda has exactly one accepting state, and then means
	 * {@link AcceptanceMode#EMPTY_STACK_IN_FINAL_STATE}.
	 *
	 * @throws AmbiguousAcceptanceException if mode is null and pda does not have exactly one accepting state
	 */
	public static CFGRuleSet convert(PDARuleSet pda, AcceptanceMode mode) throws AmbiguousAcceptanceException {
		boolean debug = false;
		Date startTime = new Date();
		if (mode == null) {
			if (pda.getAcceptingStates().size() != 1)
				throw new AmbiguousAcceptanceException(pda.getAcceptingStates());
			mode = AcceptanceMode.EMPTY_STACK_IN_FINAL_STATE;
		}
		if (mode == AcceptanceMode.FINAL_STATE) {
			pda = toEmptyStack(pda);
			mode = AcceptanceMode.EMPTY_STACK;
			if (debug) Debug.debug(debug, "Rewrote to empty stack acceptance:\n"+pda);
		}

		List<String> states = new ArrayList<String>(pda.getStates());
		CFGRuleSet.Builder b = new CFGRuleSet.Builder();
		Set<String> used = new HashSet<String>();
		for (TerminalSymbol a : pda.getInputAlphabet())
			used.add(a.getName());

		// every triple is a nonterminal, whether or not any rule has it on the left
		ArrayList<TripleSymbol> triples = new ArrayList<TripleSymbol>();
		for (String p : states)
			for (String x : pda.getStackAlphabet())
				for (String q : states)
					triples.add(SymbolFactory.getTriple(p, x, q));
		for (TripleSymbol t : triples)
			used.add(t.getName());

		NonterminalSymbol start = chooseStart(pda, mode, states, used, b);
		for (TripleSymbol t : triples)
			b.addState(t);
		for (TerminalSymbol a : pda.getInputAlphabet())
			b.addTerminal(a);

		for (PDATransition t : pda.getTransitions())
			addTransitionRules(t, states, b);

		CFGRuleSet ret = b.buildUnchecked();
		if (debug) Debug.debug(debug, "Made "+ret.getNumRules()+" rules over "+ret.getNumStates()+" nonterminals from start "+start);
		Debug.dbtime(2, startTime, "converted automaton");
		return ret;
	}

	// declares the start and gives it its rules. In EMPTY_STACK_IN_FINAL_STATE mode with a
	// single accepting state the start is that state's triple; otherwise a fresh start
	// nonterminal picks one of the triples by a unit rule
	private static NonterminalSymbol chooseStart(PDARuleSet pda, AcceptanceMode mode, List<String> states,
			Set<String> used, CFGRuleSet.Builder b) {
		String q0 = pda.getStartState();
		String z0 = pda.getStartStack();
		List<String> ends;
		if (mode == AcceptanceMode.EMPTY_STACK) {
			ends = states;
		}
		else {
			ends = new ArrayList<String>(pda.getAcceptingStates());
			if (ends.size() == 1) {
				TripleSymbol start = SymbolFactory.getTriple(q0, z0, ends.get(0));
				b.setStartState(start);
				return start;
			}
		}
		NonterminalSymbol start = SymbolFactory.getNonterminal(SymbolFactory.getFreshName("S", used));
		b.setStartState(start);
		for (String f : ends) {
			List<Symbol> rhs = new ArrayList<Symbol>();
			rhs.add(SymbolFactory.getTriple(q0, z0, f));
			b.addDerivedRule(CFGRule.derive(start, rhs));
		}
		return start;
	}

	// all the rules one move contributes. the intermediate states r1 .. rk
	// run through every tuple, odometer style, last position fastest
	private static void addTransitionRules(PDATransition t, List<String> states, CFGRuleSet.Builder b) {
		boolean debug = false;
		String p = t.getState();
		String x = t.getStackTop();
		String r = t.getNextState();
		List<String> push = t.getPush();
		int k = push.size();
		if (k == 0) {
			List<Symbol> rhs = new ArrayList<Symbol>();
			if (!t.isEpsilonMove())
				rhs.add(t.getInput());
			CFGRule nr = CFGRule.derive(SymbolFactory.getTriple(p, x, r), rhs);
			if (debug) Debug.debug(debug, t+" gives "+nr);
			b.addDerivedRule(nr);
			return;
		}
		int[] mids = new int[k];
		int count = 0;
		do {
			List<Symbol> rhs = new ArrayList<Symbol>(k+1);
			if (!t.isEpsilonMove())
				rhs.add(t.getInput());
			String prev = r;
			for (int i = 0; i < k; i++) {
				String next = states.get(mids[i]);
				rhs.add(SymbolFactory.getTriple(prev, push.get(i), next));
				prev = next;
			}
			b.addDerivedRule(CFGRule.derive(SymbolFactory.getTriple(p, x, prev), rhs));
			count++;
		} while (advance(mids, states.size()));
		if (debug) Debug.debug(debug, t+" gives "+count+" rules");
	}

	// next tuple in base n; false once every tuple has been produced
	private static boolean advance(int[] digits, int n) {
		for (int i = digits.length-1; i >= 0; i--) {
			if (++digits[i] < n)
				return true;
			digits[i] = 0;
		}
		return false;
	}

	/**
	 * An automaton that accepts by empty stack exactly what pda accepts by final
	 * state. A fresh start state puts the original start stack symbol over a fresh
	 * bottom marker, so the stack cannot empty early; from any accepting state a
	 * fresh draining state may be entered, which pops everything.
	 */
	public static PDARuleSet toEmptyStack(PDARuleSet pda) {
		String p0 = SymbolFactory.getFreshName(pda.getStartState()+"_0", pda.getStates());
		HashSet<String> withStart = new HashSet<String>(pda.getStates());
		withStart.add(p0);
		String drain = SymbolFactory.getFreshName("drain", withStart);
		String bottom = SymbolFactory.getFreshName(pda.getStartStack()+"_0", pda.getStackAlphabet());

		PDARuleSet.Builder b = new PDARuleSet.Builder();
		b.addState(p0);
		for (String s : pda.getStates())
			b.addState(s);
		b.addState(drain);
		for (TerminalSymbol a : pda.getInputAlphabet())
			b.addInputSymbol(a);
		for (String y : pda.getStackAlphabet())
			b.addStackSymbol(y);
		b.addStackSymbol(bottom);
		b.setStartState(p0);
		b.setStartStack(bottom);

		List<String> stack = new ArrayList<String>(pda.getStackAlphabet());
		stack.add(bottom);
		List<String> init = new ArrayList<String>();
		init.add(pda.getStartStack());
		init.add(bottom);
		b.addTransition(new PDATransition(p0, Symbol.getEpsilon(), bottom, pda.getStartState(), init));
		for (PDATransition t : pda.getTransitions())
			b.addTransition(t);
		List<String> none = new ArrayList<String>();
		for (String f : pda.getAcceptingStates())
			for (String y : stack)
				b.addTransition(new PDATransition(f, Symbol.getEpsilon(), y, drain, none));
		for (String y : stack)
			b.addTransition(new PDATransition(drain, Symbol.getEpsilon(), y, drain, none));
		try {
			return b.build();
		}
		catch (DataFormatException e) {
			// everything used above was declared above
			throw new IllegalStateException("empty stack rewrite is inconsistent: "+e.getMessage(), e);
		}
	}
}
