package edu.isi.cfgtools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// A pushdown automaton: states, input alphabet, stack alphabet, transitions,
// start state, start stack symbol and accepting states. Immutable once built.
// States and stack symbols are plain names; they live in their own namespaces
// and only become grammar symbols inside the [p,X,q] triples of the conversion.
public class PDARuleSet {

	private final Set<String> states;
	private final Set<TerminalSymbol> inputAlphabet;
	private final Set<String> stackAlphabet;
	private final List<PDATransition> transitions;
	private final String startState;
	private final String startStack;
	private final Set<String> acceptingStates;

	private PDARuleSet(Builder b) {
		states = Collections.unmodifiableSet(new LinkedHashSet<String>(b.states));
		inputAlphabet = Collections.unmodifiableSet(new LinkedHashSet<TerminalSymbol>(b.inputAlphabet));
		stackAlphabet = Collections.unmodifiableSet(new LinkedHashSet<String>(b.stackAlphabet));
		transitions = Collections.unmodifiableList(new ArrayList<PDATransition>(b.transitions));
		startState = b.startState;
		startStack = b.startStack;
		acceptingStates = Collections.unmodifiableSet(new LinkedHashSet<String>(b.acceptingStates));
	}

	public Set<String> getStates() { return states; }
	public Set<TerminalSymbol> getInputAlphabet() { return inputAlphabet; }
	public Set<String> getStackAlphabet() { return stackAlphabet; }
	public List<PDATransition> getTransitions() { return transitions; }
	public String getStartState() { return startState; }
	public String getStartStack() { return startStack; }
	public Set<String> getAcceptingStates() { return acceptingStates; }

	public int getNumStates() { return states.size(); }
	public int getNumTransitions() { return transitions.size(); }

	// the moves available in state reading input with top on the stack
	public List<PDATransition> getTransitions(String state, Symbol input, String top) {
		ArrayList<PDATransition> v = new ArrayList<PDATransition>();
		for (PDATransition t : transitions)
			if (t.getState().equals(state) && t.getInput().equals(input) && t.getStackTop().equals(top))
				v.add(t);
		return v;
	}

	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("states");
		for (String s : states)
			sb.append(" "+s);
		sb.append("\ninput");
		for (TerminalSymbol a : inputAlphabet)
			sb.append(" "+a);
		sb.append("\nstack");
		for (String x : stackAlphabet)
			sb.append(" "+x);
		sb.append("\nstart "+startState+"\nbottom "+startStack+"\naccept");
		for (String f : acceptingStates)
			sb.append(" "+f);
		sb.append("\n");
		for (PDATransition t : transitions)
			sb.append(t+"\n");
		return sb.toString();
	}

	// collects the parts of an automaton. by default every state, stack symbol and
	// input symbol has to be declared before build() is called; inferAlphabets()
	// instead declares whatever the transitions, start and accepting states mention
	public static class Builder {
		private final LinkedHashSet<String> states = new LinkedHashSet<String>();
		private final LinkedHashSet<TerminalSymbol> inputAlphabet = new LinkedHashSet<TerminalSymbol>();
		private final LinkedHashSet<String> stackAlphabet = new LinkedHashSet<String>();
		private final LinkedHashSet<PDATransition> transitions = new LinkedHashSet<PDATransition>();
		private final LinkedHashSet<String> acceptingStates = new LinkedHashSet<String>();
		private String startState = null;
		private String startStack = null;
		private boolean infer = false;

		public Builder addState(String s) { states.add(s); return this; }
		public Builder addInputSymbol(TerminalSymbol a) { inputAlphabet.add(a); return this; }
		public Builder addInputSymbol(String a) { return addInputSymbol(SymbolFactory.getTerminal(a)); }
		public Builder addStackSymbol(String x) { stackAlphabet.add(x); return this; }
		public Builder addAcceptingState(String s) { acceptingStates.add(s); return this; }
		public Builder setStartState(String s) { startState = s; return this; }
		public Builder setStartStack(String x) { startStack = x; return this; }
		public Builder inferAlphabets() { infer = true; return this; }

		// duplicates are ignored: the moves from a configuration form a set
		public Builder addTransition(PDATransition t) { transitions.add(t); return this; }

		public Builder addTransition(String p, String a, String x, String q, String... push) {
			Symbol in = Symbol.EPSILON_STRING.equals(a) ? Symbol.getEpsilon() : SymbolFactory.getTerminal(a);
			ArrayList<String> v = new ArrayList<String>();
			if (!(push.length == 1 && Symbol.EPSILON_STRING.equals(push[0])))
				Collections.addAll(v, push);
			return addTransition(new PDATransition(p, in, x, q, v));
		}

		public PDARuleSet build() throws DataFormatException {
			boolean debug = false;
			if (startState == null)
				throw new NoStartSymbolException("start state");
			if (startStack == null)
				throw new NoStartSymbolException("start stack symbol");
			if (infer) {
				if (debug) Debug.debug(debug, "Inferring alphabets from "+transitions.size()+" transitions");
				states.add(startState);
				states.addAll(acceptingStates);
				stackAlphabet.add(startStack);
				for (PDATransition t : transitions) {
					states.add(t.getState());
					states.add(t.getNextState());
					stackAlphabet.add(t.getStackTop());
					stackAlphabet.addAll(t.getPush());
					if (!t.isEpsilonMove())
						inputAlphabet.add((TerminalSymbol)t.getInput());
				}
			}
			if (!states.contains(startState))
				throw new UndefinedSymbolException(startState, "start state designation");
			if (!stackAlphabet.contains(startStack))
				throw new UndefinedSymbolException(startStack, "start stack designation");
			for (String f : acceptingStates)
				if (!states.contains(f))
					throw new UndefinedSymbolException(f, "accepting states");
			for (PDATransition t : transitions) {
				if (!states.contains(t.getState()))
					throw new UndefinedSymbolException(t.getState(), t.toString());
				if (!states.contains(t.getNextState()))
					throw new UndefinedSymbolException(t.getNextState(), t.toString());
				if (!stackAlphabet.contains(t.getStackTop()))
					throw new UndefinedSymbolException(t.getStackTop(), t.toString());
				for (String y : t.getPush())
					if (!stackAlphabet.contains(y))
						throw new UndefinedSymbolException(y, t.toString());
				if (!t.isEpsilonMove() && !inputAlphabet.contains(t.getInput()))
					throw new UndefinedSymbolException(t.getInput().toString(), t.toString());
			}
			return new PDARuleSet(this);
		}
	}
}
