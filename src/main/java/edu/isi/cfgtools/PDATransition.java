package edu.isi.cfgtools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// one move of a pushdown automaton: in state, reading input (a terminal or the
// epsilon marker) with stackTop on top of the stack, go to nextState and replace
// stackTop by push, whose first element ends up on top. an empty push pops
public class PDATransition {
	private final String state;
	private final Symbol input;
	private final String stackTop;
	private final String nextState;
	private final List<String> push;

	public PDATransition(String state, Symbol input, String stackTop, String nextState, List<String> push) {
		if (input.isNonterminal())
			throw new IllegalArgumentException("transition input must be a terminal or epsilon, not "+input);
		this.state = state;
		this.input = input;
		this.stackTop = stackTop;
		this.nextState = nextState;
		this.push = Collections.unmodifiableList(new ArrayList<String>(push));
	}

	public String getState() { return state; }
	public Symbol getInput() { return input; }
	public boolean isEpsilonMove() { return input.isEpsilon(); }
	public String getStackTop() { return stackTop; }
	public String getNextState() { return nextState; }
	public List<String> getPush() { return push; }

	public int hashCode() {
		int h = state.hashCode();
		h = 31*h + input.hashCode();
		h = 31*h + stackTop.hashCode();
		h = 31*h + nextState.hashCode();
		return 31*h + push.hashCode();
	}
	public boolean equals(Object o) {
		if (o == null || !o.getClass().equals(this.getClass()))
			return false;
		PDATransition t = (PDATransition)o;
		return state.equals(t.state) && input.equals(t.input) && stackTop.equals(t.stackTop) &&
			nextState.equals(t.nextState) && push.equals(t.push);
	}

	// same shape as a transition line of the pda file format
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(state+" "+input+" "+stackTop+" -> "+nextState);
		if (push.isEmpty())
			sb.append(" "+Symbol.EPSILON_STRING);
		for (String y : push)
			sb.append(" "+y);
		return sb.toString();
	}
}
