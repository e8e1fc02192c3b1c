package edu.isi.cfgtools;

// the variable [p,X,q] of the pda to cfg construction: strings that take the
// automaton from state p with X on top of the stack to state q, having popped X.
// identity is the (state, stack symbol, state) triple, not the printed name
public class TripleSymbol extends NonterminalSymbol {
    private final String from;
    private final String stack;
    private final String to;
    public TripleSymbol(String p, String x, String q) {
	super("["+p+","+x+","+q+"]");
	from = p;
	stack = x;
	to = q;
    }
    public String getFromState() { return from; }
    public String getStackSymbol() { return stack; }
    public String getToState() { return to; }

    public int hashCode() {
	int h = from.hashCode();
	h = 31*h + stack.hashCode();
	return 31*h + to.hashCode();
    }
    public boolean equals(Object o) {
	if (o == null || !o.getClass().equals(this.getClass()))
	    return false;
	TripleSymbol t = (TripleSymbol)o;
	return from.equals(t.from) && stack.equals(t.stack) && to.equals(t.to);
    }
}
