package edu.isi.cfgtools;

// grammar symbol. the kind (terminal, nonterminal, or the epsilon marker)
// is carried by the value itself, never read off the spelling of the name
public abstract class Symbol {
    public static final String EPSILON_STRING = "*e*";

    private static final Symbol eps = new Symbol() {
	public String getName() { return EPSILON_STRING; }
	public boolean isTerminal() { return false; }
	public boolean isNonterminal() { return false; }
	public boolean isEpsilon() { return true; }
	public int hashCode() { return System.identityHashCode(this); }
	public boolean equals(Object o) { return this == o; }
    };

    /** the distinguished empty right hand side; neither a terminal nor a nonterminal */
    public static Symbol getEpsilon() {
	return eps;
    }

    abstract public String getName();
    abstract public boolean isTerminal();
    abstract public boolean isNonterminal();
    public boolean isEpsilon() { return false; }

    public String toString() { return getName(); }
}
