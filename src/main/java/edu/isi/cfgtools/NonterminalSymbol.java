package edu.isi.cfgtools;

// symbol rewritten by rules. a terminal with the same name is a different symbol
public class NonterminalSymbol extends Symbol {
    private final String name;
    public NonterminalSymbol(String s) {
	if (s == null || s.length() == 0)
	    throw new IllegalArgumentException("nonterminal needs a non-empty name");
	name = s;
    }
    public String getName() { return name; }
    public boolean isTerminal() { return false; }
    public boolean isNonterminal() { return true; }

    public int hashCode() { return 31*name.hashCode()+2; }
    public boolean equals(Object o) {
	if (o == null || !o.getClass().equals(this.getClass()))
	    return false;
	return name.equals(((NonterminalSymbol)o).name);
    }
}
