package edu.isi.cfgtools;

// symbol that appears in derived strings and is never rewritten
public class TerminalSymbol extends Symbol {
    private final String name;
    public TerminalSymbol(String s) {
	if (s == null || s.length() == 0)
	    throw new IllegalArgumentException("terminal needs a non-empty name");
	name = s;
    }
    public String getName() { return name; }
    public boolean isTerminal() { return true; }
    public boolean isNonterminal() { return false; }

    public int hashCode() { return 31*name.hashCode()+1; }
    public boolean equals(Object o) {
	if (o == null || !o.getClass().equals(this.getClass()))
	    return false;
	return name.equals(((TerminalSymbol)o).name);
    }
}
