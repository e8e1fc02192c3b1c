package edu.isi.cfgtools;
/** a grammar without a start nonterminal, or an automaton without a start state or start stack symbol */
public class NoStartSymbolException extends DataFormatException {
    private final String missing;
    public NoStartSymbolException(String missing) {
	super("no "+missing+" was designated");
	this.missing = missing;
    }
    /** which designation is missing, e.g. "start state" */
    public String getMissing() { return missing; }
}
