package edu.isi.cfgtools;
/** a rule or transition mentions a nonterminal, state or stack symbol that was never declared */
public class UndefinedSymbolException extends DataFormatException {
    private final String symbol;
    private final String context;
    public UndefinedSymbolException(String symbol, String context) {
	super("undefined symbol "+symbol+" in "+context);
	this.symbol = symbol;
	this.context = context;
    }
    /** the name of the undeclared symbol */
    public String getSymbol() { return symbol; }
    /** the rule or transition that referenced it */
    public String getContext() { return context; }
}
