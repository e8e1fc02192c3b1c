package edu.isi.cfgtools;
/** the epsilon marker appears in a right hand side alongside other symbols */
public class MalformedEpsilonException extends DataFormatException {
    private final String context;
    public MalformedEpsilonException(String context) {
	super("epsilon must be the entire right hand side, but saw "+context);
	this.context = context;
    }
    public String getContext() { return context; }
}
