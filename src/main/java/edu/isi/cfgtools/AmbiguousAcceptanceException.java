package edu.isi.cfgtools;

import java.util.Set;

/** an automaton has other than one accepting state and no acceptance mode was chosen */
public class AmbiguousAcceptanceException extends ConfigureException {
    private final Set<String> accepting;
    public AmbiguousAcceptanceException(Set<String> accepting) {
	super("automaton has "+accepting.size()+" accepting states "+accepting+
	      "; choose an acceptance mode ("+AcceptanceMode.getList().trim()+")");
	this.accepting = accepting;
    }
    public Set<String> getAcceptingStates() { return accepting; }
}
