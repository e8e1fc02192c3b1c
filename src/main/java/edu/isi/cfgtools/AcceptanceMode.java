package edu.isi.cfgtools;

// how a pushdown automaton accepts, and so which triples the converted grammar starts from
public enum AcceptanceMode {
	// the whole stack, start symbol included, is popped. the final state is irrelevant
	EMPTY_STACK("empty"),
	// some accepting state is entered, whatever is left on the stack
	FINAL_STATE("final"),
	// the start stack symbol is popped and the automaton is then in an accepting state
	EMPTY_STACK_IN_FINAL_STATE("emptyfinal");

	private final String flag;
	private AcceptanceMode(String f) { flag = f; }
	public String getFlag() { return flag; }

	private static final String list;
	public static final String getList() { return list;}
	static {
		StringBuffer sb = new StringBuffer();
		for (AcceptanceMode x: AcceptanceMode.values()) {
			sb.append(x.flag+" ");
		}
		list = sb.toString();
	}
	public static AcceptanceMode get(String s) throws ConfigureException {
		for (AcceptanceMode x : AcceptanceMode.values()) {
			if (x.flag.equals(s) || x.toString().equals(s))
				return x;
		}
		throw new ConfigureException("Invalid acceptance mode ("+s+"); valid values are "+list);
	}
}
