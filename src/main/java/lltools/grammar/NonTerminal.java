package lltools.grammar;

/**
 * A non terminal symbol, its productions are stored in the grammar.
 */
public class NonTerminal extends Symbol {

	public NonTerminal(String name) {
		super(name);
	}

	@Override
	public Kind kind() {
		return Kind.NONTERMINAL;
	}
}
