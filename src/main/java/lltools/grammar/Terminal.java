package lltools.grammar;

/**
 * A terminal symbol
 */
public class Terminal extends TerminalOrEpsilon {

	public Terminal(String name) {
		super(name);
	}

	@Override
	public Kind kind() {
		return Kind.TERMINAL;
	}
}
