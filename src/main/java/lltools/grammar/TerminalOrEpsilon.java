package lltools.grammar;

/**
 * Symbols that can be part of a first set.
 */
public abstract class TerminalOrEpsilon extends Symbol {

	protected TerminalOrEpsilon(String name) {
		super(name);
	}
}
