package lltools.grammar;

import lltools.LLToolsException;

/**
 * Thrown if a grammar violates the basic rules of its representation, e.g. a name that is used
 * both as a terminal and as a non terminal.
 */
public class InvalidGrammarException extends LLToolsException {

	public InvalidGrammarException(String message) {
		super(message);
	}
}
