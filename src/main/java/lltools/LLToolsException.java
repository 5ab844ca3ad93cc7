package lltools;

/**
 * Base class of all exceptions thrown by the grammar tools.
 */
public class LLToolsException extends RuntimeException {

	public LLToolsException(String message) {
		super(message);
	}
}
