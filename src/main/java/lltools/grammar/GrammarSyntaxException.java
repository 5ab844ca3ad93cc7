package lltools.grammar;

import lltools.LocatedLLToolsException;
import lltools.Location;

/**
 * An error thrown after encountering a malformed line in a grammar text
 */
public class GrammarSyntaxException extends LocatedLLToolsException {

	public GrammarSyntaxException(Location location, String message) {
		super(location, message);
	}
}
