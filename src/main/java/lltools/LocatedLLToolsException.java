package lltools;

public class LocatedLLToolsException extends LLToolsException {

	public final Location errorLocation;

	public LocatedLLToolsException(Location errorLocation, String message) {
		super(String.format("Error at %s: %s", errorLocation, message));
		this.errorLocation = errorLocation;
	}
}
