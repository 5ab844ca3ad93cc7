package lltools.transform;

import lltools.LLToolsException;

/**
 * Thrown if a transformation didn't reach its fix point within the allowed number of passes.
 */
public class NonConvergenceException extends LLToolsException {

	public final int passes;

	public NonConvergenceException(String transformation, int passes) {
		super(String.format("%s did not converge after %d passes", transformation, passes));
		this.passes = passes;
	}
}
