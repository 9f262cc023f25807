package my.portfolioengine.app.service;

/**
 * Result of a quadratic-program solve: either solved with weights, or failed with a reason.
 */
public record SolverOutcome(
		double[] weights,
		boolean solved,
		String failureReason
) {
	public static SolverOutcome solved(double[] weights) {
		return new SolverOutcome(weights, true, null);
	}

	public static SolverOutcome failed(String reason) {
		return new SolverOutcome(null, false, reason);
	}
}
