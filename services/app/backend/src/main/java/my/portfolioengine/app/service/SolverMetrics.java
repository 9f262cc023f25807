package my.portfolioengine.app.service;

public record SolverMetrics(
		String solver,
		String failureReason,
		long elapsedMillis
) {
	public static final String SOLVER_QP = "qp";
	public static final String SOLVER_FALLBACK = "fallback";

	public boolean usedFallback() {
		return SOLVER_FALLBACK.equals(solver);
	}
}
