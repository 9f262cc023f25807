package my.portfolioengine.app.service;

import java.util.List;

/**
 * The four weight vectors of one optimization run, aligned with {@code symbols}.
 */
public record OptimizationResult(
		List<String> symbols,
		double[] initialWeights,
		double[] neutralizedWeights,
		double[] limitedWeights,
		double[] neutralizedLimitedWeights,
		SolverMetrics metrics
) {
	public static OptimizationResult empty() {
		return new OptimizationResult(List.of(), new double[0], new double[0], new double[0], new double[0],
				new SolverMetrics(SolverMetrics.SOLVER_QP, null, 0L));
	}

	public int size() {
		return symbols.size();
	}
}
