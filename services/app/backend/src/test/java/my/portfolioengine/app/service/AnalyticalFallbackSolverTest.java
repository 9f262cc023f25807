package my.portfolioengine.app.service;

import my.portfolioengine.app.model.ReturnRiskEstimate;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnalyticalFallbackSolverTest {
	private final AnalyticalFallbackSolver solver = new AnalyticalFallbackSolver();

	@Test
	void identityCovarianceRanksByExpectedReturn() {
		ReturnRiskEstimate estimate = new ReturnRiskEstimate(
				new ArrayRealVector(new double[]{0.01d, 0.02d, 0.03d}),
				MatrixUtils.createRealIdentityMatrix(3));

		double[] weights = solver.solve(estimate, 0.01d);

		assertThat(weights[0] + weights[1] + weights[2]).isCloseTo(1.0d, within(1e-12));
		assertThat(weights[2]).isGreaterThan(weights[1]);
		assertThat(weights[1]).isGreaterThan(weights[0]);
		assertThat(weights[0]).isGreaterThanOrEqualTo(0.0d);
	}

	@Test
	void singularCovarianceStillProducesValidWeights() {
		RealMatrix singular = MatrixUtils.createRealMatrix(new double[][]{{1.0d, 1.0d}, {1.0d, 1.0d}});
		ReturnRiskEstimate estimate = new ReturnRiskEstimate(new ArrayRealVector(new double[]{0.02d, 0.01d}), singular);

		double[] weights = solver.solve(estimate, 0.01d);

		assertThat(weights[0] + weights[1]).isCloseTo(1.0d, within(1e-9));
		assertThat(weights[0]).isGreaterThanOrEqualTo(0.0d);
		assertThat(weights[1]).isGreaterThanOrEqualTo(0.0d);
	}

	@Test
	void allNegativeSolutionFallsBackToEqualWeights() {
		ReturnRiskEstimate estimate = new ReturnRiskEstimate(
				new ArrayRealVector(new double[]{-1.0d, -1.0d, -1.0d}),
				MatrixUtils.createRealIdentityMatrix(3));

		double[] weights = solver.solve(estimate, 0.01d);

		assertThat(weights).containsExactly(1.0d / 3, 1.0d / 3, 1.0d / 3);
	}

	@Test
	void emptyEstimateYieldsEmptyWeights() {
		ReturnRiskEstimate estimate = new ReturnRiskEstimate(new ArrayRealVector(0), MatrixUtils.createRealMatrix(1, 1));

		assertThat(solver.solve(estimate, 0.01d)).isEmpty();
	}
}
