package my.portfolioengine.app.service;

import my.portfolioengine.app.model.ReturnRiskEstimate;
import my.portfolioengine.app.service.util.WeightVectorUtil;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Closed-form Lagrangian solution of the budget-constrained mean-variance problem, used when the
 * quadratic program fails. Uses the SVD pseudoinverse of the regularized covariance.
 */
@Service
public class AnalyticalFallbackSolver {
	private static final Logger logger = LoggerFactory.getLogger(AnalyticalFallbackSolver.class);
	static final double REGULARIZATION = 1e-8;
	static final double DEGENERATE_THRESHOLD = 1e-12;

	public double[] solve(ReturnRiskEstimate estimate, double riskAversion) {
		int size = estimate.assetCount();
		if (size == 0) {
			return new double[0];
		}
		try {
			RealMatrix regularized = estimate.covariance()
					.add(MatrixUtils.createRealIdentityMatrix(size).scalarMultiply(REGULARIZATION));
			RealMatrix pseudoInverse = new SingularValueDecomposition(regularized).getSolver().getInverse();
			RealVector mu = estimate.expectedReturns();

			double b = sumEntries(pseudoInverse);
			if (Math.abs(b) < DEGENERATE_THRESHOLD || !Double.isFinite(b)) {
				return WeightVectorUtil.equalWeights(size);
			}
			double cSum = WeightVectorUtil.sum(pseudoInverse.operate(mu).toArray());
			double nu = 2.0d * riskAversion * (cSum - 1.0d) / b;
			double[] x = pseudoInverse.operate(mu.mapSubtract(nu))
					.mapMultiply(1.0d / (2.0d * riskAversion))
					.toArray();

			double[] clipped = WeightVectorUtil.clipNegatives(x);
			double total = WeightVectorUtil.sum(clipped);
			if (total > DEGENERATE_THRESHOLD && Double.isFinite(total)) {
				for (int i = 0; i < clipped.length; i++) {
					clipped[i] /= total;
				}
				return clipped;
			}
			return WeightVectorUtil.equalWeights(size);
		} catch (MathIllegalArgumentException | MathIllegalStateException | MathArithmeticException ex) {
			logger.warn("Analytical solver failed for {} assets, using equal weights: {}", size, ex.getMessage());
			return WeightVectorUtil.equalWeights(size);
		}
	}

	private static double sumEntries(RealMatrix matrix) {
		double total = 0.0d;
		for (int row = 0; row < matrix.getRowDimension(); row++) {
			for (int column = 0; column < matrix.getColumnDimension(); column++) {
				total += matrix.getEntry(row, column);
			}
		}
		return total;
	}
}
