package my.portfolioengine.app.service;

import my.portfolioengine.app.config.AppProperties;
import my.portfolioengine.app.model.ReturnRiskEstimate;
import my.portfolioengine.app.service.util.WeightVectorUtil;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.MathUnsupportedOperationException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Solves {@code maximize mu'x - lambda x'Qx} subject to {@code sum(x) = 1, x >= 0} after repairing
 * the covariance matrix to be positive semidefinite. The program is handed to ojalgo's
 * {@link ExpressionsBasedModel}. Never throws: every failure is reported as a failed {@link SolverOutcome}.
 */
@Service
public class MeanVarianceOptimizer {
	private static final Logger logger = LoggerFactory.getLogger(MeanVarianceOptimizer.class);
	static final double MIN_EIGENVALUE = 1e-8;

	private final ExecutorService solverExecutor;
	private final Duration solverTimeout;
	private final int maxIterations;

	@Autowired
	public MeanVarianceOptimizer(@Qualifier("solverExecutor") ExecutorService solverExecutor, AppProperties properties) {
		this(solverExecutor, properties.optimizer().solverTimeout(), properties.optimizer().maxSolverIterations());
	}

	public MeanVarianceOptimizer(ExecutorService solverExecutor, Duration solverTimeout, int maxIterations) {
		this.solverExecutor = solverExecutor;
		this.solverTimeout = solverTimeout;
		this.maxIterations = maxIterations;
	}

	public SolverOutcome solve(ReturnRiskEstimate estimate, double riskAversion) {
		RealMatrix psd = repairPsd(estimate.covariance());
		RealVector mu = estimate.expectedReturns();

		SolverOutcome outcome = runBounded(psd, mu, riskAversion);
		if (!outcome.solved()) {
			return outcome;
		}
		double[] weights = WeightVectorUtil.clipNegatives(outcome.weights());
		double total = WeightVectorUtil.sum(weights);
		if (!(total > 0.0d) || !Double.isFinite(total)) {
			return SolverOutcome.failed("degenerate solution");
		}
		for (int i = 0; i < weights.length; i++) {
			weights[i] /= total;
		}
		return SolverOutcome.solved(weights);
	}

	/**
	 * Clips eigenvalues below {@value #MIN_EIGENVALUE} and rebuilds the symmetric {@code V diag(lambda) V'}.
	 * Falls back to {@code Q + 1e-8 I} when the decomposition fails.
	 */
	public static RealMatrix repairPsd(RealMatrix covariance) {
		int size = covariance.getRowDimension();
		try {
			EigenDecomposition decomposition = new EigenDecomposition(covariance);
			double[] eigenvalues = decomposition.getRealEigenvalues();
			double[] clipped = new double[eigenvalues.length];
			for (int i = 0; i < eigenvalues.length; i++) {
				clipped[i] = Math.max(eigenvalues[i], MIN_EIGENVALUE);
			}
			RealMatrix rebuilt = decomposition.getV()
					.multiply(MatrixUtils.createRealDiagonalMatrix(clipped))
					.multiply(decomposition.getVT());
			return rebuilt.add(rebuilt.transpose()).scalarMultiply(0.5d);
		} catch (MathIllegalArgumentException | MathIllegalStateException | MathArithmeticException
				 | MathUnsupportedOperationException ex) {
			logger.warn("Eigendecomposition failed, regularizing covariance instead: {}", ex.getMessage());
			return covariance.add(MatrixUtils.createRealIdentityMatrix(size).scalarMultiply(MIN_EIGENVALUE));
		}
	}

	private SolverOutcome runBounded(RealMatrix covariance, RealVector mu, double riskAversion) {
		if (solverExecutor == null || solverTimeout == null || solverTimeout.isZero() || solverTimeout.isNegative()) {
			return runGuarded(covariance, mu, riskAversion);
		}
		Future<SolverOutcome> future;
		try {
			future = solverExecutor.submit(() -> runGuarded(covariance, mu, riskAversion));
		} catch (RejectedExecutionException ex) {
			logger.warn("Solver executor rejected the task, solving inline: {}", ex.getMessage());
			return runGuarded(covariance, mu, riskAversion);
		}
		try {
			return future.get(solverTimeout.toNanos(), TimeUnit.NANOSECONDS);
		} catch (TimeoutException ex) {
			future.cancel(true);
			return SolverOutcome.failed("timed out after " + solverTimeout);
		} catch (InterruptedException ex) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			return SolverOutcome.failed("interrupted");
		} catch (ExecutionException ex) {
			Throwable cause = ex.getCause() == null ? ex : ex.getCause();
			return SolverOutcome.failed("solver error: " + cause.getMessage());
		}
	}

	private SolverOutcome runGuarded(RealMatrix covariance, RealVector mu, double riskAversion) {
		if (Thread.currentThread().isInterrupted()) {
			return SolverOutcome.failed("interrupted");
		}
		try {
			return minimize(covariance, mu, riskAversion);
		} catch (RuntimeException ex) {
			// any solver failure becomes a failed outcome
			return SolverOutcome.failed("solver error: " + ex.getMessage());
		}
	}

	private SolverOutcome minimize(RealMatrix covariance, RealVector mu, double riskAversion) {
		int size = mu.getDimension();
		if (size == 0) {
			return SolverOutcome.failed("empty problem");
		}
		ExpressionsBasedModel model = new ExpressionsBasedModel();
		model.options.iterations_abort = maxIterations;
		if (solverTimeout != null && !solverTimeout.isZero() && !solverTimeout.isNegative()) {
			model.options.time_abort = Math.max(1L, solverTimeout.toMillis());
		}

		Variable[] weights = new Variable[size];
		for (int i = 0; i < size; i++) {
			weights[i] = model.addVariable("w" + i).lower(0.0d);
		}
		Expression budget = model.addExpression("budget").level(1.0d);
		Expression objective = model.addExpression("objective").weight(1.0d);
		for (int i = 0; i < size; i++) {
			budget.set(weights[i], 1.0d);
			objective.set(weights[i], -mu.getEntry(i));
			for (int j = 0; j < size; j++) {
				double factor = riskAversion * covariance.getEntry(i, j);
				if (factor != 0.0d) {
					objective.set(weights[i], weights[j], factor);
				}
			}
		}

		Optimisation.Result result = model.minimise();
		if (Thread.currentThread().isInterrupted()) {
			return SolverOutcome.failed("interrupted");
		}
		Optimisation.State state = result.getState();
		if (!state.isOptimal()) {
			return SolverOutcome.failed("solver state " + state);
		}
		double[] solution = new double[size];
		for (int i = 0; i < size; i++) {
			solution[i] = result.doubleValue(i);
		}
		if (!WeightVectorUtil.allFinite(solution)) {
			return SolverOutcome.failed("non-finite solution");
		}
		return SolverOutcome.solved(solution);
	}
}
