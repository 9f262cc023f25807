package my.portfolioengine.app.service;

import my.portfolioengine.app.config.AppProperties;
import my.portfolioengine.app.model.PricePanel;
import my.portfolioengine.app.model.ReturnRiskEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * CEMV optimization of a price panel: estimate returns and risk, solve the quadratic program
 * (or the analytical fallback when it fails), then derive the four weight policies.
 */
@Service
public class PortfolioOptimizer {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioOptimizer.class);

	private final ReturnRiskEstimator estimator;
	private final MeanVarianceOptimizer meanVarianceOptimizer;
	private final AnalyticalFallbackSolver fallbackSolver;
	private final double riskAversion;
	private final double maxWeight;

	@Autowired
	public PortfolioOptimizer(ReturnRiskEstimator estimator,
							  MeanVarianceOptimizer meanVarianceOptimizer,
							  AnalyticalFallbackSolver fallbackSolver,
							  AppProperties properties) {
		this(estimator, meanVarianceOptimizer, fallbackSolver,
				properties.optimizer().riskAversion(), properties.optimizer().maxWeight());
	}

	public PortfolioOptimizer(ReturnRiskEstimator estimator,
							  MeanVarianceOptimizer meanVarianceOptimizer,
							  AnalyticalFallbackSolver fallbackSolver,
							  double riskAversion,
							  double maxWeight) {
		this.estimator = estimator;
		this.meanVarianceOptimizer = meanVarianceOptimizer;
		this.fallbackSolver = fallbackSolver;
		this.riskAversion = riskAversion;
		this.maxWeight = maxWeight;
	}

	public OptimizationResult optimize(PricePanel panel) {
		if (panel == null) {
			throw new IllegalArgumentException("Price panel is required");
		}
		if (panel.columnCount() == 0) {
			return OptimizationResult.empty();
		}
		ReturnRiskEstimate estimate = estimator.estimate(panel);

		long started = System.nanoTime();
		SolverOutcome outcome = meanVarianceOptimizer.solve(estimate, riskAversion);
		double[] raw;
		SolverMetrics metrics;
		if (outcome.solved()) {
			raw = outcome.weights();
			metrics = new SolverMetrics(SolverMetrics.SOLVER_QP, null, elapsedMillis(started));
		} else {
			logger.warn("Quadratic solver failed for {} assets ({}), using analytical fallback",
					panel.columnCount(), outcome.failureReason());
			raw = fallbackSolver.solve(estimate, riskAversion);
			metrics = new SolverMetrics(SolverMetrics.SOLVER_FALLBACK, outcome.failureReason(), elapsedMillis(started));
		}

		double[] initial = WeightTransforms.normalizeExact(raw);
		double[] neutralized = WeightTransforms.neutralizeExact(initial);
		double[] limited = WeightTransforms.normalizeLimit(initial, maxWeight);
		double[] neutralizedLimited = WeightTransforms.neutralizeLimit(initial, maxWeight);
		return new OptimizationResult(panel.symbols(), initial, neutralized, limited, neutralizedLimited, metrics);
	}

	private static long elapsedMillis(long startedNanos) {
		return (System.nanoTime() - startedNanos) / 1_000_000L;
	}
}
