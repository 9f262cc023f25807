package my.portfolioengine.app.service;

import my.portfolioengine.app.config.AppProperties;
import my.portfolioengine.app.dto.OptimizedWeightRowDto;
import my.portfolioengine.app.model.PricePanel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolls a fixed-size window over a price panel and optimizes every window against the universe of
 * the month the window ends in. Produces one row per symbol per window end date.
 */
@Service
public class OptimizedWeightsService {
	private static final Logger logger = LoggerFactory.getLogger(OptimizedWeightsService.class);
	public static final String ALGORITHM = "CEMV";

	private final PortfolioOptimizer portfolioOptimizer;
	private final OptimizerStatistics statistics;
	private final int windowSize;

	@Autowired
	public OptimizedWeightsService(PortfolioOptimizer portfolioOptimizer,
								   OptimizerStatistics statistics,
								   AppProperties properties) {
		this(portfolioOptimizer, statistics, properties.optimizer().windowSize());
	}

	public OptimizedWeightsService(PortfolioOptimizer portfolioOptimizer, OptimizerStatistics statistics, int windowSize) {
		if (windowSize < 2) {
			throw new IllegalArgumentException("Window size must be at least 2");
		}
		this.portfolioOptimizer = portfolioOptimizer;
		this.statistics = statistics;
		this.windowSize = windowSize;
	}

	public WeightGenerationResult computeWeights(PricePanel panel, UniverseProvider universeProvider) {
		if (panel == null || universeProvider == null) {
			throw new IllegalArgumentException("Price panel and universe provider are required");
		}
		List<OptimizedWeightRowDto> rows = new ArrayList<>();
		int processed = 0;
		int skipped = 0;
		int successes = 0;
		int fallbacks = 0;

		List<String> universe = List.of();
		int universeYear = -1;
		int universeMonth = -1;
		for (int end = windowSize - 1; end < panel.rowCount(); end++) {
			PricePanel window = panel.window(end - windowSize + 1, end + 1);
			LocalDate endOfPeriod = window.dates().get(window.rowCount() - 1);
			if (endOfPeriod.getYear() != universeYear || endOfPeriod.getMonthValue() != universeMonth || universe.isEmpty()) {
				universeYear = endOfPeriod.getYear();
				universeMonth = endOfPeriod.getMonthValue();
				List<String> resolved = universeProvider.symbolsFor(universeYear, universeMonth);
				universe = resolved == null ? List.of() : resolved;
			}

			PricePanel portfolio = window.select(universe);
			if (portfolio.columnCount() == 0) {
				logger.warn("No universe symbols with prices for window ending {}", endOfPeriod);
				skipped++;
				continue;
			}
			OptimizationResult result = portfolioOptimizer.optimize(portfolio);
			statistics.record(result.metrics());
			if (result.metrics().usedFallback()) {
				fallbacks++;
			} else {
				successes++;
			}
			for (int column = 0; column < result.size(); column++) {
				double lastPrice = portfolio.lastPrice(column);
				rows.add(new OptimizedWeightRowDto(
						endOfPeriod,
						result.symbols().get(column),
						Double.isNaN(lastPrice) ? null : lastPrice,
						result.initialWeights()[column],
						result.neutralizedWeights()[column],
						result.limitedWeights()[column],
						result.neutralizedLimitedWeights()[column],
						ALGORITHM
				));
			}
			processed++;
		}
		logger.info("Optimized {} windows ({} skipped, {} via fallback) producing {} weight rows",
				processed, skipped, fallbacks, rows.size());
		return new WeightGenerationResult(List.copyOf(rows), processed, skipped, successes, fallbacks);
	}
}
