package my.portfolioengine.app.service;

import my.portfolioengine.app.config.AppProperties;
import my.portfolioengine.app.dto.IndexCloseDto;
import my.portfolioengine.app.dto.OptimizedWeightRowDto;
import my.portfolioengine.app.model.PnlComparisonPoint;
import my.portfolioengine.app.model.PnlPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Backtests stored weights against a notional book. The return applied on row {@code i} uses the
 * weights and prices of row {@code i - lag}, so the first {@code lag} rows stay at the starting book.
 */
@Service
public class PortfolioPnlCalculator {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioPnlCalculator.class);

	private final double bookSize;
	private final int returnLag;

	@Autowired
	public PortfolioPnlCalculator(AppProperties properties) {
		this(properties.analytics().bookSize(), properties.analytics().returnLag());
	}

	public PortfolioPnlCalculator(double bookSize, int returnLag) {
		if (!(bookSize > 0.0d)) {
			throw new IllegalArgumentException("Book size must be positive");
		}
		if (returnLag < 1) {
			throw new IllegalArgumentException("Return lag must be at least 1");
		}
		this.bookSize = bookSize;
		this.returnLag = returnLag;
	}

	public List<PnlPoint> portfolioPnl(List<OptimizedWeightRowDto> rows, PortfolioStrategy strategy) {
		if (strategy == null) {
			throw new IllegalArgumentException("Strategy is required");
		}
		if (rows == null || rows.isEmpty()) {
			return List.of();
		}
		NavigableMap<LocalDate, Map<String, OptimizedWeightRowDto>> byDate = new TreeMap<>();
		TreeSet<String> symbolSet = new TreeSet<>();
		for (OptimizedWeightRowDto row : rows) {
			if (row == null || row.date() == null || row.symbol() == null) {
				continue;
			}
			byDate.computeIfAbsent(row.date(), date -> new HashMap<>()).put(row.symbol(), row);
			symbolSet.add(row.symbol());
		}
		List<String> symbols = new ArrayList<>(symbolSet);
		List<LocalDate> dates = new ArrayList<>(byDate.keySet());

		double[][] weights = new double[dates.size()][symbols.size()];
		double[][] prices = new double[dates.size()][symbols.size()];
		double[] lastSeen = new double[symbols.size()];
		Arrays.fill(lastSeen, Double.NaN);
		for (int i = 0; i < dates.size(); i++) {
			Map<String, OptimizedWeightRowDto> bySymbol = byDate.get(dates.get(i));
			for (int j = 0; j < symbols.size(); j++) {
				OptimizedWeightRowDto row = bySymbol.get(symbols.get(j));
				if (row != null) {
					weights[i][j] = finiteOrZero(strategy.weightOf(row));
					if (row.marketPrice() != null && !row.marketPrice().isNaN()) {
						lastSeen[j] = row.marketPrice();
					}
				}
				// forward fill
				prices[i][j] = lastSeen[j];
			}
		}

		List<PnlPoint> points = new ArrayList<>(dates.size());
		double value = bookSize;
		for (int i = 0; i < dates.size(); i++) {
			if (i >= returnLag) {
				int previous = i - returnLag;
				double portfolioReturn = 0.0d;
				for (int j = 0; j < symbols.size(); j++) {
					double priceReturn = (prices[i][j] - prices[previous][j]) / prices[previous][j];
					portfolioReturn += weights[previous][j] * finiteOrZero(priceReturn);
				}
				value *= 1.0d + portfolioReturn;
			}
			points.add(point(dates.get(i), value));
		}
		logger.debug("Computed {} PnL points for {} over {} symbols", points.size(), strategy.key(), symbols.size());
		return List.copyOf(points);
	}

	public List<PnlPoint> indexPnl(List<IndexCloseDto> closes) {
		if (closes == null || closes.isEmpty()) {
			return List.of();
		}
		List<IndexCloseDto> sorted = closes.stream()
				.filter(Objects::nonNull)
				.filter(close -> close.date() != null)
				.sorted(Comparator.comparing(IndexCloseDto::date))
				.toList();
		List<PnlPoint> points = new ArrayList<>(sorted.size());
		double value = bookSize;
		for (int i = 0; i < sorted.size(); i++) {
			if (i >= returnLag) {
				double previous = closeOf(sorted.get(i - returnLag));
				double current = closeOf(sorted.get(i));
				double priceReturn = previous > 0.0d ? (current - previous) / previous : 0.0d;
				value *= 1.0d + finiteOrZero(priceReturn);
			}
			points.add(point(sorted.get(i).date(), value));
		}
		return List.copyOf(points);
	}

	/**
	 * Joins two PnL series on the union of their dates. Gaps carry the last known value forward;
	 * dates before a series starts read as 0.
	 */
	public List<PnlComparisonPoint> align(List<PnlPoint> portfolio, List<PnlPoint> index) {
		Map<LocalDate, Double> portfolioByDate = byDate(portfolio);
		Map<LocalDate, Double> indexByDate = byDate(index);
		TreeSet<LocalDate> dates = new TreeSet<>(portfolioByDate.keySet());
		dates.addAll(indexByDate.keySet());

		List<PnlComparisonPoint> aligned = new ArrayList<>(dates.size());
		double lastPortfolio = 0.0d;
		double lastIndex = 0.0d;
		for (LocalDate date : dates) {
			lastPortfolio = portfolioByDate.getOrDefault(date, lastPortfolio);
			lastIndex = indexByDate.getOrDefault(date, lastIndex);
			aligned.add(new PnlComparisonPoint(date, lastPortfolio, lastIndex));
		}
		return List.copyOf(aligned);
	}

	private PnlPoint point(LocalDate date, double value) {
		return new PnlPoint(date, value, (value / bookSize - 1.0d) * 100.0d);
	}

	private static Map<LocalDate, Double> byDate(List<PnlPoint> points) {
		Map<LocalDate, Double> byDate = new LinkedHashMap<>();
		if (points != null) {
			for (PnlPoint point : points) {
				byDate.put(point.date(), point.pnlPct());
			}
		}
		return byDate;
	}

	private static double closeOf(IndexCloseDto close) {
		return close.closeIndex() == null ? Double.NaN : close.closeIndex();
	}

	private static double finiteOrZero(double value) {
		return Double.isFinite(value) ? value : 0.0d;
	}
}
