package my.portfolioengine.app.service;

import my.portfolioengine.app.config.AppProperties;
import my.portfolioengine.app.dto.RiskMetricsDto;
import my.portfolioengine.app.model.PnlPoint;
import my.portfolioengine.app.model.RollingRiskPoint;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Risk and performance metrics of a PnL series over its most recent {@code tradingDays} points.
 * Daily returns are {@code value[i] / value[i-1] - 1}; drawdown is measured from the running peak
 * of the whole series.
 */
@Service
public class PortfolioRiskCalculator {
	private static final double DAY_CAP_PCT = 1000.0d;

	private final int tradingDays;
	private final double riskFreeRate;
	private final double varLevel;
	private final int rollingWindow;

	@Autowired
	public PortfolioRiskCalculator(AppProperties properties) {
		this(properties.analytics().tradingDays(), properties.analytics().riskFreeRate(),
				properties.analytics().varLevel(), properties.analytics().rollingWindow());
	}

	public PortfolioRiskCalculator(int tradingDays, double riskFreeRate, double varLevel, int rollingWindow) {
		if (tradingDays < 1) {
			throw new IllegalArgumentException("Trading days must be at least 1");
		}
		if (!(varLevel > 0.0d && varLevel < 1.0d)) {
			throw new IllegalArgumentException("VaR level must lie strictly between 0 and 1");
		}
		if (rollingWindow < 2) {
			throw new IllegalArgumentException("Rolling window must be at least 2");
		}
		this.tradingDays = tradingDays;
		this.riskFreeRate = riskFreeRate;
		this.varLevel = varLevel;
		this.rollingWindow = rollingWindow;
	}

	public RiskMetricsDto calculate(List<PnlPoint> series) {
		if (series == null || series.isEmpty()) {
			throw new IllegalArgumentException("PnL series is empty");
		}
		int from = Math.max(0, series.size() - tradingDays);
		double[] returns = dailyReturns(series, Math.max(1, from));
		double annualization = Math.sqrt(tradingDays);
		double dailyRiskFree = riskFreeRate / tradingDays;

		double totalReturn = series.get(series.size() - 1).pnlPct();
		double maxReturn = Double.NEGATIVE_INFINITY;
		double minReturn = Double.POSITIVE_INFINITY;
		for (int i = from; i < series.size(); i++) {
			maxReturn = Math.max(maxReturn, series.get(i).pnlPct());
			minReturn = Math.min(minReturn, series.get(i).pnlPct());
		}

		DescriptiveStatistics all = new DescriptiveStatistics();
		DescriptiveStatistics downside = new DescriptiveStatistics();
		for (double value : returns) {
			all.addValue(value);
			if (value < dailyRiskFree) {
				downside.addValue(value);
			}
		}

		double dailyVolatility = 0.0d;
		double downsideVolatility = 0.0d;
		if (returns.length >= 2) {
			dailyVolatility = finiteOrZero(all.getStandardDeviation());
			if (downside.getN() > 0) {
				downsideVolatility = finiteOrZero(downside.getStandardDeviation()) * annualization;
			}
		}

		double sharpe = 0.0d;
		double sortino = 0.0d;
		if (returns.length > 0) {
			double std = all.getStandardDeviation();
			if (std > 0.0d && Double.isFinite(std)) {
				sharpe = finiteOrZero((all.getMean() - dailyRiskFree) / std * annualization);
			}
			double downsideStd = downside.getN() > 0 ? downside.getStandardDeviation() : 0.0d;
			if (downsideStd > 0.0d && Double.isFinite(downsideStd)) {
				sortino = finiteOrZero((all.getMean() - dailyRiskFree) / downsideStd * annualization);
			}
		}

		double maxDrawdownPct = maxDrawdown(series, from) * 100.0d;
		double calmar = maxDrawdownPct != 0.0d ? totalReturn / Math.abs(maxDrawdownPct) : 0.0d;

		double valueAtRisk = 0.0d;
		double conditionalValueAtRisk = 0.0d;
		double winRate = 0.0d;
		double bestDay = 0.0d;
		double worstDay = 0.0d;
		double skewness = 0.0d;
		double kurtosis = 0.0d;
		if (returns.length > 0) {
			valueAtRisk = finiteOrZero(new Percentile()
					.withEstimationType(Percentile.EstimationType.R_7)
					.evaluate(returns, varLevel * 100.0d));
			DescriptiveStatistics tail = new DescriptiveStatistics();
			int wins = 0;
			for (double value : returns) {
				if (value <= valueAtRisk) {
					tail.addValue(value);
				}
				if (value > 0.0d) {
					wins++;
				}
			}
			conditionalValueAtRisk = tail.getN() > 0 ? finiteOrZero(tail.getMean()) : 0.0d;
			winRate = wins * 100.0d / returns.length;
			bestDay = Math.min(all.getMax() * 100.0d, DAY_CAP_PCT);
			worstDay = Math.max(all.getMin() * 100.0d, -DAY_CAP_PCT);
			if (returns.length > 2) {
				skewness = finiteOrZero(all.getSkewness());
				kurtosis = finiteOrZero(all.getKurtosis());
			}
		}

		return new RiskMetricsDto(
				round(totalReturn, 2),
				round(maxReturn, 2),
				round(minReturn, 2),
				round(dailyVolatility * 100.0d, 2),
				round(dailyVolatility * annualization * 100.0d, 2),
				round(downsideVolatility * 100.0d, 2),
				round(sharpe, 2),
				round(sortino, 2),
				round(maxDrawdownPct, 2),
				round(calmar, 2),
				round((1.0d - varLevel) * 100.0d, 2),
				round(valueAtRisk * 100.0d, 4),
				round(conditionalValueAtRisk * 100.0d, 4),
				round(winRate, 2),
				round(bestDay, 2),
				round(worstDay, 2),
				round(skewness, 2),
				round(kurtosis, 2)
		);
	}

	/**
	 * Rolling annualized Sharpe ratio and volatility over {@code rollingWindow} daily returns.
	 * Windows with zero volatility are left out.
	 */
	public List<RollingRiskPoint> rollingMetrics(List<PnlPoint> series) {
		if (series == null || series.size() < 2) {
			return List.of();
		}
		int from = Math.max(1, series.size() - tradingDays);
		double annualization = Math.sqrt(tradingDays);
		double dailyRiskFree = riskFreeRate / tradingDays;
		DescriptiveStatistics window = new DescriptiveStatistics(rollingWindow);
		List<RollingRiskPoint> points = new ArrayList<>();
		for (int i = from; i < series.size(); i++) {
			window.addValue(dailyReturn(series, i));
			if (window.getN() < rollingWindow) {
				continue;
			}
			double std = window.getStandardDeviation();
			if (!(std > 0.0d) || !Double.isFinite(std)) {
				continue;
			}
			points.add(new RollingRiskPoint(
					series.get(i).date(),
					(window.getMean() - dailyRiskFree) / std * annualization,
					std * annualization * 100.0d));
		}
		return List.copyOf(points);
	}

	/**
	 * Excess return over the benchmark, penalized by half the excess volatility and 0.3 of the
	 * excess drawdown.
	 */
	public double fitnessScore(RiskMetricsDto portfolio, RiskMetricsDto benchmark) {
		double excessReturn = portfolio.totalReturnPct() - benchmark.totalReturnPct();
		double volatilityPenalty = (portfolio.annualizedVolatilityPct() - benchmark.annualizedVolatilityPct()) * 0.5d;
		double drawdownPenalty = (Math.abs(portfolio.maxDrawdownPct()) - Math.abs(benchmark.maxDrawdownPct())) * 0.3d;
		return round(excessReturn - volatilityPenalty - drawdownPenalty, 2);
	}

	private static double[] dailyReturns(List<PnlPoint> series, int from) {
		double[] returns = new double[Math.max(0, series.size() - from)];
		for (int i = from; i < series.size(); i++) {
			returns[i - from] = dailyReturn(series, i);
		}
		return returns;
	}

	private static double dailyReturn(List<PnlPoint> series, int index) {
		double previous = series.get(index - 1).value();
		return previous != 0.0d ? finiteOrZero(series.get(index).value() / previous - 1.0d) : 0.0d;
	}

	private static double maxDrawdown(List<PnlPoint> series, int from) {
		double peak = Double.NEGATIVE_INFINITY;
		double worst = 0.0d;
		for (int i = 0; i < series.size(); i++) {
			double value = series.get(i).value();
			peak = Math.max(peak, value);
			if (i >= from && peak > 0.0d) {
				worst = Math.max(worst, 1.0d - value / peak);
			}
		}
		return worst;
	}

	private static double round(double value, int scale) {
		if (!Double.isFinite(value)) {
			return 0.0d;
		}
		return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
	}

	private static double finiteOrZero(double value) {
		return Double.isFinite(value) ? value : 0.0d;
	}
}
