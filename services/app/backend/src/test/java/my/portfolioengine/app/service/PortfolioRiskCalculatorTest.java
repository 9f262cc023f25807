package my.portfolioengine.app.service;

import my.portfolioengine.app.dto.RiskMetricsDto;
import my.portfolioengine.app.model.PnlPoint;
import my.portfolioengine.app.model.RollingRiskPoint;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PortfolioRiskCalculatorTest {
	private static final LocalDate START = LocalDate.of(2024, 3, 4);

	private final PortfolioRiskCalculator calculator = new PortfolioRiskCalculator(252, 0.0d, 0.05d, 21);

	@Test
	void computesMetricsFromValueSeries() {
		RiskMetricsDto metrics = calculator.calculate(series(100.0d, 110.0d, 99.0d, 108.9d));

		assertThat(metrics.totalReturnPct()).isEqualTo(8.9d);
		assertThat(metrics.maxReturnPct()).isEqualTo(10.0d);
		assertThat(metrics.minReturnPct()).isEqualTo(-1.0d);
		assertThat(metrics.dailyVolatilityPct()).isEqualTo(11.55d);
		assertThat(metrics.annualizedVolatilityPct()).isEqualTo(183.3d);
		assertThat(metrics.downsideVolatilityPct()).isEqualTo(0.0d);
		assertThat(metrics.sharpeRatio()).isEqualTo(4.58d);
		assertThat(metrics.sortinoRatio()).isEqualTo(0.0d);
		assertThat(metrics.maxDrawdownPct()).isEqualTo(10.0d);
		assertThat(metrics.calmarRatio()).isEqualTo(0.89d);
		assertThat(metrics.varConfidencePct()).isEqualTo(95.0d);
		assertThat(metrics.valueAtRiskPct()).isCloseTo(-8.0d, within(1e-9));
		assertThat(metrics.conditionalValueAtRiskPct()).isCloseTo(-10.0d, within(1e-9));
		assertThat(metrics.winRatePct()).isEqualTo(66.67d);
		assertThat(metrics.bestDayPct()).isEqualTo(10.0d);
		assertThat(metrics.worstDayPct()).isEqualTo(-10.0d);
		assertThat(metrics.skewness()).isNegative();
		assertThat(metrics.kurtosis()).isEqualTo(0.0d);
	}

	@Test
	void onlyTheMostRecentTradingDaysCount() {
		PortfolioRiskCalculator shortHorizon = new PortfolioRiskCalculator(2, 0.0d, 0.05d, 2);

		RiskMetricsDto metrics = shortHorizon.calculate(series(100.0d, 150.0d, 120.0d, 132.0d));

		assertThat(metrics.maxReturnPct()).isEqualTo(32.0d);
		assertThat(metrics.minReturnPct()).isEqualTo(20.0d);
		assertThat(metrics.bestDayPct()).isEqualTo(10.0d);
		assertThat(metrics.worstDayPct()).isEqualTo(-20.0d);
		assertThat(metrics.maxDrawdownPct()).isEqualTo(20.0d);
	}

	@Test
	void singlePointHasOnlyBasicMetrics() {
		RiskMetricsDto metrics = calculator.calculate(series(100.0d));

		assertThat(metrics.totalReturnPct()).isEqualTo(0.0d);
		assertThat(metrics.dailyVolatilityPct()).isEqualTo(0.0d);
		assertThat(metrics.sharpeRatio()).isEqualTo(0.0d);
		assertThat(metrics.valueAtRiskPct()).isEqualTo(0.0d);
		assertThat(metrics.winRatePct()).isEqualTo(0.0d);
		assertThat(metrics.calmarRatio()).isEqualTo(0.0d);
	}

	@Test
	void emptySeriesIsRejected() {
		assertThatThrownBy(() -> calculator.calculate(List.of()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("empty");
	}

	@Test
	void rollingMetricsSkipFlatWindows() {
		PortfolioRiskCalculator rolling = new PortfolioRiskCalculator(252, 0.0d, 0.05d, 2);

		List<RollingRiskPoint> points = rolling.rollingMetrics(series(100.0d, 110.0d, 99.0d, 108.9d, 108.9d, 108.9d));

		assertThat(points).extracting(RollingRiskPoint::date)
				.containsExactly(START.plusDays(2), START.plusDays(3), START.plusDays(4));
		assertThat(points.get(0).sharpeRatio()).isCloseTo(0.0d, within(1e-9));
		assertThat(points.get(0).volatilityPct()).isCloseTo(0.1d * Math.sqrt(2.0d) * Math.sqrt(252.0d) * 100.0d, within(1e-6));
	}

	@Test
	void fitnessPenalizesExcessVolatilityAndDrawdown() {
		RiskMetricsDto portfolio = metrics(10.0d, 20.0d, 5.0d);
		RiskMetricsDto benchmark = metrics(4.0d, 10.0d, 2.0d);

		assertThat(calculator.fitnessScore(portfolio, benchmark)).isEqualTo(0.1d);
	}

	private static List<PnlPoint> series(double... values) {
		List<PnlPoint> points = new ArrayList<>();
		for (int i = 0; i < values.length; i++) {
			points.add(new PnlPoint(START.plusDays(i), values[i], (values[i] / values[0] - 1.0d) * 100.0d));
		}
		return points;
	}

	private static RiskMetricsDto metrics(double totalReturn, double annualizedVolatility, double maxDrawdown) {
		return new RiskMetricsDto(totalReturn, 0, 0, 0, annualizedVolatility, 0, 0, 0, maxDrawdown,
				0, 95, 0, 0, 0, 0, 0, 0, 0);
	}
}
