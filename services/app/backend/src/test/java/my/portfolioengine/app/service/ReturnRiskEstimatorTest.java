package my.portfolioengine.app.service;

import my.portfolioengine.app.model.PricePanel;
import my.portfolioengine.app.model.ReturnRiskEstimate;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ReturnRiskEstimatorTest {
	private final ReturnRiskEstimator estimator = new ReturnRiskEstimator(2, 21);

	@Test
	void percentChangeLooksBackTheConfiguredPeriods() {
		double[][] returns = ReturnRiskEstimator.percentChange(new double[][]{{100.0d}, {110.0d}, {121.0d}}, 2);

		assertThat(returns[0][0]).isZero();
		assertThat(returns[1][0]).isZero();
		assertThat(returns[2][0]).isCloseTo(0.21d, within(1e-12));
	}

	@Test
	void ewmaUsesRecursiveSmoothing() {
		double[][] series = {{1.0d}, {0.0d}, {0.0d}};

		assertThat(ReturnRiskEstimator.ewma(series, 0, 3)).containsExactly(1.0d, 0.5d, 0.25d);
		assertThat(ReturnRiskEstimator.ewma(series, 0, 1)).containsExactly(1.0d, 0.0d, 0.0d);
	}

	@Test
	void covarianceIsSampleCovarianceOfPrices() {
		RealMatrix covariance = ReturnRiskEstimator.covariance(new double[][]{{1.0d, 2.0d}, {2.0d, 4.0d}, {3.0d, 6.0d}});

		assertThat(covariance.getEntry(0, 0)).isCloseTo(1.0d, within(1e-12));
		assertThat(covariance.getEntry(0, 1)).isCloseTo(2.0d, within(1e-12));
		assertThat(covariance.getEntry(1, 1)).isCloseTo(4.0d, within(1e-12));
	}

	@Test
	void risingAssetGetsHigherExpectedReturn() {
		List<LocalDate> dates = new ArrayList<>();
		double[][] prices = new double[10][2];
		for (int row = 0; row < 10; row++) {
			dates.add(LocalDate.of(2024, 1, 1).plusDays(row));
			prices[row][0] = 100.0d;
			prices[row][1] = 100.0d * Math.pow(1.01d, row);
		}

		ReturnRiskEstimate estimate = estimator.estimate(new PricePanel(dates, List.of("FLAT", "UP"), prices));

		assertThat(estimate.assetCount()).isEqualTo(2);
		assertThat(estimate.expectedReturns().getEntry(0)).isZero();
		assertThat(estimate.expectedReturns().getEntry(1)).isPositive();
		assertThat(estimate.covariance().getEntry(0, 0)).isZero();
	}

	@Test
	void missingAndZeroPricesYieldFiniteEstimates() {
		List<LocalDate> dates = List.of(
				LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 4));
		double[][] prices = {
				{0.0d, 10.0d},
				{0.0d, Double.NaN},
				{5.0d, 11.0d},
				{6.0d, 12.0d}
		};

		ReturnRiskEstimate estimate = estimator.estimate(new PricePanel(dates, List.of("ZERO", "GAP"), prices));

		for (int i = 0; i < 2; i++) {
			assertThat(Double.isFinite(estimate.expectedReturns().getEntry(i))).isTrue();
			for (int j = 0; j < 2; j++) {
				assertThat(Double.isFinite(estimate.covariance().getEntry(i, j))).isTrue();
			}
		}
	}

	@Test
	void rejectsPanelsWithoutEnoughData() {
		PricePanel single = new PricePanel(List.of(LocalDate.of(2024, 1, 1)), List.of("AAA"), new double[][]{{1.0d}});

		assertThatThrownBy(() -> estimator.estimate(single)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ReturnRiskEstimator(0, 21)).isInstanceOf(IllegalArgumentException.class);
	}
}
