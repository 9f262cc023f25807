package my.portfolioengine.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import my.portfolioengine.app.model.SellQuantityMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Optimizer optimizer,
		@Valid Recommendation recommendation,
		@Valid Analytics analytics
) {
	public AppProperties {
		if (optimizer == null) {
			optimizer = Optimizer.defaults();
		}
		if (recommendation == null) {
			recommendation = Recommendation.defaults();
		}
		if (analytics == null) {
			analytics = Analytics.defaults();
		}
	}

	public static AppProperties defaults() {
		return new AppProperties(null, null, null);
	}

	public record Optimizer(
			@Positive Double riskAversion,
			@DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0") Double maxWeight,
			@Min(1) Integer returnPeriods,
			@Min(1) Integer ewmaSpan,
			@Min(2) Integer windowSize,
			Duration solverTimeout,
			@Min(1) Integer maxSolverIterations
	) {
		public Optimizer {
			riskAversion = riskAversion == null ? 0.01d : riskAversion;
			maxWeight = maxWeight == null ? 0.15d : maxWeight;
			returnPeriods = returnPeriods == null ? 2 : returnPeriods;
			ewmaSpan = ewmaSpan == null ? 21 : ewmaSpan;
			windowSize = windowSize == null ? 21 : windowSize;
			solverTimeout = solverTimeout == null ? Duration.ofSeconds(5) : solverTimeout;
			maxSolverIterations = maxSolverIterations == null ? 500 : maxSolverIterations;
		}

		public static Optimizer defaults() {
			return new Optimizer(null, null, null, null, null, null, null);
		}
	}

	public record Recommendation(
			@PositiveOrZero Double weightTolerance,
			@PositiveOrZero Double minTargetWeightPct,
			@DecimalMin(value = "0.0", inclusive = false) @DecimalMax("100.0") Double limitTargetWeightPct,
			String currency,
			SellQuantityMode sellQuantityMode
	) {
		public Recommendation {
			weightTolerance = weightTolerance == null ? 1.0d : weightTolerance;
			minTargetWeightPct = minTargetWeightPct == null ? 1.0d : minTargetWeightPct;
			limitTargetWeightPct = limitTargetWeightPct == null ? 10.0d : limitTargetWeightPct;
			currency = currency == null || currency.isBlank() ? "VND" : currency;
			sellQuantityMode = sellQuantityMode == null ? SellQuantityMode.PER_SHARE_PRICE : sellQuantityMode;
		}

		public static Recommendation defaults() {
			return new Recommendation(null, null, null, null, null);
		}
	}

	public record Analytics(
			@Positive Double bookSize,
			@Min(1) Integer tradingDays,
			Double riskFreeRate,
			@DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false) Double varLevel,
			@Min(0) Integer returnLag,
			@Min(2) Integer rollingWindow
	) {
		public Analytics {
			bookSize = bookSize == null ? 1e9d : bookSize;
			tradingDays = tradingDays == null ? 252 : tradingDays;
			riskFreeRate = riskFreeRate == null ? 0.0d : riskFreeRate;
			varLevel = varLevel == null ? 0.05d : varLevel;
			returnLag = returnLag == null ? 2 : returnLag;
			rollingWindow = rollingWindow == null ? 21 : rollingWindow;
		}

		public static Analytics defaults() {
			return new Analytics(null, null, null, null, null, null);
		}
	}
}
