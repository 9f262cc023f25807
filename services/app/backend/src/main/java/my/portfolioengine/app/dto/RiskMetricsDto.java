package my.portfolioengine.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk and performance figures of one PnL series. Percent fields are already multiplied by 100.
 */
public record RiskMetricsDto(
		@JsonProperty("total_return_pct") double totalReturnPct,
		@JsonProperty("max_return_pct") double maxReturnPct,
		@JsonProperty("min_return_pct") double minReturnPct,
		@JsonProperty("daily_volatility_pct") double dailyVolatilityPct,
		@JsonProperty("annualized_volatility_pct") double annualizedVolatilityPct,
		@JsonProperty("downside_volatility_pct") double downsideVolatilityPct,
		@JsonProperty("sharpe_ratio") double sharpeRatio,
		@JsonProperty("sortino_ratio") double sortinoRatio,
		@JsonProperty("max_dd_pct") double maxDrawdownPct,
		@JsonProperty("calmar_ratio") double calmarRatio,
		@JsonProperty("var_confidence_pct") double varConfidencePct,
		@JsonProperty("var_daily_pct") double valueAtRiskPct,
		@JsonProperty("cvar_daily_pct") double conditionalValueAtRiskPct,
		@JsonProperty("win_rate_pct") double winRatePct,
		@JsonProperty("best_day_pct") double bestDayPct,
		@JsonProperty("worst_day_pct") double worstDayPct,
		@JsonProperty("skewness") double skewness,
		@JsonProperty("kurtosis") double kurtosis
) {
}
