package my.portfolioengine.app.model;

import java.time.LocalDate;

/**
 * Annualized Sharpe ratio and volatility (percent) over the window ending on {@code date}.
 */
public record RollingRiskPoint(
		LocalDate date,
		double sharpeRatio,
		double volatilityPct
) {
}
