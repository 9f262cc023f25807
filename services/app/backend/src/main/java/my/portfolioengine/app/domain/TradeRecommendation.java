package my.portfolioengine.app.domain;

import java.math.BigDecimal;

public record TradeRecommendation(
		String symbol,
		TradeAction action,
		Weight currentWeight,
		Weight targetWeight,
		Money amount,
		TradePriority priority,
		String reason,
		Money actionPrice,
		Long actionQuantity
) {
	public BigDecimal weightDeviation() {
		return targetWeight.percentage().subtract(currentWeight.percentage()).abs();
	}
}
