package my.portfolioengine.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One row of the broker holdings feed.
 */
public record HoldingDealDto(
		@JsonProperty("symbol") String symbol,
		@JsonProperty("accumulateQuantity") long accumulateQuantity,
		@JsonProperty("marketPrice") BigDecimal marketPrice,
		@JsonProperty("averageCostPrice") BigDecimal averageCostPrice,
		@JsonProperty("breakEvenPrice") BigDecimal breakEvenPrice,
		@JsonProperty("realizedProfit") BigDecimal realizedProfit,
		@JsonProperty("unrealizedProfit") BigDecimal unrealizedProfit
) {
}
