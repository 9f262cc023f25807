package my.portfolioengine.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Target weight of one symbol in percent, with the price used to size buy orders.
 */
public record TargetWeightDto(
		@JsonProperty("symbol") String symbol,
		@JsonProperty("weight") BigDecimal weight,
		@JsonProperty("marketPrice") BigDecimal marketPrice
) {
}
