package my.portfolioengine.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Weights of one symbol on one date for all four policies, as handed to the weights store.
 */
public record OptimizedWeightRowDto(
		@JsonProperty("date") LocalDate date,
		@JsonProperty("symbol") String symbol,
		@JsonProperty("marketPrice") Double marketPrice,
		@JsonProperty("initialWeight") double initialWeight,
		@JsonProperty("neutralizedWeight") double neutralizedWeight,
		@JsonProperty("limitedWeight") double limitedWeight,
		@JsonProperty("neutralizedLimitedWeight") double neutralizedLimitedWeight,
		@JsonProperty("algorithm") String algorithm
) {
}
