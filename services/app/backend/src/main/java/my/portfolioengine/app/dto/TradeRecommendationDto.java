package my.portfolioengine.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.portfolioengine.app.domain.TradeRecommendation;

public record TradeRecommendationDto(
		@JsonProperty("symbol") String symbol,
		@JsonProperty("action") String action,
		@JsonProperty("current_weight") double currentWeight,
		@JsonProperty("target_weight") double targetWeight,
		@JsonProperty("amount") MoneyDto amount,
		@JsonProperty("priority") String priority,
		@JsonProperty("action_price") MoneyDto actionPrice,
		@JsonProperty("action_quantity") Long actionQuantity,
		@JsonProperty("reason") String reason
) {
	public static TradeRecommendationDto from(TradeRecommendation recommendation) {
		return new TradeRecommendationDto(
				recommendation.symbol(),
				recommendation.action().name(),
				recommendation.currentWeight().percentage().doubleValue(),
				recommendation.targetWeight().percentage().doubleValue(),
				MoneyDto.from(recommendation.amount()),
				recommendation.priority().name(),
				MoneyDto.from(recommendation.actionPrice()),
				recommendation.actionQuantity(),
				recommendation.reason()
		);
	}
}
