package my.portfolioengine.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.portfolioengine.app.domain.Position;
import my.portfolioengine.app.domain.Weight;

public record PositionDto(
		@JsonProperty("symbol") String symbol,
		@JsonProperty("quantity") long quantity,
		@JsonProperty("market_price") MoneyDto marketPrice,
		@JsonProperty("cost_price") MoneyDto costPrice,
		@JsonProperty("break_even_price") MoneyDto breakEvenPrice,
		@JsonProperty("weight") Double weight,
		@JsonProperty("weight_over_sv") Double weightOverStockValue,
		@JsonProperty("market_value") MoneyDto marketValue,
		@JsonProperty("realized_profit") MoneyDto realizedProfit,
		@JsonProperty("unrealized_profit") MoneyDto unrealizedProfit
) {
	public static PositionDto from(Position position) {
		return new PositionDto(
				position.symbol(),
				position.quantity(),
				MoneyDto.from(position.marketPrice()),
				MoneyDto.from(position.costPrice()),
				MoneyDto.from(position.breakEvenPrice()),
				percentage(position.weight()),
				percentage(position.weightOverStockValue()),
				MoneyDto.from(position.marketValue()),
				MoneyDto.from(position.realizedProfit()),
				MoneyDto.from(position.unrealizedProfit())
		);
	}

	private static Double percentage(Weight weight) {
		return weight == null ? null : weight.percentage().doubleValue();
	}
}
