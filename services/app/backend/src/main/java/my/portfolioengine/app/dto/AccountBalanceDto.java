package my.portfolioengine.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record AccountBalanceDto(
		@JsonProperty("availableCash") BigDecimal availableCash,
		@JsonProperty("netAssetValue") BigDecimal netAssetValue,
		@JsonProperty("stockValue") BigDecimal stockValue
) {
}
