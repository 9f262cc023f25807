package my.portfolioengine.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.portfolioengine.app.domain.Money;

public record MoneyDto(
		@JsonProperty("amount") double amount,
		@JsonProperty("currency") String currency
) {
	public static MoneyDto from(Money money) {
		return money == null ? null : new MoneyDto(money.amount().doubleValue(), money.currency());
	}
}
