package my.portfolioengine.app.domain;

import java.util.Objects;

/**
 * Snapshot of one holding. Instances are rebuilt for every analysis run and never mutated.
 * {@code weight} is relative to net asset value, {@code weightOverStockValue} to the
 * invested value only.
 */
public record Position(
		String symbol,
		long quantity,
		Money marketPrice,
		Money costPrice,
		Money breakEvenPrice,
		Weight weight,
		Weight weightOverStockValue,
		Money realizedProfit,
		Money unrealizedProfit
) {
	public Position {
		Objects.requireNonNull(symbol, "symbol");
		Objects.requireNonNull(marketPrice, "marketPrice");
		Objects.requireNonNull(weight, "weight");
	}

	public static Position empty(String symbol, String currency) {
		Money zero = Money.zero(currency);
		return new Position(symbol, 0L, zero, zero, zero, Weight.ZERO, null, null, null);
	}

	public Money marketValue() {
		return marketPrice.multiply(quantity);
	}
}
