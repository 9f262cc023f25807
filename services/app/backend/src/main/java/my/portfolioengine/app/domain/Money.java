package my.portfolioengine.app.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable monetary amount. Every arithmetic operation returns a new instance and
 * operations combining two amounts require the same currency.
 */
public record Money(BigDecimal amount, String currency) {
	public static final String DEFAULT_CURRENCY = "VND";

	public Money {
		Objects.requireNonNull(amount, "amount");
		if (currency == null || currency.isBlank()) {
			currency = DEFAULT_CURRENCY;
		}
	}

	public Money(BigDecimal amount) {
		this(amount, DEFAULT_CURRENCY);
	}

	public static Money of(BigDecimal amount, String currency) {
		return new Money(amount, currency);
	}

	public static Money of(double amount, String currency) {
		return new Money(BigDecimal.valueOf(amount), currency);
	}

	public static Money zero(String currency) {
		return new Money(BigDecimal.ZERO, currency);
	}

	public Money add(Money other) {
		requireSameCurrency("add", other);
		return new Money(amount.add(other.amount), currency);
	}

	public Money subtract(Money other) {
		requireSameCurrency("subtract", other);
		return new Money(amount.subtract(other.amount), currency);
	}

	public Money multiply(BigDecimal factor) {
		Objects.requireNonNull(factor, "factor");
		return new Money(amount.multiply(factor), currency);
	}

	public Money multiply(long factor) {
		return multiply(BigDecimal.valueOf(factor));
	}

	public Money negate() {
		return new Money(amount.negate(), currency);
	}

	public boolean isPositive() {
		return amount.signum() > 0;
	}

	public boolean isZero() {
		return amount.signum() == 0;
	}

	public boolean sameCurrency(Money other) {
		return other != null && currency.equals(other.currency);
	}

	private void requireSameCurrency(String operation, Money other) {
		Objects.requireNonNull(other, "other");
		if (!currency.equals(other.currency)) {
			throw new CurrencyMismatchException(operation, currency, other.currency);
		}
	}
}
