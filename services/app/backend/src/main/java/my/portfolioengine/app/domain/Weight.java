package my.portfolioengine.app.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Percentage weight in the closed range [0, 100].
 */
public record Weight(BigDecimal percentage) {
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

	public static final Weight ZERO = new Weight(BigDecimal.ZERO);

	public Weight {
		Objects.requireNonNull(percentage, "percentage");
		if (percentage.signum() < 0 || percentage.compareTo(ONE_HUNDRED) > 0) {
			throw new IllegalArgumentException("Weight must be between 0 and 100, got " + percentage.toPlainString());
		}
	}

	public static Weight ofPercent(double percentage) {
		return new Weight(BigDecimal.valueOf(percentage));
	}

	public BigDecimal fraction() {
		return percentage.divide(ONE_HUNDRED);
	}
}
