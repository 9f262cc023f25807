package my.portfolioengine.app.domain;

import java.math.BigDecimal;

public enum TradePriority {
	HIGH,
	MEDIUM,
	LOW;

	private static final BigDecimal HIGH_THRESHOLD = new BigDecimal("3");
	private static final BigDecimal MEDIUM_THRESHOLD = new BigDecimal("1.5");

	/**
	 * Maps an absolute weight deviation in percentage points to a priority.
	 */
	public static TradePriority forDeviation(BigDecimal deviation) {
		BigDecimal abs = deviation.abs();
		if (abs.compareTo(HIGH_THRESHOLD) > 0) {
			return HIGH;
		}
		if (abs.compareTo(MEDIUM_THRESHOLD) > 0) {
			return MEDIUM;
		}
		return LOW;
	}
}
