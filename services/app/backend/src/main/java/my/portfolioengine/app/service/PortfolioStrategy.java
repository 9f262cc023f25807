package my.portfolioengine.app.service;

import my.portfolioengine.app.dto.OptimizedWeightRowDto;

import java.util.Locale;

/**
 * Weight policy a holder follows; selects the matching variant of an optimized weight row.
 */
public enum PortfolioStrategy {
	LONG_ONLY("long_only", "LongOnly") {
		@Override
		public double weightOf(OptimizedWeightRowDto row) {
			return row.initialWeight();
		}
	},
	MARKET_NEUTRAL("market_neutral", "MarketNeutral") {
		@Override
		public double weightOf(OptimizedWeightRowDto row) {
			return row.neutralizedWeight();
		}
	},
	LIMITED("limited", "Limited") {
		@Override
		public double weightOf(OptimizedWeightRowDto row) {
			return row.limitedWeight();
		}
	},
	NEUTRALIZED_LIMITED("neutralized_limited", "NeutralizedLimited") {
		@Override
		public double weightOf(OptimizedWeightRowDto row) {
			return row.neutralizedLimitedWeight();
		}
	};

	private final String key;
	private final String displayName;

	PortfolioStrategy(String key, String displayName) {
		this.key = key;
		this.displayName = displayName;
	}

	public abstract double weightOf(OptimizedWeightRowDto row);

	public String key() {
		return key;
	}

	public String displayName() {
		return displayName;
	}

	public static PortfolioStrategy fromKey(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Strategy type is required");
		}
		String trimmed = value.trim();
		for (PortfolioStrategy strategy : values()) {
			if (strategy.key.equalsIgnoreCase(trimmed)
					|| strategy.displayName.equalsIgnoreCase(trimmed)
					|| strategy.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
				return strategy;
			}
		}
		throw new IllegalArgumentException("Unknown strategy type: " + value);
	}
}
