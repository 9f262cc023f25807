package my.portfolioengine.app.model;

/**
 * How the share count of a SELL recommendation is derived from the cash to raise.
 */
public enum SellQuantityMode {
	/**
	 * Divide by the per-share market price; the action price is the market price.
	 */
	PER_SHARE_PRICE,
	/**
	 * Divide by the total market value of the position; the action price is that value.
	 * Kept for compatibility with recommendation sets produced by the legacy pipeline.
	 */
	POSITION_VALUE
}
