package my.portfolioengine.app.domain;

public enum TradeAction {
	BUY,
	SELL
}
