package my.portfolioengine.app.model;

import java.time.LocalDate;

public record PnlComparisonPoint(
		LocalDate date,
		double portfolioPnlPct,
		double indexPnlPct
) {
}
