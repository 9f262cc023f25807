package my.portfolioengine.app.model;

import java.time.LocalDate;

/**
 * Book value on one date and its profit relative to the starting book, in percent.
 */
public record PnlPoint(
		LocalDate date,
		double value,
		double pnlPct
) {
}
