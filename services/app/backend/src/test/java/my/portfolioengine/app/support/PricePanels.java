package my.portfolioengine.app.support;

import my.portfolioengine.app.model.PricePanel;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic price panels for optimizer tests: per-symbol drift with a wave on top.
 */
public final class PricePanels {
	private PricePanels() {
	}

	public static PricePanel trending(LocalDate start, List<String> symbols, int rows) {
		List<LocalDate> dates = new ArrayList<>();
		double[][] prices = new double[rows][symbols.size()];
		for (int row = 0; row < rows; row++) {
			dates.add(start.plusDays(row));
			for (int column = 0; column < symbols.size(); column++) {
				double drift = Math.pow(1.0d + 0.004d * (column + 1), row);
				double wave = 1.0d + 0.03d * Math.sin(row * (column + 1) * 0.7d + column);
				prices[row][column] = 100.0d * (column + 1) * drift * wave;
			}
		}
		return new PricePanel(dates, symbols, prices);
	}
}
