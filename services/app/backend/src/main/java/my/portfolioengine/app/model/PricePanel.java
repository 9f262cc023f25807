package my.portfolioengine.app.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Adjusted close prices indexed by trading date (rows) and symbol (columns).
 * Missing observations are {@link Double#NaN}.
 */
public final class PricePanel {
	private final List<LocalDate> dates;
	private final List<String> symbols;
	private final double[][] prices;

	public PricePanel(List<LocalDate> dates, List<String> symbols, double[][] prices) {
		Objects.requireNonNull(dates, "dates");
		Objects.requireNonNull(symbols, "symbols");
		Objects.requireNonNull(prices, "prices");
		if (dates.size() != prices.length) {
			throw new IllegalArgumentException("Expected " + dates.size() + " price rows, got " + prices.length);
		}
		double[][] copy = new double[prices.length][];
		for (int row = 0; row < prices.length; row++) {
			if (prices[row] == null || prices[row].length != symbols.size()) {
				throw new IllegalArgumentException("Price row " + row + " does not match " + symbols.size() + " symbols");
			}
			copy[row] = prices[row].clone();
		}
		this.dates = List.copyOf(dates);
		this.symbols = List.copyOf(symbols);
		this.prices = copy;
	}

	public List<LocalDate> dates() {
		return dates;
	}

	public List<String> symbols() {
		return symbols;
	}

	public int rowCount() {
		return prices.length;
	}

	public int columnCount() {
		return symbols.size();
	}

	public double price(int row, int column) {
		return prices[row][column];
	}

	public double[][] toArray() {
		double[][] copy = new double[prices.length][];
		for (int row = 0; row < prices.length; row++) {
			copy[row] = prices[row].clone();
		}
		return copy;
	}

	/**
	 * Rows {@code [fromRow, toRowExclusive)} with all columns.
	 */
	public PricePanel window(int fromRow, int toRowExclusive) {
		if (fromRow < 0 || toRowExclusive > prices.length || fromRow > toRowExclusive) {
			throw new IllegalArgumentException("Invalid window [" + fromRow + ", " + toRowExclusive + ")");
		}
		double[][] rows = new double[toRowExclusive - fromRow][];
		for (int row = fromRow; row < toRowExclusive; row++) {
			rows[row - fromRow] = prices[row];
		}
		return new PricePanel(dates.subList(fromRow, toRowExclusive), symbols, rows);
	}

	/**
	 * Columns for the given symbols, in the order given. Symbols not present in the panel are dropped.
	 */
	public PricePanel select(List<String> selected) {
		List<String> kept = new ArrayList<>();
		List<Integer> indices = new ArrayList<>();
		for (String symbol : selected) {
			int index = symbols.indexOf(symbol);
			if (index >= 0 && !kept.contains(symbol)) {
				kept.add(symbol);
				indices.add(index);
			}
		}
		double[][] rows = new double[prices.length][kept.size()];
		for (int row = 0; row < prices.length; row++) {
			for (int column = 0; column < indices.size(); column++) {
				rows[row][column] = prices[row][indices.get(column)];
			}
		}
		return new PricePanel(dates, kept, rows);
	}

	/**
	 * Latest non-missing price of a column, or NaN when the column has none.
	 */
	public double lastPrice(int column) {
		for (int row = prices.length - 1; row >= 0; row--) {
			if (!Double.isNaN(prices[row][column])) {
				return prices[row][column];
			}
		}
		return Double.NaN;
	}
}
