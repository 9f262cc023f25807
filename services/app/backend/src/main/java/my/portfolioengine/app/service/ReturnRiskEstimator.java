package my.portfolioengine.app.service;

import my.portfolioengine.app.config.AppProperties;
import my.portfolioengine.app.model.PricePanel;
import my.portfolioengine.app.model.ReturnRiskEstimate;
import my.portfolioengine.app.service.util.WeightVectorUtil;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Derives the expected-return vector from an EWMA of k-period percentage changes and the
 * covariance matrix from the raw price panel.
 */
@Service
public class ReturnRiskEstimator {
	private final int returnPeriods;
	private final int ewmaSpan;

	@Autowired
	public ReturnRiskEstimator(AppProperties properties) {
		this(properties.optimizer().returnPeriods(), properties.optimizer().ewmaSpan());
	}

	public ReturnRiskEstimator(int returnPeriods, int ewmaSpan) {
		if (returnPeriods < 1 || ewmaSpan < 1) {
			throw new IllegalArgumentException("returnPeriods and ewmaSpan must be positive");
		}
		this.returnPeriods = returnPeriods;
		this.ewmaSpan = ewmaSpan;
	}

	public ReturnRiskEstimate estimate(PricePanel panel) {
		if (panel == null || panel.rowCount() < 2) {
			throw new IllegalArgumentException("Price panel needs at least 2 rows");
		}
		if (panel.columnCount() == 0) {
			throw new IllegalArgumentException("Price panel has no symbols");
		}
		double[][] prices = panel.toArray();
		double[][] returns = percentChange(prices, returnPeriods);
		double[] mu = new double[panel.columnCount()];
		for (int column = 0; column < mu.length; column++) {
			mu[column] = meanSkippingNaN(ewma(returns, column, ewmaSpan));
		}
		RealMatrix covariance = covariance(prices);
		return new ReturnRiskEstimate(
				new ArrayRealVector(WeightVectorUtil.sanitize(mu), false),
				sanitize(covariance));
	}

	static double[][] percentChange(double[][] prices, int periods) {
		int rows = prices.length;
		int columns = rows == 0 ? 0 : prices[0].length;
		double[][] returns = new double[rows][columns];
		for (int row = 0; row < rows; row++) {
			for (int column = 0; column < columns; column++) {
				double change = Double.NaN;
				if (row >= periods) {
					change = prices[row][column] / prices[row - periods][column] - 1.0d;
				}
				// only missing values are filled, infinities from zero prices survive
				returns[row][column] = Double.isNaN(change) ? 0.0d : change;
			}
		}
		return returns;
	}

	static double[] ewma(double[][] series, int column, int span) {
		double alpha = 2.0d / (span + 1.0d);
		double[] smoothed = new double[series.length];
		for (int row = 0; row < series.length; row++) {
			double value = series[row][column];
			smoothed[row] = row == 0 ? value : (1.0d - alpha) * smoothed[row - 1] + alpha * value;
		}
		return smoothed;
	}

	static RealMatrix covariance(double[][] prices) {
		int columns = prices[0].length;
		if (!containsNaN(prices)) {
			return new Covariance(prices, true).getCovarianceMatrix();
		}
		Covariance calculator = new Covariance();
		RealMatrix matrix = MatrixUtils.createRealMatrix(columns, columns);
		for (int i = 0; i < columns; i++) {
			for (int j = i; j < columns; j++) {
				double value = pairwiseCovariance(calculator, prices, i, j);
				matrix.setEntry(i, j, value);
				matrix.setEntry(j, i, value);
			}
		}
		return matrix;
	}

	private static double pairwiseCovariance(Covariance calculator, double[][] prices, int first, int second) {
		double[] x = new double[prices.length];
		double[] y = new double[prices.length];
		int count = 0;
		for (double[] row : prices) {
			if (!Double.isNaN(row[first]) && !Double.isNaN(row[second])) {
				x[count] = row[first];
				y[count] = row[second];
				count++;
			}
		}
		if (count < 2) {
			return Double.NaN;
		}
		return calculator.covariance(Arrays.copyOf(x, count), Arrays.copyOf(y, count), true);
	}

	private static boolean containsNaN(double[][] values) {
		for (double[] row : values) {
			for (double value : row) {
				if (Double.isNaN(value)) {
					return true;
				}
			}
		}
		return false;
	}

	private static double meanSkippingNaN(double[] values) {
		double total = 0.0d;
		int count = 0;
		for (double value : values) {
			if (!Double.isNaN(value)) {
				total += value;
				count++;
			}
		}
		return count == 0 ? Double.NaN : total / count;
	}

	private static RealMatrix sanitize(RealMatrix matrix) {
		RealMatrix sanitized = matrix.copy();
		for (int row = 0; row < sanitized.getRowDimension(); row++) {
			for (int column = 0; column < sanitized.getColumnDimension(); column++) {
				sanitized.setEntry(row, column, WeightVectorUtil.sanitize(sanitized.getEntry(row, column)));
			}
		}
		return sanitized;
	}
}
