package my.portfolioengine.app.service.util;

import java.util.Arrays;

public final class WeightVectorUtil {
	public static final double POSITIVE_INFINITY_REPLACEMENT = 1e6;
	public static final double NEGATIVE_INFINITY_REPLACEMENT = -1e6;

	private WeightVectorUtil() {
	}

	public static double sum(double[] values) {
		double total = 0.0d;
		for (double value : values) {
			total += value;
		}
		return total;
	}

	public static double mean(double[] values) {
		if (values.length == 0) {
			return 0.0d;
		}
		return sum(values) / values.length;
	}

	public static double[] equalWeights(int size) {
		double[] weights = new double[size];
		if (size > 0) {
			Arrays.fill(weights, 1.0d / size);
		}
		return weights;
	}

	public static double[] clipNegatives(double[] values) {
		double[] clipped = new double[values.length];
		for (int i = 0; i < values.length; i++) {
			clipped[i] = Math.max(values[i], 0.0d);
		}
		return clipped;
	}

	public static double[] clip(double[] values, double lower, double upper) {
		double[] clipped = new double[values.length];
		for (int i = 0; i < values.length; i++) {
			clipped[i] = clamp(values[i], lower, upper);
		}
		return clipped;
	}

	public static double clamp(double value, double lower, double upper) {
		return Math.min(Math.max(value, lower), upper);
	}

	/**
	 * First index of the largest entry, -1 for an empty vector.
	 */
	public static int argMax(double[] values) {
		int index = -1;
		double best = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < values.length; i++) {
			if (index < 0 || values[i] > best) {
				best = values[i];
				index = i;
			}
		}
		return index;
	}

	public static int argMaxAbs(double[] values) {
		int index = -1;
		double best = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < values.length; i++) {
			double abs = Math.abs(values[i]);
			if (index < 0 || abs > best) {
				best = abs;
				index = i;
			}
		}
		return index;
	}

	public static double sanitize(double value) {
		if (Double.isNaN(value)) {
			return 0.0d;
		}
		if (value == Double.POSITIVE_INFINITY) {
			return POSITIVE_INFINITY_REPLACEMENT;
		}
		if (value == Double.NEGATIVE_INFINITY) {
			return NEGATIVE_INFINITY_REPLACEMENT;
		}
		return value;
	}

	public static double[] sanitize(double[] values) {
		double[] sanitized = new double[values.length];
		for (int i = 0; i < values.length; i++) {
			sanitized[i] = sanitize(values[i]);
		}
		return sanitized;
	}

	public static boolean allFinite(double[] values) {
		for (double value : values) {
			if (!Double.isFinite(value)) {
				return false;
			}
		}
		return true;
	}
}
