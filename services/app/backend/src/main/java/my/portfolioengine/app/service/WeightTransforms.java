package my.portfolioengine.app.service;

import my.portfolioengine.app.service.util.WeightVectorUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic weight-vector transforms. Every method returns a new array and leaves its input
 * untouched.
 *
 * <ul>
 *   <li>{@link #normalizeExact(double[])}: long-only, sums to exactly 1</li>
 *   <li>{@link #neutralizeExact(double[])}: centered at zero, entries in [-1, 1]</li>
 *   <li>{@link #normalizeLimit(double[], double)}: long-only, entries in [0, maxWeight]</li>
 *   <li>{@link #neutralizeLimit(double[], double)}: centered, entries in [-maxWeight, maxWeight]</li>
 * </ul>
 *
 * Capping loops stop after {@value #MAX_ITERATIONS} iterations; a vector that has not converged by
 * then is returned as is.
 */
public final class WeightTransforms {
	private static final Logger logger = LoggerFactory.getLogger(WeightTransforms.class);

	public static final double DEFAULT_MAX_WEIGHT = 0.15d;
	static final int MAX_ITERATIONS = 100;
	static final double EXACT_TOLERANCE = 1e-15;
	static final double LIMIT_TOLERANCE = 1e-10;

	private WeightTransforms() {
	}

	public static double[] normalizeExact(double[] input) {
		double[] weights = WeightVectorUtil.clipNegatives(input);
		double total = WeightVectorUtil.sum(weights);
		if (!(total > EXACT_TOLERANCE)) {
			return WeightVectorUtil.equalWeights(weights.length);
		}
		for (int i = 0; i < weights.length; i++) {
			weights[i] /= total;
		}
		double residual = 1.0d - WeightVectorUtil.sum(weights);
		if (Math.abs(residual) > EXACT_TOLERANCE) {
			weights[WeightVectorUtil.argMax(weights)] += residual;
		}
		return weights;
	}

	public static double[] neutralizeExact(double[] input) {
		int size = input.length;
		double mean = WeightVectorUtil.mean(input);
		double[] weights = new double[size];
		for (int i = 0; i < size; i++) {
			weights[i] = WeightVectorUtil.clamp(input[i] - mean, -1.0d, 1.0d);
		}
		double total = WeightVectorUtil.sum(weights);
		if (Math.abs(total) <= EXACT_TOLERANCE || size == 0) {
			return weights;
		}
		int index = WeightVectorUtil.argMaxAbs(weights);
		weights[index] -= total;

		double overflow = 0.0d;
		if (weights[index] > 1.0d) {
			overflow = weights[index] - 1.0d;
			weights[index] = 1.0d;
		} else if (weights[index] < -1.0d) {
			overflow = weights[index] + 1.0d;
			weights[index] = -1.0d;
		}
		// single second-order pass; may leave others outside [-1, 1] for pathological inputs
		if (overflow != 0.0d && size > 1) {
			double share = overflow / (size - 1);
			for (int i = 0; i < size; i++) {
				if (i != index) {
					weights[i] += share;
				}
			}
		}
		return weights;
	}

	public static double[] normalizeLimit(double[] input) {
		return normalizeLimit(input, DEFAULT_MAX_WEIGHT);
	}

	public static double[] normalizeLimit(double[] input, double maxWeight) {
		int size = input.length;
		double[] weights = WeightVectorUtil.clipNegatives(input);
		boolean converged = false;

		for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
			double total = WeightVectorUtil.sum(weights);
			if (total <= LIMIT_TOLERANCE) {
				weights = WeightVectorUtil.equalWeights(size);
				converged = true;
				break;
			}
			for (int i = 0; i < size; i++) {
				weights[i] /= total;
			}

			double excess = 0.0d;
			boolean[] capped = new boolean[size];
			for (int i = 0; i < size; i++) {
				if (weights[i] > maxWeight + LIMIT_TOLERANCE) {
					excess += weights[i] - maxWeight;
					weights[i] = maxWeight;
					capped[i] = true;
				}
			}
			if (excess == 0.0d) {
				converged = true;
				break;
			}

			int receivers = 0;
			double headroomTotal = 0.0d;
			for (int i = 0; i < size; i++) {
				if (!capped[i] && weights[i] < maxWeight - LIMIT_TOLERANCE) {
					receivers++;
					headroomTotal += maxWeight - weights[i];
				}
			}
			if (receivers == 0) {
				break;
			}
			for (int i = 0; i < size; i++) {
				if (capped[i] || weights[i] >= maxWeight - LIMIT_TOLERANCE) {
					continue;
				}
				if (headroomTotal > LIMIT_TOLERANCE) {
					weights[i] += excess * (maxWeight - weights[i]) / headroomTotal;
				} else {
					weights[i] += excess / receivers;
				}
			}
		}
		if (!converged) {
			logger.debug("Long-only capping at {} stopped before convergence for {} assets", maxWeight, size);
		}

		double total = WeightVectorUtil.sum(weights);
		if (total > 0.0d) {
			for (int i = 0; i < size; i++) {
				weights[i] /= total;
			}
			double residual = 1.0d - WeightVectorUtil.sum(weights);
			if (residual != 0.0d) {
				weights[mostHeadroom(weights, maxWeight, residual)] += residual;
			}
		}
		return weights;
	}

	public static double[] neutralizeLimit(double[] input) {
		return neutralizeLimit(input, DEFAULT_MAX_WEIGHT);
	}

	public static double[] neutralizeLimit(double[] input, double maxWeight) {
		int size = input.length;
		double mean = WeightVectorUtil.mean(input);
		double[] weights = new double[size];
		for (int i = 0; i < size; i++) {
			weights[i] = input[i] - mean;
		}
		boolean converged = false;

		for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
			weights = WeightVectorUtil.clip(weights, -maxWeight, maxWeight);
			double total = WeightVectorUtil.sum(weights);
			if (Math.abs(total) <= LIMIT_TOLERANCE) {
				converged = true;
				break;
			}

			boolean[] adjustable = new boolean[size];
			int adjustableCount = 0;
			for (int i = 0; i < size; i++) {
				boolean pinned = Math.abs(weights[i] - maxWeight) <= LIMIT_TOLERANCE
						|| Math.abs(weights[i] + maxWeight) <= LIMIT_TOLERANCE;
				if (!pinned) {
					adjustable[i] = true;
					adjustableCount++;
				}
			}
			if (adjustableCount == 0) {
				break;
			}

			// positive imbalance moves entries toward -maxWeight, negative toward +maxWeight
			double[] capacity = new double[size];
			double capacityTotal = 0.0d;
			for (int i = 0; i < size; i++) {
				if (adjustable[i]) {
					capacity[i] = total > 0.0d ? weights[i] + maxWeight : maxWeight - weights[i];
					capacityTotal += capacity[i];
				}
			}
			if (capacityTotal > LIMIT_TOLERANCE) {
				double shift = Math.min(Math.abs(total), capacityTotal);
				double direction = Math.signum(total);
				for (int i = 0; i < size; i++) {
					if (adjustable[i]) {
						weights[i] -= direction * shift * capacity[i] / capacityTotal;
					}
				}
			} else {
				double share = total / adjustableCount;
				for (int i = 0; i < size; i++) {
					if (adjustable[i]) {
						weights[i] -= share;
					}
				}
			}
		}
		if (!converged) {
			logger.debug("Market-neutral capping at {} stopped with residual imbalance for {} assets", maxWeight, size);
		}

		weights = WeightVectorUtil.clip(weights, -maxWeight, maxWeight);
		double total = WeightVectorUtil.sum(weights);
		if (Math.abs(total) > LIMIT_TOLERANCE && size > 0) {
			int index = -1;
			double best = Double.NEGATIVE_INFINITY;
			for (int i = 0; i < size; i++) {
				double room = total > 0.0d ? weights[i] + maxWeight : maxWeight - weights[i];
				if (room > best) {
					best = room;
					index = i;
				}
			}
			weights[index] = WeightVectorUtil.clamp(weights[index] - total, -maxWeight, maxWeight);
		}
		return weights;
	}

	/**
	 * Index with the most room in the direction of the residual: up to {@code maxWeight} for a
	 * positive residual, down to zero for a negative one.
	 */
	private static int mostHeadroom(double[] weights, double maxWeight, double residual) {
		int index = 0;
		double best = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < weights.length; i++) {
			double headroom = residual > 0.0d ? maxWeight - weights[i] : weights[i];
			if (headroom > best) {
				best = headroom;
				index = i;
			}
		}
		return index;
	}
}
