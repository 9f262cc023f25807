package my.portfolioengine.app.service.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WeightVectorUtilTest {
	@Test
	void equalWeightsSplitEvenly() {
		assertThat(WeightVectorUtil.equalWeights(4)).containsExactly(0.25d, 0.25d, 0.25d, 0.25d);
		assertThat(WeightVectorUtil.equalWeights(0)).isEmpty();
	}

	@Test
	void argMaxPrefersFirstOccurrence() {
		assertThat(WeightVectorUtil.argMax(new double[]{0.2d, 0.5d, 0.5d})).isEqualTo(1);
		assertThat(WeightVectorUtil.argMaxAbs(new double[]{0.2d, -0.7d, 0.5d})).isEqualTo(1);
		assertThat(WeightVectorUtil.argMax(new double[0])).isEqualTo(-1);
	}

	@Test
	void sanitizeReplacesNonFiniteValues() {
		double[] sanitized = WeightVectorUtil.sanitize(
				new double[]{Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, 0.3d});

		assertThat(sanitized).containsExactly(0.0d, 1e6, -1e6, 0.3d);
		assertThat(WeightVectorUtil.allFinite(sanitized)).isTrue();
	}

	@Test
	void clipBoundsEveryEntry() {
		double[] input = {-0.4d, 0.1d, 0.9d};

		assertThat(WeightVectorUtil.clip(input, -0.15d, 0.15d)).containsExactly(-0.15d, 0.1d, 0.15d);
		assertThat(WeightVectorUtil.clipNegatives(input)).containsExactly(0.0d, 0.1d, 0.9d);
		assertThat(input).containsExactly(-0.4d, 0.1d, 0.9d);
	}
}
