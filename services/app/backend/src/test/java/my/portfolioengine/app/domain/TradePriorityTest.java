package my.portfolioengine.app.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class TradePriorityTest {
	@Test
	void mapsDeviationToPriority() {
		assertThat(TradePriority.forDeviation(new BigDecimal("4"))).isEqualTo(TradePriority.HIGH);
		assertThat(TradePriority.forDeviation(new BigDecimal("-3.5"))).isEqualTo(TradePriority.HIGH);
		assertThat(TradePriority.forDeviation(new BigDecimal("3"))).isEqualTo(TradePriority.MEDIUM);
		assertThat(TradePriority.forDeviation(new BigDecimal("-2"))).isEqualTo(TradePriority.MEDIUM);
		assertThat(TradePriority.forDeviation(new BigDecimal("1.5"))).isEqualTo(TradePriority.LOW);
		assertThat(TradePriority.forDeviation(BigDecimal.ONE)).isEqualTo(TradePriority.LOW);
	}
}
