package my.portfolioengine.app.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PositionTest {
	@Test
	void marketValueIsPriceTimesQuantity() {
		Money price = Money.of(new BigDecimal("25500"), "VND");
		Position position = new Position("FPT", 300L, price, price, price,
				Weight.ofPercent(7.65d), null, null, null);

		assertThat(position.marketValue().amount()).isEqualByComparingTo("7650000");
		assertThat(position.marketValue().currency()).isEqualTo("VND");
	}

	@Test
	void emptyPositionHasZeroWeightAndValue() {
		Position position = Position.empty("VNM", "VND");

		assertThat(position.quantity()).isZero();
		assertThat(position.weight().percentage()).isEqualByComparingTo("0");
		assertThat(position.marketValue().isZero()).isTrue();
	}
}
