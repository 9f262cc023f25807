package my.portfolioengine.app.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoneyTest {
	@Test
	void addsAndSubtractsSameCurrency() {
		Money a = Money.of(new BigDecimal("100.50"), "VND");
		Money b = Money.of(new BigDecimal("0.25"), "VND");

		assertThat(a.add(b).amount()).isEqualByComparingTo("100.75");
		assertThat(a.subtract(b).amount()).isEqualByComparingTo("100.25");
		assertThat(a.amount()).isEqualByComparingTo("100.50");
	}

	@Test
	void rejectsArithmeticAcrossCurrencies() {
		Money vnd = Money.of(new BigDecimal("10"), "VND");
		Money usd = Money.of(new BigDecimal("10"), "USD");

		assertThatThrownBy(() -> vnd.add(usd))
				.isInstanceOf(CurrencyMismatchException.class)
				.hasMessageContaining("VND")
				.hasMessageContaining("USD");
		assertThatThrownBy(() -> vnd.subtract(usd))
				.isInstanceOf(CurrencyMismatchException.class);
	}

	@Test
	void multipliesExactly() {
		Money price = Money.of(new BigDecimal("0.1"), "VND");

		assertThat(price.multiply(3L).amount()).isEqualByComparingTo("0.3");
		assertThat(price.multiply(new BigDecimal("2.5")).amount()).isEqualByComparingTo("0.25");
	}

	@Test
	void blankCurrencyUsesDefault() {
		assertThat(new Money(BigDecimal.ONE, "").currency()).isEqualTo(Money.DEFAULT_CURRENCY);
		assertThat(new Money(BigDecimal.ONE).currency()).isEqualTo("VND");
	}

	@Test
	void reportsSign() {
		assertThat(Money.zero("VND").isZero()).isTrue();
		assertThat(Money.of(5.0d, "VND").isPositive()).isTrue();
		assertThat(Money.of(5.0d, "VND").negate().isPositive()).isFalse();
	}
}
