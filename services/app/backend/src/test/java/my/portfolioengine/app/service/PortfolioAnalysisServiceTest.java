package my.portfolioengine.app.service;

import my.portfolioengine.app.domain.TradeAction;
import my.portfolioengine.app.domain.TradeRecommendation;
import my.portfolioengine.app.dto.AccountBalanceDto;
import my.portfolioengine.app.dto.HoldingDealDto;
import my.portfolioengine.app.dto.OptimizedWeightRowDto;
import my.portfolioengine.app.dto.PortfolioAnalysisDto;
import my.portfolioengine.app.model.SellQuantityMode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PortfolioAnalysisServiceTest {
	private static final LocalDate DATE = LocalDate.of(2024, 6, 28);

	private final PortfolioAnalysisService service = new PortfolioAnalysisService(
			new PositionProcessor(),
			new TargetWeightSelector(1.0d, 30.0d),
			new RecommendationEngine(BigDecimal.ONE, SellQuantityMode.PER_SHARE_PRICE),
			"VND");

	@Test
	void combinesPositionsTargetsAndRecommendations() {
		AnalysisRequest request = new AnalysisRequest(
				"ACC-1",
				PortfolioStrategy.LONG_ONLY,
				new AccountBalanceDto(new BigDecimal("100000000"), new BigDecimal("1000000000"), new BigDecimal("900000000")),
				List.of(new HoldingDealDto("AAA", 10_000L, new BigDecimal("10000"), new BigDecimal("9000"),
						new BigDecimal("9100"), BigDecimal.ZERO, new BigDecimal("10000000"))),
				List.of(
						new OptimizedWeightRowDto(DATE, "AAA", 10000.0d, 0.25d, 0.0d, 0.15d, 0.0d, "CEMV"),
						new OptimizedWeightRowDto(DATE, "BBB", 20000.0d, 0.125d, 0.0d, 0.125d, 0.0d, "CEMV")),
				DATE);

		PortfolioAnalysis analysis = service.analyze(request);

		assertThat(analysis.currentPositions()).hasSize(1);
		assertThat(analysis.currentPositions().get(0).weight().percentage()).isEqualByComparingTo("10");
		assertThat(analysis.targetWeights()).hasSize(2);
		assertThat(analysis.cashRatio()).isEqualByComparingTo("10");
		assertThat(analysis.recommendations())
				.extracting(TradeRecommendation::symbol)
				.containsExactly("AAA", "BBB");
		assertThat(analysis.recommendations()).allMatch(recommendation -> recommendation.action() == TradeAction.BUY);
		assertThat(analysis.recommendations().get(0).actionQuantity()).isEqualTo(15_000L);
		assertThat(analysis.recommendations().get(1).actionQuantity()).isEqualTo(6_250L);

		PortfolioAnalysisDto dto = analysis.toDto();
		assertThat(dto.strategyType()).isEqualTo("long_only");
		assertThat(dto.accountBalance().cashRatio()).isCloseTo(10.0d, within(1e-9));
		assertThat(dto.recommendations()).hasSize(2);
	}

	@Test
	void missingNetAssetValueGivesZeroCashRatioAndNoRecommendations() {
		AnalysisRequest request = new AnalysisRequest(
				"ACC-2",
				PortfolioStrategy.LIMITED,
				new AccountBalanceDto(new BigDecimal("5000000"), null, null),
				List.of(),
				List.of(new OptimizedWeightRowDto(DATE, "AAA", 10000.0d, 0.25d, 0.0d, 0.15d, 0.0d, "CEMV")),
				DATE);

		PortfolioAnalysis analysis = service.analyze(request);

		assertThat(analysis.cashRatio()).isEqualByComparingTo("0");
		assertThat(analysis.currentPositions()).isEmpty();
		assertThat(analysis.targetWeights()).hasSize(1);
		assertThat(analysis.recommendations()).isEmpty();
	}

	@Test
	void requiresStrategy() {
		AnalysisRequest request = new AnalysisRequest("ACC-3", null, null, List.of(), List.of(), DATE);

		assertThatThrownBy(() -> service.analyze(request)).isInstanceOf(IllegalArgumentException.class);
	}
}
