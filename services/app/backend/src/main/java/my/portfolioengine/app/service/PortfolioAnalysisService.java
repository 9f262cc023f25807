package my.portfolioengine.app.service;

import my.portfolioengine.app.config.AppProperties;
import my.portfolioengine.app.domain.Money;
import my.portfolioengine.app.domain.Position;
import my.portfolioengine.app.domain.TradeRecommendation;
import my.portfolioengine.app.dto.AccountBalanceDto;
import my.portfolioengine.app.dto.TargetWeightDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

@Service
public class PortfolioAnalysisService {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioAnalysisService.class);
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

	private final PositionProcessor positionProcessor;
	private final TargetWeightSelector targetWeightSelector;
	private final RecommendationEngine recommendationEngine;
	private final String currency;

	@Autowired
	public PortfolioAnalysisService(PositionProcessor positionProcessor,
									TargetWeightSelector targetWeightSelector,
									RecommendationEngine recommendationEngine,
									AppProperties properties) {
		this(positionProcessor, targetWeightSelector, recommendationEngine, properties.recommendation().currency());
	}

	public PortfolioAnalysisService(PositionProcessor positionProcessor,
									TargetWeightSelector targetWeightSelector,
									RecommendationEngine recommendationEngine,
									String currency) {
		this.positionProcessor = positionProcessor;
		this.targetWeightSelector = targetWeightSelector;
		this.recommendationEngine = recommendationEngine;
		this.currency = currency;
	}

	public PortfolioAnalysis analyze(AnalysisRequest request) {
		if (request == null || request.strategy() == null) {
			throw new IllegalArgumentException("Analysis request with a strategy is required");
		}
		AccountBalanceDto balance = request.balance();
		Money availableCash = new Money(amountOrZero(balance == null ? null : balance.availableCash()), currency);
		Money netAssetValue = new Money(amountOrZero(balance == null ? null : balance.netAssetValue()), currency);
		BigDecimal stockValue = balance == null ? null : balance.stockValue();

		List<Position> positions = positionProcessor.toPositions(
				request.deals(), netAssetValue.amount(), stockValue, currency);
		List<TargetWeightDto> targets = targetWeightSelector.selectTargets(request.weightRows(), request.strategy());
		if (targets.isEmpty()) {
			logger.warn("No target weights for account {} with strategy {}", request.accountId(), request.strategy().key());
		}
		List<TradeRecommendation> recommendations = recommendationEngine.generateRecommendations(
				positions, targets, availableCash, netAssetValue);

		BigDecimal cashRatio = netAssetValue.isPositive()
				? availableCash.amount().multiply(ONE_HUNDRED).divide(netAssetValue.amount(), 4, RoundingMode.HALF_UP)
				: BigDecimal.ZERO;
		logger.info("Analyzed account {}: {} positions, {} targets, {} recommendations",
				request.accountId(), positions.size(), targets.size(), recommendations.size());
		return new PortfolioAnalysis(
				request.accountId(),
				request.strategy(),
				availableCash,
				netAssetValue,
				cashRatio,
				positions,
				targets,
				List.copyOf(recommendations),
				request.analysisDate()
		);
	}

	private static BigDecimal amountOrZero(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}
}
