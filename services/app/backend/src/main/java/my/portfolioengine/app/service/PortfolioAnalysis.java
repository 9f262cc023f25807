package my.portfolioengine.app.service;

import my.portfolioengine.app.domain.Money;
import my.portfolioengine.app.domain.Position;
import my.portfolioengine.app.domain.TradeRecommendation;
import my.portfolioengine.app.dto.PortfolioAnalysisDto;
import my.portfolioengine.app.dto.PositionDto;
import my.portfolioengine.app.dto.TargetWeightDto;
import my.portfolioengine.app.dto.TradeRecommendationDto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record PortfolioAnalysis(
		String accountId,
		PortfolioStrategy strategy,
		Money availableCash,
		Money netAssetValue,
		BigDecimal cashRatio,
		List<Position> currentPositions,
		List<TargetWeightDto> targetWeights,
		List<TradeRecommendation> recommendations,
		LocalDate analysisDate
) {
	public PortfolioAnalysisDto toDto() {
		return new PortfolioAnalysisDto(
				accountId,
				strategy.key(),
				new PortfolioAnalysisDto.AccountSummaryDto(
						availableCash.amount().doubleValue(),
						netAssetValue.amount().doubleValue(),
						cashRatio.doubleValue()),
				currentPositions.stream().map(PositionDto::from).toList(),
				targetWeights,
				recommendations.stream().map(TradeRecommendationDto::from).toList(),
				analysisDate
		);
	}
}
