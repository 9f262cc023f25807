package my.portfolioengine.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

public record PortfolioAnalysisDto(
		@JsonProperty("account_id") String accountId,
		@JsonProperty("strategy_type") String strategyType,
		@JsonProperty("account_balance") AccountSummaryDto accountBalance,
		@JsonProperty("current_positions") List<PositionDto> currentPositions,
		@JsonProperty("target_weights") List<TargetWeightDto> targetWeights,
		@JsonProperty("recommendations") List<TradeRecommendationDto> recommendations,
		@JsonProperty("analysis_date") LocalDate analysisDate
) {
	public record AccountSummaryDto(
			@JsonProperty("available_cash") double availableCash,
			@JsonProperty("net_asset_value") double netAssetValue,
			@JsonProperty("cash_ratio") double cashRatio
	) {
	}
}
