package my.portfolioengine.app.service;

import my.portfolioengine.app.dto.AccountBalanceDto;
import my.portfolioengine.app.dto.HoldingDealDto;
import my.portfolioengine.app.dto.OptimizedWeightRowDto;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything a portfolio analysis needs, already fetched by the caller.
 */
public record AnalysisRequest(
		String accountId,
		PortfolioStrategy strategy,
		AccountBalanceDto balance,
		List<HoldingDealDto> deals,
		List<OptimizedWeightRowDto> weightRows,
		LocalDate analysisDate
) {
}
