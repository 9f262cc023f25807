package my.portfolioengine.app.service;

import my.portfolioengine.app.dto.OptimizedWeightRowDto;

import java.util.List;

public record WeightGenerationResult(
		List<OptimizedWeightRowDto> rows,
		int windowsProcessed,
		int windowsSkipped,
		int solverSuccesses,
		int solverFallbacks
) {
}
