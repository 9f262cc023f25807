package my.portfolioengine.app.service;

import my.portfolioengine.app.config.AppProperties;
import my.portfolioengine.app.dto.OptimizedWeightRowDto;
import my.portfolioengine.app.dto.TargetWeightDto;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns stored weight rows of one date into percentage targets for a strategy. Weights below the
 * minimum are dropped and the rest are capped at the limit.
 */
@Service
public class TargetWeightSelector {
	private final double minWeightPct;
	private final double limitWeightPct;

	@Autowired
	public TargetWeightSelector(AppProperties properties) {
		this(properties.recommendation().minTargetWeightPct(), properties.recommendation().limitTargetWeightPct());
	}

	public TargetWeightSelector(double minWeightPct, double limitWeightPct) {
		this.minWeightPct = minWeightPct;
		this.limitWeightPct = limitWeightPct;
	}

	public List<TargetWeightDto> selectTargets(List<OptimizedWeightRowDto> rows, PortfolioStrategy strategy) {
		if (rows == null || rows.isEmpty()) {
			return List.of();
		}
		List<TargetWeightDto> targets = new ArrayList<>();
		for (OptimizedWeightRowDto row : rows) {
			if (row == null || row.symbol() == null) {
				continue;
			}
			double pct = strategy.weightOf(row) * 100.0d;
			if (!Double.isFinite(pct) || pct < minWeightPct) {
				continue;
			}
			BigDecimal price = row.marketPrice() == null || !Double.isFinite(row.marketPrice())
					? null
					: BigDecimal.valueOf(row.marketPrice());
			targets.add(new TargetWeightDto(row.symbol(), BigDecimal.valueOf(Math.min(pct, limitWeightPct)), price));
		}
		targets.sort(Comparator.comparing(TargetWeightDto::weight).reversed());
		return List.copyOf(targets);
	}
}
