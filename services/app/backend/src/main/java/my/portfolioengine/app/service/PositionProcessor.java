package my.portfolioengine.app.service;

import my.portfolioengine.app.domain.Money;
import my.portfolioengine.app.domain.Position;
import my.portfolioengine.app.domain.Weight;
import my.portfolioengine.app.dto.HoldingDealDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds position snapshots from the raw holdings feed.
 */
@Service
public class PositionProcessor {
	private static final Logger logger = LoggerFactory.getLogger(PositionProcessor.class);
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
	private static final int WEIGHT_SCALE = 10;

	public List<Position> toPositions(List<HoldingDealDto> deals,
									  BigDecimal netAssetValue,
									  BigDecimal stockValue,
									  String currency) {
		if (deals == null || deals.isEmpty() || netAssetValue == null || netAssetValue.signum() <= 0) {
			return List.of();
		}
		List<Position> positions = new ArrayList<>();
		for (HoldingDealDto deal : deals) {
			if (deal == null || deal.symbol() == null || deal.symbol().isBlank()) {
				continue;
			}
			BigDecimal marketPrice = safeAmount(deal.marketPrice());
			if (deal.accumulateQuantity() <= 0 || marketPrice.signum() <= 0) {
				logger.debug("Skipping deal {} without quantity or price", deal.symbol());
				continue;
			}
			BigDecimal marketValue = marketPrice.multiply(BigDecimal.valueOf(deal.accumulateQuantity()));
			Weight weight = new Weight(percentOf(marketValue, netAssetValue));
			Weight weightOverStockValue = stockValue == null || stockValue.signum() <= 0
					? null
					: new Weight(percentOf(marketValue, stockValue));

			positions.add(new Position(
					deal.symbol(),
					deal.accumulateQuantity(),
					new Money(marketPrice, currency),
					new Money(safeAmount(deal.averageCostPrice()), currency),
					new Money(safeAmount(deal.breakEvenPrice()), currency),
					weight,
					weightOverStockValue,
					new Money(safeAmount(deal.realizedProfit()), currency),
					new Money(safeAmount(deal.unrealizedProfit()), currency)
			));
		}
		positions.sort(Comparator.comparing((Position position) -> position.weight().percentage()).reversed());
		return List.copyOf(positions);
	}

	private static BigDecimal percentOf(BigDecimal value, BigDecimal total) {
		return value.multiply(ONE_HUNDRED).divide(total, WEIGHT_SCALE, RoundingMode.HALF_UP);
	}

	private static BigDecimal safeAmount(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}
}
