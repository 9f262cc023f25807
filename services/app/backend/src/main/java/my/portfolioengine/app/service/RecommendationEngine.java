package my.portfolioengine.app.service;

import my.portfolioengine.app.config.AppProperties;
import my.portfolioengine.app.domain.CurrencyMismatchException;
import my.portfolioengine.app.domain.Money;
import my.portfolioengine.app.domain.Position;
import my.portfolioengine.app.domain.TradeAction;
import my.portfolioengine.app.domain.TradePriority;
import my.portfolioengine.app.domain.TradeRecommendation;
import my.portfolioengine.app.domain.Weight;
import my.portfolioengine.app.dto.TargetWeightDto;
import my.portfolioengine.app.model.SellQuantityMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Diffs target weights against current positions and emits BUY/SELL instructions for every
 * symbol whose deviation reaches the weight tolerance.
 */
@Service
public class RecommendationEngine {
	private static final Logger logger = LoggerFactory.getLogger(RecommendationEngine.class);
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

	private final BigDecimal weightTolerance;
	private final SellQuantityMode sellQuantityMode;

	@Autowired
	public RecommendationEngine(AppProperties properties) {
		this(BigDecimal.valueOf(properties.recommendation().weightTolerance()),
				properties.recommendation().sellQuantityMode());
	}

	public RecommendationEngine(BigDecimal weightTolerance, SellQuantityMode sellQuantityMode) {
		this.weightTolerance = weightTolerance == null ? BigDecimal.ONE : weightTolerance;
		this.sellQuantityMode = sellQuantityMode == null ? SellQuantityMode.PER_SHARE_PRICE : sellQuantityMode;
	}

	public List<TradeRecommendation> generateRecommendations(List<Position> currentPositions,
															 List<TargetWeightDto> targetWeights,
															 Money availableCash,
															 Money netAssetValue) {
		if (netAssetValue == null || netAssetValue.amount().signum() <= 0) {
			return List.of();
		}
		if (availableCash != null && !availableCash.sameCurrency(netAssetValue)) {
			throw new CurrencyMismatchException("compare", netAssetValue.currency(), availableCash.currency());
		}
		String currency = netAssetValue.currency();

		Map<String, Position> current = new LinkedHashMap<>();
		if (currentPositions != null) {
			for (Position position : currentPositions) {
				if (position != null) {
					current.put(position.symbol(), position);
				}
			}
		}
		Map<String, TargetWeightDto> targets = new LinkedHashMap<>();
		if (targetWeights != null) {
			for (TargetWeightDto target : targetWeights) {
				if (target != null && target.symbol() != null) {
					targets.put(target.symbol(), target);
				}
			}
		}
		Set<String> symbols = new LinkedHashSet<>(current.keySet());
		symbols.addAll(targets.keySet());

		List<TradeRecommendation> recommendations = new ArrayList<>();
		for (String symbol : symbols) {
			Position position = current.getOrDefault(symbol, Position.empty(symbol, currency));
			TargetWeightDto target = targets.get(symbol);
			BigDecimal currentWeight = position.weight().percentage();
			BigDecimal targetWeight = target == null || target.weight() == null ? BigDecimal.ZERO : target.weight();
			BigDecimal difference = targetWeight.subtract(currentWeight);
			if (difference.abs().compareTo(weightTolerance) < 0) {
				continue;
			}
			TradePriority priority = TradePriority.forDeviation(difference);

			if (difference.compareTo(weightTolerance) > 0) {
				TradeRecommendation buy = buy(position, target, currentWeight, targetWeight, priority, netAssetValue);
				if (buy != null) {
					recommendations.add(buy);
				}
			} else if (difference.compareTo(weightTolerance.negate()) < 0) {
				recommendations.add(sell(position, currentWeight, targetWeight, priority, netAssetValue));
			}
		}

		recommendations.sort(Comparator
				.comparing((TradeRecommendation recommendation) -> recommendation.priority() == TradePriority.HIGH)
				.thenComparing(TradeRecommendation::weightDeviation)
				.reversed());
		return recommendations;
	}

	private TradeRecommendation buy(Position position,
									TargetWeightDto target,
									BigDecimal currentWeight,
									BigDecimal targetWeight,
									TradePriority priority,
									Money netAssetValue) {
		Money required = netAssetValue.multiply(targetWeight.divide(ONE_HUNDRED));
		Money cashNeeded = required.subtract(position.marketValue());
		if (cashNeeded.amount().signum() <= 0) {
			return null;
		}
		BigDecimal price = target == null ? null : target.marketPrice();
		Money actionPrice = null;
		Long actionQuantity = null;
		if (price != null && price.signum() > 0) {
			actionPrice = new Money(price, netAssetValue.currency());
			actionQuantity = floorQuantity(cashNeeded.amount(), price);
		} else {
			logger.warn("No usable price for {}, buy recommendation has no quantity", position.symbol());
		}
		return new TradeRecommendation(
				position.symbol(),
				TradeAction.BUY,
				new Weight(currentWeight),
				new Weight(targetWeight),
				cashNeeded,
				priority,
				String.format(Locale.ROOT, "Increase weight from %.1f%% to %.1f%%", currentWeight, targetWeight),
				actionPrice,
				actionQuantity
		);
	}

	private TradeRecommendation sell(Position position,
									 BigDecimal currentWeight,
									 BigDecimal targetWeight,
									 TradePriority priority,
									 Money netAssetValue) {
		Money currentValue = position.marketValue();
		Money targetValue = netAssetValue.multiply(targetWeight.divide(ONE_HUNDRED));
		Money cashToRaise = currentValue.subtract(targetValue);

		Money actionPrice;
		BigDecimal divisor;
		if (sellQuantityMode == SellQuantityMode.POSITION_VALUE) {
			actionPrice = currentValue;
			divisor = currentValue.amount();
		} else {
			actionPrice = position.marketPrice();
			divisor = position.marketPrice().amount();
		}
		long quantity = divisor.signum() > 0 ? floorQuantity(cashToRaise.amount(), divisor) : 0L;
		return new TradeRecommendation(
				position.symbol(),
				TradeAction.SELL,
				new Weight(currentWeight),
				new Weight(targetWeight),
				cashToRaise,
				priority,
				String.format(Locale.ROOT, "Reduce weight from %.1f%% to %.1f%%", currentWeight, targetWeight),
				actionPrice,
				quantity
		);
	}

	private static long floorQuantity(BigDecimal amount, BigDecimal unit) {
		return amount.divide(unit, 0, RoundingMode.FLOOR).longValueExact();
	}
}
