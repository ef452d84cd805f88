package io.binana.service.balance;

import io.binana.domain.allocation.AllocationSpec;
import io.binana.domain.portfolio.AssetPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buy-only rebalancer.
 *
 * Spends new cash so that the portfolio after the purchase moves toward the target weights:
 * <pre>
 * totalValue     = sum(current values) + investableCash
 * targetValue(a) = weight(a) * totalValue
 * deficit(a)     = max(0, targetValue(a) - currentValue(a))
 * amount(a)      = floor(investableCash * deficit(a) / sum(deficits))
 * </pre>
 * Nothing is ever sold, so an overweight asset simply receives 0.
 * The amounts never add up to more than {@code investableCash}.
 */
public final class PortfolioBalancer {
    private static final Logger log = LoggerFactory.getLogger(PortfolioBalancer.class);

    private static final int SCALE = 10;

    /**
     * Compute the amount to invest per position.
     *
     * @param positions Current holdings (any symbol, valued in cents)
     * @param spec Verified target allocation
     * @param investableCash Cash to spend, in cents
     * @return Held positions in input order followed by targeted assets not held yet,
     *         each carrying its {@code amountToInvest}
     */
    public List<AssetPosition> balance(List<AssetPosition> positions, AllocationSpec spec, long investableCash) {
        Map<String, AssetPosition> bySymbol = new LinkedHashMap<>();
        for (AssetPosition position : positions) {
            if (bySymbol.putIfAbsent(position.symbol(), position.withAmountToInvest(0L)) != null) {
                throw new IllegalArgumentException("Duplicate position for " + position.symbol());
            }
        }
        for (String symbol : spec.listSymbols()) {
            bySymbol.putIfAbsent(symbol, AssetPosition.empty(symbol));
        }

        if (investableCash <= 0) {
            log.info("[PortfolioBalancer] No cash to invest ({} cents)", investableCash);
            return new ArrayList<>(bySymbol.values());
        }

        Map<String, BigDecimal> deficits = computeDeficits(bySymbol, spec, investableCash);
        BigDecimal deficitSum = deficits.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);

        if (deficitSum.signum() == 0) {
            log.info("[PortfolioBalancer] Every asset is at or above target, nothing to buy");
            return new ArrayList<>(bySymbol.values());
        }

        BigDecimal cash = BigDecimal.valueOf(investableCash);
        long allocated = 0L;
        for (Map.Entry<String, BigDecimal> entry : deficits.entrySet()) {
            BigDecimal deficit = entry.getValue();
            if (deficit.signum() == 0) {
                continue;
            }
            long amount = cash.multiply(deficit)
                .divide(deficitSum, 0, RoundingMode.DOWN)
                .longValueExact();
            bySymbol.computeIfPresent(entry.getKey(), (k, p) -> p.withAmountToInvest(amount));
            allocated += amount;
        }

        log.info("[PortfolioBalancer] Allocated {} of {} cents across {} assets",
            allocated, investableCash, countBuying(bySymbol.values()));
        return new ArrayList<>(bySymbol.values());
    }

    private static Map<String, BigDecimal> computeDeficits(Map<String, AssetPosition> bySymbol,
                                                          AllocationSpec spec, long investableCash) {
        long currentTotal = 0L;
        for (AssetPosition position : bySymbol.values()) {
            currentTotal += position.valueCents();
        }
        BigDecimal totalValue = BigDecimal.valueOf(currentTotal + investableCash);

        Map<String, BigDecimal> deficits = new LinkedHashMap<>();
        for (Map.Entry<String, Double> target : spec.weights().entrySet()) {
            String symbol = target.getKey();
            BigDecimal targetValue = totalValue.multiply(BigDecimal.valueOf(target.getValue()))
                .setScale(SCALE, RoundingMode.HALF_UP);
            BigDecimal current = BigDecimal.valueOf(bySymbol.get(symbol).valueCents());
            BigDecimal deficit = targetValue.subtract(current).max(BigDecimal.ZERO);
            deficits.put(symbol, deficit);

            log.debug("[PortfolioBalancer] {} weight={} current={} target={} deficit={}",
                symbol, target.getValue(), current, targetValue.toPlainString(), deficit.toPlainString());
        }
        return deficits;
    }

    private static long countBuying(Iterable<AssetPosition> positions) {
        long count = 0;
        for (AssetPosition position : positions) {
            if (position.isBuying()) {
                count++;
            }
        }
        return count;
    }
}
