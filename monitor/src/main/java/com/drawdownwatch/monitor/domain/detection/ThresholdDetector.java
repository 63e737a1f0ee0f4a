package com.drawdownwatch.monitor.domain.detection;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import com.drawdownwatch.monitor.domain.price.HistoricalBaseline;
import com.drawdownwatch.monitor.domain.price.PriceQuote;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares a current price with the detection baselines. Per timeframe only the highest rung
 * crossed is reported; lower rungs are implied.
 */
@Component
@RequiredArgsConstructor
public class ThresholdDetector {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENT_SCALE = 6;

    private final DetectionPolicy policy;

    public List<ThresholdCrossing> detect(
            String symbol, Market market, PriceQuote current, Map<Timeframe, HistoricalBaseline> baselines) {
        var crossings = new ArrayList<ThresholdCrossing>();
        for (var timeframe : Timeframe.DETECTION) {
            var baseline = baselines.get(timeframe);
            if (baseline == null || !baseline.isPresent() || baseline.price().signum() <= 0) {
                continue;
            }
            var drop = dropPercentage(baseline.price(), current.price());
            highestRung(drop).ifPresent(rung -> crossings.add(ThresholdCrossing.builder()
                    .symbol(symbol)
                    .market(market)
                    .timeframe(timeframe)
                    .threshold(rung)
                    .dropPercentage(drop)
                    .currentPrice(current.price())
                    .baselinePrice(baseline.price())
                    .build()));
        }
        return crossings;
    }

    static BigDecimal dropPercentage(BigDecimal baseline, BigDecimal current) {
        return baseline.subtract(current)
                .multiply(HUNDRED)
                .divide(baseline, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    private Optional<Integer> highestRung(BigDecimal drop) {
        Integer highest = null;
        for (var rung : policy.rungs()) {
            if (drop.compareTo(BigDecimal.valueOf(rung)) >= 0) {
                highest = rung;
            }
        }
        return Optional.ofNullable(highest);
    }
}
