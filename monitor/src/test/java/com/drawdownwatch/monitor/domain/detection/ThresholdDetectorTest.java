package com.drawdownwatch.monitor.domain.detection;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.drawdownwatch.monitor.support.PriceFixtures.baselines;
import static com.drawdownwatch.monitor.support.PriceFixtures.quote;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ThresholdDetectorTest {

    private final ThresholdDetector detector = new ThresholdDetector(DetectionPolicy.defaults());

    @Test
    void detect_tenPercentDrop_reportsOnlyTenPercentRung() {
        var crossings = detector.detect("X", Market.INDIA, quote("X", Market.INDIA, "180"),
                baselines("X", Market.INDIA, Map.of(Timeframe.ONE_DAY, "200")));

        assertThat(crossings).singleElement().satisfies(crossing -> {
            assertThat(crossing.timeframe()).isEqualTo(Timeframe.ONE_DAY);
            assertThat(crossing.threshold()).isEqualTo(10);
            assertThat(crossing.dropPercentage()).isEqualByComparingTo("10");
            assertThat(crossing.baselinePrice()).isEqualByComparingTo("200");
            assertThat(crossing.currentPrice()).isEqualByComparingTo("180");
        });
    }

    @Test
    void detect_dropBelowLowestRung_returnsEmpty() {
        var crossings = detector.detect("X", Market.INDIA, quote("X", Market.INDIA, "191"),
                baselines("X", Market.INDIA, Map.of(Timeframe.ONE_DAY, "200")));

        assertThat(crossings).isEmpty();
    }

    @Test
    void detect_exactlyOnRung_crosses() {
        var crossings = detector.detect("X", Market.INDIA, quote("X", Market.INDIA, "95"),
                baselines("X", Market.INDIA, Map.of(Timeframe.ONE_WEEK, "100")));

        assertThat(crossings).extracting(ThresholdCrossing::threshold).containsExactly(5);
    }

    @Test
    void detect_priceRise_returnsEmpty() {
        var crossings = detector.detect("X", Market.INDIA, quote("X", Market.INDIA, "250"),
                baselines("X", Market.INDIA, Map.of(Timeframe.ONE_DAY, "200")));

        assertThat(crossings).isEmpty();
    }

    @Test
    void detect_oneCrossingPerTimeframe() {
        var crossings = detector.detect("X", Market.USA, quote("X", Market.USA, "75"), baselines("X", Market.USA, Map.of(
                Timeframe.ONE_DAY, "80",
                Timeframe.ONE_WEEK, "85",
                Timeframe.ONE_MONTH, "90",
                Timeframe.ONE_YEAR, "100")));

        assertThat(crossings)
                .extracting(ThresholdCrossing::timeframe, ThresholdCrossing::threshold)
                .containsExactly(
                        tuple(Timeframe.ONE_DAY, 5),
                        tuple(Timeframe.ONE_WEEK, 10),
                        tuple(Timeframe.ONE_MONTH, 15),
                        tuple(Timeframe.ONE_YEAR, 20));
    }

    @Test
    void detect_absentOrNonPositiveBaseline_isSkipped() {
        var partial = new EnumMap<>(baselines("X", Market.INDIA, Map.of(Timeframe.ONE_WEEK, "0")));
        partial.remove(Timeframe.ONE_MONTH);

        var crossings = detector.detect("X", Market.INDIA, quote("X", Market.INDIA, "1"), partial);

        assertThat(crossings).isEmpty();
    }

    @Test
    void detect_threeAndSixMonthBaselines_areNotEvaluated() {
        var crossings = detector.detect("X", Market.INDIA, quote("X", Market.INDIA, "50"), baselines("X", Market.INDIA, Map.of(
                Timeframe.THREE_MONTHS, "100",
                Timeframe.SIX_MONTHS, "100")));

        assertThat(crossings).isEmpty();
    }

    @Test
    void detect_customRungs_areSortedAndDeduplicated() {
        var custom = new ThresholdDetector(new DetectionPolicy(List.of(30, 3, 3, 12), 30));

        var crossings = custom.detect("X", Market.INDIA, quote("X", Market.INDIA, "85"),
                baselines("X", Market.INDIA, Map.of(Timeframe.ONE_DAY, "100")));

        assertThat(crossings).extracting(ThresholdCrossing::threshold).containsExactly(12);
    }

    @Test
    void dropPercentage_keepsSixDecimals() {
        assertThat(ThresholdDetector.dropPercentage(new BigDecimal("180"), new BigDecimal("170.9")))
                .isEqualByComparingTo("5.055556");
    }
}
