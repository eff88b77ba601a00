package org.nowstart.avwap.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.avwap.data.type.BounceDirection;
import org.nowstart.avwap.signal.core.DailyBar;
import org.nowstart.avwap.support.AvwapPropertiesFixture;

class BounceDetectionServiceTest {

    private static final double LEVEL = 100.0;
    private static final double ATR = 2.0;

    private final BounceDetectionService service = new BounceDetectionService(AvwapPropertiesFixture.withAtrLength(2));

    @Test
    void bounceUp_detectsTouchAndConfirmationAboveLevel() {
        List<DailyBar> bars = series(
                new double[] {100.4, 100.6, 100.05, 100.5},
                new double[] {100.5, 101.2, 100.5, 101.0}
        );

        assertThat(service.bounceUp(bars, LEVEL, ATR)).isTrue();
        assertThat(service.bounceDown(bars, LEVEL, ATR)).isFalse();
        assertThat(service.isBounce(BounceDirection.UP, bars, LEVEL, ATR)).isTrue();
    }

    @Test
    void bounceUp_requiresConfirmationBeyondPush() {
        List<DailyBar> bars = series(
                new double[] {100.0, 100.2, 99.95, 100.02},
                new double[] {100.02, 100.1, 100.0, 100.05}
        );

        assertThat(service.bounceUp(bars, LEVEL, ATR)).isFalse();
    }

    @Test
    void bounceDown_detectsTouchAndConfirmationBelowLevel() {
        List<DailyBar> bars = series(
                new double[] {99.6, 99.95, 99.4, 99.5},
                new double[] {99.5, 99.6, 98.8, 99.0}
        );

        assertThat(service.bounceDown(bars, LEVEL, ATR)).isTrue();
        assertThat(service.bounceUp(bars, LEVEL, ATR)).isFalse();
        assertThat(service.isBounce(BounceDirection.DOWN, bars, LEVEL, ATR)).isTrue();
    }

    @Test
    void bounce_isFalseWithTooFewBarsOrUndefinedInputs() {
        List<DailyBar> bars = series(
                new double[] {100.4, 100.6, 100.05, 100.5},
                new double[] {100.5, 101.2, 100.5, 101.0}
        );

        assertThat(service.bounceUp(bars.subList(1, bars.size()), LEVEL, ATR)).isFalse();
        assertThat(service.bounceUp(bars, LEVEL, Double.NaN)).isFalse();
        assertThat(service.bounceUp(bars, Double.NaN, ATR)).isFalse();
        assertThat(service.bounceDown(bars, LEVEL, Double.POSITIVE_INFINITY)).isFalse();
    }

    @Test
    void bounceUpAndBounceDown_areNeverBothTrue() {
        double[][] candidates = {
                {99.9, 100.1, 99.8, 100.0},
                {100.0, 100.3, 99.7, 100.0},
                {100.2, 100.5, 99.5, 99.9},
                {99.0, 101.0, 98.0, 100.0}
        };
        for (double[] touch : candidates) {
            for (double[] confirm : candidates) {
                List<DailyBar> bars = series(touch, confirm);
                boolean up = service.bounceUp(bars, LEVEL, ATR);
                boolean down = service.bounceDown(bars, LEVEL, ATR);
                assertThat(up && down).isFalse();
            }
        }
    }

    private List<DailyBar> series(double[] touch, double[] confirm) {
        LocalDate start = LocalDate.of(2024, 3, 4);
        List<DailyBar> bars = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            bars.add(new DailyBar(start.plusDays(i), 100.0, 101.0, 99.0, 100.0, 1000));
        }
        bars.add(new DailyBar(start.plusDays(3), touch[0], touch[1], touch[2], touch[3], 1000));
        bars.add(new DailyBar(start.plusDays(4), confirm[0], confirm[1], confirm[2], confirm[3], 1000));
        return bars;
    }
}
