package org.nowstart.avwap.service;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.nowstart.avwap.data.type.BounceDirection;
import org.nowstart.avwap.signal.core.DailyBar;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BounceDetectionService {

    private final AvwapProperties avwapProperties;

    public boolean isBounce(BounceDirection direction, List<DailyBar> bars, double level, double atr) {
        return direction == BounceDirection.UP
                ? bounceUp(bars, level, atr)
                : bounceDown(bars, level, atr);
    }

    public boolean bounceUp(List<DailyBar> bars, double level, double atr) {
        if (!evaluable(bars, level, atr)) {
            return false;
        }

        double threshold = threshold(atr);
        DailyBar touch = bars.get(bars.size() - 2);
        DailyBar confirm = bars.get(bars.size() - 1);
        return touch.low() <= level + threshold
                && touch.close() >= level
                && confirm.close() > touch.close()
                && confirm.close() >= level + threshold;
    }

    public boolean bounceDown(List<DailyBar> bars, double level, double atr) {
        if (!evaluable(bars, level, atr)) {
            return false;
        }

        double threshold = threshold(atr);
        DailyBar touch = bars.get(bars.size() - 2);
        DailyBar confirm = bars.get(bars.size() - 1);
        return touch.high() >= level - threshold
                && touch.close() <= level
                && confirm.close() < touch.close()
                && confirm.close() <= level - threshold;
    }

    private boolean evaluable(List<DailyBar> bars, double level, double atr) {
        return bars != null
                && bars.size() >= avwapProperties.atrLength() + 3
                && Double.isFinite(level)
                && Double.isFinite(atr);
    }

    private double threshold(double atr) {
        return avwapProperties.atrMultiplier().doubleValue() * atr;
    }
}
