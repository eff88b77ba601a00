package org.nowstart.avwap.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.nowstart.avwap.signal.core.AvwapBands;
import org.nowstart.avwap.signal.core.DailyBar;
import org.springframework.stereotype.Service;

@Service
public class AvwapComputationService {

    public Optional<AvwapBands> computeBands(List<DailyBar> bars, int anchorIndex) {
        if (bars == null || anchorIndex < 0 || anchorIndex >= bars.size()) {
            return Optional.empty();
        }

        double cumVolume = 0.0;
        double cumPriceVolume = 0.0;
        double cumSquaredDeviation = 0.0;
        for (int i = anchorIndex; i < bars.size(); i++) {
            DailyBar bar = bars.get(i);
            double volume = bar.volume();
            if (!(volume > 0.0)) {
                continue;
            }

            double typicalPrice = bar.typicalPrice();
            cumVolume += volume;
            cumPriceVolume += typicalPrice * volume;
            // deviation is measured against the running vwap, not the final one
            double runningVwap = cumPriceVolume / cumVolume;
            double deviation = typicalPrice - runningVwap;
            cumSquaredDeviation += deviation * deviation * volume;
        }

        if (cumVolume == 0.0) {
            return Optional.empty();
        }

        double vwap = cumPriceVolume / cumVolume;
        double stdev = Math.sqrt(cumSquaredDeviation / cumVolume);
        return Optional.of(new AvwapBands(vwap, stdev));
    }

    public double averageTrueRange(List<DailyBar> bars, int length) {
        if (bars == null || length <= 0 || bars.size() < length + 1) {
            return Double.NaN;
        }

        double total = 0.0;
        for (int i = bars.size() - length; i < bars.size(); i++) {
            total += trueRange(bars.get(i), bars.get(i - 1));
        }

        double atr = total / length;
        if (!Double.isFinite(atr) || atr <= 0.0) {
            return Double.NaN;
        }
        return atr;
    }

    public int findAnchorIndex(List<DailyBar> bars, LocalDate anchorDate) {
        for (int i = 0; i < bars.size(); i++) {
            if (bars.get(i).date().equals(anchorDate)) {
                return i;
            }
        }
        return -1;
    }

    private double trueRange(DailyBar bar, DailyBar previous) {
        double highLow = bar.high() - bar.low();
        double highPrevClose = Math.abs(bar.high() - previous.close());
        double lowPrevClose = Math.abs(bar.low() - previous.close());
        return Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
    }
}
