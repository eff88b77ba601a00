package org.nowstart.avwap.service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.nowstart.avwap.data.type.AnchorRole;
import org.nowstart.avwap.data.type.BandLevel;
import org.nowstart.avwap.data.type.BounceDirection;
import org.nowstart.avwap.data.type.SignalCategory;
import org.nowstart.avwap.data.type.TradeSide;
import org.nowstart.avwap.signal.core.AvwapBands;
import org.nowstart.avwap.signal.core.AvwapSignal;
import org.nowstart.avwap.signal.core.DailyBar;
import org.nowstart.avwap.signal.core.SignalBook;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AvwapSignalClassificationService {

    private static final List<BandLevel> CURRENT_LONG_BOUNCE_LEVELS = List.of(
            BandLevel.LOWER_2, BandLevel.LOWER_1, BandLevel.VWAP, BandLevel.UPPER_1
    );
    private static final List<BandLevel> CURRENT_SHORT_BOUNCE_LEVELS = List.of(
            BandLevel.UPPER_2, BandLevel.UPPER_1, BandLevel.VWAP, BandLevel.LOWER_1
    );
    private static final List<BandLevel> PREVIOUS_LONG_BOUNCE_LEVELS = List.of(BandLevel.UPPER_1);
    private static final List<BandLevel> PREVIOUS_SHORT_BOUNCE_LEVELS = List.of(BandLevel.LOWER_1);

    private final AvwapProperties avwapProperties;
    private final AvwapComputationService avwapComputationService;
    private final BounceDetectionService bounceDetectionService;

    public SignalBook classify(
            String symbol,
            List<DailyBar> bars,
            AvwapBands bands,
            AnchorRole role,
            boolean isLong,
            boolean isShort
    ) {
        SignalBook book = new SignalBook();
        if (bars == null || bars.isEmpty() || bands == null) {
            return book;
        }

        if (role == AnchorRole.CURRENT) {
            addTiers(book, symbol, bars, bands, isLong, isShort);
            addVwapTouches(book, symbol, bars, bands, isLong);
        }
        addCrosses(book, symbol, bars, bands, role, isLong, isShort);
        addBounces(book, symbol, bars, bands, role, isLong, isShort);
        return book;
    }

    private void addTiers(SignalBook book, String symbol, List<DailyBar> bars, AvwapBands bands, boolean isLong, boolean isShort) {
        DailyBar last = bars.get(bars.size() - 1);
        double close = last.close();

        if (isLong) {
            for (int k = 3; k >= 1; k--) {
                if (close > bands.upper(k)) {
                    book.add(SignalCategory.tier(k), signal(symbol, last, BandLevel.upper(k).name(), TradeSide.LONG));
                    break;
                }
            }
        }

        if (isShort) {
            for (int k = 3; k >= 1; k--) {
                if (close < bands.lower(k)) {
                    book.add(SignalCategory.tier(k), signal(symbol, last, BandLevel.lower(k).name(), TradeSide.SHORT));
                    break;
                }
            }
        }
    }

    private void addVwapTouches(SignalBook book, String symbol, List<DailyBar> bars, AvwapBands bands, boolean isLong) {
        TradeSide side = isLong ? TradeSide.LONG : TradeSide.SHORT;
        for (DailyBar bar : bars.subList(Math.max(0, bars.size() - 2), bars.size())) {
            Set<BandLevel> touched = touchedLevels(bar, bands);
            if (!touched.contains(BandLevel.VWAP)) {
                continue;
            }
            // bars spanning VWAP and both first bands are ignored
            if (touched.contains(BandLevel.UPPER_1) && touched.contains(BandLevel.LOWER_1)) {
                continue;
            }
            book.add(SignalCategory.VWAP_CROSS, signal(symbol, bar, BandLevel.VWAP.name(), side));
        }
    }

    private void addCrosses(
            SignalBook book,
            String symbol,
            List<DailyBar> bars,
            AvwapBands bands,
            AnchorRole role,
            boolean isLong,
            boolean isShort
    ) {
        if (bars.size() < 2) {
            return;
        }

        DailyBar last = bars.get(bars.size() - 1);
        double previousClose = bars.get(bars.size() - 2).close();
        double currentClose = last.close();

        if (isLong) {
            for (int k = 1; k <= 3; k++) {
                double upper = bands.upper(k);
                if (previousClose <= upper && upper < currentClose) {
                    String label = role.label("CROSS_UP_" + BandLevel.upper(k).name());
                    book.add(SignalCategory.cross(role, TradeSide.LONG), signal(symbol, last, label, TradeSide.LONG));
                }
            }
        }

        if (isShort) {
            for (int k = 1; k <= 3; k++) {
                double lower = bands.lower(k);
                if (previousClose >= lower && lower > currentClose) {
                    String label = role.label("CROSS_DOWN_" + BandLevel.lower(k).name());
                    book.add(SignalCategory.cross(role, TradeSide.SHORT), signal(symbol, last, label, TradeSide.SHORT));
                }
            }
        }
    }

    private void addBounces(
            SignalBook book,
            String symbol,
            List<DailyBar> bars,
            AvwapBands bands,
            AnchorRole role,
            boolean isLong,
            boolean isShort
    ) {
        double atr = avwapComputationService.averageTrueRange(bars, avwapProperties.atrLength());
        if (!Double.isFinite(atr)) {
            return;
        }

        DailyBar last = bars.get(bars.size() - 1);
        if (isLong) {
            List<BandLevel> levels = role == AnchorRole.CURRENT ? CURRENT_LONG_BOUNCE_LEVELS : PREVIOUS_LONG_BOUNCE_LEVELS;
            addBounces(book, symbol, bars, bands, role, atr, last, levels, BounceDirection.UP, TradeSide.LONG);
        }
        if (isShort) {
            List<BandLevel> levels = role == AnchorRole.CURRENT ? CURRENT_SHORT_BOUNCE_LEVELS : PREVIOUS_SHORT_BOUNCE_LEVELS;
            addBounces(book, symbol, bars, bands, role, atr, last, levels, BounceDirection.DOWN, TradeSide.SHORT);
        }
    }

    private void addBounces(
            SignalBook book,
            String symbol,
            List<DailyBar> bars,
            AvwapBands bands,
            AnchorRole role,
            double atr,
            DailyBar last,
            List<BandLevel> levels,
            BounceDirection direction,
            TradeSide side
    ) {
        for (BandLevel level : levels) {
            if (bounceDetectionService.isBounce(direction, bars, bands.level(level), atr)) {
                String label = role.label("BOUNCE_" + level.name());
                book.add(SignalCategory.bounce(role, side), signal(symbol, last, label, side));
            }
        }
    }

    private Set<BandLevel> touchedLevels(DailyBar bar, AvwapBands bands) {
        Set<BandLevel> touched = EnumSet.noneOf(BandLevel.class);
        for (BandLevel level : BandLevel.values()) {
            if (bar.spans(bands.level(level))) {
                touched.add(level);
            }
        }
        return touched;
    }

    private AvwapSignal signal(String symbol, DailyBar bar, String label, TradeSide side) {
        return new AvwapSignal(symbol, bar.date(), label, side);
    }
}
