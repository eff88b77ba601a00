package org.nowstart.avwap.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.avwap.data.exception.AvwapApiException;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.nowstart.avwap.data.type.AnchorRole;
import org.nowstart.avwap.data.type.SignalCategory;
import org.nowstart.avwap.data.type.SkipReason;
import org.nowstart.avwap.repository.EarningsAnchorCacheRepository;
import org.nowstart.avwap.service.bar.BarSource;
import org.nowstart.avwap.signal.core.AnchorSelection;
import org.nowstart.avwap.signal.core.AnchorSet;
import org.nowstart.avwap.signal.core.AvwapBands;
import org.nowstart.avwap.signal.core.AvwapRunReport;
import org.nowstart.avwap.signal.core.AvwapSignal;
import org.nowstart.avwap.signal.core.DailyBar;
import org.nowstart.avwap.signal.core.EarningsAnchorCache;
import org.nowstart.avwap.signal.core.SignalBook;
import org.nowstart.avwap.signal.core.Watchlist;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AvwapSignalWorkflowService {

    private static final int MIN_TRAILING_BARS = 3;

    private final WatchlistService watchlistService;
    private final EarningsAnchorCacheRepository earningsAnchorCacheRepository;
    private final EarningsAnchorResolverService earningsAnchorResolverService;
    private final BarSource barSource;
    private final AvwapComputationService avwapComputationService;
    private final AvwapSignalClassificationService avwapSignalClassificationService;
    private final AvwapSignalReportService avwapSignalReportService;
    private final AvwapProperties avwapProperties;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicReference<AvwapRunReport> latestReport = new AtomicReference<>();

    public AvwapRunReport runOnce() {
        if (!runLock.tryLock()) {
            throw new AvwapApiException(HttpStatus.CONFLICT, "run_in_progress", "An AVWAP run is already in progress");
        }
        try {
            AvwapRunReport report = execute();
            latestReport.set(report);
            return report;
        } finally {
            runLock.unlock();
        }
    }

    public Optional<AvwapRunReport> getLatestReport() {
        return Optional.ofNullable(latestReport.get());
    }

    public AnchorSet getCachedAnchors(String symbol) {
        String normalized = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        return earningsAnchorCacheRepository.load()
                .find(normalized)
                .orElseThrow(() -> new AvwapApiException(
                        HttpStatus.NOT_FOUND,
                        "anchor_not_found",
                        "No cached earnings anchors for symbol " + normalized
                ));
    }

    private AvwapRunReport execute() {
        LocalDate today = LocalDate.now(clock);
        Watchlist watchlist = watchlistService.loadWatchlist();
        List<String> symbols = watchlist.symbols();
        log.info("event=avwap_run_started today={} symbols={} longs={} shorts={}",
                today, symbols.size(), watchlist.longs().size(), watchlist.shorts().size());

        EarningsAnchorCache cache = earningsAnchorCacheRepository.load();
        Map<String, List<LocalDate>> anchors = earningsAnchorResolverService.resolveAll(symbols, cache, today);

        SignalBook signals = new SignalBook();
        Map<String, SkipReason> skipped = new TreeMap<>();
        for (String symbol : symbols) {
            try {
                evaluateSymbol(symbol, anchors.getOrDefault(symbol, List.of()), watchlist, today, signals)
                        .ifPresent(reason -> skip(skipped, symbol, reason));
            } catch (Exception e) {
                log.error("Failed to evaluate symbol={}", symbol, e);
                skip(skipped, symbol, SkipReason.EVALUATION_FAILED);
            }
        }

        AvwapRunReport report = new AvwapRunReport(symbols.size(), signals, skipped, ZonedDateTime.now(clock));
        avwapSignalReportService.write(report);
        try {
            earningsAnchorCacheRepository.save(cache);
        } catch (RuntimeException e) {
            log.error("Failed to persist earnings cache. Anchors will be resolved again next run.", e);
        }

        log.info("event=avwap_run_completed symbols={} signals={} skipped={} completed_at={}",
                symbols.size(), signals.size(), skipped.size(), report.completedAt());
        return report;
    }

    private Optional<SkipReason> evaluateSymbol(
            String symbol,
            List<LocalDate> anchorDates,
            Watchlist watchlist,
            LocalDate today,
            SignalBook signals
    ) {
        if (anchorDates.isEmpty()) {
            return Optional.of(SkipReason.NO_ANCHORS);
        }

        AnchorSelection selection = earningsAnchorResolverService.selectAnchors(anchorDates, today);
        if (selection.recentReportSkipped()) {
            log.info("Most recent report is too fresh, using prior anchor. symbol={}, latest={}, current={}",
                    symbol, anchorDates.get(0), selection.current());
        }
        Optional<LocalDate> earliest = selection.earliest();
        if (earliest.isEmpty()) {
            return Optional.of(SkipReason.NO_ELIGIBLE_ANCHOR);
        }

        int lookbackDays = (int) ChronoUnit.DAYS.between(earliest.get(), today) + 3;
        int minBars = avwapProperties.atrLength() + 3;
        List<DailyBar> bars = barSource.fetchDailyBars(symbol, lookbackDays, minBars);
        if (bars.isEmpty()) {
            return Optional.of(SkipReason.NO_BARS);
        }

        Optional<SkipReason> firstFailure = Optional.empty();
        boolean evaluated = false;
        if (selection.current() != null) {
            Optional<SkipReason> failure = evaluateAnchor(symbol, bars, selection.current(), AnchorRole.CURRENT, watchlist, signals);
            evaluated = failure.isEmpty();
            firstFailure = failure;
        }
        if (selection.previous() != null) {
            Optional<SkipReason> failure = evaluateAnchor(symbol, bars, selection.previous(), AnchorRole.PREVIOUS, watchlist, signals);
            evaluated = evaluated || failure.isEmpty();
            if (firstFailure.isEmpty()) {
                firstFailure = failure;
            }
        }
        return evaluated ? Optional.empty() : firstFailure;
    }

    private Optional<SkipReason> evaluateAnchor(
            String symbol,
            List<DailyBar> bars,
            LocalDate anchorDate,
            AnchorRole role,
            Watchlist watchlist,
            SignalBook signals
    ) {
        int anchorIndex = avwapComputationService.findAnchorIndex(bars, anchorDate);
        if (anchorIndex < 0) {
            return anchorSkipped(symbol, anchorDate, role, SkipReason.ANCHOR_BAR_MISSING);
        }
        if (bars.size() - anchorIndex < MIN_TRAILING_BARS) {
            return anchorSkipped(symbol, anchorDate, role, SkipReason.INSUFFICIENT_TRAILING_BARS);
        }

        Optional<AvwapBands> bands = avwapComputationService.computeBands(bars, anchorIndex);
        if (bands.isEmpty()) {
            return anchorSkipped(symbol, anchorDate, role, SkipReason.BANDS_UNDEFINED);
        }

        SignalBook anchorSignals = avwapSignalClassificationService.classify(
                symbol,
                bars,
                bands.get(),
                role,
                watchlist.isLong(symbol),
                watchlist.isShort(symbol)
        );
        signals.addAll(anchorSignals);
        logSignals(symbol, anchorDate, role, bands.get(), anchorSignals);
        return Optional.empty();
    }

    private void logSignals(String symbol, LocalDate anchorDate, AnchorRole role, AvwapBands bands, SignalBook anchorSignals) {
        log.debug("event=avwap_bands symbol={} anchor={} role={} vwap={} stdev={}",
                symbol, anchorDate, role, bands.vwap(), bands.stdev());
        for (SignalCategory category : SignalCategory.forRole(role)) {
            for (AvwapSignal signal : anchorSignals.get(category)) {
                log.info("event=avwap_signal symbol={} anchor={} role={} category={} date={} label={} side={}",
                        symbol, anchorDate, role, category, signal.date(), signal.label(), signal.side());
            }
        }
    }

    private Optional<SkipReason> anchorSkipped(String symbol, LocalDate anchorDate, AnchorRole role, SkipReason reason) {
        log.warn("event=anchor_skipped symbol={} anchor={} role={} reason={}", symbol, anchorDate, role, reason);
        return Optional.of(reason);
    }

    private void skip(Map<String, SkipReason> skipped, String symbol, SkipReason reason) {
        log.warn("event=symbol_skipped symbol={} reason={}", symbol, reason);
        skipped.put(symbol, reason);
    }
}
