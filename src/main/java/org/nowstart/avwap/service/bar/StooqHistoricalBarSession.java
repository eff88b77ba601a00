package org.nowstart.avwap.service.bar;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.nowstart.avwap.repository.StooqFeignClient;
import org.nowstart.avwap.signal.core.DailyBar;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class StooqHistoricalBarSession implements HistoricalBarSession {

    private final StooqFeignClient stooqFeignClient;
    private final AvwapProperties avwapProperties;
    private final Clock clock;
    private final ExecutorService executor;
    private final Map<Integer, AtomicBoolean> inFlight = new ConcurrentHashMap<>();

    public StooqHistoricalBarSession(
            StooqFeignClient stooqFeignClient,
            AvwapProperties avwapProperties,
            Clock clock,
            @Qualifier("barSessionExecutor") ExecutorService executor
    ) {
        this.stooqFeignClient = stooqFeignClient;
        this.avwapProperties = avwapProperties;
        this.clock = clock;
        this.executor = executor;
    }

    @Override
    public void requestDailyBars(int requestId, String symbol, int lookbackDays, int minBars, HistoricalBarListener listener) {
        AtomicBoolean cancelled = new AtomicBoolean();
        inFlight.put(requestId, cancelled);
        executor.execute(() -> {
            try {
                dispatch(requestId, symbol, lookbackDays, minBars, listener, cancelled);
            } finally {
                inFlight.remove(requestId, cancelled);
            }
        });
    }

    @Override
    public void cancel(int requestId) {
        AtomicBoolean cancelled = inFlight.get(requestId);
        if (cancelled != null) {
            cancelled.set(true);
        }
    }

    private void dispatch(
            int requestId,
            String symbol,
            int lookbackDays,
            int minBars,
            HistoricalBarListener listener,
            AtomicBoolean cancelled
    ) {
        if (cancelled.get()) {
            return;
        }

        List<DailyBar> bars;
        try {
            String ticker = symbol.toLowerCase(Locale.ROOT) + avwapProperties.barSymbolSuffix();
            String body = stooqFeignClient.getDailyBars(ticker, "d");
            bars = parseCsv(body, LocalDate.now(clock).minusDays(lookbackDays), minBars);
        } catch (Exception e) {
            if (!cancelled.get()) {
                listener.onError(requestId, "stooq request failed for " + symbol, e);
            }
            return;
        }

        if (cancelled.get()) {
            return;
        }
        bars.forEach(bar -> listener.onBar(requestId, bar));
        listener.onEnd(requestId);
    }

    List<DailyBar> parseCsv(String body, LocalDate cutoff, int minBars) {
        if (body == null) {
            return List.of();
        }
        String text = body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            return List.of();
        }
        if (text.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new IllegalStateException("stooq daily hits limit exceeded");
        }

        String[] lines = text.split("\\r?\\n");
        String header = lines[0].trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith("date,open,high,low,close")) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new IllegalStateException("unexpected stooq payload: " + sample);
        }

        List<DailyBar> bars = new ArrayList<>(lines.length);
        for (int i = 1; i < lines.length; i++) {
            DailyBar bar = parseLine(lines[i]);
            if (bar != null) {
                bars.add(bar);
            }
        }
        bars.sort(Comparator.comparing(DailyBar::date));

        // rows before the cutoff are kept while fewer than minBars rows would remain
        int start = 0;
        while (start < bars.size() && bars.get(start).date().isBefore(cutoff)) {
            start++;
        }
        start = Math.min(start, Math.max(0, bars.size() - minBars));
        return new ArrayList<>(bars.subList(start, bars.size()));
    }

    private DailyBar parseLine(String line) {
        String[] cols = line.trim().split(",");
        if (cols.length < 5) {
            return null;
        }
        try {
            double close = Double.parseDouble(cols[4].trim());
            if (!(close > 0.0)) {
                return null;
            }
            return new DailyBar(
                    LocalDate.parse(cols[0].trim()),
                    Double.parseDouble(cols[1].trim()),
                    Double.parseDouble(cols[2].trim()),
                    Double.parseDouble(cols[3].trim()),
                    close,
                    cols.length >= 6 ? Double.parseDouble(cols[5].trim()) : 0.0
            );
        } catch (RuntimeException e) {
            log.debug("Skipping malformed stooq row. line={}", line);
            return null;
        }
    }
}
