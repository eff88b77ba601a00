package org.nowstart.avwap.service.bar;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.nowstart.avwap.signal.core.DailyBar;
import org.springframework.stereotype.Service;

/**
 * Blocking {@link BarSource} over an asynchronous {@link HistoricalBarSession}. One request is in flight at a
 * time; callbacks are matched to the waiting caller by request id.
 */
@Slf4j
@Service
public class SessionBarSource implements BarSource, HistoricalBarListener {

    private final HistoricalBarSession session;
    private final Duration timeout;
    private final AtomicInteger nextRequestId = new AtomicInteger(1);
    private final Map<Integer, PendingRequest> pending = new ConcurrentHashMap<>();
    private final ReentrantLock requestLock = new ReentrantLock();

    public SessionBarSource(HistoricalBarSession session, AvwapProperties avwapProperties) {
        this.session = session;
        this.timeout = avwapProperties.barRequestTimeout();
    }

    @Override
    public List<DailyBar> fetchDailyBars(String symbol, int lookbackDays, int minBars) {
        requestLock.lock();
        int requestId = nextRequestId.getAndIncrement();
        PendingRequest request = new PendingRequest();
        pending.put(requestId, request);
        try {
            session.requestDailyBars(requestId, symbol, lookbackDays, minBars, this);
            List<DailyBar> rows = request.result().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return normalize(rows);
        } catch (TimeoutException e) {
            log.warn("Timed out waiting for daily bars. symbol={}, requestId={}, timeout={}", symbol, requestId, timeout);
            session.cancel(requestId);
            return List.of();
        } catch (ExecutionException e) {
            log.warn("Daily bar request failed. symbol={}, requestId={}", symbol, requestId, e.getCause());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for daily bars. symbol={}, requestId={}", symbol, requestId);
            return List.of();
        } finally {
            pending.remove(requestId);
            requestLock.unlock();
        }
    }

    @Override
    public void onBar(int requestId, DailyBar bar) {
        PendingRequest request = pending.get(requestId);
        if (request == null) {
            log.debug("Dropping bar for unknown request. requestId={}", requestId);
            return;
        }
        request.rows().add(bar);
    }

    @Override
    public void onEnd(int requestId) {
        PendingRequest request = pending.get(requestId);
        if (request == null) {
            return;
        }
        synchronized (request.rows()) {
            request.result().complete(new ArrayList<>(request.rows()));
        }
    }

    @Override
    public void onError(int requestId, String message, Throwable cause) {
        PendingRequest request = pending.get(requestId);
        if (request == null) {
            log.debug("Dropping error for unknown request. requestId={}, message={}", requestId, message);
            return;
        }
        request.result().completeExceptionally(new IllegalStateException(message, cause));
    }

    private List<DailyBar> normalize(List<DailyBar> rows) {
        Map<LocalDate, DailyBar> byDate = new LinkedHashMap<>();
        for (DailyBar row : rows) {
            if (row != null && row.date() != null) {
                byDate.putIfAbsent(row.date(), row);
            }
        }
        return byDate.values().stream()
                .sorted(Comparator.comparing(DailyBar::date))
                .toList();
    }

    private record PendingRequest(List<DailyBar> rows, CompletableFuture<List<DailyBar>> result) {

        PendingRequest() {
            this(Collections.synchronizedList(new ArrayList<>()), new CompletableFuture<>());
        }
    }
}
