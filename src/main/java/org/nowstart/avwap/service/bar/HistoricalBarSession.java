package org.nowstart.avwap.service.bar;

/**
 * Asynchronous historical data session. Results for a request are delivered to the listener tagged with the
 * request id the caller supplied; delivery may happen on any thread. Cancelling a request that already finished
 * has no effect.
 */
public interface HistoricalBarSession {

    void requestDailyBars(int requestId, String symbol, int lookbackDays, int minBars, HistoricalBarListener listener);

    void cancel(int requestId);
}
