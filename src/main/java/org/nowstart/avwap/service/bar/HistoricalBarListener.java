package org.nowstart.avwap.service.bar;

import org.nowstart.avwap.signal.core.DailyBar;

public interface HistoricalBarListener {

    void onBar(int requestId, DailyBar bar);

    void onEnd(int requestId);

    void onError(int requestId, String message, Throwable cause);
}
