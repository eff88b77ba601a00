package org.nowstart.avwap.signal.core;

import java.time.ZonedDateTime;
import java.util.Map;
import org.nowstart.avwap.data.type.SkipReason;

public record AvwapRunReport(
        int symbolCount,
        SignalBook signals,
        Map<String, SkipReason> skippedSymbols,
        ZonedDateTime completedAt
) {

    public AvwapRunReport {
        skippedSymbols = Map.copyOf(skippedSymbols);
    }
}
