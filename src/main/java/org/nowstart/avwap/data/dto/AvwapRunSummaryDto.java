package org.nowstart.avwap.data.dto;

import java.time.ZonedDateTime;
import java.util.Map;
import org.nowstart.avwap.data.type.SignalCategory;
import org.nowstart.avwap.data.type.SkipReason;

public record AvwapRunSummaryDto(
        int symbolCount,
        int signalCount,
        Map<SignalCategory, Integer> signalCounts,
        Map<String, SkipReason> skippedSymbols,
        ZonedDateTime completedAt
) {
}
