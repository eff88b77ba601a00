package org.nowstart.avwap.data.dto;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import org.nowstart.avwap.data.type.SkipReason;

public record AvwapSignalReportDto(
        ZonedDateTime completedAt,
        List<AvwapSignalDto> signals,
        Map<String, SkipReason> skippedSymbols,
        String text
) {
}
