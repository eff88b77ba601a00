package org.nowstart.avwap.data.dto;

import java.time.LocalDate;
import org.nowstart.avwap.data.type.SignalCategory;
import org.nowstart.avwap.data.type.TradeSide;

public record AvwapSignalDto(
        SignalCategory category,
        String symbol,
        LocalDate date,
        String label,
        TradeSide side
) {
}
