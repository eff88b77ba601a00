package org.nowstart.avwap.data.dto;

import java.time.LocalDate;
import java.util.List;

public record AnchorSetDto(
        String symbol,
        LocalDate current,
        LocalDate previous,
        List<LocalDate> dates
) {
}
