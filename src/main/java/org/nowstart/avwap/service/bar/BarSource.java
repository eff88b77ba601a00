package org.nowstart.avwap.service.bar;

import java.util.List;
import org.nowstart.avwap.signal.core.DailyBar;

public interface BarSource {

    /**
     * Daily bars ascending by date and without duplicate dates. Every bar of the last {@code lookbackDays}
     * calendar days is included, and older bars are added until at least {@code minBars} rows are returned when
     * the history has them. Empty when the data is unavailable.
     */
    List<DailyBar> fetchDailyBars(String symbol, int lookbackDays, int minBars);
}
