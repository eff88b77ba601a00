package org.nowstart.avwap.service;

import java.time.LocalDate;
import java.util.List;

public interface EarningsCalendarSource {

    /**
     * Uppercased symbols reporting on the given day. Empty when the source fails.
     */
    List<String> symbolsReportingOn(LocalDate date);

    /**
     * Past report dates for one symbol, in any order. Empty when the source fails.
     */
    List<LocalDate> historicalReportDates(String symbol);
}
