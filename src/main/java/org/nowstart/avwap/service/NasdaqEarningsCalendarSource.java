package org.nowstart.avwap.service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.avwap.data.dto.NasdaqEarningsCalendarResponse;
import org.nowstart.avwap.data.dto.NasdaqEarningsSurpriseResponse;
import org.nowstart.avwap.repository.NasdaqFeignClient;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class NasdaqEarningsCalendarSource implements EarningsCalendarSource {

    private static final DateTimeFormatter REPORTED_DATE = DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US);

    private final NasdaqFeignClient nasdaqFeignClient;

    @Override
    public List<String> symbolsReportingOn(LocalDate date) {
        NasdaqEarningsCalendarResponse response;
        try {
            response = nasdaqFeignClient.getEarningsCalendar(date.toString());
        } catch (Exception e) {
            log.warn("Failed to fetch earnings calendar. date={}", date, e);
            return List.of();
        }

        if (response == null) {
            return List.of();
        }
        return response.rowsOrEmpty().stream()
                .filter(Objects::nonNull)
                .map(NasdaqEarningsCalendarResponse.Row::symbol)
                .filter(Objects::nonNull)
                .map(symbol -> symbol.trim().toUpperCase(Locale.ROOT))
                .filter(symbol -> !symbol.isEmpty())
                .toList();
    }

    @Override
    public List<LocalDate> historicalReportDates(String symbol) {
        NasdaqEarningsSurpriseResponse response;
        try {
            response = nasdaqFeignClient.getEarningsSurprise(symbol);
        } catch (Exception e) {
            log.warn("Failed to fetch historical earnings dates. symbol={}", symbol, e);
            return List.of();
        }

        if (response == null) {
            return List.of();
        }
        return response.rowsOrEmpty().stream()
                .filter(Objects::nonNull)
                .map(NasdaqEarningsSurpriseResponse.Row::dateReported)
                .map(this::parseReportedDate)
                .filter(Objects::nonNull)
                .toList();
    }

    private LocalDate parseReportedDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), REPORTED_DATE);
        } catch (DateTimeParseException e) {
            log.debug("Skipping unparseable report date. value={}", value);
            return null;
        }
    }
}
