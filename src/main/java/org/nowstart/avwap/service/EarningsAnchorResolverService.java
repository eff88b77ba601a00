package org.nowstart.avwap.service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.nowstart.avwap.signal.core.AnchorSelection;
import org.nowstart.avwap.signal.core.AnchorSet;
import org.nowstart.avwap.signal.core.EarningsAnchorCache;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class EarningsAnchorResolverService {

    private final EarningsCalendarSource earningsCalendarSource;
    private final AvwapProperties avwapProperties;

    public Map<String, List<LocalDate>> resolveAll(Collection<String> symbols, EarningsAnchorCache cache, LocalDate today) {
        int minCount = avwapProperties.anchorCount();
        List<String> missing = symbols.stream()
                .filter(symbol -> cache.get(symbol).size() < minCount)
                .toList();
        Map<String, List<LocalDate>> candidates = scanCalendar(missing, minCount, today);

        Map<String, List<LocalDate>> resolved = new LinkedHashMap<>();
        for (String symbol : symbols) {
            List<LocalDate> anchors = resolve(symbol, cache, candidates.getOrDefault(symbol, List.of()), minCount, today);
            log.info("event=anchor_resolved symbol={} anchors={} scanned={}", symbol, anchors, candidates.containsKey(symbol));
            resolved.put(symbol, anchors);
        }
        return resolved;
    }

    public List<LocalDate> resolve(
            String symbol,
            EarningsAnchorCache cache,
            Collection<LocalDate> calendarCandidates,
            int minCount,
            LocalDate today
    ) {
        AnchorSet merged = cache.get(symbol)
                .onOrBefore(today)
                .merge(AnchorSet.of(calendarCandidates).onOrBefore(today).dates());

        if (merged.size() < minCount) {
            List<LocalDate> fallback = earningsCalendarSource.historicalReportDates(symbol);
            merged = merged.merge(AnchorSet.of(fallback).onOrBefore(today).dates());
        }

        if (!merged.isEmpty()) {
            cache.put(symbol, merged);
        }
        return merged.mostRecent(minCount);
    }

    public Map<String, List<LocalDate>> scanCalendar(Collection<String> symbols, int minCount, LocalDate today) {
        Map<String, TreeSet<LocalDate>> found = new LinkedHashMap<>();
        symbols.stream()
                .map(symbol -> symbol.toUpperCase(Locale.ROOT))
                .forEach(symbol -> found.putIfAbsent(symbol, new TreeSet<>()));
        if (found.isEmpty()) {
            return Map.of();
        }

        Duration throttle = avwapProperties.calendarThrottle();
        int requests = 0;
        for (int delta = 0; delta < avwapProperties.calendarLookbackDays(); delta++) {
            if (requests > 0 && !pause(throttle)) {
                break;
            }

            LocalDate queryDate = today.minusDays(delta);
            List<String> reporting = earningsCalendarSource.symbolsReportingOn(queryDate);
            requests++;
            for (String symbol : reporting) {
                TreeSet<LocalDate> dates = found.get(symbol.toUpperCase(Locale.ROOT));
                if (dates != null) {
                    dates.add(queryDate);
                }
            }

            if (found.values().stream().allMatch(dates -> dates.size() >= minCount)) {
                break;
            }
        }
        log.info("event=calendar_scan_completed symbols={} requests={}", found.size(), requests);

        Map<String, List<LocalDate>> result = new LinkedHashMap<>();
        found.forEach((symbol, dates) -> result.put(symbol, AnchorSet.of(dates).onOrBefore(today).dates()));
        return result;
    }

    public AnchorSelection selectAnchors(List<LocalDate> dates, LocalDate today) {
        if (dates == null || dates.isEmpty()) {
            return new AnchorSelection(null, null, false);
        }

        List<LocalDate> ordered = new ArrayList<>(AnchorSet.of(dates).dates());
        LocalDate latest = ordered.get(0);
        LocalDate prior = ordered.size() > 1 ? ordered.get(1) : null;
        if (ChronoUnit.DAYS.between(latest, today) > avwapProperties.recentDays()) {
            return new AnchorSelection(latest, prior, false);
        }
        return new AnchorSelection(prior, null, true);
    }

    private boolean pause(Duration throttle) {
        if (throttle.isZero() || throttle.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(throttle.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Calendar scan interrupted. Using dates collected so far.");
            return false;
        }
    }
}
