package org.nowstart.avwap.signal.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.nowstart.avwap.data.type.SignalCategory;

/**
 * Signals grouped by output category. Rows keep insertion order apart from LONG rows being listed before SHORT rows.
 */
public final class SignalBook {

    private final Map<SignalCategory, List<AvwapSignal>> signals = new EnumMap<>(SignalCategory.class);

    public void add(SignalCategory category, AvwapSignal signal) {
        signals.computeIfAbsent(category, ignored -> new ArrayList<>()).add(signal);
    }

    public void addAll(SignalBook other) {
        other.signals.forEach((category, rows) -> rows.forEach(row -> add(category, row)));
    }

    public List<AvwapSignal> get(SignalCategory category) {
        List<AvwapSignal> rows = new ArrayList<>(signals.getOrDefault(category, List.of()));
        rows.sort(Comparator.comparing(AvwapSignal::side));
        return List.copyOf(rows);
    }

    public int size() {
        return signals.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Map<SignalCategory, Integer> counts() {
        Map<SignalCategory, Integer> counts = new EnumMap<>(SignalCategory.class);
        for (SignalCategory category : SignalCategory.values()) {
            counts.put(category, signals.getOrDefault(category, List.of()).size());
        }
        return counts;
    }
}
