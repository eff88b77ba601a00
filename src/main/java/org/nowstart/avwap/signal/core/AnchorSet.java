package org.nowstart.avwap.signal.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Distinct earnings report dates of one symbol, most recent first.
 */
public record AnchorSet(List<LocalDate> dates) {

    public static final AnchorSet EMPTY = new AnchorSet(List.of());

    public AnchorSet {
        TreeSet<LocalDate> ordered = new TreeSet<>(Comparator.reverseOrder());
        if (dates != null) {
            dates.stream().filter(Objects::nonNull).forEach(ordered::add);
        }
        dates = List.copyOf(ordered);
    }

    public static AnchorSet of(Collection<LocalDate> dates) {
        return new AnchorSet(dates == null ? List.of() : new ArrayList<>(dates));
    }

    public Optional<LocalDate> current() {
        return dates.isEmpty() ? Optional.empty() : Optional.of(dates.get(0));
    }

    public Optional<LocalDate> previous() {
        return dates.size() < 2 ? Optional.empty() : Optional.of(dates.get(1));
    }

    public int size() {
        return dates.size();
    }

    public boolean isEmpty() {
        return dates.isEmpty();
    }

    public AnchorSet onOrBefore(LocalDate day) {
        return new AnchorSet(dates.stream().filter(date -> !date.isAfter(day)).toList());
    }

    public AnchorSet merge(Collection<LocalDate> others) {
        List<LocalDate> merged = new ArrayList<>(dates);
        if (others != null) {
            merged.addAll(others);
        }
        return new AnchorSet(merged);
    }

    public List<LocalDate> mostRecent(int count) {
        return dates.subList(0, Math.min(Math.max(0, count), dates.size()));
    }
}
