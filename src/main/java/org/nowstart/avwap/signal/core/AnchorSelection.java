package org.nowstart.avwap.signal.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Anchors chosen for one run. {@code previous} is only set when a true current anchor exists.
 */
public record AnchorSelection(
        LocalDate current,
        LocalDate previous,
        boolean recentReportSkipped
) {

    public List<LocalDate> relevantAnchors() {
        List<LocalDate> anchors = new ArrayList<>(2);
        if (current != null) {
            anchors.add(current);
        }
        if (previous != null) {
            anchors.add(previous);
        }
        return anchors;
    }

    public Optional<LocalDate> earliest() {
        return relevantAnchors().stream().min(LocalDate::compareTo);
    }
}
