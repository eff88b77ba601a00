package org.nowstart.avwap.signal.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnchorSetTest {

    @Test
    void of_ordersDescendingAndDropsDuplicatesAndNulls() {
        AnchorSet anchors = AnchorSet.of(Arrays.asList(
                LocalDate.of(2024, 1, 25),
                null,
                LocalDate.of(2024, 4, 25),
                LocalDate.of(2024, 1, 25)
        ));

        assertThat(anchors.dates()).containsExactly(LocalDate.of(2024, 4, 25), LocalDate.of(2024, 1, 25));
        assertThat(anchors.current()).contains(LocalDate.of(2024, 4, 25));
        assertThat(anchors.previous()).contains(LocalDate.of(2024, 1, 25));
    }

    @Test
    void onOrBefore_dropsFutureDates() {
        AnchorSet anchors = AnchorSet.of(List.of(LocalDate.of(2024, 7, 25), LocalDate.of(2024, 4, 25)));

        assertThat(anchors.onOrBefore(LocalDate.of(2024, 5, 20)).dates()).containsExactly(LocalDate.of(2024, 4, 25));
        assertThat(anchors.onOrBefore(LocalDate.of(2024, 4, 25)).dates()).containsExactly(LocalDate.of(2024, 4, 25));
    }

    @Test
    void merge_keepsUniqueDescendingDates() {
        AnchorSet merged = AnchorSet.of(List.of(LocalDate.of(2024, 4, 25)))
                .merge(List.of(LocalDate.of(2024, 4, 25), LocalDate.of(2023, 10, 26), LocalDate.of(2024, 1, 25)));

        assertThat(merged.dates()).containsExactly(
                LocalDate.of(2024, 4, 25),
                LocalDate.of(2024, 1, 25),
                LocalDate.of(2023, 10, 26)
        );
        assertThat(merged.mostRecent(2)).containsExactly(LocalDate.of(2024, 4, 25), LocalDate.of(2024, 1, 25));
    }

    @Test
    void emptySet_hasNoCurrentOrPrevious() {
        assertThat(AnchorSet.EMPTY.current()).isEmpty();
        assertThat(AnchorSet.EMPTY.previous()).isEmpty();
        assertThat(AnchorSet.EMPTY.mostRecent(2)).isEmpty();
    }
}
