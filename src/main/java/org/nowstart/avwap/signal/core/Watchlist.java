package org.nowstart.avwap.signal.core;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public record Watchlist(
        Set<String> longs,
        Set<String> shorts
) {

    public Watchlist {
        longs = Set.copyOf(longs);
        shorts = Set.copyOf(shorts);
    }

    public List<String> symbols() {
        TreeSet<String> union = new TreeSet<>(longs);
        union.addAll(shorts);
        return List.copyOf(union);
    }

    public boolean isLong(String symbol) {
        return longs.contains(symbol);
    }

    public boolean isShort(String symbol) {
        return shorts.contains(symbol);
    }

    public boolean isEmpty() {
        return longs.isEmpty() && shorts.isEmpty();
    }
}
