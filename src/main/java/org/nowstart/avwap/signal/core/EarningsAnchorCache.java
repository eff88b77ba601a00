package org.nowstart.avwap.signal.core;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Mutable per-run view of the persisted anchor cache, keyed by symbol.
 */
public final class EarningsAnchorCache {

    private final Map<String, AnchorSet> entries;

    public EarningsAnchorCache() {
        this(Map.of());
    }

    public EarningsAnchorCache(Map<String, AnchorSet> entries) {
        this.entries = new TreeMap<>(entries);
    }

    public AnchorSet get(String symbol) {
        return entries.getOrDefault(symbol, AnchorSet.EMPTY);
    }

    public Optional<AnchorSet> find(String symbol) {
        return Optional.ofNullable(entries.get(symbol));
    }

    public void put(String symbol, AnchorSet anchors) {
        if (anchors.isEmpty()) {
            entries.remove(symbol);
            return;
        }
        entries.put(symbol, anchors);
    }

    public Map<String, AnchorSet> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }
}
