package org.nowstart.avwap.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.avwap.data.exception.WatchlistUnavailableException;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.nowstart.avwap.signal.core.Watchlist;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class WatchlistService {

    private static final String EXPORT_HEADER_PREFIX = "SYMBOLS FROM TC2000";

    private final AvwapProperties avwapProperties;

    public Watchlist loadWatchlist() {
        Set<String> longs = readSymbols(Path.of(avwapProperties.longsFile()));
        Set<String> shorts = readSymbols(Path.of(avwapProperties.shortsFile()));
        Watchlist watchlist = new Watchlist(longs, shorts);
        if (watchlist.isEmpty()) {
            throw new WatchlistUnavailableException(
                    "No symbols found in " + avwapProperties.longsFile() + " or " + avwapProperties.shortsFile()
            );
        }
        return watchlist;
    }

    Set<String> readSymbols(Path path) {
        if (!Files.exists(path)) {
            log.warn("Watchlist file not found. path={}", path);
            return Set.of();
        }

        Set<String> symbols = new LinkedHashSet<>();
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                String symbol = line.trim().toUpperCase(Locale.ROOT);
                if (symbol.isEmpty() || symbol.startsWith(EXPORT_HEADER_PREFIX)) {
                    continue;
                }
                symbols.add(symbol);
            }
        } catch (IOException e) {
            log.warn("Failed to read watchlist file. path={}", path, e);
            return Set.of();
        }
        return symbols;
    }
}
