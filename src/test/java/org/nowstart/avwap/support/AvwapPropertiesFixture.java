package org.nowstart.avwap.support;

import java.math.BigDecimal;
import java.time.Duration;
import org.nowstart.avwap.data.property.AvwapProperties;

public final class AvwapPropertiesFixture {

    private AvwapPropertiesFixture() {
    }

    public static AvwapProperties defaults() {
        return create("longs.txt", "shorts.txt", "combined_avwap.txt", "earnings_cache.json", 20, 250, Duration.ofSeconds(2));
    }

    public static AvwapProperties withFiles(String longsFile, String shortsFile) {
        return create(longsFile, shortsFile, "combined_avwap.txt", "earnings_cache.json", 20, 250, Duration.ofSeconds(2));
    }

    public static AvwapProperties withAtrLength(int atrLength) {
        return create("longs.txt", "shorts.txt", "combined_avwap.txt", "earnings_cache.json", atrLength, 250, Duration.ofSeconds(2));
    }

    public static AvwapProperties withCalendarLookbackDays(int calendarLookbackDays) {
        return create("longs.txt", "shorts.txt", "combined_avwap.txt", "earnings_cache.json", 20, calendarLookbackDays, Duration.ofSeconds(2));
    }

    public static AvwapProperties withBarRequestTimeout(Duration barRequestTimeout) {
        return create("longs.txt", "shorts.txt", "combined_avwap.txt", "earnings_cache.json", 20, 250, barRequestTimeout);
    }

    private static AvwapProperties create(
            String longsFile,
            String shortsFile,
            String outputFile,
            String earningsCacheFile,
            int atrLength,
            int calendarLookbackDays,
            Duration barRequestTimeout
    ) {
        return new AvwapProperties(
                longsFile,
                shortsFile,
                outputFile,
                earningsCacheFile,
                Duration.ofMinutes(45),
                "America/New_York",
                10,
                2,
                atrLength,
                new BigDecimal("0.05"),
                calendarLookbackDays,
                Duration.ZERO,
                "https://api.nasdaq.com",
                "https://stooq.com",
                ".us",
                barRequestTimeout
        );
    }
}
