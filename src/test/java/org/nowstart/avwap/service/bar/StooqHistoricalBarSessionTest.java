package org.nowstart.avwap.service.bar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.avwap.repository.StooqFeignClient;
import org.nowstart.avwap.service.AvwapComputationService;
import org.nowstart.avwap.signal.core.DailyBar;
import org.nowstart.avwap.support.AvwapPropertiesFixture;

@ExtendWith(MockitoExtension.class)
class StooqHistoricalBarSessionTest {

    private static final String CSV = """
            Date,Open,High,Low,Close,Volume
            2024-05-14,187.5,188.3,186.3,187.43,52393600
            2024-05-15,187.9,190.65,187.37,189.72,70400000
            2024-05-16,190.47,191.1,189.66,189.84,52845200
            """;

    @Mock
    private StooqFeignClient stooqFeignClient;
    @Mock
    private HistoricalBarListener listener;

    private ExecutorService executor;
    private StooqHistoricalBarSession session;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        session = new StooqHistoricalBarSession(
                stooqFeignClient,
                AvwapPropertiesFixture.defaults(),
                Clock.fixed(Instant.parse("2024-05-20T20:00:00Z"), ZoneId.of("America/New_York")),
                executor
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void parseCsv_keepsRowsOnOrAfterCutoff() {
        List<DailyBar> bars = session.parseCsv(CSV, LocalDate.of(2024, 5, 15), 0);

        assertThat(bars).extracting(DailyBar::date)
                .containsExactly(LocalDate.of(2024, 5, 15), LocalDate.of(2024, 5, 16));
        assertThat(bars.get(0).high()).isEqualTo(190.65);
        assertThat(bars.get(0).volume()).isEqualTo(70_400_000.0);
    }

    @Test
    void parseCsv_reachesBackPastCutoffUntilMinimumBarCount() {
        LocalDate today = LocalDate.of(2024, 5, 20);

        List<DailyBar> bars = session.parseCsv(weekdayCsv(today.minusDays(200), today), today.minusDays(23), 23);

        assertThat(bars).hasSize(23);
        assertThat(bars.get(0).date()).isEqualTo(LocalDate.of(2024, 4, 18));
        assertThat(bars.get(bars.size() - 1).date()).isEqualTo(today);
        assertThat(new AvwapComputationService().averageTrueRange(bars, 20)).isFinite();
    }

    @Test
    void parseCsv_keepsEveryRowSinceCutoffWhenAboveMinimum() {
        LocalDate today = LocalDate.of(2024, 5, 20);

        List<DailyBar> bars = session.parseCsv(weekdayCsv(today.minusDays(200), today), today.minusDays(119), 23);

        assertThat(bars.size()).isGreaterThan(23);
        assertThat(bars.get(0).date()).isEqualTo(LocalDate.of(2024, 1, 22));
    }

    @Test
    void parseCsv_skipsMalformedAndNonPositiveRowsAndDefaultsMissingVolume() {
        String body = """
                Date,Open,High,Low,Close
                2024-05-14,1,2,0.5,1.5
                2024-05-15,bad,2,1,1.5
                2024-05-16,1,2,1,0
                2024-05-17,1,2
                """;

        List<DailyBar> bars = session.parseCsv(body, LocalDate.of(2024, 1, 1), 0);

        assertThat(bars).hasSize(1);
        assertThat(bars.get(0).date()).isEqualTo(LocalDate.of(2024, 5, 14));
        assertThat(bars.get(0).volume()).isZero();
    }

    @Test
    void parseCsv_returnsEmptyForNoData() {
        assertThat(session.parseCsv("No data", LocalDate.of(2024, 1, 1), 0)).isEmpty();
        assertThat(session.parseCsv("  ", LocalDate.of(2024, 1, 1), 0)).isEmpty();
        assertThat(session.parseCsv(null, LocalDate.of(2024, 1, 1), 0)).isEmpty();
    }

    @Test
    void parseCsv_rejectsLimitAndUnexpectedPayloads() {
        assertThatThrownBy(() -> session.parseCsv("Exceeded the daily hits limit", LocalDate.of(2024, 1, 1), 0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("daily hits limit");
        assertThatThrownBy(() -> session.parseCsv("<html>maintenance</html>", LocalDate.of(2024, 1, 1), 0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unexpected stooq payload");
    }

    @Test
    void requestDailyBars_deliversParsedBarsToListener() {
        when(stooqFeignClient.getDailyBars("aapl.us", "d")).thenReturn(CSV);

        session.requestDailyBars(7, "AAPL", 30, 0, listener);

        verify(listener, timeout(1000)).onEnd(7);
        ArgumentCaptor<DailyBar> captor = ArgumentCaptor.forClass(DailyBar.class);
        verify(listener, times(3)).onBar(eq(7), captor.capture());
        assertThat(captor.getAllValues()).extracting(DailyBar::close).containsExactly(187.43, 189.72, 189.84);
        verify(listener, never()).onError(anyInt(), any(), any());
    }

    @Test
    void requestDailyBars_reportsClientFailureAsError() {
        RuntimeException failure = new RuntimeException("connection reset");
        when(stooqFeignClient.getDailyBars("msft.us", "d")).thenThrow(failure);

        session.requestDailyBars(3, "MSFT", 30, 0, listener);

        verify(listener, timeout(1000)).onError(eq(3), eq("stooq request failed for MSFT"), eq(failure));
        verify(listener, never()).onEnd(anyInt());
    }

    @Test
    void cancel_ofFinishedRequestDoesNotSuppressReusedId() {
        when(stooqFeignClient.getDailyBars("aapl.us", "d")).thenReturn(CSV);

        session.cancel(4);
        session.requestDailyBars(4, "AAPL", 30, 0, listener);

        verify(listener, timeout(1000)).onEnd(4);
    }

    @Test
    void cancel_beforeDispatchSuppressesCallbacks() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        session.requestDailyBars(9, "AAPL", 30, 0, listener);
        session.cancel(9);
        gate.countDown();

        executor.shutdown();
        assertThat(executor.awaitTermination(1, TimeUnit.SECONDS)).isTrue();
        verifyNoInteractions(listener, stooqFeignClient);
    }

    private String weekdayCsv(LocalDate from, LocalDate to) {
        StringBuilder csv = new StringBuilder("Date,Open,High,Low,Close,Volume\n");
        int i = 0;
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            if (day.getDayOfWeek() == DayOfWeek.SATURDAY || day.getDayOfWeek() == DayOfWeek.SUNDAY) {
                continue;
            }
            double close = 100.0 + (i++ % 7);
            csv.append(day).append(',').append(close - 0.5).append(',').append(close + 1.0).append(',')
                    .append(close - 1.0).append(',').append(close).append(",1000000\n");
        }
        return csv.toString();
    }
}
