package org.nowstart.avwap.scheduler;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.avwap.data.exception.WatchlistUnavailableException;
import org.nowstart.avwap.service.AvwapSignalWorkflowService;

@ExtendWith(MockitoExtension.class)
class AvwapSignalSchedulerTest {

    @Mock
    private AvwapSignalWorkflowService avwapSignalWorkflowService;

    @Test
    void run_delegatesToWorkflowService() {
        AvwapSignalScheduler scheduler = new AvwapSignalScheduler(avwapSignalWorkflowService);

        scheduler.run();

        verify(avwapSignalWorkflowService).runOnce();
    }

    @Test
    void run_keepsSchedulingWhenWatchlistIsUnavailable() {
        when(avwapSignalWorkflowService.runOnce()).thenThrow(new WatchlistUnavailableException("No symbols found"));
        AvwapSignalScheduler scheduler = new AvwapSignalScheduler(avwapSignalWorkflowService);

        assertThatCode(scheduler::run).doesNotThrowAnyException();
    }

    @Test
    void run_keepsSchedulingWhenRunFails() {
        when(avwapSignalWorkflowService.runOnce()).thenThrow(new IllegalStateException("disk full"));
        AvwapSignalScheduler scheduler = new AvwapSignalScheduler(avwapSignalWorkflowService);

        assertThatCode(scheduler::run).doesNotThrowAnyException();
    }
}
