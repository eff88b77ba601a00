package org.nowstart.avwap.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.avwap.data.exception.AvwapApiException;
import org.nowstart.avwap.service.AvwapSignalWorkflowService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AvwapSignalScheduler {

    private final AvwapSignalWorkflowService avwapSignalWorkflowService;

    @Scheduled(fixedDelayString = "${avwap.scanner.interval:45m}")
    public void run() {
        try {
            avwapSignalWorkflowService.runOnce();
        } catch (AvwapApiException e) {
            log.error("AVWAP run aborted. code={}, reason={}", e.getCode(), e.getMessage());
        } catch (Exception e) {
            log.error("AVWAP run failed. Waiting for the next cycle.", e);
        }
    }
}
