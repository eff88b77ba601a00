package org.nowstart.avwap.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Locale;
import org.nowstart.avwap.data.dto.AnchorSetDto;
import org.nowstart.avwap.data.dto.AvwapRunSummaryDto;
import org.nowstart.avwap.data.dto.AvwapSignalReportDto;
import org.nowstart.avwap.data.exception.AvwapApiException;
import org.nowstart.avwap.service.AvwapSignalReportService;
import org.nowstart.avwap.service.AvwapSignalWorkflowService;
import org.nowstart.avwap.signal.core.AnchorSet;
import org.nowstart.avwap.signal.core.AvwapRunReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/avwap")
@Tag(name = "AVWAP", description = "AVWAP 스캔 실행, 최신 시그널 조회, 실적 앵커 조회 API")
public class AvwapSignalController {

    private final AvwapSignalWorkflowService avwapSignalWorkflowService;
    private final AvwapSignalReportService avwapSignalReportService;

    public AvwapSignalController(
            AvwapSignalWorkflowService avwapSignalWorkflowService,
            AvwapSignalReportService avwapSignalReportService
    ) {
        this.avwapSignalWorkflowService = avwapSignalWorkflowService;
        this.avwapSignalReportService = avwapSignalReportService;
    }

    @PostMapping("/runs")
    @Operation(summary = "스캔 즉시 실행", description = "관심종목 전체에 대해 AVWAP 스캔을 즉시 실행하고 시그널 로그를 갱신합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "실행 완료"),
            @ApiResponse(responseCode = "409", description = "이미 실행 중"),
            @ApiResponse(responseCode = "422", description = "관심종목 없음")
    })
    public ResponseEntity<AvwapRunSummaryDto> run() {
        AvwapRunReport report = avwapSignalWorkflowService.runOnce();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(avwapSignalReportService.toSummary(report));
    }

    @GetMapping("/signals/latest")
    @Operation(summary = "최신 시그널 조회", description = "가장 최근에 완료된 스캔의 시그널과 로그 본문을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "완료된 스캔 없음")
    })
    public AvwapSignalReportDto getLatestSignals() {
        return avwapSignalWorkflowService.getLatestReport()
                .map(avwapSignalReportService::toReportDto)
                .orElseThrow(() -> new AvwapApiException(
                        HttpStatus.NOT_FOUND,
                        "report_not_found",
                        "No AVWAP run has completed yet"
                ));
    }

    @GetMapping("/anchors/{symbol}")
    @Operation(summary = "실적 앵커 조회", description = "캐시에 저장된 종목별 실적 발표일(최근순)을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "캐시된 앵커 없음")
    })
    public AnchorSetDto getAnchors(@PathVariable String symbol) {
        AnchorSet anchors = avwapSignalWorkflowService.getCachedAnchors(symbol);
        return new AnchorSetDto(
                symbol.trim().toUpperCase(Locale.ROOT),
                anchors.current().orElse(null),
                anchors.previous().orElse(null),
                anchors.dates()
        );
    }
}
