package org.nowstart.avwap.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "avwap.scanner")
public record AvwapProperties(
        // 롱 관심종목 파일
        @NotBlank @DefaultValue("longs.txt") String longsFile,
        // 숏 관심종목 파일
        @NotBlank @DefaultValue("shorts.txt") String shortsFile,
        // 매 실행마다 다시 쓰는 시그널 로그 파일
        @NotBlank @DefaultValue("combined_avwap.txt") String outputFile,
        // 실적 발표일 앵커 캐시 파일(JSON)
        @NotBlank @DefaultValue("earnings_cache.json") String earningsCacheFile,
        // 스케줄러 실행 주기(이전 실행 종료 후 대기 시간)
        @NotNull @DefaultValue("45m") Duration interval,
        // 기준 시장 타임존(오늘 날짜 판단용)
        @NotBlank @DefaultValue("America/New_York") String zone,
        // 최근 발표일이 이 일수 이내면 현재 앵커로 쓰지 않음
        @PositiveOrZero @DefaultValue("10") int recentDays,
        // 종목별로 확보할 앵커 수(현재, 이전)
        @Positive @DefaultValue("2") int anchorCount,
        // ATR 기간
        @Positive @DefaultValue("20") int atrLength,
        // 바운스 터치/확인 임계값(ATR 배수)
        @DecimalMin("0") @DefaultValue("0.05") BigDecimal atrMultiplier,
        // 실적 캘린더 역방향 최대 조회 일수
        @Positive @DefaultValue("250") int calendarLookbackDays,
        // 캘린더 요청 간 최소 간격
        @NotNull @DefaultValue("1s") Duration calendarThrottle,
        // 나스닥 API 기본 URL
        @NotBlank @DefaultValue("https://api.nasdaq.com") String calendarBaseUrl,
        // 일봉 조회용 Stooq 기본 URL
        @NotBlank @DefaultValue("https://stooq.com") String barBaseUrl,
        // Stooq 종목코드 거래소 접미사
        @DefaultValue(".us") String barSymbolSuffix,
        // 일봉 요청 1건 최대 대기 시간
        @NotNull @DefaultValue("15s") Duration barRequestTimeout
) {
}
