package org.nowstart.avwap.repository;

import org.nowstart.avwap.config.NasdaqFeignConfig;
import org.nowstart.avwap.data.dto.NasdaqEarningsCalendarResponse;
import org.nowstart.avwap.data.dto.NasdaqEarningsSurpriseResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "nasdaqClient",
        url = "${avwap.scanner.calendar-base-url}",
        configuration = NasdaqFeignConfig.class
)
public interface NasdaqFeignClient {

    @GetMapping("/api/calendar/earnings")
    NasdaqEarningsCalendarResponse getEarningsCalendar(@RequestParam("date") String date);

    @GetMapping("/api/company/{symbol}/earnings-surprise")
    NasdaqEarningsSurpriseResponse getEarningsSurprise(@PathVariable("symbol") String symbol);
}
