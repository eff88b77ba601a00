package org.nowstart.avwap.repository;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "stooqClient",
        url = "${avwap.scanner.bar-base-url}"
)
public interface StooqFeignClient {

    @GetMapping(value = "/q/d/l/", produces = "text/csv")
    String getDailyBars(
            @RequestParam("s") String symbol,
            @RequestParam("i") String interval
    );
}
