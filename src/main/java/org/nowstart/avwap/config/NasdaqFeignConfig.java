package org.nowstart.avwap.config;

import feign.RequestInterceptor;
import org.springframework.context.annotation.Bean;

public class NasdaqFeignConfig {

    static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    @Bean
    public RequestInterceptor nasdaqHeaderRequestInterceptor() {
        return template -> {
            template.header("User-Agent", USER_AGENT);
            template.header("Accept", "application/json, text/plain, */*");
            template.header("Referer", "https://www.nasdaq.com/");
        };
    }
}
