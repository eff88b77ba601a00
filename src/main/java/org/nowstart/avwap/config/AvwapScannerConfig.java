package org.nowstart.avwap.config;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AvwapScannerConfig {

    @Bean
    public Clock marketClock(AvwapProperties avwapProperties) {
        return Clock.system(ZoneId.of(avwapProperties.zone()));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService barSessionExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "bar-session");
            thread.setDaemon(true);
            return thread;
        });
    }
}
