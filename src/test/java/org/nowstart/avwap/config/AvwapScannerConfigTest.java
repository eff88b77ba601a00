package org.nowstart.avwap.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.nowstart.avwap.support.AvwapPropertiesFixture;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class AvwapScannerConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(AvwapPropsTestConfig.class, AvwapScannerConfig.class);

    @Test
    void contextProvidesMarketClockAndBarSessionExecutor() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(Clock.class).getZone()).isEqualTo(ZoneId.of("America/New_York"));
            assertThat(context).hasBean("barSessionExecutor");
        });
    }

    @Test
    void barSessionExecutor_runsTasksOnNamedDaemonThread() throws Exception {
        ExecutorService executor = new AvwapScannerConfig().barSessionExecutor();
        try {
            Future<String> name = executor.submit(() -> Thread.currentThread().getName()
                    + ":" + Thread.currentThread().isDaemon());

            assertThat(name.get(1, TimeUnit.SECONDS)).isEqualTo("bar-session:true");
        } finally {
            executor.shutdownNow();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class AvwapPropsTestConfig {

        @Bean
        AvwapProperties avwapProperties() {
            return AvwapPropertiesFixture.defaults();
        }
    }
}
