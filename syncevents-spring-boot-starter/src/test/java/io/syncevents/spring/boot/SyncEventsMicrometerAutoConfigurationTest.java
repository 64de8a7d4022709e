package io.syncevents.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.syncevents.SyncClient;
import io.syncevents.micrometer.MicrometerDispatchMetrics;
import io.syncevents.spi.DispatchMetrics;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncEventsMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    SyncEventsMicrometerAutoConfiguration.class,
                    SyncEventsAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerMetricsByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerDispatchMetrics"));
            assertInstanceOf(MicrometerDispatchMetrics.class, ctx.getBean(DispatchMetrics.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("syncevents.metrics.name-prefix=bot.sync").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("bot.sync.handler.success").counter());
            assertNull(registry.find("syncevents.handler.success").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("syncevents.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerDispatchMetrics"));
            assertTrue(ctx.containsBean("syncClient"));
        });
    }

    @Test
    void backsOffWithoutMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        SyncEventsMicrometerAutoConfiguration.class,
                        SyncEventsAutoConfiguration.class))
                .run(ctx -> {
                    assertFalse(ctx.containsBean("micrometerDispatchMetrics"));
                    assertNotNull(ctx.getBean(SyncClient.class));
                });
    }

    @Test
    void backsOffWhenCustomDispatchMetricsPresent() {
        runner.withUserConfiguration(CustomMetricsConfig.class).run(ctx -> {
            var metrics = ctx.getBean(DispatchMetrics.class);
            assertSame(DispatchMetrics.NOOP, metrics);
        });
    }

    @Test
    void metersAreRemovedWhenContextCloses() {
        var registry = new SimpleMeterRegistry();
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        SyncEventsMicrometerAutoConfiguration.class,
                        SyncEventsAutoConfiguration.class))
                .withBean(MeterRegistry.class, () -> registry)
                .run(ctx -> assertNotNull(registry.find("syncevents.handler.success").counter()));

        assertNull(registry.find("syncevents.handler.success").counter());
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomMetricsConfig {
        @Bean
        DispatchMetrics customDispatchMetrics() {
            return DispatchMetrics.NOOP;
        }
    }
}
