package com.phillippitts.navguide.config;

import com.phillippitts.navguide.config.properties.ThreadPoolProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;

class ThreadPoolMetricsConfigTest {

    private ThreadPoolTaskExecutor frame;
    private ThreadPoolTaskExecutor speech;
    private ThreadPoolMetricsConfig config;

    @BeforeEach
    void setUp() {
        ThreadPoolConfig pools = new ThreadPoolConfig(new ThreadPoolProperties());
        frame = pools.frameExecutor();
        speech = pools.speechExecutor();
        config = new ThreadPoolMetricsConfig(provider("frameExecutor", frame), provider("speechExecutor", speech));
    }

    private static ObjectProvider<ThreadPoolTaskExecutor> provider(String name, ThreadPoolTaskExecutor executor) {
        return new StaticListableBeanFactory(Map.of(name, executor)).getBeanProvider(ThreadPoolTaskExecutor.class);
    }

    @AfterEach
    void tearDown() {
        frame.shutdown();
        speech.shutdown();
    }

    @Test
    void shouldRegisterGaugesPerPool() {
        MeterRegistry registry = new SimpleMeterRegistry();

        config.navigationExecutorMetrics().bindTo(registry);

        for (String pool : new String[] {"frame", "speech"}) {
            assertThat(registry.find("navguide.pool.size").tag("pool", pool).gauge()).isNotNull();
            assertThat(registry.find("navguide.pool.active").tag("pool", pool).gauge()).isNotNull();
            assertThat(registry.find("navguide.pool.queued").tag("pool", pool).gauge()).isNotNull();
            assertThat(registry.find("navguide.pool.completed").tag("pool", pool).gauge()).isNotNull();
        }
    }

    @Test
    void completedGaugeFollowsSpeechPool() {
        MeterRegistry registry = new SimpleMeterRegistry();
        config.navigationExecutorMetrics().bindTo(registry);

        speech.execute(() -> { });

        Gauge completed = registry.find("navguide.pool.completed").tag("pool", "speech").gauge();
        await().atMost(2, TimeUnit.SECONDS).until(() -> completed.value() == 1.0);
    }

    @Test
    void healthLogDoesNotThrow() {
        assertThatCode(() -> config.logThreadPoolHealth()).doesNotThrowAnyException();
    }
}
