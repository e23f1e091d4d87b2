package com.phillippitts.factopinion.config;

import com.phillippitts.factopinion.config.properties.ThreadPoolProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ThreadPoolMetricsConfigTest {

    private ThreadPoolTaskExecutor executor;
    private ThreadPoolMetricsConfig config;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).scoringExecutor();
        ObjectProvider<ThreadPoolTaskExecutor> provider = mock(ObjectProvider.class);
        when(provider.getObject()).thenReturn(executor);
        config = new ThreadPoolMetricsConfig(provider);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void registersScoringPoolGauges() {
        MeterRegistry registry = new SimpleMeterRegistry();

        config.scoringExecutorMetrics().bindTo(registry);

        assertThat(registry.find("scoring.pool.core.size").gauge().value()).isEqualTo(4.0);
        assertThat(registry.find("scoring.pool.max.size").gauge().value()).isEqualTo(8.0);
        assertThat(registry.find("scoring.pool.active").gauge()).isNotNull();
        assertThat(registry.find("scoring.pool.queued").gauge().value()).isZero();
        assertThat(registry.find("scoring.pool.completed").gauge()).isNotNull();
        assertThat(registry.find("scoring.pool.size").gauge()).isNotNull();
    }

    @Test
    void completedGaugeTracksFinishedTasks() {
        MeterRegistry registry = new SimpleMeterRegistry();
        config.scoringExecutorMetrics().bindTo(registry);

        for (int i = 0; i < 3; i++) {
            executor.execute(() -> { });
        }

        await().atMost(2, SECONDS).until(() ->
                registry.find("scoring.pool.completed").gauge().value() == 3.0);
        await().atMost(2, SECONDS).until(() ->
                registry.find("scoring.pool.active").gauge().value() == 0.0);
    }

    @Test
    void healthLogDoesNotFail() {
        assertThatCode(config::logThreadPoolHealth).doesNotThrowAnyException();
    }
}
