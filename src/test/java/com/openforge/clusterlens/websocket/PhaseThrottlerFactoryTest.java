package com.openforge.clusterlens.websocket;

import com.openforge.clusterlens.config.InvestigationProperties;
import com.openforge.clusterlens.stream.PhaseThrottler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhaseThrottlerFactoryTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void shouldMeasureWindowsOnMonotonicTimer() {
        long nanoMillis = System.nanoTime() / 1_000_000;
        long clock = PhaseThrottlerFactory.MONOTONIC_MILLIS.getAsLong();

        assertTrue(Math.abs(clock - nanoMillis) < 1_000, "clock must follow System.nanoTime()");
    }

    @Test
    void shouldCreateThrottlerWithConfiguredWindow() {
        PhaseThrottlerFactory factory = new PhaseThrottlerFactory(scheduler,
                new InvestigationProperties(3, 4000, 100, Duration.ofMinutes(1)));
        List<String> delivered = new CopyOnWriteArrayList<>();
        PhaseThrottler<String> throttler = factory.create(delivered::add);

        throttler.emit("planning");
        throttler.emit("executing");
        throttler.close();

        assertEquals(List.of("planning"), delivered);
    }
}
