package com.openforge.clusterlens.websocket;

import com.openforge.clusterlens.config.InvestigationProperties;
import com.openforge.clusterlens.stream.PhaseThrottler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Creates throttlers that share the single timer thread and the configured window.
 */
@Component
@RequiredArgsConstructor
public class PhaseThrottlerFactory {

    /** Milliseconds from the monotonic nanosecond timer; wall-clock jumps do not reopen a window. */
    static final LongSupplier MONOTONIC_MILLIS = () -> System.nanoTime() / 1_000_000;

    private final ScheduledExecutorService phaseThrottleScheduler;
    private final InvestigationProperties  properties;

    public <T> PhaseThrottler<T> create(Consumer<T> consumer) {
        return new PhaseThrottler<>(properties.throttleWindow(), phaseThrottleScheduler,
                MONOTONIC_MILLIS, consumer);
    }
}
