package com.openforge.clusterlens.stream;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PhaseThrottlerTest {

    private final ManualTime time = new ManualTime();
    private final List<String> delivered = new ArrayList<>();
    private final PhaseThrottler<String> throttler =
            new PhaseThrottler<>(Duration.ofMillis(500), time.scheduler, time::now, delivered::add);

    @Test
    void shouldCoalesceBurstIntoLatestValuePerWindow() {
        time.advanceTo(0);
        throttler.emit("a");
        time.advanceTo(100);
        throttler.emit("b");
        time.advanceTo(200);
        throttler.emit("c");
        time.advanceTo(600);
        throttler.emit("d");

        assertEquals(List.of("a", "c"), delivered);

        time.advanceTo(1000);
        assertEquals(List.of("a", "c", "d"), delivered);
    }

    @Test
    void shouldDeliverImmediatelyOnceWindowHasElapsed() {
        throttler.emit("a");
        time.advanceTo(500);
        throttler.emit("b");
        time.advanceTo(1200);
        throttler.emit("c");

        assertEquals(List.of("a", "b", "c"), delivered);
        assertTrue(time.pendingTasks().isEmpty());
    }

    @Test
    void shouldDropPendingValueOnClose() {
        throttler.emit("a");
        time.advanceTo(100);
        throttler.emit("b");

        throttler.close();
        time.advanceTo(2000);
        throttler.emit("c");

        assertEquals(List.of("a"), delivered);
        assertTrue(throttler.isClosed());
    }

    @Test
    void shouldKeepThrottlingAfterConsumerFailure() {
        List<String> seen = new ArrayList<>();
        PhaseThrottler<String> failing = new PhaseThrottler<>(Duration.ofMillis(500), time.scheduler, time::now, value -> {
            seen.add(value);
            throw new IllegalStateException("socket closed");
        });

        failing.emit("a");
        time.advanceTo(100);
        failing.emit("b");
        time.advanceTo(500);

        assertEquals(List.of("a", "b"), seen);
    }

    /** Virtual clock plus a scheduler whose tasks run only when the clock passes their due time. */
    private static final class ManualTime {

        private final List<Task> tasks = new ArrayList<>();
        private final ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        private long now;

        ManualTime() {
            doAnswer(invocation -> {
                Runnable command = invocation.getArgument(0);
                long delay = invocation.getArgument(1);
                TimeUnit unit = invocation.getArgument(2);
                Task task = new Task(command, now + unit.toMillis(delay));
                tasks.add(task);
                ScheduledFuture<?> future = mock(ScheduledFuture.class);
                when(future.cancel(anyBoolean())).thenAnswer(cancel -> {
                    task.cancelled = true;
                    return true;
                });
                return future;
            }).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        }

        long now() {
            return now;
        }

        void advanceTo(long target) {
            while (true) {
                Task next = pendingTasks().stream()
                        .filter(t -> t.dueAt <= target)
                        .min(Comparator.comparingLong(t -> t.dueAt))
                        .orElse(null);
                if (next == null) {
                    break;
                }
                now = Math.max(now, next.dueAt);
                next.cancelled = true;
                next.command.run();
            }
            now = target;
        }

        List<Task> pendingTasks() {
            return tasks.stream().filter(t -> !t.cancelled).toList();
        }
    }

    private static final class Task {
        private final Runnable command;
        private final long     dueAt;
        private boolean        cancelled;

        Task(Runnable command, long dueAt) {
            this.command = command;
            this.dueAt   = dueAt;
        }
    }
}
