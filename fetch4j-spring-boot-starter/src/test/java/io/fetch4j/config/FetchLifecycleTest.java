package io.fetch4j.config;

import io.fetch4j.FetchScheduler;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class FetchLifecycleTest {

    private final FetchScheduler scheduler = mock(FetchScheduler.class);
    private final FetchLifecycle lifecycle = new FetchLifecycle(scheduler);

    @Test
    void shouldRejectMissingScheduler() {
        assertThatThrownBy(() -> new FetchLifecycle(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("scheduler must not be null");
    }

    @Test
    void shouldStartAndStopSchedulerOnce() {
        lifecycle.start();
        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();

        lifecycle.stop();
        lifecycle.stop();
        assertThat(lifecycle.isRunning()).isFalse();

        verify(scheduler, times(1)).start();
        verify(scheduler, times(1)).stop();
    }

    @Test
    void failedStartShouldLeaveLifecycleStopped() {
        doThrow(new IllegalArgumentException("fetch4j.processEvery must be a positive duration"))
                .when(scheduler).start();

        assertThatThrownBy(lifecycle::start).isInstanceOf(IllegalArgumentException.class);
        assertThat(lifecycle.isRunning()).isFalse();

        lifecycle.stop();
        verify(scheduler, never()).stop();
    }

    @Test
    void shouldRunInLastPhase() {
        assertThat(lifecycle.getPhase()).isEqualTo(Integer.MAX_VALUE);
        assertThat(lifecycle.isAutoStartup()).isTrue();
    }
}
