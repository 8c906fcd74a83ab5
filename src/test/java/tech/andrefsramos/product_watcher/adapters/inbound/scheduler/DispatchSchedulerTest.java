package tech.andrefsramos.product_watcher.adapters.inbound.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.andrefsramos.product_watcher.core.application.DispatchDueWatchersUseCase;

@ExtendWith(MockitoExtension.class)
class DispatchSchedulerTest {

    @Mock
    private DispatchDueWatchersUseCase dispatch;

    @InjectMocks
    private DispatchScheduler scheduler;

    @Test
    void shouldDispatchOnEachTick() {
        // given
        given(dispatch.dispatchDue()).willReturn(2, 0);

        // when
        scheduler.tick();
        scheduler.tick();

        // then
        then(dispatch).should(times(2)).dispatchDue();
    }

    @Test
    void shouldSurviveFailedPass() {
        // given
        given(dispatch.dispatchDue()).willThrow(new IllegalStateException("db down"));

        // when / then
        assertThatCode(scheduler::tick).doesNotThrowAnyException();
        assertThat(scheduler.isRunning()).isTrue();
    }

    @Test
    void shouldSkipTicksAfterStopUntilResumed() {
        // when
        scheduler.stop();
        scheduler.tick();

        // then
        assertThat(scheduler.isRunning()).isFalse();
        then(dispatch).should(never()).dispatchDue();

        scheduler.resume();
        scheduler.tick();
        then(dispatch).should().dispatchDue();
    }
}
