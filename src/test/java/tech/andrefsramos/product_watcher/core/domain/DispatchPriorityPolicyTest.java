package tech.andrefsramos.product_watcher.core.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DispatchPriorityPolicyTest {

    private static final Instant NOW = Instant.parse("2025-01-10T10:00:00Z");

    @Test
    void shouldFavorNeverCheckedShortIntervalWatchers() {
        // given
        var watcher = watcher(60, null, 0);

        // when
        int priority = DispatchPriorityPolicy.compute(watcher, NOW);

        // then
        assertThat(priority).isEqualTo(2);
    }

    @Test
    void shouldBoostStarvedWatchers() {
        // given
        var recent = watcher(600, NOW.minus(Duration.ofMinutes(5)), 0);
        var starved = watcher(600, NOW.minus(Duration.ofMinutes(25)), 0);

        // then
        assertThat(DispatchPriorityPolicy.compute(recent, NOW)).isEqualTo(10);
        assertThat(DispatchPriorityPolicy.compute(starved, NOW)).isEqualTo(8);
    }

    @Test
    void shouldDeprioritizeFlakyWatchers() {
        // given
        var healthy = watcher(300, NOW.minusSeconds(300), 0);
        var flaky = watcher(300, NOW.minusSeconds(300), 4);

        // then
        assertThat(DispatchPriorityPolicy.compute(healthy, NOW)).isEqualTo(9);
        assertThat(DispatchPriorityPolicy.compute(flaky, NOW)).isEqualTo(13);
    }

    @Test
    void shouldClampToBounds() {
        // given
        var veryFlaky = watcher(3600, NOW.minusSeconds(10), 50);

        // then
        assertThat(DispatchPriorityPolicy.compute(veryFlaky, NOW)).isEqualTo(DispatchPriorityPolicy.MAX);
        assertThat(DispatchPriorityPolicy.compute(watcher(30, null, 0), NOW)).isGreaterThanOrEqualTo(DispatchPriorityPolicy.MIN);
    }

    private static Watcher watcher(int intervalSeconds, Instant lastCheckAt, int errorCount) {
        return new Watcher("w-1", "https://shop.com/p", "shop.com", RuleSet.empty(), intervalSeconds,
                WatcherStatus.ACTIVE, lastCheckAt, null, errorCount, null);
    }
}
