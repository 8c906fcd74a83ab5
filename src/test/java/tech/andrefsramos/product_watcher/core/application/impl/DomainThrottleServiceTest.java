package tech.andrefsramos.product_watcher.core.application.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.andrefsramos.product_watcher.support.MutableClock;

class DomainThrottleServiceTest {

    private static final Duration BASE = Duration.ofSeconds(5);
    private static final Duration MAX = Duration.ofMinutes(5);

    private MutableClock clock;
    private DomainThrottleService throttle;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-10T10:00:00Z"));
        throttle = new DomainThrottleService(clock, BASE, 2.0, MAX, 10, Duration.ofHours(1), 2);
    }

    @Test
    void shouldRequireFortySecondsAfterThreeConsecutiveFailures() {
        // given
        throttle.recordFailure("shop.example.com");
        throttle.recordFailure("shop.example.com");
        throttle.recordFailure("shop.example.com");

        // when
        var delay = throttle.currentDelay("shop.example.com");

        // then
        assertThat(throttle.errorCount("shop.example.com")).isEqualTo(3);
        assertThat(delay).isEqualTo(Duration.ofSeconds(40));
        assertThat(throttle.canProceed("shop.example.com")).isEqualTo(Duration.ofSeconds(40));
    }

    @Test
    void shouldKeepBackoffMonotonicAndBelowMaxDelay() {
        long previous = 0;
        for (int errors = 0; errors <= 15; errors++) {
            long delay = throttle.requiredDelayMs(errors);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            assertThat(delay).isGreaterThanOrEqualTo(BASE.toMillis());
            assertThat(delay).isLessThanOrEqualTo(MAX.toMillis());
            previous = delay;
        }
        assertThat(throttle.requiredDelayMs(15)).isEqualTo(MAX.toMillis());
    }

    @Test
    void shouldCapErrorCount() {
        // given
        for (int i = 0; i < 25; i++) {
            throttle.recordFailure("flaky.com");
        }

        // then
        assertThat(throttle.errorCount("flaky.com")).isEqualTo(10);
        assertThat(throttle.currentDelay("flaky.com")).isEqualTo(MAX);
    }

    @Test
    void shouldSpaceBackToBackReservationsByAtLeastBaseDelay() {
        // when
        var first = throttle.reserveSlot("shop.com");
        var second = throttle.reserveSlot("shop.com");
        var third = throttle.reserveSlot("shop.com");

        // then
        assertThat(first).isZero();
        assertThat(second).isEqualTo(BASE);
        assertThat(third).isEqualTo(BASE.multipliedBy(2));
    }

    @Test
    void shouldSpaceReservationsByBackoffDelayWhenDomainHasErrors() {
        // given
        throttle.reserveSlot("shop.com");
        throttle.recordFailure("shop.com");

        // when
        var wait = throttle.reserveSlot("shop.com");

        // then
        assertThat(wait).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void shouldNotThrottleUnrelatedDomains() {
        // given
        throttle.reserveSlot("a.com");
        throttle.recordFailure("a.com");

        // when
        var wait = throttle.reserveSlot("b.com");

        // then
        assertThat(wait).isZero();
    }

    @Test
    void shouldResetErrorCountOnSuccess() {
        // given
        throttle.recordFailure("shop.com");
        throttle.recordFailure("shop.com");

        // when
        throttle.recordSuccess("shop.com");

        // then
        assertThat(throttle.errorCount("shop.com")).isZero();
        assertThat(throttle.currentDelay("shop.com")).isEqualTo(BASE);
    }

    @Test
    void shouldKeepErrorCountOnPlainAttempt() {
        // given
        throttle.recordFailure("shop.com");

        // when
        throttle.recordAttempt("shop.com");

        // then
        assertThat(throttle.errorCount("shop.com")).isEqualTo(1);
    }

    @Test
    void shouldNormalizeDomainKeys() {
        // when
        throttle.recordFailure("WWW.Shop.com.");

        // then
        assertThat(throttle.errorCount("shop.com")).isEqualTo(1);
    }

    @Test
    void shouldForgetEntriesAfterTtl() {
        // given
        throttle.recordFailure("old.com");
        throttle.recordFailure("fresh.com");
        clock.advance(Duration.ofMinutes(50));
        throttle.recordAttempt("fresh.com");
        clock.advance(Duration.ofMinutes(11));

        // when
        int removed = throttle.evictExpired();

        // then
        assertThat(removed).isEqualTo(1);
        assertThat(throttle.trackedDomains()).isEqualTo(1);
        assertThat(throttle.errorCount("old.com")).isZero();
        assertThat(throttle.canProceed("old.com")).isZero();
        assertThat(throttle.errorCount("fresh.com")).isEqualTo(1);
    }

    @Test
    void shouldForgetDomainOnReset() {
        // given
        throttle.reserveSlot("shop.com");
        throttle.recordFailure("shop.com");

        // when
        throttle.reset("shop.com");

        // then
        assertThat(throttle.errorCount("shop.com")).isZero();
        assertThat(throttle.reserveSlot("shop.com")).isZero();
    }

    @Test
    void shouldRejectBlankDomain() {
        assertThatThrownBy(() -> throttle.reserveSlot("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @SneakyThrows
    @Test
    void shouldBoundConcurrentFetchPermits() {
        // given
        assertThat(throttle.acquireFetchPermit(Duration.ZERO)).isTrue();
        assertThat(throttle.acquireFetchPermit(Duration.ZERO)).isTrue();

        // when
        boolean third = throttle.acquireFetchPermit(Duration.ofMillis(10));
        throttle.releaseFetchPermit();
        boolean afterRelease = throttle.acquireFetchPermit(Duration.ZERO);

        // then
        assertThat(third).isFalse();
        assertThat(afterRelease).isTrue();
    }

    @SneakyThrows
    @Test
    void shouldSpaceConcurrentReservationsOnSameDomainByBaseDelay() {
        // given
        int threads = 8;
        var start = new CountDownLatch(1);
        var pool = Executors.newFixedThreadPool(threads);
        var futures = new ArrayList<Future<Duration>>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(awaitThenReserve(start, "shop.example.com")));
        }

        // when
        start.countDown();
        var waits = new ArrayList<Long>();
        for (var f : futures) {
            waits.add(f.get(5, TimeUnit.SECONDS).toMillis());
        }
        pool.shutdown();

        // then
        waits.sort(Long::compare);
        assertThat(waits).doesNotHaveDuplicates();
        for (int i = 1; i < waits.size(); i++) {
            assertThat(waits.get(i) - waits.get(i - 1)).isGreaterThanOrEqualTo(BASE.toMillis());
        }
        assertThat(waits).containsExactly(0L, 5_000L, 10_000L, 15_000L, 20_000L, 25_000L, 30_000L, 35_000L);
    }

    @SneakyThrows
    @Test
    void shouldNotDelayOtherDomainsWhileOneDomainIsContended() {
        // given
        int perSide = 6;
        var start = new CountDownLatch(1);
        var pool = Executors.newFixedThreadPool(perSide * 2);
        var contended = new ArrayList<Future<Duration>>();
        var others = new ArrayList<Future<Duration>>();
        for (int i = 0; i < perSide; i++) {
            contended.add(pool.submit(awaitThenReserve(start, "busy.com")));
            others.add(pool.submit(awaitThenReserve(start, "other-" + i + ".com")));
        }

        // when
        start.countDown();

        // then
        for (var f : others) {
            assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo(Duration.ZERO);
        }
        List<Long> busyWaits = new ArrayList<>();
        for (var f : contended) {
            busyWaits.add(f.get(5, TimeUnit.SECONDS).toMillis());
        }
        pool.shutdown();
        assertThat(busyWaits).containsExactlyInAnyOrder(0L, 5_000L, 10_000L, 15_000L, 20_000L, 25_000L);
    }

    private Callable<Duration> awaitThenReserve(CountDownLatch start, String domain) {
        return () -> {
            start.await();
            return throttle.reserveSlot(domain);
        };
    }
}
