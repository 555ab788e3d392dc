package com.jz.honeypot.session;

import com.jz.honeypot.domain.entity.HoneypotSession;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStoreTest {

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private SessionStore store;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new SimpleMeterRegistry();
        store = new SessionStore(clock, registry);
        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void createsSessionOnFirstUseAndReusesIt() {
        store.withSession("a", s -> {
            s.recordMessage(clock.instant());
            return null;
        });
        int count = store.withSession("a", HoneypotSession::getMessageCount);

        assertThat(count).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
        assertThat(registry.get("honeypot.sessions.active").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void sameSessionIsProcessedOneAtATime() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < 50; i++) {
            futures.add(pool.submit(() -> store.withSession("same", s -> {
                int now = inside.incrementAndGet();
                maxInside.accumulateAndGet(now, Math::max);
                // 非原子的读改写：锁失效时计数会丢
                s.recordMessage(clock.instant());
                Thread.yield();
                inside.decrementAndGet();
                return null;
            })));
        }
        for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);

        assertThat(maxInside.get()).isEqualTo(1);
        int messages = store.withSession("same", HoneypotSession::getMessageCount);
        assertThat(messages).isEqualTo(50);
    }

    @Test
    void differentSessionsDoNotBlockEachOther() throws Exception {
        CountDownLatch bothInside = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);

        Future<Boolean> a = pool.submit(() -> store.withSession("a", s -> awaitPeer(bothInside, release)));
        Future<Boolean> b = pool.submit(() -> store.withSession("b", s -> awaitPeer(bothInside, release)));

        // 两个会话必须同时在执行，latch 才会放行
        assertThat(bothInside.await(2, TimeUnit.SECONDS)).isTrue();
        release.countDown();
        assertThat(a.get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(b.get(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void lockIsReleasedWhenProcessingThrows() throws Exception {
        assertThatThrownBy(() -> store.withSession("x", s -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        Future<Integer> next = pool.submit(() -> store.withSession("x", HoneypotSession::getMessageCount));
        assertThat(next.get(2, TimeUnit.SECONDS)).isZero();
    }

    @Test
    void zeroTtlNeverEvicts() {
        store.withSession("a", s -> null);
        clock.advance(Duration.ofDays(365));

        assertThat(store.evictIdle(Duration.ZERO)).isZero();
        assertThat(store.evictIdle(null)).isZero();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void evictsOnlyIdleSessions() {
        store.withSession("old", s -> null);
        clock.advance(Duration.ofMinutes(20));
        store.withSession("fresh", s -> null);
        clock.advance(Duration.ofMinutes(5));

        assertThat(store.evictIdle(Duration.ofMinutes(10))).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void evictedSessionStartsOver() {
        store.withSession("a", s -> {
            s.recordMessage(clock.instant());
            s.markFinalized();
            return null;
        });
        clock.advance(Duration.ofHours(1));
        store.evictIdle(Duration.ofMinutes(10));

        boolean finalized = store.withSession("a", HoneypotSession::isFinalized);
        int messages = store.withSession("a", HoneypotSession::getMessageCount);
        assertThat(finalized).isFalse();
        assertThat(messages).isZero();
    }

    @Test
    void sessionInUseIsNotEvicted() throws Exception {
        store.withSession("busy", s -> null);
        clock.advance(Duration.ofHours(1));

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<Integer> holder = pool.submit(() -> store.withSession("busy", s -> {
            entered.countDown();
            await(release);
            s.recordMessage(clock.instant());
            return s.getMessageCount();
        }));
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

        assertThat(store.evictIdle(Duration.ofMinutes(10))).isZero();
        release.countDown();
        assertThat(holder.get(2, TimeUnit.SECONDS)).isEqualTo(1);
        int messages = store.withSession("busy", HoneypotSession::getMessageCount);
        assertThat(messages).isEqualTo(1);
    }

    private static boolean awaitPeer(CountDownLatch bothInside, CountDownLatch release) {
        bothInside.countDown();
        try {
            return bothInside.await(2, TimeUnit.SECONDS) && release.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
