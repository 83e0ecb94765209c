package com.trophykit.core.auth.xbox;

import com.trophykit.core.error.CredentialExchangeException;
import com.trophykit.core.error.SessionExpiredException;
import com.trophykit.core.support.MutableClock;
import com.trophykit.core.support.ScriptedSender;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.trophykit.core.auth.xbox.XboxCredentialExchangeTest.USER_OK;
import static com.trophykit.core.auth.xbox.XboxCredentialExchangeTest.XSTS_OK;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XboxSessionManagerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-05-01T10:00:00Z"));
    private final ScriptedSender sender = new ScriptedSender().respond(200, USER_OK).respond(200, XSTS_OK);
    private final XboxCredentialExchange exchange = new XboxCredentialExchange(sender,
            XboxAuthEndpoints.under("https://auth.test"), Duration.ofSeconds(5), clock);

    @Test
    void valid_session_is_returned_without_network() throws Exception {
        var mgr = new XboxSessionManager(exchange);
        XboxSession s = mgr.authenticate("ms");
        int callsAfterAuth = sender.calls();

        clock.advance(Duration.ofMinutes(54));

        assertThat(mgr.currentSession()).isSameAs(s);
        assertThat(mgr.isAuthenticated()).isTrue();
        assertThat(sender.calls()).isEqualTo(callsAfterAuth);
    }

    @Test
    void expired_session_without_callback_is_rejected_locally() throws Exception {
        var mgr = new XboxSessionManager(exchange);
        XboxSession s = mgr.authenticate("ms");
        int callsAfterAuth = sender.calls();

        clock.advance(Duration.ofMinutes(55));

        assertThat(mgr.isAuthenticated()).isFalse();
        assertThatThrownBy(mgr::currentSession)
                .isInstanceOfSatisfying(SessionExpiredException.class,
                        e -> assertThat(e.getExpiredAt()).isEqualTo(s.expiresAt()));
        assertThat(sender.calls()).isEqualTo(callsAfterAuth);
    }

    @Test
    void never_authenticated_is_rejected_locally() {
        var mgr = new XboxSessionManager(exchange);

        assertThatThrownBy(mgr::currentSession)
                .isInstanceOf(SessionExpiredException.class)
                .hasMessageContaining("authenticate()");
        assertThat(sender.calls()).isZero();
    }

    @Test
    void expired_session_is_renewed_through_callback() throws Exception {
        AtomicInteger refreshes = new AtomicInteger();
        var mgr = new XboxSessionManager(exchange, () -> {
            refreshes.incrementAndGet();
            return Optional.of("fresh-ms-token");
        });
        XboxSession first = mgr.authenticate("ms");
        clock.advance(Duration.ofHours(1));

        XboxSession renewed = mgr.currentSession();

        assertThat(refreshes.get()).isEqualTo(1);
        assertThat(renewed).isNotSameAs(first);
        assertThat(renewed.expiresAt()).isEqualTo(clock.instant().plus(XboxCredentialExchange.SESSION_LIFETIME));
        assertThat(mgr.currentSession()).isSameAs(renewed);
        assertThat(refreshes.get()).isEqualTo(1);
    }

    @Test
    void concurrent_callers_share_one_renewal() throws Exception {
        AtomicInteger refreshes = new AtomicInteger();
        CountDownLatch inCallback = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        var mgr = new XboxSessionManager(exchange, () -> {
            refreshes.incrementAndGet();
            inCallback.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Optional.of("fresh-ms-token");
        });
        mgr.authenticate("ms");
        int callsAfterAuth = sender.calls();
        clock.advance(Duration.ofHours(1));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<XboxSession> first = pool.submit(mgr::currentSession);
            assertThat(inCallback.await(5, TimeUnit.SECONDS)).isTrue();

            AtomicReference<Thread> waiter = new AtomicReference<>();
            Future<XboxSession> second = pool.submit(() -> {
                waiter.set(Thread.currentThread());
                return mgr.currentSession();
            });
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while ((waiter.get() == null || waiter.get().getState() != Thread.State.WAITING)
                    && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            release.countDown();

            XboxSession a = first.get(5, TimeUnit.SECONDS);
            XboxSession b = second.get(5, TimeUnit.SECONDS);
            assertThat(b).isSameAs(a);
            assertThat(refreshes.get()).isEqualTo(1);
            assertThat(sender.calls() - callsAfterAuth).isEqualTo(2);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void callback_without_token_keeps_session_expired() throws Exception {
        var mgr = new XboxSessionManager(exchange, Optional::empty);
        mgr.authenticate("ms");
        int callsAfterAuth = sender.calls();
        clock.advance(Duration.ofHours(2));

        assertThatThrownBy(mgr::currentSession).isInstanceOf(SessionExpiredException.class);
        assertThat(sender.calls()).isEqualTo(callsAfterAuth);
    }

    @Test
    void callback_io_failure_surfaces_as_exchange_error() throws Exception {
        var mgr = new XboxSessionManager(exchange, () -> { throw new IOException("token store offline"); });
        mgr.authenticate("ms");
        clock.advance(Duration.ofHours(2));

        assertThatThrownBy(mgr::currentSession)
                .isInstanceOf(CredentialExchangeException.class)
                .hasMessageContaining("token store offline");
    }

    @Test
    void invalidate_drops_the_session() throws Exception {
        var mgr = new XboxSessionManager(exchange);
        mgr.authenticate("ms");

        mgr.invalidate();

        assertThat(mgr.peek()).isEmpty();
        assertThatThrownBy(mgr::currentSession).isInstanceOf(SessionExpiredException.class);
    }
}
