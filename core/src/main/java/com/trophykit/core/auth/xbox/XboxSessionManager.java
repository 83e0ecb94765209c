package com.trophykit.core.auth.xbox;

import com.trophykit.core.error.CredentialExchangeException;
import com.trophykit.core.error.SessionExpiredException;
import com.trophykit.core.util.StructuredLogger;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the current {@link XboxSession} and gates every authenticated call on its expiry.
 * <p>
 * An expired session is renewed only through the {@link TokenRefreshCallback}. Without one,
 * or when it yields nothing, {@link #currentSession()} throws {@link SessionExpiredException}
 * and nothing is sent. Renewal is single flight: concurrent callers wait for the lock and
 * reuse the session the first one obtained.
 */
public final class XboxSessionManager {
    private static final StructuredLogger log = StructuredLogger.get(XboxSessionManager.class);

    private final XboxCredentialExchange exchange;
    private final Clock clock;
    private final TokenRefreshCallback refreshCallback;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile XboxSession session;

    public XboxSessionManager(XboxCredentialExchange exchange) {
        this(exchange, null);
    }

    /** @param refreshCallback nullable */
    public XboxSessionManager(XboxCredentialExchange exchange, TokenRefreshCallback refreshCallback) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.clock = exchange.clock();
        this.refreshCallback = refreshCallback;
    }

    /** Runs the exchange with a Microsoft access token and stores the session. */
    public XboxSession authenticate(String microsoftAccessToken) throws InterruptedException {
        refreshLock.lockInterruptibly();
        try {
            XboxSession s = exchange.exchange(microsoftAccessToken);
            session = s;
            return s;
        } finally {
            refreshLock.unlock();
        }
    }

    public boolean isAuthenticated() {
        XboxSession s = session;
        return s != null && s.isValidAt(clock.instant());
    }

    public Optional<XboxSession> peek() { return Optional.ofNullable(session); }

    /** Drops the stored session; the next call needs {@link #authenticate(String)} or the callback. */
    public void invalidate() { session = null; }

    /**
     * @return a session valid right now
     * @throws SessionExpiredException expired (or never created) and no refresh produced a new one
     * @throws CredentialExchangeException the refresh callback's token was rejected
     */
    public XboxSession currentSession() throws InterruptedException {
        XboxSession s = session;
        if (s != null && s.isValidAt(clock.instant())) return s;

        refreshLock.lockInterruptibly();
        try {
            s = session;
            Instant now = clock.instant();
            if (s != null && s.isValidAt(now)) return s;   // renewed while we waited

            Instant expiredAt = s == null ? null : s.expiresAt();
            log.info("xbox.session.expired", "expiresAt", expiredAt, "now", now,
                    "hasCallback", refreshCallback != null);
            if (refreshCallback == null) {
                throw new SessionExpiredException(expiredAt, s == null
                        ? "Not authenticated with Xbox Live; call authenticate() first"
                        : "Xbox Live session expired at " + expiredAt + " and no refresh callback is configured");
            }

            Optional<String> token;
            try {
                token = refreshCallback.refreshAccessToken();
            } catch (IOException e) {
                throw new CredentialExchangeException("xbox", XboxCredentialExchange.State.UNAUTHENTICATED.name(),
                        "Refresh callback failed: " + e.getMessage(), e);
            }
            if (token == null || token.isEmpty() || token.get().isBlank()) {
                throw new SessionExpiredException(expiredAt,
                        "Xbox Live session expired and the refresh callback returned no access token");
            }
            XboxSession renewed = exchange.exchange(token.get());
            session = renewed;
            return renewed;
        } finally {
            refreshLock.unlock();
        }
    }
}
