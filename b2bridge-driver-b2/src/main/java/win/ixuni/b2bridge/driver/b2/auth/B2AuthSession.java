package win.ixuni.b2bridge.driver.b2.auth;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.b2bridge.core.util.JsonUtils;
import win.ixuni.b2bridge.driver.b2.config.B2DriverConfig;
import win.ixuni.b2bridge.driver.b2.exception.B2AuthenticationException;
import win.ixuni.b2bridge.driver.b2.exception.B2TransportException;
import win.ixuni.b2bridge.driver.b2.http.B2HttpRequest;
import win.ixuni.b2bridge.driver.b2.http.B2HttpResponse;
import win.ixuni.b2bridge.driver.b2.http.B2ResponseClassifier;
import win.ixuni.b2bridge.driver.b2.http.B2Route;
import win.ixuni.b2bridge.driver.b2.http.B2Transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the account session and the handshake that produces it.
 * <p>
 * States: {@code UNAUTHENTICATED -> AUTHENTICATING -> AUTHENTICATED}. The session goes back to
 * {@code AUTHENTICATING} only when a caller forces it or after {@link #invalidate(B2Session)}.
 * Handshakes are single-flight: callers that queued behind a running handshake take its result,
 * session or failure, instead of starting another one.
 */
@Slf4j
public class B2AuthSession {

    public enum State {
        UNAUTHENTICATED,
        AUTHENTICATING,
        AUTHENTICATED
    }

    private final B2Transport transport;
    private final B2DriverConfig config;
    private final B2Route.Control route;

    private final ReentrantLock handshakeLock = new ReentrantLock();
    private final AtomicLong handshakeCount = new AtomicLong();

    /**
     * Finished handshakes, successful or not
     */
    private final AtomicLong attempts = new AtomicLong();

    /**
     * Failure of the last finished handshake, null when it succeeded; guarded by {@link #handshakeLock}
     */
    private RuntimeException lastFailure;

    private volatile B2Session session;
    private volatile State state = State.UNAUTHENTICATED;

    public B2AuthSession(B2Transport transport, B2DriverConfig config) {
        this.transport = transport;
        this.config = config;
        this.route = new B2Route.Control(config.getAuthHost());
    }

    /**
     * Return the current session, running the handshake when there is none.
     *
     * @param force run a fresh handshake even when a session exists
     * @return the published session
     * @throws B2AuthenticationException when the server rejects the credentials
     */
    public B2Session authenticate(boolean force) {
        B2Session current = session;
        if (!force && current != null) {
            return current;
        }

        long seen = attempts.get();
        handshakeLock.lock();
        try {
            if (attempts.get() != seen) {
                // a handshake finished while we were waiting: share its outcome
                current = session;
                if (current != null) {
                    return current;
                }
                if (lastFailure != null) {
                    throw lastFailure;
                }
            }
            current = session;
            if (!force && current != null) {
                return current;
            }

            state = State.AUTHENTICATING;
            try {
                B2Session fresh = handshake();
                session = fresh;
                lastFailure = null;
                handshakeCount.incrementAndGet();
                state = State.AUTHENTICATED;
                log.info("Authorized B2 account {} (api: {}, download: {})",
                        fresh.getAccountId(), fresh.getApiHost(), fresh.getDownloadHost());
                return fresh;
            } catch (RuntimeException e) {
                session = null;
                lastFailure = e;
                state = State.UNAUTHENTICATED;
                throw e;
            } finally {
                attempts.incrementAndGet();
            }
        } finally {
            handshakeLock.unlock();
        }
    }

    public B2Session authenticate() {
        return authenticate(false);
    }

    /**
     * Drop {@code stale} so the next call re-authenticates. A newer session published in the
     * meantime is left alone.
     */
    public void invalidate(B2Session stale) {
        handshakeLock.lock();
        try {
            if (session != null && session == stale) {
                session = null;
                state = State.UNAUTHENTICATED;
                log.info("B2 session for account {} invalidated", stale.getAccountId());
            }
        } finally {
            handshakeLock.unlock();
        }
    }

    public State getState() {
        return state;
    }

    /**
     * @return number of successful handshakes so far
     */
    public long getHandshakeCount() {
        return handshakeCount.get();
    }

    private B2Session handshake() {
        String credentials = config.getKeyId() + ":" + config.getApplicationKey();
        String basic = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));

        B2HttpRequest request = B2HttpRequest.builder()
                .method(route.method())
                .scheme(config.getScheme())
                .host(route.host(null))
                .path(route.path())
                .header("Authorization", "Basic " + basic)
                .build();

        log.debug("Authorizing B2 account against {}{}", request.getHost(), request.getPath());
        try (B2HttpResponse response = transport.execute(request)) {
            if (response.getStatus() != 200) {
                throw new B2AuthenticationException("Failed to authenticate: "
                        + B2ResponseClassifier.errorMessage(response));
            }
            return B2Session.fromAuthorizeAccount(JsonUtils.readTree(response.readBody()));
        } catch (IOException e) {
            throw new B2TransportException("Authorization request to " + request.getHost() + " failed", e);
        }
    }
}
