package win.ixuni.b2bridge.driver.b2.exception;

import win.ixuni.b2bridge.core.exception.BridgeException;

/**
 * The account handshake was rejected, or a call carrying the session token came back 401.
 * <p>
 * The session is already invalidated when this is thrown, so the next call re-authenticates.
 */
public class B2AuthenticationException extends BridgeException {

    public B2AuthenticationException(String message) {
        super("Unauthorized", message, 401);
    }

    public B2AuthenticationException(String message, Throwable cause) {
        super("Unauthorized", message, 401, cause);
    }
}
