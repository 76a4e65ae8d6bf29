package win.ixuni.b2bridge.driver.b2.exception;

import lombok.Getter;
import win.ixuni.b2bridge.core.exception.BridgeException;

/**
 * Unclassified failure of a B2 call: a non-success status, or an I/O error before any status
 * was received (status -1).
 */
@Getter
public class B2TransportException extends BridgeException {

    /**
     * B2 error code from the response body ("not_found", "bad_request", ...), may be null
     */
    private final String b2Code;

    /**
     * Raw response body, may be null
     */
    private final String body;

    public B2TransportException(int status, String b2Code, String message, String body) {
        super(b2Code != null ? b2Code : "B2Error",
                "B2 request failed. status=" + status + ", code=" + b2Code + ", message=" + message,
                status);
        this.b2Code = b2Code;
        this.body = body;
    }

    public B2TransportException(String message, Throwable cause) {
        super("B2TransportError", message, -1, cause);
        this.b2Code = null;
        this.body = null;
    }
}
