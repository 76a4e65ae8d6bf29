package win.ixuni.b2bridge.driver.b2.exception;

import lombok.Getter;
import win.ixuni.b2bridge.core.exception.BridgeException;

/**
 * The upload POST to the ticket host did not return 200.
 * <p>
 * Nothing is known about partial server-side state after this.
 */
@Getter
public class B2UploadException extends BridgeException {

    private final String body;

    public B2UploadException(int status, String body) {
        super("UploadFailed", "Upload failed. status_code=" + status + ", body=" + body, status);
        this.body = body;
    }
}
