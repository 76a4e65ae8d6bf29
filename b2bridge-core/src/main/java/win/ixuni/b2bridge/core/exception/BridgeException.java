package win.ixuni.b2bridge.core.exception;

import lombok.Getter;

/**
 * B2Bridge base exception
 */
@Getter
public class BridgeException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    public BridgeException(String errorCode, String message, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public BridgeException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }
}
