package win.ixuni.b2bridge.core.exception;

/**
 * Driver not found exception
 */
public class DriverNotFoundException extends BridgeException {

    public DriverNotFoundException(String driverName) {
        super("DriverNotFound", "The specified driver does not exist: " + driverName, 500);
    }
}
