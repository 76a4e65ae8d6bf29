package win.ixuni.b2bridge.core.exception;

/**
 * Object not found exception
 */
public class ObjectNotFoundException extends BridgeException {

    public ObjectNotFoundException(String bucketName, String key) {
        super("NoSuchKey", "The specified key does not exist: " + bucketName + "/" + key, 404);
    }
}
