package win.ixuni.b2bridge.core.exception;

/**
 * Bucket already exists exception
 */
public class BucketAlreadyExistsException extends BridgeException {

    public BucketAlreadyExistsException(String bucketName) {
        super("BucketAlreadyExists", "The requested bucket name is not available: " + bucketName, 409);
    }
}
