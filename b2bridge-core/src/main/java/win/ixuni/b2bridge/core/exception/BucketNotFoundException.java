package win.ixuni.b2bridge.core.exception;

/**
 * Bucket not found exception
 */
public class BucketNotFoundException extends BridgeException {

    public BucketNotFoundException(String bucketName) {
        super("NoSuchBucket", "The specified bucket does not exist: " + bucketName, 404);
    }
}
