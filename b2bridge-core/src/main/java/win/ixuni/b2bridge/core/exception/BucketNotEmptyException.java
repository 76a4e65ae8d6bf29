package win.ixuni.b2bridge.core.exception;

/**
 * Thrown when deleting a bucket that still holds objects.
 */
public class BucketNotEmptyException extends BridgeException {

    public BucketNotEmptyException(String bucketName) {
        super("BucketNotEmpty", "The bucket you tried to delete is not empty: " + bucketName, 409);
    }
}
