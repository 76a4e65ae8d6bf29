package win.ixuni.b2bridge.core.operation.bucket;

import lombok.Value;
import win.ixuni.b2bridge.core.operation.Operation;

/**
 * Delete bucket operation
 */
@Value
public class DeleteBucketOperation implements Operation<Void> {

    String bucketName;
}
