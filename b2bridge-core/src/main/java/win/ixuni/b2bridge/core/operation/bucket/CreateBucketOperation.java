package win.ixuni.b2bridge.core.operation.bucket;

import lombok.Value;
import win.ixuni.b2bridge.core.model.StorageBucket;
import win.ixuni.b2bridge.core.operation.Operation;

/**
 * Create bucket operation
 */
@Value
public class CreateBucketOperation implements Operation<StorageBucket> {

    String bucketName;
}
