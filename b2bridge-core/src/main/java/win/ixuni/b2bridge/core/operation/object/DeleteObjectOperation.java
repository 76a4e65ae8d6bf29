package win.ixuni.b2bridge.core.operation.object;

import lombok.Value;
import win.ixuni.b2bridge.core.operation.Operation;

/**
 * Delete object operation
 */
@Value
public class DeleteObjectOperation implements Operation<Void> {

    String bucketName;

    String key;
}
