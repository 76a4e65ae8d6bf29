package win.ixuni.b2bridge.core.operation.object;

import lombok.Value;
import win.ixuni.b2bridge.core.model.StorageObjectData;
import win.ixuni.b2bridge.core.operation.Operation;

/**
 * Get object operation (metadata plus content stream)
 */
@Value
public class GetObjectOperation implements Operation<StorageObjectData> {

    String bucketName;

    String key;
}
