package win.ixuni.b2bridge.core.operation.object;

import lombok.Value;
import win.ixuni.b2bridge.core.model.StorageObject;
import win.ixuni.b2bridge.core.operation.Operation;

/**
 * Get object metadata without content
 */
@Value
public class HeadObjectOperation implements Operation<StorageObject> {

    String bucketName;

    String key;
}
