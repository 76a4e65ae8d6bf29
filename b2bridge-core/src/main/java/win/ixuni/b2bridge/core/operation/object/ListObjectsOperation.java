package win.ixuni.b2bridge.core.operation.object;

import lombok.Value;
import win.ixuni.b2bridge.core.model.ListObjectsRequest;
import win.ixuni.b2bridge.core.model.ListObjectsResult;
import win.ixuni.b2bridge.core.operation.Operation;

/**
 * List one page of objects in a bucket
 */
@Value
public class ListObjectsOperation implements Operation<ListObjectsResult> {

    ListObjectsRequest request;
}
