package win.ixuni.b2bridge.core.operation.bucket;

import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.b2bridge.core.model.StorageBucket;
import win.ixuni.b2bridge.core.operation.Operation;

/**
 * List all buckets operation
 */
@Value
public class ListBucketsOperation implements Operation<Flux<StorageBucket>> {
    // no parameters
}
