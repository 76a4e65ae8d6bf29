package win.ixuni.b2bridge.driver.b2.handler.bucket;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.model.StorageBucket;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.core.operation.bucket.ListBucketsOperation;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.model.B2Bucket;

import java.util.EnumSet;
import java.util.Set;

/**
 * B2 list buckets handler
 */
public class B2ListBucketsHandler implements OperationHandler<ListBucketsOperation, Flux<StorageBucket>> {

    @Override
    public Mono<Flux<StorageBucket>> handle(ListBucketsOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;

        return Mono.fromCallable(() -> Flux.fromIterable(ctx.getClient().listContainers())
                .map(B2Bucket::toStorageBucket));
    }

    @Override
    public Class<ListBucketsOperation> getOperationType() {
        return ListBucketsOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
