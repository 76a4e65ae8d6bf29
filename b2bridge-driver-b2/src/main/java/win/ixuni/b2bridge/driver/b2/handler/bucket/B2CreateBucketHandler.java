package win.ixuni.b2bridge.driver.b2.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.model.StorageBucket;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.core.operation.bucket.CreateBucketOperation;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * B2 create bucket handler
 * <p>
 * Buckets are created with the configured bucket type (allPrivate unless set).
 */
public class B2CreateBucketHandler implements OperationHandler<CreateBucketOperation, StorageBucket> {

    @Override
    public Mono<StorageBucket> handle(CreateBucketOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;

        return Mono.fromCallable(() -> ctx.getClient()
                .createContainer(operation.getBucketName(), ctx.getB2Config().getBucketType())
                .toStorageBucket());
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
