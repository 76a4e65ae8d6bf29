package win.ixuni.b2bridge.driver.b2.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.exception.ObjectNotFoundException;
import win.ixuni.b2bridge.core.model.StorageObject;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.core.operation.object.HeadObjectOperation;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.model.B2Bucket;
import win.ixuni.b2bridge.driver.b2.model.B2File;

import java.util.EnumSet;
import java.util.Set;

/**
 * B2 head object handler
 */
public class B2HeadObjectHandler implements OperationHandler<HeadObjectOperation, StorageObject> {

    @Override
    public Mono<StorageObject> handle(HeadObjectOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return Mono.fromCallable(() -> {
            B2Bucket bucket = ctx.getBucketResolver().resolve(bucketName);
            return ctx.findLatestFile(bucket, key)
                    .map(B2File::toStorageObject)
                    .orElseThrow(() -> new ObjectNotFoundException(bucketName, key));
        });
    }

    @Override
    public Class<HeadObjectOperation> getOperationType() {
        return HeadObjectOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
