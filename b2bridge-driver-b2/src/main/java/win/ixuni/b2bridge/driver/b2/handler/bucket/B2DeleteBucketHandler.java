package win.ixuni.b2bridge.driver.b2.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.exception.BridgeException;
import win.ixuni.b2bridge.core.exception.BucketNotEmptyException;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.model.B2Bucket;

import java.util.EnumSet;
import java.util.Set;

/**
 * B2 delete bucket handler
 * <p>
 * B2 only says whether the delete succeeded; on failure the bucket is probed for remaining
 * file versions to tell "not empty" apart from other errors.
 */
public class B2DeleteBucketHandler implements OperationHandler<DeleteBucketOperation, Void> {

    @Override
    public Mono<Void> handle(DeleteBucketOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;
        String bucketName = operation.getBucketName();

        return Mono.fromRunnable(() -> {
            B2Bucket bucket = ctx.getBucketResolver().resolve(bucketName);
            if (ctx.getClient().deleteContainer(bucket)) {
                return;
            }

            boolean hasVersions = !ctx.getClient()
                    .listObjectVersions(bucket.getId(), null, null, 1)
                    .getFiles()
                    .isEmpty();
            if (hasVersions) {
                throw new BucketNotEmptyException(bucketName);
            }
            throw new BridgeException("DeleteBucketFailed", "B2 refused to delete bucket: " + bucketName, 500);
        });
    }

    @Override
    public Class<DeleteBucketOperation> getOperationType() {
        return DeleteBucketOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
