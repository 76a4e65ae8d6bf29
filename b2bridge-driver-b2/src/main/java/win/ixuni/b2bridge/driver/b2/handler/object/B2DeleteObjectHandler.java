package win.ixuni.b2bridge.driver.b2.handler.object;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.exception.BridgeException;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.core.operation.object.DeleteObjectOperation;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.model.B2Bucket;
import win.ixuni.b2bridge.driver.b2.model.B2File;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * B2 delete object handler
 * <p>
 * Deletes the latest version of the key. Deleting a missing key succeeds.
 */
@Slf4j
public class B2DeleteObjectHandler implements OperationHandler<DeleteObjectOperation, Void> {

    @Override
    public Mono<Void> handle(DeleteObjectOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return Mono.fromRunnable(() -> {
            B2Bucket bucket = ctx.getBucketResolver().resolve(bucketName);
            Optional<B2File> latest = ctx.findLatestFile(bucket, key);
            if (latest.isEmpty()) {
                log.debug("Delete of missing B2 object {}/{} ignored", bucketName, key);
                return;
            }
            if (!ctx.getClient().deleteObject(latest.get())) {
                throw new BridgeException("DeleteObjectFailed",
                        "B2 refused to delete object: " + bucketName + "/" + key, 500);
            }
        });
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
