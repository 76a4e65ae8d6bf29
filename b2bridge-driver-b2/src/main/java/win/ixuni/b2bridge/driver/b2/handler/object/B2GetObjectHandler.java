package win.ixuni.b2bridge.driver.b2.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.model.StorageObjectData;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.core.operation.object.GetObjectOperation;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.model.B2Download;

import java.util.EnumSet;
import java.util.Set;

/**
 * B2 get object handler
 * <p>
 * Downloads by name from the download host; metadata comes from the response headers and the
 * content streams in chunks of the configured size.
 */
public class B2GetObjectHandler implements OperationHandler<GetObjectOperation, StorageObjectData> {

    @Override
    public Mono<StorageObjectData> handle(GetObjectOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;

        return Mono.fromCallable(() -> {
            B2Download download = ctx.getClient().openDownload(operation.getBucketName(), operation.getKey(),
                    ctx.getB2Config().getDownloadChunkSize());
            try {
                return StorageObjectData.builder()
                        .metadata(download.getFile().toStorageObject())
                        .content(download.getContent())
                        .build();
            } catch (RuntimeException e) {
                download.close();
                throw e;
            }
        });
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
