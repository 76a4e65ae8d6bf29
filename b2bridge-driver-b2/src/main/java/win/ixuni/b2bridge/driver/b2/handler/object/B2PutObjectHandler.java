package win.ixuni.b2bridge.driver.b2.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.model.StorageObject;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.core.operation.object.PutObjectOperation;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.model.B2Bucket;
import win.ixuni.b2bridge.driver.b2.model.B2UploadRequest;
import win.ixuni.b2bridge.driver.b2.upload.B2FileInfoValidator;

import java.io.ByteArrayOutputStream;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * B2 put object handler
 * <p>
 * Buffers the content, since B2 needs its SHA-1 before the upload starts.
 */
public class B2PutObjectHandler implements OperationHandler<PutObjectOperation, StorageObject> {

    @Override
    public Mono<StorageObject> handle(PutObjectOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;
        Map<String, String> metadata = operation.getMetadata() != null ? operation.getMetadata() : Map.of();

        return Mono.fromRunnable(() -> B2FileInfoValidator.validate(metadata))
                .then(operation.getContent()
                        .reduce(new ByteArrayOutputStream(), (baos, buffer) -> {
                            byte[] bytes = new byte[buffer.remaining()];
                            buffer.get(bytes);
                            baos.write(bytes, 0, bytes.length);
                            return baos;
                        }))
                .flatMap(baos -> Mono.fromCallable(() -> {
                    B2Bucket bucket = ctx.getBucketResolver().resolve(operation.getBucketName());
                    B2UploadRequest request = B2UploadRequest.builder()
                            .data(baos.toByteArray())
                            .contentType(operation.getContentType() != null
                                    ? operation.getContentType() : B2UploadRequest.AUTO_CONTENT_TYPE)
                            .fileInfo(metadata)
                            .build();
                    return ctx.getClient().uploadObject(bucket, operation.getKey(), request).toStorageObject();
                }));
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
