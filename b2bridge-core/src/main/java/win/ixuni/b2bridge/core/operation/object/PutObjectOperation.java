package win.ixuni.b2bridge.core.operation.object;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.b2bridge.core.model.StorageObject;
import win.ixuni.b2bridge.core.operation.Operation;

import java.nio.ByteBuffer;
import java.util.Map;

/**
 * Put object operation
 */
@Value
@Builder
public class PutObjectOperation implements Operation<StorageObject> {

    String bucketName;

    String key;

    /**
     * Object content stream
     */
    Flux<ByteBuffer> content;

    /**
     * Content type, driver default when null
     */
    String contentType;

    /**
     * User metadata
     */
    Map<String, String> metadata;
}
