package win.ixuni.b2bridge.core.model;

import lombok.Builder;
import lombok.Data;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;

/**
 * Object metadata together with its content stream
 */
@Data
@Builder
public class StorageObjectData {

    private StorageObject metadata;

    /**
     * Content stream; single use, it cannot be re-subscribed.
     * The underlying connection stays open until the stream is consumed or cancelled.
     */
    private Flux<ByteBuffer> content;
}
