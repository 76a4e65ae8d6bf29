package win.ixuni.b2bridge.driver.b2.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import reactor.core.publisher.Flux;

import java.io.Closeable;
import java.nio.ByteBuffer;

/**
 * An open download: the file record read from the response headers and its content.
 * <p>
 * The response is already open. Consume or cancel the content, or {@link #close()} the download
 * when the content will not be read; otherwise the connection stays open.
 */
@Value
public class B2Download implements Closeable {

    B2File file;

    /**
     * Single use; closes the response on completion, error or cancel
     */
    Flux<ByteBuffer> content;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    Runnable release;

    /**
     * Release the response unless the content was already subscribed to. The content cannot be
     * subscribed to afterwards.
     */
    @Override
    public void close() {
        release.run();
    }
}
