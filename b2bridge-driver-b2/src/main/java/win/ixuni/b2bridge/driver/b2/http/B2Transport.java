package win.ixuni.b2bridge.driver.b2.http;

import java.io.Closeable;
import java.io.IOException;

/**
 * HTTP transport the driver sends every request through.
 * <p>
 * Implementations send the request to the host named in the request (per-call host override),
 * pass headers and bodies through untouched, and return the raw status and body. Timeouts are
 * the implementation's concern.
 */
public interface B2Transport extends Closeable {

    B2HttpResponse execute(B2HttpRequest request) throws IOException;

    @Override
    default void close() {
    }
}
