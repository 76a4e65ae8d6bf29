package win.ixuni.b2bridge.driver.b2.http;

import lombok.Getter;
import win.ixuni.b2bridge.driver.b2.exception.B2TransportException;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Status, headers and the still-open body stream of a B2 response.
 * <p>
 * JSON callers read the body once with {@link #readBody()}; downloads consume
 * {@link #getBody()} as a stream. Either way the response must be closed.
 */
public class B2HttpResponse implements Closeable {

    @Getter
    private final int status;

    @Getter
    private final Map<String, List<String>> headers;

    @Getter
    private final InputStream body;

    private byte[] cached;

    public B2HttpResponse(int status, Map<String, List<String>> headers, InputStream body) {
        this.status = status;
        TreeMap<String, List<String>> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        sorted.putAll(headers);
        this.headers = sorted;
        this.body = body != null ? body : InputStream.nullInputStream();
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }

    /**
     * Numeric header value.
     *
     * @throws B2TransportException when the header is present but not a number
     */
    public Optional<Long> longHeader(String name) {
        return header(name).map(value -> {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new B2TransportException("Malformed " + name + " header in B2 response: " + value, e);
            }
        });
    }

    /**
     * Read the whole body; later calls return the same bytes.
     */
    public byte[] readBody() {
        if (cached == null) {
            try (InputStream in = body) {
                cached = in.readAllBytes();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read B2 response body", e);
            }
        }
        return cached;
    }

    public String readBodyAsString() {
        return new String(readBody(), StandardCharsets.UTF_8);
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
