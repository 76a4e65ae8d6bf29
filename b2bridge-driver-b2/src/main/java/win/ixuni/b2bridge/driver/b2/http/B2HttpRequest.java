package win.ixuni.b2bridge.driver.b2.http;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.Map;

/**
 * A fully resolved HTTP request, ready for a {@link B2Transport}.
 * <p>
 * At most one of {@link #body} and {@link #bodyFile} is set.
 */
@Value
@Builder
public class B2HttpRequest {

    String method;

    @Builder.Default
    String scheme = "https";

    /**
     * URL authority: host, optionally with port
     */
    String host;

    String path;

    @Singular("queryParam")
    Map<String, String> query;

    @Singular
    Map<String, String> headers;

    byte[] body;

    Path bodyFile;
}
