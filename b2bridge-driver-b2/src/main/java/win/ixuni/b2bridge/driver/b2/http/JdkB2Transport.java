package win.ixuni.b2bridge.driver.b2.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * {@link B2Transport} over the JDK {@link HttpClient}.
 * <p>
 * Bodies are always sent with a known length; B2 does not accept chunked uploads.
 */
public class JdkB2Transport implements B2Transport {

    /**
     * Headers the JDK client computes itself and refuses to accept
     */
    private static final Set<String> RESTRICTED_HEADERS = Set.of("content-length", "host", "connection");

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkB2Transport(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), requestTimeout);
    }

    public JdkB2Transport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public B2HttpResponse execute(B2HttpRequest request) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(toUri(request))
                .timeout(requestTimeout)
                .method(request.getMethod(), bodyPublisher(request));

        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            if (!RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                builder.header(header.getKey(), header.getValue());
            }
        }

        try {
            HttpResponse<InputStream> response = httpClient.send(builder.build(),
                    HttpResponse.BodyHandlers.ofInputStream());
            return new B2HttpResponse(response.statusCode(), response.headers().map(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException(
                    "Interrupted while calling " + request.getHost() + request.getPath());
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    static URI toUri(B2HttpRequest request) {
        StringBuilder uri = new StringBuilder()
                .append(request.getScheme()).append("://")
                .append(request.getHost())
                .append(request.getPath().startsWith("/") ? "" : "/")
                .append(request.getPath());

        if (!request.getQuery().isEmpty()) {
            StringJoiner query = new StringJoiner("&", "?", "");
            request.getQuery().forEach((key, value) -> query.add(
                    URLEncoder.encode(key, StandardCharsets.UTF_8) + "="
                            + URLEncoder.encode(value, StandardCharsets.UTF_8)));
            uri.append(query);
        }
        return URI.create(uri.toString());
    }

    private static HttpRequest.BodyPublisher bodyPublisher(B2HttpRequest request) throws IOException {
        if (request.getBodyFile() != null) {
            return HttpRequest.BodyPublishers.ofFile(request.getBodyFile());
        }
        if (request.getBody() != null) {
            return HttpRequest.BodyPublishers.ofByteArray(request.getBody());
        }
        return HttpRequest.BodyPublishers.noBody();
    }
}
