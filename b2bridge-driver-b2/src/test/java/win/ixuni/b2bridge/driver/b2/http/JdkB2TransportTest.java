package win.ixuni.b2bridge.driver.b2.http;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JdkB2TransportTest {

    private HttpServer server;
    private JdkB2Transport transport;
    private String host;

    private final AtomicReference<String> seenMethod = new AtomicReference<>();
    private final AtomicReference<URI> seenUri = new AtomicReference<>();
    private final AtomicReference<String> seenAuthorization = new AtomicReference<>();
    private final AtomicReference<byte[]> seenBody = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            seenMethod.set(exchange.getRequestMethod());
            seenUri.set(exchange.getRequestURI());
            seenAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            seenBody.set(exchange.getRequestBody().readAllBytes());

            byte[] response = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("X-Bz-File-Id", "f-1");
            exchange.sendResponseHeaders(201, response.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(response);
            }
        });
        server.start();
        host = "127.0.0.1:" + server.getAddress().getPort();
        transport = new JdkB2Transport(Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void sendsMethodQueryAndHeaders() throws IOException {
        B2HttpRequest request = B2HttpRequest.builder()
                .method("GET")
                .scheme("http")
                .host(host)
                .path("/b2api/v1/b2_list_file_versions")
                .queryParam("bucketId", "b1")
                .queryParam("startFileName", "a b&c")
                .header("Authorization", "token-1")
                .header("Content-Length", "999")
                .build();

        try (B2HttpResponse response = transport.execute(request)) {
            assertEquals(201, response.getStatus());
            assertEquals("f-1", response.header("x-bz-file-id").orElseThrow());
            assertEquals("{\"ok\":true}", response.readBodyAsString());
        }

        assertEquals("GET", seenMethod.get());
        assertEquals("/b2api/v1/b2_list_file_versions", seenUri.get().getPath());
        assertEquals("bucketId=b1&startFileName=a+b%26c", seenUri.get().getRawQuery());
        assertEquals("token-1", seenAuthorization.get());
    }

    @Test
    void streamsBodyFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("payload.bin");
        Files.write(file, new byte[]{1, 2, 3, 4});

        B2HttpRequest request = B2HttpRequest.builder()
                .method("POST")
                .scheme("http")
                .host(host)
                .path("/upload/path")
                .bodyFile(file)
                .build();

        try (B2HttpResponse response = transport.execute(request)) {
            assertEquals(201, response.getStatus());
        }
        assertEquals("POST", seenMethod.get());
        assertArrayEquals(new byte[]{1, 2, 3, 4}, seenBody.get());
    }

    @Test
    void missingBodyFileFailsLocally(@TempDir Path dir) {
        B2HttpRequest request = B2HttpRequest.builder()
                .method("POST")
                .scheme("http")
                .host(host)
                .path("/upload/path")
                .bodyFile(dir.resolve("missing.bin"))
                .build();

        assertThrows(IOException.class, () -> transport.execute(request));
        assertNull(seenMethod.get());
    }

    @Test
    void buildsUriWithoutQueryWhenEmpty() {
        URI uri = JdkB2Transport.toUri(B2HttpRequest.builder()
                .method("GET")
                .host("f001.backblazeb2.com")
                .path("/file/photos/a%20b.jpg")
                .build());

        assertEquals("https://f001.backblazeb2.com/file/photos/a%20b.jpg", uri.toString());
    }
}
