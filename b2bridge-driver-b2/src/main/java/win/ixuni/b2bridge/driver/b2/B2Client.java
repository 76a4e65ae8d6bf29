package win.ixuni.b2bridge.driver.b2;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import win.ixuni.b2bridge.core.util.JsonUtils;
import win.ixuni.b2bridge.driver.b2.exception.B2TransportException;
import win.ixuni.b2bridge.driver.b2.exception.B2UploadException;
import win.ixuni.b2bridge.driver.b2.http.B2HttpResponse;
import win.ixuni.b2bridge.driver.b2.http.B2Paths;
import win.ixuni.b2bridge.driver.b2.http.B2Request;
import win.ixuni.b2bridge.driver.b2.http.B2RequestRouter;
import win.ixuni.b2bridge.driver.b2.http.B2ResponseClassifier;
import win.ixuni.b2bridge.driver.b2.http.B2Route;
import win.ixuni.b2bridge.driver.b2.mapping.B2ResourceMapper;
import win.ixuni.b2bridge.driver.b2.model.B2Bucket;
import win.ixuni.b2bridge.driver.b2.model.B2Download;
import win.ixuni.b2bridge.driver.b2.model.B2File;
import win.ixuni.b2bridge.driver.b2.model.B2FilePage;
import win.ixuni.b2bridge.driver.b2.model.B2ListFilesRequest;
import win.ixuni.b2bridge.driver.b2.model.B2UploadRequest;
import win.ixuni.b2bridge.driver.b2.model.B2UploadTicket;
import win.ixuni.b2bridge.driver.b2.upload.B2FileInfoValidator;
import win.ixuni.b2bridge.driver.b2.upload.B2Hashes;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Synchronous B2 client
 * <p>
 * One method per B2 operation; each blocks for one round trip (two for uploads). Handlers wrap
 * these calls in {@code Mono.fromCallable}.
 */
@Slf4j
public class B2Client {

    public static final String DEFAULT_BUCKET_TYPE = "allPrivate";

    @Getter
    private final B2RequestRouter router;
    private final B2ResourceMapper mapper;
    private final int defaultChunkSize;

    public B2Client(B2RequestRouter router, B2ResourceMapper mapper, int defaultChunkSize) {
        if (defaultChunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + defaultChunkSize);
        }
        this.router = router;
        this.mapper = mapper;
        this.defaultChunkSize = defaultChunkSize;
    }

    // ==================== Buckets ====================

    public List<B2Bucket> listContainers() {
        return mapper.toBuckets(call(B2Request.builder()
                .route(B2Route.ApiCall.get("b2_list_buckets"))
                .includeAccountId(true)
                .build()));
    }

    /**
     * Look a bucket up by name, filtered server-side.
     */
    public Optional<B2Bucket> findContainer(String bucketName) {
        JsonNode response = call(B2Request.builder()
                .route(B2Route.ApiCall.get("b2_list_buckets"))
                .param("bucketName", bucketName)
                .includeAccountId(true)
                .build());
        return mapper.toBuckets(response).stream()
                .filter(bucket -> bucketName.equals(bucket.getName()))
                .findFirst();
    }

    public B2Bucket createContainer(String bucketName) {
        return createContainer(bucketName, DEFAULT_BUCKET_TYPE);
    }

    public B2Bucket createContainer(String bucketName, String bucketType) {
        log.debug("Creating B2 bucket {} ({})", bucketName, bucketType);
        return mapper.toBucket(call(B2Request.builder()
                .route(B2Route.ApiCall.post("b2_create_bucket"))
                .field("bucketName", bucketName)
                .field("bucketType", bucketType != null ? bucketType : DEFAULT_BUCKET_TYPE)
                .includeAccountId(true)
                .build()));
    }

    /**
     * @return true iff B2 answered 200; other statuses resolve to false
     */
    public boolean deleteContainer(B2Bucket bucket) {
        return status(B2Request.builder()
                .route(B2Route.ApiCall.post("b2_delete_bucket"))
                .field("bucketId", bucket.getId())
                .includeAccountId(true)
                .build()) == 200;
    }

    // ==================== Files ====================

    /**
     * First page of the bucket's file names; see {@link #listContainerObjects(B2Bucket, B2ListFilesRequest)}
     * to follow the cursor.
     */
    public List<B2File> listContainerObjects(B2Bucket bucket) {
        return listContainerObjects(bucket, B2ListFilesRequest.FIRST_PAGE).getFiles();
    }

    public B2FilePage listContainerObjects(B2Bucket bucket, B2ListFilesRequest request) {
        B2Request.B2RequestBuilder call = B2Request.builder()
                .route(B2Route.ApiCall.get("b2_list_file_names"))
                .param("bucketId", bucket.getId());
        if (request.getStartFileName() != null) {
            call.param("startFileName", request.getStartFileName());
        }
        if (request.getMaxFileCount() != null) {
            call.param("maxFileCount", String.valueOf(request.getMaxFileCount()));
        }
        if (request.getPrefix() != null) {
            call.param("prefix", request.getPrefix());
        }
        if (request.getDelimiter() != null) {
            call.param("delimiter", request.getDelimiter());
        }
        return mapper.toFilePage(call(call.build()), bucket);
    }

    /**
     * List all versions of the bucket's files. Each cursor parameter is sent only when non-null.
     */
    public B2FilePage listObjectVersions(String bucketId, String startFileName, String startFileId,
                                         Integer maxFileCount) {
        B2Request.B2RequestBuilder call = B2Request.builder()
                .route(B2Route.ApiCall.get("b2_list_file_versions"))
                .param("bucketId", bucketId);
        if (startFileName != null) {
            call.param("startFileName", startFileName);
        }
        if (startFileId != null) {
            call.param("startFileId", startFileId);
        }
        if (maxFileCount != null) {
            call.param("maxFileCount", String.valueOf(maxFileCount));
        }
        return mapper.toFilePage(call(call.build()), null);
    }

    public B2File getObject(String fileId) {
        return mapper.toFile(call(B2Request.builder()
                .route(B2Route.ApiCall.get("b2_get_file_info"))
                .param("fileId", fileId)
                .build()), null);
    }

    /**
     * Hide a file name; the returned record has action "hide".
     */
    public B2File hideObject(String bucketId, String fileName) {
        return mapper.toFile(call(B2Request.builder()
                .route(B2Route.ApiCall.post("b2_hide_file"))
                .field("bucketId", bucketId)
                .field("fileName", fileName)
                .build()), null);
    }

    /**
     * @return true iff B2 answered 200; other statuses resolve to false
     */
    public boolean deleteObject(B2File file) {
        return status(B2Request.builder()
                .route(B2Route.ApiCall.post("b2_delete_file_version"))
                .field("fileName", file.getName())
                .field("fileId", file.getFileId())
                .build()) == 200;
    }

    // ==================== Upload ====================

    /**
     * Fetch a fresh upload ticket. Tickets are never cached.
     */
    public B2UploadTicket getUploadTicket(String bucketId) {
        JsonNode response = call(B2Request.builder()
                .route(new B2Route.UploadTicketFetch(bucketId))
                .build());
        JsonNode bucket = response.get("bucketId");
        String uploadUrl = response.path("uploadUrl").asText(null);
        String token = response.path("authorizationToken").asText(null);
        if (uploadUrl == null || token == null || !hasHost(uploadUrl)) {
            throw new B2TransportException(200, null,
                    "Upload ticket for bucket " + bucketId + " lacks a usable uploadUrl or authorizationToken",
                    response.toString());
        }
        return new B2UploadTicket(bucket != null ? bucket.asText() : bucketId, uploadUrl, token);
    }

    public String getUploadUrl(String bucketId) {
        return getUploadTicket(bucketId).getUploadUrl();
    }

    /**
     * Upload one file: fetch a ticket, then POST the payload to the ticket's host with the
     * ticket's token.
     * <p>
     * Metadata is validated before any network call. The SHA-1 header is computed over exactly
     * the bytes sent, unless the request carries a precomputed one.
     *
     * @throws IllegalArgumentException on invalid metadata or when no payload is given
     * @throws IOException              when a local source cannot be read
     * @throws B2UploadException        when the upload POST does not return 200
     */
    public B2File uploadObject(B2Bucket bucket, String objectName, B2UploadRequest upload) throws IOException {
        var infoHeaders = B2FileInfoValidator.toHeaders(upload.getFileInfo());

        byte[] data = null;
        Path file = upload.getFile();
        String sha1 = upload.getContentSha1();
        if (upload.getData() != null) {
            data = upload.getData();
        } else if (upload.getStream() != null) {
            try (InputStream in = upload.getStream()) {
                data = in.readAllBytes();
            }
        } else if (file == null) {
            throw new IllegalArgumentException("Upload of " + objectName + " has no payload");
        }

        if (sha1 == null) {
            sha1 = data != null ? B2Hashes.sha1Hex(data) : B2Hashes.sha1Hex(file);
        }

        B2UploadTicket ticket = getUploadTicket(bucket.getId());
        B2Route.UploadPut route = new B2Route.UploadPut(ticket.host(), ticket.path(),
                ticket.getAuthorizationToken());

        B2Request.B2RequestBuilder request = B2Request.builder()
                .route(route)
                .header("X-Bz-File-Name", B2Paths.encode(objectName))
                .header("Content-Type", upload.getContentType() != null
                        ? upload.getContentType() : B2UploadRequest.AUTO_CONTENT_TYPE)
                .header("X-Bz-Content-Sha1", sha1)
                .headers(infoHeaders);
        if (data != null) {
            request.body(data);
        } else {
            request.bodyFile(file);
        }

        log.debug("Uploading {} to B2 bucket {} via {}", objectName, bucket.getName(), route);
        try (B2HttpResponse response = router.request(request.build())) {
            if (response.getStatus() != 200) {
                throw new B2UploadException(response.getStatus(), response.readBodyAsString());
            }
            return mapper.toFile(JsonUtils.readTree(response.readBody()), bucket);
        }
    }

    // ==================== Download ====================

    /**
     * Download a file to {@code destination}.
     * <p>
     * Content goes to a temporary sibling first and is moved into place once complete. When
     * fewer bytes arrive than announced the download fails: the partial file is deleted when
     * {@code deleteOnFailure} is set, otherwise it is left at the destination.
     *
     * @return true when the whole content was written
     * @throws FileAlreadyExistsException when the destination exists and {@code overwriteExisting} is false
     * @throws IOException                on local write failures
     */
    public boolean downloadObject(B2File file, Path destination, boolean overwriteExisting,
                                  boolean deleteOnFailure) throws IOException {
        if (!overwriteExisting && Files.exists(destination)) {
            throw new FileAlreadyExistsException(destination.toString());
        }

        Path directory = destination.toAbsolutePath().getParent();
        try (B2HttpResponse response = openDownloadResponse(bucketName(file), file.getName())) {
            Long expected = response.longHeader("Content-Length").orElse(file.getSize());
            Path temp = Files.createTempFile(directory, "." + destination.getFileName(), ".part");

            long written;
            try (InputStream in = response.getBody();
                 OutputStream out = Files.newOutputStream(temp)) {
                written = in.transferTo(out);
            } catch (IOException e) {
                finishFailed(temp, destination, deleteOnFailure);
                throw e;
            }

            if (expected != null && written != expected) {
                log.warn("Incomplete B2 download of {}: {} of {} bytes", file.getName(), written, expected);
                finishFailed(temp, destination, deleteOnFailure);
                return false;
            }
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
            return true;
        }
    }

    public Flux<ByteBuffer> downloadObjectAsStream(B2File file) {
        return downloadObjectAsStream(file, defaultChunkSize);
    }

    /**
     * Open a download and expose it as chunks of at most {@code chunkSize} bytes.
     * <p>
     * The request is sent before this returns, and the connection stays open until the flux is
     * subscribed to and terminates or is cancelled. The flux is finite and can be subscribed to
     * once. Use {@link #openDownload} when the content may end up unread.
     */
    public Flux<ByteBuffer> downloadObjectAsStream(B2File file, int chunkSize) {
        checkChunkSize(chunkSize);
        return new DownloadStream(openDownloadResponse(bucketName(file), file.getName()), chunkSize).content();
    }

    /**
     * Open a download by name, returning the file record from the response headers with the content.
     * <p>
     * The returned download holds the open response; consume its content or close it.
     */
    public B2Download openDownload(String bucketName, String fileName, int chunkSize) {
        checkChunkSize(chunkSize);
        B2HttpResponse response = openDownloadResponse(bucketName, fileName);
        DownloadStream stream = new DownloadStream(response, chunkSize);
        B2File fallback = B2File.builder()
                .name(fileName)
                .bucket(B2Bucket.builder().name(bucketName).build())
                .build();
        B2File file;
        try {
            file = mapper.fromDownloadHeaders(response, fallback);
        } catch (RuntimeException e) {
            stream.release();
            throw e;
        }
        return new B2Download(file, stream.content(), stream::release);
    }

    public int getDefaultChunkSize() {
        return defaultChunkSize;
    }

    // ==================== Internals ====================

    private JsonNode call(B2Request request) {
        try (B2HttpResponse response = router.request(request)) {
            B2ResponseClassifier.check(response);
            return JsonUtils.readTree(response.readBody());
        } catch (IOException e) {
            throw new B2TransportException("Failed to close B2 response for " + request.getRoute(), e);
        }
    }

    private int status(B2Request request) {
        try (B2HttpResponse response = router.request(request)) {
            int status = response.getStatus();
            if (status != 200) {
                log.debug("B2 {} answered {}: {}", request.getRoute(), status, response.readBodyAsString());
            }
            return status;
        } catch (IOException e) {
            throw new B2TransportException("Failed to close B2 response for " + request.getRoute(), e);
        }
    }

    private B2HttpResponse openDownloadResponse(String bucketName, String fileName) {
        B2HttpResponse response = router.request(B2Request.builder()
                .route(new B2Route.Download(bucketName + "/" + fileName))
                .build());
        if (response.getStatus() == 200) {
            return response;
        }
        try (B2HttpResponse failed = response) {
            throw B2ResponseClassifier.rejection(failed);
        } catch (IOException e) {
            throw new B2TransportException("Failed to close B2 download of " + fileName, e);
        }
    }

    /**
     * Content of an open download response. Either the content is subscribed to once, or the
     * response is released unread; whichever happens first wins.
     */
    private static final class DownloadStream {

        private final B2HttpResponse response;
        private final int chunkSize;
        private final AtomicBoolean claimed = new AtomicBoolean();

        DownloadStream(B2HttpResponse response, int chunkSize) {
            this.response = response;
            this.chunkSize = chunkSize;
        }

        Flux<ByteBuffer> content() {
            return Flux.defer(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return Flux.error(new IllegalStateException(
                            "B2 download stream can only be consumed once"));
                }
                return Flux.using(
                        () -> response,
                        open -> Flux.<ByteBuffer>generate(sink -> {
                            try {
                                byte[] chunk = open.getBody().readNBytes(chunkSize);
                                if (chunk.length == 0) {
                                    sink.complete();
                                } else {
                                    sink.next(ByteBuffer.wrap(chunk));
                                }
                            } catch (IOException e) {
                                sink.error(new B2TransportException("Failed to read B2 download stream", e));
                            }
                        }),
                        DownloadStream::close);
            });
        }

        void release() {
            if (claimed.compareAndSet(false, true)) {
                close(response);
            }
        }

        private static void close(B2HttpResponse response) {
            try {
                response.close();
            } catch (IOException e) {
                log.warn("Failed to close B2 download stream", e);
            }
        }
    }

    private static void finishFailed(Path temp, Path destination, boolean deleteOnFailure) throws IOException {
        if (deleteOnFailure) {
            Files.deleteIfExists(temp);
        } else {
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean hasHost(String url) {
        try {
            return new URI(url).getRawAuthority() != null;
        } catch (URISyntaxException e) {
            log.debug("Malformed B2 upload URL {}", url, e);
            return false;
        }
    }

    private static String bucketName(B2File file) {
        if (file.getBucket() == null || file.getBucket().getName() == null) {
            throw new IllegalArgumentException("File " + file.getName() + " is not bound to a bucket");
        }
        return file.getBucket().getName();
    }

    private static void checkChunkSize(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
    }
}
