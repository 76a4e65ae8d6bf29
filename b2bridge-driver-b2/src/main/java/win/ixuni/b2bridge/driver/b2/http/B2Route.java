package win.ixuni.b2bridge.driver.b2.http;

import win.ixuni.b2bridge.driver.b2.auth.B2Session;

import java.util.Map;
import java.util.Objects;

/**
 * Where a B2 request goes and which credential it carries.
 * <p>
 * Every call names its route explicitly; the route alone decides host, token, path and whether
 * the body is JSON or raw bytes.
 */
public sealed interface B2Route permits B2Route.Control, B2Route.ApiCall, B2Route.Download,
        B2Route.UploadTicketFetch, B2Route.UploadPut {

    String API_PATH = "/b2api/v1/";

    String FILE_PATH = "/file/";

    String method();

    /**
     * @param session the current session; unused by routes that carry their own host
     */
    String host(B2Session session);

    /**
     * Value of the Authorization header
     */
    String token(B2Session session);

    String path();

    /**
     * Raw routes pass bodies through untouched instead of JSON-encoding them
     */
    boolean raw();

    /**
     * Whether a 401 on this route means the session token is no longer valid
     */
    default boolean usesSessionToken() {
        return true;
    }

    /**
     * Query parameters implied by the route itself
     */
    default Map<String, String> params() {
        return Map.of();
    }

    /**
     * Account authorization handshake against the fixed auth host.
     */
    record Control(String authHost) implements B2Route {

        public Control {
            Objects.requireNonNull(authHost, "authHost");
        }

        @Override
        public String method() {
            return "GET";
        }

        @Override
        public String host(B2Session session) {
            return authHost;
        }

        @Override
        public String token(B2Session session) {
            throw new IllegalStateException("The authorization call carries Basic credentials, not a token");
        }

        @Override
        public String path() {
            return API_PATH + "b2_authorize_account";
        }

        @Override
        public boolean raw() {
            return false;
        }

        @Override
        public boolean usesSessionToken() {
            return false;
        }
    }

    /**
     * Versioned JSON API call on the api host.
     */
    record ApiCall(String action, String method) implements B2Route {

        public ApiCall {
            Objects.requireNonNull(action, "action");
            Objects.requireNonNull(method, "method");
        }

        public static ApiCall get(String action) {
            return new ApiCall(action, "GET");
        }

        public static ApiCall post(String action) {
            return new ApiCall(action, "POST");
        }

        @Override
        public String host(B2Session session) {
            return session.getApiHost();
        }

        @Override
        public String token(B2Session session) {
            return session.getAuthorizationToken();
        }

        @Override
        public String path() {
            return API_PATH + action;
        }

        @Override
        public boolean raw() {
            return false;
        }
    }

    /**
     * Raw file download from the download host, {@code filePath} being "bucketName/fileName".
     */
    record Download(String filePath) implements B2Route {

        public Download {
            Objects.requireNonNull(filePath, "filePath");
        }

        @Override
        public String method() {
            return "GET";
        }

        @Override
        public String host(B2Session session) {
            return session.getDownloadHost();
        }

        @Override
        public String token(B2Session session) {
            return session.getAuthorizationToken();
        }

        @Override
        public String path() {
            return FILE_PATH + B2Paths.encodePath(filePath);
        }

        @Override
        public boolean raw() {
            return true;
        }
    }

    /**
     * Fetch of a one-time upload ticket for a bucket.
     */
    record UploadTicketFetch(String bucketId) implements B2Route {

        public UploadTicketFetch {
            Objects.requireNonNull(bucketId, "bucketId");
        }

        @Override
        public String method() {
            return "GET";
        }

        @Override
        public String host(B2Session session) {
            return session.getApiHost();
        }

        @Override
        public String token(B2Session session) {
            return session.getAuthorizationToken();
        }

        @Override
        public String path() {
            return API_PATH + "b2_get_upload_url";
        }

        @Override
        public boolean raw() {
            return false;
        }

        @Override
        public Map<String, String> params() {
            return Map.of("bucketId", bucketId);
        }
    }

    /**
     * Raw upload POST to the host and path of an upload ticket, with the ticket's token.
     */
    record UploadPut(String uploadHost, String uploadPath, String uploadToken) implements B2Route {

        public UploadPut {
            Objects.requireNonNull(uploadHost, "uploadHost");
            Objects.requireNonNull(uploadPath, "uploadPath");
            Objects.requireNonNull(uploadToken, "uploadToken");
        }

        @Override
        public String method() {
            return "POST";
        }

        @Override
        public String host(B2Session session) {
            return uploadHost;
        }

        @Override
        public String token(B2Session session) {
            return uploadToken;
        }

        @Override
        public String path() {
            return uploadPath;
        }

        @Override
        public boolean raw() {
            return true;
        }

        @Override
        public boolean usesSessionToken() {
            return false;
        }

        @Override
        public String toString() {
            return "UploadPut[uploadHost=" + uploadHost + ", uploadPath=" + uploadPath + "]";
        }
    }
}
