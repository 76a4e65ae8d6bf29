package win.ixuni.b2bridge.driver.b2.model;

import lombok.Builder;
import lombok.Value;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;

/**
 * Payload and headers of one upload.
 * <p>
 * Exactly one source is set: {@link #data}, {@link #stream} (read fully into memory) or
 * {@link #file} (hashed in a first pass, then streamed). When {@link #contentSha1} is given it
 * is trusted and no hash is computed.
 */
@Value
@Builder
public class B2UploadRequest {

    /**
     * Lets B2 pick the content type from the file name
     */
    public static final String AUTO_CONTENT_TYPE = "b2/x-auto";

    byte[] data;

    InputStream stream;

    Path file;

    @Builder.Default
    String contentType = AUTO_CONTENT_TYPE;

    /**
     * Becomes one X-Bz-Info-* header per entry
     */
    @Builder.Default
    Map<String, String> fileInfo = Map.of();

    /**
     * Precomputed hex SHA-1 of the payload
     */
    String contentSha1;

    public static B2UploadRequest ofBytes(byte[] data) {
        return B2UploadRequest.builder().data(data).build();
    }

    public static B2UploadRequest ofFile(Path file) {
        return B2UploadRequest.builder().file(file).build();
    }
}
