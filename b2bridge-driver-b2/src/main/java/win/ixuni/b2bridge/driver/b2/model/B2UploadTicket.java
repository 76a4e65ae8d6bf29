package win.ixuni.b2bridge.driver.b2.model;

import lombok.ToString;
import lombok.Value;

import java.net.URI;

/**
 * Upload URL and token scoped to one bucket.
 * <p>
 * Fetched for every upload and never cached.
 */
@Value
public class B2UploadTicket {

    String bucketId;

    String uploadUrl;

    @ToString.Exclude
    String authorizationToken;

    /**
     * Authority of the upload URL
     */
    public String host() {
        return URI.create(uploadUrl).getRawAuthority();
    }

    /**
     * Path of the upload URL, used verbatim
     */
    public String path() {
        String path = URI.create(uploadUrl).getRawPath();
        return path == null || path.isEmpty() ? "/" : path;
    }
}
