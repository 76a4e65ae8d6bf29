package win.ixuni.b2bridge.driver.b2.model;

import lombok.Builder;
import lombok.Value;
import win.ixuni.b2bridge.core.model.StorageObject;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One version of a B2 file. Transient view, owns no resources.
 */
@Value
@Builder(toBuilder = true)
public class B2File {

    public static final String HASH_TYPE = "sha1";

    String fileId;

    String name;

    /**
     * Size in bytes; null when the record carried neither size nor contentLength
     */
    Long size;

    /**
     * Hex SHA-1 of the content, null when B2 does not know it
     */
    String contentSha1;

    String contentType;

    /**
     * User metadata ("fileInfo"), empty when none
     */
    @Builder.Default
    Map<String, String> fileInfo = Map.of();

    /**
     * Milliseconds since the epoch, null when absent
     */
    Long uploadTimestamp;

    /**
     * upload, hide, start or folder
     */
    String action;

    /**
     * Bucket the file was read from, null when the call did not name one
     */
    B2Bucket bucket;

    public StorageObject toStorageObject() {
        Map<String, Object> extra = new HashMap<>();
        if (fileId != null) {
            extra.put("fileId", fileId);
        }
        if (uploadTimestamp != null) {
            extra.put("uploadTimestamp", uploadTimestamp);
        }
        if (action != null) {
            extra.put("action", action);
        }

        return StorageObject.builder()
                .key(name)
                .bucketName(bucket != null ? bucket.getName() : null)
                .size(size)
                .contentHash(contentSha1)
                .hashType(HASH_TYPE)
                .lastModified(uploadTimestamp != null ? Instant.ofEpochMilli(uploadTimestamp) : null)
                .contentType(contentType)
                .userMetadata(fileInfo)
                .extra(Map.copyOf(extra))
                .build();
    }
}
