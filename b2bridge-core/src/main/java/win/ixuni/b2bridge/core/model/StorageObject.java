package win.ixuni.b2bridge.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Object model
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageObject {

    private String key;

    /**
     * Owning bucket, null when the backend record does not say
     */
    private String bucketName;

    /**
     * Size in bytes, null when unknown
     */
    private Long size;

    /**
     * Content hash as reported by the backend
     */
    private String contentHash;

    /**
     * Algorithm of {@link #contentHash} (e.g. "sha1")
     */
    private String hashType;

    private Instant lastModified;

    private String contentType;

    private Map<String, String> userMetadata;

    /**
     * Backend-specific attributes (B2: "fileId", "uploadTimestamp", "action")
     */
    @Builder.Default
    private Map<String, Object> extra = Map.of();
}
