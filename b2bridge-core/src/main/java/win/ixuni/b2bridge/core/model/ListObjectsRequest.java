package win.ixuni.b2bridge.core.model;

import lombok.Builder;
import lombok.Data;

/**
 * List objects request parameters
 */
@Data
@Builder
public class ListObjectsRequest {

    private String bucketName;

    private String prefix;

    /**
     * Delimiter for folder-style listing, none by default
     */
    private String delimiter;

    /**
     * Continuation marker: the {@link ListObjectsResult#getNextMarker()} of the previous page
     */
    private String marker;

    @Builder.Default
    private Integer maxKeys = 1000;
}
