package win.ixuni.b2bridge.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a listing
 * <p>
 * Callers that want the whole bucket loop, passing {@link #nextMarker} back as the marker
 * until {@link #isTruncated} is false.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListObjectsResult {

    private String bucketName;

    private String prefix;

    private String delimiter;

    private Boolean isTruncated;

    private String nextMarker;

    private List<StorageObject> contents;

    /**
     * Folder prefixes, only filled when a delimiter was requested
     */
    private List<String> commonPrefixes;
}
