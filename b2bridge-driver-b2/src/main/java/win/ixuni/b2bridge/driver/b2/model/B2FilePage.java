package win.ixuni.b2bridge.driver.b2.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of a file listing with its continuation cursor.
 * <p>
 * Pass {@link #nextFileName} (and {@link #nextFileId} for version listings) back as the start
 * of the next call until {@link #hasMore()} is false.
 */
@Value
@Builder
public class B2FilePage {

    @Builder.Default
    List<B2File> files = List.of();

    String nextFileName;

    /**
     * Only set by version listings
     */
    String nextFileId;

    public boolean hasMore() {
        return nextFileName != null;
    }
}
