package win.ixuni.b2bridge.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Bucket model
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageBucket {

    private String name;

    /**
     * Creation time, null when the backend does not report it
     */
    private Instant creationDate;

    /**
     * Owning driver instance name
     */
    private String driverName;

    /**
     * Backend-specific attributes (B2: "id", "bucketType")
     */
    @Builder.Default
    private Map<String, Object> extra = Map.of();
}
