package win.ixuni.b2bridge.driver.b2.model;

import lombok.Builder;
import lombok.Value;
import win.ixuni.b2bridge.core.model.StorageBucket;

import java.util.HashMap;
import java.util.Map;

/**
 * A B2 bucket as returned by the API. Transient view, owns no resources.
 */
@Value
@Builder
public class B2Bucket {

    String id;

    String name;

    /**
     * allPublic, allPrivate, snapshot, ...
     */
    String bucketType;

    /**
     * Name of the driver instance the bucket was read through
     */
    String driverName;

    public StorageBucket toStorageBucket() {
        return StorageBucket.builder()
                .name(name)
                .driverName(driverName)
                .extra(extra())
                .build();
    }

    private Map<String, Object> extra() {
        Map<String, Object> extra = new HashMap<>();
        if (id != null) {
            extra.put("id", id);
        }
        if (bucketType != null) {
            extra.put("bucketType", bucketType);
        }
        return Map.copyOf(extra);
    }
}
