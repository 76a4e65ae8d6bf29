package win.ixuni.b2bridge.driver.b2.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import win.ixuni.b2bridge.core.config.DriverConfig;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandlerRegistry;
import win.ixuni.b2bridge.driver.b2.B2Client;
import win.ixuni.b2bridge.driver.b2.config.B2DriverConfig;
import win.ixuni.b2bridge.driver.b2.model.B2Bucket;
import win.ixuni.b2bridge.driver.b2.model.B2File;
import win.ixuni.b2bridge.driver.b2.model.B2ListFilesRequest;

import java.util.Optional;

/**
 * B2 driver context
 * <p>
 * Holds the B2 client, the bucket resolver and configuration
 */
@Getter
@Builder
public class B2DriverContext implements DriverContext {

    private final DriverConfig config;

    private final B2DriverConfig b2Config;

    private final B2Client client;

    /**
     * Bucket name to bucket id lookups
     */
    private final B2BucketResolver bucketResolver;

    /**
     * Operation handler registry (injected at runtime)
     */
    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public DriverConfig getConfig() {
        return config;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public String getDriverType() {
        return "b2";
    }

    /**
     * Latest visible version of {@code key}, empty when the name does not exist or is hidden
     */
    public Optional<B2File> findLatestFile(B2Bucket bucket, String key) {
        var page = client.listContainerObjects(bucket, B2ListFilesRequest.builder()
                .startFileName(key)
                .maxFileCount(1)
                .build());
        return page.getFiles().stream()
                .filter(file -> key.equals(file.getName()))
                .findFirst();
    }
}
