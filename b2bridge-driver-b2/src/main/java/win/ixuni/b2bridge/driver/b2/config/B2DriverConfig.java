package win.ixuni.b2bridge.driver.b2.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;
import win.ixuni.b2bridge.core.config.DriverConfig;

import java.time.Duration;

/**
 * Backblaze B2 driver configuration
 */
@Data
@Builder
public class B2DriverConfig {

    public static final String DEFAULT_AUTH_HOST = "api.backblaze.com";

    /**
     * Application key id, the user half of the Basic credentials
     */
    private String keyId;

    @ToString.Exclude
    private String applicationKey;

    /**
     * Host of the account authorization endpoint
     */
    @Builder.Default
    private String authHost = DEFAULT_AUTH_HOST;

    /**
     * Scheme used for every host; only tests talk plain http
     */
    @Builder.Default
    private String scheme = "https";

    @Builder.Default
    private Duration connectTimeout = Duration.ofSeconds(10);

    @Builder.Default
    private Duration requestTimeout = Duration.ofSeconds(60);

    /**
     * Chunk size of download streams when the caller does not pick one
     */
    @Builder.Default
    private int downloadChunkSize = 8192;

    /**
     * Bucket type used by the generic create-bucket operation
     */
    @Builder.Default
    private String bucketType = "allPrivate";

    public static B2DriverConfig from(DriverConfig config) {
        int chunkSize = config.getInt("download-chunk-size", 8192);
        if (chunkSize <= 0) {
            throw new IllegalArgumentException(
                    "B2 driver '" + config.getName() + "': download-chunk-size must be positive");
        }
        return B2DriverConfig.builder()
                .keyId(config.getRequiredString("key-id"))
                .applicationKey(config.getRequiredString("application-key"))
                .authHost(config.getString("auth-host", DEFAULT_AUTH_HOST))
                .scheme(config.getString("scheme", "https"))
                .connectTimeout(Duration.ofMillis(config.getLong("connect-timeout-ms", 10_000L)))
                .requestTimeout(Duration.ofMillis(config.getLong("request-timeout-ms", 60_000L)))
                .downloadChunkSize(chunkSize)
                .bucketType(config.getString("bucket-type", "allPrivate"))
                .build();
    }
}
