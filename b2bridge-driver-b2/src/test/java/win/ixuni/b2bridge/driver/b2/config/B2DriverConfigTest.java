package win.ixuni.b2bridge.driver.b2.config;

import org.junit.jupiter.api.Test;
import win.ixuni.b2bridge.core.config.DriverConfig;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class B2DriverConfigTest {

    @Test
    void appliesDefaults() {
        B2DriverConfig config = B2DriverConfig.from(driverConfig(Map.of(
                "key-id", "k1",
                "application-key", "secret")));

        assertEquals("k1", config.getKeyId());
        assertEquals("api.backblaze.com", config.getAuthHost());
        assertEquals("https", config.getScheme());
        assertEquals(Duration.ofSeconds(10), config.getConnectTimeout());
        assertEquals(Duration.ofSeconds(60), config.getRequestTimeout());
        assertEquals(8192, config.getDownloadChunkSize());
        assertEquals("allPrivate", config.getBucketType());
    }

    @Test
    void readsOverrides() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("key-id", "k1");
        properties.put("application-key", "secret");
        properties.put("auth-host", "localhost:8080");
        properties.put("scheme", "http");
        properties.put("connect-timeout-ms", "250");
        properties.put("request-timeout-ms", 1000);
        properties.put("download-chunk-size", "1024");
        properties.put("bucket-type", "allPublic");

        B2DriverConfig config = B2DriverConfig.from(driverConfig(properties));

        assertEquals("localhost:8080", config.getAuthHost());
        assertEquals("http", config.getScheme());
        assertEquals(Duration.ofMillis(250), config.getConnectTimeout());
        assertEquals(Duration.ofSeconds(1), config.getRequestTimeout());
        assertEquals(1024, config.getDownloadChunkSize());
        assertEquals("allPublic", config.getBucketType());
    }

    @Test
    void rejectsMissingCredentialsAndBadChunkSize() {
        assertThrows(IllegalArgumentException.class,
                () -> B2DriverConfig.from(driverConfig(Map.of("key-id", "k1"))));
        assertThrows(IllegalArgumentException.class,
                () -> B2DriverConfig.from(driverConfig(Map.of(
                        "key-id", "k1", "application-key", "s", "download-chunk-size", 0))));
    }

    @Test
    void toStringHidesApplicationKey() {
        B2DriverConfig config = B2DriverConfig.from(driverConfig(Map.of(
                "key-id", "k1",
                "application-key", "super-secret")));

        assertFalse(config.toString().contains("super-secret"));
    }

    private static DriverConfig driverConfig(Map<String, Object> properties) {
        DriverConfig config = new DriverConfig();
        config.setName("archive");
        config.setType("b2");
        config.setProperties(new HashMap<>(properties));
        return config;
    }
}
