package win.ixuni.b2bridge.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * B2Bridge main configuration
 * <p>
 * Example:
 * <pre>
 * b2bridge:
 *   default-driver: archive
 *   drivers:
 *     - name: archive
 *       type: b2
 *       properties:
 *         key-id: 0012ab...
 *         application-key: K001...
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "b2bridge")
public class BridgeProperties {

    private List<DriverConfig> drivers = new ArrayList<>();

    /**
     * Driver used when a caller does not name one
     */
    private String defaultDriver;
}
