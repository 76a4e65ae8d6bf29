package win.ixuni.b2bridge.driver.b2;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.b2bridge.core.config.DriverConfig;
import win.ixuni.b2bridge.core.driver.DriverFactory;
import win.ixuni.b2bridge.core.driver.StorageDriver;

/**
 * Backblaze B2 driver factory
 * <p>
 * One driver instance per configured B2 account.
 */
@Slf4j
@Component
public class B2DriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "b2";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        log.info("Creating B2 driver instance: {}", config.getName());
        return new B2StorageDriverV2(config);
    }

    @Override
    public String getDescription() {
        return "Backblaze B2";
    }
}
