package win.ixuni.b2bridge.core.driver;

import win.ixuni.b2bridge.core.config.DriverConfig;

/**
 * Driver factory interface
 * <p>
 * Each driver type provides a factory that creates driver instances from configuration.
 * Several instances of one type can coexist (e.g. two B2 accounts).
 */
public interface DriverFactory {

    /**
     * @return driver type identifier (e.g. "b2")
     */
    String getDriverType();

    /**
     * Create a driver instance from configuration
     *
     * @param config driver configuration
     * @return driver instance
     */
    StorageDriver createDriver(DriverConfig config);

    default String getDescription() {
        return getDriverType() + " storage driver";
    }
}
