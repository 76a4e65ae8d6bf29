package win.ixuni.b2bridge.core.driver;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Driver factory loader
 * <p>
 * Uses {@link ServiceLoader} to discover DriverFactory implementations on the classpath.
 * A driver only needs a {@code META-INF/services} entry to be picked up.
 */
@Slf4j
public final class DriverFactoryLoader {

    private DriverFactoryLoader() {
    }

    public static List<DriverFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static List<DriverFactory> load(ClassLoader classLoader) {
        ServiceLoader<DriverFactory> loader = ServiceLoader.load(DriverFactory.class, classLoader);
        List<DriverFactory> factories = new ArrayList<>();

        for (DriverFactory factory : loader) {
            factories.add(factory);
            log.info("Discovered driver factory via SPI: {} - {}",
                    factory.getDriverType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No DriverFactory implementations found via SPI");
        } else {
            log.info("Loaded {} driver factories via SPI", factories.size());
        }

        return Collections.unmodifiableList(factories);
    }
}
