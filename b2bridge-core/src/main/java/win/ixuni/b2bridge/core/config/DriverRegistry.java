package win.ixuni.b2bridge.core.config;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverFactory;
import win.ixuni.b2bridge.core.driver.StorageDriver;
import win.ixuni.b2bridge.core.exception.DriverNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Driver registry
 * <p>
 * Creates and owns every configured driver instance. Several instances of one type are allowed.
 */
@Slf4j
@RequiredArgsConstructor
public class DriverRegistry {

    private final BridgeProperties properties;
    private final List<DriverFactory> driverFactories;

    /**
     * name -> driver
     */
    private final Map<String, StorageDriver> drivers = new ConcurrentHashMap<>();

    /**
     * type -> factory
     */
    private final Map<String, DriverFactory> factoryMap = new ConcurrentHashMap<>();

    @PostConstruct
    public void initialize() {
        log.info("Initializing driver registry with {} driver factories", driverFactories.size());

        for (DriverFactory factory : driverFactories) {
            factoryMap.put(factory.getDriverType(), factory);
            log.info("Registered driver factory: {} - {}", factory.getDriverType(), factory.getDescription());
        }

        for (DriverConfig config : properties.getDrivers()) {
            if (!config.isEnabled()) {
                log.info("Driver '{}' is disabled, skipping", config.getName());
                continue;
            }

            DriverFactory factory = factoryMap.get(config.getType());
            if (factory == null) {
                log.error("Unknown driver type '{}' for driver '{}'", config.getType(), config.getName());
                continue;
            }

            try {
                StorageDriver driver = factory.createDriver(config);
                driver.initialize().block();
                drivers.put(config.getName(), driver);
                log.info("Created driver instance: {} (type: {})", config.getName(), config.getType());
            } catch (Exception e) {
                log.error("Failed to create driver '{}': {}", config.getName(), e.getMessage(), e);
            }
        }

        log.info("Driver registry initialized with {} drivers", drivers.size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down driver registry...");
        Flux.fromIterable(drivers.values())
                .flatMap(driver -> driver.shutdown()
                        .doOnSuccess(v -> log.info("Driver '{}' shutdown complete", driver.getDriverName()))
                        .onErrorResume(e -> {
                            log.error("Error shutting down driver '{}': {}", driver.getDriverName(), e.getMessage());
                            return Mono.empty();
                        }))
                .blockLast();
        drivers.clear();
    }

    /**
     * @throws DriverNotFoundException when no driver has this name
     */
    public StorageDriver getDriver(String name) {
        StorageDriver driver = drivers.get(name);
        if (driver == null) {
            throw new DriverNotFoundException(name);
        }
        return driver;
    }

    /**
     * @throws DriverNotFoundException when no default is configured or it failed to start
     */
    public StorageDriver getDefaultDriver() {
        String name = properties.getDefaultDriver();
        if (name == null || name.isBlank()) {
            throw new DriverNotFoundException("<default>");
        }
        return getDriver(name);
    }

    public Optional<StorageDriver> findDriver(String name) {
        return Optional.ofNullable(drivers.get(name));
    }

    public Map<String, StorageDriver> getAllDrivers() {
        return Map.copyOf(drivers);
    }
}
