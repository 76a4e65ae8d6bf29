package win.ixuni.b2bridge.core.config;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverFactory;
import win.ixuni.b2bridge.core.driver.StorageDriver;
import win.ixuni.b2bridge.core.exception.DriverNotFoundException;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DriverRegistryTest {

    @Test
    void createsEnabledDriversOfKnownTypes() {
        BridgeProperties properties = new BridgeProperties();
        properties.setDrivers(List.of(
                driverConfig("main", "stub", true),
                driverConfig("off", "stub", false),
                driverConfig("unknown", "nope", true)));
        properties.setDefaultDriver("main");

        DriverRegistry registry = new DriverRegistry(properties, List.of(new StubFactory()));
        registry.initialize();

        assertEquals(1, registry.getAllDrivers().size());
        assertEquals("main", registry.getDriver("main").getDriverName());
        assertSame(registry.getDriver("main"), registry.getDefaultDriver());
        assertTrue(registry.findDriver("off").isEmpty());
        assertThrows(DriverNotFoundException.class, () -> registry.getDriver("unknown"));
    }

    @Test
    void failingFactoryDoesNotStopOtherDrivers() {
        DriverFactory broken = mock(DriverFactory.class);
        when(broken.getDriverType()).thenReturn("broken");
        when(broken.createDriver(any())).thenThrow(new IllegalArgumentException("bad config"));

        BridgeProperties properties = new BridgeProperties();
        properties.setDrivers(List.of(driverConfig("a", "broken", true), driverConfig("b", "stub", true)));

        DriverRegistry registry = new DriverRegistry(properties, List.of(broken, new StubFactory()));
        registry.initialize();

        assertTrue(registry.findDriver("a").isEmpty());
        assertTrue(registry.findDriver("b").isPresent());
    }

    @Test
    void missingDefaultDriverFails() {
        DriverRegistry registry = new DriverRegistry(new BridgeProperties(), List.of());
        registry.initialize();

        assertThrows(DriverNotFoundException.class, registry::getDefaultDriver);
    }

    @Test
    void shutdownStopsEveryDriver() {
        StubFactory factory = new StubFactory();
        BridgeProperties properties = new BridgeProperties();
        properties.setDrivers(List.of(driverConfig("a", "stub", true), driverConfig("b", "stub", true)));

        DriverRegistry registry = new DriverRegistry(properties, List.of(factory));
        registry.initialize();
        registry.shutdown();

        assertEquals(2, factory.shutdowns.get());
        assertTrue(registry.getAllDrivers().isEmpty());
    }

    private static DriverConfig driverConfig(String name, String type, boolean enabled) {
        DriverConfig config = new DriverConfig();
        config.setName(name);
        config.setType(type);
        config.setEnabled(enabled);
        return config;
    }

    private static class StubFactory implements DriverFactory {

        private final AtomicInteger shutdowns = new AtomicInteger();

        @Override
        public String getDriverType() {
            return "stub";
        }

        @Override
        public StorageDriver createDriver(DriverConfig config) {
            return new StorageDriver() {
                @Override
                public String getDriverType() {
                    return "stub";
                }

                @Override
                public String getDriverName() {
                    return config.getName();
                }

                @Override
                public Mono<Void> shutdown() {
                    return Mono.fromRunnable(shutdowns::incrementAndGet);
                }
            };
        }
    }
}
