package win.ixuni.b2bridge.core.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import win.ixuni.b2bridge.core.driver.DriverFactory;

/**
 * Spring wiring for embedding B2Bridge in an application
 * <p>
 * Picks up every {@code @Component} driver factory under {@code win.ixuni.b2bridge} and binds
 * {@link BridgeProperties} from the {@code b2bridge.*} namespace.
 */
@Configuration
@ComponentScan(basePackages = "win.ixuni.b2bridge")
@EnableConfigurationProperties(BridgeProperties.class)
public class BridgeConfiguration {

    @Bean
    public DriverRegistry driverRegistry(BridgeProperties properties, ObjectProvider<DriverFactory> factories) {
        return new DriverRegistry(properties, factories.orderedStream().toList());
    }
}
