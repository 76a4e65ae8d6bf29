package win.ixuni.b2bridge.core.driver;

import lombok.Getter;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.operation.OperationHandlerRegistry;

import java.util.Set;

/**
 * Abstract base class for V2 storage drivers
 * <p>
 * Subclasses only need to build their context and register handlers.
 */
public abstract class AbstractStorageDriverV2 implements StorageDriverV2 {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    @Override
    public Set<Capability> getCapabilities() {
        // Union of the capabilities declared by registered handlers
        return handlerRegistry.getAggregatedCapabilities();
    }
}
