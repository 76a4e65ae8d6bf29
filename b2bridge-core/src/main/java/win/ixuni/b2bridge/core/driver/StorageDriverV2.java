package win.ixuni.b2bridge.core.driver;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.Operation;
import win.ixuni.b2bridge.core.operation.OperationHandlerRegistry;

/**
 * Storage driver interface V2
 * <p>
 * Command-pattern architecture where all operations are executed via {@link #execute(Operation)}.
 * Each driver implements its own handlers and registers them with the registry.
 */
public interface StorageDriverV2 extends StorageDriver {

    /**
     * Get the operation handler registry
     *
     * @return handler registry
     */
    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Get the driver context
     *
     * @return driver context
     */
    DriverContext getDriverContext();

    /**
     * Execute an operation through the interceptor chain
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, getDriverContext());
    }
}
