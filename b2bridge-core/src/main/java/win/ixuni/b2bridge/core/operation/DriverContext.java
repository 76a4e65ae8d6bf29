package win.ixuni.b2bridge.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.config.DriverConfig;

/**
 * Driver context interface
 * <p>
 * Shared dependencies a driver's handlers need. Each driver implements its own context class.
 */
public interface DriverContext {

    DriverConfig getConfig();

    String getDriverName();

    String getDriverType();

    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Inject the handler registry; called once while the driver is being built.
     *
     * @param registry handler registry
     */
    void setHandlerRegistry(OperationHandlerRegistry registry);

    /**
     * Execute another operation from inside a handler without depending on the handler instance.
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, this);
    }
}
