package win.ixuni.b2bridge.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;

import java.util.Collections;
import java.util.Set;

/**
 * Operation handler interface
 *
 * @param <O> operation type
 * @param <R> result type
 */
public interface OperationHandler<O extends Operation<R>, R> {

    /**
     * Handle the operation
     *
     * @param operation the operation instance
     * @param context   driver context
     * @return operation result
     */
    Mono<R> handle(O operation, DriverContext context);

    /**
     * @return the operation class this handler is registered for
     */
    Class<O> getOperationType();

    /**
     * Capabilities contributed by this handler
     * <p>
     * A driver's capabilities are the union over all of its registered handlers.
     *
     * @return capability set, empty by default
     */
    default Set<Capability> getProvidedCapabilities() {
        return Collections.emptySet();
    }
}
