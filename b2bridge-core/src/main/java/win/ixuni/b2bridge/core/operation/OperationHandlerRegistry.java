package win.ixuni.b2bridge.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Operation handler registry
 * <p>
 * Maps operation classes to handlers. Drivers register handlers while they are built; at
 * runtime the handler is looked up by the operation's class and run through the interceptors.
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();
    private final List<HandlerInterceptor> interceptors = new CopyOnWriteArrayList<>();

    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        Class<O> operationType = handler.getOperationType();
        handlers.put(operationType, handler);
        log.debug("Registered handler for operation: {}", operationType.getSimpleName());
    }

    /**
     * Add an interceptor; interceptors are kept sorted by {@link HandlerInterceptor#getOrder()}.
     */
    public void addInterceptor(HandlerInterceptor interceptor) {
        interceptors.add(interceptor);
        // CopyOnWriteArrayList cannot be sorted in place
        List<HandlerInterceptor> sorted = new ArrayList<>(interceptors);
        sorted.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        interceptors.clear();
        interceptors.addAll(sorted);
        log.debug("Added interceptor: {} with order {}",
                interceptor.getClass().getSimpleName(), interceptor.getOrder());
    }

    /**
     * @return the handler, or null when none is registered
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> OperationHandler<O, R> getHandler(Class<O> operationType) {
        return (OperationHandler<O, R>) handlers.get(operationType);
    }

    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, DriverContext context) {
        Class<O> operationType = (Class<O>) operation.getClass();
        OperationHandler<O, R> handler = getHandler(operationType);

        if (handler == null) {
            return Mono.error(new UnsupportedOperationException(
                    "No handler registered for operation: " + operationType.getSimpleName()));
        }

        log.debug("Executing operation: {} with handler: {} through {} interceptors",
                operation.getOperationName(), handler.getClass().getSimpleName(), interceptors.size());

        InterceptorChain<O, R> chain = buildChain(handler, 0);
        return chain.proceed(operation, context);
    }

    private <O extends Operation<R>, R> InterceptorChain<O, R> buildChain(
            OperationHandler<O, R> handler, int index) {
        if (index >= interceptors.size()) {
            return handler::handle;
        }

        HandlerInterceptor interceptor = interceptors.get(index);
        InterceptorChain<O, R> nextChain = buildChain(handler, index + 1);

        return (op, ctx) -> interceptor.intercept(op, ctx, nextChain);
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return handlers.containsKey(operationType);
    }

    public int size() {
        return handlers.size();
    }

    public int interceptorCount() {
        return interceptors.size();
    }

    public Set<Class<?>> getRegisteredOperationTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * @return union of {@link OperationHandler#getProvidedCapabilities()} over all handlers
     */
    public Set<Capability> getAggregatedCapabilities() {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (OperationHandler<?, ?> handler : handlers.values()) {
            capabilities.addAll(handler.getProvidedCapabilities());
        }
        return capabilities;
    }
}
