package win.ixuni.b2bridge.core.operation;

import reactor.core.publisher.Mono;

/**
 * Remainder of an interceptor chain, ending in the handler itself.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public interface InterceptorChain<O extends Operation<R>, R> {

    Mono<R> proceed(O operation, DriverContext context);
}
