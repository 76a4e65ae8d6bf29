package win.ixuni.b2bridge.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler interceptor
 * <p>
 * Chain-of-responsibility hook around handler execution (logging, exception translation).
 */
public interface HandlerInterceptor {

    <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            DriverContext context,
            InterceptorChain<O, R> chain);

    /**
     * Lower values run first (outermost).
     *
     * @return priority ordinal, 0 by default
     */
    default int getOrder() {
        return 0;
    }
}
