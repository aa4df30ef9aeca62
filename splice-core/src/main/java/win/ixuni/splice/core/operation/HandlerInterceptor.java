package win.ixuni.splice.core.operation;

import reactor.core.publisher.Mono;

/**
 * Wraps every operation executed through a driver's registry
 * <p>
 * Interceptors run in ascending {@link #getOrder()}; the first one sees the call before all others and
 * the result after all others. Call logging and test fault
 * injection are implemented as interceptors.
 */
public interface HandlerInterceptor {

    /**
     * Intercept an operation; implementations call {@code chain.proceed()} to continue
     *
     * @param operation the operation instance
     * @param context   driver context
     * @param chain     rest of the chain
     * @param <O>       operation type
     * @param <R>       result type
     * @return operation result
     */
    <O extends Operation<R>, R> Mono<R> intercept(O operation, DriverContext context, InterceptorChain<O, R> chain);

    /**
     * Lower values run first (outermost)
     */
    default int getOrder() {
        return 0;
    }
}
