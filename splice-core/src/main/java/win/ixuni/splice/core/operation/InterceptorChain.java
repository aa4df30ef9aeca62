package win.ixuni.splice.core.operation;

import reactor.core.publisher.Mono;

/**
 * Remainder of an interceptor chain: the next interceptor, or the handler at the end
 *
 * @param <O> operation type
 * @param <R> result type
 */
@FunctionalInterface
public interface InterceptorChain<O extends Operation<R>, R> {

    Mono<R> proceed(O operation, DriverContext context);
}
