package win.ixuni.splice.test.util;

import reactor.core.publisher.Mono;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.HandlerInterceptor;
import win.ixuni.splice.core.operation.InterceptorChain;
import win.ixuni.splice.core.operation.ObjectScoped;
import win.ixuni.splice.core.operation.Operation;

import java.util.function.Predicate;

/**
 * Fails the matching operations before they reach the handler
 */
public class FailingInterceptor implements HandlerInterceptor {

    private final Predicate<Operation<?>> failing;
    private final RuntimeException error;

    public FailingInterceptor(Predicate<Operation<?>> failing, RuntimeException error) {
        this.failing = failing;
        this.error = error;
    }

    /**
     * Fail every operation of one type
     */
    public FailingInterceptor(Class<? extends Operation<?>> failingType, RuntimeException error) {
        this(failingType::isInstance, error);
    }

    /**
     * Fail operations of one type on a single key
     */
    public static FailingInterceptor onKey(Class<? extends Operation<?>> failingType, String key,
                                           RuntimeException error) {
        return new FailingInterceptor(operation -> failingType.isInstance(operation)
                && operation instanceof ObjectScoped scoped
                && key.equals(scoped.getKey()), error);
    }

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(O operation, DriverContext context,
                                                         InterceptorChain<O, R> chain) {
        if (failing.test(operation)) {
            return Mono.error(error);
        }
        return chain.proceed(operation, context);
    }
}
