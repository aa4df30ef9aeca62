package win.ixuni.splice.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.HandlerInterceptor;
import win.ixuni.splice.core.operation.InterceptorChain;
import win.ixuni.splice.core.operation.Operation;

/**
 * Logs every store call with its duration
 */
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            DriverContext context,
            InterceptorChain<O, R> chain) {

        return Mono.defer(() -> {
            final long startTime = System.currentTimeMillis();
            final String operationName = operation.getOperationName();
            final String driverName = context.getDriverName();

            log.debug("[{}] {} {}", driverName, operationName, operation);

            return chain.proceed(operation, context)
                    .doOnSuccess(result -> log.debug("[{}] {} completed in {}ms",
                            driverName, operationName, System.currentTimeMillis() - startTime))
                    .doOnError(error -> log.warn("[{}] {} failed after {}ms: {}",
                            driverName, operationName, System.currentTimeMillis() - startTime,
                            error.getMessage()));
        });
    }

    @Override
    public int getOrder() {
        return -100;
    }
}
