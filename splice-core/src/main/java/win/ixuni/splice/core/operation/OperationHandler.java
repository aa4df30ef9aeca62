package win.ixuni.splice.core.operation;

import reactor.core.publisher.Mono;

/**
 * Driver-side implementation of one operation type
 *
 * @param <O> operation type
 * @param <R> result type
 */
public interface OperationHandler<O extends Operation<R>, R> {

    /**
     * Handle the operation
     *
     * @param operation the operation instance
     * @param context   context of the driver the handler is registered on
     * @return operation result
     */
    Mono<R> handle(O operation, DriverContext context);

    /**
     * Operation class this handler is registered for
     */
    Class<O> getOperationType();
}
