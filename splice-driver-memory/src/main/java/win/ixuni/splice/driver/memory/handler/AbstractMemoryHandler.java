package win.ixuni.splice.driver.memory.handler;

import reactor.core.publisher.Mono;
import win.ixuni.splice.core.exception.BucketNotFoundException;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.Operation;
import win.ixuni.splice.core.operation.OperationHandler;
import win.ixuni.splice.driver.memory.context.MemoryDriverContext;
import win.ixuni.splice.driver.memory.context.MemoryStore;

/**
 * Base class of memory handlers
 * <p>
 * Checks the context type once so subclasses receive a {@link MemoryStore} directly.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public abstract class AbstractMemoryHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, DriverContext context) {
        if (!(context instanceof MemoryDriverContext memoryContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected MemoryDriverContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, memoryContext.getStore());
    }

    protected abstract Mono<R> doHandle(O operation, MemoryStore store);

    protected Mono<Void> requireBucket(MemoryStore store, String bucketName) {
        return store.getBuckets().containsKey(bucketName)
                ? Mono.empty()
                : Mono.error(new BucketNotFoundException(bucketName));
    }
}
