package win.ixuni.splice.core.driver;

import reactor.core.publisher.Mono;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.Operation;
import win.ixuni.splice.core.operation.OperationHandlerRegistry;

/**
 * Storage driver
 * <p>
 * A driver instance is one client of an object store. All store calls go through {@link #execute(Operation)},
 * which dispatches to the handler registered for the operation type.
 */
public interface StorageDriver {

    /**
     * Get the operation handler registry
     *
     * @return handler registry
     */
    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Get the driver context shared by all handlers of this instance
     *
     * @return driver context
     */
    DriverContext getDriverContext();

    /**
     * Execute an operation
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, getDriverContext());
    }

    /**
     * Get the driver type identifier
     *
     * @return driver type (e.g. "s3", "memory")
     */
    String getDriverType();

    /**
     * Get the driver instance name
     *
     * @return instance name (as specified in configuration)
     */
    String getDriverName();

    /**
     * Initialize the driver
     *
     * @return completion signal
     */
    default Mono<Void> initialize() {
        return Mono.empty();
    }

    /**
     * Shut down the driver and release its client resources
     *
     * @return completion signal
     */
    default Mono<Void> shutdown() {
        return Mono.empty();
    }
}
