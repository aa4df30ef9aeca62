package win.ixuni.splice.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.splice.core.config.DriverConfig;

/**
 * Driver context
 * <p>
 * Shared state handed to every handler of one driver instance (clients, backing maps, configuration).
 * Each driver provides its own implementation.
 */
public interface DriverContext {

    DriverConfig getConfig();

    String getDriverName();

    String getDriverType();

    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Injected by the driver once its handlers are registered
     */
    void setHandlerRegistry(OperationHandlerRegistry registry);

    /**
     * Execute another operation from inside a handler, through the full interceptor chain
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, this);
    }
}
