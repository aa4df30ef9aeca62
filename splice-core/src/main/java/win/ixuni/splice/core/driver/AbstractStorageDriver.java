package win.ixuni.splice.core.driver;

import lombok.Getter;
import win.ixuni.splice.core.config.DriverConfig;
import win.ixuni.splice.core.operation.OperationHandlerRegistry;
import win.ixuni.splice.core.operation.interceptor.LoggingInterceptor;

/**
 * Base class for storage drivers
 * <p>
 * Owns the handler registry and installs the logging interceptor. Subclasses build their context,
 * register their handlers and then call {@link #bindContext()}.
 */
public abstract class AbstractStorageDriver implements StorageDriver {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    @Getter
    protected final DriverConfig config;

    protected AbstractStorageDriver(DriverConfig config) {
        this.config = config;
        handlerRegistry.addInterceptor(new LoggingInterceptor());
    }

    /**
     * Inject the registry into the context so handlers can call other operations
     */
    protected void bindContext() {
        getDriverContext().setHandlerRegistry(handlerRegistry);
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }
}
