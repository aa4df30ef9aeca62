package win.ixuni.splice.driver.memory.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import win.ixuni.splice.core.config.DriverConfig;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.OperationHandlerRegistry;
import win.ixuni.splice.driver.memory.MemoryDriverFactory;

/**
 * Memory driver context
 */
@Getter
@Builder
public class MemoryDriverContext implements DriverContext {

    private final DriverConfig config;

    private final MemoryStore store;

    /**
     * Operation handler registry (injected at runtime)
     */
    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public String getDriverType() {
        return MemoryDriverFactory.DRIVER_TYPE;
    }
}
