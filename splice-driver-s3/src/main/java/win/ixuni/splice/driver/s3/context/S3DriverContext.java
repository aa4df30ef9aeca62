package win.ixuni.splice.driver.s3.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import win.ixuni.splice.core.config.DriverConfig;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.OperationHandlerRegistry;
import win.ixuni.splice.driver.s3.S3DriverFactory;

/**
 * S3 driver context
 * <p>
 * Holds the AWS S3 async client and configuration
 */
@Getter
@Builder
public class S3DriverContext implements DriverContext {

    private final DriverConfig config;

    private final S3AsyncClient s3Client;

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
        return S3DriverFactory.DRIVER_TYPE;
    }
}
