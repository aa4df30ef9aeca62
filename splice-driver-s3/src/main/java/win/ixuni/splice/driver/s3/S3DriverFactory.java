package win.ixuni.splice.driver.s3;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.splice.core.config.DriverConfig;
import win.ixuni.splice.core.driver.DriverFactory;
import win.ixuni.splice.core.driver.StorageDriver;

/**
 * S3 driver factory
 * <p>
 * Every call builds a new client; callers release it through {@link StorageDriver#shutdown()}.
 */
@Slf4j
@Component
public class S3DriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "s3";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        log.debug("Creating S3 driver instance: {}", config.getName());
        return new S3StorageDriver(config);
    }

    @Override
    public String getDescription() {
        return "S3 driver for AWS S3, MinIO, and other S3-compatible backends";
    }
}
