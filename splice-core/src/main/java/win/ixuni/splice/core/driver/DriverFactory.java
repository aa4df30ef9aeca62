package win.ixuni.splice.core.driver;

import win.ixuni.splice.core.config.DriverConfig;

/**
 * Driver factory interface
 * <p>
 * Each driver type provides a factory that creates driver instances from configuration. Factories are
 * discovered as Spring beans or through {@link DriverFactoryLoader}.
 */
public interface DriverFactory {

    /**
     * Get the driver type supported by this factory
     *
     * @return driver type identifier (e.g. "memory", "s3")
     */
    String getDriverType();

    /**
     * Create a driver instance from configuration
     *
     * @param config driver configuration
     * @return driver instance
     */
    StorageDriver createDriver(DriverConfig config);

    default String getDescription() {
        return getDriverType() + " storage driver";
    }
}
