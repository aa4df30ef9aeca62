package win.ixuni.splice.core.driver;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.splice.core.exception.DriverNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Driver factory loader
 * <p>
 * Uses Java SPI (ServiceLoader) to discover DriverFactory implementations on the classpath, for embedding
 * the merger without a Spring context. Driver modules declare their factory in
 * {@code META-INF/services/win.ixuni.splice.core.driver.DriverFactory}.
 */
@Slf4j
public final class DriverFactoryLoader {

    private DriverFactoryLoader() {
    }

    public static List<DriverFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static List<DriverFactory> load(ClassLoader classLoader) {
        List<DriverFactory> factories = new ArrayList<>();
        for (DriverFactory factory : ServiceLoader.load(DriverFactory.class, classLoader)) {
            factories.add(factory);
            log.debug("Discovered driver factory via SPI: {} - {}",
                    factory.getDriverType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No DriverFactory implementations found via SPI");
        }
        return Collections.unmodifiableList(factories);
    }

    /**
     * Find the factory for a driver type among the given factories
     *
     * @throws DriverNotFoundException when none matches
     */
    public static DriverFactory find(List<? extends DriverFactory> factories, String driverType) {
        return factories.stream()
                .filter(factory -> factory.getDriverType().equals(driverType))
                .findFirst()
                .orElseThrow(() -> new DriverNotFoundException(driverType));
    }

    /**
     * Find the factory for a driver type on the classpath
     */
    public static DriverFactory find(String driverType) {
        return find(load(), driverType);
    }
}
