package win.ixuni.splice.driver.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.splice.core.config.DriverConfig;
import win.ixuni.splice.core.driver.DriverFactory;
import win.ixuni.splice.driver.memory.context.MemoryStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory driver factory
 * <p>
 * Keeps one {@link MemoryStore} per driver name for its own lifetime.
 */
@Slf4j
@Component
public class MemoryDriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "memory";

    private final Map<String, MemoryStore> stores = new ConcurrentHashMap<>();

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public MemoryStorageDriver createDriver(DriverConfig config) {
        log.debug("Creating memory driver instance: {}", config.getName());
        MemoryStore store = stores.computeIfAbsent(config.getName(), name -> {
            log.info("Allocating in-memory store '{}'", name);
            return new MemoryStore();
        });
        return new MemoryStorageDriver(config, store);
    }

    public Optional<MemoryStore> findStore(String driverName) {
        return Optional.ofNullable(stores.get(driverName));
    }

    @Override
    public String getDescription() {
        return "In-memory storage driver for tests and local runs";
    }
}
