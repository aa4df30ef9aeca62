package win.ixuni.splice.core.merge;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.splice.core.config.DriverConfig;
import win.ixuni.splice.core.driver.DriverFactory;
import win.ixuni.splice.core.driver.DriverFactoryLoader;
import win.ixuni.splice.core.driver.StorageDriver;

/**
 * Supplies the store driver for one merge call and takes it back afterwards
 * <p>
 * {@link #release(StorageDriver)} is called exactly once for every driver handed out, on success, error
 * and cancellation alike.
 */
public interface DriverSource {

    Mono<StorageDriver> acquire();

    Mono<Void> release(StorageDriver driver);

    /**
     * Lend an existing driver; the caller keeps ownership and shuts it down itself
     */
    static DriverSource shared(StorageDriver driver) {
        return new DriverSource() {
            @Override
            public Mono<StorageDriver> acquire() {
                return Mono.just(driver);
            }

            @Override
            public Mono<Void> release(StorageDriver ignored) {
                return Mono.empty();
            }
        };
    }

    /**
     * Create a fresh driver for every call and shut it down when the call ends
     */
    static DriverSource perCall(DriverFactory factory, DriverConfig config) {
        return new PerCallDriverSource(factory, config);
    }

    /**
     * Like {@link #perCall(DriverFactory, DriverConfig)}, with the factory discovered through SPI
     */
    static DriverSource perCall(DriverConfig config) {
        return perCall(DriverFactoryLoader.find(config.getType()), config);
    }

    @Slf4j
    final class PerCallDriverSource implements DriverSource {

        private final DriverFactory factory;
        private final DriverConfig config;

        private PerCallDriverSource(DriverFactory factory, DriverConfig config) {
            this.factory = factory;
            this.config = config;
        }

        @Override
        public Mono<StorageDriver> acquire() {
            return Mono.fromCallable(() -> factory.createDriver(config))
                    .flatMap(driver -> driver.initialize()
                            .thenReturn(driver)
                            .onErrorResume(e -> driver.shutdown().then(Mono.error(e))));
        }

        @Override
        public Mono<Void> release(StorageDriver driver) {
            return driver.shutdown()
                    .doOnSuccess(v -> log.debug("Released driver '{}'", driver.getDriverName()));
        }
    }
}
