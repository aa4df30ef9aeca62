package win.ixuni.splice.driver.memory;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.splice.core.config.DriverConfig;
import win.ixuni.splice.core.driver.AbstractStorageDriver;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.bucket.CreateBucketOperation;
import win.ixuni.splice.driver.memory.context.MemoryDriverContext;
import win.ixuni.splice.driver.memory.context.MemoryStore;
import win.ixuni.splice.driver.memory.handler.bucket.MemoryBucketExistsHandler;
import win.ixuni.splice.driver.memory.handler.bucket.MemoryCreateBucketHandler;
import win.ixuni.splice.driver.memory.handler.object.MemoryDeleteObjectHandler;
import win.ixuni.splice.driver.memory.handler.object.MemoryGetObjectHandler;
import win.ixuni.splice.driver.memory.handler.object.MemoryListObjectsHandler;
import win.ixuni.splice.driver.memory.handler.object.MemoryPutObjectHandler;

/**
 * In-memory storage driver
 * <p>
 * Used by tests and for local runs without an object store. Buckets listed in the {@code buckets}
 * property are created on initialization.
 */
@Slf4j
public class MemoryStorageDriver extends AbstractStorageDriver {

    private final MemoryDriverContext driverContext;

    public MemoryStorageDriver(DriverConfig config, MemoryStore store) {
        super(config);
        this.driverContext = MemoryDriverContext.builder()
                .config(config)
                .store(store)
                .build();
        registerHandlers();
        bindContext();
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new MemoryBucketExistsHandler());
        getHandlerRegistry().register(new MemoryCreateBucketHandler());

        getHandlerRegistry().register(new MemoryListObjectsHandler());
        getHandlerRegistry().register(new MemoryGetObjectHandler());
        getHandlerRegistry().register(new MemoryPutObjectHandler());
        getHandlerRegistry().register(new MemoryDeleteObjectHandler());

        log.debug("Registered {} operation handlers for memory driver", getHandlerRegistry().size());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public String getDriverType() {
        return MemoryDriverFactory.DRIVER_TYPE;
    }

    public MemoryStore getStore() {
        return driverContext.getStore();
    }

    @Override
    public Mono<Void> initialize() {
        log.debug("Initializing memory storage driver: {}", getDriverName());
        return Flux.fromIterable(config.getList("buckets"))
                .concatMap(bucket -> execute(new CreateBucketOperation(bucket)))
                .then();
    }

    @Override
    public Mono<Void> shutdown() {
        // the store belongs to the factory and keeps its data
        log.debug("Shutting down memory storage driver: {}", getDriverName());
        return Mono.empty();
    }
}
