package win.ixuni.splice.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.splice.core.operation.bucket.CreateBucketOperation;
import win.ixuni.splice.driver.memory.context.MemoryStore;
import win.ixuni.splice.driver.memory.handler.AbstractMemoryHandler;

import java.time.Instant;

/**
 * Memory bucket creation; an existing bucket is left as is
 */
public class MemoryCreateBucketHandler extends AbstractMemoryHandler<CreateBucketOperation, Void> {

    @Override
    protected Mono<Void> doHandle(CreateBucketOperation operation, MemoryStore store) {
        return Mono.fromRunnable(() -> store.getBuckets().putIfAbsent(operation.getBucketName(), Instant.now()));
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }
}
