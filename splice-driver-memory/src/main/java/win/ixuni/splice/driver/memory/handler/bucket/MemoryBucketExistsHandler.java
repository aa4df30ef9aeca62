package win.ixuni.splice.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.splice.core.operation.bucket.BucketExistsOperation;
import win.ixuni.splice.driver.memory.context.MemoryStore;
import win.ixuni.splice.driver.memory.handler.AbstractMemoryHandler;

/**
 * Memory bucket existence check
 */
public class MemoryBucketExistsHandler extends AbstractMemoryHandler<BucketExistsOperation, Boolean> {

    @Override
    protected Mono<Boolean> doHandle(BucketExistsOperation operation, MemoryStore store) {
        return Mono.just(store.getBuckets().containsKey(operation.getBucketName()));
    }

    @Override
    public Class<BucketExistsOperation> getOperationType() {
        return BucketExistsOperation.class;
    }
}
