package win.ixuni.splice.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.splice.core.operation.object.DeleteObjectOperation;
import win.ixuni.splice.driver.memory.context.MemoryStore;
import win.ixuni.splice.driver.memory.handler.AbstractMemoryHandler;

/**
 * Memory DeleteObject handler
 */
public class MemoryDeleteObjectHandler extends AbstractMemoryHandler<DeleteObjectOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteObjectOperation operation, MemoryStore store) {
        // deleting a missing key is not an error
        return requireBucket(store, operation.getBucketName())
                .then(Mono.fromRunnable(() -> store.getObjects()
                        .remove(store.objectKey(operation.getBucketName(), operation.getKey()))));
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}
