package win.ixuni.splice.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.splice.core.exception.ObjectNotFoundException;
import win.ixuni.splice.core.model.ObjectData;
import win.ixuni.splice.core.model.StoredObject;
import win.ixuni.splice.core.operation.object.GetObjectOperation;
import win.ixuni.splice.core.util.ByteBuffers;
import win.ixuni.splice.driver.memory.context.MemoryStore;
import win.ixuni.splice.driver.memory.handler.AbstractMemoryHandler;

/**
 * Memory GetObject handler
 */
public class MemoryGetObjectHandler extends AbstractMemoryHandler<GetObjectOperation, ObjectData> {

    @Override
    protected Mono<ObjectData> doHandle(GetObjectOperation operation, MemoryStore store) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return requireBucket(store, bucketName).then(Mono.defer(() -> {
            MemoryStore.ObjectData obj = store.getObjects().get(store.objectKey(bucketName, key));
            if (obj == null) {
                return Mono.error(new ObjectNotFoundException(bucketName, key));
            }

            StoredObject metadata = StoredObject.builder()
                    .bucketName(bucketName)
                    .key(key)
                    .size((long) obj.getData().length)
                    .etag(obj.getEtag())
                    .contentType(obj.getContentType())
                    .lastModified(obj.getLastModified())
                    .build();

            return Mono.just(ObjectData.builder()
                    .metadata(metadata)
                    .content(ByteBuffers.of(obj.getData()))
                    .build());
        }));
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}
