package win.ixuni.splice.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.splice.core.model.StoredObject;
import win.ixuni.splice.core.operation.object.PutObjectOperation;
import win.ixuni.splice.core.util.ByteBuffers;
import win.ixuni.splice.driver.memory.context.MemoryStore;
import win.ixuni.splice.driver.memory.handler.AbstractMemoryHandler;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;

/**
 * Memory PutObject handler
 */
public class MemoryPutObjectHandler extends AbstractMemoryHandler<PutObjectOperation, StoredObject> {

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    @Override
    protected Mono<StoredObject> doHandle(PutObjectOperation operation, MemoryStore store) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return requireBucket(store, bucketName)
                .then(ByteBuffers.collect(operation.getContent()))
                .map(data -> {
                    String etag = "\"" + md5Hex(data) + "\"";
                    Instant now = Instant.now();
                    String contentType = operation.getContentType() != null
                            ? operation.getContentType()
                            : DEFAULT_CONTENT_TYPE;

                    store.getObjects().put(store.objectKey(bucketName, key), MemoryStore.ObjectData.builder()
                            .bucketName(bucketName)
                            .key(key)
                            .data(data)
                            .etag(etag)
                            .contentType(contentType)
                            .lastModified(now)
                            .build());

                    return StoredObject.builder()
                            .bucketName(bucketName)
                            .key(key)
                            .size((long) data.length)
                            .etag(etag)
                            .lastModified(now)
                            .contentType(contentType)
                            .build();
                });
    }

    private String md5Hex(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(data);
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}
