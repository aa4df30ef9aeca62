package win.ixuni.splice.driver.memory.handler.object;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.splice.core.model.ListObjectsRequest;
import win.ixuni.splice.core.model.ListObjectsResult;
import win.ixuni.splice.core.model.StoredObject;
import win.ixuni.splice.core.operation.object.ListObjectsOperation;
import win.ixuni.splice.driver.memory.context.MemoryStore;
import win.ixuni.splice.driver.memory.handler.AbstractMemoryHandler;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Memory object listing
 * <p>
 * Keys come back in UTF-8 binary order, as S3 lists them. The continuation token is the last key
 * of the previous page.
 */
@Slf4j
public class MemoryListObjectsHandler extends AbstractMemoryHandler<ListObjectsOperation, ListObjectsResult> {

    static final Comparator<String> KEY_ORDER = (a, b) ->
            Arrays.compareUnsigned(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    @Override
    protected Mono<ListObjectsResult> doHandle(ListObjectsOperation operation, MemoryStore store) {
        ListObjectsRequest request = operation.getRequest();
        String bucketName = request.getBucketName();
        String prefix = request.getPrefix() != null ? request.getPrefix() : "";
        String after = request.getContinuationToken();
        int maxKeys = request.getMaxKeys() != null ? request.getMaxKeys() : 1000;

        return requireBucket(store, bucketName).then(Mono.fromCallable(() -> {
            List<StoredObject> matching = store.getObjects().values().stream()
                    .filter(obj -> obj.getBucketName().equals(bucketName))
                    .filter(obj -> obj.getKey().startsWith(prefix))
                    .filter(obj -> after == null || KEY_ORDER.compare(obj.getKey(), after) > 0)
                    .sorted(Comparator.comparing(MemoryStore.ObjectData::getKey, KEY_ORDER))
                    .map(obj -> StoredObject.builder()
                            .bucketName(bucketName)
                            .key(obj.getKey())
                            .size((long) obj.getData().length)
                            .etag(obj.getEtag())
                            .lastModified(obj.getLastModified())
                            .contentType(obj.getContentType())
                            .build())
                    .toList();

            boolean truncated = matching.size() > maxKeys;
            List<StoredObject> page = matching.subList(0, Math.min(maxKeys, matching.size()));

            log.debug("ListObjects: bucket={}, prefix={}, found {} objects (truncated: {})",
                    bucketName, prefix, page.size(), truncated);

            return ListObjectsResult.builder()
                    .bucketName(bucketName)
                    .prefix(prefix)
                    .contents(page)
                    .truncated(truncated)
                    .nextContinuationToken(truncated ? page.get(page.size() - 1).getKey() : null)
                    .build();
        }));
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }
}
