package win.ixuni.splice.core.merge;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.splice.core.config.SpliceProperties;
import win.ixuni.splice.core.driver.StorageDriver;
import win.ixuni.splice.core.exception.BucketNotFoundException;
import win.ixuni.splice.core.exception.InvalidArgumentException;
import win.ixuni.splice.core.exception.MalformedContentException;
import win.ixuni.splice.core.exception.NoObjectsToMergeException;
import win.ixuni.splice.core.exception.PrefixNotFoundException;
import win.ixuni.splice.core.model.ListObjectsRequest;
import win.ixuni.splice.core.model.ListObjectsResult;
import win.ixuni.splice.core.operation.bucket.BucketExistsOperation;
import win.ixuni.splice.core.operation.object.DeleteObjectOperation;
import win.ixuni.splice.core.operation.object.GetObjectOperation;
import win.ixuni.splice.core.operation.object.ListObjectsOperation;
import win.ixuni.splice.core.operation.object.PutObjectOperation;
import win.ixuni.splice.core.util.ByteBuffers;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Merges the objects under a prefix into a single object
 * <p>
 * Steps, each store call completing before the next one starts:
 * <ol>
 *   <li>validate the bucket name, the bucket's existence and the new object key</li>
 *   <li>list every object under the normalized prefix, failing when there is none</li>
 *   <li>for each object whose short name starts with the initial name: append its lines to the merged
 *       text when the name also ends with the new key's extension, then delete it</li>
 *   <li>fail when no object matched the initial name</li>
 *   <li>upload the merged text, without its final line break, to the new key</li>
 *   <li>optionally delete the job marker objects under the prefix</li>
 * </ol>
 * Nothing is rolled back: inputs deleted before a failure stay deleted.
 */
@Slf4j
public class ObjectsMerger {

    private final DriverSource driverSource;
    private final List<String> markerFiles;
    private final int listPageSize;

    public ObjectsMerger(DriverSource driverSource) {
        this(driverSource, MergeConstants.DEFAULT_MARKER_FILES, MergeConstants.DEFAULT_LIST_PAGE_SIZE);
    }

    public ObjectsMerger(DriverSource driverSource, SpliceProperties.MergeConfig config) {
        this(driverSource, config.getMarkerFiles(), config.getListPageSize());
    }

    public ObjectsMerger(DriverSource driverSource, List<String> markerFiles, int listPageSize) {
        if (listPageSize <= 0) {
            throw new InvalidArgumentException("List page size must be positive: " + listPageSize);
        }
        this.driverSource = driverSource;
        this.markerFiles = List.copyOf(markerFiles);
        this.listPageSize = listPageSize;
    }

    /**
     * Blocking merge with the bucket root as prefix and marker deletion enabled
     */
    public MergeResult mergeAndWait(String bucketName, String newObjectKey, String objectsToMergeInitialName) {
        return mergeAndWait(bucketName, newObjectKey, objectsToMergeInitialName, "", true);
    }

    public MergeResult mergeAndWait(String bucketName, String newObjectKey, String objectsToMergeInitialName,
                                    String objectsToMergePrefix) {
        return mergeAndWait(bucketName, newObjectKey, objectsToMergeInitialName, objectsToMergePrefix, true);
    }

    public MergeResult mergeAndWait(String bucketName, String newObjectKey, String objectsToMergeInitialName,
                                    String objectsToMergePrefix, boolean deleteSuccessFiles) {
        return merge(MergeRequest.builder()
                .bucketName(bucketName)
                .newObjectKey(newObjectKey)
                .objectsToMergeInitialName(objectsToMergeInitialName)
                .objectsToMergePrefix(objectsToMergePrefix)
                .deleteSuccessFiles(deleteSuccessFiles)
                .build())
                .block();
    }

    /**
     * Merge with a driver obtained from the driver source for this call only
     */
    public Mono<MergeResult> merge(MergeRequest request) {
        if (!ObjectKeys.isInformed(request.getBucketName())) {
            return Mono.error(new InvalidArgumentException("Bucket not informed!"));
        }

        return Mono.usingWhen(
                driverSource.acquire(),
                driver -> merge(driver, request),
                driverSource::release,
                (driver, error) -> driverSource.release(driver),
                driverSource::release);
    }

    private Mono<MergeResult> merge(StorageDriver driver, MergeRequest request) {
        return checkBucketExists(driver, request.getBucketName())
                .then(Mono.fromCallable(() -> openContext(request)))
                .flatMap(ctx -> {
                    log.info("Merging objects starting with '{}' under {}/{} into {}",
                            ctx.getInitialName(), ctx.getBucketName(), ctx.getPrefix(),
                            ctx.getRequest().getNewObjectKey());

                    return listPrefix(driver, ctx)
                            .flatMap(candidates -> mergeCandidates(driver, ctx, candidates))
                            .then(Mono.defer(() -> upload(driver, ctx)))
                            .flatMap(size -> deleteMarkers(driver, ctx).thenReturn(size))
                            .map(ctx::toResult);
                })
                .doOnNext(result -> log.info("Merged {} objects ({} deleted) into {}/{} ({} bytes)",
                        result.getMergedKeys().size(), result.getDeletedKeys().size(),
                        result.getBucketName(), result.getObjectKey(), result.getSize()));
    }

    private Mono<Void> checkBucketExists(StorageDriver driver, String bucketName) {
        return driver.execute(new BucketExistsOperation(bucketName))
                .flatMap(exists -> exists
                        ? Mono.<Void>empty()
                        : Mono.error(new BucketNotFoundException(bucketName)));
    }

    private MergeContext openContext(MergeRequest request) {
        if (!ObjectKeys.isInformed(request.getNewObjectKey())) {
            throw new InvalidArgumentException("Object key not informed!");
        }
        if (request.getObjectsToMergeInitialName() == null) {
            throw new InvalidArgumentException("Objects to merge initial name not informed!");
        }
        return new MergeContext(request);
    }

    /**
     * All objects under the prefix, following continuation tokens across pages
     */
    private Mono<List<CandidateObject>> listPrefix(StorageDriver driver, MergeContext ctx) {
        ListObjectsRequest firstPage = ListObjectsRequest.builder()
                .bucketName(ctx.getBucketName())
                .prefix(ctx.getPrefix())
                .maxKeys(listPageSize)
                .build();

        return listPage(driver, firstPage)
                .expand(page -> page.isTruncated() && page.getNextContinuationToken() != null
                        ? listPage(driver, firstPage.toBuilder()
                                .continuationToken(page.getNextContinuationToken())
                                .build())
                        : Mono.empty())
                .concatMapIterable(ListObjectsResult::getContents)
                .map(CandidateObject::of)
                .collectList()
                .flatMap(candidates -> candidates.isEmpty()
                        ? Mono.error(new PrefixNotFoundException(ctx.getBucketName(), ctx.getPrefix()))
                        : Mono.just(candidates));
    }

    private Mono<ListObjectsResult> listPage(StorageDriver driver, ListObjectsRequest request) {
        return driver.execute(new ListObjectsOperation(request));
    }

    private Mono<Void> mergeCandidates(StorageDriver driver, MergeContext ctx, List<CandidateObject> candidates) {
        return Flux.fromIterable(candidates)
                .filter(candidate -> candidate.startsWith(ctx.getInitialName()))
                .doOnNext(candidate -> ctx.qualified())
                .concatMap(candidate -> mergeCandidate(driver, ctx, candidate))
                .then(Mono.defer(() -> ctx.getQualifyingCount() == 0
                        ? Mono.error(new NoObjectsToMergeException(ctx.getPrefix(), ctx.getInitialName()))
                        : Mono.empty()));
    }

    private Mono<Void> mergeCandidate(StorageDriver driver, MergeContext ctx, CandidateObject candidate) {
        Mono<Void> read = candidate.endsWith(ctx.getExtension())
                ? readInto(driver, ctx, candidate)
                : Mono.fromRunnable(() -> log.debug("Skipping content of {}: extension is not '{}'",
                        candidate.getKey(), ctx.getExtension()));

        return read
                .then(driver.execute(new DeleteObjectOperation(ctx.getBucketName(), candidate.getKey())))
                .then(Mono.fromRunnable(() -> ctx.deleted(candidate.getKey())));
    }

    private Mono<Void> readInto(StorageDriver driver, MergeContext ctx, CandidateObject candidate) {
        return driver.execute(new GetObjectOperation(ctx.getBucketName(), candidate.getKey()))
                .flatMap(data -> ByteBuffers.collect(data.getContent()))
                .map(bytes -> {
                    log.debug("Merging {} ({} bytes)", candidate.getKey(), bytes.length);
                    return decode(ctx, candidate, bytes);
                })
                .doOnNext(text -> ctx.appendLines(candidate.getKey(), text))
                .then();
    }

    /**
     * Strict UTF-8 decoding; a malformed body fails the merge before the object is deleted
     */
    private String decode(MergeContext ctx, CandidateObject candidate, byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedContentException(ctx.getBucketName(), candidate.getKey(), e);
        }
    }

    private Mono<Long> upload(StorageDriver driver, MergeContext ctx) {
        byte[] content = ctx.mergedContent();
        return driver.execute(PutObjectOperation.builder()
                        .bucketName(ctx.getBucketName())
                        .key(ctx.getRequest().getNewObjectKey())
                        .content(ByteBuffers.of(content))
                        .contentType(MergeConstants.MERGED_CONTENT_TYPE)
                        .build())
                .thenReturn((long) content.length);
    }

    private Mono<Void> deleteMarkers(StorageDriver driver, MergeContext ctx) {
        if (!ctx.getRequest().isDeleteSuccessFiles()) {
            return Mono.empty();
        }
        return Flux.fromIterable(markerFiles)
                .map(name -> ctx.getPrefix() + name)
                .concatMap(key -> driver.execute(new DeleteObjectOperation(ctx.getBucketName(), key))
                        .then(Mono.fromRunnable(() -> ctx.markerDeleted(key))))
                .then();
    }
}
