package win.ixuni.splice.core.merge;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static win.ixuni.splice.core.merge.MergeConstants.LINE_BREAK;

/**
 * State of one running merge
 * <p>
 * Created per call and confined to it, so a single {@link ObjectsMerger} can serve concurrent requests.
 */
@Getter
class MergeContext {

    private final MergeRequest request;
    private final String prefix;
    private final String extension;

    private final StringBuilder accumulator = new StringBuilder();
    private final List<String> mergedKeys = new ArrayList<>();
    private final List<String> deletedKeys = new ArrayList<>();
    private final List<String> markerKeys = new ArrayList<>();
    private int qualifyingCount;

    MergeContext(MergeRequest request) {
        this.request = request;
        this.prefix = ObjectKeys.normalizePrefix(request.getObjectsToMergePrefix());
        this.extension = ObjectKeys.extractExtension(request.getNewObjectKey());
    }

    String getBucketName() {
        return request.getBucketName();
    }

    String getInitialName() {
        return request.getObjectsToMergeInitialName();
    }

    void qualified() {
        qualifyingCount++;
    }

    void appendLines(String key, String text) {
        text.lines().forEach(line -> accumulator.append(line).append(LINE_BREAK));
        mergedKeys.add(key);
    }

    void deleted(String key) {
        deletedKeys.add(key);
    }

    void markerDeleted(String key) {
        markerKeys.add(key);
    }

    /**
     * Accumulated text without the line break that follows the last merged line
     */
    byte[] mergedContent() {
        int length = accumulator.length();
        if (length > 0 && accumulator.charAt(length - 1) == LINE_BREAK.charAt(0)) {
            length--;
        }
        return accumulator.substring(0, length).getBytes(StandardCharsets.UTF_8);
    }

    MergeResult toResult(long size) {
        return MergeResult.builder()
                .bucketName(getBucketName())
                .objectKey(request.getNewObjectKey())
                .prefix(prefix)
                .mergedKeys(List.copyOf(mergedKeys))
                .deletedKeys(List.copyOf(deletedKeys))
                .markerKeys(List.copyOf(markerKeys))
                .size(size)
                .build();
    }
}
