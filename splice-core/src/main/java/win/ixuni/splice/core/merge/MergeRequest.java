package win.ixuni.splice.core.merge;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one merge call
 */
@Value
@Builder(toBuilder = true)
public class MergeRequest {

    /**
     * Bucket holding both the inputs and the merged object
     */
    String bucketName;

    /**
     * Key of the merged object; its extension selects which inputs contribute content
     */
    String newObjectKey;

    /**
     * Objects whose short name starts with this are merged and removed
     */
    String objectsToMergeInitialName;

    /**
     * Prefix the inputs live under, empty for the bucket root
     */
    @Builder.Default
    String objectsToMergePrefix = "";

    /**
     * Remove the job marker objects under the prefix once the merged object is written
     */
    @Builder.Default
    boolean deleteSuccessFiles = true;

    public static MergeRequest of(String bucketName, String newObjectKey, String objectsToMergeInitialName) {
        return builder()
                .bucketName(bucketName)
                .newObjectKey(newObjectKey)
                .objectsToMergeInitialName(objectsToMergeInitialName)
                .build();
    }
}
