package win.ixuni.splice.core.merge;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a completed merge
 */
@Value
@Builder
public class MergeResult {

    String bucketName;

    /**
     * Key the merged object was written to
     */
    String objectKey;

    /**
     * Normalized prefix the inputs were listed from
     */
    String prefix;

    /**
     * Inputs whose content went into the merged object, in merge order
     */
    List<String> mergedKeys;

    /**
     * Every input removed, including name matches whose extension differed
     */
    List<String> deletedKeys;

    /**
     * Marker keys a delete was issued for (empty when marker deletion was disabled)
     */
    List<String> markerKeys;

    /**
     * Size in bytes of the merged object
     */
    long size;
}
