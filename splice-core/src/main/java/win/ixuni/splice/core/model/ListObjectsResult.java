package win.ixuni.splice.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a prefix listing, keys in store order
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListObjectsResult {

    private String bucketName;

    private String prefix;

    /**
     * Objects on this page
     */
    @Builder.Default
    private List<StoredObject> contents = List.of();

    /**
     * Whether more pages follow
     */
    private boolean truncated;

    /**
     * Token to pass in the next request when {@link #truncated} is set
     */
    private String nextContinuationToken;
}
