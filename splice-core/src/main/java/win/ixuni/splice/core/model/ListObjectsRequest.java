package win.ixuni.splice.core.model;

import lombok.Builder;
import lombok.Data;

/**
 * Parameters for a single listing page
 */
@Data
@Builder(toBuilder = true)
public class ListObjectsRequest {

    private String bucketName;

    /**
     * Key prefix filter, empty lists the whole bucket
     */
    @Builder.Default
    private String prefix = "";

    /**
     * Token returned by the previous page, null for the first page
     */
    private String continuationToken;

    /**
     * Maximum number of keys in one page
     */
    @Builder.Default
    private Integer maxKeys = 1000;
}
