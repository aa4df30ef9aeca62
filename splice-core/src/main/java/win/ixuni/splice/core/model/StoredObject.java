package win.ixuni.splice.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored object metadata
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredObject {

    /**
     * Owning bucket
     */
    private String bucketName;

    /**
     * Full object key
     */
    private String key;

    /**
     * Object size in bytes
     */
    private Long size;

    /**
     * ETag (usually the MD5 of the content)
     */
    private String etag;

    private Instant lastModified;

    private String contentType;
}
