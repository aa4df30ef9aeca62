package win.ixuni.splice.core.operation.bucket;

import lombok.Value;
import win.ixuni.splice.core.operation.BucketScoped;
import win.ixuni.splice.core.operation.Operation;

/**
 * Check whether a bucket exists
 * <p>
 * Handlers answer {@code false} for a missing bucket and let every other store error through.
 */
@Value
public class BucketExistsOperation implements Operation<Boolean>, BucketScoped {

    String bucketName;
}
