package win.ixuni.splice.core.operation.bucket;

import lombok.Value;
import win.ixuni.splice.core.operation.BucketScoped;
import win.ixuni.splice.core.operation.Operation;

/**
 * Create a bucket (idempotent)
 */
@Value
public class CreateBucketOperation implements Operation<Void>, BucketScoped {

    String bucketName;
}
