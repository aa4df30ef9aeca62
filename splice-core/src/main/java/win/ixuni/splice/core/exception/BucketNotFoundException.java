package win.ixuni.splice.core.exception;

import lombok.Getter;

/**
 * Bucket not found exception
 */
@Getter
public class BucketNotFoundException extends SpliceException {

    private final String bucketName;

    public BucketNotFoundException(String bucketName) {
        super("NoSuchBucket", "Bucket not found! (" + bucketName + ")");
        this.bucketName = bucketName;
    }
}
