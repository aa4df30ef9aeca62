package win.ixuni.splice.core.operation;

/**
 * Operation addressed to a single bucket
 */
public interface BucketScoped {

    String getBucketName();
}
