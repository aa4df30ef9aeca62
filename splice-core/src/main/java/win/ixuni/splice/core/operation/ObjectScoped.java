package win.ixuni.splice.core.operation;

/**
 * Operation addressed to a single object
 */
public interface ObjectScoped extends BucketScoped {

    String getKey();
}
