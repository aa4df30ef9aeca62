package win.ixuni.splice.core.operation.object;

import lombok.Value;
import win.ixuni.splice.core.operation.ObjectScoped;
import win.ixuni.splice.core.operation.Operation;

/**
 * Delete object operation
 * <p>
 * Deleting a key that does not exist completes normally.
 */
@Value
public class DeleteObjectOperation implements Operation<Void>, ObjectScoped {

    String bucketName;

    String key;
}
