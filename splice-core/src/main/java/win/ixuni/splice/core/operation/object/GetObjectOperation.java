package win.ixuni.splice.core.operation.object;

import lombok.Value;
import win.ixuni.splice.core.model.ObjectData;
import win.ixuni.splice.core.operation.ObjectScoped;
import win.ixuni.splice.core.operation.Operation;

/**
 * Get object operation (metadata and content stream)
 */
@Value
public class GetObjectOperation implements Operation<ObjectData>, ObjectScoped {

    String bucketName;

    String key;
}
