package win.ixuni.splice.core.operation.object;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.splice.core.model.StoredObject;
import win.ixuni.splice.core.operation.ObjectScoped;
import win.ixuni.splice.core.operation.Operation;

import java.nio.ByteBuffer;

/**
 * Put object operation, replaces any object already stored under the key
 */
@Value
@Builder
public class PutObjectOperation implements Operation<StoredObject>, ObjectScoped {

    String bucketName;

    String key;

    /**
     * Object content stream
     */
    Flux<ByteBuffer> content;

    String contentType;
}
