package win.ixuni.splice.core.model;

import lombok.Builder;
import lombok.Data;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;

/**
 * Object metadata together with its content stream
 */
@Data
@Builder
public class ObjectData {

    private StoredObject metadata;

    /**
     * Object content stream (reactive)
     */
    private Flux<ByteBuffer> content;
}
