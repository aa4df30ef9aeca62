package win.ixuni.splice.core.util;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * Helpers for reactive byte streams
 */
public final class ByteBuffers {

    private ByteBuffers() {
    }

    /**
     * Collect a content stream into one array; an empty stream yields an empty array
     */
    public static Mono<byte[]> collect(Flux<ByteBuffer> content) {
        return content
                .reduceWith(ByteArrayOutputStream::new, (baos, buffer) -> {
                    byte[] bytes = new byte[buffer.remaining()];
                    buffer.get(bytes);
                    baos.write(bytes, 0, bytes.length);
                    return baos;
                })
                .map(ByteArrayOutputStream::toByteArray);
    }

    public static Flux<ByteBuffer> of(byte[] data) {
        return Flux.just(ByteBuffer.wrap(data));
    }
}
