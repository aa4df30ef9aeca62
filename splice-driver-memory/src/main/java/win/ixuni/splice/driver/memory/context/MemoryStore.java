package win.ixuni.splice.driver.memory.context;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backing data of an in-memory store
 * <p>
 * Outlives the driver instances that use it: the factory keeps one store per driver name, so a driver
 * created for a single merge sees the data left by earlier ones.
 */
@Getter
public class MemoryStore {

    /**
     * bucketName -> creation time
     */
    private final Map<String, Instant> buckets = new ConcurrentHashMap<>();

    /**
     * bucketName/key -> object
     */
    private final Map<String, ObjectData> objects = new ConcurrentHashMap<>();

    public String objectKey(String bucketName, String key) {
        return bucketName + "/" + key;
    }

    @Getter
    @Builder
    public static class ObjectData {
        private final String bucketName;
        private final String key;
        private final byte[] data;
        private final String etag;
        private final String contentType;
        private final Instant lastModified;
    }
}
