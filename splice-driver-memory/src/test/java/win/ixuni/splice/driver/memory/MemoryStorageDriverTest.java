package win.ixuni.splice.driver.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.splice.core.config.DriverConfig;
import win.ixuni.splice.core.exception.BucketNotFoundException;
import win.ixuni.splice.core.exception.ObjectNotFoundException;
import win.ixuni.splice.core.model.ListObjectsRequest;
import win.ixuni.splice.core.model.ListObjectsResult;
import win.ixuni.splice.core.model.ObjectData;
import win.ixuni.splice.core.model.StoredObject;
import win.ixuni.splice.core.operation.bucket.BucketExistsOperation;
import win.ixuni.splice.core.operation.bucket.CreateBucketOperation;
import win.ixuni.splice.core.operation.object.DeleteObjectOperation;
import win.ixuni.splice.core.operation.object.GetObjectOperation;
import win.ixuni.splice.core.operation.object.ListObjectsOperation;
import win.ixuni.splice.core.operation.object.PutObjectOperation;
import win.ixuni.splice.core.util.ByteBuffers;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStorageDriverTest {

    private static final String BUCKET = "memory-test-bucket";

    private MemoryDriverFactory factory;
    private MemoryStorageDriver driver;

    @BeforeEach
    void setUp() {
        factory = new MemoryDriverFactory();
        driver = factory.createDriver(DriverConfig.of("mem", "memory", Map.of()));
        driver.execute(new CreateBucketOperation(BUCKET)).block();
    }

    private void put(String key, String content) {
        driver.execute(PutObjectOperation.builder()
                .bucketName(BUCKET)
                .key(key)
                .content(ByteBuffers.of(content.getBytes(StandardCharsets.UTF_8)))
                .build()).block();
    }

    private String get(String key) {
        ObjectData data = driver.execute(new GetObjectOperation(BUCKET, key)).block();
        return new String(ByteBuffers.collect(data.getContent()).block(), StandardCharsets.UTF_8);
    }

    private ListObjectsResult list(String prefix, int maxKeys, String token) {
        return driver.execute(new ListObjectsOperation(ListObjectsRequest.builder()
                .bucketName(BUCKET)
                .prefix(prefix)
                .maxKeys(maxKeys)
                .continuationToken(token)
                .build())).block();
    }

    @Test
    void bucketExists() {
        assertTrue(driver.execute(new BucketExistsOperation(BUCKET)).block());
        assertFalse(driver.execute(new BucketExistsOperation("missing")).block());
    }

    @Test
    void putThenGet() {
        put("dir/a.txt", "hello");

        assertEquals("hello", get("dir/a.txt"));
    }

    @Test
    @DisplayName("Put overwrites an existing object and defaults the content type")
    void put_overwrites() {
        put("a.txt", "first");
        StoredObject stored = driver.execute(PutObjectOperation.builder()
                .bucketName(BUCKET)
                .key("a.txt")
                .content(ByteBuffers.of("second".getBytes(StandardCharsets.UTF_8)))
                .build()).block();

        assertEquals("second", get("a.txt"));
        assertEquals(6L, stored.getSize());
        assertEquals("application/octet-stream", stored.getContentType());
        assertNotNull(stored.getEtag());
    }

    @Test
    void get_missingKey() {
        assertThrows(ObjectNotFoundException.class,
                () -> driver.execute(new GetObjectOperation(BUCKET, "missing.txt")).block());
    }

    @Test
    void operationsOnMissingBucket() {
        assertThrows(BucketNotFoundException.class,
                () -> driver.execute(new DeleteObjectOperation("missing", "a.txt")).block());
        assertThrows(BucketNotFoundException.class,
                () -> driver.execute(new ListObjectsOperation(ListObjectsRequest.builder()
                        .bucketName("missing")
                        .build())).block());
    }

    @Test
    @DisplayName("Deleting a missing key completes normally")
    void delete_isIdempotent() {
        put("a.txt", "x");

        driver.execute(new DeleteObjectOperation(BUCKET, "a.txt")).block();
        driver.execute(new DeleteObjectOperation(BUCKET, "a.txt")).block();

        assertTrue(list("", 10, null).getContents().isEmpty());
    }

    @Test
    @DisplayName("Listing filters by prefix and sorts keys")
    void list_filtersAndSorts() {
        put("data/b.txt", "b");
        put("data/a.txt", "a");
        put("data/sub/c.txt", "c");
        put("other/d.txt", "d");

        ListObjectsResult result = list("data/", 1000, null);

        assertEquals(List.of("data/a.txt", "data/b.txt", "data/sub/c.txt"),
                result.getContents().stream().map(StoredObject::getKey).toList());
        assertFalse(result.isTruncated());
        assertNull(result.getNextContinuationToken());
    }

    @Test
    @DisplayName("Keys outside the BMP sort by their UTF-8 bytes, not UTF-16 code units")
    void list_usesUtf8ByteOrder() {
        // U+FB01 is EF AC 81 in UTF-8, U+1F600 is F0 9F 98 80 (a D83D surrogate in UTF-16)
        put("u/😀.txt", "emoji");
        put("u/ﬁ.txt", "ligature");

        ListObjectsResult all = list("u/", 1000, null);
        assertEquals(List.of("u/ﬁ.txt", "u/😀.txt"),
                all.getContents().stream().map(StoredObject::getKey).toList());

        ListObjectsResult first = list("u/", 1, null);
        assertEquals("u/ﬁ.txt", first.getNextContinuationToken());
        ListObjectsResult second = list("u/", 1, first.getNextContinuationToken());
        assertEquals(List.of("u/😀.txt"),
                second.getContents().stream().map(StoredObject::getKey).toList());
    }

    @Test
    @DisplayName("Listing pages through continuation tokens")
    void list_paginates() {
        put("p/1", "1");
        put("p/2", "2");
        put("p/3", "3");

        ListObjectsResult first = list("p/", 2, null);
        assertTrue(first.isTruncated());
        assertEquals(2, first.getContents().size());

        ListObjectsResult second = list("p/", 2, first.getNextContinuationToken());
        assertFalse(second.isTruncated());
        assertEquals(List.of("p/3"), second.getContents().stream().map(StoredObject::getKey).toList());
    }

    @Test
    @DisplayName("Drivers created with the same name share one store")
    void factory_sharesStoreByName() {
        put("shared.txt", "kept");
        driver.shutdown().block();

        MemoryStorageDriver again = factory.createDriver(DriverConfig.of("mem", "memory", Map.of()));
        MemoryStorageDriver other = factory.createDriver(DriverConfig.of("other", "memory", Map.of()));

        assertSame(driver.getStore(), again.getStore());
        assertNotSame(driver.getStore(), other.getStore());
        assertTrue(again.execute(new BucketExistsOperation(BUCKET)).block());
        assertTrue(factory.findStore("mem").isPresent());
    }

    @Test
    void initialize_createsConfiguredBuckets() {
        MemoryStorageDriver seeded = factory.createDriver(
                DriverConfig.of("seeded", "memory", Map.of("buckets", "logs, jobs")));

        seeded.initialize().block();

        assertTrue(seeded.execute(new BucketExistsOperation("logs")).block());
        assertTrue(seeded.execute(new BucketExistsOperation("jobs")).block());
    }

    @Test
    void registersSupportedOperations() {
        assertEquals(6, driver.getHandlerRegistry().size());
        assertEquals("memory", driver.getDriverType());
        assertEquals("mem", driver.getDriverName());
    }
}
