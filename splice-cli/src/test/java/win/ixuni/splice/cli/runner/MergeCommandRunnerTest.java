package win.ixuni.splice.cli.runner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;
import win.ixuni.splice.core.config.SpliceProperties;
import win.ixuni.splice.core.exception.BucketNotFoundException;
import win.ixuni.splice.core.exception.InvalidArgumentException;
import win.ixuni.splice.core.operation.object.PutObjectOperation;
import win.ixuni.splice.core.util.ByteBuffers;
import win.ixuni.splice.driver.memory.MemoryDriverFactory;
import win.ixuni.splice.driver.memory.MemoryStorageDriver;
import win.ixuni.splice.driver.memory.context.MemoryStore;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "splice.driver.name=cli-test",
        "splice.driver.type=memory",
        "splice.driver.properties.buckets=cli-bucket",
        "splice.merge.list-page-size=2"
})
class MergeCommandRunnerTest {

    private static final String BUCKET = "cli-bucket";

    @Autowired
    private MergeCommandRunner runner;

    @Autowired
    private MemoryDriverFactory memoryDriverFactory;

    @Autowired
    private SpliceProperties properties;

    private MemoryStorageDriver driver;

    @BeforeEach
    void setUp() {
        // same driver name as the runner, so both see one store
        driver = memoryDriverFactory.createDriver(properties.getDriver());
        driver.initialize().block();
    }

    private void put(String key, String content) {
        driver.execute(PutObjectOperation.builder()
                .bucketName(BUCKET)
                .key(key)
                .content(ByteBuffers.of(content.getBytes(StandardCharsets.UTF_8)))
                .build()).block();
    }

    private boolean exists(String key) {
        MemoryStore store = driver.getStore();
        return store.getObjects().containsKey(store.objectKey(BUCKET, key));
    }

    private String content(String key) {
        MemoryStore store = driver.getStore();
        return new String(store.getObjects().get(store.objectKey(BUCKET, key)).getData(), StandardCharsets.UTF_8);
    }

    private void run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
    }

    @Test
    void mergesFromCommandLineOptions() {
        put("run1/part-0.txt", "a\nb\n");
        put("run1/part-1.txt", "c");
        put("run1/part-2.txt", "d\n");
        put("run1/_SUCCESS", "");

        run("--bucket=cli-bucket", "--new-object-key=run1/merged.txt",
                "--initial-name=part", "--prefix=run1");

        assertEquals("a\nb\nc\nd", content("run1/merged.txt"));
        assertFalse(exists("run1/part-0.txt"));
        assertFalse(exists("run1/part-1.txt"));
        assertFalse(exists("run1/part-2.txt"));
        assertFalse(exists("run1/_SUCCESS"));
    }

    @Test
    void keepsMarkersWhenDisabled() {
        put("run2/part-0.txt", "x");
        put("run2/_SUCCESS", "");

        run("--bucket=cli-bucket", "--new-object-key=run2/merged.txt",
                "--initial-name=part", "--prefix=run2/", "--delete-success-files=false");

        assertEquals("x", content("run2/merged.txt"));
        assertTrue(exists("run2/_SUCCESS"));
    }

    @Test
    @DisplayName("Without --bucket only the usage is printed")
    void printsUsageWithoutBucket() {
        put("run3/part-0.txt", "kept");
        int before = driver.getStore().getObjects().size();

        run("--new-object-key=run3/merged.txt", "--initial-name=part", "--prefix=run3");

        assertEquals(before, driver.getStore().getObjects().size());
        assertTrue(exists("run3/part-0.txt"));
    }

    @Test
    void missingBucketFails() {
        assertThrows(BucketNotFoundException.class,
                () -> run("--bucket=no-such-bucket", "--new-object-key=merged.txt", "--initial-name=part"));
    }

    @Test
    void invalidFlagFails() {
        put("run4/part-0.txt", "kept");

        assertThrows(InvalidArgumentException.class,
                () -> run("--bucket=cli-bucket", "--new-object-key=run4/merged.txt",
                        "--initial-name=part", "--prefix=run4", "--delete-success-files=maybe"));
        assertTrue(exists("run4/part-0.txt"));
    }
}
