package win.ixuni.splice.driver.s3;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import win.ixuni.splice.core.config.DriverConfig;
import win.ixuni.splice.core.driver.AbstractStorageDriver;
import win.ixuni.splice.core.exception.InvalidArgumentException;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.driver.s3.context.S3DriverContext;
import win.ixuni.splice.driver.s3.handler.bucket.S3BucketExistsHandler;
import win.ixuni.splice.driver.s3.handler.object.S3DeleteObjectHandler;
import win.ixuni.splice.driver.s3.handler.object.S3GetObjectHandler;
import win.ixuni.splice.driver.s3.handler.object.S3ListObjectsHandler;
import win.ixuni.splice.driver.s3.handler.object.S3PutObjectHandler;

import java.net.URI;

/**
 * S3 storage driver
 * <p>
 * Talks to AWS S3, MinIO or any other S3-compatible backend. Each driver instance owns one
 * {@link S3AsyncClient}, which is closed on {@link #shutdown()}. SDK errors reach the caller as thrown
 * by the client; only the bucket existence check turns a 404 into {@code false}.
 */
@Slf4j
public class S3StorageDriver extends AbstractStorageDriver {

    public static final String DEFAULT_REGION = "us-east-1";

    private final S3DriverContext driverContext;
    private final S3AsyncClient s3Client;

    public S3StorageDriver(DriverConfig config) {
        this(config, buildS3Client(config));
    }

    S3StorageDriver(DriverConfig config, S3AsyncClient s3Client) {
        super(config);
        this.s3Client = s3Client;
        this.driverContext = S3DriverContext.builder()
                .config(config)
                .s3Client(s3Client)
                .build();

        registerHandlers();
        bindContext();
    }

    static S3AsyncClient buildS3Client(DriverConfig config) {
        String endpoint = config.getString("endpoint", null);
        String region = config.getString("region", DEFAULT_REGION);
        boolean pathStyle = config.getBoolean("path-style", true);

        if (endpoint == null || endpoint.isBlank()) {
            log.warn("S3 driver '{}': no endpoint configured, will use AWS default", config.getName());
        }

        var builder = S3AsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider(config))
                .forcePathStyle(pathStyle);

        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }

        return builder.build();
    }

    /**
     * Static credentials when both keys are configured, the SDK default chain when neither is
     */
    static AwsCredentialsProvider credentialsProvider(DriverConfig config) {
        String accessKey = config.getString("access-key", "");
        String secretKey = config.getString("secret-key", "");

        if (accessKey.isBlank() && secretKey.isBlank()) {
            log.info("S3 driver '{}': no keys configured, using the default credentials chain", config.getName());
            return DefaultCredentialsProvider.create();
        }
        if (accessKey.isBlank() || secretKey.isBlank()) {
            throw new InvalidArgumentException(
                    "S3 driver '" + config.getName() + "': access-key and secret-key must be configured together");
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new S3BucketExistsHandler());

        getHandlerRegistry().register(new S3ListObjectsHandler());
        getHandlerRegistry().register(new S3GetObjectHandler());
        getHandlerRegistry().register(new S3PutObjectHandler());
        getHandlerRegistry().register(new S3DeleteObjectHandler());

        log.debug("Registered {} operation handlers for S3 driver", getHandlerRegistry().size());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public String getDriverType() {
        return S3DriverFactory.DRIVER_TYPE;
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing S3 driver: {} -> {}",
                getDriverName(),
                config.getString("endpoint", "AWS S3"));
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down S3 driver: {}", getDriverName());
        return Mono.fromRunnable(s3Client::close);
    }
}
