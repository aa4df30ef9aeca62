package win.ixuni.splice.driver.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import win.ixuni.splice.core.model.StoredObject;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.OperationHandler;
import win.ixuni.splice.core.operation.object.PutObjectOperation;
import win.ixuni.splice.core.util.ByteBuffers;
import win.ixuni.splice.driver.s3.context.S3DriverContext;

import java.time.Instant;

/**
 * S3 PutObject handler
 * <p>
 * Buffers the content before sending it: a single PutObject needs the content length up front,
 * and not every S3-compatible backend accepts chunked uploads without it.
 */
public class S3PutObjectHandler implements OperationHandler<PutObjectOperation, StoredObject> {

    @Override
    public Mono<StoredObject> handle(PutObjectOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return ByteBuffers.collect(operation.getContent())
                .flatMap(data -> {
                    var s3Request = PutObjectRequest.builder()
                            .bucket(bucketName)
                            .key(key)
                            .contentType(operation.getContentType())
                            .contentLength((long) data.length)
                            .build();

                    return Mono.fromFuture(() -> ctx.getS3Client().putObject(
                                    s3Request, AsyncRequestBody.fromBytes(data)))
                            .map(response -> StoredObject.builder()
                                    .bucketName(bucketName)
                                    .key(key)
                                    .size((long) data.length)
                                    .etag(response.eTag())
                                    .lastModified(Instant.now())
                                    .contentType(operation.getContentType())
                                    .build());
                });
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}
