package win.ixuni.splice.driver.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.OperationHandler;
import win.ixuni.splice.core.operation.bucket.BucketExistsOperation;
import win.ixuni.splice.driver.s3.context.S3DriverContext;

/**
 * S3 BucketExists handler, backed by HeadBucket
 */
public class S3BucketExistsHandler implements OperationHandler<BucketExistsOperation, Boolean> {

    @Override
    public Mono<Boolean> handle(BucketExistsOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;

        return Mono.fromFuture(() -> ctx.getS3Client().headBucket(
                        HeadBucketRequest.builder()
                                .bucket(operation.getBucketName())
                                .build()))
                .map(response -> true)
                .onErrorResume(NoSuchBucketException.class, e -> Mono.just(false))
                .onErrorResume(S3Exception.class, e -> {
                    // HeadBucket has no body, a missing bucket only shows up as 404
                    if (e.statusCode() == 404) {
                        return Mono.just(false);
                    }
                    return Mono.error(e);
                });
    }

    @Override
    public Class<BucketExistsOperation> getOperationType() {
        return BucketExistsOperation.class;
    }
}
