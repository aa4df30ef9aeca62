package win.ixuni.splice.driver.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.OperationHandler;
import win.ixuni.splice.core.operation.object.DeleteObjectOperation;
import win.ixuni.splice.driver.s3.context.S3DriverContext;

/**
 * S3 DeleteObject handler. S3 answers 204 for keys that do not exist.
 */
public class S3DeleteObjectHandler implements OperationHandler<DeleteObjectOperation, Void> {

    @Override
    public Mono<Void> handle(DeleteObjectOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;

        return Mono.fromFuture(() -> ctx.getS3Client().deleteObject(
                        DeleteObjectRequest.builder()
                                .bucket(operation.getBucketName())
                                .key(operation.getKey())
                                .build()))
                .then();
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}
