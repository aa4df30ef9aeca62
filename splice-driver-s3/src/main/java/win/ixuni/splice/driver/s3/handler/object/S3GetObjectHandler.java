package win.ixuni.splice.driver.s3.handler.object;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import win.ixuni.splice.core.model.ObjectData;
import win.ixuni.splice.core.model.StoredObject;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.OperationHandler;
import win.ixuni.splice.core.operation.object.GetObjectOperation;
import win.ixuni.splice.driver.s3.context.S3DriverContext;

/**
 * S3 GetObject handler
 * <p>
 * The body is exposed as the SDK's publisher, nothing is buffered here.
 */
public class S3GetObjectHandler implements OperationHandler<GetObjectOperation, ObjectData> {

    @Override
    public Mono<ObjectData> handle(GetObjectOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return Mono.fromFuture(() -> ctx.getS3Client().getObject(
                        GetObjectRequest.builder()
                                .bucket(bucketName)
                                .key(key)
                                .build(),
                        AsyncResponseTransformer.toPublisher()))
                .map(publisher -> {
                    GetObjectResponse response = publisher.response();
                    StoredObject metadata = StoredObject.builder()
                            .bucketName(bucketName)
                            .key(key)
                            .size(response.contentLength())
                            .etag(response.eTag())
                            .lastModified(response.lastModified())
                            .contentType(response.contentType())
                            .build();

                    return ObjectData.builder()
                            .metadata(metadata)
                            .content(Flux.from(publisher))
                            .build();
                });
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}
