package win.ixuni.splice.driver.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import win.ixuni.splice.core.model.ListObjectsRequest;
import win.ixuni.splice.core.model.ListObjectsResult;
import win.ixuni.splice.core.model.StoredObject;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.OperationHandler;
import win.ixuni.splice.core.operation.object.ListObjectsOperation;
import win.ixuni.splice.driver.s3.context.S3DriverContext;

/**
 * S3 ListObjects handler
 * <p>
 * Issues one ListObjectsV2 call per page. S3 returns keys in UTF-8 binary order.
 */
public class S3ListObjectsHandler implements OperationHandler<ListObjectsOperation, ListObjectsResult> {

    @Override
    public Mono<ListObjectsResult> handle(ListObjectsOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;
        ListObjectsRequest request = operation.getRequest();

        var s3Request = ListObjectsV2Request.builder()
                .bucket(request.getBucketName())
                .prefix(request.getPrefix())
                .continuationToken(request.getContinuationToken())
                .maxKeys(request.getMaxKeys())
                .build();

        return Mono.fromFuture(() -> ctx.getS3Client().listObjectsV2(s3Request))
                .map(response -> toResult(request, response));
    }

    private ListObjectsResult toResult(ListObjectsRequest request, ListObjectsV2Response response) {
        return ListObjectsResult.builder()
                .bucketName(request.getBucketName())
                .prefix(request.getPrefix())
                .truncated(Boolean.TRUE.equals(response.isTruncated()))
                .nextContinuationToken(response.nextContinuationToken())
                .contents(response.contents().stream()
                        .map(obj -> StoredObject.builder()
                                .bucketName(request.getBucketName())
                                .key(obj.key())
                                .size(obj.size())
                                .etag(obj.eTag())
                                .lastModified(obj.lastModified())
                                .build())
                        .toList())
                .build();
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }
}
