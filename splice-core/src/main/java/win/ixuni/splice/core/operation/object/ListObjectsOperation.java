package win.ixuni.splice.core.operation.object;

import lombok.Value;
import win.ixuni.splice.core.model.ListObjectsRequest;
import win.ixuni.splice.core.model.ListObjectsResult;
import win.ixuni.splice.core.operation.BucketScoped;
import win.ixuni.splice.core.operation.Operation;

/**
 * List one page of objects under a prefix
 */
@Value
public class ListObjectsOperation implements Operation<ListObjectsResult>, BucketScoped {

    ListObjectsRequest request;

    @Override
    public String getBucketName() {
        return request.getBucketName();
    }
}
