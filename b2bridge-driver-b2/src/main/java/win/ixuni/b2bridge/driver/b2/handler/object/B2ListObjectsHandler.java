package win.ixuni.b2bridge.driver.b2.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.model.ListObjectsRequest;
import win.ixuni.b2bridge.core.model.ListObjectsResult;
import win.ixuni.b2bridge.core.model.StorageObject;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.core.operation.object.ListObjectsOperation;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.model.B2Bucket;
import win.ixuni.b2bridge.driver.b2.model.B2File;
import win.ixuni.b2bridge.driver.b2.model.B2FilePage;
import win.ixuni.b2bridge.driver.b2.model.B2ListFilesRequest;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * B2 list objects handler
 * <p>
 * Returns exactly one page. The marker is B2's startFileName (inclusive), so callers continue
 * with the returned nextMarker. With a delimiter, B2 "folder" entries become common prefixes.
 */
public class B2ListObjectsHandler implements OperationHandler<ListObjectsOperation, ListObjectsResult> {

    private static final String FOLDER_ACTION = "folder";

    @Override
    public Mono<ListObjectsResult> handle(ListObjectsOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;
        ListObjectsRequest request = operation.getRequest();

        return Mono.fromCallable(() -> {
            B2Bucket bucket = ctx.getBucketResolver().resolve(request.getBucketName());
            B2FilePage page = ctx.getClient().listContainerObjects(bucket, B2ListFilesRequest.builder()
                    .startFileName(request.getMarker())
                    .maxFileCount(request.getMaxKeys())
                    .prefix(request.getPrefix())
                    .delimiter(request.getDelimiter())
                    .build());

            List<StorageObject> contents = new ArrayList<>();
            List<String> commonPrefixes = new ArrayList<>();
            for (B2File file : page.getFiles()) {
                if (FOLDER_ACTION.equals(file.getAction())) {
                    commonPrefixes.add(file.getName());
                } else {
                    contents.add(file.toStorageObject());
                }
            }

            return ListObjectsResult.builder()
                    .bucketName(request.getBucketName())
                    .prefix(request.getPrefix())
                    .delimiter(request.getDelimiter())
                    .isTruncated(page.hasMore())
                    .nextMarker(page.getNextFileName())
                    .contents(contents)
                    .commonPrefixes(commonPrefixes)
                    .build();
        });
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
