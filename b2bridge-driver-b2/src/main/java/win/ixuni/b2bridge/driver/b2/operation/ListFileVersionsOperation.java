package win.ixuni.b2bridge.driver.b2.operation;

import lombok.Builder;
import lombok.Value;
import win.ixuni.b2bridge.core.operation.Operation;
import win.ixuni.b2bridge.driver.b2.model.B2FilePage;

/**
 * List one page of file versions in a bucket
 * <p>
 * The cursor fields are optional; pass the previous page's nextFileName/nextFileId to continue.
 */
@Value
@Builder
public class ListFileVersionsOperation implements Operation<B2FilePage> {

    String bucketId;

    String startFileName;

    String startFileId;

    Integer maxFileCount;
}
