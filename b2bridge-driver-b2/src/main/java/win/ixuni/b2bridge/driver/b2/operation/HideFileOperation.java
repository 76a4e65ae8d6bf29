package win.ixuni.b2bridge.driver.b2.operation;

import lombok.Value;
import win.ixuni.b2bridge.core.operation.Operation;
import win.ixuni.b2bridge.driver.b2.model.B2File;

/**
 * Hide a file name so it no longer shows in name listings; earlier versions are kept
 */
@Value
public class HideFileOperation implements Operation<B2File> {

    String bucketId;

    String fileName;
}
