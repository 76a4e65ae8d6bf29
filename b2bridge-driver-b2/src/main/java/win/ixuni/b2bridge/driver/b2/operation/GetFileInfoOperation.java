package win.ixuni.b2bridge.driver.b2.operation;

import lombok.Value;
import win.ixuni.b2bridge.core.operation.Operation;
import win.ixuni.b2bridge.driver.b2.model.B2File;

/**
 * Get one file version by its B2 file id
 */
@Value
public class GetFileInfoOperation implements Operation<B2File> {

    String fileId;
}
