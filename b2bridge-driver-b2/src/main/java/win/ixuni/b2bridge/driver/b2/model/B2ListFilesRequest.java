package win.ixuni.b2bridge.driver.b2.model;

import lombok.Builder;
import lombok.Value;

/**
 * Optional parameters of a file-name listing; null fields are not sent.
 */
@Value
@Builder
public class B2ListFilesRequest {

    public static final B2ListFilesRequest FIRST_PAGE = B2ListFilesRequest.builder().build();

    String startFileName;

    Integer maxFileCount;

    String prefix;

    String delimiter;
}
