package win.ixuni.b2bridge.driver.b2.http;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.Map;

/**
 * A B2 call before host, token and body encoding are resolved by {@link B2RequestRouter}.
 */
@Value
@Builder
public class B2Request {

    B2Route route;

    @Singular
    Map<String, String> params;

    /**
     * JSON body fields of non-raw routes
     */
    @Singular("field")
    Map<String, Object> data;

    @Singular
    Map<String, String> headers;

    /**
     * Raw body of raw routes
     */
    byte[] body;

    /**
     * Raw body streamed from a file, alternative to {@link #body}
     */
    Path bodyFile;

    /**
     * Add the session's account id: as a query parameter on GET, as a body field on POST
     */
    boolean includeAccountId;
}
