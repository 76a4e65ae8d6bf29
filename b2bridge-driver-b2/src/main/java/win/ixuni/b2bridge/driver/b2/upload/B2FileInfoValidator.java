package win.ixuni.b2bridge.driver.b2.upload;

import win.ixuni.b2bridge.driver.b2.http.B2Paths;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates upload metadata and turns it into {@code X-Bz-Info-*} headers.
 * <p>
 * B2 accepts at most 10 items; keys are 1 to 50 characters of letters, digits, '-' and '_'.
 * Values are percent-encoded.
 */
public final class B2FileInfoValidator {

    public static final String HEADER_PREFIX = "X-Bz-Info-";

    public static final int MAX_ITEMS = 10;

    private static final Pattern KEY = Pattern.compile("[A-Za-z0-9_-]{1,50}");

    private B2FileInfoValidator() {
    }

    /**
     * @throws IllegalArgumentException when there are too many items, a key is malformed or a
     *                                  value is null
     */
    public static void validate(Map<String, String> fileInfo) {
        if (fileInfo == null) {
            return;
        }
        if (fileInfo.size() > MAX_ITEMS) {
            throw new IllegalArgumentException("B2 allows at most " + MAX_ITEMS
                    + " metadata items, got " + fileInfo.size());
        }
        for (Map.Entry<String, String> entry : fileInfo.entrySet()) {
            String key = entry.getKey();
            if (key == null || !KEY.matcher(key).matches()) {
                throw new IllegalArgumentException("Invalid B2 metadata key: '" + key
                        + "' (expected 1-50 of [A-Za-z0-9_-])");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("B2 metadata value for '" + key + "' is null");
            }
        }
    }

    /**
     * Validate and build the header map, keeping the caller's order.
     */
    public static Map<String, String> toHeaders(Map<String, String> fileInfo) {
        validate(fileInfo);
        Map<String, String> headers = new LinkedHashMap<>();
        if (fileInfo != null) {
            fileInfo.forEach((key, value) -> headers.put(HEADER_PREFIX + key, B2Paths.encode(value)));
        }
        return headers;
    }
}
