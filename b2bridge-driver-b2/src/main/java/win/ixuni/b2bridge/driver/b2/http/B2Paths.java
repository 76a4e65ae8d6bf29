package win.ixuni.b2bridge.driver.b2.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding as B2 expects it in paths and {@code X-Bz-*} headers.
 */
public final class B2Paths {

    private B2Paths() {
    }

    /**
     * Encode every segment of a path, keeping {@code /} as the separator
     */
    public static String encodePath(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String[] segments = path.split("/", -1);
        StringBuilder encoded = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                encoded.append('/');
            }
            encoded.append(encode(segments[i]));
        }
        return encoded.toString();
    }

    /**
     * Encode a single value; spaces become {@code %20}, never {@code +}
     */
    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%7E", "~");
    }
}
