package win.ixuni.b2bridge.driver.b2.auth;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import win.ixuni.b2bridge.driver.b2.exception.B2AuthenticationException;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Result of one successful account authorization: the token and the hosts it is valid for.
 * <p>
 * Immutable; a session is either published whole or not at all.
 */
@Value
@Builder
public class B2Session {

    String accountId;

    String apiUrl;

    /**
     * Authority of {@link #apiUrl}
     */
    String apiHost;

    String downloadUrl;

    /**
     * Authority of {@link #downloadUrl}
     */
    String downloadHost;

    @ToString.Exclude
    String authorizationToken;

    Long recommendedPartSize;

    Long absoluteMinimumPartSize;

    static B2Session fromAuthorizeAccount(JsonNode json) {
        String accountId = requireText(json, "accountId");
        String apiUrl = requireText(json, "apiUrl");
        String downloadUrl = requireText(json, "downloadUrl");
        String token = requireText(json, "authorizationToken");

        return B2Session.builder()
                .accountId(accountId)
                .apiUrl(apiUrl)
                .apiHost(authorityOf(apiUrl))
                .downloadUrl(downloadUrl)
                .downloadHost(authorityOf(downloadUrl))
                .authorizationToken(token)
                .recommendedPartSize(json.hasNonNull("recommendedPartSize")
                        ? json.get("recommendedPartSize").asLong() : null)
                .absoluteMinimumPartSize(json.hasNonNull("absoluteMinimumPartSize")
                        ? json.get("absoluteMinimumPartSize").asLong() : null)
                .build();
    }

    private static String requireText(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new B2AuthenticationException("Authorization response is missing '" + field + "'");
        }
        return value.asText();
    }

    private static String authorityOf(String url) {
        String authority;
        try {
            authority = new URI(url).getRawAuthority();
        } catch (URISyntaxException e) {
            throw new B2AuthenticationException("Authorization response has a malformed URL: " + url, e);
        }
        if (authority == null) {
            throw new B2AuthenticationException("Authorization response has no host in URL: " + url);
        }
        return authority;
    }
}
