package win.ixuni.b2bridge.driver.b2.http;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.b2bridge.core.util.JsonUtils;
import win.ixuni.b2bridge.driver.b2.auth.B2AuthSession;
import win.ixuni.b2bridge.driver.b2.auth.B2Session;
import win.ixuni.b2bridge.driver.b2.exception.B2AuthenticationException;
import win.ixuni.b2bridge.driver.b2.exception.B2TransportException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves a {@link B2Request} against the current session and sends it.
 * <p>
 * Authenticates lazily before every call. A 401 on a route that carried the session token
 * invalidates the session and raises {@link B2AuthenticationException}; every other status is
 * returned to the caller unclassified.
 */
@Slf4j
@RequiredArgsConstructor
public class B2RequestRouter {

    @Getter
    private final B2AuthSession authSession;
    private final B2Transport transport;
    private final String scheme;

    public B2HttpResponse request(B2Request request) {
        B2Session session = authSession.authenticate(false);
        B2HttpRequest http = resolve(request, session);
        B2Route route = request.getRoute();

        log.debug("B2 {} {}{} ({})", http.getMethod(), http.getHost(), http.getPath(), route);

        B2HttpResponse response;
        try {
            response = transport.execute(http);
        } catch (IOException e) {
            throw new B2TransportException(
                    "B2 " + http.getMethod() + " " + http.getHost() + http.getPath() + " failed", e);
        }

        if (response.getStatus() == 401 && route.usesSessionToken()) {
            String message;
            try (B2HttpResponse rejected = response) {
                message = B2ResponseClassifier.errorMessage(rejected);
            } catch (IOException e) {
                throw new B2TransportException("Failed to read 401 response from " + http.getHost(), e);
            }
            authSession.invalidate(session);
            throw new B2AuthenticationException(message);
        }
        return response;
    }

    /**
     * Turn a request into wire form for the given session: host, path, token, query and body.
     */
    B2HttpRequest resolve(B2Request request, B2Session session) {
        B2Route route = request.getRoute();
        String method = route.method();

        Map<String, String> params = new LinkedHashMap<>(route.params());
        params.putAll(request.getParams());
        Map<String, Object> data = new LinkedHashMap<>(request.getData());

        if (request.isIncludeAccountId()) {
            if ("GET".equals(method)) {
                params.put("accountId", session.getAccountId());
            } else if ("POST".equals(method)) {
                data.put("accountId", session.getAccountId());
            }
        }

        B2HttpRequest.B2HttpRequestBuilder http = B2HttpRequest.builder()
                .method(method)
                .scheme(scheme)
                .host(route.host(session))
                .path(route.path())
                .query(params)
                .headers(request.getHeaders())
                .header("Authorization", route.token(session));

        if (route.raw()) {
            http.body(request.getBody()).bodyFile(request.getBodyFile());
        } else if (!data.isEmpty()) {
            http.body(JsonUtils.toJsonBytes(data)).header("Content-Type", "application/json");
        }
        return http.build();
    }
}
