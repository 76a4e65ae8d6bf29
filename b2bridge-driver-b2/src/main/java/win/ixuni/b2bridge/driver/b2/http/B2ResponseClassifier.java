package win.ixuni.b2bridge.driver.b2.http;

import com.fasterxml.jackson.databind.JsonNode;
import win.ixuni.b2bridge.core.exception.BridgeException;
import win.ixuni.b2bridge.core.util.JsonUtils;
import win.ixuni.b2bridge.driver.b2.exception.B2AuthenticationException;
import win.ixuni.b2bridge.driver.b2.exception.B2TransportException;

/**
 * Maps B2 status codes to outcomes.
 * <p>
 * Success is 200, 201 or 202. A 401 is an authentication failure. Anything else is left
 * unclassified: {@link #check} raises it, while boolean-returning operations read the status
 * themselves.
 */
public final class B2ResponseClassifier {

    public enum Outcome {
        SUCCESS,
        AUTH_FAILURE,
        FAILURE
    }

    private B2ResponseClassifier() {
    }

    public static boolean isSuccess(int status) {
        return status == 200 || status == 201 || status == 202;
    }

    public static Outcome classify(int status) {
        if (isSuccess(status)) {
            return Outcome.SUCCESS;
        }
        return status == 401 ? Outcome.AUTH_FAILURE : Outcome.FAILURE;
    }

    /**
     * Pass successful responses through, raise on anything else.
     *
     * @throws B2AuthenticationException on 401
     * @throws B2TransportException      on any other non-success status
     */
    public static B2HttpResponse check(B2HttpResponse response) {
        switch (classify(response.getStatus())) {
            case SUCCESS -> {
                return response;
            }
            case AUTH_FAILURE -> throw new B2AuthenticationException(errorMessage(response));
            default -> throw failure(response);
        }
    }

    /**
     * Like {@link #check} but only {@code expected} passes; downloads and uploads require 200.
     */
    public static B2HttpResponse require(B2HttpResponse response, int expected) {
        if (response.getStatus() == expected) {
            return response;
        }
        throw rejection(response);
    }

    /**
     * The exception a rejected response maps to: {@link B2AuthenticationException} on 401,
     * {@link B2TransportException} otherwise.
     */
    public static BridgeException rejection(B2HttpResponse response) {
        if (classify(response.getStatus()) == Outcome.AUTH_FAILURE) {
            return new B2AuthenticationException(errorMessage(response));
        }
        return failure(response);
    }

    /**
     * Build the exception for an unclassified failure, reading code and message from the body.
     */
    public static B2TransportException failure(B2HttpResponse response) {
        String body = response.readBodyAsString();
        JsonNode error = parseError(response);
        return new B2TransportException(response.getStatus(),
                error != null ? textOrNull(error, "code") : null,
                error != null ? textOrNull(error, "message") : body,
                body);
    }

    /**
     * The {@code message} field of a B2 error body, or the raw body when it is not JSON
     */
    public static String errorMessage(B2HttpResponse response) {
        JsonNode error = parseError(response);
        String message = error != null ? textOrNull(error, "message") : null;
        return message != null ? message : response.readBodyAsString();
    }

    private static JsonNode parseError(B2HttpResponse response) {
        byte[] body = response.readBody();
        if (body.length == 0) {
            return null;
        }
        try {
            JsonNode node = JsonUtils.readTree(body);
            return node.isObject() ? node : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
