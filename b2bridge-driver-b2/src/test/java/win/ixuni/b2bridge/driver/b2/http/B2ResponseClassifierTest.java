package win.ixuni.b2bridge.driver.b2.http;

import org.junit.jupiter.api.Test;
import win.ixuni.b2bridge.driver.b2.exception.B2AuthenticationException;
import win.ixuni.b2bridge.driver.b2.exception.B2TransportException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class B2ResponseClassifierTest {

    @Test
    void onlyTwoHundredTwoHundredOneAndTwoHundredTwoAreSuccess() {
        assertTrue(B2ResponseClassifier.isSuccess(200));
        assertTrue(B2ResponseClassifier.isSuccess(201));
        assertTrue(B2ResponseClassifier.isSuccess(202));
        assertFalse(B2ResponseClassifier.isSuccess(204));
        assertFalse(B2ResponseClassifier.isSuccess(400));

        assertEquals(B2ResponseClassifier.Outcome.AUTH_FAILURE, B2ResponseClassifier.classify(401));
        assertEquals(B2ResponseClassifier.Outcome.FAILURE, B2ResponseClassifier.classify(403));
        assertEquals(B2ResponseClassifier.Outcome.FAILURE, B2ResponseClassifier.classify(503));
    }

    @Test
    void checkRaisesAuthenticationErrorOnUnauthorized() {
        B2HttpResponse response = response(401, "{\"status\":401,\"code\":\"unauthorized\",\"message\":\"nope\"}");

        B2AuthenticationException e = assertThrows(B2AuthenticationException.class,
                () -> B2ResponseClassifier.check(response));
        assertEquals("nope", e.getMessage());
        assertEquals(401, e.getHttpStatus());
    }

    @Test
    void checkRaisesTransportErrorWithCodeAndBody() {
        String body = "{\"status\":400,\"code\":\"bad_request\",\"message\":\"Invalid bucketId\"}";

        B2TransportException e = assertThrows(B2TransportException.class,
                () -> B2ResponseClassifier.check(response(400, body)));

        assertEquals(400, e.getHttpStatus());
        assertEquals("bad_request", e.getB2Code());
        assertEquals(body, e.getBody());
        assertTrue(e.getMessage().contains("Invalid bucketId"));
    }

    @Test
    void nonJsonErrorBodyDegradesToRawText() {
        B2HttpResponse response = response(503, "Service Unavailable");

        B2TransportException e = assertThrows(B2TransportException.class,
                () -> B2ResponseClassifier.check(response));
        assertNull(e.getB2Code());
        assertTrue(e.getMessage().contains("Service Unavailable"));
        assertEquals("Service Unavailable", B2ResponseClassifier.errorMessage(response));
    }

    @Test
    void requireAcceptsOnlyTheExpectedStatus() {
        B2HttpResponse ok = response(200, "");
        assertSame(ok, B2ResponseClassifier.require(ok, 200));

        assertThrows(B2TransportException.class, () -> B2ResponseClassifier.require(response(202, ""), 200));
    }

    private static B2HttpResponse response(int status, String body) {
        return new B2HttpResponse(status, Map.of(),
                new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }
}
