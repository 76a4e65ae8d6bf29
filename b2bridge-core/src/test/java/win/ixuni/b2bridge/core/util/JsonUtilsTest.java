package win.ixuni.b2bridge.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilsTest {

    @Test
    void serializesMapsInInsertionOrder() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("bucketName", "photos");
        data.put("bucketType", "allPrivate");

        assertEquals("{\"bucketName\":\"photos\",\"bucketType\":\"allPrivate\"}", JsonUtils.toJson(data));
    }

    @Test
    void readTreeRejectsNonJson() {
        JsonNode node = JsonUtils.readTree("{\"a\":1}".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, node.get("a").asInt());

        assertThrows(IllegalArgumentException.class,
                () -> JsonUtils.readTree("<html>".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void ignoresUnknownProperties() {
        Sample sample = JsonUtils.fromJson("{\"name\":\"x\",\"extra\":true}".getBytes(StandardCharsets.UTF_8),
                Sample.class);
        assertEquals("x", sample.name);
    }

    static class Sample {
        public String name;
    }
}
