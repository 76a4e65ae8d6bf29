package win.ixuni.b2bridge.driver.b2.http;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class B2PathsTest {

    @Test
    void encodesSegmentsAndKeepsSlashes() {
        assertEquals("photos/a%20b/c%2Bd~e.txt", B2Paths.encodePath("photos/a b/c+d~e.txt"));
        assertEquals("%E7%8C%AB.jpg", B2Paths.encodePath("猫.jpg"));
    }

    @Test
    void encodeEscapesSlashInsideValues() {
        assertEquals("a%2Fb%20c", B2Paths.encode("a/b c"));
    }
}
