package win.ixuni.b2bridge.driver.b2.upload;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class B2HashesTest {

    @Test
    void knownDigest() {
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d",
                B2Hashes.sha1Hex("abc".getBytes(StandardCharsets.UTF_8)));
        assertEquals("da39a3ee5e6b4b0d3255bfef95601890afd80709", B2Hashes.sha1Hex(new byte[0]));
    }

    @Test
    void streamingFileDigestMatchesInMemoryDigest(@TempDir Path dir) throws IOException {
        byte[] data = new byte[300_000];
        new Random(42).nextBytes(data);
        Path file = Files.write(dir.resolve("blob.bin"), data);

        assertEquals(B2Hashes.sha1Hex(data), B2Hashes.sha1Hex(file));
    }

    @Test
    void missingFilePropagates(@TempDir Path dir) {
        assertThrows(NoSuchFileException.class, () -> B2Hashes.sha1Hex(dir.resolve("missing")));
    }
}
