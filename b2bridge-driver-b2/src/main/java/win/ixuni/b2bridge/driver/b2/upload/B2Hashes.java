package win.ixuni.b2bridge.driver.b2.upload;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hex SHA-1 digests, the content hash B2 checks on upload.
 */
public final class B2Hashes {

    private static final int BUFFER_SIZE = 64 * 1024;

    private B2Hashes() {
    }

    public static String sha1Hex(byte[] data) {
        return HexFormat.of().formatHex(sha1().digest(data));
    }

    /**
     * Hash a file in one streaming pass without loading it into memory.
     *
     * @throws IOException when the file cannot be read
     */
    public static String sha1Hex(Path file) throws IOException {
        MessageDigest digest = sha1();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
