package com.qualitygate.core.cache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Produces stable SHA-256 digests of file content.
 *
 * <p>Shared by the {@link ResultCache} and the change detector so both agree on what
 * "same content" means. Instances are stateless and thread-safe.
 */
public class ContentHasher {

    private static final String ALGORITHM = "SHA-256";

    /**
     * Digests raw bytes.
     *
     * @param content bytes to digest
     * @return lower-case hex digest
     */
    public String digest(byte[] content) {
        return HexFormat.of().formatHex(newDigest().digest(content));
    }

    /**
     * Digests text encoded as UTF-8.
     *
     * @param content text to digest
     * @return lower-case hex digest
     */
    public String digest(String content) {
        return digest(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Digests the bytes of a file.
     *
     * @param file file to read
     * @return lower-case hex digest
     * @throws IOException if the file cannot be read
     */
    public String digestFile(Path file) throws IOException {
        return digest(Files.readAllBytes(file));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
