package org.metaconv.compiler.registry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over the UTF-8 bytes of the key, truncated to a fixed number of hex digits.
 */
public class Sha256KeyHasher implements KeyHasher {

    public static final int DEFAULT_LENGTH = 16;

    private final int hexLength;

    public Sha256KeyHasher() {
        this(DEFAULT_LENGTH);
    }

    /**
     * @param hexLength Number of hex digits kept, between 8 and 64.
     */
    public Sha256KeyHasher(int hexLength) {
        if (hexLength < 8 || hexLength > 64) {
            throw new IllegalArgumentException("hexLength must be between 8 and 64, got " + hexLength);
        }
        this.hexLength = hexLength;
    }

    @Override
    public String hash(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes).substring(0, hexLength);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }
}
