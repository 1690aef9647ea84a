package io.bridgeconfig.core.canonical;

import io.bridgeconfig.core.model.Configuration;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Computes the integrity checksum of a {@link Configuration}: the lower-case hex SHA-256 of
 * the UTF-8 bytes of its canonical serialization (which excludes the checksum field).
 *
 * <p>
 * The same digest can be reproduced from a saved state file with common tools, since the
 * checksum is the first member of the file:
 *
 * <pre>
 *   grep -v checksum state.json | sha256sum
 *   jq --indent 4 'del(.checksum)' state.json | sha256sum
 * </pre>
 */
public final class ChecksumEngine {

    private ChecksumEngine() {}

    /** Canonical text of {@code config}, trailing newline included. */
    public static String canonicalText(Configuration config) {
        return CanonicalJson.write(ConfigurationCodec.encode(config));
    }

    /** Checksum of the current content of {@code config}. */
    public static String checksum(Configuration config) {
        return sha256Hex(canonicalText(config));
    }

    /** Lower-case hex SHA-256 of the UTF-8 encoding of {@code text}. */
    public static String sha256Hex(String text) {
        MessageDigest sha256;
        try {
            sha256 = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        return Hex.toHexString(sha256.digest(text.getBytes(StandardCharsets.UTF_8)));
    }
}
