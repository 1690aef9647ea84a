package io.bridgeconfig.core.error;

import java.util.List;

/** Thrown when the stored checksum of a state file differs from the digest of its content. */
public final class ChecksumMismatchException extends StateFileException {

    private static final long serialVersionUID = 1L;

    private final String storedChecksum;
    private final String computedChecksum;

    public ChecksumMismatchException(String storedChecksum, String computedChecksum, String source) {
        super(
                "Checksum mismatch",
                List.of(ConfigIssue.field(
                        "checksum", "checksum mismatch: " + storedChecksum + " (expected " + computedChecksum + ")")),
                source);
        this.storedChecksum = storedChecksum;
        this.computedChecksum = computedChecksum;
    }

    /** The checksum found in the file. */
    public String storedChecksum() {
        return storedChecksum;
    }

    /** The checksum computed from the loaded configuration. */
    public String computedChecksum() {
        return computedChecksum;
    }
}
