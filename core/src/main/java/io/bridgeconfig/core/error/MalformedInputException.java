package io.bridgeconfig.core.error;

import java.util.List;

/**
 * Thrown when a state file cannot be interpreted at all: unreadable, not JSON, not an object,
 * missing its checksum, or keyed by a chain id that is not an integer.
 */
public final class MalformedInputException extends StateFileException {

    private static final long serialVersionUID = 1L;

    public MalformedInputException(ConfigIssue issue, String source) {
        super("Malformed input", List.of(issue), source);
    }

    public MalformedInputException(ConfigIssue issue, Throwable cause, String source) {
        super("Malformed input", List.of(issue), cause, source);
    }
}
