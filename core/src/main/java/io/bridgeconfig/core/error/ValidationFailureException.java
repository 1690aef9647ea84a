package io.bridgeconfig.core.error;

import java.util.List;

/** Thrown when a constructed configuration breaks a cross-field rule (address format, token coverage). */
public final class ValidationFailureException extends StateFileException {

    private static final long serialVersionUID = 1L;

    public ValidationFailureException(List<ConfigIssue> issues, String source) {
        super("Validation failed", issues, source);
    }
}
