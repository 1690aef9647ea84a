package io.bridgeconfig.core.error;

import java.util.List;

/** Thrown when a state file cannot be written. The previous file, if any, is left in place. */
public final class StateWriteException extends StateFileException {

    private static final long serialVersionUID = 1L;

    public StateWriteException(String message, Throwable cause, String source) {
        super(message, List.of(), cause, source);
    }
}
