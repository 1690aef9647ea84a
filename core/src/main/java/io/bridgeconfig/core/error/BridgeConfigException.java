package io.bridgeconfig.core.error;

/**
 * Abstract base for all bridge-config exceptions. Never thrown directly; use the concrete
 * subclasses under {@link StateFileException} or the deployment lookup errors.
 */
public abstract class BridgeConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected BridgeConfigException(String message, String source) {
        super(message);
        this.source = source;
    }

    protected BridgeConfigException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} if in-memory. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
