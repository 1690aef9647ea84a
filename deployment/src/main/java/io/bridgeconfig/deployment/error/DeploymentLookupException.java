package io.bridgeconfig.deployment.error;

import io.bridgeconfig.core.error.BridgeConfigException;

/**
 * Thrown when a deployment manifest or contract ABI cannot be read, or when a chain has no
 * deployment. {@link #source()} names the offending file or directory.
 */
public final class DeploymentLookupException extends BridgeConfigException {

    private static final long serialVersionUID = 1L;

    public DeploymentLookupException(String message, String source) {
        super(message, source);
    }

    public DeploymentLookupException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
