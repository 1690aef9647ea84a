package io.bridgeconfig.core.error;

import java.util.Objects;

/**
 * A single finding against a configuration value: where it is and what is wrong with it.
 *
 * <p>
 * {@code path} is a JSONPath-style location using the external field names of the state file,
 * e.g. {@code $.RequestManager.lp_fee_ppm} or {@code $.token_addresses.USDC}. The root value
 * is {@code $}.
 *
 * @param path    location of the offending value
 * @param message what constraint the value violates
 */
public record ConfigIssue(String path, String message) {

    /** Root location. */
    public static final String ROOT = "$";

    public ConfigIssue {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /** Creates an issue for the named field directly below the root. */
    public static ConfigIssue field(String fieldName, String message) {
        return new ConfigIssue(child(ROOT, fieldName), message);
    }

    /** Appends a member name to a path. */
    public static String child(String path, String name) {
        return path + "." + name;
    }

    /**
     * Re-roots this issue below {@code prefix}: {@code $.x} under {@code $.RequestManager}
     * becomes {@code $.RequestManager.x}.
     */
    public ConfigIssue under(String prefix) {
        if (path.equals(ROOT)) {
            return new ConfigIssue(prefix, message);
        }
        if (path.startsWith(ROOT)) {
            return new ConfigIssue(prefix + path.substring(ROOT.length()), message);
        }
        return new ConfigIssue(child(prefix, path), message);
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
