package io.bridgeconfig.core.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fill manager parameters. The whitelist holds the addresses allowed to fill requests; operators
 * are added and removed over the lifetime of a deployment, each change producing a new value.
 *
 * @param whitelist addresses authorized to fill, in insertion order
 */
public record FillManagerConfig(Set<String> whitelist) {

    public FillManagerConfig {
        whitelist = FieldChecks.orderedCopy(whitelist, "whitelist");
    }

    /** Creates a fill manager config with an empty whitelist. */
    public static FillManagerConfig empty() {
        return new FillManagerConfig(Set.of());
    }

    /** Returns a copy with {@code address} appended to the whitelist (no-op if present). */
    public FillManagerConfig withWhitelisted(String address) {
        Set<String> updated = new LinkedHashSet<>(whitelist);
        updated.add(address);
        return new FillManagerConfig(updated);
    }

    /** Returns a copy without {@code address} in the whitelist. */
    public FillManagerConfig withoutWhitelisted(String address) {
        Set<String> updated = new LinkedHashSet<>(whitelist);
        updated.remove(address);
        return new FillManagerConfig(updated);
    }
}
