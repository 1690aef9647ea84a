package io.bridgeconfig.core.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when one or more fields fail their static constraint (type, range, presence) while a
 * configuration value is being constructed.
 */
public final class SchemaViolationException extends StateFileException {

    private static final long serialVersionUID = 1L;

    public SchemaViolationException(List<ConfigIssue> issues, String source) {
        super("Schema violation", issues, source);
    }

    public SchemaViolationException(List<ConfigIssue> issues) {
        this(issues, null);
    }

    /** Returns the same violations located below {@code prefix}, attributed to {@code source}. */
    public SchemaViolationException under(String prefix, String source) {
        List<ConfigIssue> moved = new ArrayList<>(issues().size());
        for (ConfigIssue issue : issues()) {
            moved.add(issue.under(prefix));
        }
        return new SchemaViolationException(moved, source);
    }
}
