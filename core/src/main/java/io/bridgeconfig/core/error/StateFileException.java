package io.bridgeconfig.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Abstract parent for failures while constructing, loading or saving a configuration state.
 * Carries every underlying finding as an ordered list of {@link ConfigIssue}s so callers can
 * render all of them at once.
 */
public abstract class StateFileException extends BridgeConfigException {

    private static final long serialVersionUID = 1L;

    private final List<ConfigIssue> issues;

    protected StateFileException(String summary, List<ConfigIssue> issues, String source) {
        super(render(summary, issues), source);
        this.issues = List.copyOf(issues);
    }

    protected StateFileException(String summary, List<ConfigIssue> issues, Throwable cause, String source) {
        super(render(summary, issues), cause, source);
        this.issues = List.copyOf(issues);
    }

    /** Every finding, in the order it was detected. Never empty for validation kinds. */
    public List<ConfigIssue> issues() {
        return issues;
    }

    private static String render(String summary, List<ConfigIssue> issues) {
        if (issues.isEmpty()) {
            return summary;
        }
        return summary + ":\n" + issues.stream().map(ConfigIssue::toString).collect(Collectors.joining("\n"));
    }
}
