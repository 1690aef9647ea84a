package io.bridgeconfig.core.validation;

import io.bridgeconfig.core.canonical.FieldNames;
import io.bridgeconfig.core.error.ConfigIssue;
import io.bridgeconfig.core.error.ValidationFailureException;
import io.bridgeconfig.core.model.Configuration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Cross-field rules of a {@link Configuration} that the record constructors cannot check on
 * their own:
 * <ul>
 * <li>every entry of {@code token_addresses} is a checksum address</li>
 * <li>every token in {@code RequestManager.tokens} has an entry in {@code token_addresses}</li>
 * </ul>
 *
 * <p>
 * Both checks always run and every finding is reported, in check order. Stateless.
 */
public final class ConfigurationValidator {

    private static final String TOKEN_ADDRESSES_PATH = ConfigIssue.child(ConfigIssue.ROOT, FieldNames.TOKEN_ADDRESSES);

    private ConfigurationValidator() {}

    /** Returns all findings; an empty list means the configuration is valid. */
    public static List<ConfigIssue> validate(Configuration config) {
        return validate(config.tokenAddresses(), config.requestManager().tokens().keySet());
    }

    /**
     * Runs the same checks on the members they read, for input that could not be built into a
     * {@link Configuration}.
     *
     * @param tokenAddresses token symbol to address, as in {@code token_addresses}
     * @param tokenSymbols   the symbols of {@code RequestManager.tokens}
     */
    public static List<ConfigIssue> validate(Map<String, String> tokenAddresses, Collection<String> tokenSymbols) {
        List<ConfigIssue> issues = new ArrayList<>();
        issues.addAll(checkTokenAddresses(tokenAddresses));
        issues.addAll(checkTokenCoverage(tokenAddresses, tokenSymbols));
        return issues;
    }

    /**
     * Runs {@link #validate(Configuration)} and throws if there is any finding.
     *
     * @param source file the configuration came from, may be null
     * @throws ValidationFailureException with every finding
     */
    public static void requireValid(Configuration config, String source) {
        List<ConfigIssue> issues = validate(config);
        if (!issues.isEmpty()) {
            throw new ValidationFailureException(issues, source);
        }
    }

    static List<ConfigIssue> checkTokenAddresses(Map<String, String> tokenAddresses) {
        List<ConfigIssue> issues = new ArrayList<>();
        for (Map.Entry<String, String> entry : tokenAddresses.entrySet()) {
            if (!ChecksumAddresses.isChecksumAddress(entry.getValue())) {
                issues.add(new ConfigIssue(
                        ConfigIssue.child(TOKEN_ADDRESSES_PATH, entry.getKey()),
                        "expected a checksum address: " + entry.getValue()));
            }
        }
        return issues;
    }

    static List<ConfigIssue> checkTokenCoverage(Map<String, String> tokenAddresses, Collection<String> tokenSymbols) {
        List<ConfigIssue> issues = new ArrayList<>();
        for (String symbol : tokenSymbols) {
            if (!tokenAddresses.containsKey(symbol)) {
                issues.add(new ConfigIssue(TOKEN_ADDRESSES_PATH, "missing address for token " + symbol));
            }
        }
        return issues;
    }
}
