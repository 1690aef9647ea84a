package io.bridgeconfig.core.canonical;

import java.util.regex.Pattern;

/** Chain id keys: JSON object keys are strings, the model keys chains by number. */
public final class ChainIds {

    private static final Pattern INTEGER_KEY = Pattern.compile(StateFileSchema.CHAIN_KEY_PATTERN);

    private ChainIds() {}

    /**
     * Parses a chain id key. Surrounding whitespace and a leading sign are accepted, so
     * {@code " +10"} yields {@code 10}.
     *
     * @throws NumberFormatException if {@code key} is not a decimal integer that fits a long;
     *                               {@link #isInteger} tells the two cases apart
     */
    public static long parse(String key) {
        return Long.parseLong(key.strip());
    }

    /** Whether {@code key} is written as a decimal integer, whatever its magnitude. */
    public static boolean isInteger(String key) {
        return INTEGER_KEY.matcher(key).matches();
    }

    /** Message for a chain key that {@link #parse} rejects. */
    public static String rejection(String key) {
        return isInteger(key) ? "chain id out of range: " + key : "invalid chain ID: " + key;
    }

    /** The key a chain id is written under. */
    public static String key(long chainId) {
        return Long.toString(chainId);
    }
}
