package io.bridgeconfig.core.model;

import java.math.BigInteger;

/**
 * Per-token limits, keyed externally by token symbol.
 *
 * @param transferLimit maximum amount of the token transferable in one request
 * @param ethInToken    gas compensation exchange rate (amount of token per ETH)
 */
public record TokenConfig(BigInteger transferLimit, BigInteger ethInToken) {

    public TokenConfig {
        FieldChecks.start()
                .nonNegative("transfer_limit", transferLimit)
                .nonNegative("eth_in_token", ethInToken)
                .throwIfAny();
    }

    public static TokenConfig of(long transferLimit, long ethInToken) {
        return new TokenConfig(BigInteger.valueOf(transferLimit), BigInteger.valueOf(ethInToken));
    }
}
