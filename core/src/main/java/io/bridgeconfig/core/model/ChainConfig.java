package io.bridgeconfig.core.model;

import java.math.BigInteger;

/**
 * Per-chain parameters, keyed externally by numeric chain id.
 *
 * @param finalityPeriod  blocks to wait before a block on this chain is final, at least 1
 * @param targetWeightPpm target share of liquidity allocated to this chain, in ppm
 * @param transferCost    estimated gas cost of a transfer on this chain
 */
public record ChainConfig(long finalityPeriod, long targetWeightPpm, BigInteger transferCost) {

    public ChainConfig {
        FieldChecks.start()
                .atLeast("finality_period", finalityPeriod, 1)
                .ppm("target_weight_ppm", targetWeightPpm)
                .nonNegative("transfer_cost", transferCost)
                .throwIfAny();
    }

    public static ChainConfig of(long finalityPeriod, long targetWeightPpm, long transferCost) {
        return new ChainConfig(finalityPeriod, targetWeightPpm, BigInteger.valueOf(transferCost));
    }
}
