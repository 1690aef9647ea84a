package io.bridgeconfig.core.model;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Request manager parameters: fees, supported chains, supported tokens and the LP whitelist.
 *
 * <p>
 * Map and set iteration order is the insertion order and is preserved through serialization.
 *
 * @param minFeePpm      minimum fee, in ppm
 * @param lpFeePpm       liquidity provider fee, in ppm, at most 999999
 * @param protocolFeePpm protocol fee, in ppm, at most 999999
 * @param chains         chain id to chain parameters; every chain id is at least 1
 * @param tokens         token symbol to token limits
 * @param whitelist      addresses of whitelisted liquidity providers
 */
public record RequestManagerConfig(
        long minFeePpm,
        long lpFeePpm,
        long protocolFeePpm,
        Map<Long, ChainConfig> chains,
        Map<String, TokenConfig> tokens,
        Set<String> whitelist) {

    public RequestManagerConfig {
        chains = FieldChecks.orderedCopy(chains, "chains");
        tokens = FieldChecks.orderedCopy(tokens, "tokens");
        whitelist = FieldChecks.orderedCopy(whitelist, "whitelist");
        FieldChecks.start()
                .atLeast("min_fee_ppm", minFeePpm, 0)
                .ppm("lp_fee_ppm", lpFeePpm)
                .ppm("protocol_fee_ppm", protocolFeePpm)
                .chainIds("chains", chains.keySet())
                .throwIfAny();
    }

    /** Zero fees, no chains, no tokens, empty whitelist. */
    public static RequestManagerConfig initial() {
        return new RequestManagerConfig(0, 0, 0, Map.of(), Map.of(), Set.of());
    }

    public RequestManagerConfig withFees(long minFeePpm, long lpFeePpm, long protocolFeePpm) {
        return new RequestManagerConfig(minFeePpm, lpFeePpm, protocolFeePpm, chains, tokens, whitelist);
    }

    /** Returns a copy with {@code chainId} set to {@code config}, replacing any existing entry in place. */
    public RequestManagerConfig withChain(long chainId, ChainConfig config) {
        Map<Long, ChainConfig> updated = new LinkedHashMap<>(chains);
        updated.put(chainId, config);
        return new RequestManagerConfig(minFeePpm, lpFeePpm, protocolFeePpm, updated, tokens, whitelist);
    }

    public RequestManagerConfig withoutChain(long chainId) {
        Map<Long, ChainConfig> updated = new LinkedHashMap<>(chains);
        updated.remove(chainId);
        return new RequestManagerConfig(minFeePpm, lpFeePpm, protocolFeePpm, updated, tokens, whitelist);
    }

    /** Returns a copy with {@code symbol} set to {@code config}, replacing any existing entry in place. */
    public RequestManagerConfig withToken(String symbol, TokenConfig config) {
        Map<String, TokenConfig> updated = new LinkedHashMap<>(tokens);
        updated.put(symbol, config);
        return new RequestManagerConfig(minFeePpm, lpFeePpm, protocolFeePpm, chains, updated, whitelist);
    }

    public RequestManagerConfig withoutToken(String symbol) {
        Map<String, TokenConfig> updated = new LinkedHashMap<>(tokens);
        updated.remove(symbol);
        return new RequestManagerConfig(minFeePpm, lpFeePpm, protocolFeePpm, chains, updated, whitelist);
    }

    public RequestManagerConfig withWhitelisted(String address) {
        Set<String> updated = new LinkedHashSet<>(whitelist);
        updated.add(address);
        return new RequestManagerConfig(minFeePpm, lpFeePpm, protocolFeePpm, chains, tokens, updated);
    }

    public RequestManagerConfig withoutWhitelisted(String address) {
        Set<String> updated = new LinkedHashSet<>(whitelist);
        updated.remove(address);
        return new RequestManagerConfig(minFeePpm, lpFeePpm, protocolFeePpm, chains, tokens, updated);
    }
}
