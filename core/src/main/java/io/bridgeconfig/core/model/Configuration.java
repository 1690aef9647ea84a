package io.bridgeconfig.core.model;

import io.bridgeconfig.core.canonical.ChecksumEngine;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Protocol configuration of a bridge deployment at a given block height. Immutable: every
 * change produces a new value through one of the {@code with...} methods.
 *
 * <p>
 * The constructor enforces the static field constraints only. Cross-field rules (checksum
 * address format, token coverage) are checked by
 * {@link io.bridgeconfig.core.validation.ConfigurationValidator}; loading a state file runs both.
 *
 * @param block          block height at which this snapshot was taken, at least 1
 * @param chainId        home chain id, at least 1
 * @param tokenAddresses token symbol to checksum address of the token on the home chain
 * @param requestManager request manager parameters ({@code RequestManager} in the state file)
 * @param fillManager    fill manager parameters ({@code FillManager} in the state file)
 */
public record Configuration(
        long block,
        long chainId,
        Map<String, String> tokenAddresses,
        RequestManagerConfig requestManager,
        FillManagerConfig fillManager) {

    public Configuration {
        tokenAddresses = FieldChecks.orderedCopy(tokenAddresses, "token_addresses");
        Objects.requireNonNull(requestManager, "requestManager must not be null");
        Objects.requireNonNull(fillManager, "fillManager must not be null");
        FieldChecks.start()
                .atLeast("block", block, 1)
                .atLeast("chain_id", chainId, 1)
                .throwIfAny();
    }

    /**
     * Creates the configuration of a fresh deployment: no tokens, no chains, zero fees and
     * empty whitelists.
     *
     * @param chainId home chain id
     * @param block   block height of the deployment
     */
    public static Configuration initial(long chainId, long block) {
        return new Configuration(
                block, chainId, Map.of(), RequestManagerConfig.initial(), FillManagerConfig.empty());
    }

    /**
     * Digest of the canonical serialization of this value. Always computed from the current
     * content, never taken from a stored checksum.
     *
     * @return lower-case hex SHA-256
     */
    public String computeChecksum() {
        return ChecksumEngine.checksum(this);
    }

    public Configuration withBlock(long block) {
        return new Configuration(block, chainId, tokenAddresses, requestManager, fillManager);
    }

    /** Returns a copy mapping {@code symbol} to {@code address}, replacing any existing entry in place. */
    public Configuration withTokenAddress(String symbol, String address) {
        Map<String, String> updated = new LinkedHashMap<>(tokenAddresses);
        updated.put(symbol, address);
        return new Configuration(block, chainId, updated, requestManager, fillManager);
    }

    public Configuration withoutTokenAddress(String symbol) {
        Map<String, String> updated = new LinkedHashMap<>(tokenAddresses);
        updated.remove(symbol);
        return new Configuration(block, chainId, updated, requestManager, fillManager);
    }

    public Configuration withRequestManager(RequestManagerConfig requestManager) {
        return new Configuration(block, chainId, tokenAddresses, requestManager, fillManager);
    }

    public Configuration withFillManager(FillManagerConfig fillManager) {
        return new Configuration(block, chainId, tokenAddresses, requestManager, fillManager);
    }
}
