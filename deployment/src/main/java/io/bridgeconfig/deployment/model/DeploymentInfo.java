package io.bridgeconfig.deployment.model;

import io.bridgeconfig.deployment.error.DeploymentLookupException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Contracts of a deployment, per chain: chain id to contract name to {@link ContractInfo}.
 * Immutable, in manifest order.
 */
public final class DeploymentInfo {

    private final Map<Long, Map<String, ContractInfo>> chains;
    private final String source;

    /**
     * @param chains chain id to contracts deployed on that chain; copied
     * @param source directory the deployment was read from, for error reporting
     */
    public DeploymentInfo(Map<Long, Map<String, ContractInfo>> chains, String source) {
        Map<Long, Map<String, ContractInfo>> copy = new LinkedHashMap<>();
        chains.forEach((chainId, contracts) ->
                copy.put(chainId, Collections.unmodifiableMap(new LinkedHashMap<>(contracts))));
        this.chains = Collections.unmodifiableMap(copy);
        this.source = source;
    }

    /** Chain ids with at least a manifest entry. */
    public Set<Long> chainIds() {
        return chains.keySet();
    }

    /** Unmodifiable view of the whole deployment. */
    public Map<Long, Map<String, ContractInfo>> chains() {
        return chains;
    }

    /**
     * Contracts deployed on {@code chainId}.
     *
     * @throws DeploymentLookupException if the deployment has no entry for the chain
     */
    public Map<String, ContractInfo> contractsFor(long chainId) {
        Map<String, ContractInfo> contracts = chains.get(chainId);
        if (contracts == null) {
            throw new DeploymentLookupException(
                    "No deployment for chain " + chainId + "; deployed chains are " + chains.keySet(), source);
        }
        return contracts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeploymentInfo that)) return false;
        return chains.equals(that.chains);
    }

    @Override
    public int hashCode() {
        return chains.hashCode();
    }

    @Override
    public String toString() {
        return "DeploymentInfo" + chains;
    }
}
