package io.bridgeconfig.deployment;

import io.bridgeconfig.deployment.error.DeploymentLookupException;
import io.bridgeconfig.deployment.model.ContractInfo;
import io.bridgeconfig.deployment.model.DeploymentInfo;
import io.bridgeconfig.deployment.spi.ChainClient;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Binds the contracts of a deployment for the chain a {@link ChainClient} is connected to. */
public final class DeploymentContracts {

    private static final Logger LOG = LoggerFactory.getLogger(DeploymentContracts.class);

    private DeploymentContracts() {
        // utility class
    }

    /**
     * Loads the deployment in {@code deploymentDir} and binds every contract deployed on the
     * client's chain.
     *
     * @return contract name to handle, in manifest order
     * @throws DeploymentLookupException if the deployment cannot be read or has no entry for the
     *                                   client's chain
     */
    public static <C> Map<String, C> forClient(ChainClient<C> client, Path deploymentDir) {
        return bind(client, DeploymentInfoLoader.load(deploymentDir));
    }

    /** Binds the contracts of an already loaded deployment for the client's chain. */
    public static <C> Map<String, C> bind(ChainClient<C> client, DeploymentInfo deployment) {
        Objects.requireNonNull(client, "client must not be null");
        long chainId = client.chainId();
        Map<String, C> contracts = new LinkedHashMap<>();
        for (Map.Entry<String, ContractInfo> entry : deployment.contractsFor(chainId).entrySet()) {
            contracts.put(entry.getKey(), client.bind(entry.getKey(), entry.getValue()));
        }
        LOG.debug("Bound {} contracts on chain {}", contracts.size(), chainId);
        return Collections.unmodifiableMap(contracts);
    }
}
