package io.bridgeconfig.deployment.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Where a contract is deployed on one chain, and its ABI.
 *
 * @param address         contract address
 * @param deploymentBlock block the contract was deployed in; event scans start here
 * @param abi             the contract ABI (a JSON array), shared between chains
 */
public record ContractInfo(String address, long deploymentBlock, JsonNode abi) {

    public ContractInfo {
        Objects.requireNonNull(address, "address must not be null");
        Objects.requireNonNull(abi, "abi must not be null");
    }
}
