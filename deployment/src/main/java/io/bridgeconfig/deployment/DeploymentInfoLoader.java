package io.bridgeconfig.deployment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bridgeconfig.core.canonical.ChainIds;
import io.bridgeconfig.core.validation.ChecksumAddresses;
import io.bridgeconfig.deployment.error.DeploymentLookupException;
import io.bridgeconfig.deployment.model.ContractInfo;
import io.bridgeconfig.deployment.model.DeploymentInfo;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a deployment directory: a {@code deployment.json} manifest plus one
 * {@code <ContractName>.json} ABI file per contract.
 *
 * <pre>
 * deployment.json
 * {
 *   "chains": {
 *     "10": {
 *       "RequestManager": {"address": "0x...", "deployment_block": 1234},
 *       ...
 *     },
 *     ...
 *   }
 * }
 *
 * RequestManager.json
 * { "abi": [ ... ] }
 * </pre>
 *
 * <p>
 * Each ABI file is read once per load, however many chains the contract is deployed on.
 * Read-only, no network access. Thread-safe.
 */
public final class DeploymentInfoLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DeploymentInfoLoader.class);

    /** Name of the manifest file inside a deployment directory. */
    public static final String MANIFEST_FILE = "deployment.json";

    private static final ObjectMapper JSON = new ObjectMapper();

    private DeploymentInfoLoader() {
        // utility class
    }

    /**
     * Loads the deployment described in {@code deploymentDir}.
     *
     * @param deploymentDir directory holding the manifest and the ABI files
     * @return per-chain contract information, in manifest order
     * @throws DeploymentLookupException if the manifest or an ABI file is missing or malformed
     */
    public static DeploymentInfo load(Path deploymentDir) {
        Objects.requireNonNull(deploymentDir, "deploymentDir must not be null");
        Path manifestPath = deploymentDir.resolve(MANIFEST_FILE);
        JsonNode manifest = readJson(manifestPath);
        JsonNode chainsNode = manifest.get("chains");
        if (chainsNode == null || !chainsNode.isObject()) {
            throw new DeploymentLookupException("Manifest has no 'chains' object", manifestPath.toString());
        }

        Map<String, JsonNode> abis = new LinkedHashMap<>();
        Map<Long, Map<String, ContractInfo>> chains = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> chainEntry : chainsNode.properties()) {
            long chainId = parseChainId(chainEntry.getKey(), manifestPath);
            if (!chainEntry.getValue().isObject()) {
                throw new DeploymentLookupException(
                        "Expected an object of contracts for chain " + chainId, manifestPath.toString());
            }
            Map<String, ContractInfo> contracts = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> contractEntry : chainEntry.getValue().properties()) {
                String name = contractEntry.getKey();
                JsonNode abi = abis.computeIfAbsent(name, n -> loadContractAbi(deploymentDir, n));
                contracts.put(name, contractInfo(name, chainId, contractEntry.getValue(), abi, manifestPath));
            }
            chains.put(chainId, contracts);
            LOG.debug("Chain {}: contracts={}", chainId, contracts.keySet());
        }

        LOG.info("Loaded deployment from {}: chains={}, contracts={}", deploymentDir, chains.keySet(), abis.keySet());
        return new DeploymentInfo(chains, deploymentDir.toString());
    }

    /**
     * Reads the ABI of {@code contractName} from {@code <deploymentDir>/<contractName>.json}.
     *
     * @throws DeploymentLookupException if the file is missing or has no {@code abi} array
     */
    public static JsonNode loadContractAbi(Path deploymentDir, String contractName) {
        Path abiPath = deploymentDir.resolve(contractName + ".json");
        JsonNode abi = readJson(abiPath).get("abi");
        if (abi == null || !abi.isArray()) {
            throw new DeploymentLookupException("Missing 'abi' array for contract " + contractName, abiPath.toString());
        }
        LOG.debug("Loaded ABI for {} ({} entries)", contractName, abi.size());
        return abi;
    }

    private static ContractInfo contractInfo(
            String name, long chainId, JsonNode deployment, JsonNode abi, Path manifestPath) {
        JsonNode address = deployment.get("address");
        JsonNode block = deployment.get("deployment_block");
        if (address == null || !ChecksumAddresses.isHexAddress(address.textValue())) {
            throw new DeploymentLookupException(
                    "Invalid address for " + name + " on chain " + chainId + ": " + address, manifestPath.toString());
        }
        if (block == null || !block.canConvertToExactIntegral() || !block.canConvertToLong()) {
            throw new DeploymentLookupException(
                    "Invalid deployment_block for " + name + " on chain " + chainId + ": " + block,
                    manifestPath.toString());
        }
        return new ContractInfo(address.textValue(), block.longValue(), abi);
    }

    private static long parseChainId(String key, Path manifestPath) {
        try {
            return ChainIds.parse(key);
        } catch (NumberFormatException e) {
            throw new DeploymentLookupException("invalid chain ID: " + key, e, manifestPath.toString());
        }
    }

    private static JsonNode readJson(Path path) {
        JsonNode node;
        try {
            node = JSON.readTree(path.toFile());
        } catch (IOException e) {
            throw new DeploymentLookupException(
                    "Failed to read " + path.getFileName() + ": " + e.getMessage(), e, path.toString());
        }
        if (node == null || !node.isObject()) {
            throw new DeploymentLookupException("Expected a JSON object in " + path.getFileName(), path.toString());
        }
        return node;
    }
}
