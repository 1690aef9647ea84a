package io.bridgeconfig.core.canonical;

import static io.bridgeconfig.core.canonical.FieldNames.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridgeconfig.core.error.ConfigIssue;
import io.bridgeconfig.core.error.SchemaViolationException;
import io.bridgeconfig.core.model.ChainConfig;
import io.bridgeconfig.core.model.Configuration;
import io.bridgeconfig.core.model.FillManagerConfig;
import io.bridgeconfig.core.model.RequestManagerConfig;
import io.bridgeconfig.core.model.TokenConfig;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps a {@link Configuration} to its JSON tree and back, using the names in
 * {@link FieldNames}. The tree produced by {@link #encode} is the input of the canonical
 * writer; {@link #decode} is the only way untyped input becomes a model value.
 *
 * <p>
 * Decoding never coerces: a non-integral number, an out-of-range value or a missing member is
 * reported, not fixed. All violations found anywhere in the tree are reported together in one
 * {@link SchemaViolationException}.
 */
public final class ConfigurationCodec {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ConfigurationCodec() {}

    /** Projects {@code config} to a JSON object in canonical member order, without checksum. */
    public static ObjectNode encode(Configuration config) {
        ObjectNode root = NODES.objectNode();
        root.put(BLOCK, config.block());
        root.put(CHAIN_ID, config.chainId());
        ObjectNode addresses = root.putObject(TOKEN_ADDRESSES);
        config.tokenAddresses().forEach(addresses::put);
        root.set(REQUEST_MANAGER, encode(config.requestManager()));
        root.set(FILL_MANAGER, encode(config.fillManager()));
        return root;
    }

    private static ObjectNode encode(RequestManagerConfig requestManager) {
        ObjectNode node = NODES.objectNode();
        node.put(MIN_FEE_PPM, requestManager.minFeePpm());
        node.put(LP_FEE_PPM, requestManager.lpFeePpm());
        node.put(PROTOCOL_FEE_PPM, requestManager.protocolFeePpm());
        ObjectNode chains = node.putObject(CHAINS);
        requestManager.chains().forEach((chainId, chain) -> {
            ObjectNode chainNode = chains.putObject(ChainIds.key(chainId));
            chainNode.put(FINALITY_PERIOD, chain.finalityPeriod());
            chainNode.put(TARGET_WEIGHT_PPM, chain.targetWeightPpm());
            chainNode.put(TRANSFER_COST, chain.transferCost());
        });
        ObjectNode tokens = node.putObject(TOKENS);
        requestManager.tokens().forEach((symbol, token) -> {
            ObjectNode tokenNode = tokens.putObject(symbol);
            tokenNode.put(TRANSFER_LIMIT, token.transferLimit());
            tokenNode.put(ETH_IN_TOKEN, token.ethInToken());
        });
        addAll(node.putArray(WHITELIST), requestManager.whitelist());
        return node;
    }

    private static ObjectNode encode(FillManagerConfig fillManager) {
        ObjectNode node = NODES.objectNode();
        addAll(node.putArray(WHITELIST), fillManager.whitelist());
        return node;
    }

    private static void addAll(ArrayNode array, Set<String> values) {
        for (String value : values) {
            array.add(value);
        }
    }

    /**
     * Constructs a configuration from untyped JSON (without its checksum member).
     *
     * @param data   parsed state file content
     * @param source file the data came from, for error reporting; may be null
     * @return the constructed configuration; cross-field rules are not checked here
     * @throws SchemaViolationException listing every structural and range violation
     */
    public static Configuration decode(JsonNode data, String source) {
        List<ConfigIssue> structural = StateFileSchema.validate(data);
        if (!structural.isEmpty()) {
            throw new SchemaViolationException(structural, source);
        }
        Reader reader = new Reader(source);
        Configuration config = reader.configuration(data);
        if (!reader.issues.isEmpty()) {
            throw new SchemaViolationException(reader.issues, source);
        }
        return config;
    }

    /**
     * Walks a structurally valid tree and builds the records, collecting violations instead of
     * failing on the first. A record is constructed whenever its own members could be read, so
     * its own constraints are checked even if a nested record failed; a record that failed, or
     * that contains one that failed, comes back as {@code null}.
     */
    private static final class Reader {

        private final String source;
        private final List<ConfigIssue> issues = new ArrayList<>();

        Reader(String source) {
            this.source = source;
        }

        Configuration configuration(JsonNode node) {
            String root = ConfigIssue.ROOT;
            int before = issues.size();
            Long block = longAt(node, BLOCK, root);
            Long chainId = longAt(node, CHAIN_ID, root);
            boolean scalarsRead = issues.size() == before;
            Map<String, String> tokenAddresses = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> entry : node.get(TOKEN_ADDRESSES).properties()) {
                tokenAddresses.put(entry.getKey(), entry.getValue().textValue());
            }
            RequestManagerConfig requestManager =
                    requestManager(node.get(REQUEST_MANAGER), ConfigIssue.child(root, REQUEST_MANAGER));
            FillManagerConfig fillManager =
                    fillManager(node.get(FILL_MANAGER), ConfigIssue.child(root, FILL_MANAGER));
            if (!scalarsRead) {
                return null;
            }
            // stand-ins for failed children so that this record still checks its own fields
            Configuration config = construct(
                    root,
                    () -> new Configuration(
                            block,
                            chainId,
                            tokenAddresses,
                            requestManager != null ? requestManager : RequestManagerConfig.initial(),
                            fillManager != null ? fillManager : FillManagerConfig.empty()));
            return requestManager != null && fillManager != null ? config : null;
        }

        RequestManagerConfig requestManager(JsonNode node, String path) {
            int before = issues.size();
            Long minFee = longAt(node, MIN_FEE_PPM, path);
            Long lpFee = longAt(node, LP_FEE_PPM, path);
            Long protocolFee = longAt(node, PROTOCOL_FEE_PPM, path);
            boolean scalarsRead = issues.size() == before;

            int childrenBefore = issues.size();
            String chainsPath = ConfigIssue.child(path, CHAINS);
            Map<Long, ChainConfig> chains = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> entry : node.get(CHAINS).properties()) {
                String chainPath = ConfigIssue.child(chainsPath, entry.getKey());
                long chainId;
                try {
                    chainId = ChainIds.parse(entry.getKey());
                } catch (NumberFormatException e) {
                    issues.add(new ConfigIssue(chainPath, ChainIds.rejection(entry.getKey())));
                    continue;
                }
                ChainConfig chain = chain(entry.getValue(), chainPath);
                if (chain != null) {
                    chains.put(chainId, chain);
                }
            }

            String tokensPath = ConfigIssue.child(path, TOKENS);
            Map<String, TokenConfig> tokens = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> entry : node.get(TOKENS).properties()) {
                TokenConfig token = token(entry.getValue(), ConfigIssue.child(tokensPath, entry.getKey()));
                if (token != null) {
                    tokens.put(entry.getKey(), token);
                }
            }
            boolean childrenBuilt = issues.size() == childrenBefore;

            Set<String> whitelist = strings(node.get(WHITELIST));
            if (!scalarsRead) {
                return null;
            }
            RequestManagerConfig config = construct(
                    path, () -> new RequestManagerConfig(minFee, lpFee, protocolFee, chains, tokens, whitelist));
            return childrenBuilt ? config : null;
        }

        FillManagerConfig fillManager(JsonNode node, String path) {
            Set<String> whitelist = strings(node.get(WHITELIST));
            return construct(path, () -> new FillManagerConfig(whitelist));
        }

        ChainConfig chain(JsonNode node, String path) {
            int before = issues.size();
            Long finalityPeriod = longAt(node, FINALITY_PERIOD, path);
            Long targetWeight = longAt(node, TARGET_WEIGHT_PPM, path);
            BigInteger transferCost = bigIntegerAt(node, TRANSFER_COST, path);
            if (issues.size() != before) {
                return null;
            }
            return construct(path, () -> new ChainConfig(finalityPeriod, targetWeight, transferCost));
        }

        TokenConfig token(JsonNode node, String path) {
            int before = issues.size();
            BigInteger transferLimit = bigIntegerAt(node, TRANSFER_LIMIT, path);
            BigInteger ethInToken = bigIntegerAt(node, ETH_IN_TOKEN, path);
            if (issues.size() != before) {
                return null;
            }
            return construct(path, () -> new TokenConfig(transferLimit, ethInToken));
        }

        private <T> T construct(String path, Supplier<T> constructor) {
            try {
                return constructor.get();
            } catch (SchemaViolationException e) {
                issues.addAll(e.under(path, source).issues());
                return null;
            }
        }

        private Long longAt(JsonNode parent, String field, String path) {
            JsonNode value = parent.get(field);
            if (!requireIntegral(value, field, path)) {
                return null;
            }
            if (!value.canConvertToLong()) {
                issues.add(new ConfigIssue(ConfigIssue.child(path, field), "integer out of range: " + value.asText()));
                return null;
            }
            return value.longValue();
        }

        private BigInteger bigIntegerAt(JsonNode parent, String field, String path) {
            JsonNode value = parent.get(field);
            return requireIntegral(value, field, path) ? value.bigIntegerValue() : null;
        }

        private boolean requireIntegral(JsonNode value, String field, String path) {
            if (value == null || !value.isIntegralNumber()) {
                issues.add(new ConfigIssue(
                        ConfigIssue.child(path, field),
                        "expected an integer, got " + (value == null ? "nothing" : value.toString())));
                return false;
            }
            return true;
        }

        private static Set<String> strings(JsonNode array) {
            Set<String> values = new LinkedHashSet<>();
            for (JsonNode element : array) {
                values.add(element.textValue());
            }
            return values;
        }
    }
}
