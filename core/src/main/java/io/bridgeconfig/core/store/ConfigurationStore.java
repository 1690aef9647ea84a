package io.bridgeconfig.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridgeconfig.core.canonical.CanonicalJson;
import io.bridgeconfig.core.canonical.ChainIds;
import io.bridgeconfig.core.canonical.ConfigurationCodec;
import io.bridgeconfig.core.canonical.FieldNames;
import io.bridgeconfig.core.error.ChecksumMismatchException;
import io.bridgeconfig.core.error.ConfigIssue;
import io.bridgeconfig.core.error.MalformedInputException;
import io.bridgeconfig.core.error.SchemaViolationException;
import io.bridgeconfig.core.error.StateFileException;
import io.bridgeconfig.core.error.StateWriteException;
import io.bridgeconfig.core.error.ValidationFailureException;
import io.bridgeconfig.core.model.Configuration;
import io.bridgeconfig.core.validation.ConfigurationValidator;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads and saves checksum-verified state files.
 *
 * <p>
 * A state file is the canonical serialization of a {@link Configuration} with a
 * {@code checksum} member inserted first. Loading accepts a file only if it is well-formed,
 * every field satisfies its constraint, the cross-field rules hold and the stored checksum
 * equals the checksum recomputed from the loaded value. There is no partial success.
 *
 * <p>
 * Every call opens, reads or writes, and closes the file once. Concurrent writers of the same
 * path are not coordinated. Stateless and thread-safe.
 */
public final class ConfigurationStore {

    private static final ObjectMapper JSON =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final String CHAINS_PATH = ConfigIssue.child(
            ConfigIssue.child(ConfigIssue.ROOT, FieldNames.REQUEST_MANAGER), FieldNames.CHAINS);

    /** Permissions of a newly created state file, where the file system supports them. */
    private static final Set<PosixFilePermission> NEW_FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private ConfigurationStore() {
        // utility class
    }

    /**
     * Loads and verifies the state file at {@code path}.
     *
     * @return the verified configuration
     * @throws MalformedInputException    if the file cannot be read or parsed, has no checksum,
     *                                    or keys a chain by a non-integer
     * @throws SchemaViolationException   if any field violates its constraint; the issues also
     *                                    list every broken cross-field rule
     * @throws ValidationFailureException if only cross-field rules are broken
     * @throws ChecksumMismatchException  if the stored checksum does not match the content
     */
    public static Configuration load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedInputException(
                    new ConfigIssue(ConfigIssue.ROOT, "failed to read state file: " + e.getMessage()), e, source);
        }
        return parse(text, source);
    }

    /**
     * Loads and verifies state file content that is already in memory.
     *
     * @param text   the state file content
     * @param source where the content came from, for error reporting; may be null
     * @see #load(Path)
     */
    public static Configuration parse(String text, String source) {
        ObjectNode data = readObject(text, source);
        List<ConfigIssue> keyIssues = normalizeChainKeys(data, source);
        String storedChecksum = removeChecksum(data, source);
        Configuration config;
        try {
            config = ConfigurationCodec.decode(data, source);
        } catch (SchemaViolationException e) {
            throw schemaViolation(keyIssues, e.issues(), validatorIssues(data), source);
        }
        if (!keyIssues.isEmpty()) {
            throw schemaViolation(keyIssues, List.of(), ConfigurationValidator.validate(config), source);
        }
        ConfigurationValidator.requireValid(config, source);
        String computedChecksum = config.computeChecksum();
        if (!storedChecksum.equals(computedChecksum)) {
            throw new ChecksumMismatchException(storedChecksum, computedChecksum, source);
        }
        return config;
    }

    /**
     * Loads the state file at {@code path} and returns its verified checksum.
     *
     * @throws StateFileException as {@link #load(Path)}
     */
    public static String verify(Path path) {
        return load(path).computeChecksum();
    }

    /**
     * Renders {@code config} as state file text: {@code checksum} first, then the canonical
     * members, 4-space indentation and a trailing newline.
     */
    public static String render(Configuration config) {
        ObjectNode data = JSON.createObjectNode();
        data.put(FieldNames.CHECKSUM, config.computeChecksum());
        data.setAll(ConfigurationCodec.encode(config));
        return CanonicalJson.write(data);
    }

    /**
     * Writes {@code config} to {@code path}. The content is written to a temporary file next to
     * the target which then replaces the target, so a failed save never leaves a truncated
     * file behind. A configuration that breaks a cross-field rule is refused, since it could
     * not be loaded again.
     *
     * @throws ValidationFailureException if a cross-field rule is broken; nothing is written
     * @throws StateWriteException        if the file cannot be written or moved into place
     */
    public static void save(Configuration config, Path path) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(path, "path must not be null");
        ConfigurationValidator.requireValid(config, path.toString());
        String text = render(config);
        Path target = path.toAbsolutePath();
        Path temp;
        try {
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        } catch (IOException e) {
            throw new StateWriteException("Failed to create temporary file for " + path, e, path.toString());
        }
        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writer.write(text);
            }
            applyPermissions(temp, target);
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new StateWriteException("Failed to write state file " + path, e, path.toString());
        }
    }

    /** Temporary files are private; give the result the target's permissions, or the defaults. */
    private static void applyPermissions(Path temp, Path target) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(temp, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        if (Files.exists(target)) {
            view.setPermissions(Files.getPosixFilePermissions(target));
        } else {
            view.setPermissions(NEW_FILE_PERMISSIONS);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, IOException failure) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static ObjectNode readObject(String text, String source) {
        JsonNode root;
        try {
            root = JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException(
                    new ConfigIssue(ConfigIssue.ROOT, "invalid JSON: " + e.getOriginalMessage()), e, source);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedInputException(
                    new ConfigIssue(ConfigIssue.ROOT, "expected a JSON object at top level"), source);
        }
        return (ObjectNode) root;
    }

    /**
     * Rewrites the keys of {@code RequestManager.chains} to their numeric form, so that
     * {@code " 10"} and {@code "+10"} both become {@code "10"}. A later duplicate replaces the
     * earlier value and keeps the earlier position. Other shapes are left for the schema check.
     *
     * @return one issue per integer key that does not fit a chain id; those entries are dropped
     * @throws MalformedInputException if a key is not an integer at all
     */
    private static List<ConfigIssue> normalizeChainKeys(ObjectNode data, String source) {
        JsonNode requestManager = data.get(FieldNames.REQUEST_MANAGER);
        if (requestManager == null || !requestManager.isObject()) {
            return List.of();
        }
        JsonNode chains = requestManager.get(FieldNames.CHAINS);
        if (chains == null || !chains.isObject()) {
            return List.of();
        }
        List<ConfigIssue> outOfRange = new ArrayList<>();
        ObjectNode normalized = JSON.createObjectNode();
        for (Map.Entry<String, JsonNode> entry : chains.properties()) {
            String key = entry.getKey();
            long chainId;
            try {
                chainId = ChainIds.parse(key);
            } catch (NumberFormatException e) {
                ConfigIssue issue = new ConfigIssue(ConfigIssue.child(CHAINS_PATH, key), ChainIds.rejection(key));
                if (!ChainIds.isInteger(key)) {
                    throw new MalformedInputException(issue, e, source);
                }
                outOfRange.add(issue);
                continue;
            }
            normalized.set(ChainIds.key(chainId), entry.getValue());
        }
        ((ObjectNode) requestManager).set(FieldNames.CHAINS, normalized);
        return outOfRange;
    }

    /**
     * Cross-field findings for input that failed to decode, read from whatever members have the
     * right shape.
     */
    private static List<ConfigIssue> validatorIssues(ObjectNode data) {
        Map<String, String> tokenAddresses = new LinkedHashMap<>();
        JsonNode addresses = data.get(FieldNames.TOKEN_ADDRESSES);
        if (addresses != null && addresses.isObject()) {
            for (Map.Entry<String, JsonNode> entry : addresses.properties()) {
                if (entry.getValue().isTextual()) {
                    tokenAddresses.put(entry.getKey(), entry.getValue().textValue());
                }
            }
        }
        List<String> tokenSymbols = new ArrayList<>();
        JsonNode requestManager = data.get(FieldNames.REQUEST_MANAGER);
        JsonNode tokens = requestManager == null ? null : requestManager.get(FieldNames.TOKENS);
        if (tokens != null && tokens.isObject()) {
            tokens.fieldNames().forEachRemaining(tokenSymbols::add);
        }
        return ConfigurationValidator.validate(tokenAddresses, tokenSymbols);
    }

    /** One failure with the field violations first and the cross-field findings after them. */
    private static SchemaViolationException schemaViolation(
            List<ConfigIssue> keyIssues,
            List<ConfigIssue> fieldIssues,
            List<ConfigIssue> crossFieldIssues,
            String source) {
        List<ConfigIssue> issues = new ArrayList<>(keyIssues);
        issues.addAll(fieldIssues);
        issues.addAll(crossFieldIssues);
        return new SchemaViolationException(issues, source);
    }

    private static String removeChecksum(ObjectNode data, String source) {
        JsonNode checksum = data.remove(FieldNames.CHECKSUM);
        if (checksum == null) {
            throw new MalformedInputException(ConfigIssue.field(FieldNames.CHECKSUM, "missing checksum"), source);
        }
        if (!checksum.isTextual()) {
            throw new MalformedInputException(
                    ConfigIssue.field(FieldNames.CHECKSUM, "expected a string, got " + checksum), source);
        }
        return checksum.textValue();
    }
}
