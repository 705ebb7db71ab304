package io.rpcmeta.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link DerivationConfig} from a YAML file with an optional environment
 * variable overlay.
 *
 * <pre>{@code
 * matching:
 *   consumption-policy: exclusive      # or first-match
 *   require-all-members-matched: false
 * model:
 *   include-default-methods: false
 * cache:
 *   enabled: true
 * }</pre>
 *
 * <p>
 * Missing keys receive the defaults of {@link DerivationConfig.Builder}.
 * Unknown keys are rejected so that typos surface at load time. Environment
 * variables ({@code RPCMETA_CONSUMPTION_POLICY},
 * {@code RPCMETA_REQUIRE_ALL_MEMBERS_MATCHED},
 * {@code RPCMETA_INCLUDE_DEFAULT_METHODS}, {@code RPCMETA_CACHE_ENABLED}) take
 * precedence over YAML values. An env var counts as set only if it is defined
 * and non-blank.
 */
public final class DerivationConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String CLASSPATH_RESOURCE = "rpc-metadata.yaml";

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("matching", "model", "cache");
    private static final Set<String> KNOWN_MATCHING_KEYS = Set.of("consumption-policy", "require-all-members-matched");
    private static final Set<String> KNOWN_MODEL_KEYS = Set.of("include-default-methods");
    private static final Set<String> KNOWN_CACHE_KEYS = Set.of("enabled");

    private DerivationConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration from the given YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static DerivationConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration from the given YAML file, applying overrides from
     * the supplied lookup. The lookup returns {@code null} for undefined
     * variables.
     */
    public static DerivationConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return fromTree(YAML_MAPPER.readTree(in), envLookup, configPath.toString());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Loads {@code rpc-metadata.yaml} from the classpath if present, otherwise
     * the defaults, then applies environment overrides.
     */
    public static DerivationConfig loadDefault(Function<String, String> envLookup) {
        ClassLoader loader = DerivationConfigLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(CLASSPATH_RESOURCE)) {
            JsonNode root = in != null ? YAML_MAPPER.readTree(in) : YAML_MAPPER.createObjectNode();
            return fromTree(root, envLookup, "classpath:" + CLASSPATH_RESOURCE);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: classpath:" + CLASSPATH_RESOURCE, e);
        }
    }

    private static DerivationConfig fromTree(JsonNode root, Function<String, String> envLookup, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + source);
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "", source);

        DerivationConfig.Builder builder = DerivationConfig.builder();

        JsonNode matching = root.path("matching");
        rejectUnknownKeys(matching, KNOWN_MATCHING_KEYS, "matching.", source);
        if (matching.has("consumption-policy"))
            builder.consumptionPolicy(ConsumptionPolicy.parse(matching.get("consumption-policy").asText()));
        if (matching.has("require-all-members-matched"))
            builder.requireAllMembersMatched(requireBoolean(matching, "require-all-members-matched", source));

        JsonNode model = root.path("model");
        rejectUnknownKeys(model, KNOWN_MODEL_KEYS, "model.", source);
        if (model.has("include-default-methods"))
            builder.includeDefaultMethods(requireBoolean(model, "include-default-methods", source));

        JsonNode cache = root.path("cache");
        rejectUnknownKeys(cache, KNOWN_CACHE_KEYS, "cache.", source);
        if (cache.has("enabled")) builder.cacheEnabled(requireBoolean(cache, "enabled", source));

        // --- Environment variable overlay ---
        envString(envLookup, "RPCMETA_CONSUMPTION_POLICY", v -> builder.consumptionPolicy(ConsumptionPolicy.parse(v)));
        envBool(envLookup, "RPCMETA_REQUIRE_ALL_MEMBERS_MATCHED", builder::requireAllMembersMatched);
        envBool(envLookup, "RPCMETA_INCLUDE_DEFAULT_METHODS", builder::includeDefaultMethods);
        envBool(envLookup, "RPCMETA_CACHE_ENABLED", builder::cacheEnabled);

        return builder.build();
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> known, String prefix, String source) {
        if (!node.isObject()) {
            return;
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                throw new ConfigLoadException("Unknown configuration key '" + prefix + name + "' in " + source);
            }
        }
    }

    private static boolean requireBoolean(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (!value.isBoolean()) {
            throw new ConfigLoadException("Configuration key '" + field + "' must be a boolean in " + source);
        }
        return value.asBoolean();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
