package io.atprose.lexicon.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

/**
 * Loads {@link LexiconConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Recognized keys and their overrides:
 *
 * <pre>
 * handle:
 *   strict: true              # ATPROSE_HANDLE_STRICT
 * did:
 *   max-length: 2048          # ATPROSE_DID_MAX_LENGTH
 *   allowed-methods: [plc]    # ATPROSE_DID_ALLOWED_METHODS (comma separated)
 * union:
 *   open-by-default: false    # ATPROSE_UNION_OPEN_BY_DEFAULT
 * parser:
 *   strict-keys: true         # ATPROSE_PARSER_STRICT_KEYS
 * validation:
 *   max-depth: 128            # ATPROSE_VALIDATION_MAX_DEPTH
 * </pre>
 *
 * <p>
 * Missing keys receive the defaults from {@link LexiconConfig.Builder}. Env vars take precedence
 * over YAML values. An env var is considered "set" if and only if it is defined AND its trimmed
 * value is non-empty.
 */
public final class LexiconConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private LexiconConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid values
     */
    public static LexiconConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from the supplied lookup
     * function. Returning {@code null} from {@code envLookup} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid values
     */
    public static LexiconConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Builds configuration from defaults and environment variables alone. */
    public static LexiconConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration from environment: " + e.getMessage(), e);
        }
    }

    private static LexiconConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        LexiconConfig.Builder builder = LexiconConfig.builder();

        // --- YAML mapping ---

        JsonNode handle = root.path("handle");
        if (handle.has("strict")) builder.strictHandles(requireBoolean(handle, "strict", "handle.strict"));

        JsonNode did = root.path("did");
        if (did.has("max-length")) builder.didMaxLength(requireInt(did, "max-length", "did.max-length"));
        if (did.has("allowed-methods")) builder.didAllowedMethods(methods(did.get("allowed-methods")));

        JsonNode union = root.path("union");
        if (union.has("open-by-default"))
            builder.unionOpenByDefault(requireBoolean(union, "open-by-default", "union.open-by-default"));

        JsonNode parser = root.path("parser");
        if (parser.has("strict-keys")) builder.strictKeys(requireBoolean(parser, "strict-keys", "parser.strict-keys"));

        JsonNode validation = root.path("validation");
        if (validation.has("max-depth")) builder.maxDepth(requireInt(validation, "max-depth", "validation.max-depth"));

        // --- Environment variable overlay ---

        envBool(envLookup, "ATPROSE_HANDLE_STRICT", builder::strictHandles);
        envInt(envLookup, "ATPROSE_DID_MAX_LENGTH", builder::didMaxLength);
        envString(envLookup, "ATPROSE_DID_ALLOWED_METHODS", value -> builder.didAllowedMethods(splitMethods(value)));
        envBool(envLookup, "ATPROSE_UNION_OPEN_BY_DEFAULT", builder::unionOpenByDefault);
        envBool(envLookup, "ATPROSE_PARSER_STRICT_KEYS", builder::strictKeys);
        envInt(envLookup, "ATPROSE_VALIDATION_MAX_DEPTH", builder::maxDepth);

        return builder.build();
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

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
                throw new ConfigLoadException(envVar + " must be true or false, got: '" + value + "'");
            }
            setter.accept(Boolean.parseBoolean(value));
        }
    }

    // --- YAML helpers ---

    private static boolean requireBoolean(JsonNode node, String field, String key) {
        JsonNode value = node.get(field);
        if (!value.isBoolean()) {
            throw new ConfigLoadException("'" + key + "' must be a boolean, got: " + value);
        }
        return value.booleanValue();
    }

    private static int requireInt(JsonNode node, String field, String key) {
        JsonNode value = node.get(field);
        if (!value.isInt()) {
            throw new ConfigLoadException("'" + key + "' must be an integer, got: " + value);
        }
        return value.intValue();
    }

    private static Set<String> methods(JsonNode node) {
        if (node.isTextual()) {
            return splitMethods(node.asText());
        }
        if (!node.isArray()) {
            throw new ConfigLoadException("'did.allowed-methods' must be a list of method names, got: " + node);
        }
        Set<String> methods = new LinkedHashSet<>();
        node.forEach(m -> methods.add(m.asText()));
        return methods;
    }

    private static Set<String> splitMethods(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
