package io.shortcode.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.shortcode.core.engine.RenderBudget;
import io.shortcode.core.engine.RenderOptions;
import io.shortcode.core.engine.UnknownDirectivePolicy;
import io.shortcode.core.error.ConfigLoadException;
import io.shortcode.core.model.DuplicateArgumentPolicy;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link RenderOptions} from a YAML file with optional environment
 * variable overlay.
 *
 * <p>
 * Layout:
 *
 * <pre>
 * render:
 *   unknown-directive: fail          # fail | preserve
 *   duplicate-arguments: last-wins   # last-wins | first-wins | reject
 *   placeholder: "@@SHORTCODE@@"
 * budget:
 *   max-handler-ms: 1000
 *   max-output-chars: 16777216
 * </pre>
 *
 * <p>
 * Missing keys receive the defaults from {@link RenderOptions.Builder};
 * unrecognized keys are rejected so that typos surface at load time.
 *
 * <p>
 * Environment variable overlay: every key can be overridden by its
 * {@code SHORTCODE_*} variable. An env var is considered "set" if and only if
 * it is defined AND its trimmed value is non-empty.
 */
public final class RenderOptionsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RenderOptionsLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_UNKNOWN_DIRECTIVE = "SHORTCODE_UNKNOWN_DIRECTIVE";
    static final String ENV_DUPLICATE_ARGUMENTS = "SHORTCODE_DUPLICATE_ARGUMENTS";
    static final String ENV_PLACEHOLDER = "SHORTCODE_PLACEHOLDER";
    static final String ENV_MAX_HANDLER_MS = "SHORTCODE_MAX_HANDLER_MS";
    static final String ENV_MAX_OUTPUT_CHARS = "SHORTCODE_MAX_OUTPUT_CHARS";

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("render", "budget");
    private static final Set<String> KNOWN_RENDER_KEYS =
            Set.of("unknown-directive", "duplicate-arguments", "placeholder");
    private static final Set<String> KNOWN_BUDGET_KEYS = Set.of("max-handler-ms", "max-output-chars");

    private RenderOptionsLoader() {
        // utility class
    }

    /**
     * Loads options from the given YAML file, applying environment variable
     * overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or
     *                             holds an invalid value
     */
    public static RenderOptions load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads options from the given YAML file, applying environment variable
     * overrides from the supplied lookup function. Returning {@code null} from
     * {@code envLookup} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or
     *                             holds an invalid value
     */
    public static RenderOptions load(Path configPath, Function<String, String> envLookup) {
        String source = configPath.toString();
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath, source);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return fromTree(YAML_MAPPER.readTree(in), envLookup, source);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e, source);
        }
    }

    /**
     * Parses options from YAML text.
     *
     * @param yaml      configuration text
     * @param envLookup environment variable lookup function
     * @param source    name used in error messages
     */
    public static RenderOptions parse(String yaml, Function<String, String> envLookup, String source) {
        try {
            return fromTree(YAML_MAPPER.readTree(yaml), envLookup, source);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + source, e, source);
        }
    }

    private static RenderOptions fromTree(JsonNode root, Function<String, String> envLookup, String source) {
        // an empty document parses to null or MissingNode
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + source, source);
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "", source);

        JsonNode render = section(root, "render", source);
        JsonNode budget = section(root, "budget", source);
        rejectUnknownKeys(render, KNOWN_RENDER_KEYS, "render.", source);
        rejectUnknownKeys(budget, KNOWN_BUDGET_KEYS, "budget.", source);

        String unknownDirective = override(envLookup, ENV_UNKNOWN_DIRECTIVE, textOrNull(render, "unknown-directive"));
        String duplicateArguments =
                override(envLookup, ENV_DUPLICATE_ARGUMENTS, textOrNull(render, "duplicate-arguments"));
        String placeholder = override(envLookup, ENV_PLACEHOLDER, textOrNull(render, "placeholder"));
        String maxHandlerMs = override(envLookup, ENV_MAX_HANDLER_MS, textOrNull(budget, "max-handler-ms"));
        String maxOutputChars = override(envLookup, ENV_MAX_OUTPUT_CHARS, textOrNull(budget, "max-output-chars"));

        RenderOptions.Builder builder = RenderOptions.builder();
        if (unknownDirective != null) {
            builder.unknownDirectivePolicy(
                    enumValue(UnknownDirectivePolicy.class, unknownDirective, "render.unknown-directive", source));
        }
        if (duplicateArguments != null) {
            builder.duplicateArgumentPolicy(enumValue(
                    DuplicateArgumentPolicy.class, duplicateArguments, "render.duplicate-arguments", source));
        }
        if (placeholder != null) {
            builder.placeholder(placeholder);
        }
        if (maxHandlerMs != null || maxOutputChars != null) {
            long handlerMs = maxHandlerMs != null
                    ? parseLong(maxHandlerMs, "budget.max-handler-ms", source)
                    : RenderBudget.DEFAULT.maxHandlerMs();
            int outputChars = maxOutputChars != null
                    ? parseInt(maxOutputChars, "budget.max-output-chars", source)
                    : RenderBudget.DEFAULT.maxOutputChars();
            builder.budget(budget(handlerMs, outputChars, source));
        }

        try {
            RenderOptions options = builder.build();
            LOG.info(
                    "Loaded render options from {}: unknown_directive={}, duplicate_arguments={}, max_handler_ms={}, max_output_chars={}",
                    source,
                    options.unknownDirectivePolicy(),
                    options.duplicateArgumentPolicy(),
                    options.budget().maxHandlerMs(),
                    options.budget().maxOutputChars());
            return options;
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + source + ": " + e.getMessage(), e, source);
        }
    }

    private static RenderBudget budget(long handlerMs, int outputChars, String source) {
        try {
            return new RenderBudget(handlerMs, outputChars);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid budget in " + source + ": " + e.getMessage(), e, source);
        }
    }

    private static JsonNode section(JsonNode root, String name, String source) {
        JsonNode node = root.path(name);
        if (node.isMissingNode() || node.isNull()) {
            return YAML_MAPPER.createObjectNode();
        }
        if (!node.isObject()) {
            throw new ConfigLoadException("'" + name + "' must be a mapping in " + source, source);
        }
        return node;
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> known, String prefix, String source) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                throw new ConfigLoadException(
                        "Unknown configuration key '" + prefix + name + "' in " + source + "; expected one of "
                                + known,
                        source);
            }
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String override(Function<String, String> envLookup, String envName, String yamlValue) {
        String env = envLookup.apply(envName);
        if (env != null && !env.trim().isEmpty()) {
            LOG.debug("Configuration overridden by environment: {}", envName);
            return env.trim();
        }
        return yamlValue;
    }

    private static long parseLong(String value, String key, String source) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("'" + key + "' must be an integer, got: '" + value + "'", e, source);
        }
    }

    private static int parseInt(String value, String key, String source) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("'" + key + "' must be an int, got: '" + value + "'", e, source);
        }
    }

    /** Accepts {@code last-wins}, {@code LAST_WINS}, {@code Last_Wins}. */
    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, String key, String source) {
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        throw new ConfigLoadException(
                String.format("Invalid value '%s' for '%s' in %s", value, key, source), source);
    }
}
