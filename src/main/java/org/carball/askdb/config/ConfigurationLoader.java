package org.carball.askdb.config;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > defaults
     */
    public TranslationSettings loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        // Start with defaults
        TranslationSettings.TranslationSettingsBuilder builder = TranslationSettings.defaults().toBuilder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        TranslationSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    private void applyEnvironmentVariables(TranslationSettings.TranslationSettingsBuilder builder) {
        Map<String, String> env = environment;

        if (env.containsKey("ASKDB_TIME_ZONE")) {
            builder.timeZone(parseZone(env.get("ASKDB_TIME_ZONE")));
        }
        if (env.containsKey("ASKDB_MAX_OFFSET_DAYS")) {
            applyNumber("ASKDB_MAX_OFFSET_DAYS", env.get("ASKDB_MAX_OFFSET_DAYS"),
                    v -> builder.maxOffsetDays(Integer.parseInt(v)));
        }
        if (env.containsKey("ASKDB_REQUEST_TIMEOUT_MS")) {
            applyNumber("ASKDB_REQUEST_TIMEOUT_MS", env.get("ASKDB_REQUEST_TIMEOUT_MS"),
                    v -> builder.requestTimeout(Duration.ofMillis(Long.parseLong(v))));
        }
        if (env.containsKey("ASKDB_ROW_LIMIT")) {
            applyNumber("ASKDB_ROW_LIMIT", env.get("ASKDB_ROW_LIMIT"),
                    v -> builder.rowLimit(Integer.parseInt(v)));
        }
        if (env.containsKey("ASKDB_STORE_URL")) {
            builder.storeUrl(env.get("ASKDB_STORE_URL"));
        }
        if (env.containsKey("ASKDB_STORE_API_KEY")) {
            builder.storeApiKey(env.get("ASKDB_STORE_API_KEY"));
        }
        if (env.containsKey("OPENAI_API_KEY")) {
            builder.openAiApiKey(env.get("OPENAI_API_KEY"));
        }
    }

    private void applyCLIArguments(TranslationSettings.TranslationSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--time-zone":
                    builder.timeZone(parseZone(value));
                    break;
                case "--max-offset-days":
                    applyNumber(arg, value, v -> builder.maxOffsetDays(Integer.parseInt(v)));
                    break;
                case "--timeout-ms":
                    applyNumber(arg, value, v -> builder.requestTimeout(Duration.ofMillis(Long.parseLong(v))));
                    break;
                case "--row-limit":
                    applyNumber(arg, value, v -> builder.rowLimit(Integer.parseInt(v)));
                    break;
                case "--store-url":
                    builder.storeUrl(value);
                    break;
                case "--api-key":
                    builder.openAiApiKey(value);
                    break;
                default:
                    break;
            }
        }
    }

    private static void applyNumber(String source, String value, Consumer<String> setter) {
        try {
            setter.accept(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    private static ZoneId parseZone(String value) {
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid time zone: " + value, e);
        }
    }

    /**
     * Returns help text for the configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --time-zone <zone>          Warehouse time zone for day boundaries (default: Europe/London)
              --max-offset-days <num>     Largest accepted day offset in date conditions (default: 365)
              --timeout-ms <num>          Store request timeout in milliseconds (default: 10000)
              --row-limit <num>           Maximum rows fetched per query (default: 10000)
              --store-url <url>           PostgREST root of the warehouse store
              --api-key <key>             OpenAI API key for --question

            Environment Variables:
              ASKDB_TIME_ZONE             Same as --time-zone
              ASKDB_MAX_OFFSET_DAYS       Same as --max-offset-days
              ASKDB_REQUEST_TIMEOUT_MS    Same as --timeout-ms
              ASKDB_ROW_LIMIT             Same as --row-limit
              ASKDB_STORE_URL             Same as --store-url
              ASKDB_STORE_API_KEY         API key sent to the store
              OPENAI_API_KEY              Same as --api-key

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Built-in defaults
            """;
    }
}
