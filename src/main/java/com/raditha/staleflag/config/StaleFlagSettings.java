package com.raditha.staleflag.config;

import com.raditha.staleflag.model.ApiPattern;
import com.raditha.staleflag.model.FlagSpec;
import com.raditha.staleflag.model.Treatment;
import com.raditha.staleflag.model.TreatmentKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the cleanup configuration and flag list from Settings (stale-flag.yml)
 * with CLI overrides.
 *
 * Configuration priority: CLI arguments > stale-flag.yml > defaults
 */
public class StaleFlagSettings {

    private static final String CONFIG_KEY = "stale_flag";

    private StaleFlagSettings() {
        /* this is only a utility class */
    }

    /**
     * Load configuration from Settings, applying CLI overrides where provided.
     *
     * @param maxHopsCLI     CLI binding hop limit (0 = use YAML/default)
     * @param parallelismCLI CLI worker count (0 = use YAML/default)
     * @return Complete cleanup configuration
     */
    public static CleanupConfig loadConfig(int maxHopsCLI, int parallelismCLI) {
        Map<String, Object> config = section();
        CleanupConfig defaults = CleanupConfig.defaults();

        int maxHops = maxHopsCLI != 0 ? maxHopsCLI
                : getInt(config, "max_binding_hops", defaults.maxBindingHops());
        int maxIterations = getInt(config, "max_fixed_point_iterations", defaults.maxFixedPointIterations());
        int parallelism = parallelismCLI != 0 ? parallelismCLI
                : getInt(config, "parallelism", defaults.parallelism());
        boolean removePublic = getBoolean(config, "remove_public_constants", defaults.removePublicConstants());

        List<String> excludePatterns = getListString(config, "exclude_patterns");
        if (excludePatterns.isEmpty()) {
            excludePatterns = defaults.excludePatterns();
        }

        return new CleanupConfig(maxHops, maxIterations, parallelism, removePublic, excludePatterns);
    }

    /**
     * Flags to clean. A flag given on the command line replaces the YAML list.
     *
     * @param flagCLI          flag name from the CLI (null = use YAML)
     * @param apiCLI           API pattern from the CLI
     * @param treatmentCLI     treatment value from the CLI (null = true)
     * @param treatmentKindCLI treatment kind from the CLI (null = boolean)
     * @throws IllegalArgumentException when a flag entry is incomplete or invalid
     */
    public static List<FlagSpec> loadFlags(String flagCLI, String apiCLI, String treatmentCLI,
            String treatmentKindCLI) {
        if (flagCLI != null) {
            if (apiCLI == null) {
                throw new IllegalArgumentException("--api is required together with --flag");
            }
            TreatmentKind kind = treatmentKindCLI == null ? TreatmentKind.BOOLEAN
                    : TreatmentKind.fromString(treatmentKindCLI);
            String value = treatmentCLI == null ? "true" : treatmentCLI;
            return List.of(new FlagSpec(flagCLI, ApiPattern.parse(apiCLI), new Treatment(kind, value)));
        }

        List<FlagSpec> flags = new ArrayList<>();
        Object raw = section().get("flags");
        if (!(raw instanceof List<?> entries)) {
            return flags;
        }
        for (Object entry : entries) {
            if (!(entry instanceof Map)) {
                throw new IllegalArgumentException("Invalid flag entry: " + entry);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> flag = (Map<String, Object>) entry;
            flags.add(toFlagSpec(flag));
        }
        return flags;
    }

    private static FlagSpec toFlagSpec(Map<String, Object> flag) {
        String name = getString(flag, "name", null);
        String api = getString(flag, "api", null);
        if (name == null || api == null) {
            throw new IllegalArgumentException("Flag entries need a name and an api: " + flag);
        }
        int argumentIndex = getInt(flag, "argument_index", 0);
        TreatmentKind kind = TreatmentKind.fromString(getString(flag, "treatment_kind", "boolean"));
        String treatment = getString(flag, "treatment", "true");
        ApiPattern pattern = api.indexOf('#') >= 0 ? ApiPattern.parse(api) : ApiPattern.parse(api, argumentIndex);
        return new FlagSpec(name, pattern, new Treatment(kind, treatment));
    }

    private static Map<String, Object> section() {
        Object yamlConfigRaw = Settings.getProperty(CONFIG_KEY);
        if (yamlConfigRaw instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) yamlConfigRaw;
            return config;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            return (List<String>) value;
        }
        return List.of();
    }
}
