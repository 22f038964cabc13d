package com.raditha.staleflag.config;

import java.util.List;

/**
 * Configuration for a cleanup run.
 * Defines iteration bounds, parallelism and filtering rules.
 *
 * @param maxBindingHops          Maximum binding hops followed from a flag argument to its literal
 * @param maxFixedPointIterations Maximum simplification and pruning steps per unit
 * @param parallelism             Worker threads used for each stage
 * @param removePublicConstants   Also delete public/protected flag constants once unreferenced
 * @param excludePatterns         File patterns to exclude (glob format)
 */
public record CleanupConfig(
        int maxBindingHops,
        int maxFixedPointIterations,
        int parallelism,
        boolean removePublicConstants,
        List<String> excludePatterns) {

    public static final int DEFAULT_MAX_BINDING_HOPS = 8;
    public static final int DEFAULT_MAX_FIXED_POINT_ITERATIONS = 256;

    /**
     * Validate configuration.
     */
    public CleanupConfig {
        if (maxBindingHops < 1) {
            throw new IllegalArgumentException("maxBindingHops must be >= 1");
        }
        if (maxFixedPointIterations < 1) {
            throw new IllegalArgumentException("maxFixedPointIterations must be >= 1");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    public static CleanupConfig defaults() {
        return new CleanupConfig(
                DEFAULT_MAX_BINDING_HOPS,
                DEFAULT_MAX_FIXED_POINT_ITERATIONS,
                Runtime.getRuntime().availableProcessors(),
                false,
                defaultExcludePatterns());
    }

    /**
     * Default file exclusion patterns.
     */
    static List<String> defaultExcludePatterns() {
        return List.of(
                "**/target/**",
                "**/build/**",
                "**/generated/**",
                "**/.git/**");
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        String path = filePath.replace('\\', '/');
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(path, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** and * wildcards; a leading double star also matches no directory at all.
     */
    private static boolean matchesGlobPattern(String path, String pattern) {
        String regex = pattern
                .replace(".", "\\.")
                .replace("**/", "\u0001")
                .replace("**", "\u0002")
                .replace("*", "[^/]*")
                .replace("\u0001", "(.*/)?")
                .replace("\u0002", ".*");
        return path.matches(regex);
    }
}
