package com.dice.config;

import com.dice.exception.ConfigurationException;
import com.dice.expression.DiceLimits;
import com.dice.explanation.ExplanationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads dice engine configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static DiceConfig load(String path) {
        log.info("Loading dice configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static DiceConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The engine section may sit at the root or under a 'dice' key
        Map<String, Object> diceConfig = root.containsKey("dice")
                ? (Map<String, Object>) root.get("dice")
                : root;

        DiceConfig config;
        try {
            config = DiceConfig.builder()
                    .maxRerolls(getInt(diceConfig, "max-rerolls", DiceConfig.DEFAULT_MAX_REROLLS))
                    .maxExpressionLength(getInt(diceConfig, "max-expression-length",
                            DiceLimits.DEFAULT_MAX_EXPRESSION_LENGTH))
                    .enableCaching(getBoolean(diceConfig, "enable-caching", true))
                    .cacheSize(getInt(diceConfig, "cache-size", DiceConfig.DEFAULT_CACHE_SIZE))
                    .maxDiceCount(getInt(diceConfig, "max-dice-count", DiceLimits.DEFAULT_MAX_DICE_COUNT))
                    .maxDiceSides(getInt(diceConfig, "max-dice-sides", DiceLimits.DEFAULT_MAX_DICE_SIDES))
                    .maxExecutionTimeMs(getLong(diceConfig, "max-execution-time-ms",
                            DiceConfig.DEFAULT_MAX_EXECUTION_TIME_MS))
                    .divisionByZero(parseDivisionPolicy(diceConfig))
                    .explodingRangeMultiplier(getInt(diceConfig, "exploding-range-multiplier",
                            DiceConfig.DEFAULT_EXPLODING_RANGE_MULTIPLIER))
                    .randomSeed(getOptionalLong(diceConfig, "random-seed"))
                    .explanation(parseExplanationOptions((Map<String, Object>) diceConfig.get("explanation")))
                    .build();
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid numeric value in dice configuration: " + e.getMessage(), e);
        }

        log.info("Loaded dice configuration: maxRerolls={}, maxExpressionLength={}, caching={} (size {}), "
                        + "divisionByZero={}, seeded={}",
                config.maxRerolls(), config.maxExpressionLength(), config.enableCaching(), config.cacheSize(),
                config.divisionByZero(), config.randomSeed() != null);

        return config;
    }

    private static DivisionByZeroPolicy parseDivisionPolicy(Map<String, Object> map) {
        String policy = getString(map, "division-by-zero", null);
        if (policy == null || policy.isBlank()) {
            return DivisionByZeroPolicy.ERROR;
        }
        try {
            return DivisionByZeroPolicy.valueOf(policy.toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown division-by-zero policy '" + policy
                    + "'. Expected ERROR or ZERO.", e);
        }
    }

    private static ExplanationOptions parseExplanationOptions(Map<String, Object> map) {
        if (map == null) {
            return ExplanationOptions.defaults();
        }
        ExplanationOptions defaults = ExplanationOptions.defaults();
        ExplanationOptions options = new ExplanationOptions(
                getBoolean(map, "include-tokenization", defaults.includeTokenization()),
                getBoolean(map, "include-parsing", defaults.includeParsing()),
                getBoolean(map, "include-intermediate-steps", defaults.includeIntermediateSteps()),
                getBoolean(map, "include-dice-details", defaults.includeDiceDetails()),
                getBoolean(map, "include-timings", defaults.includeTimings()),
                getBoolean(map, "verbose-mode", defaults.verboseMode())
        );
        log.debug("Parsed explanation options: {}", options);
        return options;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        long wide = value instanceof Number ? ((Number) value).longValue() : Long.parseLong(value.toString());
        if (wide < Integer.MIN_VALUE || wide > Integer.MAX_VALUE) {
            throw new ConfigurationException("'" + key + "' is out of range: " + value);
        }
        return (int) wide;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Long value = getOptionalLong(map, key);
        return value != null ? value : defaultValue;
    }

    private static Long getOptionalLong(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }
}
