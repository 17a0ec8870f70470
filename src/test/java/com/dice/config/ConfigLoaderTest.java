package com.dice.config;

import com.dice.exception.ConfigurationException;
import com.dice.explanation.ExplanationOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load the bundled configuration")
    void shouldLoadBundledConfiguration() {
        DiceConfig config = ConfigLoader.load("classpath:dice.yaml");

        assertEquals(DiceConfig.defaults().maxRerolls(), config.maxRerolls());
        assertEquals(1000, config.maxExpressionLength());
        assertTrue(config.enableCaching());
        assertEquals(DivisionByZeroPolicy.ERROR, config.divisionByZero());
        assertNull(config.randomSeed());
        assertEquals(ExplanationOptions.defaults(), config.explanation());
    }

    @Test
    @DisplayName("Should load every option from YAML")
    void shouldLoadAllOptions() {
        DiceConfig config = ConfigLoader.load("classpath:dice-test.yaml");

        assertEquals(5, config.maxRerolls());
        assertEquals(50, config.maxExpressionLength());
        assertFalse(config.enableCaching());
        assertEquals(10, config.cacheSize());
        assertEquals(20, config.maxDiceCount());
        assertEquals(100, config.maxDiceSides());
        assertEquals(DiceConfig.DEFAULT_MAX_EXECUTION_TIME_MS, config.maxExecutionTimeMs());
        assertEquals(DivisionByZeroPolicy.ZERO, config.divisionByZero());
        assertEquals(3, config.explodingRangeMultiplier());
        assertEquals(42L, config.randomSeed());

        ExplanationOptions options = config.explanation();
        assertFalse(options.includeTokenization());
        assertTrue(options.includeParsing());
        assertTrue(options.verboseMode());
    }

    @Test
    @DisplayName("Should accept options at the document root")
    void shouldAcceptRootLevelOptions() {
        DiceConfig config = ConfigLoader.parseYaml(yaml("max-rerolls: 7\ncache-size: 3\n"));

        assertEquals(7, config.maxRerolls());
        assertEquals(3, config.cacheSize());
        assertTrue(config.enableCaching());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("max-rerolls: 0")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("cache-size: lots")));
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("division-by-zero: sometimes")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("")));
    }

    @Test
    @DisplayName("Should reject integer options wider than an int")
    void shouldRejectOutOfRangeIntegers() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("max-rerolls: 4294967297")));
        assertTrue(e.getMessage().contains("max-rerolls"));

        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("cache-size: '9999999999'")));
        assertEquals(Integer.MAX_VALUE,
                ConfigLoader.parseYaml(yaml("max-dice-sides: 2147483647")).maxDiceSides());
    }

    @Test
    @DisplayName("Should fail on a missing file")
    void shouldFailOnMissingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/nonexistent/dice.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:missing.yaml"));
    }

    @Test
    @DisplayName("Builder should round-trip through toBuilder")
    void builderShouldCopyValues() {
        DiceConfig config = DiceConfig.builder().maxRerolls(9).randomSeed(7L).build();

        assertEquals(config, config.toBuilder().build());
        assertEquals(9, config.toBuilder().maxDiceCount(5).build().maxRerolls());
    }
}
