package com.dice.engine;

import com.dice.config.ConfigLoader;
import com.dice.config.DiceConfig;

/**
 * Factory for creating {@link DiceEngine} instances from configuration.
 */
public final class DiceEngineFactory {

    private DiceEngineFactory() {
    }

    public static DiceEngine create(DiceConfig config) {
        return new DefaultDiceEngine(config);
    }

    public static DiceEngine createDefault() {
        return create(DiceConfig.defaults());
    }

    /**
     * Create an engine from a YAML file; supports the classpath: prefix.
     */
    public static DiceEngine fromFile(String path) {
        return create(ConfigLoader.load(path));
    }
}
