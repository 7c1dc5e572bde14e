package com.example.dungeonquest.util;

import com.example.dungeonquest.combat.RandomSource;
import com.example.dungeonquest.persistence.ContentLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Startup settings. Each value is read from an environment variable first, then a
 * system property, then falls back to its default:
 *   DUNGEONQUEST_SEED    / dungeonquest.seed     - fixed RNG seed for reproducible runs
 *   DUNGEONQUEST_CONTENT / dungeonquest.content  - classpath directory of the YAML content
 */
public class GameConfig {

    private static final Logger logger = LoggerFactory.getLogger(GameConfig.class);

    public static final String SEED_ENV = "DUNGEONQUEST_SEED";
    public static final String SEED_PROPERTY = "dungeonquest.seed";
    public static final String CONTENT_ENV = "DUNGEONQUEST_CONTENT";
    public static final String CONTENT_PROPERTY = "dungeonquest.content";

    private final Long seed;
    private final String contentDirectory;

    public GameConfig(Long seed, String contentDirectory) {
        this.seed = seed;
        this.contentDirectory = contentDirectory != null ? contentDirectory : ContentLoader.DEFAULT_DIRECTORY;
    }

    /**
     * Read settings from the process environment and system properties.
     */
    public static GameConfig fromEnvironment() {
        return from(System.getenv(), System::getProperty);
    }

    /**
     * Read settings from the given environment map and property lookup.
     */
    public static GameConfig from(Map<String, String> env, UnaryOperator<String> properties) {
        String seedStr = lookup(env, properties, SEED_ENV, SEED_PROPERTY);
        Long seed = null;
        if (seedStr != null) {
            try {
                seed = Long.parseLong(seedStr.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid seed '{}'", seedStr);
            }
        }
        String content = lookup(env, properties, CONTENT_ENV, CONTENT_PROPERTY);
        return new GameConfig(seed, content);
    }

    private static String lookup(Map<String, String> env, UnaryOperator<String> properties,
                                 String envName, String propertyName) {
        String val = env.get(envName);
        if (val != null && !val.isEmpty()) return val;
        val = properties.apply(propertyName);
        if (val != null && !val.isEmpty()) return val;
        return null;
    }

    public Long getSeed() { return seed; }

    public String getContentDirectory() { return contentDirectory; }

    /**
     * Seeded source when a seed is configured, otherwise a non-deterministic one.
     */
    public RandomSource createRandomSource() {
        if (seed != null) {
            logger.info("Using fixed RNG seed {}", seed);
            return RandomSource.seeded(seed);
        }
        return RandomSource.threadLocal();
    }
}
