package com.example.dungeonquest;

import com.example.dungeonquest.combat.RandomSource;
import com.example.dungeonquest.persistence.ContentLoader;
import com.example.dungeonquest.util.GameConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Startup configuration")
class GameConfigTest {

    @Test
    @DisplayName("Defaults apply when nothing is set")
    void defaults() {
        GameConfig config = GameConfig.from(Map.of(), key -> null);

        assertNull(config.getSeed());
        assertEquals(ContentLoader.DEFAULT_DIRECTORY, config.getContentDirectory());
    }

    @Test
    @DisplayName("System properties are used when the environment is silent")
    void propertiesFallback() {
        Map<String, String> props = Map.of(GameConfig.SEED_PROPERTY, "7", GameConfig.CONTENT_PROPERTY, "/custom");
        GameConfig config = GameConfig.from(Map.of(), props::get);

        assertEquals(7L, config.getSeed());
        assertEquals("/custom", config.getContentDirectory());
    }

    @Test
    @DisplayName("Environment wins over system properties")
    void environmentWins() {
        GameConfig config = GameConfig.from(Map.of(GameConfig.SEED_ENV, "42"),
            key -> GameConfig.SEED_PROPERTY.equals(key) ? "7" : null);

        assertEquals(42L, config.getSeed());
    }

    @Test
    @DisplayName("An invalid seed is ignored")
    void invalidSeedIgnored() {
        GameConfig config = GameConfig.from(Map.of(GameConfig.SEED_ENV, "abc"), key -> null);
        assertNull(config.getSeed());
    }

    @Test
    @DisplayName("The same seed gives the same rolls")
    void seededSourceIsReproducible() {
        RandomSource a = new GameConfig(99L, null).createRandomSource();
        RandomSource b = new GameConfig(99L, null).createRandomSource();

        for (int i = 0; i < 10; i++) {
            assertEquals(a.nextDouble(), b.nextDouble());
        }
    }

    @Test
    @DisplayName("nextInt stays within its inclusive bounds")
    void nextIntBounds() {
        RandomSource low = () -> 0.0;
        RandomSource high = () -> 0.999999;

        assertEquals(10, low.nextInt(10, 30));
        assertEquals(30, high.nextInt(10, 30));
        assertEquals(1.1, high.uniform(0.9, 1.1), 0.0001);
    }
}
