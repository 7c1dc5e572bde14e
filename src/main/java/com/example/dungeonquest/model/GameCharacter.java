package com.example.dungeonquest.model;

import java.util.Objects;

/**
 * Either side of a combat encounter. Each character exclusively owns its {@link Stats}.
 */
public abstract class GameCharacter {
    private final String name;
    private final Stats stats;
    private final String asciiArt; // opaque to the combat engine

    protected GameCharacter(String name, Stats stats, String asciiArt) {
        this.name = Objects.requireNonNull(name, "name");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.asciiArt = asciiArt != null ? asciiArt : "";
    }

    public String getName() { return name; }
    public Stats getStats() { return stats; }
    public String getAsciiArt() { return asciiArt; }

    public boolean isAlive() {
        return stats.isAlive();
    }

    public abstract boolean isPlayer();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + " " + stats + "]";
    }
}
