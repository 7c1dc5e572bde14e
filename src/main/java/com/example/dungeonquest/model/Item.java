package com.example.dungeonquest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A consumable item definition, e.g. a potion. The effect maps a resource key
 * ({@link #HP} or {@link #MP}) to the amount restored.
 */
public class Item {
    public static final String HP = "hp";
    public static final String MP = "mp";

    private final String name;
    private final String description;
    private final String category;
    private final Map<String, Integer> effect;

    public Item(String name, String description, String category, Map<String, Integer> effect) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description != null ? description : "";
        this.category = category != null ? category : "misc";
        this.effect = effect != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(effect))
            : Collections.emptyMap();
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getCategory() { return category; }
    public Map<String, Integer> getEffect() { return effect; }

    public int getEffect(String key) {
        return effect.getOrDefault(key, 0);
    }

    public boolean hasEffect() {
        return !effect.isEmpty();
    }

    /** Whether a resource key is one that items may restore. */
    public static boolean isKnownEffect(String key) {
        return HP.equals(key) || MP.equals(key);
    }

    @Override
    public String toString() {
        return "Item[" + name + " " + effect + "]";
    }
}
