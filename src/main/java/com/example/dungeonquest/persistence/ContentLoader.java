package com.example.dungeonquest.persistence;

import com.example.dungeonquest.model.CharacterClass;
import com.example.dungeonquest.model.EnemyTemplate;
import com.example.dungeonquest.model.Item;
import com.example.dungeonquest.model.Skill;
import com.example.dungeonquest.model.SkillType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the static content catalog from YAML resources on the classpath.
 * Files are read from one directory (default /data/):
 *   - skills.yaml:  skills: [{name, description, mp_cost, skill_type, power, duration, status_effect}]
 *   - classes.yaml: classes: [{name, description, hp, mp, attack, speed, skills: [skill names]}]
 *   - enemies.yaml: enemies: [{key, name, level, hp, mp, attack, speed, exp_reward, gold_reward, art}]
 *   - items.yaml:   items: [{name, description, category, effect: {hp|mp: amount}}], starting_items: [names]
 *
 * Everything is validated up front; bad content fails the load with a {@link ContentException}.
 */
public class ContentLoader {

    private static final Logger logger = LoggerFactory.getLogger(ContentLoader.class);

    public static final String DEFAULT_DIRECTORY = "/data";

    private final String directory;

    public ContentLoader() {
        this(DEFAULT_DIRECTORY);
    }

    public ContentLoader(String directory) {
        String dir = directory == null || directory.isBlank() ? DEFAULT_DIRECTORY : directory.trim();
        if (!dir.startsWith("/")) dir = "/" + dir;
        if (dir.endsWith("/")) dir = dir.substring(0, dir.length() - 1);
        this.directory = dir;
    }

    /**
     * Load and validate the whole catalog.
     */
    public GameContent load() throws ContentException {
        Map<String, Skill> skills;
        Map<String, CharacterClass> classes;
        List<EnemyTemplate> enemies;
        Map<String, Item> items;
        List<Item> startingItems;

        try (InputStream in = open("skills.yaml")) {
            skills = parseSkills(in);
        } catch (IOException e) {
            throw new ContentException("Failed to read skills.yaml", e);
        }
        try (InputStream in = open("classes.yaml")) {
            classes = parseClasses(in, skills);
        } catch (IOException e) {
            throw new ContentException("Failed to read classes.yaml", e);
        }
        try (InputStream in = open("enemies.yaml")) {
            enemies = parseEnemies(in);
        } catch (IOException e) {
            throw new ContentException("Failed to read enemies.yaml", e);
        }
        try (InputStream in = open("items.yaml")) {
            Map<String, Object> root = loadYaml(in, "items.yaml");
            items = parseItems(root);
            startingItems = parseStartingItems(root, items);
        } catch (IOException e) {
            throw new ContentException("Failed to read items.yaml", e);
        }

        logger.info("Loaded content from {}: {} skills, {} classes, {} enemies, {} items",
            directory, skills.size(), classes.size(), enemies.size(), items.size());
        return new GameContent(skills, classes, enemies, items, startingItems);
    }

    private InputStream open(String file) throws ContentException {
        String path = directory + "/" + file;
        InputStream in = ContentLoader.class.getResourceAsStream(path);
        if (in == null) {
            throw new ContentException("Content resource not found: " + path);
        }
        return in;
    }

    // Skills

    /**
     * Parse skill definitions keyed by name, in file order.
     */
    public Map<String, Skill> parseSkills(InputStream in) throws ContentException {
        Map<String, Object> root = loadYaml(in, "skills");
        Map<String, Skill> skills = new LinkedHashMap<>();
        for (Map<String, Object> data : getList(root, "skills")) {
            String name = requireName(data, "skill");
            SkillType type;
            try {
                type = SkillType.fromString(getString(data, "skill_type", null));
            } catch (IllegalArgumentException e) {
                logger.error("Rejected skill {}: {}", name, e.getMessage());
                throw new ContentException("Skill '" + name + "': " + e.getMessage(), e);
            }
            Skill skill;
            try {
                skill = new Skill(name,
                    getString(data, "description", ""),
                    getInt(data, "mp_cost", 0),
                    type,
                    getDouble(data, "power", 0.0),
                    getInt(data, "duration", 0),
                    getString(data, "status_effect", null));
            } catch (IllegalArgumentException e) {
                throw new ContentException("Skill '" + name + "': " + e.getMessage(), e);
            }
            if (skills.putIfAbsent(name, skill) != null) {
                throw new ContentException("Duplicate skill: " + name);
            }
        }
        return skills;
    }

    // Classes

    /**
     * Parse class loadouts, resolving skill names against already-loaded skills.
     */
    public Map<String, CharacterClass> parseClasses(InputStream in, Map<String, Skill> skills) throws ContentException {
        Map<String, Object> root = loadYaml(in, "classes");
        Map<String, CharacterClass> classes = new LinkedHashMap<>();
        for (Map<String, Object> data : getList(root, "classes")) {
            String name = requireName(data, "class");
            int hp = requirePositive(data, "hp", name);
            int mp = getInt(data, "mp", 0);
            int attack = getInt(data, "attack", 0);
            int speed = getInt(data, "speed", 0);
            if (mp < 0 || attack < 0 || speed < 0) {
                throw new ContentException("Class '" + name + "' has negative stats");
            }

            List<Skill> loadout = new ArrayList<>();
            Object skillNames = data.get("skills");
            if (skillNames instanceof List) {
                for (Object s : (List<?>) skillNames) {
                    Skill skill = skills.get(String.valueOf(s));
                    if (skill == null) {
                        throw new ContentException("Class '" + name + "' references unknown skill: " + s);
                    }
                    loadout.add(skill);
                }
            }

            CharacterClass cc = new CharacterClass(name, getString(data, "description", ""),
                hp, mp, attack, speed, loadout);
            if (classes.putIfAbsent(name, cc) != null) {
                throw new ContentException("Duplicate class: " + name);
            }
        }
        return classes;
    }

    // Enemies

    public List<EnemyTemplate> parseEnemies(InputStream in) throws ContentException {
        Map<String, Object> root = loadYaml(in, "enemies");
        List<EnemyTemplate> enemies = new ArrayList<>();
        for (Map<String, Object> data : getList(root, "enemies")) {
            String name = requireName(data, "enemy");
            int level = getInt(data, "level", 1);
            int hp = requirePositive(data, "hp", name);
            int mp = getInt(data, "mp", 0);
            int attack = getInt(data, "attack", 0);
            int speed = getInt(data, "speed", 0);
            int expReward = getInt(data, "exp_reward", 0);
            int goldReward = getInt(data, "gold_reward", 0);
            if (level < 1 || mp < 0 || attack < 0 || speed < 0 || expReward < 0 || goldReward < 0) {
                throw new ContentException("Enemy '" + name + "' has invalid stats or rewards");
            }
            String key = getString(data, "key", name.toLowerCase().replace(' ', '_'));
            enemies.add(new EnemyTemplate(key, name, level, hp, mp, attack, speed,
                expReward, goldReward, getString(data, "art", "")));
        }
        return enemies;
    }

    // Items

    public Map<String, Item> parseItems(Map<String, Object> root) throws ContentException {
        Map<String, Item> items = new LinkedHashMap<>();
        for (Map<String, Object> data : getList(root, "items")) {
            String name = requireName(data, "item");
            Map<String, Integer> effect = new LinkedHashMap<>();
            Object effectObj = data.get("effect");
            if (effectObj instanceof Map) {
                for (Map.Entry<?, ?> e : ((Map<?, ?>) effectObj).entrySet()) {
                    String key = String.valueOf(e.getKey()).toLowerCase();
                    if (!Item.isKnownEffect(key)) {
                        throw new ContentException("Item '" + name + "' has unknown effect: " + e.getKey());
                    }
                    if (!(e.getValue() instanceof Number) || ((Number) e.getValue()).intValue() < 0) {
                        throw new ContentException("Item '" + name + "' effect " + key + " must be a non-negative number");
                    }
                    effect.put(key, ((Number) e.getValue()).intValue());
                }
            }
            Item item = new Item(name, getString(data, "description", ""),
                getString(data, "category", "misc"), effect);
            if (items.putIfAbsent(name, item) != null) {
                throw new ContentException("Duplicate item: " + name);
            }
        }
        return items;
    }

    public List<Item> parseStartingItems(Map<String, Object> root, Map<String, Item> items) throws ContentException {
        List<Item> result = new ArrayList<>();
        Object names = root.get("starting_items");
        if (names instanceof List) {
            for (Object n : (List<?>) names) {
                Item item = items.get(String.valueOf(n));
                if (item == null) {
                    throw new ContentException("Unknown starting item: " + n);
                }
                result.add(item);
            }
        }
        return result;
    }

    /**
     * Parse a YAML document into its top-level map.
     */
    public Map<String, Object> loadYaml(InputStream in, String what) throws ContentException {
        try {
            Object doc = new Yaml().load(in);
            if (doc == null) return new LinkedHashMap<>();
            if (!(doc instanceof Map)) {
                throw new ContentException("Expected a mapping at the top of " + what);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> root = (Map<String, Object>) doc;
            return root;
        } catch (YAMLException e) {
            throw new ContentException("Malformed YAML in " + what + ": " + e.getMessage(), e);
        }
    }

    // YAML helper methods

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> getList(Map<String, Object> root, String key) throws ContentException {
        Object val = root.get(key);
        if (val == null) return new ArrayList<>();
        if (!(val instanceof List)) {
            throw new ContentException("'" + key + "' must be a list");
        }
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object o : (List<?>) val) {
            if (!(o instanceof Map)) {
                throw new ContentException("Entries of '" + key + "' must be mappings");
            }
            out.add((Map<String, Object>) o);
        }
        return out;
    }

    private static String requireName(Map<String, Object> map, String what) throws ContentException {
        String name = getString(map, "name", null);
        if (name == null || name.isBlank()) {
            throw new ContentException("A " + what + " is missing its name");
        }
        return name.trim();
    }

    private static int requirePositive(Map<String, Object> map, String key, String owner) throws ContentException {
        int val = getInt(map, key, 0);
        if (val <= 0) {
            throw new ContentException("'" + owner + "' needs a positive " + key);
        }
        return val;
    }

    private static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).doubleValue();
        if (val instanceof String) {
            try { return Double.parseDouble(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }
}
