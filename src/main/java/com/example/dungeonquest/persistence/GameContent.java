package com.example.dungeonquest.persistence;

import com.example.dungeonquest.model.CharacterClass;
import com.example.dungeonquest.model.EnemyTemplate;
import com.example.dungeonquest.model.Item;
import com.example.dungeonquest.model.Player;
import com.example.dungeonquest.model.Skill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only catalog of skills, classes, enemies and items, loaded once at startup.
 */
public class GameContent {
    private final Map<String, Skill> skills;
    private final Map<String, CharacterClass> classes;
    private final List<EnemyTemplate> enemies;
    private final Map<String, Item> items;
    private final List<Item> startingItems;

    public GameContent(Map<String, Skill> skills, Map<String, CharacterClass> classes,
                       List<EnemyTemplate> enemies, Map<String, Item> items, List<Item> startingItems) {
        this.skills = Collections.unmodifiableMap(new LinkedHashMap<>(skills));
        this.classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
        this.enemies = List.copyOf(enemies);
        this.items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
        this.startingItems = List.copyOf(startingItems);
    }

    public Skill getSkill(String name) { return skills.get(name); }
    public Map<String, Skill> getSkills() { return skills; }

    /** Classes in menu order. */
    public List<CharacterClass> getClasses() { return new ArrayList<>(classes.values()); }

    /**
     * Find a class by name, case-insensitive.
     */
    public CharacterClass getClass(String name) {
        if (name == null) return null;
        for (CharacterClass cc : classes.values()) {
            if (cc.name.equalsIgnoreCase(name.trim())) return cc;
        }
        return null;
    }

    public List<EnemyTemplate> getEnemies() { return enemies; }


    public Item getItem(String name) { return items.get(name); }

    public List<Item> getStartingItems() { return startingItems; }

    /**
     * Create a new player of the given class holding the starting items.
     */
    public Player newPlayer(String playerName, CharacterClass characterClass) {
        Player player = characterClass.createPlayer(playerName);
        startingItems.forEach(player::addItem);
        return player;
    }
}
