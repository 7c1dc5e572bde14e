package com.example.dungeonquest.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The player character: a class loadout (skills), an inventory, gold and experience.
 * Build one through {@link CharacterClass#createPlayer(String)}.
 */
public class Player extends GameCharacter {

    private static final Logger logger = LoggerFactory.getLogger(Player.class);

    /** Experience needed per level: level N levels up at N * 100 total experience. */
    public static final int EXP_PER_LEVEL = 100;

    private final String className;
    private final List<Skill> skills;
    private final List<Item> inventory = new ArrayList<>();
    private int gold;

    public Player(String name, Stats stats, String className, List<Skill> skills) {
        this(name, stats, className, skills, "");
    }

    public Player(String name, Stats stats, String className, List<Skill> skills, String asciiArt) {
        super(name, stats, asciiArt);
        this.className = className;
        this.skills = skills != null ? List.copyOf(skills) : List.of();
    }

    public String getClassName() { return className; }

    public List<Skill> getSkills() { return skills; }

    public Skill getSkill(int index) {
        if (index < 0 || index >= skills.size()) return null;
        return skills.get(index);
    }

    // Gold

    public int getGold() { return gold; }

    public void addGold(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cannot add negative gold: " + amount);
        }
        gold += amount;
    }

    // Progression

    /**
     * Add experience and level up once if the threshold (level * 100) is reached.
     * A single grant never levels more than once; leftover experience counts toward
     * the next call.
     * @throws IllegalArgumentException if the amount is negative
     * @return true if the player levelled up
     */
    public boolean gainExp(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cannot gain negative experience: " + amount);
        }
        Stats stats = getStats();
        stats.addExp(amount);
        if (stats.getExp() >= stats.getLevel() * EXP_PER_LEVEL) {
            levelUp();
            return true;
        }
        return false;
    }

    private void levelUp() {
        getStats().levelUp();
        logger.debug("{} reached level {}", getName(), getStats().getLevel());
    }

    // Inventory

    public List<Item> getInventory() {
        return Collections.unmodifiableList(inventory);
    }

    public void addItem(Item item) {
        if (item != null) inventory.add(item);
    }

    public boolean hasItems() {
        return !inventory.isEmpty();
    }

    /**
     * Consume the item at the given inventory slot.
     * @return a message describing the effect, or null if the slot is empty
     */
    public String useItem(int index) {
        if (index < 0 || index >= inventory.size()) return null;
        Item item = inventory.remove(index);
        return applyItem(item);
    }

    /**
     * Consume the first item with the given name (case-insensitive).
     * @return a message describing the effect, or null if no such item is held
     */
    public String useItem(String itemName) {
        for (int i = 0; i < inventory.size(); i++) {
            if (inventory.get(i).getName().equalsIgnoreCase(itemName)) {
                return useItem(i);
            }
        }
        return null;
    }

    private String applyItem(Item item) {
        if (!item.hasEffect()) {
            return "Used " + item.getName() + ".";
        }
        List<String> parts = new ArrayList<>();
        int hp = item.getEffect(Item.HP);
        if (item.getEffect().containsKey(Item.HP)) {
            getStats().heal(hp);
            parts.add(hp + " HP");
        }
        int mp = item.getEffect(Item.MP);
        if (item.getEffect().containsKey(Item.MP)) {
            getStats().restoreMp(mp);
            parts.add(mp + " MP");
        }
        if (parts.isEmpty()) {
            return "Used " + item.getName() + ".";
        }
        return "Used " + item.getName() + "! Restored " + String.join(" and ", parts) + ".";
    }

    @Override
    public boolean isPlayer() {
        return true;
    }
}
