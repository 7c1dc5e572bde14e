package com.example.dungeonquest.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A playable class (e.g., Warrior, Wizard): starting stats plus an ordered skill list.
 * Classes differ only in data, so every class builds the same {@link Player} type.
 */
public class CharacterClass {
    public final String name;
    public final String description;
    public final int hp;
    public final int mp;
    public final int attack;
    public final int speed;

    private final List<Skill> skills;

    public CharacterClass(String name, String description, int hp, int mp, int attack, int speed,
                          List<Skill> skills) {
        this.name = name;
        this.description = description;
        this.hp = hp;
        this.mp = mp;
        this.attack = attack;
        this.speed = speed;
        this.skills = skills != null ? new ArrayList<>(skills) : new ArrayList<>();
    }

    /**
     * Get the class skills in menu order.
     */
    public List<Skill> getSkills() {
        return Collections.unmodifiableList(skills);
    }

    /**
     * Create a level 1 player of this class at full HP/MP with an empty inventory.
     */
    public Player createPlayer(String playerName) {
        Stats stats = new Stats(hp, hp, mp, mp, attack, speed);
        return new Player(playerName, stats, name, skills);
    }

    @Override
    public String toString() {
        return "CharacterClass[" + name + "]";
    }
}
