package com.example.dungeonquest.game;

import com.example.dungeonquest.combat.RandomSource;
import com.example.dungeonquest.model.Enemy;
import com.example.dungeonquest.model.EnemyTemplate;
import com.example.dungeonquest.model.Player;
import com.example.dungeonquest.model.Stats;

import java.util.List;

/**
 * Out-of-combat actions in the dungeon: exploring for encounters, searching for gold,
 * and resting at a campfire.
 */
public class DungeonExplorer {

    /** Chance that exploring leads to a fight */
    public static final double ENCOUNTER_CHANCE = 0.7;

    /** Chance that searching turns up gold */
    public static final double TREASURE_CHANCE = 0.4;

    public static final int TREASURE_MIN = 10;
    public static final int TREASURE_MAX = 30;

    private final List<EnemyTemplate> enemies;
    private final RandomSource random;

    public DungeonExplorer(List<EnemyTemplate> enemies, RandomSource random) {
        if (enemies == null || enemies.isEmpty()) {
            throw new IllegalArgumentException("The dungeon needs at least one enemy");
        }
        this.enemies = List.copyOf(enemies);
        this.random = random;
    }

    /**
     * Result of exploring: a freshly spawned enemy to fight, or null and a quiet story line.
     */
    public record Exploration(Enemy enemy, String story) {
        public boolean isEncounter() {
            return enemy != null;
        }
    }

    public Exploration explore() {
        if (random.chance(ENCOUNTER_CHANCE)) {
            EnemyTemplate template = enemies.get(random.nextInt(0, enemies.size() - 1));
            Enemy enemy = template.spawn();
            return new Exploration(enemy, "A " + enemy.getName() + " blocks your path!");
        }
        return new Exploration(null, "You find an empty chamber. The silence is eerie.");
    }

    /**
     * Search the room; may add gold to the player.
     */
    public String search(Player player) {
        if (random.chance(TREASURE_CHANCE)) {
            int gold = random.nextInt(TREASURE_MIN, TREASURE_MAX);
            player.addGold(gold);
            return "You found " + gold + " gold hidden in a dusty chest!";
        }
        return "You search thoroughly but find nothing of value.";
    }

    /**
     * Rest at a campfire: recover a third of max HP and half of max MP.
     */
    public String rest(Player player) {
        Stats stats = player.getStats();
        int heal = stats.getMaxHp() / 3;
        int mpRestore = stats.getMaxMp() / 2;
        stats.heal(heal);
        stats.restoreMp(mpRestore);
        return "You rest by the campfire. Recovered " + heal + " HP and " + mpRestore + " MP.";
    }
}
