package com.example.dungeonquest.combat;

import com.example.dungeonquest.model.Enemy;
import com.example.dungeonquest.model.Player;

import java.util.List;

/**
 * Presentation side of combat. Implementations draw snapshots; they hold no combat rules.
 */
public interface CombatRenderer {

    /**
     * Draw both combatants and the combat log.
     */
    void renderCombat(Player player, Enemy enemy, List<String> messages);

    /**
     * Draw the player's skill list (numbered from 1, 0 to cancel).
     */
    default void renderSkillMenu(Player player) {}

    /**
     * Draw the player's inventory (numbered from 1, 0 to cancel).
     */
    default void renderInventory(Player player) {}
}
