package com.example.dungeonquest.combat;

/**
 * Input side of combat: turns a user's raw choice into a {@link CombatAction}.
 * The session validates skill and item indices itself.
 */
@FunctionalInterface
public interface ActionSource {

    /**
     * Block until the player picks an action.
     */
    CombatAction nextAction(CombatSession session);

    /**
     * Called when the player cannot act (stunned) or a declined action needs acknowledging.
     */
    default void acknowledge(CombatSession session) {}
}
