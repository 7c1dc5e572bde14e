package com.example.dungeonquest.combat;

/**
 * Represents the current state of a combat encounter.
 */
public enum CombatState {

    /** Combat is running turns */
    ACTIVE("Active"),

    /** Enemy HP reached 0 (rewards granted) */
    PLAYER_VICTORY("Victory"),

    /** Player HP reached 0 */
    PLAYER_DEFEAT("Defeat"),

    /** Player escaped */
    PLAYER_FLED("Fled");

    private final String displayName;

    CombatState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
