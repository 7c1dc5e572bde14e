package com.example.dungeonquest.effect;

/**
 * Kinds of status effect a combatant can carry.
 */
public enum EffectType {

    /** Adds (or subtracts) power to one stat while active */
    STAT_MODIFIER("Stat Modifier"),

    /** Deals power damage on every end-of-turn tick */
    DAMAGE_OVER_TIME("Damage Over Time"),

    /** Holder skips its action phase while active */
    STUN("Stun");

    private final String displayName;

    EffectType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
