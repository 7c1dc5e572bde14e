package com.example.dungeonquest.model;

/**
 * How a skill affects its caster or target. This is a closed set: content naming any
 * other type is rejected when it is loaded.
 */
public enum SkillType {

    /** Direct damage to the target, with a small random spread */
    DAMAGE("damage"),

    /** Restores HP to the target (self-heals target the caster) */
    HEAL("heal"),

    /** Raises the caster's attack for a number of turns */
    BUFF("buff"),

    /** Lowers the target's attack for a number of turns */
    DEBUFF("debuff"),

    /** Poison, burn and similar: damage on every end-of-turn tick */
    DAMAGE_OVER_TIME("dot"),

    /** Target loses its actions for a number of turns */
    STUN("stun");

    private final String key;

    SkillType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Whether the skill leaves a status effect behind, and so needs a duration of at least 1 turn.
     */
    public boolean isTimed() {
        return this == BUFF || this == DEBUFF || this == DAMAGE_OVER_TIME || this == STUN;
    }

    /**
     * Parse a skill type from its content key ("dot") or enum name ("DAMAGE_OVER_TIME"),
     * case-insensitive.
     * @throws IllegalArgumentException if the name is not a known skill type
     */
    public static SkillType fromString(String str) {
        if (str == null || str.isBlank()) {
            throw new IllegalArgumentException("Skill type is missing");
        }
        String s = str.trim();
        for (SkillType type : values()) {
            if (type.key.equalsIgnoreCase(s) || type.name().equalsIgnoreCase(s)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown skill type: " + str);
    }
}
