package com.example.dungeonquest.model;

import java.util.Objects;

/**
 * An immutable skill definition. Skills cost MP and scale with the caster's
 * effective attack through {@link #getPower()}.
 */
public class Skill {
    private final String name;
    private final String description;
    private final int mpCost;
    private final SkillType type;
    private final double power;
    private final int duration;
    private final String statusEffectName; // optional label for DOT effects

    public Skill(String name, String description, int mpCost, SkillType type, double power) {
        this(name, description, mpCost, type, power, 0, null);
    }

    public Skill(String name, String description, int mpCost, SkillType type,
                 double power, int duration, String statusEffectName) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description != null ? description : "";
        this.type = Objects.requireNonNull(type, "type");
        if (mpCost < 0) {
            throw new IllegalArgumentException("Skill " + name + " has negative MP cost");
        }
        if (power < 0) {
            throw new IllegalArgumentException("Skill " + name + " has negative power");
        }
        if (duration < 0) {
            throw new IllegalArgumentException("Skill " + name + " has negative duration");
        }
        if (type.isTimed() && duration < 1) {
            throw new IllegalArgumentException("Skill " + name + " (" + type.getKey() + ") needs a duration of at least 1 turn");
        }
        this.mpCost = mpCost;
        this.power = power;
        this.duration = duration;
        this.statusEffectName = statusEffectName == null || statusEffectName.isBlank() ? null : statusEffectName;
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public int getMpCost() { return mpCost; }
    public SkillType getType() { return type; }
    public double getPower() { return power; }
    public int getDuration() { return duration; }
    public String getStatusEffectName() { return statusEffectName; }

    /** Name of the status effect this skill applies: the override label if set, else the skill name. */
    public String getEffectName() {
        return statusEffectName != null ? statusEffectName : name;
    }

    @Override
    public String toString() {
        return String.format("Skill[%s %s mp=%d power=%.2f duration=%d]", name, type, mpCost, power, duration);
    }
}
