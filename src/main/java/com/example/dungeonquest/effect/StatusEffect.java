package com.example.dungeonquest.effect;

import com.example.dungeonquest.model.Stat;

import java.util.Objects;

/**
 * A temporary buff, debuff, damage-over-time or stun attached to one combatant.
 * The name is the identity key: a combatant never carries two effects with the same name.
 */
public class StatusEffect {
    private final String name;
    private final EffectType type;
    private final Stat statAffected; // only for STAT_MODIFIER
    private int power;
    private int duration;

    public StatusEffect(String name, EffectType type, Stat statAffected, int power, int duration) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        if (type == EffectType.STAT_MODIFIER && statAffected == null) {
            throw new IllegalArgumentException("Stat modifier " + name + " needs a stat");
        }
        this.statAffected = type == EffectType.STAT_MODIFIER ? statAffected : null;
        this.power = power;
        this.duration = duration;
    }

    public static StatusEffect statModifier(String name, Stat stat, int power, int duration) {
        return new StatusEffect(name, EffectType.STAT_MODIFIER, stat, power, duration);
    }

    public static StatusEffect damageOverTime(String name, int power, int duration) {
        return new StatusEffect(name, EffectType.DAMAGE_OVER_TIME, null, power, duration);
    }

    public static StatusEffect stun(String name, int duration) {
        return new StatusEffect(name, EffectType.STUN, null, 0, duration);
    }

    public String getName() { return name; }
    public EffectType getType() { return type; }
    public Stat getStatAffected() { return statAffected; }
    public int getPower() { return power; }
    public int getDuration() { return duration; }

    void setDuration(int duration) { this.duration = duration; }
    void addPower(int amount) { this.power += amount; }

    /**
     * Age the effect by one turn.
     * @return true if the effect is still active afterwards
     */
    boolean tick() {
        duration--;
        return duration > 0;
    }

    public boolean isActive() {
        return duration > 0;
    }

    /** Short status-bar form, e.g. "Battle Cry +5 (3t)" or "Poison 7/turn (2t)". */
    public String describe() {
        switch (type) {
            case STAT_MODIFIER:
                String sign = power > 0 ? "+" : "";
                return name + " " + sign + power + " (" + duration + "t)";
            case DAMAGE_OVER_TIME:
                return name + " " + power + "/turn (" + duration + "t)";
            default:
                return name + " (" + duration + "t)";
        }
    }

    @Override
    public String toString() {
        return String.format("StatusEffect[%s %s power=%d duration=%d]", name, type, power, duration);
    }
}
