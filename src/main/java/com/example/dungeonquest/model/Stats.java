package com.example.dungeonquest.model;

import com.example.dungeonquest.effect.StatusEffect;
import com.example.dungeonquest.effect.StatusEffectSet;

import java.util.List;

/**
 * Resource pools, base combat stats and progression for one combatant.
 * Owns the combatant's status effects; effective stats include their modifiers.
 */
public class Stats {
    private int hp;
    private int maxHp;
    private int mp;
    private int maxMp;
    private int attack;
    private int speed;
    private int level;
    private int exp;

    private final StatusEffectSet statusEffects = new StatusEffectSet();

    public Stats(int hp, int maxHp, int mp, int maxMp, int attack, int speed) {
        this(hp, maxHp, mp, maxMp, attack, speed, 1, 0);
    }

    public Stats(int hp, int maxHp, int mp, int maxMp, int attack, int speed, int level, int exp) {
        if (maxHp < 0 || maxMp < 0 || attack < 0 || speed < 0 || exp < 0) {
            throw new IllegalArgumentException("Stats must not be negative");
        }
        if (level < 1) {
            throw new IllegalArgumentException("Level must be at least 1, was " + level);
        }
        this.maxHp = maxHp;
        this.maxMp = maxMp;
        this.hp = Math.max(0, Math.min(hp, maxHp));
        this.mp = Math.max(0, Math.min(mp, maxMp));
        this.attack = attack;
        this.speed = speed;
        this.level = level;
        this.exp = exp;
    }

    // Resource pools

    public int getHp() { return hp; }
    public int getMaxHp() { return maxHp; }
    public int getMp() { return mp; }
    public int getMaxMp() { return maxMp; }

    public boolean isAlive() {
        return hp > 0;
    }

    /**
     * Deal damage. At least 1 point is always dealt, even when the computed amount is
     * zero or negative; HP never drops below 0.
     * @return the damage dealt
     */
    public int takeDamage(int amount) {
        int actual = Math.max(1, amount);
        hp = Math.max(0, hp - actual);
        return actual;
    }

    /**
     * Heal up to max HP.
     * @return the reported heal amount (at least 1). This is computed before capping,
     *         so near full health it can be larger than the HP actually recovered.
     */
    public int heal(int amount) {
        int reported = Math.max(1, amount);
        // compare against the headroom so a huge amount cannot overflow
        hp = Math.max(0, amount >= maxHp - hp ? maxHp : hp + amount);
        return reported;
    }

    /**
     * Spend MP if there is enough of it.
     * @return true if the MP was spent, false (and nothing changed) otherwise
     */
    public boolean useMp(int amount) {
        if (mp >= amount) {
            mp -= amount;
            return true;
        }
        return false;
    }

    public void restoreMp(int amount) {
        mp = Math.max(0, amount >= maxMp - mp ? maxMp : mp + amount);
    }

    // Combat stats

    public int getAttack() { return attack; }
    public int getSpeed() { return speed; }

    public int getEffectiveAttack() {
        return Math.max(1, attack + statusEffects.statModifierTotal(Stat.ATTACK));
    }

    public int getEffectiveSpeed() {
        return Math.max(1, speed + statusEffects.statModifierTotal(Stat.SPEED));
    }

    // Progression

    public int getLevel() { return level; }
    public int getExp() { return exp; }

    void addExp(int amount) {
        exp += amount;
    }

    /**
     * One level of growth: +1 level, +10% max HP/MP and attack (rounded down),
     * +1 speed, and a full restore of HP and MP.
     */
    void levelUp() {
        level += 1;
        maxHp += (int) (maxHp * 0.1);
        maxMp += (int) (maxMp * 0.1);
        hp = maxHp;
        mp = maxMp;
        attack += (int) (attack * 0.1);
        speed += 1;
    }

    // Status effects

    public StatusEffectSet getStatusEffects() {
        return statusEffects;
    }

    public void addStatusEffect(StatusEffect effect) {
        statusEffects.add(effect);
    }

    public void removeStatusEffect(String name) {
        statusEffects.remove(name);
    }

    public boolean isStunned() {
        return statusEffects.isStunned();
    }

    public int getStatModifier(Stat stat) {
        return statusEffects.statModifierTotal(stat);
    }

    /**
     * End-of-turn pass over this container's effects.
     * @return messages produced by DOT damage and expiries
     */
    public List<String> tickStatusEffects() {
        return statusEffects.tick(this);
    }

    @Override
    public String toString() {
        return String.format("Stats[HP %d/%d, MP %d/%d, ATK %d, SPD %d, L%d, EXP %d]",
            hp, maxHp, mp, maxMp, attack, speed, level, exp);
    }
}
