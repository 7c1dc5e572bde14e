package com.example.dungeonquest.combat;

/**
 * Combat formulas for skill power, damage spread and fleeing.
 *
 * Skill effect amount: floor(effective_attack * skill_power)
 * Skill damage:        round(effect_amount * uniform(0.9, 1.1))
 * Basic attack damage: round(effective_attack * uniform(0.8, 1.2))
 * Flee:                succeeds when the roll is below 0.5
 */
public class CombatCalculator {

    /** Chance that a flee attempt succeeds */
    public static final double FLEE_CHANCE = 0.5;

    /** Damage spread for basic attacks */
    public static final double BASIC_ATTACK_MIN = 0.8;
    public static final double BASIC_ATTACK_MAX = 1.2;

    /** Damage spread for damage skills */
    public static final double SKILL_DAMAGE_MIN = 0.9;
    public static final double SKILL_DAMAGE_MAX = 1.1;

    /**
     * Base amount a skill works with before any spread.
     *
     * @param effectiveAttack caster's attack including modifiers
     * @param power the skill's multiplier
     * @return floor(effectiveAttack * power)
     */
    public int calculateEffectAmount(int effectiveAttack, double power) {
        return (int) Math.floor(effectiveAttack * power);
    }

    /**
     * Damage for a damage skill after applying the spread factor.
     *
     * @param effectAmount result of {@link #calculateEffectAmount(int, double)}
     * @param spread factor in [0.9, 1.1]
     */
    public int calculateSkillDamage(int effectAmount, double spread) {
        return (int) Math.round(effectAmount * spread);
    }

    /**
     * Damage for a basic attack after applying the spread factor.
     *
     * @param effectiveAttack attacker's attack including modifiers
     * @param spread factor in [0.8, 1.2]
     */
    public int calculateBasicAttackDamage(int effectiveAttack, double spread) {
        return (int) Math.round(effectiveAttack * spread);
    }

    /**
     * Power of a buff or (before negation) a debuff: the effect amount, at least 1.
     */
    public int calculateModifierPower(int effectAmount) {
        return Math.max(1, effectAmount);
    }

    /**
     * Whether a flee roll escapes. The boundary value itself fails.
     *
     * @param roll a value in [0.0, 1.0)
     */
    public boolean isFleeSuccessful(double roll) {
        return roll < FLEE_CHANCE;
    }
}
