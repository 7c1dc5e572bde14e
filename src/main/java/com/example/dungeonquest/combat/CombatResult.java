package com.example.dungeonquest.combat;

import com.example.dungeonquest.effect.StatusEffect;
import com.example.dungeonquest.model.GameCharacter;

/**
 * Result of a basic attack or a skill use.
 * Carries the numbers for callers and the line to append to the combat log.
 */
public class CombatResult {

    /** Whether the action happened (false only when it was declined) */
    private final boolean success;

    /** The type of result */
    private final ResultType type;

    /** Damage dealt (0 unless HIT) */
    private final int damage;

    /** Reported healing (0 unless HEAL) */
    private final int healing;

    /** The attacker/user */
    private final GameCharacter attacker;

    /** The character that received the effect */
    private final GameCharacter target;

    /** Status effect applied, if any */
    private StatusEffect appliedEffect;

    /** Message for the combat log */
    private String message;

    public enum ResultType {
        HIT,            // Damage dealt by a basic attack or damage skill
        HEAL,           // HP restored
        BUFF,           // Attack raised on the caster
        DEBUFF,         // Attack lowered on the target
        DAMAGE_OVER_TIME, // DOT applied to the target
        STUN,           // Target stunned
        NOT_ENOUGH_MP   // Skill declined, nothing changed
    }

    private CombatResult(ResultType type, boolean success, int damage, int healing,
                         GameCharacter attacker, GameCharacter target) {
        this.type = type;
        this.success = success;
        this.damage = damage;
        this.healing = healing;
        this.attacker = attacker;
        this.target = target;
    }

    // Static factory methods

    public static CombatResult hit(GameCharacter attacker, GameCharacter target, int damage) {
        return new CombatResult(ResultType.HIT, true, damage, 0, attacker, target);
    }

    public static CombatResult heal(GameCharacter healer, GameCharacter target, int healing) {
        return new CombatResult(ResultType.HEAL, true, 0, healing, healer, target);
    }

    public static CombatResult effect(ResultType type, GameCharacter caster, GameCharacter target,
                                      StatusEffect effect) {
        CombatResult r = new CombatResult(type, true, 0, 0, caster, target);
        r.appliedEffect = effect;
        return r;
    }

    public static CombatResult notEnoughMp(GameCharacter caster, int mpCost) {
        CombatResult r = new CombatResult(ResultType.NOT_ENOUGH_MP, false, 0, 0, caster, null);
        r.message = "Not enough MP! Need " + mpCost + " MP.";
        return r;
    }

    // Getters

    public boolean isSuccess() { return success; }
    public ResultType getType() { return type; }
    public int getDamage() { return damage; }
    public int getHealing() { return healing; }
    public GameCharacter getTarget() { return target; }
    public StatusEffect getAppliedEffect() { return appliedEffect; }

    public String getMessage() { return message; }
    public CombatResult setMessage(String msg) { this.message = msg; return this; }

    @Override
    public String toString() {
        String attackerName = attacker != null ? attacker.getName() : "?";
        String targetName = target != null ? target.getName() : "?";
        return String.format("CombatResult[%s %s -> %s, damage=%d, healing=%d]",
            type, attackerName, targetName, damage, healing);
    }
}
