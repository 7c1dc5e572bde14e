package com.example.dungeonquest.combat;

import com.example.dungeonquest.effect.StatusEffect;
import com.example.dungeonquest.model.GameCharacter;
import com.example.dungeonquest.model.Skill;
import com.example.dungeonquest.model.Stat;
import com.example.dungeonquest.model.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves basic attacks and skills against the caster's and target's stats.
 */
public class SkillResolver {

    private static final Logger logger = LoggerFactory.getLogger(SkillResolver.class);

    /** Name given to stun effects applied by skills */
    public static final String STUN_EFFECT_NAME = "Stunned";

    private final RandomSource random;
    private final CombatCalculator calculator;

    public SkillResolver(RandomSource random) {
        this(random, new CombatCalculator());
    }

    public SkillResolver(RandomSource random, CombatCalculator calculator) {
        this.random = random;
        this.calculator = calculator;
    }

    public CombatCalculator getCalculator() {
        return calculator;
    }

    /**
     * A basic attack: no MP cost, always lands for at least 1 damage.
     */
    public CombatResult basicAttack(GameCharacter attacker, GameCharacter target) {
        double spread = random.uniform(CombatCalculator.BASIC_ATTACK_MIN, CombatCalculator.BASIC_ATTACK_MAX);
        int damage = calculator.calculateBasicAttackDamage(attacker.getStats().getEffectiveAttack(), spread);
        int dealt = target.getStats().takeDamage(damage);
        return CombatResult.hit(attacker, target, dealt)
            .setMessage(attacker.getName() + " attacks " + target.getName() + " for " + dealt + " damage!");
    }

    /**
     * Use a skill. The MP cost is paid first; if the caster cannot pay, nothing changes and a
     * NOT_ENOUGH_MP result is returned.
     *
     * Heals land on {@code target}, so a self-heal passes the caster as target. Buffs always
     * land on the caster; every other type lands on {@code target}.
     */
    public CombatResult resolve(GameCharacter caster, GameCharacter target, Skill skill) {
        Stats casterStats = caster.getStats();
        if (!casterStats.useMp(skill.getMpCost())) {
            logger.debug("{} cannot afford {} ({} MP, has {})",
                caster.getName(), skill.getName(), skill.getMpCost(), casterStats.getMp());
            return CombatResult.notEnoughMp(caster, skill.getMpCost());
        }

        int effectAmount = calculator.calculateEffectAmount(casterStats.getEffectiveAttack(), skill.getPower());
        String prefix = caster.getName() + " uses " + skill.getName() + "! ";

        switch (skill.getType()) {
            case DAMAGE: {
                double spread = random.uniform(CombatCalculator.SKILL_DAMAGE_MIN, CombatCalculator.SKILL_DAMAGE_MAX);
                int damage = calculator.calculateSkillDamage(effectAmount, spread);
                int dealt = target.getStats().takeDamage(damage);
                return CombatResult.hit(caster, target, dealt)
                    .setMessage(prefix + "Deals " + dealt + " damage!");
            }
            case HEAL: {
                int healed = target.getStats().heal(effectAmount);
                return CombatResult.heal(caster, target, healed)
                    .setMessage(prefix + "Restored " + healed + " HP!");
            }
            case BUFF: {
                int power = calculator.calculateModifierPower(effectAmount);
                StatusEffect buff = StatusEffect.statModifier(skill.getName(), Stat.ATTACK, power, skill.getDuration());
                casterStats.addStatusEffect(buff);
                return CombatResult.effect(CombatResult.ResultType.BUFF, caster, caster, buff)
                    .setMessage(prefix + "Attack +" + power + " for " + skill.getDuration() + " turns!");
            }
            case DEBUFF: {
                int power = calculator.calculateModifierPower(effectAmount);
                StatusEffect debuff = StatusEffect.statModifier(skill.getName(), Stat.ATTACK, -power, skill.getDuration());
                target.getStats().addStatusEffect(debuff);
                return CombatResult.effect(CombatResult.ResultType.DEBUFF, caster, target, debuff)
                    .setMessage(prefix + target.getName() + "'s attack -" + power
                        + " for " + skill.getDuration() + " turns!");
            }
            case DAMAGE_OVER_TIME: {
                int power = Math.max(1, effectAmount);
                StatusEffect dot = StatusEffect.damageOverTime(skill.getEffectName(), power, skill.getDuration());
                target.getStats().addStatusEffect(dot);
                return CombatResult.effect(CombatResult.ResultType.DAMAGE_OVER_TIME, caster, target, dot)
                    .setMessage(prefix + target.getName() + " is afflicted with " + dot.getName() + "!");
            }
            case STUN: {
                StatusEffect stun = StatusEffect.stun(STUN_EFFECT_NAME, skill.getDuration());
                target.getStats().addStatusEffect(stun);
                return CombatResult.effect(CombatResult.ResultType.STUN, caster, target, stun)
                    .setMessage(prefix + target.getName() + " is stunned for " + skill.getDuration() + " turns!");
            }
            default:
                // SkillType is validated when content is loaded
                throw new IllegalStateException("Unhandled skill type " + skill.getType() + " for " + skill.getName());
        }
    }
}
