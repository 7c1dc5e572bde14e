package com.example.dungeonquest;

import com.example.dungeonquest.effect.EffectType;
import com.example.dungeonquest.effect.StatusEffect;
import com.example.dungeonquest.effect.StatusEffectSet;
import com.example.dungeonquest.model.Stat;
import com.example.dungeonquest.model.Stats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Status effect stacking, ticking and expiry")
class StatusEffectSetTest {

    private Stats owner;
    private StatusEffectSet effects;

    @BeforeEach
    void setUp() {
        owner = new Stats(50, 50, 0, 0, 10, 10);
        effects = owner.getStatusEffects();
    }

    @Test
    @DisplayName("Re-applying a DOT sums power and keeps the longer duration")
    void dotStacksPowerAndMaxDuration() {
        effects.add(StatusEffect.damageOverTime("Poison", 5, 3));
        effects.add(StatusEffect.damageOverTime("Poison", 7, 2));

        assertEquals(1, effects.size());
        StatusEffect poison = effects.find("Poison");
        assertEquals(12, poison.getPower());
        assertEquals(3, poison.getDuration());
    }

    @Test
    @DisplayName("Re-applying a stat modifier refreshes duration without adding power")
    void statModifierRefreshesOnly() {
        effects.add(StatusEffect.statModifier("Battle Cry", Stat.ATTACK, 3, 1));
        effects.add(StatusEffect.statModifier("Battle Cry", Stat.ATTACK, 5, 3));

        StatusEffect buff = effects.find("Battle Cry");
        assertEquals(3, buff.getPower());
        assertEquals(3, buff.getDuration());
        assertEquals(3, effects.statModifierTotal(Stat.ATTACK));
    }

    @Test
    @DisplayName("Differently named effects coexist")
    void differentNamesCoexist() {
        effects.add(StatusEffect.damageOverTime("Poison", 5, 3));
        effects.add(StatusEffect.damageOverTime("Burn", 4, 4));

        assertEquals(2, effects.size());
        assertTrue(effects.contains("Poison"));
        assertTrue(effects.contains("Burn"));
    }

    @Test
    @DisplayName("DOT damages the owner each tick and wears off after its duration")
    void dotTicksThenExpires() {
        effects.add(StatusEffect.damageOverTime("Poison", 5, 2));

        List<String> first = owner.tickStatusEffects();
        assertEquals(List.of("[DOT] Poison deals 5 damage!"), first);
        assertEquals(45, owner.getHp());
        assertEquals(1, effects.find("Poison").getDuration());

        List<String> second = owner.tickStatusEffects();
        assertEquals(List.of("[DOT] Poison deals 5 damage!", "[*] Poison wore off!"), second);
        assertEquals(40, owner.getHp());
        assertTrue(effects.isEmpty());
    }

    @Test
    @DisplayName("Every effect present at the start of a tick fires once, even when several expire")
    void everyEffectFiresOncePerTick() {
        effects.add(StatusEffect.damageOverTime("Poison", 3, 1));
        effects.add(StatusEffect.damageOverTime("Burn", 2, 1));
        effects.add(StatusEffect.stun("Stunned", 1));

        List<String> messages = owner.tickStatusEffects();

        assertEquals(List.of(
            "[DOT] Poison deals 3 damage!",
            "[*] Poison wore off!",
            "[DOT] Burn deals 2 damage!",
            "[*] Burn wore off!",
            "[*] Stunned wore off!"), messages);
        assertEquals(45, owner.getHp());
        assertTrue(effects.isEmpty());
        assertFalse(owner.isStunned());
    }

    @Test
    @DisplayName("A zero-power DOT still deals 1 damage")
    void zeroPowerDotDealsOne() {
        effects.add(StatusEffect.damageOverTime("Sting", 0, 2));
        owner.tickStatusEffects();
        assertEquals(49, owner.getHp());
    }

    @Test
    @DisplayName("Modifiers stop counting once they wear off")
    void modifierExpires() {
        effects.add(StatusEffect.statModifier("Battle Cry", Stat.ATTACK, 3, 1));
        assertEquals(13, owner.getEffectiveAttack());

        owner.tickStatusEffects();
        assertEquals(10, owner.getEffectiveAttack());
    }

    @Test
    @DisplayName("Effects with no turns left are not applied")
    void expiredEffectIgnored() {
        effects.add(StatusEffect.stun("Stunned", 0));
        effects.add(StatusEffect.damageOverTime("Poison", 5, 0));

        assertTrue(effects.isEmpty());
        assertFalse(owner.isStunned());
    }

    @Test
    @DisplayName("Removing an absent effect does nothing")
    void removeAbsentIsNoOp() {
        effects.add(StatusEffect.stun("Stunned", 1));
        effects.remove("Poison");
        assertEquals(1, effects.size());
    }

    @Test
    @DisplayName("Stat modifiers need a stat")
    void statModifierNeedsStat() {
        assertThrows(IllegalArgumentException.class,
            () -> new StatusEffect("Odd", EffectType.STAT_MODIFIER, null, 1, 1));
    }

    @Test
    @DisplayName("describe() summarises effects for the status bar")
    void describeForStatusBar() {
        assertEquals("None", effects.describe());

        effects.add(StatusEffect.statModifier("Battle Cry", Stat.ATTACK, 5, 3));
        effects.add(StatusEffect.statModifier("Crippling Shot", Stat.ATTACK, -4, 2));
        effects.add(StatusEffect.damageOverTime("Poison", 7, 2));
        effects.add(StatusEffect.stun("Stunned", 1));

        assertEquals("Battle Cry +5 (3t), Crippling Shot -4 (2t), Poison 7/turn (2t), Stunned (1t)",
            effects.describe());
    }
}
