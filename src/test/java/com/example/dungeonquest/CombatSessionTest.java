package com.example.dungeonquest;

import com.example.dungeonquest.combat.CombatAction;
import com.example.dungeonquest.combat.CombatSession;
import com.example.dungeonquest.combat.CombatState;
import com.example.dungeonquest.combat.RandomSource;
import com.example.dungeonquest.combat.TurnOutcome;
import com.example.dungeonquest.effect.StatusEffect;
import com.example.dungeonquest.model.Enemy;
import com.example.dungeonquest.model.Item;
import com.example.dungeonquest.model.Player;
import com.example.dungeonquest.model.Skill;
import com.example.dungeonquest.model.SkillType;
import com.example.dungeonquest.model.Stats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Combat turn state machine")
class CombatSessionTest {

    private static final RandomSource MIDPOINT = () -> 0.5;

    private static final Skill POWER_STRIKE = new Skill("Power Strike", "", 10, SkillType.DAMAGE, 1.5);
    private static final Skill HEAL = new Skill("Heal", "", 15, SkillType.HEAL, 0.8);
    private static final Skill POISON_CLOUD = new Skill("Poison Cloud", "", 15, SkillType.DAMAGE_OVER_TIME, 0.5, 3, "Poison");
    private static final Skill STUNNING_STRIKE = new Skill("Stunning Strike", "", 15, SkillType.STUN, 0.0, 1, null);

    private static Player player(int hp, int mp) {
        return new Player("Tester", new Stats(hp, 100, mp, 50, 10, 10), "Warrior",
            List.of(POWER_STRIKE, HEAL, POISON_CLOUD, STUNNING_STRIKE));
    }

    private static Enemy goblin(int hp, int expReward) {
        return new Enemy("Goblin", new Stats(hp, 40, 10, 10, 8, 8), "", expReward, 15);
    }

    private static Item potion() {
        return new Item("Health Potion", "Restores 40 HP", "potion", Map.of(Item.HP, 40));
    }

    @Test
    @DisplayName("Start announces the enemy and begins active")
    void startAnnouncesEnemy() {
        CombatSession session = CombatSession.start(player(100, 50), goblin(40, 30), MIDPOINT);

        assertEquals(CombatState.ACTIVE, session.getState());
        assertEquals(List.of("A wild Goblin appears!"), session.getMessages());
        assertEquals(0, session.getTurn());
    }

    @Test
    @DisplayName("Start rejects a defeated combatant")
    void startRejectsDefeated() {
        assertThrows(IllegalArgumentException.class,
            () -> CombatSession.start(player(0, 50), goblin(40, 30), MIDPOINT));
        assertThrows(IllegalArgumentException.class,
            () -> CombatSession.start(player(100, 50), goblin(0, 30), MIDPOINT));
    }

    @Test
    @DisplayName("Attack turn: player hits, enemy retaliates")
    void attackTurn() {
        Player p = player(100, 50);
        Enemy e = goblin(40, 30);
        CombatSession session = CombatSession.start(p, e, MIDPOINT);

        TurnOutcome outcome = session.submitAction(CombatAction.attack());

        assertFalse(outcome.requery());
        assertEquals(List.of("Tester attacks Goblin for 10 damage!", "Goblin attacks Tester for 8 damage!"),
            outcome.messages());
        assertEquals(30, e.getStats().getHp());
        assertEquals(92, p.getStats().getHp());
        assertEquals(1, session.getTurn());
        assertTrue(session.isActive());
    }

    @Test
    @DisplayName("Killing blow ends combat before the enemy acts and pays rewards")
    void victoryPaysRewards() {
        Player p = player(100, 50);
        CombatSession session = CombatSession.start(p, goblin(10, 30), MIDPOINT);

        TurnOutcome outcome = session.submitAction(CombatAction.attack());

        assertEquals(CombatState.PLAYER_VICTORY, outcome.state());
        assertTrue(outcome.isTerminal());
        assertEquals(List.of("Tester attacks Goblin for 10 damage!", "Goblin defeated!", "Gained 30 EXP and 15 gold!"),
            outcome.messages());
        assertEquals(100, p.getStats().getHp());
        assertEquals(30, p.getStats().getExp());
        assertEquals(15, p.getGold());
    }

    @Test
    @DisplayName("Victory that crosses the threshold announces the level up")
    void victoryLevelUp() {
        Player p = player(100, 50);
        CombatSession session = CombatSession.start(p, goblin(10, 100), MIDPOINT);

        TurnOutcome outcome = session.submitAction(CombatAction.attack());

        assertTrue(outcome.messages().contains("[LEVEL UP!] Now level 2!"));
        assertEquals(2, p.getStats().getLevel());
        assertEquals(110, p.getStats().getHp());
    }

    @Test
    @DisplayName("Enemy killing the player ends combat without ticking effects")
    void defeatSkipsTick() {
        Player p = player(5, 50);
        p.getStats().addStatusEffect(StatusEffect.damageOverTime("Poison", 3, 2));
        CombatSession session = CombatSession.start(p, goblin(40, 30), MIDPOINT);

        TurnOutcome outcome = session.submitAction(CombatAction.attack());

        assertEquals(CombatState.PLAYER_DEFEAT, outcome.state());
        assertEquals("Tester has been defeated...", outcome.messages().get(outcome.messages().size() - 1));
        assertEquals(0, p.getStats().getHp());
        assertEquals(2, p.getStats().getStatusEffects().find("Poison").getDuration());
    }

    @Test
    @DisplayName("Actions after combat ends are rejected")
    void submitAfterEndRejected() {
        CombatSession session = CombatSession.start(player(100, 50), goblin(10, 30), MIDPOINT);
        session.submitAction(CombatAction.attack());

        assertThrows(IllegalStateException.class, () -> session.submitAction(CombatAction.attack()));
    }

    @Test
    @DisplayName("Not enough MP declines the action without consuming the turn")
    void notEnoughMpRequeries() {
        Player p = player(100, 5);
        Enemy e = goblin(40, 30);
        CombatSession session = CombatSession.start(p, e, MIDPOINT);

        TurnOutcome outcome = session.submitAction(CombatAction.useSkill(0));

        assertTrue(outcome.requery());
        assertEquals(List.of("Not enough MP! Need 10 MP."), outcome.messages());
        assertEquals(0, session.getTurn());
        assertEquals(100, p.getStats().getHp());
        assertEquals(40, e.getStats().getHp());
    }

    @Test
    @DisplayName("Cancelled and invalid skill choices are declined")
    void cancelledAndInvalidSkill() {
        CombatSession session = CombatSession.start(player(100, 50), goblin(40, 30), MIDPOINT);

        TurnOutcome cancelled = session.submitAction(CombatAction.useSkill(CombatAction.CANCELLED));
        assertTrue(cancelled.requery());
        assertTrue(cancelled.messages().isEmpty());

        TurnOutcome invalid = session.submitAction(CombatAction.useSkill(9));
        assertTrue(invalid.requery());
        assertEquals(List.of("Invalid skill choice."), invalid.messages());
        assertEquals(0, session.getTurn());
    }

    @Test
    @DisplayName("Damage skill then enemy retaliation")
    void damageSkillTurn() {
        Player p = player(100, 50);
        Enemy e = goblin(40, 30);
        CombatSession session = CombatSession.start(p, e, MIDPOINT);

        TurnOutcome outcome = session.submitAction(CombatAction.useSkill(0));

        assertEquals(List.of("Tester uses Power Strike! Deals 15 damage!", "Goblin attacks Tester for 8 damage!"),
            outcome.messages());
        assertEquals(25, e.getStats().getHp());
        assertEquals(40, p.getStats().getMp());
    }

    @Test
    @DisplayName("Heal skill heals the player, not the enemy")
    void healTargetsPlayer() {
        Player p = player(50, 50);
        Enemy e = goblin(30, 30);
        CombatSession session = CombatSession.start(p, e, MIDPOINT);

        TurnOutcome outcome = session.submitAction(CombatAction.useSkill(1));

        assertEquals("Tester uses Heal! Restored 8 HP!", outcome.messages().get(0));
        assertEquals(50, p.getStats().getHp()); // +8 then -8
        assertEquals(30, e.getStats().getHp());
    }

    @Test
    @DisplayName("Using an item consumes it and the turn")
    void useItemTurn() {
        Player p = player(50, 50);
        p.addItem(potion());
        CombatSession session = CombatSession.start(p, goblin(40, 30), MIDPOINT);

        TurnOutcome outcome = session.submitAction(CombatAction.useItem(0));

        assertFalse(outcome.requery());
        assertEquals("Used Health Potion! Restored 40 HP.", outcome.messages().get(0));
        assertEquals(82, p.getStats().getHp());
        assertFalse(p.hasItems());
    }

    @Test
    @DisplayName("Item actions are declined with no items or a bad index")
    void itemDeclines() {
        Player p = player(50, 50);
        CombatSession session = CombatSession.start(p, goblin(40, 30), MIDPOINT);

        assertEquals(List.of("You have no items!"), session.submitAction(CombatAction.useItem(0)).messages());

        p.addItem(potion());
        TurnOutcome invalid = session.submitAction(CombatAction.useItem(3));
        assertTrue(invalid.requery());
        assertEquals(List.of("Invalid item choice."), invalid.messages());
        assertTrue(session.submitAction(CombatAction.useItem(CombatAction.CANCELLED)).messages().isEmpty());
        assertTrue(p.hasItems());
        assertEquals(0, session.getTurn());
    }

    @Test
    @DisplayName("Flee roll of 0.5 fails and the enemy attacks")
    void fleeFailsAtBoundary() {
        Player p = player(100, 50);
        CombatSession session = CombatSession.start(p, goblin(40, 30), MIDPOINT);

        TurnOutcome outcome = session.submitAction(CombatAction.flee());

        assertEquals(List.of("Tester couldn't escape!", "Goblin attacks Tester for 8 damage!"), outcome.messages());
        assertTrue(session.isActive());
    }

    @Test
    @DisplayName("Flee roll below 0.5 escapes immediately")
    void fleeSucceeds() {
        Player p = player(100, 50);
        CombatSession session = CombatSession.start(p, goblin(40, 30), () -> 0.49);

        TurnOutcome outcome = session.submitAction(CombatAction.flee());

        assertEquals(CombatState.PLAYER_FLED, outcome.state());
        assertEquals(List.of("Tester successfully fled!"), outcome.messages());
        assertEquals(100, p.getStats().getHp());
        assertEquals(0, p.getGold());
    }

    @Test
    @DisplayName("A stunned enemy skips exactly one action per stun turn")
    void stunnedEnemySkipsAction() {
        Player p = player(100, 50);
        Enemy e = goblin(40, 30);
        CombatSession session = CombatSession.start(p, e, MIDPOINT);

        TurnOutcome stunTurn = session.submitAction(CombatAction.useSkill(3));
        assertEquals(List.of(
            "Tester uses Stunning Strike! Goblin is stunned for 1 turns!",
            "Goblin is stunned and cannot act!",
            "[*] Stunned wore off!"), stunTurn.messages());
        assertEquals(100, p.getStats().getHp());

        TurnOutcome next = session.submitAction(CombatAction.attack());
        assertEquals("Goblin attacks Tester for 8 damage!", next.messages().get(1));
    }

    @Test
    @DisplayName("A player stunned for 2 turns loses exactly 2 actions")
    void stunnedPlayerLosesActions() {
        Player p = player(100, 50);
        Enemy e = goblin(40, 30);
        p.getStats().addStatusEffect(StatusEffect.stun("Stunned", 2));
        CombatSession session = CombatSession.start(p, e, MIDPOINT);

        assertTrue(session.isPlayerStunned());
        TurnOutcome first = session.submitAction(CombatAction.attack());
        assertEquals("Tester is stunned and cannot act!", first.messages().get(0));

        assertTrue(session.isPlayerStunned());
        session.passStunnedTurn();

        assertFalse(session.isPlayerStunned());
        assertEquals(40, e.getStats().getHp());
        assertEquals(84, p.getStats().getHp());
        assertThrows(IllegalStateException.class, session::passStunnedTurn);

        session.submitAction(CombatAction.attack());
        assertEquals(30, e.getStats().getHp());
        assertEquals(3, session.getTurn());
    }

    @Test
    @DisplayName("An enemy killed by a DOT tick still pays rewards")
    void dotKillIsVictory() {
        Player p = player(100, 50);
        Enemy e = goblin(5, 30);
        CombatSession session = CombatSession.start(p, e, MIDPOINT);

        TurnOutcome outcome = session.submitAction(CombatAction.useSkill(2));

        assertEquals(List.of(
            "Tester uses Poison Cloud! Goblin is afflicted with Poison!",
            "Goblin attacks Tester for 8 damage!",
            "[DOT] Poison deals 5 damage!",
            "Goblin defeated!",
            "Gained 30 EXP and 15 gold!"), outcome.messages());
        assertEquals(CombatState.PLAYER_VICTORY, session.getState());
        assertEquals(15, p.getGold());
    }

    @Test
    @DisplayName("Player dying to a DOT tick loses even if the enemy also dies")
    void dotDoubleKnockoutIsDefeat() {
        Player p = player(10, 50);
        Enemy e = goblin(40, 30);
        p.getStats().addStatusEffect(StatusEffect.damageOverTime("Burn", 5, 2));
        e.getStats().addStatusEffect(StatusEffect.damageOverTime("Poison", 50, 2));
        CombatSession session = CombatSession.start(p, e, () -> 0.0);

        // low roll: basic attacks deal round(10 * 0.8) = 8 and round(8 * 0.8) = 6
        TurnOutcome outcome = session.submitAction(CombatAction.attack());

        assertFalse(p.isAlive());
        assertFalse(e.isAlive());
        assertEquals(CombatState.PLAYER_DEFEAT, outcome.state());
    }
}
