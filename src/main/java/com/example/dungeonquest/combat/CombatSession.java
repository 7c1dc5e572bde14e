package com.example.dungeonquest.combat;

import com.example.dungeonquest.model.Enemy;
import com.example.dungeonquest.model.Player;
import com.example.dungeonquest.model.Skill;
import com.example.dungeonquest.model.SkillType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One encounter between the player and a single enemy.
 *
 * Each accepted action runs a full turn: the player acts (or is skipped while stunned),
 * the enemy retaliates with a basic attack unless stunned, then status effects tick on
 * the player and then on the enemy. Combat ends as soon as either side reaches 0 HP or
 * the player flees. Declined actions (cancelled menus, bad indices, not enough MP,
 * empty inventory) leave the turn unconsumed.
 */
public class CombatSession {

    private static final Logger logger = LoggerFactory.getLogger(CombatSession.class);

    private final Player player;
    private final Enemy enemy;
    private final RandomSource random;
    private final SkillResolver resolver;

    private CombatState state = CombatState.ACTIVE;

    /** Number of turns consumed so far */
    private int turn = 0;

    /** Append-only combat log */
    private final List<String> messages = new ArrayList<>();

    private CombatSession(Player player, Enemy enemy, RandomSource random, SkillResolver resolver) {
        this.player = player;
        this.enemy = enemy;
        this.random = random;
        this.resolver = resolver;
    }

    /**
     * Begin an encounter.
     * @throws IllegalArgumentException if either combatant is missing or already defeated
     */
    public static CombatSession start(Player player, Enemy enemy, RandomSource random) {
        return start(player, enemy, random, new SkillResolver(random));
    }

    public static CombatSession start(Player player, Enemy enemy, RandomSource random, SkillResolver resolver) {
        if (player == null || enemy == null) {
            throw new IllegalArgumentException("Combat needs a player and an enemy");
        }
        if (!player.isAlive()) {
            throw new IllegalArgumentException(player.getName() + " cannot fight with 0 HP");
        }
        if (!enemy.isAlive()) {
            throw new IllegalArgumentException(enemy.getName() + " is already defeated");
        }
        CombatSession session = new CombatSession(player, enemy, random, resolver);
        session.log("A wild " + enemy.getName() + " appears!");
        logger.info("Combat started: {} vs {}", player.getName(), enemy.getName());
        return session;
    }

    // Accessors

    public Player getPlayer() { return player; }
    public Enemy getEnemy() { return enemy; }
    public CombatState getState() { return state; }
    public boolean isActive() { return state == CombatState.ACTIVE; }
    public int getTurn() { return turn; }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    /**
     * Whether the next turn will skip the player's action. Front ends should not ask for
     * input in that case; any submitted action is ignored.
     */
    public boolean isPlayerStunned() {
        return player.getStats().isStunned();
    }

    // Turn protocol

    /**
     * Submit the player's decision for this turn.
     * @throws IllegalStateException if the combat has already ended
     */
    public TurnOutcome submitAction(CombatAction action) {
        requireActive();
        if (isPlayerStunned()) {
            return passStunnedTurn();
        }
        if (action == null) {
            throw new IllegalArgumentException("Action is required");
        }
        int mark = messages.size();

        switch (action.getKind()) {
            case ATTACK:
                log(resolver.basicAttack(player, enemy).getMessage());
                break;
            case USE_SKILL:
                if (!useSkill(action)) return declined(mark, action);
                break;
            case USE_ITEM:
                if (!useItem(action)) return declined(mark, action);
                break;
            case FLEE:
                if (resolver.getCalculator().isFleeSuccessful(random.nextDouble())) {
                    log(player.getName() + " successfully fled!");
                    turn++;
                    end(CombatState.PLAYER_FLED);
                    return TurnOutcome.completed(since(mark), state);
                }
                log(player.getName() + " couldn't escape!");
                break;
            default:
                throw new IllegalStateException("Unhandled action " + action);
        }

        if (!enemy.isAlive()) {
            turn++;
            victory();
            return TurnOutcome.completed(since(mark), state);
        }
        return finishTurn(mark);
    }

    /**
     * Run a turn in which the stunned player does nothing.
     * @throws IllegalStateException if combat has ended or the player is not stunned
     */
    public TurnOutcome passStunnedTurn() {
        requireActive();
        if (!isPlayerStunned()) {
            throw new IllegalStateException(player.getName() + " is not stunned");
        }
        int mark = messages.size();
        log(player.getName() + " is stunned and cannot act!");
        return finishTurn(mark);
    }

    private void requireActive() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Combat already ended: " + state);
        }
    }

    /**
     * @return true if a skill was used and the turn is consumed
     */
    private boolean useSkill(CombatAction action) {
        if (action.isCancelled()) return false;
        Skill skill = player.getSkill(action.getIndex());
        if (skill == null) {
            log("Invalid skill choice.");
            return false;
        }
        // heals are self-heals; every other type is aimed at the enemy (buffs pick the caster themselves)
        CombatResult result = skill.getType() == SkillType.HEAL
            ? resolver.resolve(player, player, skill)
            : resolver.resolve(player, enemy, skill);
        log(result.getMessage());
        return result.isSuccess();
    }

    /**
     * @return true if an item was used and the turn is consumed
     */
    private boolean useItem(CombatAction action) {
        if (!player.hasItems()) {
            log("You have no items!");
            return false;
        }
        if (action.isCancelled()) return false;
        String result = player.useItem(action.getIndex());
        if (result == null) {
            log("Invalid item choice.");
            return false;
        }
        log(result);
        return true;
    }

    /**
     * Enemy phase, end-of-turn tick and termination check.
     */
    private TurnOutcome finishTurn(int mark) {
        turn++;

        if (enemy.getStats().isStunned()) {
            log(enemy.getName() + " is stunned and cannot act!");
        } else {
            log(resolver.basicAttack(enemy, player).getMessage());
            if (!player.isAlive()) {
                defeat();
                return TurnOutcome.completed(since(mark), state);
            }
        }

        messages.addAll(player.getStats().tickStatusEffects());
        messages.addAll(enemy.getStats().tickStatusEffects());

        if (!player.isAlive()) {
            defeat();
        } else if (!enemy.isAlive()) {
            victory();
        }
        return TurnOutcome.completed(since(mark), state);
    }

    private TurnOutcome declined(int mark, CombatAction action) {
        logger.debug("Declined {} on turn {}", action, turn + 1);
        return TurnOutcome.declined(since(mark), state);
    }

    private void victory() {
        log(enemy.getName() + " defeated!");
        int oldLevel = player.getStats().getLevel();
        player.gainExp(enemy.getExpReward());
        player.addGold(enemy.getGoldReward());
        log("Gained " + enemy.getExpReward() + " EXP and " + enemy.getGoldReward() + " gold!");
        if (player.getStats().getLevel() > oldLevel) {
            log("[LEVEL UP!] Now level " + player.getStats().getLevel() + "!");
        }
        end(CombatState.PLAYER_VICTORY);
    }

    private void defeat() {
        log(player.getName() + " has been defeated...");
        end(CombatState.PLAYER_DEFEAT);
    }

    private void end(CombatState result) {
        state = result;
        logger.info("Combat ended after {} turn(s): {} vs {} -> {}",
            turn, player.getName(), enemy.getName(), result.getDisplayName());
    }

    private void log(String message) {
        messages.add(message);
    }

    private List<String> since(int mark) {
        return new ArrayList<>(messages.subList(mark, messages.size()));
    }
}
