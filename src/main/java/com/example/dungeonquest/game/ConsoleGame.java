package com.example.dungeonquest.game;

import com.example.dungeonquest.combat.ActionSource;
import com.example.dungeonquest.combat.CombatAction;
import com.example.dungeonquest.combat.CombatRenderer;
import com.example.dungeonquest.combat.CombatSession;
import com.example.dungeonquest.combat.CombatState;
import com.example.dungeonquest.combat.RandomSource;
import com.example.dungeonquest.combat.TurnOutcome;
import com.example.dungeonquest.model.CharacterClass;
import com.example.dungeonquest.model.Enemy;
import com.example.dungeonquest.model.GameCharacter;
import com.example.dungeonquest.model.Item;
import com.example.dungeonquest.model.Player;
import com.example.dungeonquest.model.Skill;
import com.example.dungeonquest.model.Stats;
import com.example.dungeonquest.persistence.GameContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

/**
 * Text front end: main menu, character creation, the exploration loop and combat input.
 * Reads lines from a reader and writes plain text, so it runs the same on a terminal or in tests.
 */
public class ConsoleGame implements CombatRenderer, ActionSource {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleGame.class);

    private static final String DEFAULT_NAME = "Hero";
    private static final String RULE = "==================================================";

    private final GameContent content;
    private final RandomSource random;
    private final BufferedReader in;
    private final PrintWriter out;
    private final DungeonExplorer explorer;

    /** Set when input runs out; every loop unwinds from here */
    private boolean closed = false;

    public ConsoleGame(GameContent content, RandomSource random, BufferedReader in, PrintWriter out) {
        this.content = content;
        this.random = random;
        this.in = in;
        this.out = out;
        this.explorer = new DungeonExplorer(content.getEnemies(), random);
    }

    /**
     * Run until the player quits or input ends.
     */
    public void run() throws IOException {
        while (!closed) {
            out.println(RULE);
            out.println("                 DUNGEON QUEST");
            out.println(RULE);
            out.println("1. New Game");
            out.println("2. Quit");
            String choice = prompt("Choose: ");
            if (choice == null || choice.equals("2")) {
                break;
            }
            if (!choice.equals("1")) {
                continue;
            }
            Player player = createCharacter();
            if (player == null) {
                break;
            }
            explore(player);
            if (!player.isAlive()) {
                gameOver(player);
            }
        }
        out.println("Farewell, adventurer.");
        out.flush();
    }

    // Character creation

    Player createCharacter() throws IOException {
        String name = prompt("Enter your name: ");
        if (name == null) return null;
        if (name.isBlank()) name = DEFAULT_NAME;

        List<CharacterClass> classes = content.getClasses();
        while (true) {
            out.println();
            out.println("Choose your class:");
            for (int i = 0; i < classes.size(); i++) {
                CharacterClass cc = classes.get(i);
                out.printf("%d. %-8s HP %d  MP %d  ATK %d  SPD %d  %s%n",
                    i + 1, cc.name, cc.hp, cc.mp, cc.attack, cc.speed, cc.description);
            }
            String choice = prompt("Class: ");
            if (choice == null) return null;
            int index = parseIndex(choice);
            if (index >= 0 && index < classes.size()) {
                Player player = content.newPlayer(name.trim(), classes.get(index));
                logger.info("New {} named {}", player.getClassName(), player.getName());
                out.println("Welcome, " + player.getName() + " the " + player.getClassName() + "!");
                return player;
            }
            out.println("Invalid class choice.");
        }
    }

    // Exploration

    void explore(Player player) throws IOException {
        while (!closed && player.isAlive()) {
            out.println();
            out.println(player.getName() + " the " + player.getClassName()
                + " | Level " + player.getStats().getLevel()
                + " | HP " + player.getStats().getHp() + "/" + player.getStats().getMaxHp()
                + " | MP " + player.getStats().getMp() + "/" + player.getStats().getMaxMp()
                + " | Gold " + player.getGold());
            out.println("1. Explore deeper");
            out.println("2. Search the room");
            out.println("3. Rest");
            out.println("4. Quit to menu");
            String choice = prompt("What will you do? ");
            if (choice == null || choice.equals("4")) {
                return;
            }
            switch (choice) {
                case "1":
                    DungeonExplorer.Exploration result = explorer.explore();
                    out.println(result.story());
                    if (result.isEncounter()) {
                        fight(player, result.enemy());
                    }
                    break;
                case "2":
                    out.println(explorer.search(player));
                    break;
                case "3":
                    out.println(explorer.rest(player));
                    break;
                default:
                    out.println("Invalid choice.");
            }
        }
    }

    /**
     * Drive one encounter to its end (or until input runs out).
     */
    CombatState fight(Player player, Enemy enemy) throws IOException {
        CombatSession session = CombatSession.start(player, enemy, random);
        while (session.isActive() && !closed) {
            renderCombat(player, enemy, session.getMessages());
            TurnOutcome outcome;
            if (session.isPlayerStunned()) {
                acknowledge(session);
                outcome = session.passStunnedTurn();
            } else {
                CombatAction action = nextAction(session);
                if (action == null) break;
                outcome = session.submitAction(action);
                // cancelling a menu adds nothing to the log and needs no pause
                if (outcome.requery() && !outcome.messages().isEmpty()) {
                    out.println(outcome.messages().get(outcome.messages().size() - 1));
                    acknowledge(session);
                }
            }
            if (outcome.isTerminal()) {
                renderCombat(player, enemy, session.getMessages());
                acknowledge(session);
            }
        }
        return session.getState();
    }

    private void gameOver(Player player) throws IOException {
        out.println();
        out.println(RULE);
        out.println("                   GAME OVER");
        out.println(RULE);
        out.println(player.getName() + " fell at level " + player.getStats().getLevel()
            + " with " + player.getGold() + " gold.");
        prompt("Press Enter to return to the menu...");
    }

    // CombatRenderer

    @Override
    public void renderCombat(Player player, Enemy enemy, List<String> messages) {
        out.println();
        out.println(RULE);
        if (enemy.getAsciiArt() != null && !enemy.getAsciiArt().isEmpty()) {
            out.println(enemy.getAsciiArt());
        }
        renderCombatant(enemy);
        out.println("--------------------------------------------------");
        renderCombatant(player);
        out.println(RULE);
        int from = Math.max(0, messages.size() - 6);
        for (String message : messages.subList(from, messages.size())) {
            out.println("  " + message);
        }
        out.flush();
    }

    private void renderCombatant(GameCharacter character) {
        Stats stats = character.getStats();
        out.printf("%s (Lv %d)  HP %d/%d  MP %d/%d%n", character.getName(), stats.getLevel(),
            stats.getHp(), stats.getMaxHp(), stats.getMp(), stats.getMaxMp());
        out.println("  Status: " + stats.getStatusEffects().describe());
    }

    @Override
    public void renderSkillMenu(Player player) {
        out.println("Skills:");
        List<Skill> skills = player.getSkills();
        for (int i = 0; i < skills.size(); i++) {
            Skill skill = skills.get(i);
            out.printf("%d. %s (%d MP) - %s%n", i + 1, skill.getName(), skill.getMpCost(), skill.getDescription());
        }
        out.println("0. Back");
    }

    @Override
    public void renderInventory(Player player) {
        out.println("Inventory:");
        List<Item> items = player.getInventory();
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            out.printf("%d. %s - %s%n", i + 1, item.getName(), item.getDescription());
        }
        out.println("0. Back");
    }

    // ActionSource

    /**
     * @return the chosen action, or null if input ended
     */
    @Override
    public CombatAction nextAction(CombatSession session) {
        try {
            while (true) {
                out.println("1. Attack  2. Skill  3. Item  4. Flee");
                String choice = prompt("Your choice: ");
                if (choice == null) return null;
                switch (choice) {
                    case "1":
                        return CombatAction.attack();
                    case "2":
                        renderSkillMenu(session.getPlayer());
                        String skill = prompt("Skill: ");
                        if (skill == null) return null;
                        return CombatAction.useSkill(parseIndex(skill));
                    case "3":
                        if (!session.getPlayer().hasItems()) {
                            return CombatAction.useItem(CombatAction.CANCELLED);
                        }
                        renderInventory(session.getPlayer());
                        String item = prompt("Item: ");
                        if (item == null) return null;
                        return CombatAction.useItem(parseIndex(item));
                    case "4":
                        return CombatAction.flee();
                    default:
                        out.println("Invalid choice.");
                }
            }
        } catch (IOException e) {
            logger.error("Failed to read combat input", e);
            closed = true;
            return null;
        }
    }

    @Override
    public void acknowledge(CombatSession session) {
        try {
            prompt("Press Enter to continue...");
        } catch (IOException e) {
            logger.error("Failed to read input", e);
            closed = true;
        }
    }

    // Input helpers

    private String prompt(String text) throws IOException {
        if (closed) return null;
        out.print(text);
        out.flush();
        String line = in.readLine();
        if (line == null) {
            closed = true;
            return null;
        }
        return line.trim();
    }

    /**
     * Menu numbers start at 1; 0, blanks and anything non-numeric come back as {@link CombatAction#CANCELLED}.
     */
    static int parseIndex(String choice) {
        try {
            int n = Integer.parseInt(choice.trim());
            return n > 0 ? n - 1 : CombatAction.CANCELLED;
        } catch (NumberFormatException e) {
            return CombatAction.CANCELLED;
        }
    }
}
