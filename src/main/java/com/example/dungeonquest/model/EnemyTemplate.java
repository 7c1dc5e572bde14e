package com.example.dungeonquest.model;

/**
 * Static definition of an enemy. Each encounter spawns a fresh {@link Enemy} from it.
 */
public class EnemyTemplate {
    private final String key;
    private final String name;
    private final int level;
    private final int hpMax;
    private final int mpMax;
    private final int attack;
    private final int speed;
    private final int expReward;
    private final int goldReward;
    private final String asciiArt;

    public EnemyTemplate(String key, String name, int level, int hpMax, int mpMax,
                         int attack, int speed, int expReward, int goldReward, String asciiArt) {
        this.key = key;
        this.name = name;
        this.level = level;
        this.hpMax = hpMax;
        this.mpMax = mpMax;
        this.attack = attack;
        this.speed = speed;
        this.expReward = expReward;
        this.goldReward = goldReward;
        this.asciiArt = asciiArt;
    }

    public String getKey() { return key; }
    public String getName() { return name; }
    public int getLevel() { return level; }
    public int getHpMax() { return hpMax; }
    public int getMpMax() { return mpMax; }
    public int getAttack() { return attack; }
    public int getSpeed() { return speed; }
    public int getExpReward() { return expReward; }
    public int getGoldReward() { return goldReward; }
    public String getAsciiArt() { return asciiArt; }

    /**
     * Create a new enemy at full HP and MP with no status effects.
     */
    public Enemy spawn() {
        Stats stats = new Stats(hpMax, hpMax, mpMax, mpMax, attack, speed, level, 0);
        return new Enemy(name, stats, asciiArt, expReward, goldReward);
    }
}
