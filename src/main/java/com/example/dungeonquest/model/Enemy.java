package com.example.dungeonquest.model;

/**
 * An enemy in combat. Grants fixed experience and gold when defeated.
 */
public class Enemy extends GameCharacter {
    private final int expReward;
    private final int goldReward;

    public Enemy(String name, Stats stats, String asciiArt, int expReward, int goldReward) {
        super(name, stats, asciiArt);
        if (expReward < 0 || goldReward < 0) {
            throw new IllegalArgumentException("Rewards must not be negative for " + name);
        }
        this.expReward = expReward;
        this.goldReward = goldReward;
    }

    public int getExpReward() { return expReward; }
    public int getGoldReward() { return goldReward; }

    @Override
    public boolean isPlayer() {
        return false;
    }
}
