package com.example.dungeonquest.model;

/**
 * Combat stats that status effects can modify.
 */
public enum Stat {
    ATTACK,
    SPEED
}
