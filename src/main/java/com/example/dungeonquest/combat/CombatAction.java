package com.example.dungeonquest.combat;

/**
 * One player decision submitted to a {@link CombatSession}.
 * Skill and item actions carry a zero-based index into the player's lists;
 * a negative index means the sub-menu was cancelled.
 */
public final class CombatAction {

    public enum Kind {
        ATTACK,
        USE_SKILL,
        USE_ITEM,
        FLEE
    }

    /** Index used when the player backs out of a skill or item menu */
    public static final int CANCELLED = -1;

    private static final CombatAction ATTACK = new CombatAction(Kind.ATTACK, 0);
    private static final CombatAction FLEE = new CombatAction(Kind.FLEE, 0);

    private final Kind kind;
    private final int index;

    private CombatAction(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    public static CombatAction attack() {
        return ATTACK;
    }

    public static CombatAction useSkill(int index) {
        return new CombatAction(Kind.USE_SKILL, index);
    }

    public static CombatAction useItem(int index) {
        return new CombatAction(Kind.USE_ITEM, index);
    }

    public static CombatAction flee() {
        return FLEE;
    }

    public Kind getKind() { return kind; }
    public int getIndex() { return index; }

    public boolean isCancelled() {
        return (kind == Kind.USE_SKILL || kind == Kind.USE_ITEM) && index < 0;
    }

    @Override
    public String toString() {
        return kind == Kind.USE_SKILL || kind == Kind.USE_ITEM ? kind + "(" + index + ")" : kind.name();
    }
}
