package com.example.dungeonquest.combat;

import java.util.List;

/**
 * What one call to {@link CombatSession#submitAction(CombatAction)} produced.
 *
 * @param messages log lines added by this call, in order
 * @param state session state after the call
 * @param requery true if the action was declined (cancelled, invalid index, not enough MP,
 *                no items) and the player must choose again; no turn was consumed
 */
public record TurnOutcome(List<String> messages, CombatState state, boolean requery) {

    public TurnOutcome {
        messages = List.copyOf(messages);
    }

    static TurnOutcome declined(List<String> messages, CombatState state) {
        return new TurnOutcome(messages, state, true);
    }

    static TurnOutcome completed(List<String> messages, CombatState state) {
        return new TurnOutcome(messages, state, false);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
