package com.example.dungeonquest.effect;

import com.example.dungeonquest.model.Stat;
import com.example.dungeonquest.model.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The status effects carried by one {@link Stats} container, together with the rules
 * for stacking, ticking and expiry.
 *
 * Stacking is keyed by effect name. Re-applying an effect that is already present keeps
 * a single entry: its duration becomes the longer of the two, and damage-over-time
 * effects additionally add the new power to the old one.
 */
public class StatusEffectSet {

    private static final Logger logger = LoggerFactory.getLogger(StatusEffectSet.class);

    private final List<StatusEffect> effects = new ArrayList<>();

    /**
     * Apply an effect, merging with an existing effect of the same name.
     * Effects with no turns left are ignored.
     */
    public void add(StatusEffect effect) {
        if (effect == null) return;
        if (!effect.isActive()) {
            logger.debug("Ignored {} with no turns left", effect.getName());
            return;
        }
        StatusEffect existing = find(effect.getName());
        if (existing != null) {
            existing.setDuration(Math.max(existing.getDuration(), effect.getDuration()));
            if (effect.getType() == EffectType.DAMAGE_OVER_TIME) {
                existing.addPower(effect.getPower());
            }
            logger.debug("Refreshed {} (power={}, duration={})",
                existing.getName(), existing.getPower(), existing.getDuration());
            return;
        }
        effects.add(effect);
        logger.debug("Applied {}", effect);
    }

    /**
     * Remove the effect with the given name. Does nothing if it is absent.
     */
    public void remove(String name) {
        effects.removeIf(e -> e.getName().equals(name));
    }

    public StatusEffect find(String name) {
        for (StatusEffect e : effects) {
            if (e.getName().equals(name)) return e;
        }
        return null;
    }

    public boolean contains(String name) {
        return find(name) != null;
    }

    public boolean isStunned() {
        return effects.stream().anyMatch(e -> e.getType() == EffectType.STUN);
    }

    /**
     * Sum of the power of every stat modifier that targets the given stat.
     */
    public int statModifierTotal(Stat stat) {
        int total = 0;
        for (StatusEffect e : effects) {
            if (e.getType() == EffectType.STAT_MODIFIER && e.getStatAffected() == stat) {
                total += e.getPower();
            }
        }
        return total;
    }

    /**
     * Run one end-of-turn pass over every active effect: damage-over-time effects hurt
     * the owner, then each effect loses one turn. Expired effects are removed once the
     * whole pass is done, so every effect present at the start fires exactly once.
     *
     * @param owner the stats these effects belong to (receives DOT damage)
     * @return messages describing what happened, in order
     */
    public List<String> tick(Stats owner) {
        List<String> messages = new ArrayList<>();
        List<String> expired = new ArrayList<>();

        for (StatusEffect effect : new ArrayList<>(effects)) {
            if (effect.getType() == EffectType.DAMAGE_OVER_TIME) {
                int damage = owner.takeDamage(effect.getPower());
                messages.add("[DOT] " + effect.getName() + " deals " + damage + " damage!");
            }
            if (!effect.tick()) {
                expired.add(effect.getName());
                messages.add("[*] " + effect.getName() + " wore off!");
            }
        }

        for (String name : expired) {
            remove(name);
        }
        return messages;
    }

    public int size() {
        return effects.size();
    }

    public boolean isEmpty() {
        return effects.isEmpty();
    }

    /** Comma-separated summary for status displays, or "None". */
    public String describe() {
        if (effects.isEmpty()) return "None";
        return effects.stream().map(StatusEffect::describe).collect(Collectors.joining(", "));
    }
}
