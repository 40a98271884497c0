package com.mtg.forgescript.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A compiled ability. Each variant renders exactly one script line.
 */
public sealed interface Ability permits Ability.Triggered, Ability.Activated, Ability.Static, Ability.Spell {

    String render();

    /**
     * Single-line description cut to {@code maxLength} characters.
     */
    static String describe(String text, int maxLength) {
        String flat = text.replaceAll("\\s*\\R\\s*", " ").strip();
        return flat.length() > maxLength ? flat.substring(0, maxLength) : flat;
    }

    /**
     * {@code T:} line executing a support variable when the trigger fires.
     */
    record Triggered(TriggerDescriptor trigger, String execute, String description) implements Ability {
        @Override
        public String render() {
            return "T:" + trigger.render() + " | Execute$ " + execute + " | TriggerDescription$ " + description;
        }
    }

    /**
     * {@code A:AB$} line: an effect paid for with a cost.
     */
    record Activated(String effect, String cost, String description) implements Ability {
        @Override
        public String render() {
            return "A:AB$ " + effect + " | Cost$ " + cost + " | SpellDescription$ " + description;
        }
    }

    /**
     * {@code S:} line for a continuous effect.
     */
    record Static(Map<String, String> parameters) implements Ability {
        public Static {
            parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        }

        @Override
        public String render() {
            StringBuilder sb = new StringBuilder("S:");
            parameters.forEach((key, value) -> {
                if (sb.length() > 2) {
                    sb.append(" | ");
                }
                sb.append(key).append("$ ").append(value);
            });
            return sb.toString();
        }
    }

    /**
     * {@code A:SP$} line: the effect of casting the card itself.
     */
    record Spell(String effect, String description) implements Ability {
        @Override
        public String render() {
            return "A:SP$ " + effect + " | SpellDescription$ " + description;
        }
    }
}
