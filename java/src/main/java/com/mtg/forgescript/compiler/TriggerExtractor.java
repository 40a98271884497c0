package com.mtg.forgescript.compiler;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives trigger descriptors from condition clauses such as "Whenever this creature attacks"
 * or "At the beginning of your upkeep".
 */
public class TriggerExtractor {
    private static final Pattern EVENT_PREFIX = Pattern.compile("^(?:whenever|when)\\s+");
    private static final Pattern CREATURE_YOU_CONTROL =
            Pattern.compile("^(?:a|one or more)\\s+creatures?\\s+you control");

    static final String SELF = "Card.Self";

    /**
     * One event rule: a predicate over the lower-cased clause and the descriptor it builds.
     */
    record Rule(String name, Predicate<String> matches, Function<String, TriggerDescriptor> build) {}

    // Most specific first.
    private static final List<Rule> EVENT_RULES = List.of(
            new Rule("enters", clause -> clause.contains("enters"),
                    clause -> TriggerDescriptor.of(TriggerMode.CHANGES_ZONE)
                            .with("Destination", "Battlefield")
                            .with("ValidCard", validCard(clause))
                            .with("TriggerZones", "Battlefield")
                            .build()),
            new Rule("dies", clause -> clause.contains("dies") || clause.contains("put into a graveyard"),
                    clause -> {
                        String valid = validCard(clause);
                        return TriggerDescriptor.of(TriggerMode.CHANGES_ZONE)
                                .with("Origin", "Battlefield")
                                .with("Destination", "Graveyard")
                                .with("ValidCard", valid)
                                .with("TriggerZones", SELF.equals(valid) ? "Graveyard" : "Battlefield")
                                .build();
                    }),
            new Rule("attacks", clause -> clause.contains("attacks"),
                    clause -> TriggerDescriptor.of(TriggerMode.ATTACKS)
                            .with("ValidCard", validCard(clause))
                            .with("TriggerZones", "Battlefield")
                            .build()),
            new Rule("deals damage", clause -> clause.contains("deals") && clause.contains("damage"),
                    clause -> {
                        TriggerDescriptor.Builder builder = TriggerDescriptor.of(TriggerMode.DAMAGE_DONE)
                                .with("ValidSource", validCard(clause))
                                .with("ValidTarget", clause.contains("to a player") ? "Player" : "Opponent");
                        if (clause.contains("combat damage")) {
                            builder.with("CombatDamage", "True");
                        }
                        return builder.with("TriggerZones", "Battlefield").build();
                    }),
            new Rule("discards",
                    clause -> clause.contains("discard") && (clause.contains("you") || clause.contains("opponent")),
                    clause -> TriggerDescriptor.of(TriggerMode.DISCARD)
                            .with("ValidCard", "Card")
                            .with("ValidPlayer", clause.contains("opponent") ? "Opponent" : "You")
                            .with("TriggerZones", "Battlefield")
                            .build()),
            new Rule("cast", clause -> clause.contains("cast"),
                    clause -> TriggerDescriptor.of(TriggerMode.SPELL_CAST)
                            .with("ValidCard", spellType(clause))
                            .with("ValidActivatingPlayer", clause.contains("opponent") ? "Opponent" : "You")
                            .with("TriggerZones", "Battlefield")
                            .build()),
            new Rule("taps", clause -> clause.contains("taps") || clause.contains("tapped"),
                    clause -> TriggerDescriptor.of(TriggerMode.TAPS)
                            .with("ValidCard", validCard(clause))
                            .with("TriggerZones", "Battlefield")
                            .build()),
            new Rule("sacrifice", clause -> clause.contains("sacrifice"),
                    clause -> TriggerDescriptor.of(TriggerMode.CHANGES_ZONE)
                            .with("Destination", "Graveyard")
                            .with("TriggerZones", "Graveyard")
                            .build())
    );

    /**
     * Extract a trigger from a full condition clause, either event ("When ...", "Whenever ...")
     * or phase ("At the beginning of ...").
     */
    public Optional<TriggerDescriptor> extract(String condition) {
        String lower = condition.strip().toLowerCase();
        Matcher event = EVENT_PREFIX.matcher(lower);
        if (event.lookingAt()) {
            return forEvent(lower.substring(event.end()));
        }
        if (lower.contains("beginning of") || lower.contains("upkeep") || lower.contains("end of")) {
            return forPhase(lower);
        }
        return Optional.empty();
    }

    /**
     * Extract an event trigger from the clause after "When"/"Whenever".
     */
    public Optional<TriggerDescriptor> forEvent(String clause) {
        String lower = clause.strip().toLowerCase();
        for (Rule rule : EVENT_RULES) {
            if (rule.matches().test(lower)) {
                return Optional.of(rule.build().apply(lower));
            }
        }
        return Optional.empty();
    }

    /**
     * Extract a phase trigger from timing text such as "your upkeep".
     * Timing outside the phase table yields nothing.
     */
    public Optional<TriggerDescriptor> forPhase(String timing) {
        String lower = timing.strip().toLowerCase();
        return Phase.fromTiming(lower).map(phase -> {
            TriggerDescriptor.Builder builder = TriggerDescriptor.of(TriggerMode.PHASE)
                    .with("Phase", phase.getScriptName());
            if (lower.contains("opponent")) {
                builder.with("ValidPlayer", "Opponent");
            } else if (lower.contains("your ")) {
                builder.with("ValidPlayer", "You");
            }
            return builder.with("TriggerZones", "Battlefield").build();
        });
    }

    /**
     * The card filter for the subject of a clause. Anything that is not another creature
     * refers to the card itself ("this creature", "~", the card's own name).
     */
    static String validCard(String clause) {
        if (clause.startsWith("another creature")) {
            return clause.startsWith("another creature you control") ? "Creature.Other+YouCtrl" : "Creature.Other";
        }
        if (CREATURE_YOU_CONTROL.matcher(clause).lookingAt()) {
            return "Creature.YouCtrl";
        }
        if (clause.startsWith("a creature")) {
            return "Creature";
        }
        return SELF;
    }

    private static String spellType(String clause) {
        if (clause.contains("instant or sorcery")) {
            return "Instant,Sorcery";
        }
        if (clause.contains("creature spell")) {
            return "Creature";
        }
        return "Card";
    }
}
