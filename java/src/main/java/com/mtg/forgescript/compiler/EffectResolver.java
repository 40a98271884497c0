package com.mtg.forgescript.compiler;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps an effect clause to an effect token with an ordered rule table.
 *
 * <p>Rules are tried top to bottom against the lower-cased clause and the first match wins.
 * Several rules overlap ("loses life" and "life", "untap" and "tap"), so the order is part
 * of the contract.
 */
public class EffectResolver {
    private static final Pattern GAIN = Pattern.compile("\\bgains?\\b");
    private static final Pattern LOSE = Pattern.compile("\\blos(?:e|es)\\b");
    // "lifelink" is not life
    private static final Pattern LIFE = Pattern.compile("\\blife\\b");
    private static final Pattern TAP = Pattern.compile("\\btap\\b");
    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern NUMBER_WORD = Pattern.compile("\\b(a|an|one|two|three)\\b");
    private static final Pattern TARGET_TYPE =
            Pattern.compile("target (creature|artifact|enchantment|land|permanent|player|opponent)");

    private static final Map<String, Integer> NUMBER_WORDS =
            Map.of("a", 1, "an", 1, "one", 1, "two", 2, "three", 3);

    private static final List<String> TOKEN_SCRIPTS =
            List.of("food", "treasure", "clue", "blood", "beer", "gnome", "goblin");

    /**
     * One row of the resolution table.
     */
    public record Rule(EffectKind kind, Predicate<String> matches, Function<String, EffectToken> handler) {}

    private static final List<Rule> RULES = List.of(
            new Rule(EffectKind.GAIN_LIFE,
                    text -> GAIN.matcher(text).find() && LIFE.matcher(text).find(),
                    text -> EffectToken.of(EffectKind.GAIN_LIFE)
                            .with("Defined", "You")
                            .with("LifeAmount", magnitude(text, "life"))
                            .build()),
            new Rule(EffectKind.LOSE_LIFE,
                    text -> LOSE.matcher(text).find() && LIFE.matcher(text).find() && text.contains("opponent"),
                    text -> EffectToken.of(EffectKind.LOSE_LIFE)
                            .with("Defined", "EachOpponent")
                            .with("LifeAmount", magnitude(text, "life"))
                            .build()),
            new Rule(EffectKind.LOSE_LIFE,
                    text -> LOSE.matcher(text).find() && LIFE.matcher(text).find(),
                    text -> EffectToken.of(EffectKind.LOSE_LIFE)
                            .with("Defined", "You")
                            .with("LifeAmount", magnitude(text, "life"))
                            .build()),
            new Rule(EffectKind.DRAW,
                    text -> text.contains("draw"),
                    text -> EffectToken.of(EffectKind.DRAW)
                            .with("Defined", "You")
                            .with("NumCards", magnitude(text, "card"))
                            .build()),
            new Rule(EffectKind.DEAL_DAMAGE,
                    text -> text.contains("deals") && text.contains("damage"),
                    EffectResolver::dealDamage),
            new Rule(EffectKind.CREATE_TOKEN,
                    text -> text.contains("create") && text.contains("token"),
                    text -> EffectToken.of(EffectKind.CREATE_TOKEN)
                            .with("TokenScript", TOKEN_SCRIPTS.stream().filter(text::contains).findFirst().orElse("generic"))
                            .with("TokenAmount", magnitude(text, "token"))
                            .build()),
            new Rule(EffectKind.DISCARD,
                    text -> text.contains("discard"),
                    EffectResolver::discard),
            new Rule(EffectKind.MILL,
                    text -> text.contains("mill"),
                    text -> EffectToken.of(EffectKind.MILL)
                            .with("NumCards", magnitude(text, "card"))
                            .with("Defined", "You")
                            .build()),
            new Rule(EffectKind.COUNTER,
                    text -> text.contains("counter") && text.contains("spell"),
                    text -> EffectToken.of(EffectKind.COUNTER)
                            .with("TargetType", "Spell")
                            .with("ValidTgts", "Card")
                            .with("TgtPrompt", "Select target spell")
                            .build()),
            new Rule(EffectKind.TAP,
                    text -> TAP.matcher(text).find() && text.contains("target"),
                    text -> targeted(EffectKind.TAP, text, "Creature")),
            new Rule(EffectKind.UNTAP,
                    text -> text.contains("untap"),
                    text -> targeted(EffectKind.UNTAP, text, "Permanent")),
            new Rule(EffectKind.SCRY,
                    text -> text.contains("scry"),
                    text -> EffectToken.of(EffectKind.SCRY)
                            .with("ScryNum", magnitude(text, ""))
                            .build()),
            new Rule(EffectKind.SURVEIL,
                    text -> text.contains("surveil"),
                    text -> EffectToken.of(EffectKind.SURVEIL)
                            .with("NumCards", magnitude(text, ""))
                            .build()),
            new Rule(EffectKind.PUT_COUNTER,
                    text -> text.contains("put") && text.contains("counter"),
                    EffectResolver::putCounter),
            new Rule(EffectKind.SACRIFICE,
                    text -> text.contains("sacrifice"),
                    text -> EffectToken.of(EffectKind.SACRIFICE)
                            .with("SacValid", text.contains("creature") ? "Creature" : "Card")
                            .build()),
            new Rule(EffectKind.SEARCH_LIBRARY,
                    text -> text.contains("search") && text.contains("library"),
                    EffectResolver::searchLibrary),
            new Rule(EffectKind.RETURN_FROM_GRAVEYARD,
                    text -> text.contains("return") && text.contains("graveyard") && text.contains("battlefield"),
                    text -> EffectToken.of(EffectKind.RETURN_FROM_GRAVEYARD)
                            .with("Origin", "Graveyard")
                            .with("Destination", "Battlefield")
                            .with("ChangeType", text.contains("artifact") ? "Artifact" : "Creature")
                            .build())
    );

    /**
     * Resolve an effect clause. Returns {@link EffectToken#unknown()} when no rule matches.
     */
    public EffectToken resolve(String clause) {
        String lower = clause.strip().toLowerCase();
        for (Rule rule : RULES) {
            if (rule.matches().test(lower)) {
                return rule.handler().apply(lower);
            }
        }
        return EffectToken.unknown();
    }

    /**
     * Resolve an effect clause, dropping the unknown token.
     */
    public Optional<EffectToken> resolveKnown(String clause) {
        return Optional.of(resolve(clause)).filter(EffectToken::isKnown);
    }

    /**
     * The resolution table in evaluation order.
     */
    public List<Rule> rules() {
        return RULES;
    }

    /**
     * Amount for an effect: the integer directly before {@code keyword} (or the first integer
     * when there is no keyword), else the first number word, else 1.
     * Integers that belong to a power/toughness or counter like "+1/+1" are not amounts.
     */
    static int magnitude(String text, String keyword) {
        Matcher number = keyword.isEmpty()
                ? INTEGER.matcher(text)
                : Pattern.compile("(?<![+\\-/\\d])(\\d+)\\s+" + Pattern.quote(keyword)).matcher(text);
        if (number.find()) {
            return Integer.parseInt(keyword.isEmpty() ? number.group() : number.group(1));
        }
        Matcher word = NUMBER_WORD.matcher(text);
        if (word.find()) {
            return NUMBER_WORDS.get(word.group(1));
        }
        return 1;
    }

    private static EffectToken dealDamage(String text) {
        EffectToken.Builder builder = EffectToken.of(EffectKind.DEAL_DAMAGE)
                .with("NumDmg", magnitude(text, "damage"));
        if (text.contains("any target")) {
            return builder.with("ValidTgts", "Any").with("TgtPrompt", "Select any target").build();
        }
        if (text.contains("target creature or player")) {
            return builder.with("ValidTgts", "Creature,Player").with("TgtPrompt", "Select target creature or player").build();
        }
        if (text.contains("target")) {
            return withTarget(builder, text, "Creature").build();
        }
        if (text.contains("each opponent")) {
            return builder.with("Defined", "Player.Opponent").build();
        }
        return builder.with("Defined", "TriggeredPlayer").build();
    }

    private static EffectToken discard(String text) {
        EffectToken.Builder builder = EffectToken.of(EffectKind.DISCARD)
                .with("Mode", "TgtChoose")
                .with("NumCards", magnitude(text, "card"));
        if (text.contains("target opponent")) {
            return builder.with("ValidTgts", "Player.Opponent").build();
        }
        if (text.contains("target player")) {
            return builder.with("ValidTgts", "Player").build();
        }
        if (text.contains("each opponent")) {
            return builder.with("Defined", "Player.Opponent").build();
        }
        return builder.with("Defined", "You").build();
    }

    private static EffectToken putCounter(String text) {
        EffectToken.Builder builder = EffectToken.of(EffectKind.PUT_COUNTER)
                .with("CounterType", CounterType.fromText(text))
                .with("CounterNum", magnitude(text, "counter"));
        if (text.contains("target")) {
            return withTarget(builder, text, "Creature").build();
        }
        if (text.contains("creatures you control")) {
            return builder.with("Defined", "Valid Creature.YouCtrl").build();
        }
        return builder.with("Defined", "Self").build();
    }

    private static EffectToken searchLibrary(String text) {
        String changeType;
        if (text.contains("basic land")) {
            changeType = "Land.Basic";
        } else if (text.contains("land")) {
            changeType = "Land";
        } else if (text.contains("creature")) {
            changeType = "Creature";
        } else {
            changeType = "Card";
        }
        return EffectToken.of(EffectKind.SEARCH_LIBRARY)
                .with("Origin", "Library")
                .with("Destination", text.contains("onto the battlefield") ? "Battlefield" : "Hand")
                .with("ChangeType", changeType)
                .with("ChangeNum", magnitude(text, ""))
                .with("Mandatory", "False")
                .build();
    }

    private static EffectToken targeted(EffectKind kind, String text, String defaultType) {
        return withTarget(EffectToken.of(kind), text, defaultType).build();
    }

    // "target artifact" -> ValidTgts$ Artifact, "target opponent" -> ValidTgts$ Player.Opponent
    private static EffectToken.Builder withTarget(EffectToken.Builder builder, String text, String defaultType) {
        Matcher target = TARGET_TYPE.matcher(text);
        String word = target.find() ? target.group(1) : defaultType.toLowerCase();
        String type = word.equals("opponent")
                ? "Player.Opponent"
                : Character.toUpperCase(word.charAt(0)) + word.substring(1);
        return builder.with("ValidTgts", type).with("TgtPrompt", "Select target " + word);
    }
}
