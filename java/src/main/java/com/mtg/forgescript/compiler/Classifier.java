package com.mtg.forgescript.compiler;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Assigns an ability category to a block with an ordered rule table.
 * The first matching rule wins; later rules are broader and must stay last.
 */
public class Classifier {
    static final Pattern ACTIVATED_COST = Pattern.compile("^\\{.+?\\}:", Pattern.DOTALL);

    // Whole words: "This" must not count as "is".
    private static final Pattern STATIC_KEYWORDS =
            Pattern.compile("\\b(?:gets?|have|has|is|are)\\s|\\b(?:can|doesn)['’]t\\b");

    /**
     * One row of the decision table.
     */
    public record Rule(String name, AbilityCategory category, Predicate<String> matches) {}

    private static final List<Rule> RULES = List.of(
            new Rule("choose", AbilityCategory.MODAL,
                    text -> text.contains("Choose") && (text.contains("—") || text.contains("-"))),
            new Rule("whenever", AbilityCategory.TRIGGERED, text -> text.startsWith("Whenever ")),
            new Rule("when", AbilityCategory.TRIGGERED, text -> text.startsWith("When ")),
            new Rule("beginning", AbilityCategory.PERIODIC, text -> text.startsWith("At the beginning of ")),
            new Rule("upkeep cost", AbilityCategory.UPKEEP_COST,
                    text -> text.contains("Upkeep—") || text.contains("Upkeep:")),
            new Rule("activated", AbilityCategory.ACTIVATED, text -> ACTIVATED_COST.matcher(text).find()),
            new Rule("static", AbilityCategory.STATIC,
                    text -> STATIC_KEYWORDS.matcher(text).find())
    );

    /**
     * Classify one block. Never returns {@link AbilityCategory#UNRECOGNIZED}; that category is
     * only assigned when the matched category's extractor comes back empty.
     */
    public AbilityCategory classify(AbilityBlock block) {
        String text = block.text();
        for (Rule rule : RULES) {
            if (rule.matches().test(text)) {
                return rule.category();
            }
        }
        return AbilityCategory.SPELL_EFFECT;
    }

    /**
     * The decision table in evaluation order.
     */
    public List<Rule> rules() {
        return RULES;
    }
}
