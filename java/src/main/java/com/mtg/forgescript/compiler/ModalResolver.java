package com.mtg.forgescript.compiler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiles "Choose one —" blocks into a charm over one support variable per choice.
 */
public class ModalResolver {
    private static final Pattern MODAL = Pattern.compile("^(.*?)(Choose (?:one|two|three|up to \\w+).*)$", Pattern.DOTALL);
    private static final Pattern CHOOSE_COUNT = Pattern.compile("Choose (?:up to )?(one|two|three|\\d+)");
    private static final Pattern BULLET = Pattern.compile("^[ \\t]*[•\\-—][ \\t]*(.+?)[ \\t]*$", Pattern.MULTILINE);
    private static final List<String> TRIGGER_WORDS = List.of("Whenever", "When", "At the beginning");
    private static final Map<String, Integer> COUNT_WORDS = Map.of("one", 1, "two", 2, "three", 3);

    private final EffectResolver effects;
    private final TriggerExtractor triggers;

    public ModalResolver(EffectResolver effects, TriggerExtractor triggers) {
        this.effects = effects;
        this.triggers = triggers;
    }

    /**
     * Compile a modal block.
     *
     * <p>Choices that resolve to no effect are left out. With no choice left the whole block
     * is compiled as a plain spell effect. A trigger prefix that cannot be extracted drops the
     * block; nothing is allocated in that case.
     */
    public Optional<Ability> resolve(String text, SupportVariableAllocator allocator) {
        String prefix = "";
        String choicesText = text;
        Matcher modal = MODAL.matcher(text);
        if (modal.matches()) {
            prefix = modal.group(1).strip();
            choicesText = modal.group(2).strip();
        }

        List<EffectToken> choices = extractChoices(choicesText).stream()
                .map(effects::resolve)
                .filter(EffectToken::isKnown)
                .collect(Collectors.toList());
        if (choices.isEmpty()) {
            return effects.resolveKnown(text)
                    .map(effect -> new Ability.Spell(effect.render(),
                            Ability.describe(text, AbilityCompiler.SPELL_DESCRIPTION_LENGTH)));
        }

        Optional<TriggerDescriptor> trigger = Optional.empty();
        if (TRIGGER_WORDS.stream().anyMatch(prefix::contains)) {
            trigger = triggers.extract(prefix);
            if (trigger.isEmpty()) {
                return Optional.empty();
            }
        }

        String choicesName = allocator.allocate("Choices");
        List<String> choiceNames = new ArrayList<>();
        for (EffectToken choice : choices) {
            choiceNames.add(allocator.declare("Choice", choice.render()));
        }
        allocator.define(choicesName, String.join(",", choiceNames));

        String charm = "Charm | CharmNum$ " + charmNum(choicesText) + " | Choices$ " + choicesName;
        if (trigger.isPresent()) {
            String execute = allocator.declare("CharmEffect", "AB$ " + charm);
            return Optional.of(new Ability.Triggered(trigger.get(), execute,
                    Ability.describe(text, AbilityCompiler.TRIGGER_DESCRIPTION_LENGTH)));
        }
        return Optional.of(new Ability.Spell(charm, Ability.describe(text, AbilityCompiler.SPELL_DESCRIPTION_LENGTH)));
    }

    /**
     * Choice clauses: bullet lines, or failing that every line except the "Choose" line.
     */
    List<String> extractChoices(String choicesText) {
        List<String> choices = new ArrayList<>();
        Matcher bullet = BULLET.matcher(choicesText);
        while (bullet.find()) {
            choices.add(bullet.group(1));
        }
        if (!choices.isEmpty()) {
            return choices;
        }
        return Arrays.stream(choicesText.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("Choose"))
                .collect(Collectors.toList());
    }

    /**
     * Number of modes to choose: "Choose two" is 2, "Choose up to three" is 3, anything else 1.
     */
    static int charmNum(String choicesText) {
        Matcher count = CHOOSE_COUNT.matcher(choicesText);
        if (!count.find()) {
            return 1;
        }
        String value = count.group(1);
        return COUNT_WORDS.containsKey(value) ? COUNT_WORDS.get(value) : Integer.parseInt(value);
    }
}
