package com.mtg.forgescript.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles rules text into Forge ability lines and support variables.
 *
 * <p>Each block is classified and handed to the extractor for its category. A block whose
 * extractor finds nothing is dropped whole; no line is emitted that references a support
 * variable which was not produced.
 */
public class AbilityCompiler {
    private static final Pattern EVENT_TRIGGER =
            Pattern.compile("^(?:Whenever|When)\\s+(.+?),\\s+(.+?)(?:\\.|$)", Pattern.DOTALL);
    private static final Pattern PERIODIC =
            Pattern.compile("^At the beginning of (.+?),\\s+(.+?)(?:\\.|$)", Pattern.DOTALL);
    private static final Pattern UPKEEP_COST = Pattern.compile("Upkeep[—:]\\s*(.+?)(?:\\.|$)", Pattern.DOTALL);
    private static final Pattern ACTIVATED = Pattern.compile("^(\\{.+?\\}):\\s*(.+?)(?:\\.|$)", Pattern.DOTALL);

    static final int TRIGGER_DESCRIPTION_LENGTH = 80;
    static final int SPELL_DESCRIPTION_LENGTH = 100;

    private final Segmenter segmenter;
    private final Classifier classifier;
    private final TriggerExtractor triggers;
    private final EffectResolver effects;
    private final ModalResolver modal;
    private final StaticAbilities statics;

    public AbilityCompiler() {
        this.segmenter = new Segmenter();
        this.classifier = new Classifier();
        this.triggers = new TriggerExtractor();
        this.effects = new EffectResolver();
        this.modal = new ModalResolver(effects, triggers);
        this.statics = new StaticAbilities();
    }

    /**
     * Compile rules text with a fresh allocator.
     */
    public AbilityScript compile(String rulesText) {
        return compile(rulesText, new SupportVariableAllocator());
    }

    /**
     * Compile rules text, naming support variables with {@code allocator}.
     * The allocator should be new for every card.
     */
    public AbilityScript compile(String rulesText, SupportVariableAllocator allocator) {
        List<Ability> abilities = new ArrayList<>();
        segmenter.segment(rulesText)
                .filter(block -> !block.isBlank())
                .forEach(block -> compileBlock(block, allocator).ifPresent(abilities::add));
        return new AbilityScript(abilities, allocator.variables());
    }

    Optional<Ability> compileBlock(AbilityBlock block, SupportVariableAllocator allocator) {
        String text = block.text();
        return switch (classifier.classify(block)) {
            case MODAL -> modal.resolve(text, allocator);
            case TRIGGERED -> compileTriggered(text, allocator);
            case PERIODIC -> compilePeriodic(text, allocator);
            case UPKEEP_COST -> compileUpkeepCost(text, allocator);
            case ACTIVATED -> compileActivated(text);
            case STATIC -> statics.resolve(text);
            case SPELL_EFFECT -> compileSpell(text);
            case UNRECOGNIZED -> Optional.empty();
        };
    }

    private Optional<Ability> compileTriggered(String text, SupportVariableAllocator allocator) {
        Matcher trigger = EVENT_TRIGGER.matcher(text);
        if (!trigger.lookingAt()) {
            return Optional.empty();
        }
        return triggered(triggers.forEvent(trigger.group(1)), trigger.group(2), "Effect",
                Ability.describe(text, TRIGGER_DESCRIPTION_LENGTH), allocator);
    }

    private Optional<Ability> compilePeriodic(String text, SupportVariableAllocator allocator) {
        Matcher periodic = PERIODIC.matcher(text);
        if (!periodic.lookingAt()) {
            return Optional.empty();
        }
        return triggered(triggers.forPhase(periodic.group(1)), periodic.group(2), "Effect",
                Ability.describe(text, TRIGGER_DESCRIPTION_LENGTH), allocator);
    }

    private Optional<Ability> compileUpkeepCost(String text, SupportVariableAllocator allocator) {
        Matcher upkeep = UPKEEP_COST.matcher(text);
        if (!upkeep.find()) {
            return Optional.empty();
        }
        String cost = upkeep.group(1).strip();
        TriggerDescriptor trigger = TriggerDescriptor.of(TriggerMode.PHASE)
                .with("Phase", Phase.UPKEEP.getScriptName())
                .with("TriggerZones", "Battlefield")
                .build();
        return triggered(Optional.of(trigger), cost, "UpkeepEffect",
                Ability.describe("Upkeep— " + cost, TRIGGER_DESCRIPTION_LENGTH), allocator);
    }

    // Both halves must resolve before a name is allocated.
    private Optional<Ability> triggered(Optional<TriggerDescriptor> trigger, String effectClause, String baseName,
                                        String description, SupportVariableAllocator allocator) {
        if (trigger.isEmpty()) {
            return Optional.empty();
        }
        Optional<EffectToken> effect = effects.resolveKnown(effectClause);
        if (effect.isEmpty()) {
            return Optional.empty();
        }
        String execute = allocator.declare(baseName, effect.get().render());
        return Optional.of(new Ability.Triggered(trigger.get(), execute, description));
    }

    private Optional<Ability> compileActivated(String text) {
        Matcher activated = ACTIVATED.matcher(text);
        if (!activated.lookingAt()) {
            return Optional.empty();
        }
        String cost = parseCost(activated.group(1));
        return effects.resolveKnown(activated.group(2))
                .map(effect -> new Ability.Activated(effect.render(), cost,
                        Ability.describe(text, SPELL_DESCRIPTION_LENGTH)));
    }

    private Optional<Ability> compileSpell(String text) {
        return effects.resolveKnown(text)
                .map(effect -> new Ability.Spell(effect.render(), Ability.describe(text, SPELL_DESCRIPTION_LENGTH)));
    }

    /**
     * "{2}{B}, {T}" becomes "2 B T".
     */
    static String parseCost(String costString) {
        return costString.replace("{", "")
                .replace("}", " ")
                .replace(",", " ")
                .replaceAll("\\s+", " ")
                .strip();
    }
}
