package com.mtg.forgescript.compiler;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Classifier rule order.
 */
class ClassifierTest {

    private final Classifier classifier = new Classifier();

    private AbilityCategory classify(String text) {
        return classifier.classify(new AbilityBlock(text, 0));
    }

    @Test
    void testRuleOrder() {
        List<String> names = classifier.rules().stream().map(Classifier.Rule::name).collect(Collectors.toList());
        assertEquals(List.of("choose", "whenever", "when", "beginning", "upkeep cost", "activated", "static"), names);
    }

    @Test
    void testTriggered() {
        assertEquals(AbilityCategory.TRIGGERED, classify("Whenever this creature attacks, you gain 1 life."));
        assertEquals(AbilityCategory.TRIGGERED, classify("When this creature enters, draw a card."));
    }

    @Test
    void testPeriodic() {
        assertEquals(AbilityCategory.PERIODIC, classify("At the beginning of your upkeep, this creature gets +1/+1."));
    }

    @Test
    void testUpkeepCost() {
        assertEquals(AbilityCategory.UPKEEP_COST, classify("Upkeep—Lose 1 life."));
        assertEquals(AbilityCategory.UPKEEP_COST, classify("Upkeep: Sacrifice a creature."));
    }

    @Test
    void testActivated() {
        assertEquals(AbilityCategory.ACTIVATED, classify("{T}: Draw a card."));
        assertEquals(AbilityCategory.ACTIVATED, classify("{2}{B}, {T}: Each opponent loses 1 life."));
    }

    @Test
    void testActivatedBeatsStatic() {
        assertEquals(AbilityCategory.ACTIVATED, classify("{1}: This creature gets +1/+0 until end of turn."));
    }

    @Test
    void testModalBeatsTrigger() {
        assertEquals(AbilityCategory.MODAL, classify("When this creature enters, Choose one —\n• Scry 1.\n• Draw a card."));
    }

    @Test
    void testStatic() {
        assertEquals(AbilityCategory.STATIC, classify("Creatures you control get +1/+1."));
        assertEquals(AbilityCategory.STATIC, classify("Enchanted creature has flying."));
        assertEquals(AbilityCategory.STATIC, classify("This creature can't block."));
        assertEquals(AbilityCategory.STATIC, classify("This creature can’t block."));
    }

    @Test
    void testStaticKeywordsAreWholeWords() {
        assertEquals(AbilityCategory.SPELL_EFFECT, classify("This creature likes pie."));
        assertEquals(AbilityCategory.SPELL_EFFECT, classify("Target creature gains haste."));
    }

    @Test
    void testDefaultSpellEffect() {
        assertEquals(AbilityCategory.SPELL_EFFECT, classify("Draw two cards."));
    }
}
