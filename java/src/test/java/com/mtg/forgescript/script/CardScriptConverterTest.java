package com.mtg.forgescript.script;

import com.mtg.forgescript.card.CardDocument;
import com.mtg.forgescript.card.CardDocumentException;
import com.mtg.forgescript.card.CardRecord;
import com.mtg.forgescript.compiler.CompiledCard;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardScriptConverter.
 */
class CardScriptConverterTest {

    private final CardScriptConverter converter = new CardScriptConverter();

    private CompiledCard convert(CardRecord card) {
        return converter.convert(card).orElseThrow();
    }

    @Test
    void testCreature() {
        CardRecord card = new CardRecord("Gnome Scout", "2U/B", "Creature - Gnome Scout", "1/1", "",
                "Whenever this creature attacks, you gain 1 life.");

        assertEquals(List.of(
                "Name:Gnome Scout",
                "ManaCost:2 U/B",
                "Types:Creature Gnome Scout",
                "PT:1/1",
                "T:Mode$ Attacks | ValidCard$ Card.Self | TriggerZones$ Battlefield | Execute$ Effect1"
                        + " | TriggerDescription$ Whenever this creature attacks, you gain 1 life.",
                "SVar:Effect1:GainLife | Defined$ You | LifeAmount$ 1",
                "Oracle:Whenever this creature attacks, you gain 1 life."), convert(card).lines());
    }

    @Test
    void testNoCost() {
        CardRecord card = new CardRecord("Beer", "", "Token Artifact - Food", "", "", "");

        assertEquals(List.of("Name:Beer", "ManaCost:no cost", "Types:Token Artifact Food", "Oracle:"),
                convert(card).lines());
    }

    @Test
    void testLoyalty() {
        CardRecord card = new CardRecord("Zappy", "3R", "Legendary Planeswalker — Zappy", "", "4", "");

        assertTrue(convert(card).lines().contains("Loyalty:4"));
        assertTrue(convert(card).linesStartingWith("PT:").isEmpty());
    }

    @Test
    void testEntitiesDecoded() {
        CardRecord card = new CardRecord("Pie Lover", "1", "Creature", "1/1", "", "This creature likes pie &amp; cake.");

        CompiledCard script = convert(card);
        assertEquals("Oracle:This creature likes pie & cake.", script.lines().get(script.lines().size() - 1));
    }

    @Test
    void testUnrecognizedTextKeepsOracleOnly() {
        CardRecord card = new CardRecord("Pie Lover", "1", "Creature", "1/1", "", "Flying\nThis creature likes pie.");

        CompiledCard script = convert(card);
        assertTrue(script.linesStartingWith("T:").isEmpty());
        assertTrue(script.linesStartingWith("A:").isEmpty());
        assertTrue(script.linesStartingWith("S:").isEmpty());
        assertTrue(script.linesStartingWith("SVar:").isEmpty());
        assertEquals("Oracle:Flying\\nThis creature likes pie.", script.lines().get(script.lines().size() - 1));
    }

    @Test
    void testMissingName() {
        assertTrue(converter.convert(new CardRecord("  ", "1", "Creature", "1/1", "", "Draw a card.")).isEmpty());
        assertTrue(converter.convert(new CardRecord(null, "1", "Creature", "1/1", "", "Draw a card.")).isEmpty());
    }

    @Test
    void testEachCardNumbersFromOne() {
        CardRecord first = new CardRecord("A", "1", "Creature", "1/1", "", "When this creature dies, draw a card.");
        CardRecord second = new CardRecord("B", "1", "Creature", "1/1", "", "When this creature dies, scry 1.");

        converter.convert(first);
        assertEquals(List.of("SVar:Effect1:Scry | ScryNum$ 1"), convert(second).linesStartingWith("SVar:"));
    }

    @Test
    void testDeterministic() {
        CardRecord card = new CardRecord("Oracle", "1UB", "Sorcery", "", "",
                "Choose one —\n• Draw two cards.\n• Each opponent loses 2 life.");

        assertEquals(convert(card).render(), convert(card).render());
    }

    @Test
    void testConvertDocument() throws CardDocumentException {
        List<CardRecord> cards = CardDocument.fromResource("cards.xml").getCards();

        CompiledCard lamp = convert(cards.get(1));
        assertEquals("ManaCost:2 U/B", lamp.lines().get(1));
        assertTrue(lamp.lines().contains("A:AB$ Draw | Defined$ You | NumCards$ 1 | Cost$ T | SpellDescription$ {T}: Draw a card."));

        CompiledCard oracle = convert(cards.get(4));
        assertEquals(List.of("SVar:Choices1:Choice2,Choice3",
                        "SVar:Choice2:Draw | Defined$ You | NumCards$ 2",
                        "SVar:Choice3:LoseLife | Defined$ EachOpponent | LifeAmount$ 2"),
                oracle.linesStartingWith("SVar:"));
        assertEquals("Oracle:Choose one —\\n• Draw two cards.\\n• Each opponent loses 2 life.",
                oracle.lines().get(oracle.lines().size() - 1));
    }
}
