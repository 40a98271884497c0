package com.mtg.forgescript.compiler;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Segmenter.
 */
class SegmenterTest {

    private final Segmenter segmenter = new Segmenter();

    private List<AbilityBlock> segment(String text) {
        return segmenter.segment(text).collect(Collectors.toList());
    }

    @Test
    void testSplitOnSentenceBoundary() {
        List<AbilityBlock> blocks = segment("You gain 1 life. Draw a card.");
        assertEquals(2, blocks.size());
        assertEquals("You gain 1 life.", blocks.get(0).text());
        assertEquals("Draw a card.", blocks.get(1).text());
    }

    @Test
    void testSplitBeforeCost() {
        List<AbilityBlock> blocks = segment("Flying. {T}: Draw a card.");
        assertEquals(2, blocks.size());
        assertEquals("{T}: Draw a card.", blocks.get(1).text());
    }

    @Test
    void testLineBreakIsNotBoundary() {
        List<AbilityBlock> blocks = segment("Flying\nWhenever this creature attacks, you gain 1 life.");
        assertEquals(1, blocks.size());
        assertEquals("Flying\nWhenever this creature attacks, you gain 1 life.", blocks.get(0).text());
    }

    @Test
    void testSentenceEndFollowedByLineBreak() {
        List<AbilityBlock> blocks = segment("Choose one —\n• Draw two cards.\n• Scry 2.");
        assertEquals(1, blocks.size());
    }

    @Test
    void testLowerCaseContinuationIsNotBoundary() {
        assertEquals(1, segment("Draw a card. then discard a card.").size());
    }

    @Test
    void testOtherTerminators() {
        assertEquals(3, segment("Really! Truly? Yes.").size());
    }

    @Test
    void testBlocksCoverInput() {
        String text = "Flying\nWhenever this creature attacks, you gain 1 life.  {T}: Draw a card. Scry 2.";
        List<AbilityBlock> blocks = segment(text);
        assertEquals(3, blocks.size());
        assertEquals(text, blocks.stream().map(AbilityBlock::raw).collect(Collectors.joining()));
    }

    @Test
    void testOffsets() {
        String text = "You gain 1 life. Draw a card.";
        List<AbilityBlock> blocks = segment(text);
        assertEquals(0, blocks.get(0).offset());
        assertEquals(text.indexOf("Draw"), blocks.get(1).offset());
    }

    @Test
    void testEmptyInput() {
        assertEquals(0, segmenter.segment("").count());
        assertEquals(0, segmenter.segment("   \n ").count());
        assertEquals(0, segmenter.segment(null).count());
    }

    @Test
    void testStreamConsumedOnce() {
        Stream<AbilityBlock> blocks = segmenter.segment("A. B.");
        assertEquals(2, blocks.count());
        assertThrows(IllegalStateException.class, blocks::count);
    }
}
