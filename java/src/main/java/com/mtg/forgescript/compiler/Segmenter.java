package com.mtg.forgescript.compiler;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Splits rules text into ability blocks.
 *
 * <p>A block ends after {@code .}, {@code !} or {@code ?} when horizontal whitespace and an
 * uppercase letter or an opening brace follow. Line breaks never end a block, so keyword
 * lists and modal bullets stay with the sentence they belong to.
 */
public class Segmenter {
    private static final Pattern BOUNDARY = Pattern.compile("(?<=[.!?])[ \\t\\x0B\\f\\r]+(?=[A-Z{])");

    /**
     * Segment rules text. The returned stream is lazy and can be consumed once.
     */
    public Stream<AbilityBlock> segment(String rulesText) {
        if (rulesText == null || rulesText.isBlank()) {
            return Stream.empty();
        }
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(new BlockIterator(rulesText),
                        Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private static final class BlockIterator implements Iterator<AbilityBlock> {
        private final String text;
        private final Matcher matcher;
        private int start;

        BlockIterator(String text) {
            this.text = text;
            this.matcher = BOUNDARY.matcher(text);
        }

        @Override
        public boolean hasNext() {
            return start < text.length();
        }

        @Override
        public AbilityBlock next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int end = matcher.find() ? matcher.end() : text.length();
            AbilityBlock block = new AbilityBlock(text.substring(start, end), start);
            start = end;
            return block;
        }
    }
}
