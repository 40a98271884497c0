package com.mtg.forgescript.compiler;

/**
 * One segment of rules text, compiled as a single ability.
 *
 * @param raw    the exact source slice, including the whitespace that separated it from the next block
 * @param offset start offset of {@code raw} in the rules text
 */
public record AbilityBlock(String raw, int offset) {

    /**
     * The block text without surrounding whitespace.
     */
    public String text() {
        return raw.strip();
    }

    public boolean isBlank() {
        return raw.isBlank();
    }
}
