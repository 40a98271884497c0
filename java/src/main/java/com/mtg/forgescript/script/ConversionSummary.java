package com.mtg.forgescript.script;

import java.nio.file.Path;

/**
 * Counts reported at the end of a conversion run.
 */
public record ConversionSummary(
    /**
     * Cards written (or compiled, in a dry run).
     */
    int converted,

    /**
     * Records skipped because they have no name.
     */
    int skipped,

    /**
     * Converted cards that are tokens.
     */
    int tokens,

    Path outputDirectory
) {
    public int total() {
        return converted + skipped;
    }
}
