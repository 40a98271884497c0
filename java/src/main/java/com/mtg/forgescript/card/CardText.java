package com.mtg.forgescript.card;

/**
 * Rules text helpers shared by the converter and the Oracle line.
 */
public final class CardText {
    private CardText() {}

    /**
     * Decode the entities left behind by double-encoded exports.
     * {@code &amp;} goes last so "&amp;quot;" decodes to "&quot;" and no further.
     */
    public static String decodeEntities(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&apos;", "'")
                .replace("&quot;", "\"")
                .replace("&amp;", "&");
    }

    /**
     * Escape line breaks as the two characters {@code \n} for the single-line Oracle directive.
     */
    public static String escapeOracle(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text.replace("\r\n", "\n").replace("\n", "\\n");
    }
}
