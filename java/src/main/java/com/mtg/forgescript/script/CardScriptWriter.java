package com.mtg.forgescript.script;

import com.mtg.forgescript.compiler.CompiledCard;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Writes card scripts into a Forge card directory, one sub-directory per first letter.
 */
public class CardScriptWriter {
    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-z0-9\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Path outputDirectory;

    public CardScriptWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /**
     * Write one card script.
     *
     * @return the path written
     * @throws WriteException if the directory or file cannot be written
     */
    public Path write(String cardName, CompiledCard card) throws WriteException {
        Path target = pathFor(cardName);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, card.render(), StandardCharsets.UTF_8);
            return target;
        } catch (IOException e) {
            throw new WriteException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    /**
     * Where the script for {@code cardName} goes: {@code <output>/<first letter>/<file name>}.
     */
    public Path pathFor(String cardName) {
        String fileName = sanitizeFileName(cardName);
        String letter = fileName.isEmpty() ? "z" : fileName.substring(0, 1);
        return outputDirectory.resolve(letter).resolve(fileName + ".txt");
    }

    /**
     * "Bob's Fish & Chips" becomes "bobs_fish_and_chips".
     */
    public static String sanitizeFileName(String cardName) {
        String name = cardName.toLowerCase()
                .replace("'", "")
                .replace("&", "and");
        name = INVALID_CHARS.matcher(name).replaceAll("");
        return WHITESPACE.matcher(name.strip()).replaceAll("_");
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Exception thrown when a script cannot be written.
     */
    public static class WriteException extends Exception {
        public WriteException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
