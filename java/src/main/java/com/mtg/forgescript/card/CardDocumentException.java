package com.mtg.forgescript.card;

/**
 * Exception thrown when a card document cannot be read or parsed.
 */
public class CardDocumentException extends Exception {
    public CardDocumentException(String message) {
        super(message);
    }

    public CardDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
