package com.mtg.forgescript.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Card document loaded from a Cockatrice XML card database.
 * Cards are kept in document order.
 */
public class CardDocument {
    private final List<CardRecord> cards;

    private CardDocument(List<CardRecord> cards) {
        this.cards = cards;
    }

    /**
     * Load cards from an XML file.
     */
    public static CardDocument fromFile(String path) throws CardDocumentException {
        try {
            String content = Files.readString(Path.of(path));
            return fromXml(content);
        } catch (IOException e) {
            throw new CardDocumentException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource.
     */
    public static CardDocument fromResource(String resourcePath) throws CardDocumentException {
        try (InputStream is = CardDocument.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardDocumentException("Resource not found: " + resourcePath);
            }
            return fromDatabase(newMapper().readValue(is, Database.class));
        } catch (IOException e) {
            throw new CardDocumentException("XML parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from an XML string.
     */
    public static CardDocument fromXml(String xml) throws CardDocumentException {
        try {
            return fromDatabase(newMapper().readValue(xml, Database.class));
        } catch (IOException e) {
            throw new CardDocumentException("XML parsing error: " + e.getMessage(), e);
        }
    }

    private static XmlMapper newMapper() {
        XmlMapper mapper = new XmlMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    private static CardDocument fromDatabase(Database database) {
        if (database == null || database.cards == null) {
            return new CardDocument(List.of());
        }
        return new CardDocument(new ArrayList<>(database.cards));
    }

    public List<CardRecord> getCards() {
        return Collections.unmodifiableList(cards);
    }

    /**
     * Get total number of card records, including unnamed ones.
     */
    public int cardCount() {
        return cards.size();
    }

    /**
     * Root element of a Cockatrice database: {@code <cockatrice_carddatabase><cards><card/>...}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Database {
        @JacksonXmlElementWrapper(localName = "cards")
        @JacksonXmlProperty(localName = "card")
        List<CardRecord> cards = new ArrayList<>();
    }
}
