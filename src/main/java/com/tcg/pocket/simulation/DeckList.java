package com.tcg.pocket.simulation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Deck list: an ordered list of card ids with multiplicity.
 * Text format is "N card-id" per line; blank lines and lines starting with
 * # or // are ignored.
 */
public class DeckList {
    private final List<String> cardIds;
    private final String name;

    public DeckList(List<String> cardIds, String name) {
        this.cardIds = List.copyOf(cardIds);
        this.name = name;
    }

    /**
     * Load a deck list from a file. The deck is named after the file.
     *
     * @throws InvalidDeckException if the file cannot be read or a line is malformed
     */
    public static DeckList loadFromFile(String path) throws InvalidDeckException {
        String content;
        try {
            content = Files.readString(Path.of(path));
        } catch (IOException e) {
            throw new InvalidDeckException(InvalidDeckException.Reason.MALFORMED,
                "Failed to read deck file: " + e.getMessage(), e);
        }
        String fileName = Path.of(path).getFileName().toString();
        String deckName = fileName.endsWith(".txt")
            ? fileName.substring(0, fileName.length() - 4)
            : fileName;
        return parse(content, deckName);
    }

    public static DeckList parse(String content, String name) throws InvalidDeckException {
        List<String> ids = new ArrayList<>();
        String[] lines = content.split("\n");

        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();

            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }

            // "N card-id"
            int spaceIdx = line.indexOf(' ');
            if (spaceIdx == -1) {
                throw new InvalidDeckException(InvalidDeckException.Reason.MALFORMED,
                    "Invalid deck format at line " + (lineNum + 1) + ": expected 'COUNT CARD_ID'");
            }

            String countStr = line.substring(0, spaceIdx);
            String cardId = line.substring(spaceIdx + 1).trim();

            int count;
            try {
                count = Integer.parseInt(countStr);
            } catch (NumberFormatException e) {
                throw new InvalidDeckException(InvalidDeckException.Reason.MALFORMED,
                    "Invalid deck format at line " + (lineNum + 1) + ": '" + countStr + "' is not a valid number");
            }
            if (count <= 0 || cardId.isEmpty()) {
                throw new InvalidDeckException(InvalidDeckException.Reason.MALFORMED,
                    "Invalid deck format at line " + (lineNum + 1) + ": '" + line + "'");
            }
            for (int i = 0; i < count; i++) {
                ids.add(cardId);
            }
        }
        return new DeckList(ids, name);
    }

    public List<String> getCardIds() {
        return cardIds;
    }

    public int size() {
        return cardIds.size();
    }

    public String getName() {
        return name;
    }
}
