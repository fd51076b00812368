package com.tcg.pocket.card;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Card database that loads card definitions from JSON.
 * Immutable once built, so a single instance is shared by every match and
 * every thread.
 */
public class CardDatabase {
    private static final Logger log = LoggerFactory.getLogger(CardDatabase.class);

    public static final String DEFAULT_RESOURCE = "cards.json";
    public static final int MAX_ATTACKS = 3;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private final Map<String, Card> cards;
    private final Map<String, Integer> ordinals;
    private final Map<String, List<Card>> byName;

    private CardDatabase(Map<String, Card> cards) {
        this.cards = Collections.unmodifiableMap(cards);
        Map<String, Integer> ordinalMap = new HashMap<>();
        Map<String, List<Card>> nameMap = new HashMap<>();
        int i = 0;
        for (Card card : cards.values()) {
            ordinalMap.put(card.getId(), i++);
            nameMap.computeIfAbsent(card.getName(), k -> new ArrayList<>()).add(card);
        }
        this.ordinals = ordinalMap;
        this.byName = nameMap;
    }

    /**
     * Load the card pool bundled with the engine.
     */
    public static CardDatabase defaultDatabase() throws CardDatabaseException {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load cards from a JSON file.
     */
    public static CardDatabase fromFile(String path) throws CardDatabaseException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new CardDatabaseException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource.
     */
    public static CardDatabase fromResource(String resourcePath) throws CardDatabaseException {
        try (InputStream is = CardDatabase.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardDatabaseException("Resource not found: " + resourcePath);
            }
            List<Card> cardList = MAPPER.readValue(is, new TypeReference<List<Card>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string.
     */
    public static CardDatabase fromJson(String json) throws CardDatabaseException {
        try {
            List<Card> cardList = MAPPER.readValue(json, new TypeReference<List<Card>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static CardDatabase fromCardList(List<Card> cardList) throws CardDatabaseException {
        Map<String, Card> cards = new LinkedHashMap<>();
        for (Card card : cardList) {
            if (card.getId() == null || card.getId().isBlank()) {
                throw new CardDatabaseException("Card without id: " + card.getName());
            }
            if (card.getName() == null || card.getName().isBlank()) {
                throw new CardDatabaseException("Card without name: " + card.getId());
            }
            if (cards.putIfAbsent(card.getId(), card) != null) {
                throw new CardDatabaseException("Duplicate card id: " + card.getId());
            }
        }
        for (Card card : cards.values()) {
            validate(card, cards);
        }
        log.debug("Loaded {} card definitions", cards.size());
        return new CardDatabase(cards);
    }

    private static void validate(Card card, Map<String, Card> cards) throws CardDatabaseException {
        if (card instanceof Card.Pokemon pokemon) {
            if (pokemon.getHp() <= 0) {
                throw new CardDatabaseException("Pokémon " + card.getId() + " has no HP");
            }
            if (pokemon.getStage() == null) {
                throw new CardDatabaseException("Pokémon " + card.getId() + " has no stage");
            }
            if (pokemon.getEnergyType() == null) {
                throw new CardDatabaseException("Pokémon " + card.getId() + " has no energy type");
            }
            if (pokemon.getAttacks().size() > MAX_ATTACKS) {
                throw new CardDatabaseException("Pokémon " + card.getId() + " has more than "
                    + MAX_ATTACKS + " attacks");
            }
            if (pokemon.getRetreatCost() < 0) {
                throw new CardDatabaseException("Pokémon " + card.getId() + " has a negative retreat cost");
            }
            if (pokemon.getStage() == Stage.BASIC) {
                if (pokemon.getEvolvesFrom() != null) {
                    throw new CardDatabaseException("Basic Pokémon " + card.getId() + " cannot evolve from "
                        + pokemon.getEvolvesFrom());
                }
            } else {
                validateEvolution(pokemon, cards);
            }
        } else if (card instanceof Card.Item || card instanceof Card.Supporter) {
            if (((TrainerCard) card).getEffect() == null) {
                throw new CardDatabaseException("Trainer " + card.getId() + " has no effect");
            }
        } else if (card instanceof Card.Tool tool) {
            if (tool.getEffect() != null) {
                throw new CardDatabaseException("Tool " + card.getId() + " cannot have a played effect");
            }
        }
    }

    private static void validateEvolution(Card.Pokemon pokemon, Map<String, Card> cards)
            throws CardDatabaseException {
        String from = pokemon.getEvolvesFrom();
        if (from == null) {
            throw new CardDatabaseException("Evolution " + pokemon.getId() + " has no evolves_from");
        }
        Stage expected = pokemon.getStage().previous();
        boolean resolvable = cards.values().stream()
            .anyMatch(c -> c instanceof Card.Pokemon p
                && p.getName().equals(from)
                && p.getStage() == expected);
        if (!resolvable) {
            throw new CardDatabaseException("Evolution " + pokemon.getId() + " evolves from unknown "
                + expected.getJsonValue() + " '" + from + "'");
        }
    }

    /**
     * Get a card by id.
     * @throws UnknownCardException if the id is not in the database
     */
    public Card lookup(String id) throws UnknownCardException {
        Card card = cards.get(id);
        if (card == null) {
            throw new UnknownCardException(id);
        }
        return card;
    }

    /**
     * Find the first card with the given name.
     */
    public Optional<Card> findByName(String name) {
        List<Card> matches = byName.get(name);
        return matches == null ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * Stable index of a card in load order, used by the observation encoder.
     */
    public int ordinalOf(Card card) {
        Integer ordinal = ordinals.get(card.getId());
        return ordinal != null ? ordinal : -1;
    }

    /**
     * Get total number of cards.
     */
    public int cardCount() {
        return cards.size();
    }

    /**
     * Check if a card exists.
     */
    public boolean hasCard(String id) {
        return cards.containsKey(id);
    }

    /**
     * All cards in load order.
     */
    public List<Card> allCards() {
        return List.copyOf(cards.values());
    }
}
