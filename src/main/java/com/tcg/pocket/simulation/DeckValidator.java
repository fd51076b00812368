package com.tcg.pocket.simulation;

import com.tcg.pocket.card.Card;
import com.tcg.pocket.card.CardDatabase;
import com.tcg.pocket.card.Stage;
import com.tcg.pocket.card.UnknownCardException;
import com.tcg.pocket.config.RulesConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deck construction rules: exact size, a copy limit per card name, at least
 * one basic Pokémon and a complete line under every evolution.
 */
public final class DeckValidator {

    private DeckValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Resolve and check a deck.
     * @return the cards in deck-list order
     * @throws InvalidDeckException describing the first violated rule
     */
    public static List<Card> validate(List<String> cardIds, CardDatabase db, RulesConfig rules)
            throws InvalidDeckException {
        List<Card> cards = new ArrayList<>(cardIds.size());
        for (String id : cardIds) {
            try {
                cards.add(db.lookup(id));
            } catch (UnknownCardException e) {
                throw new InvalidDeckException(InvalidDeckException.Reason.UNKNOWN_CARD,
                    "Unknown card id: " + id, e);
            }
        }

        if (cards.size() != rules.getDeckSize()) {
            throw new InvalidDeckException(InvalidDeckException.Reason.WRONG_SIZE,
                "Deck has " + cards.size() + " cards, expected " + rules.getDeckSize());
        }

        Map<String, Integer> copies = new HashMap<>();
        for (Card card : cards) {
            int count = copies.merge(card.getName(), 1, Integer::sum);
            if (count > rules.getMaxCopies()) {
                throw new InvalidDeckException(InvalidDeckException.Reason.TOO_MANY_COPIES,
                    "More than " + rules.getMaxCopies() + " copies of " + card.getName());
            }
        }

        if (cards.stream().noneMatch(Card::isBasicPokemon)) {
            throw new InvalidDeckException(InvalidDeckException.Reason.NO_BASIC, "Deck has no basic Pokémon");
        }

        Set<String> stagesPresent = new HashSet<>();
        for (Card card : cards) {
            if (card instanceof Card.Pokemon pokemon) {
                stagesPresent.add(pokemon.getStage() + ":" + pokemon.getName());
            }
        }
        for (Card card : cards) {
            if (card instanceof Card.Pokemon pokemon && pokemon.getStage() != Stage.BASIC) {
                String needed = pokemon.getStage().previous() + ":" + pokemon.getEvolvesFrom();
                if (!stagesPresent.contains(needed)) {
                    throw new InvalidDeckException(InvalidDeckException.Reason.BROKEN_EVOLUTION,
                        pokemon.getName() + " needs " + pokemon.getEvolvesFrom() + " in the deck");
                }
            }
        }
        return cards;
    }
}
