package com.tcg.pocket.game.zones;

import com.tcg.pocket.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand - ordered cards in hand, addressed by index for the action space.
 */
public class Hand {
    private final List<Card> cards;

    public Hand() {
        this.cards = new ArrayList<>();
    }

    private Hand(List<Card> cards) {
        this.cards = new ArrayList<>(cards);
    }

    public void add(Card card) {
        cards.add(card);
    }

    public void addAll(List<Card> cardsToAdd) {
        cards.addAll(cardsToAdd);
    }

    public Card get(int index) {
        return cards.get(index);
    }

    /**
     * Remove a card by index.
     * @param index The index of the card to remove
     * @return The removed card, or null if index is out of bounds
     */
    public Card remove(int index) {
        if (index >= 0 && index < cards.size()) {
            return cards.remove(index);
        }
        return null;
    }

    /**
     * Remove and return every card, preserving order.
     */
    public List<Card> removeAll() {
        List<Card> removed = new ArrayList<>(cards);
        cards.clear();
        return removed;
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }

    /**
     * Check if the hand contains a card with the given name.
     */
    public boolean contains(String cardName) {
        return cards.stream().anyMatch(c -> c.getName().equals(cardName));
    }

    public boolean hasBasicPokemon() {
        return cards.stream().anyMatch(Card::isBasicPokemon);
    }

    public Hand copy() {
        return new Hand(cards);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Hand other && other.cards.equals(cards);
    }

    @Override
    public int hashCode() {
        return cards.hashCode();
    }
}
