package com.tcg.pocket.game.zones;

import com.tcg.pocket.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * Discard pile (ordered stack). Most recent cards are at the end.
 */
public class DiscardPile {
    private final List<Card> cards;

    public DiscardPile() {
        this.cards = new ArrayList<>();
    }

    private DiscardPile(List<Card> cards) {
        this.cards = new ArrayList<>(cards);
    }

    public void add(Card card) {
        cards.add(card);
    }

    public void addAll(List<Card> cardsToAdd) {
        cards.addAll(cardsToAdd);
    }

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
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

    public Card get(int index) {
        return cards.get(index);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public DiscardPile copy() {
        return new DiscardPile(cards);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DiscardPile other && other.cards.equals(cards);
    }

    @Override
    public int hashCode() {
        return cards.hashCode();
    }
}
