package com.tcg.pocket.game.zones;

import com.tcg.pocket.card.Card;
import com.tcg.pocket.rng.GameRng;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Deck - ordered stack of face-down cards.
 * Top of the deck is at index 0; draws come from the top.
 *
 * Uses ArrayDeque internally for O(1) operations at both ends.
 */
public class Deck {
    private Deque<Card> cards;

    public Deck() {
        this.cards = new ArrayDeque<>();
    }

    public Deck(List<Card> cards) {
        this.cards = new ArrayDeque<>(cards);
    }

    public void addCard(Card card) {
        cards.addLast(card);
    }

    /**
     * Draw a card from the top of the deck.
     * @return The drawn card
     * @throws NoSuchElementException if the deck is empty
     */
    public Card draw() {
        Card card = cards.pollFirst();
        if (card == null) {
            throw new NoSuchElementException("Cannot draw from empty deck");
        }
        return card;
    }

    /**
     * Put a card on the bottom of the deck.
     */
    public void putOnBottom(Card card) {
        cards.addLast(card);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Shuffle the deck using the provided RNG.
     * Converts to list, shuffles, then rebuilds the deque.
     */
    public void shuffle(GameRng rng) {
        List<Card> list = new ArrayList<>(cards);
        rng.shuffle(list);
        cards = new ArrayDeque<>(list);
    }

    /**
     * Get an unmodifiable view of the cards, top first.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }

    /**
     * Remove the card at a position counted from the top.
     */
    public Card removeAt(int index) {
        if (index < 0 || index >= cards.size()) {
            throw new IndexOutOfBoundsException("Deck index " + index + " out of " + cards.size());
        }
        Iterator<Card> iter = cards.iterator();
        for (int i = 0; i < index; i++) {
            iter.next();
        }
        Card card = iter.next();
        iter.remove();
        return card;
    }

    public Deck copy() {
        return new Deck(new ArrayList<>(cards));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Deck other && List.copyOf(other.cards).equals(List.copyOf(cards));
    }

    @Override
    public int hashCode() {
        return List.copyOf(cards).hashCode();
    }
}
