package com.tcg.pocket.game;

import com.tcg.pocket.card.Card;
import com.tcg.pocket.game.zones.Bench;
import com.tcg.pocket.game.zones.CardInstance;
import com.tcg.pocket.game.zones.Deck;
import com.tcg.pocket.game.zones.DiscardPile;
import com.tcg.pocket.game.zones.Hand;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * State of one player.
 * Board slots are addressed by index: slot {@value #ACTIVE_SLOT} is the active
 * spot and slots 1..benchSize map to bench positions 0..benchSize-1.
 */
public class PlayerState {
    public static final int ACTIVE_SLOT = 0;

    private final Hand hand;
    private final Deck deck;
    private final DiscardPile discard;
    private final Bench bench;
    private CardInstance active;
    private EnergyZone energyZone;

    private int prizePoints;
    private boolean energyAttachedThisTurn;
    private boolean supporterPlayedThisTurn;
    private boolean retreatedThisTurn;
    private int turnsTaken;
    private boolean setupConfirmed;
    private int cardTotal;

    public PlayerState(List<Card> deckCards, int benchSize, int prizePoints) {
        this.hand = new Hand();
        this.deck = new Deck(deckCards);
        this.discard = new DiscardPile();
        this.bench = new Bench(benchSize);
        this.active = null;
        this.prizePoints = prizePoints;
        this.cardTotal = deckCards.size();
    }

    private PlayerState(PlayerState other) {
        this.hand = other.hand.copy();
        this.deck = other.deck.copy();
        this.discard = other.discard.copy();
        this.bench = other.bench.copy();
        this.active = other.active != null ? other.active.copy() : null;
        this.energyZone = other.energyZone != null ? other.energyZone.copy() : null;
        this.prizePoints = other.prizePoints;
        this.energyAttachedThisTurn = other.energyAttachedThisTurn;
        this.supporterPlayedThisTurn = other.supporterPlayedThisTurn;
        this.retreatedThisTurn = other.retreatedThisTurn;
        this.turnsTaken = other.turnsTaken;
        this.setupConfirmed = other.setupConfirmed;
        this.cardTotal = other.cardTotal;
    }

    public PlayerState copy() {
        return new PlayerState(this);
    }

    // ---- Zones ----

    public Hand getHand() {
        return hand;
    }

    public Deck getDeck() {
        return deck;
    }

    public DiscardPile getDiscard() {
        return discard;
    }

    public Bench getBench() {
        return bench;
    }

    public CardInstance getActive() {
        return active;
    }

    public void setActive(CardInstance active) {
        this.active = active;
    }

    public boolean hasActive() {
        return active != null;
    }

    public int boardSlots() {
        return 1 + bench.capacity();
    }

    /**
     * Get the Pokémon in a board slot, or null if empty or out of range.
     */
    public CardInstance getInPlay(int slot) {
        if (slot == ACTIVE_SLOT) {
            return active;
        }
        if (slot < 1 || slot > bench.capacity()) {
            return null;
        }
        return bench.get(slot - 1);
    }

    public void setInPlay(int slot, CardInstance instance) {
        if (slot == ACTIVE_SLOT) {
            active = instance;
        } else {
            bench.set(slot - 1, instance);
        }
    }

    /**
     * Occupied board slots, active first.
     */
    public List<Integer> occupiedSlots() {
        List<Integer> slots = new ArrayList<>(boardSlots());
        for (int slot = 0; slot < boardSlots(); slot++) {
            if (getInPlay(slot) != null) {
                slots.add(slot);
            }
        }
        return slots;
    }

    /**
     * Board slot holding the instance with the given id, or -1.
     */
    public int slotOf(int instanceId) {
        for (int slot = 0; slot < boardSlots(); slot++) {
            CardInstance instance = getInPlay(slot);
            if (instance != null && instance.getInstanceId() == instanceId) {
                return slot;
            }
        }
        return -1;
    }

    public boolean hasPokemonInPlay() {
        return active != null || !bench.isEmpty();
    }

    /**
     * Swap the active Pokémon with a bench position. The outgoing active
     * loses its status conditions.
     */
    public void switchActive(int benchPosition) {
        CardInstance incoming = bench.get(benchPosition);
        if (incoming == null) {
            throw new IllegalStateException("No Pokémon at bench position " + benchPosition);
        }
        CardInstance outgoing = active;
        if (outgoing != null) {
            outgoing.onBenched();
        }
        active = incoming;
        bench.set(benchPosition, outgoing);
    }

    /**
     * Number of cards this player owns across every zone, counted live.
     */
    public int countCards() {
        int count = hand.size() + deck.size() + discard.size();
        for (int slot : occupiedSlots()) {
            count += getInPlay(slot).allCards().size();
        }
        return count;
    }

    /**
     * Number of cards the player started the match with.
     */
    public int getCardTotal() {
        return cardTotal;
    }

    // ---- Energy zone ----

    public EnergyZone getEnergyZone() {
        return energyZone;
    }

    public void setEnergyZone(EnergyZone energyZone) {
        this.energyZone = energyZone;
    }

    // ---- Counters and once-per-turn flags ----

    public int getPrizePoints() {
        return prizePoints;
    }

    /**
     * Score points toward victory: the counter only ever moves down, stopping at zero.
     */
    public void scorePoints(int points) {
        prizePoints = Math.max(0, prizePoints - points);
    }

    public boolean isEnergyAttachedThisTurn() {
        return energyAttachedThisTurn;
    }

    public void setEnergyAttachedThisTurn(boolean energyAttachedThisTurn) {
        this.energyAttachedThisTurn = energyAttachedThisTurn;
    }

    public boolean isSupporterPlayedThisTurn() {
        return supporterPlayedThisTurn;
    }

    public void setSupporterPlayedThisTurn(boolean supporterPlayedThisTurn) {
        this.supporterPlayedThisTurn = supporterPlayedThisTurn;
    }

    public boolean isRetreatedThisTurn() {
        return retreatedThisTurn;
    }

    public void setRetreatedThisTurn(boolean retreatedThisTurn) {
        this.retreatedThisTurn = retreatedThisTurn;
    }

    /**
     * Clear once-per-turn flags, including per-instance ability use.
     */
    public void resetTurnFlags() {
        energyAttachedThisTurn = false;
        supporterPlayedThisTurn = false;
        retreatedThisTurn = false;
        for (int slot : occupiedSlots()) {
            getInPlay(slot).setAbilityUsed(false);
        }
    }

    public int getTurnsTaken() {
        return turnsTaken;
    }

    public void incrementTurnsTaken() {
        turnsTaken++;
    }

    /**
     * True during the player's first turn of the match.
     */
    public boolean isFirstTurn() {
        return turnsTaken <= 1;
    }

    public boolean isSetupConfirmed() {
        return setupConfirmed;
    }

    public void setSetupConfirmed(boolean setupConfirmed) {
        this.setupConfirmed = setupConfirmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlayerState other)) {
            return false;
        }
        return prizePoints == other.prizePoints
            && energyAttachedThisTurn == other.energyAttachedThisTurn
            && supporterPlayedThisTurn == other.supporterPlayedThisTurn
            && retreatedThisTurn == other.retreatedThisTurn
            && turnsTaken == other.turnsTaken
            && setupConfirmed == other.setupConfirmed
            && cardTotal == other.cardTotal
            && hand.equals(other.hand)
            && deck.equals(other.deck)
            && discard.equals(other.discard)
            && bench.equals(other.bench)
            && Objects.equals(active, other.active)
            && Objects.equals(energyZone, other.energyZone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hand, deck, discard, bench, active, prizePoints, turnsTaken);
    }
}
