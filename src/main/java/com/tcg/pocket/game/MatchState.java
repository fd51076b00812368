package com.tcg.pocket.game;

import com.tcg.pocket.config.RulesConfig;
import com.tcg.pocket.rng.GameRng;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Complete, self-contained snapshot of one match.
 * Holds no references outside itself apart from the shared immutable card
 * definitions and rules, so abandoning or copying a match is always safe.
 */
public class MatchState {
    public static final int PLAYER_A = 0;
    public static final int PLAYER_B = 1;

    private final RulesConfig rules;
    private final PlayerState[] players;
    private final GameRng rng;

    private int currentPlayer;
    private int firstPlayer;
    private Phase phase;
    private int turnNumber;

    private PendingChoice pendingChoice;
    private final Deque<Frame> stack;
    private AttackContext attack;
    private boolean endTurnRequested;

    private MatchResult result;
    private final List<MatchEvent> events;
    private int actionsThisTurn;
    private int nextInstanceId;

    public MatchState(RulesConfig rules, PlayerState playerA, PlayerState playerB, GameRng rng) {
        this.rules = rules;
        this.players = new PlayerState[] {playerA, playerB};
        this.rng = rng;
        this.currentPlayer = PLAYER_A;
        this.firstPlayer = PLAYER_A;
        this.phase = Phase.SETUP;
        this.turnNumber = 0;
        this.stack = new ArrayDeque<>();
        this.result = MatchResult.ONGOING;
        this.events = new ArrayList<>();
    }

    private MatchState(MatchState other) {
        this.rules = other.rules;
        this.players = new PlayerState[] {other.players[0].copy(), other.players[1].copy()};
        this.rng = other.rng.copy();
        this.currentPlayer = other.currentPlayer;
        this.firstPlayer = other.firstPlayer;
        this.phase = other.phase;
        this.turnNumber = other.turnNumber;
        this.pendingChoice = other.pendingChoice;
        this.stack = new ArrayDeque<>(other.stack);
        this.attack = other.attack != null ? other.attack.copy() : null;
        this.endTurnRequested = other.endTurnRequested;
        this.result = other.result;
        this.events = new ArrayList<>(other.events);
        this.actionsThisTurn = other.actionsThisTurn;
        this.nextInstanceId = other.nextInstanceId;
    }

    /**
     * Deep copy, including the rng state.
     */
    public MatchState copy() {
        return new MatchState(this);
    }

    public RulesConfig getRules() {
        return rules;
    }

    public GameRng getRng() {
        return rng;
    }

    // ---- Players ----

    public PlayerState getPlayer(int player) {
        return players[player];
    }

    public PlayerState getCurrent() {
        return players[currentPlayer];
    }

    public PlayerState getOpponent() {
        return players[1 - currentPlayer];
    }

    public int getCurrentPlayer() {
        return currentPlayer;
    }

    public void setCurrentPlayer(int currentPlayer) {
        this.currentPlayer = currentPlayer;
    }

    public int getFirstPlayer() {
        return firstPlayer;
    }

    public void setFirstPlayer(int firstPlayer) {
        this.firstPlayer = firstPlayer;
    }

    /**
     * Player whose input the match waits for: the chooser of a pending
     * choice, otherwise the current player. -1 once the match is over.
     */
    public int getActingPlayer() {
        if (result.isTerminal()) {
            return -1;
        }
        return pendingChoice != null ? pendingChoice.chooser() : currentPlayer;
    }

    // ---- Turn structure ----

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public void incrementTurn() {
        turnNumber++;
    }

    public int getActionsThisTurn() {
        return actionsThisTurn;
    }

    public void incrementActionsThisTurn() {
        actionsThisTurn++;
    }

    public void resetActionsThisTurn() {
        actionsThisTurn = 0;
    }

    public int nextInstanceId() {
        return nextInstanceId++;
    }

    // ---- Resolution ----

    public PendingChoice getPendingChoice() {
        return pendingChoice;
    }

    public boolean hasPendingChoice() {
        return pendingChoice != null;
    }

    public void setPendingChoice(PendingChoice pendingChoice) {
        this.pendingChoice = pendingChoice;
    }

    public void clearPendingChoice() {
        this.pendingChoice = null;
    }

    public void push(Frame frame) {
        stack.push(frame);
    }

    public Frame pop() {
        return stack.pop();
    }

    public boolean isStackEmpty() {
        return stack.isEmpty();
    }

    public void clearStack() {
        stack.clear();
    }

    public AttackContext getAttack() {
        return attack;
    }

    public void setAttack(AttackContext attack) {
        this.attack = attack;
    }

    public boolean isEndTurnRequested() {
        return endTurnRequested;
    }

    public void setEndTurnRequested(boolean endTurnRequested) {
        this.endTurnRequested = endTurnRequested;
    }

    // ---- Result and events ----

    public MatchResult getResult() {
        return result;
    }

    public void setResult(MatchResult result) {
        this.result = result;
    }

    public boolean isTerminal() {
        return result.isTerminal();
    }

    public void record(MatchEvent event) {
        events.add(event);
    }

    public void record(MatchEvent.Type type, int player, int amount, String detail) {
        events.add(new MatchEvent(type, turnNumber, player, amount, detail));
    }

    public List<MatchEvent> getEvents() {
        return List.copyOf(events);
    }

    public long countEvents(MatchEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchState other)) {
            return false;
        }
        return currentPlayer == other.currentPlayer
            && firstPlayer == other.firstPlayer
            && turnNumber == other.turnNumber
            && actionsThisTurn == other.actionsThisTurn
            && nextInstanceId == other.nextInstanceId
            && endTurnRequested == other.endTurnRequested
            && phase == other.phase
            && result == other.result
            && players[0].equals(other.players[0])
            && players[1].equals(other.players[1])
            && rng.equals(other.rng)
            && Objects.equals(pendingChoice, other.pendingChoice)
            && Objects.equals(attack, other.attack)
            && List.copyOf(stack).equals(List.copyOf(other.stack))
            && events.equals(other.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(players[0], players[1], rng, currentPlayer, phase, turnNumber, result);
    }
}
