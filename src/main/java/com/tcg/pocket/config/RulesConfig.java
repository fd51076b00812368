package com.tcg.pocket.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Rules constants of the modelled game mode. Every field has the standard
 * value as its default; a JSON file only needs the fields it overrides.
 * Treat an instance as read-only once a match has started with it.
 */
public class RulesConfig {
    public static final String DEFAULT_RESOURCE = "rules.json";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    /** Who takes the first turn. */
    public enum FirstPlayer {
        COIN_FLIP,
        PLAYER_A,
        PLAYER_B
    }

    /** What happens when a player must draw from an empty deck at the start of their turn. */
    public enum DeckOutPolicy {
        LOSE,
        SKIP
    }

    /** When once-per-turn flags (energy, supporter, retreat, abilities) are cleared. */
    public enum ResetPoint {
        START_OF_TURN,
        END_OF_TURN
    }

    @JsonProperty("deck_size")
    private int deckSize = 20;

    @JsonProperty("max_copies")
    private int maxCopies = 2;

    @JsonProperty("bench_size")
    private int benchSize = 3;

    @JsonProperty("hand_limit")
    private int handLimit = 10;

    @JsonProperty("prize_points")
    private int prizePoints = 3;

    @JsonProperty("opening_hand")
    private int openingHand = 5;

    @JsonProperty("weakness_bonus")
    private int weaknessBonus = 20;

    @JsonProperty("poison_damage")
    private int poisonDamage = 10;

    @JsonProperty("burn_damage")
    private int burnDamage = 20;

    @JsonProperty("first_player")
    private FirstPlayer firstPlayer = FirstPlayer.COIN_FLIP;

    @JsonProperty("deck_out")
    private DeckOutPolicy deckOutPolicy = DeckOutPolicy.LOSE;

    @JsonProperty("once_per_turn_reset")
    private ResetPoint oncePerTurnReset = ResetPoint.START_OF_TURN;

    @JsonProperty("first_turn_attack")
    private boolean firstTurnAttack = false;

    @JsonProperty("max_turns")
    private int maxTurns = 200;

    @JsonProperty("max_actions_per_turn")
    private int maxActionsPerTurn = 100;

    /**
     * Standard rules.
     */
    public static RulesConfig defaults() {
        return new RulesConfig();
    }

    /**
     * Load rules from a classpath resource.
     */
    public static RulesConfig fromResource(String resourcePath) throws IOException {
        try (InputStream is = RulesConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return MAPPER.readValue(is, RulesConfig.class).validate();
        }
    }

    /**
     * Load rules from a JSON file.
     */
    public static RulesConfig fromFile(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), RulesConfig.class).validate();
    }

    public static RulesConfig fromJson(String json) throws IOException {
        return MAPPER.readValue(json, RulesConfig.class).validate();
    }

    /**
     * Check value ranges.
     * @throws IllegalArgumentException if a value is out of range
     */
    public RulesConfig validate() {
        require(deckSize > 0, "deck_size must be positive");
        require(maxCopies > 0, "max_copies must be positive");
        require(benchSize > 0 && benchSize <= 3, "bench_size must be between 1 and 3");
        require(handLimit > 0 && handLimit <= 10, "hand_limit must be between 1 and 10");
        require(prizePoints > 0, "prize_points must be positive");
        require(openingHand > 0 && openingHand <= deckSize, "opening_hand must be between 1 and deck_size");
        require(openingHand <= handLimit, "opening_hand cannot exceed hand_limit");
        require(weaknessBonus >= 0 && poisonDamage >= 0 && burnDamage >= 0, "damage values cannot be negative");
        require(maxTurns > 0, "max_turns must be positive");
        require(maxActionsPerTurn > 0, "max_actions_per_turn must be positive");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public int getDeckSize() {
        return deckSize;
    }

    public int getMaxCopies() {
        return maxCopies;
    }

    public int getBenchSize() {
        return benchSize;
    }

    public int getHandLimit() {
        return handLimit;
    }

    public int getPrizePoints() {
        return prizePoints;
    }

    public int getOpeningHand() {
        return openingHand;
    }

    public int getWeaknessBonus() {
        return weaknessBonus;
    }

    public int getPoisonDamage() {
        return poisonDamage;
    }

    public int getBurnDamage() {
        return burnDamage;
    }

    public FirstPlayer getFirstPlayer() {
        return firstPlayer;
    }

    public DeckOutPolicy getDeckOutPolicy() {
        return deckOutPolicy;
    }

    public ResetPoint getOncePerTurnReset() {
        return oncePerTurnReset;
    }

    public boolean isFirstTurnAttack() {
        return firstTurnAttack;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public int getMaxActionsPerTurn() {
        return maxActionsPerTurn;
    }

    public RulesConfig setDeckSize(int deckSize) { this.deckSize = deckSize; return this; }
    public RulesConfig setMaxCopies(int maxCopies) { this.maxCopies = maxCopies; return this; }
    public RulesConfig setBenchSize(int benchSize) { this.benchSize = benchSize; return this; }
    public RulesConfig setHandLimit(int handLimit) { this.handLimit = handLimit; return this; }
    public RulesConfig setPrizePoints(int prizePoints) { this.prizePoints = prizePoints; return this; }
    public RulesConfig setOpeningHand(int openingHand) { this.openingHand = openingHand; return this; }
    public RulesConfig setWeaknessBonus(int weaknessBonus) { this.weaknessBonus = weaknessBonus; return this; }
    public RulesConfig setPoisonDamage(int poisonDamage) { this.poisonDamage = poisonDamage; return this; }
    public RulesConfig setBurnDamage(int burnDamage) { this.burnDamage = burnDamage; return this; }
    public RulesConfig setFirstPlayer(FirstPlayer firstPlayer) { this.firstPlayer = firstPlayer; return this; }
    public RulesConfig setDeckOutPolicy(DeckOutPolicy deckOutPolicy) { this.deckOutPolicy = deckOutPolicy; return this; }
    public RulesConfig setOncePerTurnReset(ResetPoint oncePerTurnReset) { this.oncePerTurnReset = oncePerTurnReset; return this; }
    public RulesConfig setFirstTurnAttack(boolean firstTurnAttack) { this.firstTurnAttack = firstTurnAttack; return this; }
    public RulesConfig setMaxTurns(int maxTurns) { this.maxTurns = maxTurns; return this; }
    public RulesConfig setMaxActionsPerTurn(int maxActionsPerTurn) { this.maxActionsPerTurn = maxActionsPerTurn; return this; }
}
