package com.tcg.pocket.simulation;

import com.tcg.pocket.action.ActionApplier;
import com.tcg.pocket.action.LegalActions;
import com.tcg.pocket.card.Card;
import com.tcg.pocket.card.CardDatabase;
import com.tcg.pocket.card.EnergyType;
import com.tcg.pocket.config.RulesConfig;
import com.tcg.pocket.game.EnergyZone;
import com.tcg.pocket.game.MatchState;
import com.tcg.pocket.game.PlayerState;
import com.tcg.pocket.game.TurnManager;
import com.tcg.pocket.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for training loops: reset, step, observe and mask.
 *
 * An engine holds only immutable collaborators, so one instance can serve
 * many matches on many threads. Each match lives entirely in its
 * {@link MatchState}.
 */
public class GameEngine {
    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final CardDatabase db;
    private final RulesConfig rules;
    private final ObservationEncoder encoder;

    public GameEngine(CardDatabase db, RulesConfig rules) {
        this.db = db;
        this.rules = rules.validate();
        this.encoder = new ObservationEncoder(db, rules);
    }

    public GameEngine(CardDatabase db) {
        this(db, RulesConfig.defaults());
    }

    /**
     * Start a match: validate both decks, shuffle, deal opening hands and pick
     * the first player. The match then waits for setup actions.
     *
     * @throws InvalidDeckException if either deck breaks a construction rule
     */
    public ResetResult reset(long seed, List<String> deckA, List<String> deckB) throws InvalidDeckException {
        List<Card> cardsA = DeckValidator.validate(deckA, db, rules);
        List<Card> cardsB = DeckValidator.validate(deckB, db, rules);

        PlayerState playerA = newPlayer(cardsA);
        PlayerState playerB = newPlayer(cardsB);
        MatchState state = new MatchState(rules, playerA, playerB, new GameRng(seed));
        TurnManager.deal(state);
        TurnManager.chooseFirstPlayer(state);
        log.debug("Match reset with seed {}, player {} goes first", seed, state.getFirstPlayer());
        return new ResetResult(state, observe(state, MatchState.PLAYER_A), observe(state, MatchState.PLAYER_B));
    }

    public ResetResult reset(long seed, DeckList deckA, DeckList deckB) throws InvalidDeckException {
        return reset(seed, deckA.getCardIds(), deckB.getCardIds());
    }

    /**
     * Apply one action for the acting player and resolve everything it sets
     * off. The given state is modified in place.
     *
     * @throws com.tcg.pocket.action.IllegalActionException if the action is not legal
     */
    public StepResult step(MatchState state, int actionIndex) {
        ActionApplier.apply(state, actionIndex);
        return new StepResult(state,
            observe(state, MatchState.PLAYER_A),
            observe(state, MatchState.PLAYER_B),
            state.isTerminal(),
            state.getResult(),
            state.getTurnNumber());
    }

    public float[] observe(MatchState state, int perspective) {
        return encoder.encode(state, perspective);
    }

    public boolean[] legalMask(MatchState state, int perspective) {
        return LegalActions.mask(state, perspective);
    }

    public CardDatabase getCardDatabase() {
        return db;
    }

    public RulesConfig getRules() {
        return rules;
    }

    private PlayerState newPlayer(List<Card> cards) {
        PlayerState player = new PlayerState(cards, rules.getBenchSize(), rules.getPrizePoints());
        player.setEnergyZone(new EnergyZone(energyTypes(cards)));
        return player;
    }

    /**
     * Energy types the zone generates: every type of the deck's Pokémon, or
     * colorless for a deck without typed Pokémon.
     */
    static List<EnergyType> energyTypes(List<Card> cards) {
        Set<EnergyType> types = EnumSet.noneOf(EnergyType.class);
        for (Card card : cards) {
            if (card instanceof Card.Pokemon pokemon && pokemon.getEnergyType() != EnergyType.COLORLESS) {
                types.add(pokemon.getEnergyType());
            }
        }
        if (types.isEmpty()) {
            return List.of(EnergyType.COLORLESS);
        }
        return new ArrayList<>(types);
    }
}
