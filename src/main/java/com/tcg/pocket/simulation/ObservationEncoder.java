package com.tcg.pocket.simulation;

import com.tcg.pocket.card.Attack;
import com.tcg.pocket.card.Card;
import com.tcg.pocket.card.CardCategory;
import com.tcg.pocket.card.CardDatabase;
import com.tcg.pocket.card.EnergyType;
import com.tcg.pocket.card.Stage;
import com.tcg.pocket.config.RulesConfig;
import com.tcg.pocket.effect.ModifierKind;
import com.tcg.pocket.game.EnergyZone;
import com.tcg.pocket.game.MatchState;
import com.tcg.pocket.game.PendingChoice;
import com.tcg.pocket.game.Phase;
import com.tcg.pocket.game.PlayerState;
import com.tcg.pocket.game.StatusCondition;
import com.tcg.pocket.game.zones.CardInstance;
import com.tcg.pocket.game.zones.Hand;

import java.util.List;

/**
 * Encodes a match from one player's point of view as a fixed-length vector
 * with every value in [0, 1].
 *
 * Layout: a global block, the perspective player's public block, the
 * opponent's public block, then the perspective player's hand. The
 * opponent's hand only appears as a size in its public block.
 */
public class ObservationEncoder {
    public static final int SIZE = 512;

    static final int MAX_HP = 300;
    static final int MAX_ENERGY = 10;
    static final int BOARD_SLOTS = 4;
    static final int HAND_SLOTS = 10;

    static final int GLOBAL_FEATURES = 17;
    static final int SLOT_FEATURES = 45;
    static final int PLAYER_FEATURES = 7 + 2 * EnergyType.values().length + BOARD_SLOTS * SLOT_FEATURES;
    static final int HAND_CARD_FEATURES = 2 + CardCategory.values().length;

    static final int OWN_OFFSET = GLOBAL_FEATURES;
    static final int OPPONENT_OFFSET = OWN_OFFSET + PLAYER_FEATURES;
    static final int HAND_OFFSET = OPPONENT_OFFSET + PLAYER_FEATURES;
    static final int USED = HAND_OFFSET + HAND_SLOTS * HAND_CARD_FEATURES;

    private final CardDatabase db;
    private final RulesConfig rules;

    public ObservationEncoder(CardDatabase db, RulesConfig rules) {
        if (USED > SIZE) {
            throw new IllegalStateException("Observation layout needs " + USED + " entries");
        }
        this.db = db;
        this.rules = rules;
    }

    /**
     * Encode {@code state} for {@code perspective}. Pure: reads the state only.
     */
    public float[] encode(MatchState state, int perspective) {
        float[] obs = new float[SIZE];
        encodeGlobal(state, perspective, obs);
        encodePlayer(state, perspective, obs, OWN_OFFSET);
        encodePlayer(state, 1 - perspective, obs, OPPONENT_OFFSET);
        encodeHand(state.getPlayer(perspective).getHand(), obs);
        return obs;
    }

    private void encodeGlobal(MatchState state, int perspective, float[] obs) {
        obs[0] = ratio(state.getTurnNumber(), rules.getMaxTurns());
        obs[1] = flag(state.getCurrentPlayer() == perspective);
        obs[2] = flag(state.getActingPlayer() == perspective);
        Phase phase = state.getPhase();
        obs[3 + phase.ordinal()] = 1f;
        PendingChoice choice = state.getPendingChoice();
        if (choice != null) {
            obs[3 + Phase.values().length + choice.kind().ordinal()] = 1f;
        }
        obs[GLOBAL_FEATURES - 1] = flag(state.getFirstPlayer() == perspective);
    }

    private void encodePlayer(MatchState state, int player, float[] obs, int offset) {
        PlayerState ps = state.getPlayer(player);
        int i = offset;
        obs[i++] = ratio(ps.getPrizePoints(), rules.getPrizePoints());
        obs[i++] = ratio(ps.getHand().size(), rules.getHandLimit());
        obs[i++] = ratio(ps.getDeck().size(), rules.getDeckSize());
        obs[i++] = ratio(ps.getDiscard().size(), rules.getDeckSize());
        obs[i++] = flag(ps.isEnergyAttachedThisTurn());
        obs[i++] = flag(ps.isSupporterPlayedThisTurn());
        obs[i++] = flag(ps.isRetreatedThisTurn());

        EnergyZone zone = ps.getEnergyZone();
        int energyTypes = EnergyType.values().length;
        if (zone != null && zone.getCurrent() != null) {
            obs[i + zone.getCurrent().ordinal()] = 1f;
        }
        i += energyTypes;
        if (zone != null && zone.getNext() != null) {
            obs[i + zone.getNext().ordinal()] = 1f;
        }
        i += energyTypes;

        for (int slot = 0; slot < BOARD_SLOTS; slot++) {
            CardInstance instance = slot < ps.boardSlots() ? ps.getInPlay(slot) : null;
            if (instance != null) {
                encodeInstance(state, instance, obs, i);
            }
            i += SLOT_FEATURES;
        }
    }

    private void encodeInstance(MatchState state, CardInstance instance, float[] obs, int offset) {
        Card.Pokemon card = instance.getCard();
        int i = offset;
        obs[i++] = 1f;
        obs[i++] = cardCode(card);
        obs[i++] = ratio(instance.getRemainingHp(), MAX_HP);
        obs[i++] = ratio(instance.getDamage(), MAX_HP);
        Stage stage = card.getStage();
        obs[i + stage.ordinal()] = 1f;
        i += Stage.values().length;
        obs[i + card.getEnergyType().ordinal()] = 1f;
        i += EnergyType.values().length;
        for (EnergyType type : EnergyType.values()) {
            obs[i++] = ratio(instance.getEnergy(type), MAX_ENERGY);
        }
        for (StatusCondition status : StatusCondition.values()) {
            obs[i++] = flag(instance.hasStatus(status));
        }
        obs[i++] = flag(instance.hasTool());
        obs[i++] = flag(instance.isAbilityUsed());
        obs[i++] = flag(card.isEx());
        obs[i++] = flag(instance.getTurnPlaced() == state.getTurnNumber());
        for (ModifierKind kind : ModifierKind.values()) {
            obs[i++] = flag(instance.hasModifier(kind));
        }
        List<Attack> attacks = card.getAttacks();
        for (int a = 0; a < CardDatabase.MAX_ATTACKS; a++) {
            obs[i++] = flag(a < attacks.size() && instance.canPay(attacks.get(a).getCost()));
        }
    }

    private void encodeHand(Hand hand, float[] obs) {
        int i = HAND_OFFSET;
        for (int h = 0; h < HAND_SLOTS; h++) {
            if (h < hand.size()) {
                Card card = hand.get(h);
                obs[i] = 1f;
                obs[i + 1] = cardCode(card);
                obs[i + 2 + card.getCategory().ordinal()] = 1f;
            }
            i += HAND_CARD_FEATURES;
        }
    }

    /**
     * Card identity as a value in (0, 1], stable for a given database.
     */
    private float cardCode(Card card) {
        int ordinal = db.ordinalOf(card);
        return ordinal < 0 ? 0f : (ordinal + 1) / (float) db.cardCount();
    }

    private static float ratio(int value, int max) {
        if (max <= 0) {
            return 0f;
        }
        return Math.max(0f, Math.min(1f, value / (float) max));
    }

    private static float flag(boolean value) {
        return value ? 1f : 0f;
    }
}
