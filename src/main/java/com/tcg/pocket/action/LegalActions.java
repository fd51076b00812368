package com.tcg.pocket.action;

import com.tcg.pocket.game.GameActions;
import com.tcg.pocket.game.MatchState;
import com.tcg.pocket.game.PendingChoice;
import com.tcg.pocket.game.Phase;

import java.util.ArrayList;
import java.util.List;

/**
 * Legality masks over the action space.
 *
 * Only the acting player gets true bits: the chooser while a choice is
 * pending, otherwise the current player. While a choice is pending only the
 * matching choice family is legal.
 */
public final class LegalActions {

    private LegalActions() {
        // Utility class - prevent instantiation
    }

    /**
     * Mask of the actions {@code perspective} may take now.
     */
    public static boolean[] mask(MatchState state, int perspective) {
        boolean[] mask = new boolean[ActionSpace.SIZE];
        if (state.isTerminal() || state.getActingPlayer() != perspective) {
            return mask;
        }
        for (int index = 0; index < ActionType.ATTACH_TOOL.getEnd(); index++) {
            mask[index] = isLegal(state, ActionSpace.decode(index));
        }
        return mask;
    }

    /**
     * Indices of every legal action for the acting player.
     */
    public static List<Integer> legalIndices(MatchState state) {
        List<Integer> indices = new ArrayList<>();
        if (state.isTerminal()) {
            return indices;
        }
        boolean[] mask = mask(state, state.getActingPlayer());
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                indices.add(i);
            }
        }
        return indices;
    }

    public static boolean isLegal(MatchState state, int index) {
        if (index < 0 || index >= ActionSpace.SIZE || ActionSpace.isReserved(index)) {
            return false;
        }
        return isLegal(state, ActionSpace.decode(index));
    }

    /**
     * Legality of a decoded action for the acting player.
     */
    public static boolean isLegal(MatchState state, Action action) {
        if (state.isTerminal()) {
            return false;
        }
        ActionType type = action.type();
        if (state.hasPendingChoice()) {
            return type.isChoice() && GameActions.canAnswer(state, choiceKind(type), action.first());
        }
        if (type.isChoice()) {
            return false;
        }
        if (state.getPhase() == Phase.SETUP) {
            return switch (type) {
                case PLACE_ACTIVE -> GameActions.canPlaceActive(state, action.first());
                case PLACE_BENCH -> GameActions.canPlaceBench(state, action.first());
                case CONFIRM_SETUP -> GameActions.canConfirmSetup(state);
                default -> false;
            };
        }
        return switch (type) {
            case PLAY_BASIC -> GameActions.canPlayBasic(state, action.first());
            case EVOLVE -> GameActions.canEvolve(state, action.first(), action.second());
            case ATTACH_ENERGY -> GameActions.canAttachEnergy(state, action.first());
            case RETREAT -> GameActions.canRetreat(state, action.first());
            case USE_ABILITY -> GameActions.canUseAbility(state, action.first());
            case PLAY_TRAINER -> GameActions.canPlayTrainer(state, action.first());
            case ATTACH_TOOL -> GameActions.canAttachTool(state, action.first(), action.second());
            case ATTACK -> GameActions.canAttack(state, action.first());
            case END_TURN -> GameActions.canEndTurn(state);
            default -> false;
        };
    }

    static PendingChoice.Kind choiceKind(ActionType type) {
        return switch (type) {
            case CHOOSE_OWN_TARGET -> PendingChoice.Kind.OWN_TARGET;
            case CHOOSE_OPPONENT_TARGET -> PendingChoice.Kind.OPPONENT_TARGET;
            case PROMOTE -> PendingChoice.Kind.PROMOTE;
            case CHOOSE_HAND_CARD -> PendingChoice.Kind.HAND_CARD;
            default -> throw new IllegalArgumentException(type + " does not answer a choice");
        };
    }
}
