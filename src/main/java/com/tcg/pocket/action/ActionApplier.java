package com.tcg.pocket.action;

import com.tcg.pocket.game.GameActions;
import com.tcg.pocket.game.MatchState;
import com.tcg.pocket.game.TurnManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies one action index to a match and runs the engine until the match
 * needs input again.
 */
public final class ActionApplier {
    private static final Logger log = LoggerFactory.getLogger(ActionApplier.class);

    private ActionApplier() {
        // Utility class - prevent instantiation
    }

    /**
     * Apply the action at {@code index} for the acting player.
     * @throws IllegalActionException if the index is out of range, reserved or not legal now;
     *                                the state is not modified in that case
     */
    public static void apply(MatchState state, int index) {
        if (state.isTerminal()) {
            throw new IllegalActionException(index, "match is over");
        }
        Action action = ActionSpace.decode(index);
        if (!LegalActions.isLegal(state, action)) {
            throw new IllegalActionException(index, action + " is not legal for player "
                + state.getActingPlayer() + " in " + state.getPhase());
        }
        log.trace("Player {} applies {}", state.getActingPlayer(), action);

        if (!action.type().isChoice() && !action.type().isSetup()) {
            state.incrementActionsThisTurn();
        }
        switch (action.type()) {
            case PLACE_ACTIVE -> GameActions.placeActive(state, action.first());
            case PLACE_BENCH -> GameActions.placeBench(state, action.first());
            case CONFIRM_SETUP -> GameActions.confirmSetup(state);
            case PLAY_BASIC -> GameActions.playBasic(state, action.first());
            case EVOLVE -> GameActions.evolve(state, action.first(), action.second());
            case ATTACH_ENERGY -> GameActions.attachEnergy(state, action.first());
            case RETREAT -> GameActions.retreat(state, action.first());
            case USE_ABILITY -> GameActions.useAbility(state, action.first());
            case PLAY_TRAINER -> GameActions.playTrainer(state, action.first());
            case ATTACH_TOOL -> GameActions.attachTool(state, action.first(), action.second());
            case ATTACK -> GameActions.attack(state, action.first());
            case END_TURN -> GameActions.endTurn(state);
            case CHOOSE_OWN_TARGET, CHOOSE_OPPONENT_TARGET, PROMOTE, CHOOSE_HAND_CARD ->
                GameActions.answerChoice(state, action.first());
        }
        TurnManager.advance(state);
    }
}
