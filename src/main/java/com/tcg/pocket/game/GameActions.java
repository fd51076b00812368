package com.tcg.pocket.game;

import com.tcg.pocket.card.Ability;
import com.tcg.pocket.card.Attack;
import com.tcg.pocket.card.Card;
import com.tcg.pocket.card.EnergyType;
import com.tcg.pocket.card.PassiveKind;
import com.tcg.pocket.card.TrainerCard;
import com.tcg.pocket.effect.EffectExecutor;
import com.tcg.pocket.effect.ModifierKind;
import com.tcg.pocket.game.zones.CardInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Player actions: the checks that decide whether an action can be taken and
 * the state changes it makes.
 *
 * The {@code canX} methods are pure and are what the legality mask is built
 * from. The action methods assume the matching check passed and leave any
 * scheduled frames on the stack for {@link TurnManager#advance(MatchState)}.
 */
public final class GameActions {
    private static final Logger log = LoggerFactory.getLogger(GameActions.class);

    private GameActions() {
        // Utility class - prevent instantiation
    }

    // ==================== SETUP ====================

    public static boolean canPlaceActive(MatchState state, int handIndex) {
        PlayerState ps = state.getCurrent();
        return state.getPhase() == Phase.SETUP
            && !ps.isSetupConfirmed()
            && !ps.hasActive()
            && isBasicInHand(ps, handIndex);
    }

    public static void placeActive(MatchState state, int handIndex) {
        PlayerState ps = state.getCurrent();
        Card.Pokemon card = (Card.Pokemon) ps.getHand().remove(handIndex);
        ps.setActive(new CardInstance(state.nextInstanceId(), card, state.getTurnNumber()));
        log.debug("Player {} sets up {} as active", state.getCurrentPlayer(), card.getName());
    }

    public static boolean canPlaceBench(MatchState state, int handIndex) {
        PlayerState ps = state.getCurrent();
        return state.getPhase() == Phase.SETUP
            && !ps.isSetupConfirmed()
            && ps.hasActive()
            && !ps.getBench().isFull()
            && isBasicInHand(ps, handIndex);
    }

    public static void placeBench(MatchState state, int handIndex) {
        PlayerState ps = state.getCurrent();
        benchBasic(state, ps, handIndex);
    }

    public static boolean canConfirmSetup(MatchState state) {
        PlayerState ps = state.getCurrent();
        return state.getPhase() == Phase.SETUP && !ps.isSetupConfirmed() && ps.hasActive();
    }

    public static void confirmSetup(MatchState state) {
        log.debug("Player {} confirms setup", state.getCurrentPlayer());
        TurnManager.finishSetup(state);
    }

    // ==================== MAIN PHASE ====================

    /**
     * Free main-phase actions are available until the per-turn cap is hit.
     */
    private static boolean inMainPhase(MatchState state) {
        return state.getPhase() == Phase.MAIN && !state.hasPendingChoice() && !state.isTerminal();
    }

    private static boolean underActionCap(MatchState state) {
        return state.getActionsThisTurn() < state.getRules().getMaxActionsPerTurn();
    }

    public static boolean canPlayBasic(MatchState state, int handIndex) {
        PlayerState ps = state.getCurrent();
        return inMainPhase(state) && underActionCap(state)
            && !ps.getBench().isFull()
            && isBasicInHand(ps, handIndex);
    }

    public static void playBasic(MatchState state, int handIndex) {
        benchBasic(state, state.getCurrent(), handIndex);
    }

    /**
     * An evolution card can go onto a Pokémon of the previous stage with the
     * matching name, except on the player's first turn or onto a Pokémon that
     * came into play or evolved this turn.
     */
    public static boolean canEvolve(MatchState state, int handIndex, int slot) {
        PlayerState ps = state.getCurrent();
        if (!inMainPhase(state) || !underActionCap(state) || ps.isFirstTurn()) {
            return false;
        }
        if (handIndex < 0 || handIndex >= ps.getHand().size() || slot < 0 || slot >= ps.boardSlots()) {
            return false;
        }
        if (!(ps.getHand().get(handIndex) instanceof Card.Pokemon evolution) || evolution.isBasicPokemon()) {
            return false;
        }
        CardInstance target = ps.getInPlay(slot);
        return target != null
            && target.getTurnPlaced() < state.getTurnNumber()
            && target.getCard().getStage() == evolution.getStage().previous()
            && target.getName().equals(evolution.getEvolvesFrom());
    }

    public static void evolve(MatchState state, int handIndex, int slot) {
        PlayerState ps = state.getCurrent();
        Card.Pokemon evolution = (Card.Pokemon) ps.getHand().remove(handIndex);
        CardInstance target = ps.getInPlay(slot);
        log.debug("Player {}: {} evolves into {}", state.getCurrentPlayer(), target.getName(), evolution.getName());
        target.evolve(evolution, state.getTurnNumber());
    }

    public static boolean canAttachEnergy(MatchState state, int slot) {
        PlayerState ps = state.getCurrent();
        return inMainPhase(state) && underActionCap(state)
            && !ps.isEnergyAttachedThisTurn()
            && ps.getEnergyZone().getCurrent() != null
            && slot >= 0 && slot < ps.boardSlots()
            && ps.getInPlay(slot) != null;
    }

    public static void attachEnergy(MatchState state, int slot) {
        PlayerState ps = state.getCurrent();
        EnergyType energy = ps.getEnergyZone().take();
        ps.getInPlay(slot).attachEnergy(energy, 1);
        ps.setEnergyAttachedThisTurn(true);
    }

    /**
     * Retreat cost after passive and one-turn reductions, never below zero.
     */
    public static int retreatCost(CardInstance active) {
        int cost = active.getCard().getRetreatCost()
            - active.passiveTotal(PassiveKind.RETREAT_REDUCTION)
            - active.modifierTotal(ModifierKind.RETREAT_REDUCTION);
        return Math.max(0, cost);
    }

    public static boolean canRetreat(MatchState state, int benchPosition) {
        PlayerState ps = state.getCurrent();
        if (!inMainPhase(state) || !underActionCap(state) || ps.isRetreatedThisTurn() || !ps.hasActive()) {
            return false;
        }
        if (benchPosition < 0 || benchPosition >= ps.getBench().capacity()
                || ps.getBench().get(benchPosition) == null) {
            return false;
        }
        CardInstance active = ps.getActive();
        return !isImmobile(active)
            && !active.hasModifier(ModifierKind.CANT_RETREAT)
            && active.getTotalEnergy() >= retreatCost(active);
    }

    public static void retreat(MatchState state, int benchPosition) {
        PlayerState ps = state.getCurrent();
        CardInstance active = ps.getActive();
        List<EnergyType> paid = active.removeAnyEnergy(retreatCost(active));
        ps.switchActive(benchPosition);
        ps.setRetreatedThisTurn(true);
        log.debug("Player {}: {} retreats paying {}", state.getCurrentPlayer(), active.getName(), paid);
    }

    public static boolean canUseAbility(MatchState state, int slot) {
        PlayerState ps = state.getCurrent();
        if (!inMainPhase(state) || !underActionCap(state) || slot < 0 || slot >= ps.boardSlots()) {
            return false;
        }
        CardInstance instance = ps.getInPlay(slot);
        if (instance == null || instance.isAbilityUsed()) {
            return false;
        }
        Ability ability = instance.getCard().getAbility();
        if (ability == null || !ability.isActivated()) {
            return false;
        }
        if (ability.isActiveOnly() && slot != PlayerState.ACTIVE_SLOT) {
            return false;
        }
        return EffectExecutor.isPlayable(ability.getEffect(), state, state.getCurrentPlayer(),
            instance.getInstanceId());
    }

    public static void useAbility(MatchState state, int slot) {
        CardInstance instance = state.getCurrent().getInPlay(slot);
        instance.setAbilityUsed(true);
        Ability ability = instance.getCard().getAbility();
        log.debug("Player {}: {} uses {}", state.getCurrentPlayer(), instance.getName(), ability.getName());
        scheduleEffect(state, new Frame.EffectFrame(ability.getEffect(), state.getCurrentPlayer(),
            instance.getInstanceId()));
    }

    /**
     * Items and supporters. One supporter per turn.
     */
    public static boolean canPlayTrainer(MatchState state, int handIndex) {
        PlayerState ps = state.getCurrent();
        if (!inMainPhase(state) || !underActionCap(state)
                || handIndex < 0 || handIndex >= ps.getHand().size()) {
            return false;
        }
        Card card = ps.getHand().get(handIndex);
        if (card instanceof Card.Supporter) {
            if (ps.isSupporterPlayedThisTurn()) {
                return false;
            }
        } else if (!(card instanceof Card.Item)) {
            return false;
        }
        return EffectExecutor.isPlayable(((TrainerCard) card).getEffect(), state, state.getCurrentPlayer(),
            Frame.EffectFrame.NO_SOURCE);
    }

    public static void playTrainer(MatchState state, int handIndex) {
        PlayerState ps = state.getCurrent();
        Card card = ps.getHand().remove(handIndex);
        if (card instanceof Card.Supporter) {
            ps.setSupporterPlayedThisTurn(true);
        }
        ps.getDiscard().add(card);
        log.debug("Player {} plays {}", state.getCurrentPlayer(), card.getName());
        scheduleEffect(state, new Frame.EffectFrame(((TrainerCard) card).getEffect(), state.getCurrentPlayer(),
            Frame.EffectFrame.NO_SOURCE));
    }

    public static boolean canAttachTool(MatchState state, int handIndex, int slot) {
        PlayerState ps = state.getCurrent();
        if (!inMainPhase(state) || !underActionCap(state)
                || handIndex < 0 || handIndex >= ps.getHand().size()
                || slot < 0 || slot >= ps.boardSlots()) {
            return false;
        }
        CardInstance target = ps.getInPlay(slot);
        return ps.getHand().get(handIndex) instanceof Card.Tool && target != null && !target.hasTool();
    }

    public static void attachTool(MatchState state, int handIndex, int slot) {
        PlayerState ps = state.getCurrent();
        Card.Tool tool = (Card.Tool) ps.getHand().remove(handIndex);
        ps.getInPlay(slot).setTool(tool);
        log.debug("Player {} attaches {} to {}", state.getCurrentPlayer(), tool.getName(),
            ps.getInPlay(slot).getName());
    }

    /**
     * Attacks stay available after the action cap. The player going first
     * cannot attack on turn 1 unless the rules allow it.
     */
    public static boolean canAttack(MatchState state, int attackIndex) {
        PlayerState ps = state.getCurrent();
        if (!inMainPhase(state) || !ps.hasActive()) {
            return false;
        }
        if (state.getTurnNumber() == 1 && !state.getRules().isFirstTurnAttack()) {
            return false;
        }
        CardInstance active = ps.getActive();
        List<Attack> attacks = active.getCard().getAttacks();
        if (attackIndex < 0 || attackIndex >= attacks.size()) {
            return false;
        }
        return !isImmobile(active)
            && !active.hasModifier(ModifierKind.CANT_ATTACK)
            && active.canPay(attacks.get(attackIndex).getCost());
    }

    public static void attack(MatchState state, int attackIndex) {
        TurnManager.declareAttack(state, attackIndex);
    }

    public static boolean canEndTurn(MatchState state) {
        return inMainPhase(state);
    }

    public static void endTurn(MatchState state) {
        state.setPhase(Phase.END_OF_TURN);
        state.push(new Frame.StepFrame(Frame.Step.END_TURN, state.getCurrentPlayer()));
    }

    // ==================== CHOICES ====================

    public static boolean canAnswer(MatchState state, PendingChoice.Kind kind, int answer) {
        PendingChoice choice = state.getPendingChoice();
        return choice != null && !state.isTerminal() && choice.kind() == kind && choice.accepts(answer);
    }

    /**
     * Answer the pending choice. Promotions move the Pokémon directly; every
     * other choice re-schedules the suspended frame with the answer filled in.
     */
    public static void answerChoice(MatchState state, int answer) {
        PendingChoice choice = state.getPendingChoice();
        if (choice.kind() == PendingChoice.Kind.PROMOTE) {
            TurnManager.promote(state, choice.chooser(), answer);
            return;
        }
        state.clearPendingChoice();
        state.push(choice.resume().withChoice(answer));
    }

    // ==================== HELPERS ====================

    private static boolean isBasicInHand(PlayerState ps, int handIndex) {
        return handIndex >= 0 && handIndex < ps.getHand().size() && ps.getHand().get(handIndex).isBasicPokemon();
    }

    private static void benchBasic(MatchState state, PlayerState ps, int handIndex) {
        Card.Pokemon card = (Card.Pokemon) ps.getHand().remove(handIndex);
        int position = ps.getBench().firstEmpty();
        ps.getBench().set(position, new CardInstance(state.nextInstanceId(), card, state.getTurnNumber()));
        log.debug("Player {} benches {}", state.getCurrentPlayer(), card.getName());
    }

    private static boolean isImmobile(CardInstance active) {
        for (StatusCondition status : active.getStatuses()) {
            if (status.blocksAction()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Schedule a main-phase effect followed by a knockout check.
     */
    private static void scheduleEffect(MatchState state, Frame.EffectFrame frame) {
        state.setPhase(Phase.EFFECT_RESOLUTION);
        state.push(new Frame.StepFrame(Frame.Step.KNOCKOUT_CHECK, state.getCurrentPlayer()));
        state.push(frame);
    }
}
