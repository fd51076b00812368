package com.tcg.pocket.game;

import com.tcg.pocket.card.Attack;
import com.tcg.pocket.card.Card;
import com.tcg.pocket.card.PassiveKind;
import com.tcg.pocket.card.Trigger;
import com.tcg.pocket.card.TriggerEvent;
import com.tcg.pocket.config.RulesConfig;
import com.tcg.pocket.effect.EffectExecutor;
import com.tcg.pocket.effect.ModifierKind;
import com.tcg.pocket.game.zones.CardInstance;
import com.tcg.pocket.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turn structure and the resolution loop.
 *
 * {@link #advance(MatchState)} drains the resolution stack and moves through
 * the transient phases until the match needs input again: a free decision in
 * SETUP or MAIN, a pending choice, or the end of the match.
 */
public final class TurnManager {
    private static final Logger log = LoggerFactory.getLogger(TurnManager.class);

    private TurnManager() {
        // Utility class - prevent instantiation
    }

    // ==================== SETUP ====================

    /**
     * Shuffle both decks and deal opening hands. A hand without a basic
     * Pokémon goes back into the deck and is redrawn after a reshuffle.
     */
    public static void deal(MatchState state) {
        GameRng rng = state.getRng();
        int handSize = state.getRules().getOpeningHand();
        for (int player = MatchState.PLAYER_A; player <= MatchState.PLAYER_B; player++) {
            PlayerState ps = state.getPlayer(player);
            ps.getDeck().shuffle(rng);
            drawOpeningHand(ps, handSize);
            int mulligans = 0;
            while (!ps.getHand().hasBasicPokemon()) {
                for (Card card : ps.getHand().removeAll()) {
                    ps.getDeck().putOnBottom(card);
                }
                ps.getDeck().shuffle(rng);
                drawOpeningHand(ps, handSize);
                mulligans++;
            }
            if (mulligans > 0) {
                log.debug("Player {} redrew the opening hand {} time(s)", player, mulligans);
            }
            ps.getEnergyZone().prime(rng);
        }
    }

    private static void drawOpeningHand(PlayerState ps, int handSize) {
        for (int i = 0; i < handSize && !ps.getDeck().isEmpty(); i++) {
            ps.getHand().add(ps.getDeck().draw());
        }
    }

    /**
     * Pick the first player and open setup for them.
     */
    public static void chooseFirstPlayer(MatchState state) {
        int first = switch (state.getRules().getFirstPlayer()) {
            case PLAYER_A -> MatchState.PLAYER_A;
            case PLAYER_B -> MatchState.PLAYER_B;
            case COIN_FLIP -> state.getRng().coinFlip() ? MatchState.PLAYER_A : MatchState.PLAYER_B;
        };
        state.setFirstPlayer(first);
        state.setCurrentPlayer(first);
        state.setPhase(Phase.SETUP);
    }

    /**
     * Called after a player confirms setup: the other player sets up next,
     * or the first turn begins once both are done.
     */
    public static void finishSetup(MatchState state) {
        state.getCurrent().setSetupConfirmed(true);
        PlayerState other = state.getOpponent();
        if (!other.isSetupConfirmed()) {
            state.setCurrentPlayer(1 - state.getCurrentPlayer());
            return;
        }
        state.setCurrentPlayer(state.getFirstPlayer());
        beginTurn(state);
    }

    // ==================== RESOLUTION LOOP ====================

    /**
     * Resolve frames until the match needs input or is over.
     */
    public static void advance(MatchState state) {
        while (!state.isTerminal() && !state.hasPendingChoice()) {
            if (state.isStackEmpty()) {
                Phase phase = state.getPhase();
                if (phase == Phase.SETUP || phase == Phase.MAIN) {
                    return;
                }
                // A main-phase card or ability finished resolving
                if (state.isEndTurnRequested()) {
                    state.setEndTurnRequested(false);
                    state.push(new Frame.StepFrame(Frame.Step.END_TURN, state.getCurrentPlayer()));
                    continue;
                }
                state.setPhase(Phase.MAIN);
                return;
            }
            Frame frame = state.pop();
            if (frame instanceof Frame.EffectFrame effectFrame) {
                state.setPhase(Phase.EFFECT_RESOLUTION);
                EffectExecutor.resolve(effectFrame, state, state.getRng());
            } else if (frame instanceof Frame.StepFrame stepFrame) {
                runStep(state, stepFrame);
            }
        }
    }

    private static void runStep(MatchState state, Frame.StepFrame frame) {
        switch (frame.step()) {
            case DEAL_ATTACK_DAMAGE -> dealAttackDamage(state);
            case DEFENDER_REACTIONS -> pushDefenderReactions(state);
            case DAMAGE_DEALT_TRIGGERS -> pushDamageDealtTriggers(state);
            case KNOCKOUT_CHECK -> knockoutCheck(state);
            case PROMOTE -> requestPromotion(state, frame.player());
            case BETWEEN_TURNS_TRIGGERS -> pushTriggers(state, frame.player(), TriggerEvent.BETWEEN_TURNS);
            case END_TURN -> endOfTurn(state);
            case NEXT_TURN -> nextTurn(state);
        }
    }

    // ==================== ATTACK ====================

    /**
     * Schedule an attack of the current active. Confusion is checked here:
     * tails means the attack does nothing and the turn ends.
     */
    public static void declareAttack(MatchState state, int attackIndex) {
        state.setPhase(Phase.ATTACK);
        PlayerState attacker = state.getCurrent();
        CardInstance active = attacker.getActive();
        int player = state.getCurrentPlayer();
        state.push(new Frame.StepFrame(Frame.Step.END_TURN, player));
        if (active.hasStatus(StatusCondition.CONFUSED) && !state.getRng().coinFlip()) {
            log.debug("Player {}: {} is confused and the attack failed", player, active.getName());
            return;
        }
        Attack attack = active.getCard().getAttacks().get(attackIndex);
        state.setAttack(new AttackContext(player, active.getInstanceId(), attackIndex, attack.getDamage()));
        state.push(new Frame.StepFrame(Frame.Step.KNOCKOUT_CHECK, player));
        state.push(new Frame.StepFrame(Frame.Step.DAMAGE_DEALT_TRIGGERS, player));
        state.push(new Frame.StepFrame(Frame.Step.DEFENDER_REACTIONS, player));
        state.push(new Frame.StepFrame(Frame.Step.DEAL_ATTACK_DAMAGE, player));
        if (attack.hasEffect()) {
            state.push(new Frame.EffectFrame(attack.getEffect(), player, active.getInstanceId()));
        }
        log.debug("Player {}: {} uses {}", player, active.getName(), attack.getName());
    }

    /**
     * Final damage of an attack after bonuses, weakness and reductions.
     */
    public static int computeAttackDamage(RulesConfig rules, CardInstance attacker, CardInstance defender,
                                          int baseDamage) {
        int damage = baseDamage;
        if (attacker != null) {
            damage += attacker.passiveTotal(PassiveKind.DAMAGE_BONUS);
            damage += attacker.modifierTotal(ModifierKind.DAMAGE_BOOST);
            if (defender.getCard().getWeakness() != null
                    && defender.getCard().getWeakness() == attacker.getCard().getEnergyType()) {
                damage += rules.getWeaknessBonus();
            }
        }
        damage -= defender.passiveTotal(PassiveKind.DAMAGE_REDUCTION);
        damage -= defender.modifierTotal(ModifierKind.DAMAGE_REDUCTION);
        if (defender.hasModifier(ModifierKind.INVULNERABLE)) {
            damage = 0;
        }
        return Math.max(0, damage);
    }

    private static void dealAttackDamage(MatchState state) {
        AttackContext attack = state.getAttack();
        if (attack == null || attack.getDamage() <= 0) {
            return;
        }
        PlayerState attackerSide = state.getPlayer(attack.getAttacker());
        CardInstance defender = state.getPlayer(1 - attack.getAttacker()).getActive();
        if (defender == null) {
            return;
        }
        int attackerSlot = attackerSide.slotOf(attack.getAttackerInstanceId());
        CardInstance attacker = attackerSlot >= 0 ? attackerSide.getInPlay(attackerSlot) : null;
        int damage = computeAttackDamage(state.getRules(), attacker, defender, attack.getDamage());
        defender.addDamage(damage);
        attack.recordHit(defender.getInstanceId(), damage);
        log.debug("{} takes {} damage ({} HP left)", defender.getName(), damage, defender.getRemainingHp());
    }

    private static void pushDefenderReactions(MatchState state) {
        AttackContext attack = state.getAttack();
        if (attack == null || attack.getDamageDealt() <= 0) {
            return;
        }
        int owner = 1 - attack.getAttacker();
        PlayerState defenderSide = state.getPlayer(owner);
        int slot = defenderSide.slotOf(attack.getDefenderInstanceId());
        if (slot < 0) {
            return;
        }
        CardInstance defender = defenderSide.getInPlay(slot);
        List<Trigger> triggers = defender.getTriggers(TriggerEvent.ON_DAMAGED);
        for (int i = triggers.size() - 1; i >= 0; i--) {
            state.push(new Frame.EffectFrame(triggers.get(i).effect(), owner, defender.getInstanceId()));
        }
    }

    private static void pushDamageDealtTriggers(MatchState state) {
        AttackContext attack = state.getAttack();
        if (attack == null || attack.getDamageDealt() <= 0) {
            return;
        }
        // Pushed defender first so the attacker's side resolves first
        pushTriggers(state, 1 - attack.getAttacker(), TriggerEvent.ON_DAMAGE_DEALT);
        pushTriggers(state, attack.getAttacker(), TriggerEvent.ON_DAMAGE_DEALT);
    }

    /**
     * Push every trigger of a player's board for {@code event} so that they
     * resolve in slot order, active first.
     */
    private static void pushTriggers(MatchState state, int player, TriggerEvent event) {
        PlayerState ps = state.getPlayer(player);
        List<Integer> slots = ps.occupiedSlots();
        for (int s = slots.size() - 1; s >= 0; s--) {
            CardInstance instance = ps.getInPlay(slots.get(s));
            List<Trigger> triggers = instance.getTriggers(event);
            for (int i = triggers.size() - 1; i >= 0; i--) {
                state.push(new Frame.EffectFrame(triggers.get(i).effect(), player, instance.getInstanceId()));
            }
        }
    }

    // ==================== KNOCKOUTS ====================

    /**
     * Remove every knocked-out Pokémon, award points, then either end the
     * match or schedule the promotions that must happen before play goes on.
     */
    public static void knockoutCheck(MatchState state) {
        state.setPhase(Phase.KNOCKOUT_CHECK);
        AttackContext attack = state.getAttack();
        int current = state.getCurrentPlayer();
        List<Frame.EffectFrame> knockoutTriggers = new ArrayList<>();
        for (int player : new int[] {current, 1 - current}) {
            PlayerState ps = state.getPlayer(player);
            for (int slot : ps.occupiedSlots()) {
                CardInstance instance = ps.getInPlay(slot);
                if (!instance.isKnockedOut()) {
                    continue;
                }
                if (attack != null && attack.getDefenderInstanceId() == instance.getInstanceId()) {
                    for (Trigger trigger : instance.getTriggers(TriggerEvent.ON_KNOCKED_OUT)) {
                        knockoutTriggers.add(new Frame.EffectFrame(trigger.effect(), player,
                            Frame.EffectFrame.NO_SOURCE));
                    }
                }
                knockOut(state, player, slot);
            }
        }
        if (checkWinCondition(state)) {
            return;
        }
        if (!knockoutTriggers.isEmpty()) {
            state.push(new Frame.StepFrame(Frame.Step.KNOCKOUT_CHECK, current));
            for (int i = knockoutTriggers.size() - 1; i >= 0; i--) {
                state.push(knockoutTriggers.get(i));
            }
            return;
        }
        // The player not on turn promotes first
        for (int player : new int[] {current, 1 - current}) {
            PlayerState ps = state.getPlayer(player);
            if (!ps.hasActive() && !ps.getBench().isEmpty()) {
                state.push(new Frame.StepFrame(Frame.Step.PROMOTE, player));
            }
        }
    }

    private static void knockOut(MatchState state, int player, int slot) {
        PlayerState owner = state.getPlayer(player);
        CardInstance instance = owner.getInPlay(slot);
        owner.setInPlay(slot, null);
        owner.getDiscard().addAll(instance.allCards());
        int points = instance.getCard().getPrizeValue();
        state.getPlayer(1 - player).scorePoints(points);
        state.record(MatchEvent.Type.KNOCKOUT, player, 0, instance.getName());
        state.record(MatchEvent.Type.PRIZE_AWARDED, 1 - player, points, instance.getName());
        log.debug("Player {}: {} knocked out, player {} scores {}", player, instance.getName(), 1 - player, points);
    }

    /**
     * End the match if a player has scored out or has no Pokémon left.
     * @return true if the match is now over
     */
    public static boolean checkWinCondition(MatchState state) {
        PlayerState a = state.getPlayer(MatchState.PLAYER_A);
        PlayerState b = state.getPlayer(MatchState.PLAYER_B);
        boolean aWins = a.getPrizePoints() == 0 || !b.hasPokemonInPlay();
        boolean bWins = b.getPrizePoints() == 0 || !a.hasPokemonInPlay();
        if (!aWins && !bWins) {
            return false;
        }
        MatchResult result = aWins && bWins ? MatchResult.DRAW
            : aWins ? MatchResult.PLAYER_A : MatchResult.PLAYER_B;
        endMatch(state, result, "knockout");
        return true;
    }

    private static void requestPromotion(MatchState state, int player) {
        PlayerState ps = state.getPlayer(player);
        if (ps.hasActive() || ps.getBench().isEmpty()) {
            return;
        }
        List<Integer> positions = ps.getBench().occupiedPositions();
        state.setPendingChoice(new PendingChoice(PendingChoice.Kind.PROMOTE, player, positions, null));
    }

    /**
     * Move a benched Pokémon into the empty active spot.
     */
    public static void promote(MatchState state, int player, int benchPosition) {
        PlayerState ps = state.getPlayer(player);
        ps.setActive(ps.getBench().remove(benchPosition));
        state.clearPendingChoice();
        log.debug("Player {} promotes {}", player, ps.getActive().getName());
    }

    public static void endMatch(MatchState state, MatchResult result, String reason) {
        state.setResult(result);
        state.setPhase(Phase.TERMINAL);
        state.clearStack();
        state.clearPendingChoice();
        state.setAttack(null);
        state.record(MatchEvent.Type.MATCH_ENDED, state.getCurrentPlayer(), 0, result + " by " + reason);
        log.debug("Match over after turn {}: {} ({})", state.getTurnNumber(), result, reason);
    }

    // ==================== TURN BOUNDARIES ====================

    /**
     * Checkup between turns, then schedule knockouts and the next turn.
     */
    public static void endOfTurn(MatchState state) {
        state.setPhase(Phase.END_OF_TURN);
        state.setAttack(null);
        state.setEndTurnRequested(false);
        int current = state.getCurrentPlayer();
        PlayerState ps = state.getCurrent();
        ps.getEnergyZone().discardCurrent();

        checkup(state, current);
        checkup(state, 1 - current);
        if (ps.hasActive()) {
            ps.getActive().removeStatus(StatusCondition.PARALYZED);
        }
        for (int player = MatchState.PLAYER_A; player <= MatchState.PLAYER_B; player++) {
            PlayerState each = state.getPlayer(player);
            for (int slot : each.occupiedSlots()) {
                each.getInPlay(slot).expireModifiers(state.getTurnNumber());
            }
        }
        if (state.getRules().getOncePerTurnReset() == RulesConfig.ResetPoint.END_OF_TURN) {
            ps.resetTurnFlags();
        }

        // Checkup knockouts are settled before any between-turns trigger sees the board
        state.push(new Frame.StepFrame(Frame.Step.NEXT_TURN, current));
        state.push(new Frame.StepFrame(Frame.Step.KNOCKOUT_CHECK, current));
        state.push(new Frame.StepFrame(Frame.Step.BETWEEN_TURNS_TRIGGERS, current));
        state.push(new Frame.StepFrame(Frame.Step.KNOCKOUT_CHECK, current));
    }

    /**
     * Status effects on one active: poison, then burn with a recovery flip,
     * then a wake-up flip for sleep.
     */
    private static void checkup(MatchState state, int player) {
        CardInstance active = state.getPlayer(player).getActive();
        if (active == null) {
            return;
        }
        RulesConfig rules = state.getRules();
        GameRng rng = state.getRng();
        if (active.hasStatus(StatusCondition.POISONED)) {
            active.addDamage(rules.getPoisonDamage());
        }
        if (active.hasStatus(StatusCondition.BURNED)) {
            active.addDamage(rules.getBurnDamage());
            if (rng.coinFlip()) {
                active.removeStatus(StatusCondition.BURNED);
            }
        }
        if (active.hasStatus(StatusCondition.ASLEEP) && rng.coinFlip()) {
            active.removeStatus(StatusCondition.ASLEEP);
        }
    }

    private static void nextTurn(MatchState state) {
        if (state.getTurnNumber() >= state.getRules().getMaxTurns()) {
            endMatch(state, MatchResult.DRAW, "turn limit");
            return;
        }
        state.setCurrentPlayer(1 - state.getCurrentPlayer());
        beginTurn(state);
    }

    /**
     * Start of turn: reset flags, draw, generate energy, open the main phase.
     */
    public static void beginTurn(MatchState state) {
        state.incrementTurn();
        state.resetActionsThisTurn();
        state.setEndTurnRequested(false);
        state.setPhase(Phase.START_OF_TURN);
        int player = state.getCurrentPlayer();
        PlayerState ps = state.getCurrent();
        ps.incrementTurnsTaken();
        if (state.getRules().getOncePerTurnReset() == RulesConfig.ResetPoint.START_OF_TURN) {
            ps.resetTurnFlags();
        }

        if (ps.getDeck().isEmpty()) {
            state.record(MatchEvent.Type.DECK_OUT, player, 0, "empty deck at draw");
            if (state.getRules().getDeckOutPolicy() == RulesConfig.DeckOutPolicy.LOSE) {
                endMatch(state, MatchResult.winner(1 - player), "deck out");
                return;
            }
        } else if (ps.getHand().size() < state.getRules().getHandLimit()) {
            ps.getHand().add(ps.getDeck().draw());
        }

        state.setPhase(Phase.ENERGY_GENERATION);
        // The player going first gets no energy on the very first turn
        if (state.getTurnNumber() > 1) {
            ps.getEnergyZone().generate(state.getRng());
        }
        state.setPhase(Phase.MAIN);
        log.debug("Turn {} begins for player {}", state.getTurnNumber(), player);
    }
}
