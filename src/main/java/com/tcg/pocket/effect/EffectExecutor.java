package com.tcg.pocket.effect;

import com.tcg.pocket.card.Card;
import com.tcg.pocket.card.EnergyType;
import com.tcg.pocket.game.AttackContext;
import com.tcg.pocket.game.Frame;
import com.tcg.pocket.game.MatchEvent;
import com.tcg.pocket.game.MatchState;
import com.tcg.pocket.game.PendingChoice;
import com.tcg.pocket.game.PlayerState;
import com.tcg.pocket.game.zones.CardInstance;
import com.tcg.pocket.game.zones.TurnModifier;
import com.tcg.pocket.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Resolves effect frames against a match.
 *
 * Composite primitives never recurse: they push their children onto the
 * match's resolution stack, so nested effects resolve last-in first-out and a
 * child that needs a choice can suspend without losing its siblings.
 *
 * Rng draws happen in a fixed order: coin flips one draw each in flip order,
 * random card picks one draw per card, shuffles as Fisher-Yates from the last
 * index down.
 */
public final class EffectExecutor {
    private static final Logger log = LoggerFactory.getLogger(EffectExecutor.class);

    private static final Predicate<CardInstance> ANY = instance -> true;

    private EffectExecutor() {
        // Utility class - prevent instantiation
    }

    /**
     * Resolve one frame. The frame must already be popped from the stack.
     *
     * @return APPLIED, FIZZLED (no-op, recorded as an event), or SUSPENDED
     *         (a pending choice holding this frame has been set)
     */
    public static EffectOutcome resolve(Frame.EffectFrame frame, MatchState state, GameRng rng) {
        Effect effect = frame.effect();
        if (effect instanceof Effect.Damage damage) {
            return resolveDamage(frame, damage, state);
        } else if (effect instanceof Effect.BonusDamage bonus) {
            return resolveAttackDamage(frame, state, bonus.amount(), false);
        } else if (effect instanceof Effect.SetDamage set) {
            return resolveAttackDamage(frame, state, set.amount(), true);
        } else if (effect instanceof Effect.Heal heal) {
            return resolveHeal(frame, heal, state);
        } else if (effect instanceof Effect.ApplyStatus apply) {
            return resolveApplyStatus(frame, apply, state);
        } else if (effect instanceof Effect.CureStatus cure) {
            return resolveCureStatus(frame, cure, state);
        } else if (effect instanceof Effect.AttachEnergy attach) {
            return resolveAttachEnergy(frame, attach, state);
        } else if (effect instanceof Effect.MoveEnergy move) {
            return resolveMoveEnergy(frame, move, state);
        } else if (effect instanceof Effect.DiscardEnergy discard) {
            return resolveDiscardEnergy(frame, discard, state);
        } else if (effect instanceof Effect.MoveCards move) {
            return resolveMoveCards(frame, move, state, rng);
        } else if (effect instanceof Effect.Draw draw) {
            return resolveDraw(frame, draw, state);
        } else if (effect instanceof Effect.ShuffleDeck shuffle) {
            state.getPlayer(shuffle.side().resolve(frame.controller())).getDeck().shuffle(rng);
            return EffectOutcome.APPLIED;
        } else if (effect instanceof Effect.CoinFlip flip) {
            return resolveCoinFlip(frame, flip, state, rng);
        } else if (effect instanceof Effect.Scaled scaled) {
            return resolveScaled(frame, scaled, state, rng);
        } else if (effect instanceof Effect.Conditional conditional) {
            return resolveConditional(frame, conditional, state);
        } else if (effect instanceof Effect.Sequence sequence) {
            List<Effect> children = sequence.effects();
            for (int i = children.size() - 1; i >= 0; i--) {
                state.push(frame.child(children.get(i)));
            }
            return EffectOutcome.APPLIED;
        } else if (effect instanceof Effect.SwitchActive switchActive) {
            return resolveSwitchActive(frame, switchActive, state);
        } else if (effect instanceof Effect.Modifier modifier) {
            return resolveModifier(frame, modifier, state);
        } else if (effect instanceof Effect.EndTurn) {
            state.setEndTurnRequested(true);
            return EffectOutcome.APPLIED;
        } else if (effect instanceof Effect.Unique unique) {
            return resolveUnique(frame, unique, state, rng);
        }
        throw new IllegalStateException("Unhandled effect: " + effect);
    }

    /**
     * Cheap precondition check used by the legality mask for trainers and
     * abilities, so cards whose first step can only fizzle are not offered.
     * A {@code sourceInstanceId} of {@link Frame.EffectFrame#NO_SOURCE} means
     * the effect belongs to a trainer card that is about to leave the hand.
     */
    public static boolean isPlayable(Effect effect, MatchState state, int controller, int sourceInstanceId) {
        if (effect instanceof Effect.Sequence sequence) {
            return isPlayable(sequence.effects().get(0), state, controller, sourceInstanceId);
        }
        if (effect instanceof Effect.Heal heal) {
            for (BoardRef ref : reachable(state, controller, sourceInstanceId, heal.target())) {
                if (instanceAt(state, ref).isDamaged()) {
                    return true;
                }
            }
            return false;
        }
        if (effect instanceof Effect.SwitchActive switchActive) {
            return !state.getPlayer(switchActive.side().resolve(controller)).getBench().isEmpty();
        }
        if (effect instanceof Effect.MoveCards move && move.from() != Zone.HAND) {
            int owner = move.side().resolve(controller);
            PlayerState player = state.getPlayer(owner);
            if (matchingIndices(player, move.from(), move.filter()).isEmpty()) {
                return false;
            }
            // A trainer is still in its controller's hand here but leaves it before resolving
            if (move.to() == Zone.HAND && owner == controller
                    && sourceInstanceId == Frame.EffectFrame.NO_SOURCE) {
                return player.getHand().size() - 1 < state.getRules().getHandLimit();
            }
            return hasRoom(state, player, move.to());
        }
        return true;
    }

    // ==================== TARGETING ====================

    /**
     * Every board slot a selector can reach, ignoring choices.
     */
    static List<BoardRef> reachable(MatchState state, int controller, int sourceInstanceId, Target target) {
        int player = target.getSide().resolve(controller);
        PlayerState board = state.getPlayer(player);
        List<BoardRef> refs = new ArrayList<>(board.boardSlots());
        switch (target) {
            case SELF -> {
                int slot = sourceInstanceId == Frame.EffectFrame.NO_SOURCE
                    ? (board.hasActive() ? PlayerState.ACTIVE_SLOT : -1)
                    : board.slotOf(sourceInstanceId);
                if (slot >= 0) {
                    refs.add(new BoardRef(player, slot));
                }
            }
            case OWN_ACTIVE, OPPONENT_ACTIVE -> {
                if (board.hasActive()) {
                    refs.add(new BoardRef(player, PlayerState.ACTIVE_SLOT));
                }
            }
            default -> {
                for (int slot : board.occupiedSlots()) {
                    if (slot != PlayerState.ACTIVE_SLOT || !target.benchOnly()) {
                        refs.add(new BoardRef(player, slot));
                    }
                }
            }
        }
        return refs;
    }

    /**
     * Resolve a selector to board slots. A chosen selector without an answer
     * records a pending choice over the slots passing {@code choosable} and
     * returns null; with no such slot it returns an empty list.
     */
    static List<BoardRef> selectTargets(MatchState state, Frame.EffectFrame frame, Target target,
                                        Predicate<CardInstance> choosable) {
        List<BoardRef> reachable = reachable(state, frame.controller(), frame.sourceInstanceId(), target);
        if (!target.isChosen()) {
            return reachable;
        }
        if (frame.hasChoice()) {
            for (BoardRef ref : reachable) {
                if (ref.slot() == frame.chosen() && choosable.test(instanceAt(state, ref))) {
                    return List.of(ref);
                }
            }
            return List.of();
        }
        List<Integer> candidates = new ArrayList<>(reachable.size());
        for (BoardRef ref : reachable) {
            if (choosable.test(instanceAt(state, ref))) {
                candidates.add(ref.slot());
            }
        }
        if (candidates.isEmpty()) {
            return List.of();
        }
        PendingChoice.Kind kind = target.getSide() == Side.OWN
            ? PendingChoice.Kind.OWN_TARGET
            : PendingChoice.Kind.OPPONENT_TARGET;
        state.setPendingChoice(new PendingChoice(kind, frame.controller(), candidates, frame));
        return null;
    }

    private static boolean isActive(MatchState state, CardInstance instance) {
        return state.getPlayer(MatchState.PLAYER_A).getActive() == instance
            || state.getPlayer(MatchState.PLAYER_B).getActive() == instance;
    }

    static CardInstance instanceAt(MatchState state, BoardRef ref) {
        return state.getPlayer(ref.player()).getInPlay(ref.slot());
    }

    private static EffectOutcome fizzle(MatchState state, Frame.EffectFrame frame, String reason) {
        String kind = frame.effect().getClass().getSimpleName();
        log.debug("Effect {} of player {} fizzled: {}", kind, frame.controller(), reason);
        state.record(MatchEvent.Type.EFFECT_FIZZLED, frame.controller(), 0, kind + ": " + reason);
        return EffectOutcome.FIZZLED;
    }

    // ==================== DAMAGE AND HEALING ====================

    private static EffectOutcome resolveDamage(Frame.EffectFrame frame, Effect.Damage damage, MatchState state) {
        List<BoardRef> refs = selectTargets(state, frame, damage.target(), ANY);
        if (refs == null) {
            return EffectOutcome.SUSPENDED;
        }
        if (refs.isEmpty()) {
            return fizzle(state, frame, "no damage target");
        }
        for (BoardRef ref : refs) {
            instanceAt(state, ref).addDamage(damage.amount());
        }
        return EffectOutcome.APPLIED;
    }

    private static EffectOutcome resolveAttackDamage(Frame.EffectFrame frame, MatchState state,
                                                     int amount, boolean replace) {
        AttackContext attack = state.getAttack();
        if (attack == null || attack.getAttackerInstanceId() != frame.sourceInstanceId()) {
            return fizzle(state, frame, "no attack of this Pokémon is resolving");
        }
        if (replace) {
            attack.setDamage(amount);
        } else {
            attack.addDamage(amount);
        }
        return EffectOutcome.APPLIED;
    }

    private static EffectOutcome resolveHeal(Frame.EffectFrame frame, Effect.Heal heal, MatchState state) {
        List<BoardRef> refs = selectTargets(state, frame, heal.target(), CardInstance::isDamaged);
        if (refs == null) {
            return EffectOutcome.SUSPENDED;
        }
        int healed = 0;
        for (BoardRef ref : refs) {
            healed += instanceAt(state, ref).heal(heal.amount());
        }
        if (healed == 0) {
            return fizzle(state, frame, "nothing to heal");
        }
        return EffectOutcome.APPLIED;
    }

    // ==================== STATUS ====================

    private static EffectOutcome resolveApplyStatus(Frame.EffectFrame frame, Effect.ApplyStatus apply,
                                                    MatchState state) {
        List<BoardRef> refs = selectTargets(state, frame, apply.target(),
            instance -> isActive(state, instance));
        if (refs == null) {
            return EffectOutcome.SUSPENDED;
        }
        boolean applied = false;
        for (BoardRef ref : refs) {
            // Only the active spot can hold a status condition
            if (ref.slot() == PlayerState.ACTIVE_SLOT) {
                instanceAt(state, ref).addStatus(apply.status());
                applied = true;
            }
        }
        if (!applied) {
            return fizzle(state, frame, "no active Pokémon to become " + apply.status());
        }
        return EffectOutcome.APPLIED;
    }

    private static EffectOutcome resolveCureStatus(Frame.EffectFrame frame, Effect.CureStatus cure,
                                                   MatchState state) {
        List<BoardRef> refs = selectTargets(state, frame, cure.target(),
            instance -> !instance.getStatuses().isEmpty());
        if (refs == null) {
            return EffectOutcome.SUSPENDED;
        }
        if (refs.isEmpty()) {
            return fizzle(state, frame, "no Pokémon to cure");
        }
        for (BoardRef ref : refs) {
            instanceAt(state, ref).clearStatuses();
        }
        return EffectOutcome.APPLIED;
    }

    // ==================== ENERGY ====================

    private static EffectOutcome resolveAttachEnergy(Frame.EffectFrame frame, Effect.AttachEnergy attach,
                                                     MatchState state) {
        List<BoardRef> refs = selectTargets(state, frame, attach.target(), ANY);
        if (refs == null) {
            return EffectOutcome.SUSPENDED;
        }
        if (refs.isEmpty()) {
            return fizzle(state, frame, "no Pokémon to attach energy to");
        }
        for (BoardRef ref : refs) {
            instanceAt(state, ref).attachEnergy(attach.energy(), attach.count());
        }
        return EffectOutcome.APPLIED;
    }

    private static Predicate<CardInstance> hasEnergy(EnergyType type) {
        return type == null
            ? instance -> instance.getTotalEnergy() > 0
            : instance -> instance.getEnergy(type) > 0;
    }

    private static EffectOutcome resolveMoveEnergy(Frame.EffectFrame frame, Effect.MoveEnergy move,
                                                   MatchState state) {
        List<BoardRef> sources = selectTargets(state, frame, move.from(), hasEnergy(move.energy()));
        if (sources == null) {
            return EffectOutcome.SUSPENDED;
        }
        if (sources.isEmpty()) {
            return fizzle(state, frame, "no energy to move");
        }
        BoardRef sourceRef = sources.get(0);
        List<BoardRef> destinations = selectTargets(state, frame, move.to(),
            instance -> !instance.equals(instanceAt(state, sourceRef)));
        if (destinations == null) {
            return EffectOutcome.SUSPENDED;
        }
        if (destinations.isEmpty() || destinations.get(0).equals(sourceRef)) {
            return fizzle(state, frame, "no Pokémon to move energy to");
        }
        CardInstance from = instanceAt(state, sourceRef);
        CardInstance to = instanceAt(state, destinations.get(0));
        int moved;
        if (move.energy() == null) {
            List<EnergyType> removed = from.removeAnyEnergy(move.all() ? from.getTotalEnergy() : move.count());
            for (EnergyType type : removed) {
                to.attachEnergy(type, 1);
            }
            moved = removed.size();
        } else {
            int wanted = move.all() ? from.getEnergy(move.energy()) : move.count();
            moved = from.removeEnergy(move.energy(), wanted);
            to.attachEnergy(move.energy(), moved);
        }
        if (moved == 0) {
            return fizzle(state, frame, "no energy to move");
        }
        return EffectOutcome.APPLIED;
    }

    private static EffectOutcome resolveDiscardEnergy(Frame.EffectFrame frame, Effect.DiscardEnergy discard,
                                                      MatchState state) {
        List<BoardRef> refs = selectTargets(state, frame, discard.target(), hasEnergy(discard.energy()));
        if (refs == null) {
            return EffectOutcome.SUSPENDED;
        }
        int removed = 0;
        for (BoardRef ref : refs) {
            CardInstance instance = instanceAt(state, ref);
            if (discard.energy() == null) {
                int wanted = discard.all() ? instance.getTotalEnergy() : discard.count();
                removed += instance.removeAnyEnergy(wanted).size();
            } else {
                int wanted = discard.all() ? instance.getEnergy(discard.energy()) : discard.count();
                removed += instance.removeEnergy(discard.energy(), wanted);
            }
        }
        if (removed == 0) {
            return fizzle(state, frame, "no energy to discard");
        }
        return EffectOutcome.APPLIED;
    }

    // ==================== CARDS AND ZONES ====================

    /**
     * Indices of matching cards in pick order: deck top first, hand in order,
     * discard most recent first.
     */
    private static List<Integer> matchingIndices(PlayerState player, Zone zone, CardFilter filter) {
        List<Card> cards = switch (zone) {
            case DECK -> player.getDeck().getCards();
            case HAND -> player.getHand().getCards();
            case DISCARD -> player.getDiscard().getCards();
            case BENCH -> List.of();
        };
        List<Integer> indices = new ArrayList<>();
        if (zone == Zone.DISCARD) {
            for (int i = cards.size() - 1; i >= 0; i--) {
                if (filter.matches(cards.get(i))) {
                    indices.add(i);
                }
            }
        } else {
            for (int i = 0; i < cards.size(); i++) {
                if (filter.matches(cards.get(i))) {
                    indices.add(i);
                }
            }
        }
        return indices;
    }

    private static boolean hasRoom(MatchState state, PlayerState player, Zone zone) {
        return switch (zone) {
            case HAND -> player.getHand().size() < state.getRules().getHandLimit();
            case BENCH -> !player.getBench().isFull();
            case DECK, DISCARD -> true;
        };
    }

    private static Card takeFrom(PlayerState player, Zone zone, int index) {
        return switch (zone) {
            case DECK -> player.getDeck().removeAt(index);
            case HAND -> player.getHand().remove(index);
            case DISCARD -> player.getDiscard().remove(index);
            case BENCH -> throw new IllegalArgumentException("Cannot take cards from the bench");
        };
    }

    private static void putInto(MatchState state, PlayerState player, Zone zone, Card card) {
        switch (zone) {
            case DECK -> player.getDeck().putOnBottom(card);
            case HAND -> player.getHand().add(card);
            case DISCARD -> player.getDiscard().add(card);
            case BENCH -> {
                int position = player.getBench().firstEmpty();
                player.getBench().set(position,
                    new CardInstance(state.nextInstanceId(), (Card.Pokemon) card, state.getTurnNumber()));
            }
        }
    }

    private static EffectOutcome resolveMoveCards(Frame.EffectFrame frame, Effect.MoveCards move,
                                                  MatchState state, GameRng rng) {
        PlayerState player = state.getPlayer(move.side().resolve(frame.controller()));
        if (move.selection() == Selection.CHOSEN) {
            return resolveChosenMove(frame, move, state, player);
        }
        int wanted = move.all() ? Integer.MAX_VALUE : move.count();
        int moved = 0;
        while (moved < wanted && hasRoom(state, player, move.to())) {
            List<Integer> matches = matchingIndices(player, move.from(), move.filter());
            if (matches.isEmpty()) {
                break;
            }
            int index = move.selection() == Selection.RANDOM
                ? matches.get(rng.nextInt(matches.size()))
                : matches.get(0);
            putInto(state, player, move.to(), takeFrom(player, move.from(), index));
            moved++;
        }
        if (moved == 0) {
            return fizzle(state, frame, "no " + move.filter() + " card to move from " + move.from());
        }
        return EffectOutcome.APPLIED;
    }

    private static EffectOutcome resolveChosenMove(Frame.EffectFrame frame, Effect.MoveCards move,
                                                   MatchState state, PlayerState player) {
        List<Integer> matches = matchingIndices(player, Zone.HAND, move.filter());
        if (matches.isEmpty() || !hasRoom(state, player, move.to())) {
            return fizzle(state, frame, "no matching card in hand");
        }
        if (!frame.hasChoice()) {
            state.setPendingChoice(new PendingChoice(PendingChoice.Kind.HAND_CARD, frame.controller(), matches, frame));
            return EffectOutcome.SUSPENDED;
        }
        if (!matches.contains(frame.chosen())) {
            return fizzle(state, frame, "chosen card no longer matches");
        }
        putInto(state, player, move.to(), takeFrom(player, Zone.HAND, frame.chosen()));
        if (move.count() > 1) {
            state.push(frame.child(new Effect.MoveCards(move.side(), move.from(), move.to(), move.count() - 1,
                false, move.filter(), move.selection())));
        }
        return EffectOutcome.APPLIED;
    }

    private static EffectOutcome resolveDraw(Frame.EffectFrame frame, Effect.Draw draw, MatchState state) {
        PlayerState player = state.getPlayer(draw.side().resolve(frame.controller()));
        int drawn = 0;
        while (drawn < draw.count()
                && !player.getDeck().isEmpty()
                && player.getHand().size() < state.getRules().getHandLimit()) {
            player.getHand().add(player.getDeck().draw());
            drawn++;
        }
        if (drawn == 0) {
            return fizzle(state, frame, "cannot draw");
        }
        return EffectOutcome.APPLIED;
    }

    // ==================== COMPOSITES ====================

    private static EffectOutcome resolveCoinFlip(Frame.EffectFrame frame, Effect.CoinFlip flip,
                                                 MatchState state, GameRng rng) {
        int heads = rng.coinFlips(flip.flips());
        boolean allHeads = heads == flip.flips();
        log.debug("Player {} flipped {} heads out of {}", frame.controller(), heads, flip.flips());
        Effect branch = allHeads ? flip.onHeads() : flip.onTails();
        if (branch != null) {
            state.push(frame.child(branch));
        }
        return EffectOutcome.APPLIED;
    }

    private static EffectOutcome resolveScaled(Frame.EffectFrame frame, Effect.Scaled scaled,
                                               MatchState state, GameRng rng) {
        int times = count(scaled.counter(), frame, state, rng);
        for (int i = 0; i < times; i++) {
            state.push(frame.child(scaled.effect()));
        }
        return EffectOutcome.APPLIED;
    }

    private static EffectOutcome resolveConditional(Frame.EffectFrame frame, Effect.Conditional conditional,
                                                    MatchState state) {
        Effect branch = holds(conditional.condition(), frame, state) ? conditional.then() : conditional.otherwise();
        if (branch != null) {
            state.push(frame.child(branch));
        }
        return EffectOutcome.APPLIED;
    }

    static int count(Counter counter, Frame.EffectFrame frame, MatchState state, GameRng rng) {
        PlayerState side = state.getPlayer(counter.side().resolve(frame.controller()));
        switch (counter.kind()) {
            case COIN_HEADS:
                return rng.coinFlips(counter.flips());
            case HEADS_UNTIL_TAILS:
                return rng.flipsUntilTails(Counter.MAX_FLIPS);
            case BENCH_SIZE:
                return side.getBench().count();
            case HAND_SIZE:
                return side.getHand().size();
            case ENERGY_ATTACHED: {
                int total = 0;
                for (BoardRef ref : reachable(state, frame.controller(), frame.sourceInstanceId(), counter.target())) {
                    CardInstance instance = instanceAt(state, ref);
                    total += counter.energy() == null ? instance.getTotalEnergy() : instance.getEnergy(counter.energy());
                }
                return total;
            }
            case DAMAGE_COUNTERS: {
                int total = 0;
                for (BoardRef ref : reachable(state, frame.controller(), frame.sourceInstanceId(), counter.target())) {
                    total += instanceAt(state, ref).getDamage() / 10;
                }
                return total;
            }
            default:
                throw new IllegalStateException("Unhandled counter: " + counter.kind());
        }
    }

    static boolean holds(Condition condition, Frame.EffectFrame frame, MatchState state) {
        if (condition.kind() == ConditionKind.BENCH_AT_LEAST) {
            PlayerState side = state.getPlayer(condition.side().resolve(frame.controller()));
            return side.getBench().count() >= condition.amount();
        }
        List<BoardRef> refs = reachable(state, frame.controller(), frame.sourceInstanceId(), condition.target());
        if (refs.isEmpty()) {
            return false;
        }
        CardInstance instance = instanceAt(state, refs.get(0));
        return switch (condition.kind()) {
            case DAMAGED -> instance.isDamaged();
            case HAS_STATUS -> instance.hasStatus(condition.status());
            case IS_EX -> instance.getCard().isEx();
            case HAS_TOOL -> instance.hasTool();
            case ENERGY_AT_LEAST -> (condition.energy() == null
                ? instance.getTotalEnergy()
                : instance.getEnergy(condition.energy())) >= condition.amount();
            case BENCH_AT_LEAST -> throw new IllegalStateException("handled above");
        };
    }

    // ==================== BOARD ====================

    private static EffectOutcome resolveSwitchActive(Frame.EffectFrame frame, Effect.SwitchActive switchActive,
                                                     MatchState state) {
        int owner = switchActive.side().resolve(frame.controller());
        PlayerState player = state.getPlayer(owner);
        if (player.getBench().isEmpty()) {
            return fizzle(state, frame, "no benched Pokémon to switch in");
        }
        if (!frame.hasChoice()) {
            int chooser = switchActive.ownerChooses() ? owner : frame.controller();
            List<Integer> candidates = new ArrayList<>();
            for (int position : player.getBench().occupiedPositions()) {
                candidates.add(position + 1);
            }
            PendingChoice.Kind kind = chooser == owner
                ? PendingChoice.Kind.OWN_TARGET
                : PendingChoice.Kind.OPPONENT_TARGET;
            state.setPendingChoice(new PendingChoice(kind, chooser, candidates, frame));
            return EffectOutcome.SUSPENDED;
        }
        int slot = frame.chosen();
        if (slot <= PlayerState.ACTIVE_SLOT || player.getInPlay(slot) == null) {
            return fizzle(state, frame, "chosen bench slot is empty");
        }
        player.switchActive(slot - 1);
        return EffectOutcome.APPLIED;
    }

    private static EffectOutcome resolveModifier(Frame.EffectFrame frame, Effect.Modifier modifier,
                                                 MatchState state) {
        List<BoardRef> refs = selectTargets(state, frame, modifier.target(), ANY);
        if (refs == null) {
            return EffectOutcome.SUSPENDED;
        }
        if (refs.isEmpty()) {
            return fizzle(state, frame, "no Pokémon to modify");
        }
        int expires = expiryTurn(state, frame.controller(), modifier.expiry());
        for (BoardRef ref : refs) {
            instanceAt(state, ref).addModifier(new TurnModifier(modifier.modifier(), modifier.amount(), expires));
        }
        return EffectOutcome.APPLIED;
    }

    /**
     * Absolute last turn of a modifier. Turns alternate, so the opponent's
     * next turn is one or two turns away depending on whose turn it is now.
     */
    static int expiryTurn(MatchState state, int controller, Expiry expiry) {
        int turn = state.getTurnNumber();
        boolean ownTurn = controller == state.getCurrentPlayer();
        return switch (expiry) {
            case THIS_TURN -> turn;
            case OPPONENT_NEXT_TURN -> ownTurn ? turn + 1 : turn + 2;
            case OWN_NEXT_TURN -> ownTurn ? turn + 2 : turn + 1;
        };
    }

    // ==================== UNIQUE CARDS ====================

    private static EffectOutcome resolveUnique(Frame.EffectFrame frame, Effect.Unique unique,
                                               MatchState state, GameRng rng) {
        PlayerState player = state.getPlayer(frame.controller());
        if (Effect.Unique.COPYCAT.equals(unique.name())) {
            // Shuffle hand into deck, then draw as many cards as the opponent holds
            int target = Math.min(state.getPlayer(1 - frame.controller()).getHand().size(),
                state.getRules().getHandLimit());
            for (Card card : player.getHand().removeAll()) {
                player.getDeck().putOnBottom(card);
            }
            player.getDeck().shuffle(rng);
            for (int i = 0; i < target && !player.getDeck().isEmpty(); i++) {
                player.getHand().add(player.getDeck().draw());
            }
            return EffectOutcome.APPLIED;
        }
        // Pokémon Communication: swap a chosen Pokémon in hand with a random one from the deck
        List<Integer> inHand = matchingIndices(player, Zone.HAND, CardFilter.POKEMON);
        List<Integer> inDeck = matchingIndices(player, Zone.DECK, CardFilter.POKEMON);
        if (inHand.isEmpty() || inDeck.isEmpty()) {
            return fizzle(state, frame, "needs a Pokémon in both hand and deck");
        }
        if (!frame.hasChoice()) {
            state.setPendingChoice(new PendingChoice(PendingChoice.Kind.HAND_CARD, frame.controller(), inHand, frame));
            return EffectOutcome.SUSPENDED;
        }
        if (!inHand.contains(frame.chosen())) {
            return fizzle(state, frame, "chosen card is not a Pokémon");
        }
        Card fromHand = player.getHand().remove(frame.chosen());
        Card fromDeck = player.getDeck().removeAt(inDeck.get(rng.nextInt(inDeck.size())));
        player.getHand().add(fromDeck);
        player.getDeck().putOnBottom(fromHand);
        player.getDeck().shuffle(rng);
        return EffectOutcome.APPLIED;
    }
}
