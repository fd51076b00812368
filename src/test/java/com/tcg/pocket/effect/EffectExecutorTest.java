package com.tcg.pocket.effect;

import com.tcg.pocket.action.ActionApplier;
import com.tcg.pocket.action.ActionSpace;
import com.tcg.pocket.action.ActionType;
import com.tcg.pocket.action.LegalActions;
import com.tcg.pocket.card.Card;
import com.tcg.pocket.card.EnergyType;
import com.tcg.pocket.game.AttackContext;
import com.tcg.pocket.game.MatchEvent;
import com.tcg.pocket.game.MatchState;
import com.tcg.pocket.game.PendingChoice;
import com.tcg.pocket.game.Phase;
import com.tcg.pocket.game.StatusCondition;
import com.tcg.pocket.game.zones.CardInstance;
import com.tcg.pocket.game.zones.Deck;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tcg.pocket.TestMatches.giveHand;
import static com.tcg.pocket.TestMatches.mainPhase;
import static com.tcg.pocket.TestMatches.putActive;
import static com.tcg.pocket.TestMatches.putBench;
import static com.tcg.pocket.TestMatches.resolve;
import static com.tcg.pocket.TestMatches.stockDeck;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EffectExecutor primitives, composites and choices.
 */
class EffectExecutorTest {
    private static final int A = MatchState.PLAYER_A;
    private static final int B = MatchState.PLAYER_B;

    // ==================== DAMAGE AND HEALING ====================

    @Test
    void testDirectDamageIgnoresWeakness() {
        MatchState state = mainPhase();
        putActive(state, A, "t-003");
        CardInstance splashy = putActive(state, B, "t-004");

        resolve(state, new Effect.Damage(30, Target.OPPONENT_ACTIVE), A);

        assertEquals(30, splashy.getDamage(), "Direct damage is not an attack and skips weakness");
        assertEquals(Phase.MAIN, state.getPhase());
        assertTrue(state.isStackEmpty());
    }

    @Test
    void testHealOnFullHpFizzles() {
        MatchState state = mainPhase();
        CardInstance mon = putActive(state, A, "t-001");

        resolve(state, new Effect.Heal(20, Target.SELF), A, mon.getInstanceId());

        assertEquals(0, mon.getDamage());
        assertEquals(1, state.countEvents(MatchEvent.Type.EFFECT_FIZZLED), "A heal with nothing to heal fizzles");
        assertFalse(state.hasPendingChoice());
    }

    @Test
    void testChosenHealWithoutDamagedTargetFizzlesWithoutChoice() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        putBench(state, A, "t-004");

        resolve(state, new Effect.Heal(20, Target.CHOOSE_OWN), A);

        assertFalse(state.hasPendingChoice(), "No choice is offered when no candidate exists");
        assertEquals(1, state.countEvents(MatchEvent.Type.EFFECT_FIZZLED));
    }

    @Test
    void testChosenTargetSuspendsWithExactCandidates() {
        MatchState state = mainPhase();
        CardInstance active = putActive(state, A, "t-001");
        putBench(state, A, "t-004");
        CardInstance hurt = putBench(state, A, "t-003");
        active.addDamage(20);
        hurt.addDamage(10);

        resolve(state, new Effect.Heal(20, Target.CHOOSE_OWN), A);

        PendingChoice choice = state.getPendingChoice();
        assertNotNull(choice, "Healing a chosen Pokémon needs a choice");
        assertEquals(PendingChoice.Kind.OWN_TARGET, choice.kind());
        assertEquals(A, choice.chooser());
        assertEquals(List.of(0, 2), choice.candidates(), "Only damaged Pokémon are candidates");

        boolean[] mask = LegalActions.mask(state, A);
        for (int i = 0; i < mask.length; i++) {
            boolean expected = i == ActionSpace.encode(ActionType.CHOOSE_OWN_TARGET, 0)
                || i == ActionSpace.encode(ActionType.CHOOSE_OWN_TARGET, 2);
            assertEquals(expected, mask[i], "Unexpected mask bit " + i);
        }

        ActionApplier.apply(state, ActionSpace.encode(ActionType.CHOOSE_OWN_TARGET, 2));

        assertFalse(state.hasPendingChoice());
        assertEquals(0, hurt.getDamage());
        assertEquals(20, active.getDamage(), "The Pokémon not chosen keeps its damage");
        assertEquals(Phase.MAIN, state.getPhase());
    }

    @Test
    void testBonusDamageOutsideAttackFizzles() {
        MatchState state = mainPhase();
        CardInstance mon = putActive(state, A, "t-001");

        resolve(state, new Effect.BonusDamage(30), A, mon.getInstanceId());

        assertEquals(1, state.countEvents(MatchEvent.Type.EFFECT_FIZZLED));
    }

    @Test
    void testAttackDamageModifiers() {
        MatchState state = mainPhase();
        CardInstance mon = putActive(state, A, "t-001");
        putActive(state, B, "t-001");
        state.setAttack(new AttackContext(A, mon.getInstanceId(), 0, 20));

        resolve(state, new Effect.BonusDamage(30), A, mon.getInstanceId());
        assertEquals(50, state.getAttack().getDamage());

        resolve(state, new Effect.SetDamage(10), A, mon.getInstanceId());
        assertEquals(10, state.getAttack().getDamage(), "Set damage replaces earlier bonuses");
        assertEquals(0, state.countEvents(MatchEvent.Type.EFFECT_FIZZLED));
    }

    // ==================== STATUS AND ENERGY ====================

    @Test
    void testAttachEnergyToWholeBench() {
        MatchState state = mainPhase();
        CardInstance active = putActive(state, A, "t-001");
        CardInstance first = putBench(state, A, "t-004");
        CardInstance second = putBench(state, A, "t-003");

        resolve(state, new Effect.AttachEnergy(EnergyType.LIGHTNING, 1, Target.OWN_BENCH), A);

        assertEquals(0, active.getTotalEnergy());
        assertEquals(1, first.getEnergy(EnergyType.LIGHTNING));
        assertEquals(1, second.getEnergy(EnergyType.LIGHTNING));
    }

    @Test
    void testStatusOnlyLandsOnActive() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        CardInstance active = putActive(state, B, "t-001");
        CardInstance benched = putBench(state, B, "t-004");

        resolve(state, new Effect.ApplyStatus(StatusCondition.POISONED, Target.ALL_OPPONENT), A);

        assertTrue(active.hasStatus(StatusCondition.POISONED));
        assertTrue(benched.getStatuses().isEmpty(), "Benched Pokémon cannot hold a status condition");
    }

    @Test
    void testChosenStatusTargetIsActiveOnly() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        CardInstance active = putActive(state, B, "t-001");
        CardInstance benched = putBench(state, B, "t-004");

        resolve(state, new Effect.ApplyStatus(StatusCondition.POISONED, Target.CHOOSE_OPPONENT), A);

        assertEquals(List.of(0), state.getPendingChoice().candidates(), "Benched Pokémon are not offered");
        assertFalse(LegalActions.isLegal(state, ActionSpace.encode(ActionType.CHOOSE_OPPONENT_TARGET, 1)));

        ActionApplier.apply(state, ActionSpace.encode(ActionType.CHOOSE_OPPONENT_TARGET, 0));

        assertTrue(active.hasStatus(StatusCondition.POISONED));
        assertTrue(benched.getStatuses().isEmpty());
        assertEquals(0, state.countEvents(MatchEvent.Type.EFFECT_FIZZLED));
    }

    @Test
    void testCureStatus() {
        MatchState state = mainPhase();
        CardInstance active = putActive(state, A, "t-001");
        active.addStatus(StatusCondition.BURNED);

        resolve(state, new Effect.CureStatus(Target.OWN_ACTIVE), A);

        assertTrue(active.getStatuses().isEmpty());
    }

    @Test
    void testMoveEnergyToChosenBench() {
        MatchState state = mainPhase();
        CardInstance active = putActive(state, A, "t-001");
        CardInstance benched = putBench(state, A, "t-004");
        active.attachEnergy(EnergyType.WATER, 2);

        resolve(state, new Effect.MoveEnergy(null, 1, true, Target.OWN_ACTIVE, Target.CHOOSE_OWN_BENCH), A);
        assertEquals(List.of(1), state.getPendingChoice().candidates());

        ActionApplier.apply(state, ActionSpace.encode(ActionType.CHOOSE_OWN_TARGET, 1));

        assertEquals(0, active.getTotalEnergy());
        assertEquals(2, benched.getEnergy(EnergyType.WATER));
    }

    @Test
    void testDiscardEnergyWithNoneAttachedFizzles() {
        MatchState state = mainPhase();
        CardInstance mon = putActive(state, A, "t-003");

        resolve(state, new Effect.DiscardEnergy(EnergyType.FIRE, 1, false, Target.SELF), A, mon.getInstanceId());

        assertEquals(1, state.countEvents(MatchEvent.Type.EFFECT_FIZZLED));
    }

    // ==================== COMPOSITES ====================

    @Test
    void testCoinFlipUsesMatchRng() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        CardInstance target = putActive(state, B, "t-001");
        boolean heads = state.getRng().copy().coinFlip();

        resolve(state, new Effect.CoinFlip(1, new Effect.Damage(30, Target.OPPONENT_ACTIVE), null), A);

        assertEquals(heads ? 30 : 0, target.getDamage(), "Damage lands only on heads");
    }

    @Test
    void testScaledByCoinHeads() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        CardInstance target = putActive(state, B, "t-005");
        int heads = state.getRng().copy().coinFlips(3);

        Counter counter = new Counter(CounterKind.COIN_HEADS, 3, null, null, null);
        resolve(state, new Effect.Scaled(counter, new Effect.Damage(10, Target.OPPONENT_ACTIVE)), A);

        assertEquals(heads * 10, target.getDamage());
    }

    @Test
    void testConditionalTakesElseBranch() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        CardInstance target = putActive(state, B, "t-005");

        Condition damaged = new Condition(ConditionKind.DAMAGED, Target.OPPONENT_ACTIVE, null, null, null, 0);
        resolve(state, new Effect.Conditional(damaged,
            new Effect.Damage(50, Target.OPPONENT_ACTIVE),
            new Effect.Damage(10, Target.OPPONENT_ACTIVE)), A);
        assertEquals(10, target.getDamage(), "An undamaged target takes the else branch");

        resolve(state, new Effect.Conditional(damaged,
            new Effect.Damage(50, Target.OPPONENT_ACTIVE), null), A);
        assertEquals(60, target.getDamage());
    }

    @Test
    void testSequenceResolvesInListedOrder() {
        MatchState state = mainPhase();
        CardInstance mon = putActive(state, A, "t-005");

        resolve(state, new Effect.Sequence(List.of(
            new Effect.Damage(30, Target.OWN_ACTIVE),
            new Effect.Heal(20, Target.OWN_ACTIVE))), A);

        assertEquals(10, mon.getDamage(), "Damage first, then the heal");
        assertEquals(0, state.countEvents(MatchEvent.Type.EFFECT_FIZZLED));
    }

    @Test
    void testChoiceInsideSequenceKeepsLaterSteps() {
        MatchState state = mainPhase();
        CardInstance active = putActive(state, A, "t-001");
        active.addDamage(30);
        stockDeck(state, A, "t-004");

        resolve(state, new Effect.Sequence(List.of(
            new Effect.Heal(20, Target.CHOOSE_OWN),
            new Effect.Draw(Side.OWN, 1))), A);

        assertTrue(state.hasPendingChoice());
        assertEquals(0, state.getPlayer(A).getHand().size(), "The draw waits behind the choice");

        ActionApplier.apply(state, ActionSpace.encode(ActionType.CHOOSE_OWN_TARGET, 0));

        assertEquals(10, active.getDamage());
        assertEquals(1, state.getPlayer(A).getHand().size());
        assertTrue(state.isStackEmpty());
    }

    @Test
    void testEndTurnEffectEndsTurnAfterResolution() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        putActive(state, B, "t-001");
        stockDeck(state, B, "t-004");

        resolve(state, new Effect.EndTurn(), A);

        assertEquals(B, state.getCurrentPlayer(), "The turn passes once the effect is done");
        assertEquals(4, state.getTurnNumber());
        assertEquals(Phase.MAIN, state.getPhase());
    }

    // ==================== CARDS AND ZONES ====================

    @Test
    void testRandomSearchIsReproducible() {
        MatchState state = mainPhase();
        stockDeck(state, A, "i-001", "t-001", "s-001", "t-004", "t-003");
        MatchState twin = state.copy();
        Effect search = new Effect.MoveCards(Side.OWN, Zone.DECK, Zone.HAND, 1, false,
            CardFilter.BASIC, Selection.RANDOM);

        resolve(state, search, A);
        resolve(twin, search, A);

        assertEquals(1, state.getPlayer(A).getHand().size());
        assertTrue(state.getPlayer(A).getHand().get(0).isBasicPokemon());
        assertEquals(4, state.getPlayer(A).getDeck().size());
        assertEquals(state, twin, "Same rng state, same pick");
    }

    @Test
    void testMoveBasicToBench() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        stockDeck(state, A, "i-001", "t-004");

        resolve(state, new Effect.MoveCards(Side.OWN, Zone.DECK, Zone.BENCH, 1, false, null, null), A);

        CardInstance benched = state.getPlayer(A).getBench().get(0);
        assertNotNull(benched);
        assertEquals("Splashy", benched.getName());
        assertEquals(state.getTurnNumber(), benched.getTurnPlaced());
    }

    @Test
    void testShuffleDeckUsesMatchRng() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        stockDeck(state, A, "t-001", "t-002", "t-003", "t-004", "i-001", "s-001");
        Deck expected = state.getPlayer(A).getDeck().copy();
        expected.shuffle(state.getRng().copy());

        resolve(state, new Effect.ShuffleDeck(Side.OWN), A);

        assertEquals(expected, state.getPlayer(A).getDeck());
    }

    @Test
    void testDrawStopsAtHandLimit() {
        MatchState state = mainPhase();
        for (int i = 0; i < 10; i++) {
            giveHand(state, A, "i-001");
        }
        stockDeck(state, A, "t-001");

        resolve(state, new Effect.Draw(Side.OWN, 2), A);

        assertEquals(10, state.getPlayer(A).getHand().size());
        assertEquals(1, state.getPlayer(A).getDeck().size());
        assertEquals(1, state.countEvents(MatchEvent.Type.EFFECT_FIZZLED));
    }

    @Test
    void testChosenHandCardToDeck() {
        MatchState state = mainPhase();
        giveHand(state, A, "i-001", "t-001", "t-004");

        resolve(state, new Effect.MoveCards(Side.OWN, Zone.HAND, Zone.DECK, 1, false,
            CardFilter.POKEMON, Selection.CHOSEN), A);

        assertEquals(PendingChoice.Kind.HAND_CARD, state.getPendingChoice().kind());
        assertEquals(List.of(1, 2), state.getPendingChoice().candidates());

        ActionApplier.apply(state, ActionSpace.encode(ActionType.CHOOSE_HAND_CARD, 2));

        assertEquals(2, state.getPlayer(A).getHand().size());
        assertEquals("Splashy", state.getPlayer(A).getDeck().getCards().get(0).getName());
    }

    // ==================== BOARD ====================

    @Test
    void testSwitchOpponentActiveChosenByController() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        CardInstance oldActive = putActive(state, B, "t-001");
        putBench(state, B, "t-004");
        CardInstance flamey = putBench(state, B, "t-003");
        oldActive.addStatus(StatusCondition.POISONED);

        resolve(state, new Effect.SwitchActive(Side.OPPONENT, false), A);

        PendingChoice choice = state.getPendingChoice();
        assertEquals(PendingChoice.Kind.OPPONENT_TARGET, choice.kind());
        assertEquals(A, choice.chooser());
        assertEquals(List.of(1, 2), choice.candidates());

        ActionApplier.apply(state, ActionSpace.encode(ActionType.CHOOSE_OPPONENT_TARGET, 2));

        assertSame(flamey, state.getPlayer(B).getActive());
        assertSame(oldActive, state.getPlayer(B).getBench().get(1));
        assertTrue(oldActive.getStatuses().isEmpty(), "Going to the bench clears status conditions");
    }

    @Test
    void testSwitchChosenByOwner() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        putActive(state, B, "t-001");
        putBench(state, B, "t-004");

        resolve(state, new Effect.SwitchActive(Side.OPPONENT, true), A);

        PendingChoice choice = state.getPendingChoice();
        assertEquals(PendingChoice.Kind.OWN_TARGET, choice.kind());
        assertEquals(B, choice.chooser());
        assertEquals(B, state.getActingPlayer(), "The bench owner answers");
        assertFalse(LegalActions.mask(state, A)[ActionSpace.encode(ActionType.END_TURN)]);
    }

    @Test
    void testModifierLastsThroughOpponentTurn() {
        MatchState state = mainPhase();
        CardInstance mon = putActive(state, A, "t-001");
        putActive(state, B, "t-001");
        stockDeck(state, A, "t-004");
        stockDeck(state, B, "t-004");

        resolve(state, new Effect.Modifier(ModifierKind.DAMAGE_REDUCTION, 20, Target.SELF,
            Expiry.OPPONENT_NEXT_TURN), A, mon.getInstanceId());
        assertTrue(mon.hasModifier(ModifierKind.DAMAGE_REDUCTION));

        ActionApplier.apply(state, ActionSpace.encode(ActionType.END_TURN));
        assertEquals(B, state.getCurrentPlayer());
        assertTrue(mon.hasModifier(ModifierKind.DAMAGE_REDUCTION), "Still active during the opponent's turn");

        ActionApplier.apply(state, ActionSpace.encode(ActionType.END_TURN));
        assertFalse(mon.hasModifier(ModifierKind.DAMAGE_REDUCTION), "Gone once the opponent's turn ends");
    }

    // ==================== UNIQUE CARDS ====================

    @Test
    void testCopycatMatchesOpponentHandSize() {
        MatchState state = mainPhase();
        giveHand(state, A, "i-001", "s-001");
        giveHand(state, B, "t-001", "t-001", "t-004", "t-003", "i-001");
        stockDeck(state, A, "t-001", "t-004", "t-003", "i-004", "s-002");

        resolve(state, new Effect.Unique(Effect.Unique.COPYCAT), A);

        assertEquals(5, state.getPlayer(A).getHand().size());
        assertEquals(2, state.getPlayer(A).getDeck().size());
        assertEquals(5, state.getPlayer(B).getHand().size(), "The opponent's hand is untouched");
    }

    @Test
    void testPokemonCommunicationSwapsChosenPokemon() {
        MatchState state = mainPhase();
        giveHand(state, A, "i-001", "t-001");
        stockDeck(state, A, "s-001", "t-004");

        resolve(state, new Effect.Unique(Effect.Unique.POKEMON_COMMUNICATION), A);

        assertEquals(PendingChoice.Kind.HAND_CARD, state.getPendingChoice().kind());
        assertEquals(List.of(1), state.getPendingChoice().candidates(), "Only Pokémon in hand can be chosen");

        ActionApplier.apply(state, ActionSpace.encode(ActionType.CHOOSE_HAND_CARD, 1));

        List<String> hand = state.getPlayer(A).getHand().getCards().stream().map(Card::getName).toList();
        List<String> deck = state.getPlayer(A).getDeck().getCards().stream().map(Card::getName).toList();
        assertTrue(hand.contains("Splashy"), "The deck's Pokémon comes to hand");
        assertTrue(deck.contains("Testmon"), "The chosen Pokémon goes into the deck");
        assertEquals(2, hand.size());
        assertEquals(2, deck.size());
    }

    @Test
    void testPokemonCommunicationNeedsPokemonInDeck() {
        MatchState state = mainPhase();
        giveHand(state, A, "t-001");
        stockDeck(state, A, "s-001");

        resolve(state, new Effect.Unique(Effect.Unique.POKEMON_COMMUNICATION), A);

        assertFalse(state.hasPendingChoice());
        assertEquals(1, state.countEvents(MatchEvent.Type.EFFECT_FIZZLED));
    }

    // ==================== PLAYABILITY ====================

    @Test
    void testIsPlayable() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");

        assertFalse(EffectExecutor.isPlayable(new Effect.Heal(20, Target.CHOOSE_OWN), state, A, -1),
            "Nothing to heal");
        assertFalse(EffectExecutor.isPlayable(new Effect.SwitchActive(Side.OWN, false), state, A, -1),
            "Nothing to switch in");
        assertFalse(EffectExecutor.isPlayable(new Effect.MoveCards(Side.OWN, Zone.DECK, Zone.HAND, 1, false,
            CardFilter.BASIC, Selection.RANDOM), state, A, -1), "Empty deck");

        state.getPlayer(A).getActive().addDamage(10);
        assertTrue(EffectExecutor.isPlayable(new Effect.Heal(20, Target.CHOOSE_OWN), state, A, -1));
        assertTrue(EffectExecutor.isPlayable(new Effect.Draw(Side.OWN, 2), state, A, -1));
    }

    @Test
    void testExpiryTurns() {
        MatchState state = mainPhase();
        assertEquals(3, EffectExecutor.expiryTurn(state, A, Expiry.THIS_TURN));
        assertEquals(4, EffectExecutor.expiryTurn(state, A, Expiry.OPPONENT_NEXT_TURN));
        assertEquals(5, EffectExecutor.expiryTurn(state, A, Expiry.OWN_NEXT_TURN));
        assertEquals(5, EffectExecutor.expiryTurn(state, B, Expiry.OPPONENT_NEXT_TURN),
            "Effects B controls during A's turn reach A's next turn");
    }
}
