package com.tcg.pocket.game;

import com.tcg.pocket.action.ActionApplier;
import com.tcg.pocket.action.ActionSpace;
import com.tcg.pocket.action.ActionType;
import com.tcg.pocket.action.IllegalActionException;
import com.tcg.pocket.action.LegalActions;
import com.tcg.pocket.card.Card;
import com.tcg.pocket.card.EnergyType;
import com.tcg.pocket.config.RulesConfig;
import com.tcg.pocket.effect.ModifierKind;
import com.tcg.pocket.game.zones.CardInstance;
import com.tcg.pocket.game.zones.TurnModifier;
import com.tcg.pocket.rng.GameRng;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tcg.pocket.TestMatches.card;
import static com.tcg.pocket.TestMatches.mainPhase;
import static com.tcg.pocket.TestMatches.putActive;
import static com.tcg.pocket.TestMatches.putBench;
import static com.tcg.pocket.TestMatches.rules;
import static com.tcg.pocket.TestMatches.stockDeck;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the attack pipeline, knockouts, promotion and turn boundaries.
 */
class TurnManagerTest {
    private static final int A = MatchState.PLAYER_A;
    private static final int B = MatchState.PLAYER_B;

    private static final int FIRST_ATTACK = ActionSpace.encode(ActionType.ATTACK, 0);
    private static final int END_TURN = ActionSpace.encode(ActionType.END_TURN);

    /**
     * A main-phase position where both decks can still be drawn from.
     */
    private static MatchState stockedMatch() {
        MatchState state = mainPhase();
        stockDeck(state, A, "t-001", "t-001", "t-004");
        stockDeck(state, B, "t-001", "t-001", "t-004");
        return state;
    }

    // ==================== ATTACKS ====================

    @Test
    void testAttackAppliesWeaknessAndPassesTurn() {
        MatchState state = stockedMatch();
        putActive(state, A, "t-004");
        CardInstance flamey = putActive(state, B, "t-003");

        ActionApplier.apply(state, FIRST_ATTACK);

        assertEquals(30, flamey.getDamage(), "10 base plus 20 weakness");
        assertEquals(B, state.getCurrentPlayer(), "Attacking ends the turn");
        assertEquals(4, state.getTurnNumber());
        assertEquals(Phase.MAIN, state.getPhase());
        assertNull(state.getAttack(), "The attack context is cleared at end of turn");
    }

    @Test
    void testDamageCalculation() {
        RulesConfig rules = RulesConfig.defaults();
        CardInstance attacker = new CardInstance(1, (Card.Pokemon) card("t-004"), 0);
        CardInstance defender = new CardInstance(2, (Card.Pokemon) card("t-003"), 0);

        assertEquals(60, TurnManager.computeAttackDamage(rules, attacker, defender, 40));

        attacker.addModifier(new TurnModifier(ModifierKind.DAMAGE_BOOST, 10, 9));
        defender.addModifier(new TurnModifier(ModifierKind.DAMAGE_REDUCTION, 30, 9));
        assertEquals(40, TurnManager.computeAttackDamage(rules, attacker, defender, 40));

        defender.addModifier(new TurnModifier(ModifierKind.INVULNERABLE, 0, 9));
        assertEquals(0, TurnManager.computeAttackDamage(rules, attacker, defender, 40));
    }

    @Test
    void testDamageNeverNegative() {
        CardInstance attacker = new CardInstance(1, (Card.Pokemon) card("t-001"), 0);
        CardInstance defender = new CardInstance(2, (Card.Pokemon) card("t-001"), 0);
        defender.addModifier(new TurnModifier(ModifierKind.DAMAGE_REDUCTION, 50, 9));

        assertEquals(0, TurnManager.computeAttackDamage(RulesConfig.defaults(), attacker, defender, 20));
    }

    @Test
    void testAttackEffectResolvesBeforeDamage() {
        MatchState state = stockedMatch();
        CardInstance flamey = putActive(state, A, "t-003");
        CardInstance target = putActive(state, B, "t-005");
        flamey.attachEnergy(EnergyType.FIRE, 1);
        flamey.attachEnergy(EnergyType.COLORLESS, 1);

        ActionApplier.apply(state, ActionSpace.encode(ActionType.ATTACK, 1));

        assertEquals(60, target.getDamage());
        assertEquals(0, flamey.getEnergy(EnergyType.FIRE), "Burn Up discards a fire energy");
        assertEquals(1, flamey.getTotalEnergy());
    }

    @Test
    void testUnpayableAttackIsIllegal() {
        MatchState state = stockedMatch();
        putActive(state, A, "t-003");
        putActive(state, B, "t-001");

        assertFalse(GameActions.canAttack(state, 0));
        assertThrows(IllegalActionException.class, () -> ActionApplier.apply(state, FIRST_ATTACK));
        assertEquals(A, state.getCurrentPlayer(), "A rejected action leaves the match untouched");
    }

    @Test
    void testConfusionCanStopAttack() {
        MatchState state = stockedMatch();
        CardInstance attacker = putActive(state, A, "t-001");
        CardInstance target = putActive(state, B, "t-005");
        attacker.addStatus(StatusCondition.CONFUSED);
        boolean heads = state.getRng().copy().coinFlip();

        ActionApplier.apply(state, FIRST_ATTACK);

        assertEquals(heads ? 20 : 0, target.getDamage());
        assertEquals(B, state.getCurrentPlayer(), "The turn ends either way");
    }

    @Test
    void testAsleepBlocksAttackAndRetreat() {
        MatchState state = stockedMatch();
        CardInstance active = putActive(state, A, "t-001");
        putBench(state, A, "t-004");
        putActive(state, B, "t-001");
        active.attachEnergy(EnergyType.COLORLESS, 1);
        active.addStatus(StatusCondition.ASLEEP);

        assertFalse(GameActions.canAttack(state, 0));
        assertFalse(GameActions.canRetreat(state, 0));
        assertTrue(GameActions.canEndTurn(state));
    }

    // ==================== REACTIONS ====================

    @Test
    void testRoughSkinAndHelmetStrikeBack() {
        MatchState state = stockedMatch();
        CardInstance attacker = putActive(state, A, "t-005");
        CardInstance spiky = putActive(state, B, "t-006");
        spiky.setTool((Card.Tool) card("tl-002"));

        ActionApplier.apply(state, FIRST_ATTACK);

        assertEquals(30, spiky.getDamage());
        assertEquals(40, attacker.getDamage(), "Ability and tool each deal 20 back");
    }

    @Test
    void testNoReactionWhenNoDamageDealt() {
        MatchState state = stockedMatch();
        CardInstance attacker = putActive(state, A, "t-001");
        CardInstance spiky = putActive(state, B, "t-006");
        spiky.addModifier(new TurnModifier(ModifierKind.INVULNERABLE, 0, 9));

        ActionApplier.apply(state, FIRST_ATTACK);

        assertEquals(0, spiky.getDamage());
        assertEquals(0, attacker.getDamage());
    }

    // ==================== KNOCKOUTS ====================

    @Test
    void testKnockoutScoresAndForcesPromotion() {
        MatchState state = stockedMatch();
        putActive(state, A, "t-005");
        CardInstance defender = putActive(state, B, "t-001");
        putBench(state, B, "t-004");
        CardInstance flamey = putBench(state, B, "t-003");
        defender.addDamage(40);

        ActionApplier.apply(state, FIRST_ATTACK);

        assertEquals(1, state.countEvents(MatchEvent.Type.KNOCKOUT));
        assertEquals(1, state.countEvents(MatchEvent.Type.PRIZE_AWARDED));
        assertEquals(2, state.getPlayer(A).getPrizePoints());
        assertFalse(state.getPlayer(B).hasActive());
        assertEquals(1, state.getPlayer(B).getDiscard().size(), "The knocked-out card is discarded");

        PendingChoice choice = state.getPendingChoice();
        assertNotNull(choice, "B must pick a new active");
        assertEquals(PendingChoice.Kind.PROMOTE, choice.kind());
        assertEquals(B, choice.chooser());
        assertEquals(List.of(0, 1), choice.candidates());
        assertFalse(LegalActions.mask(state, A)[END_TURN], "Only the promoting player may act");

        boolean[] mask = LegalActions.mask(state, B);
        assertTrue(mask[ActionSpace.encode(ActionType.PROMOTE, 0)]);
        assertTrue(mask[ActionSpace.encode(ActionType.PROMOTE, 1)]);
        assertFalse(mask[ActionSpace.encode(ActionType.PROMOTE, 2)]);
        assertFalse(mask[END_TURN]);

        ActionApplier.apply(state, ActionSpace.encode(ActionType.PROMOTE, 1));

        assertSame(flamey, state.getPlayer(B).getActive());
        assertEquals(B, state.getCurrentPlayer(), "The turn passes after the promotion");
        assertEquals(Phase.MAIN, state.getPhase());
    }

    @Test
    void testKnockoutWithEmptyBenchEndsMatch() {
        MatchState state = stockedMatch();
        putActive(state, A, "t-005");
        CardInstance defender = putActive(state, B, "t-001");
        defender.addDamage(40);

        ActionApplier.apply(state, FIRST_ATTACK);

        assertTrue(state.isTerminal());
        assertEquals(MatchResult.PLAYER_A, state.getResult());
        assertEquals(Phase.TERMINAL, state.getPhase());
        assertEquals(-1, state.getActingPlayer());
        assertFalse(contains(LegalActions.mask(state, A)), "No action after the match ends");
        assertFalse(contains(LegalActions.mask(state, B)));
        assertThrows(IllegalActionException.class, () -> ActionApplier.apply(state, END_TURN));
    }

    @Test
    void testExKnockoutScoresTwoPoints() {
        MatchState state = stockedMatch();
        putActive(state, A, "t-005");
        CardInstance ex = putActive(state, B, "t-005");
        putBench(state, B, "t-001");
        ex.addDamage(60);

        ActionApplier.apply(state, FIRST_ATTACK);

        assertEquals(1, state.getPlayer(A).getPrizePoints());
        assertEquals(2, state.getEvents().stream()
            .filter(e -> e.type() == MatchEvent.Type.PRIZE_AWARDED)
            .mapToInt(MatchEvent::amount)
            .sum());
    }

    @Test
    void testLastPointsWinDespiteBench() {
        MatchState state = stockedMatch();
        putActive(state, A, "t-005");
        CardInstance defender = putActive(state, B, "t-001");
        putBench(state, B, "t-004");
        defender.addDamage(40);
        state.getPlayer(A).scorePoints(2);

        ActionApplier.apply(state, FIRST_ATTACK);

        assertEquals(MatchResult.PLAYER_A, state.getResult());
        assertEquals(0, state.getPlayer(A).getPrizePoints());
        assertFalse(state.hasPendingChoice(), "No promotion once the match is decided");
    }

    @Test
    void testSimultaneousKnockoutIsDraw() {
        MatchState state = stockedMatch();
        CardInstance attacker = putActive(state, A, "t-001");
        CardInstance spiky = putActive(state, B, "t-006");
        attacker.addDamage(50);
        spiky.addDamage(70);

        ActionApplier.apply(state, FIRST_ATTACK);

        assertEquals(2, state.countEvents(MatchEvent.Type.KNOCKOUT));
        assertEquals(MatchResult.DRAW, state.getResult(), "Both players are out of Pokémon");
    }

    // ==================== TURN BOUNDARIES ====================

    @Test
    void testPoisonAndBurnAtCheckup() {
        MatchState state = stockedMatch();
        CardInstance poisoned = putActive(state, A, "t-005");
        CardInstance burned = putActive(state, B, "t-005");
        poisoned.addStatus(StatusCondition.POISONED);
        burned.addStatus(StatusCondition.BURNED);
        boolean recovers = state.getRng().copy().coinFlip();

        ActionApplier.apply(state, END_TURN);

        assertEquals(10, poisoned.getDamage());
        assertTrue(poisoned.hasStatus(StatusCondition.POISONED), "Poison stays until cured");
        assertEquals(20, burned.getDamage());
        assertEquals(!recovers, burned.hasStatus(StatusCondition.BURNED), "Heads cures the burn");
    }

    @Test
    void testParalysisWearsOffAtOwnersTurnEnd() {
        MatchState state = stockedMatch();
        CardInstance own = putActive(state, A, "t-001");
        CardInstance other = putActive(state, B, "t-001");
        own.addStatus(StatusCondition.PARALYZED);
        other.addStatus(StatusCondition.PARALYZED);

        ActionApplier.apply(state, END_TURN);

        assertFalse(own.hasStatus(StatusCondition.PARALYZED));
        assertTrue(other.hasStatus(StatusCondition.PARALYZED), "B stays paralyzed through its own turn");
        assertFalse(GameActions.canAttack(state, 0));
    }

    @Test
    void testBetweenTurnsHealAfterCheckup() {
        MatchState state = stockedMatch();
        CardInstance active = putActive(state, A, "t-001");
        putActive(state, B, "t-001");
        active.setTool((Card.Tool) card("tl-003"));
        active.addDamage(30);
        active.addStatus(StatusCondition.POISONED);

        ActionApplier.apply(state, END_TURN);

        assertEquals(30, active.getDamage(), "Poison for 10, then Leftovers heals 10");
        assertEquals(B, state.getCurrentPlayer());
    }

    @Test
    void testCheckupKnockoutIsNotUndoneByBetweenTurnsHeal() {
        MatchState state = stockedMatch();
        CardInstance active = putActive(state, A, "t-001");
        putBench(state, A, "t-004");
        putActive(state, B, "t-001");
        active.setTool((Card.Tool) card("tl-003"));
        active.addDamage(50);
        active.addStatus(StatusCondition.POISONED);

        ActionApplier.apply(state, END_TURN);

        assertEquals(1, state.countEvents(MatchEvent.Type.KNOCKOUT));
        assertEquals(2, state.getPlayer(B).getPrizePoints(), "B scores for the poison knockout");
        assertFalse(state.getPlayer(A).hasActive());
        assertEquals(2, state.getPlayer(A).getDiscard().size(), "Pokémon and tool are discarded");
        assertEquals(PendingChoice.Kind.PROMOTE, state.getPendingChoice().kind());
        assertEquals(A, state.getPendingChoice().chooser());
    }

    @Test
    void testPoisonKnockoutBetweenTurnsPromotesBeforeNextTurn() {
        MatchState state = stockedMatch();
        putActive(state, A, "t-001");
        CardInstance sick = putActive(state, B, "t-001");
        putBench(state, B, "t-004");
        sick.addDamage(50);
        sick.addStatus(StatusCondition.POISONED);

        ActionApplier.apply(state, END_TURN);

        assertEquals(PendingChoice.Kind.PROMOTE, state.getPendingChoice().kind());
        assertEquals(2, state.getPlayer(A).getPrizePoints());
        assertEquals(3, state.getTurnNumber(), "The next turn waits for the promotion");

        ActionApplier.apply(state, ActionSpace.encode(ActionType.PROMOTE, 0));

        assertEquals(4, state.getTurnNumber());
        assertEquals(B, state.getCurrentPlayer());
    }

    @Test
    void testTurnStartDrawsAndGeneratesEnergy() {
        MatchState state = stockedMatch();
        putActive(state, A, "t-001");
        putActive(state, B, "t-001");
        state.getPlayer(B).getEnergyZone().prime(new GameRng(1));

        ActionApplier.apply(state, END_TURN);

        PlayerState b = state.getPlayer(B);
        assertEquals(1, b.getHand().size());
        assertEquals(2, b.getDeck().size());
        assertEquals(EnergyType.COLORLESS, b.getEnergyZone().getCurrent());
        assertEquals(0, state.getActionsThisTurn());
    }

    @Test
    void testDeckOutLoses() {
        MatchState state = mainPhase();
        putActive(state, A, "t-001");
        putActive(state, B, "t-001");

        ActionApplier.apply(state, END_TURN);

        assertEquals(1, state.countEvents(MatchEvent.Type.DECK_OUT));
        assertEquals(MatchResult.PLAYER_A, state.getResult(), "B cannot draw and loses");
    }

    @Test
    void testDeckOutSkipKeepsPlaying() {
        MatchState state = mainPhase(rules("{\"deck_out\": \"skip\"}"), 1L);
        putActive(state, A, "t-001");
        putActive(state, B, "t-001");

        ActionApplier.apply(state, END_TURN);

        assertFalse(state.isTerminal());
        assertEquals(B, state.getCurrentPlayer());
        assertEquals(1, state.countEvents(MatchEvent.Type.DECK_OUT));
    }

    @Test
    void testTurnLimitIsDraw() {
        MatchState state = mainPhase(rules("{\"max_turns\": 3}"), 1L);
        putActive(state, A, "t-001");
        putActive(state, B, "t-001");

        ActionApplier.apply(state, END_TURN);

        assertEquals(MatchResult.DRAW, state.getResult());
    }

    @Test
    void testOncePerTurnFlagsResetAtOwnTurnStart() {
        MatchState state = stockedMatch();
        putActive(state, A, "t-001");
        putActive(state, B, "t-001");
        state.getPlayer(B).setSupporterPlayedThisTurn(true);
        state.getPlayer(A).setEnergyAttachedThisTurn(true);

        ActionApplier.apply(state, END_TURN);

        assertFalse(state.getPlayer(B).isSupporterPlayedThisTurn());
        assertTrue(state.getPlayer(A).isEnergyAttachedThisTurn(), "A's flags wait for A's next turn");
    }

    @Test
    void testOncePerTurnFlagsResetAtTurnEndWhenConfigured() {
        MatchState state = mainPhase(rules("{\"once_per_turn_reset\": \"end_of_turn\"}"), 1L);
        stockDeck(state, B, "t-001");
        putActive(state, A, "t-001");
        putActive(state, B, "t-001");
        state.getPlayer(A).setEnergyAttachedThisTurn(true);

        ActionApplier.apply(state, END_TURN);

        assertFalse(state.getPlayer(A).isEnergyAttachedThisTurn());
    }

    private static boolean contains(boolean[] mask) {
        for (boolean bit : mask) {
            if (bit) {
                return true;
            }
        }
        return false;
    }
}
