package com.tcg.pocket.simulation;

import com.tcg.pocket.TestMatches;
import com.tcg.pocket.action.LegalActions;
import com.tcg.pocket.card.Card;
import com.tcg.pocket.config.RulesConfig;
import com.tcg.pocket.game.MatchState;
import com.tcg.pocket.game.zones.Hand;
import com.tcg.pocket.rng.GameRng;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObservationEncoderTest {
    private static final int A = MatchState.PLAYER_A;
    private static final int B = MatchState.PLAYER_B;

    private final ObservationEncoder encoder = new ObservationEncoder(TestMatches.cards(), RulesConfig.defaults());

    private static MatchState board() {
        MatchState state = TestMatches.mainPhase();
        TestMatches.putActive(state, A, "t-003");
        TestMatches.putActive(state, B, "t-004");
        TestMatches.putBench(state, B, "t-001");
        TestMatches.giveHand(state, A, "i-001", "t-001");
        TestMatches.giveHand(state, B, "s-001", "t-002");
        return state;
    }

    @Test
    void testLayoutFitsFixedSize() {
        assertTrue(ObservationEncoder.USED <= ObservationEncoder.SIZE);
        assertEquals(ObservationEncoder.SIZE, encoder.encode(board(), A).length);
    }

    @Test
    void testValuesStayInUnitRange() throws InvalidDeckException {
        GameEngine engine = new GameEngine(TestMatches.bundledCards());
        MatchState state = engine.reset(8L, TestMatches.sampleDeck("fire"), TestMatches.sampleDeck("psychic")).state();
        GameRng picker = new GameRng(8L);
        while (!state.isTerminal()) {
            for (int perspective = A; perspective <= B; perspective++) {
                for (float value : engine.observe(state, perspective)) {
                    assertTrue(value >= 0f && value <= 1f, "Observation value out of range: " + value);
                }
            }
            List<Integer> legal = LegalActions.legalIndices(state);
            engine.step(state, legal.get(picker.nextInt(legal.size())));
        }
    }

    @Test
    void testOpponentHandContentsAreHidden() {
        MatchState state = board();
        MatchState swapped = state.copy();
        Hand opponentHand = swapped.getPlayer(B).getHand();
        opponentHand.remove(0);
        opponentHand.add(TestMatches.card("tl-002"));

        assertArrayEquals(encoder.encode(state, A), encoder.encode(swapped, A),
            "Swapping a hidden card must not change what A sees");
        assertFalse(Arrays.equals(encoder.encode(state, B), encoder.encode(swapped, B)),
            "B sees its own hand");
    }

    @Test
    void testOpponentHandSizeIsVisible() {
        MatchState state = board();
        MatchState bigger = state.copy();
        bigger.getPlayer(B).getHand().add(TestMatches.card("i-002"));

        assertFalse(Arrays.equals(encoder.encode(state, A), encoder.encode(bigger, A)));
    }

    @Test
    void testPerspectivesMirror() {
        MatchState state = board();
        float[] forA = encoder.encode(state, A);
        float[] forB = encoder.encode(state, B);

        assertEquals(1f, forA[1], "A is on turn");
        assertEquals(0f, forB[1]);
        for (int i = 0; i < ObservationEncoder.PLAYER_FEATURES; i++) {
            assertEquals(forA[ObservationEncoder.OWN_OFFSET + i], forB[ObservationEncoder.OPPONENT_OFFSET + i], 0f,
                "Public block " + i);
        }
    }

    @Test
    void testEncodingDoesNotTouchState() {
        MatchState state = board();
        MatchState before = state.copy();
        encoder.encode(state, A);
        encoder.encode(state, B);
        assertEquals(before, state);
    }

    @Test
    void testCardCodesDifferPerCard() {
        MatchState one = board();
        MatchState two = board();
        Card replacement = TestMatches.card("t-007");
        two.getPlayer(A).getHand().remove(1);
        two.getPlayer(A).getHand().add(replacement);

        assertFalse(Arrays.equals(encoder.encode(one, A), encoder.encode(two, A)));
    }
}
