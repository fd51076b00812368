package com.tcg.pocket.simulation;

import com.tcg.pocket.TestMatches;
import com.tcg.pocket.game.MatchState;
import com.tcg.pocket.rng.GameRng;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RandomPlayoutTest {

    @Test
    void testPlayoutsFinishAndRepeat() throws InvalidDeckException {
        GameEngine engine = new GameEngine(TestMatches.bundledCards());
        DeckList water = TestMatches.sampleDeck("water");
        DeckList lightning = TestMatches.sampleDeck("lightning");

        for (long seed = 1; seed <= 20; seed++) {
            MatchSummary summary = RandomPlayout.run(engine, seed, water.getCardIds(), lightning.getCardIds());
            assertTrue(summary.result().isTerminal());
            assertTrue(summary.turns() >= 1 && summary.turns() <= engine.getRules().getMaxTurns());
            assertTrue(summary.steps() >= 4);
            assertEquals(summary, RandomPlayout.run(engine, seed, water.getCardIds(), lightning.getCardIds()),
                "Same seed, same match");
        }
    }

    @Test
    void testTurnLimitEndsInDraw() throws InvalidDeckException {
        GameEngine engine = new GameEngine(TestMatches.bundledCards(), TestMatches.rules("{\"max_turns\": 2}"));
        MatchState state = engine.reset(4L, TestMatches.sampleDeck("fire"), TestMatches.sampleDeck("water")).state();

        MatchSummary summary = RandomPlayout.playOut(state, new GameRng(4L));

        assertTrue(summary.turns() <= 2);
        if (summary.turns() == 2 && summary.knockouts() == 0) {
            assertTrue(summary.isDraw(), "No knockouts in two turns means the turn limit decided it");
        }
    }
}
