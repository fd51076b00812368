package com.tcg.pocket.action;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the fixed index layout of the action space.
 */
class ActionSpaceTest {

    @Test
    void testFamiliesAreContiguous() {
        int expectedBase = 0;
        for (ActionType type : ActionType.values()) {
            assertEquals(expectedBase, type.getBase(), type + " starts where the previous family ends");
            expectedBase = type.getEnd();
        }
        assertEquals(157, expectedBase);
    }

    @Test
    void testSingleParameterFamilies() {
        assertEquals(0, ActionSpace.encode(ActionType.PLACE_ACTIVE, 0));
        assertEquals(19, ActionSpace.encode(ActionType.PLACE_BENCH, 9));
        assertEquals(20, ActionSpace.encode(ActionType.CONFIRM_SETUP));
        assertEquals(73, ActionSpace.encode(ActionType.ATTACH_ENERGY, 2));
        assertEquals(94, ActionSpace.encode(ActionType.ATTACK, 2));
        assertEquals(95, ActionSpace.encode(ActionType.END_TURN));
        assertEquals(101, ActionSpace.encode(ActionType.CHOOSE_OPPONENT_TARGET, 1));
        assertEquals(106, ActionSpace.encode(ActionType.PROMOTE, 2));

        assertEquals(Action.of(ActionType.RETREAT, 1), ActionSpace.decode(76));
        assertEquals(Action.of(ActionType.CHOOSE_HAND_CARD, 9), ActionSpace.decode(116));
        assertEquals(Action.of(ActionType.END_TURN), ActionSpace.decode(95));
    }

    @Test
    void testTwoParameterFamilies() {
        assertEquals(45, ActionSpace.encode(ActionType.EVOLVE, 3, 2));
        assertEquals(Action.of(ActionType.EVOLVE, 3, 2), ActionSpace.decode(45));
        assertEquals(70, ActionSpace.encode(ActionType.EVOLVE, 9, 3));

        assertEquals(117, ActionSpace.encode(ActionType.ATTACH_TOOL, 0, 0));
        assertEquals(156, ActionSpace.encode(ActionType.ATTACH_TOOL, 9, 3));
        assertEquals(Action.of(ActionType.ATTACH_TOOL, 2, 1), ActionSpace.decode(126));
    }

    @Test
    void testEveryUsedIndexDecodesBackToItself() {
        for (int index = 0; index < ActionType.ATTACH_TOOL.getEnd(); index++) {
            assertEquals(index, ActionSpace.encode(ActionSpace.decode(index)));
        }
    }

    @Test
    void testReservedAndOutOfRangeIndices() {
        assertFalse(ActionSpace.isReserved(156));
        assertTrue(ActionSpace.isReserved(157));
        assertTrue(ActionSpace.isReserved(511));
        assertFalse(ActionSpace.isReserved(512));

        IllegalActionException reserved = assertThrows(IllegalActionException.class, () -> ActionSpace.decode(300));
        assertEquals(300, reserved.getActionIndex());
        assertThrows(IllegalActionException.class, () -> ActionSpace.decode(-1));
        assertThrows(IllegalActionException.class, () -> ActionSpace.decode(ActionSpace.SIZE));
    }

    @Test
    void testEncodeRejectsOutOfRangeParameters() {
        assertThrows(IllegalArgumentException.class, () -> ActionSpace.encode(ActionType.RETREAT, 3));
        assertThrows(IllegalArgumentException.class, () -> ActionSpace.encode(ActionType.PLAY_TRAINER, 10));
        assertThrows(IllegalArgumentException.class, () -> ActionSpace.encode(ActionType.EVOLVE, 0, 4));
        assertThrows(IllegalArgumentException.class, () -> ActionSpace.encode(ActionType.ATTACH_TOOL, -1, 0));
    }

    @Test
    void testFamilyKinds() {
        assertTrue(ActionType.PROMOTE.isChoice());
        assertTrue(ActionType.CHOOSE_HAND_CARD.isChoice());
        assertFalse(ActionType.ATTACK.isChoice());
        assertTrue(ActionType.CONFIRM_SETUP.isSetup());
        assertFalse(ActionType.PLAY_BASIC.isSetup());
    }
}
