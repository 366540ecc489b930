package nibbler.orchestrate;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static nibbler.decompose.InstructionKind.*;
import static nibbler.orchestrate.InstructionState.*;
import static org.junit.jupiter.api.Assertions.*;

public class InstructionTrackerTest {

    @Test
    public void testForwardTransitions() {
        InstructionTracker tracker = new InstructionTracker(Arrays.asList(ADD, SUB));
        assertEquals(PENDING, tracker.state(ADD));
        tracker.advance(ADD, GENERATING);
        tracker.advance(ADD, COMPLETE);
        tracker.advance(SUB, FAILED);
        assertEquals(COMPLETE, tracker.snapshot().get(ADD));
        assertEquals(FAILED, tracker.snapshot().get(SUB));
    }

    @Test
    public void testNoBackwardTransitions() {
        InstructionTracker tracker = new InstructionTracker(Arrays.asList(ADD));
        tracker.advance(ADD, GENERATING);
        tracker.advance(ADD, PARTIALLY_FAILED);
        assertThrows(IllegalStateException.class, () -> tracker.advance(ADD, GENERATING));
        assertThrows(IllegalStateException.class, () -> tracker.advance(ADD, COMPLETE));
        assertEquals(PARTIALLY_FAILED, tracker.state(ADD));
    }

    @Test
    public void testUntrackedInstruction() {
        assertThrows(IllegalArgumentException.class, () -> new InstructionTracker(Arrays.asList(ADD)).state(SUB));
    }

    @ParameterizedTest
    @CsvSource({
            "PENDING, GENERATING, true",
            "PENDING, FAILED, true",
            "PENDING, COMPLETE, false",
            "GENERATING, PARTIALLY_FAILED, true",
            "GENERATING, PENDING, false",
            "COMPLETE, FAILED, false",
            "FAILED, FAILED, false"})
    public void testCanMoveTo(InstructionState from, InstructionState to, boolean allowed) {
        assertEquals(allowed, from.canMoveTo(to));
    }

    @Test
    public void testTerminalStates() {
        assertFalse(PENDING.isTerminal());
        assertFalse(GENERATING.isTerminal());
        assertTrue(COMPLETE.isTerminal());
        assertTrue(PARTIALLY_FAILED.isTerminal());
        assertTrue(FAILED.isTerminal());
    }
}
