package hu.advjava.mcpcrossword;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class AssignmentValidatorTest {
    private final Crossword crossword = ExampleCrossword.SIMPLE.toCrossword();
    private final List<Slot> slots = crossword.getSlots();
    private final AssignmentValidator validator = new AssignmentValidator(crossword);

    @Test
    public void emptyAssignmentIsConsistentButIncomplete() {
        assertTrue(validator.isConsistent(Map.of()));
        assertFalse(validator.isComplete(Map.of()));
    }

    @Test
    public void fullSolutionPasses() {
        Map<Slot, String> solution = Map.of(
                slots.get(0), "SIX", slots.get(1), "NINE", slots.get(2), "SEVEN", slots.get(3), "FIVE");
        assertTrue(validator.isConsistent(solution));
        assertTrue(validator.isComplete(solution));
    }

    @Test
    public void repeatedWordIsInconsistent() {
        assertFalse(validator.isConsistent(Map.of(slots.get(1), "NINE", slots.get(3), "NINE")));
    }

    @Test
    public void wrongLengthIsInconsistent() {
        assertFalse(validator.isConsistent(Map.of(slots.get(0), "NINE")));
    }

    @Test
    public void crossingConflictIsInconsistent() {
        // SIX and THREE disagree on the top-left letter
        assertFalse(validator.isConsistent(Map.of(slots.get(0), "SIX", slots.get(2), "THREE")));
        assertTrue(validator.isConsistent(Map.of(slots.get(0), "SIX", slots.get(2), "SEVEN")));
    }

    @Test
    public void unrelatedSlotsNeverConflict() {
        assertTrue(validator.isConsistent(Map.of(slots.get(0), "TWO", slots.get(3), "FOUR")));
    }

    @Test
    public void emptyWordIsNotComplete() {
        Map<Slot, String> assignment = new HashMap<>(Map.of(
                slots.get(0), "SIX", slots.get(1), "NINE", slots.get(2), "SEVEN"));
        assertFalse(validator.isComplete(assignment));
        assignment.put(slots.get(3), "");
        assertFalse(validator.isComplete(assignment));
    }
}
