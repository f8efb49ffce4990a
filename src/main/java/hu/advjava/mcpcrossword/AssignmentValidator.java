package hu.advjava.mcpcrossword;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;

/**
 * Checks partial and complete assignments of words to slots.
 */
public final class AssignmentValidator {

    private final Crossword crossword;

    public AssignmentValidator(Crossword crossword) {
        this.crossword = crossword;
    }

    /**
     * An assignment is consistent when all words are distinct, every word fits its
     * slot's length and any two assigned crossing slots agree on the shared letter.
     */
    public boolean isConsistent(Map<Slot, String> assignment) {
        if (new HashSet<>(assignment.values()).size() != assignment.size()) return false;

        if (assignment.entrySet().stream()
                .anyMatch(e -> e.getValue() == null || e.getValue().length() != e.getKey().length())) return false;

        return assignment.entrySet().stream().allMatch(e ->
                crossword.neighbors(e.getKey()).stream()
                        .filter(assignment::containsKey)
                        .allMatch(neighbor -> agree(e.getKey(), e.getValue(), neighbor, assignment.get(neighbor))));
    }

    /** True iff every slot of the grid holds a non-empty word. */
    public boolean isComplete(Map<Slot, String> assignment) {
        return crossword.getSlots().stream()
                .map(assignment::get)
                .allMatch(word -> Objects.nonNull(word) && !word.isEmpty());
    }

    private boolean agree(Slot x, String xWord, Slot y, String yWord) {
        return crossword.overlap(x, y)
                .map(o -> o.agrees(xWord, yWord))
                .orElse(true);
    }
}
