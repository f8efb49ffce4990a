package hu.advjava.mcpcrossword;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import hu.advjava.mcpcrossword.Crossword.Arc;

public class CrosswordCreatorTest {

    private static void assertValidSolution(Crossword crossword, Map<Slot, String> solution) {
        var validator = new AssignmentValidator(crossword);
        assertAll(
                () -> assertTrue(validator.isComplete(solution)),
                () -> assertTrue(validator.isConsistent(solution)),
                () -> assertEquals(solution.size(), new HashSet<>(solution.values()).size()),
                () -> {
                    for (Arc arc : crossword.arcs()) {
                        Overlap o = crossword.overlap(arc.x(), arc.y()).orElseThrow();
                        assertEquals(solution.get(arc.x()).charAt(o.first()), solution.get(arc.y()).charAt(o.second()),
                                arc.toString());
                    }
                });
    }

    @Test
    public void solvesBundledExamples() {
        for (ExampleCrossword example : List.of(ExampleCrossword.TINY, ExampleCrossword.SIMPLE,
                ExampleCrossword.STEPS, ExampleCrossword.ELL)) {
            Crossword crossword = example.toCrossword();
            Optional<Map<Slot, String>> solution = new CrosswordCreator(crossword, example.getWords()).solve();
            assertTrue(solution.isPresent(), example.name());
            assertValidSolution(crossword, solution.get());
        }
    }

    @Test
    public void crossingLetterMustMatch() {
        Crossword crossword = ExampleCrossword.TINY.toCrossword();
        Map<Slot, String> solution = new CrosswordCreator(crossword, List.of("CAT", "DOG", "TIE")).solve().orElseThrow();
        assertEquals(List.of("CAT", "TIE"), List.copyOf(solution.values()));
    }

    @Test
    public void simpleExampleHasItsOnlyFill() {
        Crossword crossword = ExampleCrossword.SIMPLE.toCrossword();
        Map<Slot, String> solution = new CrosswordCreator(crossword, ExampleCrossword.SIMPLE.getWords()).solve().orElseThrow();
        assertEquals(List.of("SIX", "NINE", "SEVEN", "FIVE"), List.copyOf(solution.values()));
    }

    @Test
    public void misalignedCrossingHasNoSolution() {
        Crossword crossword = Crossword.parse("___", "#_#", "#_#");
        assertTrue(new CrosswordCreator(crossword, List.of("CAT", "DOG", "TIE")).solve().isEmpty());
    }

    @Test
    public void missingWordLengthHasNoSolution() {
        Crossword crossword = Crossword.parse("____", "_###", "_###");
        assertTrue(new CrosswordCreator(crossword, List.of("CAT", "DOG", "TIE")).solve().isEmpty());
    }

    @Test
    public void wordsMustBeDistinct() {
        // ABA fits both slots on its own, but there is only one of it
        Crossword crossword = Crossword.parse("___", "_##", "_##");
        var creator = new CrosswordCreator(crossword, List.of("ABA"));
        assertTrue(creator.solve().isEmpty());
        crossword.getSlots().forEach(slot -> assertEquals(1, creator.getDomains().size(slot)));
    }

    @Test
    public void latticeHasNoSolution() {
        var example = ExampleCrossword.LATTICE;
        assertTrue(new CrosswordCreator(example.toCrossword(), example.getWords()).solve().isEmpty());
    }

    @Test
    public void gridWithoutSlotsIsTriviallySolved() {
        Crossword crossword = Crossword.parse("_#", "#_");
        assertEquals(Optional.of(Map.of()), new CrosswordCreator(crossword, List.of("CAT")).solve());
    }

    @Test
    public void repeatedSolvesAgree() {
        var example = ExampleCrossword.ELL;
        var first = new CrosswordCreator(example.toCrossword(), example.getWords()).solve();
        var second = new CrosswordCreator(example.toCrossword(), example.getWords()).solve();
        var creator = new CrosswordCreator(example.toCrossword(), example.getWords());
        assertAll(
                () -> assertEquals(first, second),
                () -> assertEquals(first, creator.solve()),
                () -> assertEquals(first, creator.solve()));
    }

    @Test
    public void fewestRemainingValuesFirst() {
        Crossword crossword = ExampleCrossword.SIMPLE.toCrossword();
        List<Slot> slots = crossword.getSlots();
        var creator = new CrosswordCreator(crossword, ExampleCrossword.SIMPLE.getWords());
        creator.getDomains().enforceNodeConsistency();
        // top has 4 words, the others 3; bottom and left both have two neighbours, bottom comes first
        assertEquals(slots.get(1), creator.selectUnassignedVariable(Map.of()));
        assertEquals(slots.get(3), creator.selectUnassignedVariable(Map.of(slots.get(1), "NINE", slots.get(2), "SEVEN")));
    }

    @Test
    public void degreeBreaksTies() {
        Crossword crossword = ExampleCrossword.SIMPLE.toCrossword();
        List<Slot> slots = crossword.getSlots();
        var creator = new CrosswordCreator(crossword, List.of("SIX", "SEVEN", "NINE", "FIVE"));
        creator.getDomains().enforceNodeConsistency();
        // top and left hold one word each; left crosses two slots, top only one
        assertEquals(slots.get(2), creator.selectUnassignedVariable(Map.of(slots.get(1), "NINE", slots.get(3), "FIVE")));
    }

    @Test
    public void leastConstrainingValueFirst() {
        Crossword crossword = ExampleCrossword.TINY.toCrossword();
        Slot across = crossword.getSlots().get(0), down = crossword.getSlots().get(1);
        var creator = new CrosswordCreator(crossword, List.of("TIE", "DOG", "CAT"));
        creator.getDomains().enforceNodeConsistency();
        // CAT leaves TIE for the down slot, DOG and TIE leave nothing
        assertAll(
                () -> assertEquals(List.of("CAT", "TIE", "DOG"), creator.orderDomainValues(across, Map.of())),
                () -> assertEquals(List.of("TIE", "DOG", "CAT"), creator.orderDomainValues(across, Map.of(down, "TIE"))));
    }

    @Test
    public void backtrackExtendsPartialAssignment() {
        Crossword crossword = ExampleCrossword.SIMPLE.toCrossword();
        List<Slot> slots = crossword.getSlots();
        var creator = new CrosswordCreator(crossword, ExampleCrossword.SIMPLE.getWords());
        creator.getDomains().enforceNodeConsistency();

        Map<Slot, String> partial = Map.of(slots.get(2), "SEVEN");
        Map<Slot, String> solution = creator.backtrack(partial).orElseThrow();
        assertAll(
                () -> assertEquals(Map.of(slots.get(2), "SEVEN"), partial),
                () -> assertEquals("SEVEN", solution.get(slots.get(2))),
                () -> assertValidSolution(crossword, solution),
                () -> assertTrue(creator.backtrack(Map.of(slots.get(2), "THREE")).isEmpty()));
    }

    @Test
    public void searchRejectsWordsOfTheWrongLength() {
        Crossword crossword = ExampleCrossword.TINY.toCrossword();
        Slot across = crossword.getSlots().get(0), down = crossword.getSlots().get(1);
        // no node consistency: "A" stays in both domains
        var creator = new CrosswordCreator(crossword, List.of("CAT", "A", "TIE"));
        assertAll(
                () -> assertEquals(List.of("CAT", "A", "TIE"), creator.orderDomainValues(across, Map.of())),
                () -> assertEquals(Map.of(across, "CAT", down, "TIE"), creator.backtrack(Map.of()).orElseThrow()));
    }
}
