package hu.advjava.mcpcrossword;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Stack;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fills a crossword from a word list.
 *
 * Pipeline:
 *   1) node consistency: words of the wrong length leave each slot's domain
 *   2) AC-3 over all arcs
 *   3) backtracking search, minimum-remaining-values then degree to pick a slot,
 *      least-constraining-value to order its words
 *
 * Propagation is not repeated during search; the pruned domains from steps 1-2 drive
 * every ordering decision.
 */
public class CrosswordCreator {
    private static final Logger log = LogManager.getLogger(CrosswordCreator.class);

    public static enum State {
        SOLVED,
        NO_SOLUTION
    }

    private final Crossword crossword;
    private final Domains domains;
    private final ArcConsistency arcConsistency;
    private final AssignmentValidator validator;

    private long attempts;
    private long backtracks;

    public CrosswordCreator(Crossword crossword, Collection<String> words) {
        this.crossword = crossword;
        this.domains = Domains.initialize(crossword.getSlots(), words);
        this.arcConsistency = new ArcConsistency(crossword, domains);
        this.validator = new AssignmentValidator(crossword);
    }

    public Crossword getCrossword() {
        return crossword;
    }

    public Domains getDomains() {
        return domains;
    }

    public AssignmentValidator getValidator() {
        return validator;
    }

    /**
     * Enforce node and arc consistency, then search.
     * @return a complete, consistent assignment, or empty when the puzzle has no solution
     */
    public Optional<Map<Slot, String>> solve() {
        domains.enforceNodeConsistency();
        if (!arcConsistency.ac3() || domains.isAnyEmpty()) {
            log.info("No solution: arc consistency left an empty domain");
            return Optional.empty();
        }
        var solution = backtrack(Map.of());
        log.debug("{} after {} attempts and {} backtracks ({} slots)",
                solution.isPresent() ? State.SOLVED : State.NO_SOLUTION, attempts, backtracks, crossword.getSlots().size());
        return solution;
    }

    //    Calls the lambda time and again, discards all "nothing" values and returns the first actual content.
    //    The lambda must eventually produce something.
    static <R> R findContent(Supplier<Optional<R>> lambda) {
        return Stream.generate(lambda).filter(Optional::isPresent).map(Optional::get).findFirst().get();
    }

    // One search level: the slot being filled and the words not tried for it yet.
    record Frame(Slot slot, Iterator<String> candidates) {}

    /**
     * Backtracking search extending the given partial assignment, which is not modified.
     * Words are drawn from the current domains, so run node consistency first; words of the
     * wrong length are rejected by the validator rather than tried.
     * @return the completed assignment in slot order, or empty if none extends the input
     */
    public Optional<Map<Slot, String>> backtrack(Map<Slot, String> assignment) {
        Map<Slot, String> working = new LinkedHashMap<>(assignment);
        if (validator.isComplete(working)) return Optional.of(ordered(working));

        var stack = new Stack<Frame>();
        stack.push(frameFor(working));

        State state = findContent(() -> maybeExtend(working, stack));
        return state == State.SOLVED ? Optional.of(ordered(working)) : Optional.empty();
    }

    //    maybeExtend does one step of the search.
    //    The top frame's previous word is taken back first. If the frame has no words left, it is popped: the
    //    parent level will then retract its own word on the next step. Otherwise the next word goes in; an
    //    inconsistent word stays undecided, a consistent one either completes the grid or opens a new level.
    private Optional<State> maybeExtend(Map<Slot, String> assignment, Stack<Frame> stack) {
        if (stack.isEmpty()) return Optional.of(State.NO_SOLUTION);

        Frame frame = stack.peek();
        assignment.remove(frame.slot());
        if (!frame.candidates().hasNext()) {
            stack.pop();
            backtracks++;
            return Optional.empty();
        }

        assignment.put(frame.slot(), frame.candidates().next());
        attempts++;
        if (!validator.isConsistent(assignment)) return Optional.empty();
        if (validator.isComplete(assignment)) return Optional.of(State.SOLVED);

        stack.push(frameFor(assignment));
        return Optional.empty();
    }

    private Frame frameFor(Map<Slot, String> assignment) {
        Slot slot = selectUnassignedVariable(assignment);
        return new Frame(slot, orderDomainValues(slot, assignment).iterator());
    }

    /**
     * The unassigned slot with the fewest remaining words; ties go to the slot with the
     * most neighbours, then to the earliest slot in grid order.
     */
    public Slot selectUnassignedVariable(Map<Slot, String> assignment) {
        return crossword.getSlots().stream()
                .filter(slot -> !assignment.containsKey(slot))
                .min(Comparator.<Slot>comparingInt(domains::size)
                        .thenComparing(Comparator.<Slot>comparingInt(crossword::degree).reversed()))
                .orElseThrow(() -> new IllegalStateException("Every slot is already assigned"));
    }

    /**
     * The words of a slot's domain, ordered by how many candidates each rules out among the
     * unassigned neighbours (fewest first). Equal counts keep word-list order. A word that
     * does not reach a crossing rules out every candidate of that neighbour.
     */
    public List<String> orderDomainValues(Slot slot, Map<Slot, String> assignment) {
        List<Slot> open = crossword.neighbors(slot).stream()
                .filter(neighbor -> !assignment.containsKey(neighbor))
                .toList();
        Map<String, Long> eliminated = domains.get(slot).stream()
                .collect(Collectors.toMap(word -> word, word -> ruledOut(slot, word, open),
                        (a, b) -> a, LinkedHashMap::new));
        return domains.get(slot).stream()
                .sorted(Comparator.comparingLong(eliminated::get))
                .toList();
    }

    private long ruledOut(Slot slot, String word, List<Slot> neighbors) {
        return neighbors.stream().mapToLong(neighbor -> {
            Overlap o = crossword.overlap(slot, neighbor).orElseThrow();
            return domains.get(neighbor).stream()
                    .filter(other -> !o.agrees(word, other))
                    .count();
        }).sum();
    }

    private Map<Slot, String> ordered(Map<Slot, String> assignment) {
        Map<Slot, String> result = new LinkedHashMap<>();
        crossword.getSlots().stream()
                .filter(assignment::containsKey)
                .forEach(slot -> result.put(slot, assignment.get(slot)));
        return Collections.unmodifiableMap(result);
    }
}
