package hu.advjava.mcpcrossword;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import hu.advjava.mcpcrossword.Slot.Direction;

/**
 * Crossword grid geometry.
 *
 * Model:
 *   - height x width cells, each either open (fillable) or blocked.
 *   - every maximal run of 2+ open cells in a row is an ACROSS slot, in a column a DOWN slot.
 *   - two slots crossing in one cell get an {@link Overlap} at that cell's index within each slot.
 *
 * The grid, its slots and overlaps are computed once and never change.
 */
public final class Crossword {

    public static final char OPEN = '_';

    private final int height;
    private final int width;
    private final boolean[][] structure;

    // ACROSS slots row-major, then DOWN slots column-major
    private final List<Slot> slots;
    private final Map<Slot, Map<Slot, Overlap>> overlaps;

    /** A slot paired with one of its neighbours; the unit of work of arc consistency. */
    public record Arc(Slot x, Slot y) {}

    public Crossword(int height, int width, BiPredicate<Integer, Integer> isOpen) {
        if (height < 0 || width < 0) throw new StructureException("Negative grid size " + height + "x" + width);
        this.height = height;
        this.width = width;
        this.structure = IntStream.range(0, height)
                .mapToObj(r -> {
                    boolean[] row = new boolean[width];
                    IntStream.range(0, width).forEach(c -> row[c] = isOpen.test(r, c));
                    return row;
                })
                .toArray(boolean[][]::new);
        this.slots = Collections.unmodifiableList(findSlots());
        this.overlaps = computeOverlaps();
    }

    /**
     * Parse text rows, {@value #OPEN} marks an open cell and anything else a blocked one.
     * All rows must have the same width.
     */
    public static Crossword parse(List<String> rows) {
        if (rows == null) throw new StructureException("Structure is missing");
        int width = rows.isEmpty() ? 0 : rows.get(0).length();
        IntStream.range(0, rows.size())
                .filter(r -> rows.get(r).length() != width)
                .findFirst()
                .ifPresent(r -> {
                    throw new StructureException("Ragged structure: row %d has width %d, expected %d"
                            .formatted(r, rows.get(r).length(), width));
                });
        return new Crossword(rows.size(), width, (r, c) -> rows.get(r).charAt(c) == OPEN);
    }

    public static Crossword parse(String... rows) {
        return parse(Arrays.asList(rows));
    }

    /* ===================== Slot discovery ===================== */

    private List<Slot> findSlots() {
        List<Slot> found = new ArrayList<>();
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                if (startsRun(r, c, Direction.ACROSS)) found.add(new Slot(r, c, Direction.ACROSS, runLength(r, c, Direction.ACROSS)));
            }
        }
        for (int c = 0; c < width; c++) {
            for (int r = 0; r < height; r++) {
                if (startsRun(r, c, Direction.DOWN)) found.add(new Slot(r, c, Direction.DOWN, runLength(r, c, Direction.DOWN)));
            }
        }
        return found;
    }

    // a run starts at an open cell whose predecessor is blocked or off-grid, and spans 2+ cells
    private boolean startsRun(int r, int c, Direction d) {
        return isOpen(r, c)
                && !isOpen(r - d.getRowStep(), c - d.getColStep())
                && isOpen(r + d.getRowStep(), c + d.getColStep());
    }

    private int runLength(int r, int c, Direction d) {
        return (int) Stream.iterate(new int[]{r, c}, cell -> isOpen(cell[0], cell[1]),
                        cell -> new int[]{cell[0] + d.getRowStep(), cell[1] + d.getColStep()})
                .count();
    }

    /* ===================== Overlaps ===================== */

    private Map<Slot, Map<Slot, Overlap>> computeOverlaps() {
        // cell index -> the ACROSS slot covering it, and its letter index
        Slot[] acrossAt = new Slot[height * width];
        int[] acrossIndex = new int[height * width];
        slots.stream().filter(s -> s.direction() == Direction.ACROSS).forEach(s ->
                IntStream.range(0, s.length()).forEach(k -> {
                    int[] cell = s.cell(k);
                    acrossAt[cell[0] * width + cell[1]] = s;
                    acrossIndex[cell[0] * width + cell[1]] = k;
                }));

        Map<Slot, Map<Slot, Overlap>> table = new LinkedHashMap<>();
        slots.forEach(s -> table.put(s, new LinkedHashMap<>()));
        slots.stream().filter(s -> s.direction() == Direction.DOWN).forEach(down ->
                IntStream.range(0, down.length()).forEach(k -> {
                    int[] cell = down.cell(k);
                    Slot across = acrossAt[cell[0] * width + cell[1]];
                    if (across != null) {
                        Overlap o = new Overlap(acrossIndex[cell[0] * width + cell[1]], k);
                        table.get(across).put(down, o);
                        table.get(down).put(across, o.swap());
                    }
                }));

        return table.entrySet().stream().collect(Collectors.toUnmodifiableMap(
                Map.Entry::getKey, e -> Collections.unmodifiableMap(e.getValue())));
    }

    /* ===================== Public API ===================== */

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    /** True for an open cell; coordinates outside the grid count as blocked. */
    public boolean isOpen(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width && structure[row][col];
    }

    public List<Slot> getSlots() {
        return slots;
    }

    public boolean contains(Slot slot) {
        return slot != null && overlaps.containsKey(slot);
    }

    /** Where x and y cross, indices ordered as (x, y); empty when they do not cross or x equals y. */
    public Optional<Overlap> overlap(Slot x, Slot y) {
        return Optional.ofNullable(table(x).get(checked(y)));
    }

    /** Slots crossing the given one, in slot order. */
    public Set<Slot> neighbors(Slot slot) {
        Map<Slot, Overlap> row = table(slot);
        return slots.stream().filter(row::containsKey).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int degree(Slot slot) {
        return table(slot).size();
    }

    /** All ordered pairs of slots with a defined overlap. */
    public List<Arc> arcs() {
        return slots.stream()
                .flatMap(x -> neighbors(x).stream().map(y -> new Arc(x, y)))
                .toList();
    }

    private Map<Slot, Overlap> table(Slot slot) {
        return overlaps.get(checked(slot));
    }

    private Slot checked(Slot slot) {
        if (!contains(slot)) throw new InvalidSlotException(slot);
        return slot;
    }

    @Override
    public String toString() {
        return IntStream.range(0, height)
                .mapToObj(r -> IntStream.range(0, width)
                        .mapToObj(c -> structure[r][c] ? String.valueOf(OPEN) : "#")
                        .collect(Collectors.joining()))
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
