package hu.advjava.mcpcrossword;

import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * A crossword variable: a maximal run of open cells in one direction.
 * Two slots are equal iff row, column, direction and length all match.
 */
public record Slot(int row, int col, Direction direction, int length) {

    public static enum Direction {
        ACROSS(0, 1),
        DOWN(1, 0);

        private final int rowStep;
        private final int colStep;

        private Direction(int rowStep, int colStep) {
            this.rowStep = rowStep;
            this.colStep = colStep;
        }

        public int getRowStep() {
            return rowStep;
        }
        public int getColStep() {
            return colStep;
        }
    }

    public Slot {
        if (direction == null) throw new IllegalArgumentException("Slot direction is required");
        if (length < 1) throw new IllegalArgumentException("Slot length must be positive: " + length);
    }

    /** Grid coordinate {row, col} of the k-th letter. */
    public int[] cell(int k) {
        if (k < 0 || k >= length) throw new IndexOutOfBoundsException("Letter " + k + " outside " + this);
        return new int[]{row + k * direction.getRowStep(), col + k * direction.getColStep()};
    }

    public Stream<int[]> cells() {
        return IntStream.range(0, length).mapToObj(this::cell);
    }

    @Override
    public String toString() {
        return "(%d, %d) %s : %d".formatted(row, col, direction, length);
    }
}
