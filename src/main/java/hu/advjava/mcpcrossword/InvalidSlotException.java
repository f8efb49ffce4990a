package hu.advjava.mcpcrossword;

/** A slot was queried that does not belong to the grid. */
public class InvalidSlotException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final Slot slot;

    public InvalidSlotException(Slot slot) {
        super("Slot is not part of this crossword: " + slot);
        this.slot = slot;
    }

    public Slot getSlot() {
        return slot;
    }
}
