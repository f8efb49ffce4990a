package hu.advjava.mcpcrossword;

/** Malformed grid structure, e.g. rows of unequal width. */
public class StructureException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public StructureException(String message) {
        super(message);
    }
}
