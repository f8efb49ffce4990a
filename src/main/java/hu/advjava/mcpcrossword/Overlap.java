package hu.advjava.mcpcrossword;

/**
 * Character indices at which two slots cross: {@code first} belongs to the
 * slot passed first to {@link Crossword#overlap(Slot, Slot)}.
 */
public record Overlap(int first, int second) {

    public Overlap swap() {
        return new Overlap(second, first);
    }

    /** True when both words reach the crossing and carry the same letter there. */
    public boolean agrees(String firstWord, String secondWord) {
        return firstWord.length() > first && secondWord.length() > second
                && firstWord.charAt(first) == secondWord.charAt(second);
    }
}
