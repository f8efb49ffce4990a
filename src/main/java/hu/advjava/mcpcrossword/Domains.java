package hu.advjava.mcpcrossword;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Candidate words per slot. Domains only ever shrink.
 * Word order within a domain is the order of the source word list.
 */
public final class Domains {
    private static final Logger log = LogManager.getLogger(Domains.class);

    private final Map<Slot, Set<String>> bySlot;

    private Domains(Map<Slot, Set<String>> bySlot) {
        this.bySlot = bySlot;
    }

    /** Every slot starts with its own copy of the whole word list; duplicates collapse. */
    public static Domains initialize(Collection<Slot> slots, Collection<String> words) {
        Map<Slot, Set<String>> bySlot = new LinkedHashMap<>();
        slots.forEach(slot -> bySlot.put(slot, new LinkedHashSet<>(words)));
        return new Domains(bySlot);
    }

    /** Deep copy; changes to either side are not visible in the other. */
    public Domains copy() {
        return new Domains(bySlot.entrySet().stream().collect(Collectors.toMap(
                Map.Entry::getKey, e -> new LinkedHashSet<>(e.getValue()), (a, b) -> a, LinkedHashMap::new)));
    }

    /** Drop every word whose length differs from its slot's length. */
    public int enforceNodeConsistency() {
        int removed = bySlot.entrySet().stream()
                .mapToInt(e -> removeAll(e.getKey(), e.getValue().stream()
                        .filter(word -> word.length() != e.getKey().length())
                        .collect(Collectors.toSet())))
                .sum();
        log.debug("node consistency removed {} candidates", removed);
        return removed;
    }

    /** Read-only view of a slot's candidates. */
    public Set<String> get(Slot slot) {
        return Collections.unmodifiableSet(domain(slot));
    }

    public int size(Slot slot) {
        return domain(slot).size();
    }

    /** Removes the given words from a slot's domain, returning how many were present. */
    public int removeAll(Slot slot, Collection<String> words) {
        Set<String> domain = domain(slot);
        int before = domain.size();
        domain.removeAll(words);
        return before - domain.size();
    }

    public boolean isAnyEmpty() {
        return bySlot.values().stream().anyMatch(Set::isEmpty);
    }

    public Set<Slot> slots() {
        return Collections.unmodifiableSet(bySlot.keySet());
    }

    private Set<String> domain(Slot slot) {
        Set<String> domain = slot == null ? null : bySlot.get(slot);
        if (domain == null) throw new InvalidSlotException(slot);
        return domain;
    }

    @Override
    public String toString() {
        return bySlot.entrySet().stream()
                .map(e -> e.getKey() + " -> " + e.getValue().size())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
