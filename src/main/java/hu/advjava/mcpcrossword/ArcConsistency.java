package hu.advjava.mcpcrossword;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import hu.advjava.mcpcrossword.Crossword.Arc;

/**
 * AC-3 over the overlap graph of a crossword.
 *
 * An arc (x, y) is consistent when every word left for x has some word left for y
 * carrying the same letter at the crossing cell. Revising x can break arcs (z, x),
 * so those go back on the queue.
 */
public final class ArcConsistency {
    private static final Logger log = LogManager.getLogger(ArcConsistency.class);

    private final Crossword crossword;
    private final Domains domains;

    public ArcConsistency(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /**
     * Make x arc consistent with y. Meant to run after node consistency; a word too short
     * to reach the crossing cell has no letter there and is never supported.
     * @return whether any word was removed from x's domain
     */
    public boolean revise(Slot x, Slot y) {
        return crossword.overlap(x, y).map(overlap -> {
            Set<Character> letters = domains.get(y).stream()
                    .filter(word -> word.length() > overlap.second())
                    .map(word -> word.charAt(overlap.second()))
                    .collect(Collectors.toSet());
            Set<String> unsupported = domains.get(x).stream()
                    .filter(word -> word.length() <= overlap.first() || !letters.contains(word.charAt(overlap.first())))
                    .collect(Collectors.toSet());
            return domains.removeAll(x, unsupported) > 0;
        }).orElse(false);
    }

    /** Run AC-3 starting from every arc of the crossword. */
    public boolean ac3() {
        return ac3(crossword.arcs());
    }

    /**
     * Run AC-3 starting from the given arcs.
     * @return false as soon as some domain becomes empty, true once the queue drains
     */
    public boolean ac3(Collection<Arc> arcs) {
        Deque<Arc> queue = new ArrayDeque<>(arcs);
        int revisions = 0;
        while (!queue.isEmpty()) {
            Arc arc = queue.poll();
            if (!revise(arc.x(), arc.y())) continue;
            revisions++;
            if (domains.size(arc.x()) == 0) {
                log.debug("domain of {} emptied by {}, unsolvable", arc.x(), arc.y());
                return false;
            }
            crossword.neighbors(arc.x()).stream()
                    .filter(z -> !z.equals(arc.y()))
                    .forEach(z -> queue.add(new Arc(z, arc.x())));
        }
        log.debug("arc consistency reached after {} revisions", revisions);
        return true;
    }
}
