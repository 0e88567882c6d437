package dev.automata.engine;

import dev.automata.model.Automaton;
import dev.automata.model.GeneratorLimits;
import dev.automata.model.StateLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Intersects two complete deterministic automata by synchronized product construction.
 *
 * <p>Only composite states reachable from the paired start states are materialized. Each
 * pair of operand indices gets a fresh composite index the first time it is discovered;
 * operands are never modified.
 */
public final class ProductComposer {

    private static final Logger log = LoggerFactory.getLogger(ProductComposer.class);

    private ProductComposer() {}

    public static Automaton intersect(Automaton left, Automaton right) {
        return intersect(left, right, GeneratorLimits.defaults());
    }

    /**
     * Build the automaton accepting exactly the words accepted by both operands.
     *
     * @throws StateLimitExceededException if more than {@code limits.maxStates()} composite
     *         states are reachable
     */
    public static Automaton intersect(Automaton left, Automaton right, GeneratorLimits limits) {
        if (!left.alphabet().equals(right.alphabet())) {
            throw new IllegalArgumentException("Cannot intersect automata over different alphabets: %s vs %s"
                .formatted(left.alphabet().asString(), right.alphabet().asString()));
        }
        int symbols = left.alphabet().size();

        Map<Long, Integer> indexOfPair = new HashMap<>();
        List<int[]> pairs = new ArrayList<>();
        List<int[]> rows = new ArrayList<>();
        Deque<Integer> worklist = new ArrayDeque<>();

        worklist.add(discover(left.start(), right.start(), indexOfPair, pairs, limits));

        while (!worklist.isEmpty()) {
            int current = worklist.poll();
            int[] pair = pairs.get(current);
            int[] row = new int[symbols];
            for (int c = 0; c < symbols; c++) {
                int l = left.target(pair[0], c);
                int r = right.target(pair[1], c);
                Integer known = indexOfPair.get(key(l, r));
                if (known == null) {
                    known = discover(l, r, indexOfPair, pairs, limits);
                    worklist.add(known);
                }
                row[c] = known;
            }
            // FIFO worklist: states are completed in index order
            rows.add(row);
        }

        var accepting = new BitSet(pairs.size());
        var labels = new ArrayList<String>(pairs.size());
        for (int s = 0; s < pairs.size(); s++) {
            int[] pair = pairs.get(s);
            if (left.isAccepting(pair[0]) && right.isAccepting(pair[1])) {
                accepting.set(s);
            }
            labels.add("(" + left.label(pair[0]) + "," + right.label(pair[1]) + ")");
        }

        log.debug("Product of {} x {} states reached {} composite state(s)",
            left.stateCount(), right.stateCount(), pairs.size());
        return new Automaton(left.alphabet(), rows.toArray(new int[0][]), 0, accepting, labels);
    }

    private static int discover(int l, int r, Map<Long, Integer> indexOfPair, List<int[]> pairs,
                                GeneratorLimits limits) {
        if (pairs.size() >= limits.maxStates()) {
            throw new StateLimitExceededException(limits.maxStates());
        }
        int index = pairs.size();
        pairs.add(new int[] {l, r});
        indexOfPair.put(key(l, r), index);
        return index;
    }

    private static long key(int l, int r) {
        return ((long) l << 32) | (r & 0xffffffffL);
    }
}
