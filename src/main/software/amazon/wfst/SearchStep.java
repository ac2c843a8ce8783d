package software.amazon.wfst;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A partial path waiting in the search queue: how much it has cost so far, how many input symbols it has consumed,
 * what it has produced, and the state it has reached. A step whose state is {@code null} has stopped and only awaits
 * the check that it consumed the whole input.
 *
 * Steps order by cost and then by the order they were queued in, so equal-cost paths come out first-in first-out.
 */
@Immutable
final class SearchStep implements Comparable<SearchStep> {

    final double cost;
    final long sequence;
    final int consumed;
    @Nullable
    final State state;
    @Nullable
    private final Produced produced;

    private SearchStep(final double cost, final long sequence, final int consumed,
                       @Nullable final Produced produced, @Nullable final State state) {
        this.cost = cost;
        this.sequence = sequence;
        this.consumed = consumed;
        this.produced = produced;
        this.state = state;
    }

    static SearchStep start(final State initialState, final long sequence) {
        return new SearchStep(0.0, sequence, 0, null, initialState);
    }

    /**
     * @return a step that stops here, paying the final weight of the current state
     */
    SearchStep finish(final long nextSequence) {
        return new SearchStep(cost + state.getFinalWeight(), nextSequence, consumed, produced, null);
    }

    /**
     * @return a step that has taken {@code transition}, consumed {@code consumedSymbols} more input symbols and
     * produced {@code symbol}
     */
    SearchStep advance(final Transition transition, final int consumedSymbols, final String symbol,
                       final long nextSequence) {
        return new SearchStep(cost + transition.getWeight(), nextSequence, consumed + consumedSymbols,
                new Produced(symbol, produced), transition.getTarget());
    }

    boolean isFinished() {
        return state == null;
    }

    List<String> getProduced() {
        List<String> symbols = new ArrayList<>();
        for (Produced p = produced; p != null; p = p.previous) {
            symbols.add(p.symbol);
        }
        Collections.reverse(symbols);
        return symbols;
    }

    @Override
    public int compareTo(final SearchStep other) {
        int cmp = Double.compare(cost, other.cost);
        return cmp != 0 ? cmp : Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return "Step{cost=" + cost + ", consumed=" + consumed + ", produced=" + getProduced()
                + ", state=" + (state == null ? "done" : state.getId()) + '}';
    }

    // Output symbols are shared between a step and all of its successors.
    private static final class Produced {
        final String symbol;
        final Produced previous;

        Produced(final String symbol, final Produced previous) {
            this.symbol = symbol;
            this.previous = previous;
        }
    }
}
