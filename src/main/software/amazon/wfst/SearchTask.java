package software.amazon.wfst;

import software.amazon.wfst.flag.FlagStringFilter;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Represents the state of one pass of a string through an automaton: the tokenized string, the queue of partial
 * paths, and the options. Every call to {@link Fst#apply} gets a task of its own.
 */
@NotThreadSafe
class SearchTask {

    // What we're trying to consume
    final List<String> tokens;

    // false: consume the input side and produce the output side; true: the other way round
    final boolean inverse;

    final ApplyConfiguration configuration;

    private final Set<String> alphabet;

    // null unless flag diacritics are obeyed
    private final FlagStringFilter flagFilter;

    private final PriorityQueue<SearchStep> queue = new PriorityQueue<>();

    private long sequence = 0;

    SearchTask(final Fst fst, final List<String> tokens, final boolean inverse,
               final ApplyConfiguration configuration) {
        this.tokens = tokens;
        this.inverse = inverse;
        this.configuration = configuration;
        this.alphabet = fst.getAlphabet();
        this.flagFilter = configuration.isObeyFlags() ? new FlagStringFilter(alphabet) : null;
        queue.add(SearchStep.start(fst.getInitialState(), nextSequence()));
    }

    long nextSequence() {
        return sequence++;
    }

    void addStep(final SearchStep step) {
        queue.add(step);
    }

    boolean stepsRemain() {
        return !queue.isEmpty();
    }

    SearchStep nextStep() {
        return queue.remove();
    }

    boolean isInAlphabet(final String symbol) {
        return alphabet.contains(symbol);
    }

    /**
     * @return true if flag diacritics are ignored or the produced symbols carry a consistent set of them
     */
    boolean flagsAgree(final List<String> produced) {
        return flagFilter == null || flagFilter.test(produced);
    }
}
