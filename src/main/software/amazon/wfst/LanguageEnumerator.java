package software.amazon.wfst;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Queue;

/**
 * Walks all accepting paths of an automaton breadth first, reporting each with its total cost in the order it is
 * discovered. The walk does not remember visited states, so for an automaton with a cycle it never runs dry.
 */
@NotThreadSafe
final class LanguageEnumerator implements Iterator<WeightedPath> {

    private final Queue<Partial> queue = new ArrayDeque<>();

    private WeightedPath next;

    LanguageEnumerator(final Fst fst) {
        queue.add(new Partial(fst.getInitialState(), 0.0, new ArrayList<>()));
    }

    @Override
    public boolean hasNext() {
        while (next == null && !queue.isEmpty()) {
            Partial partial = queue.remove();
            for (Transition transition : partial.state.getTransitions()) {
                List<Label> labels = new ArrayList<>(partial.labels.size() + 1);
                labels.addAll(partial.labels);
                labels.add(transition.getLabel());
                queue.add(new Partial(transition.getTarget(), partial.cost + transition.getWeight(), labels));
            }
            if (partial.state.isFinal()) {
                next = new WeightedPath(partial.cost + partial.state.getFinalWeight(), partial.labels);
            }
        }
        return next != null;
    }

    @Override
    public WeightedPath next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        WeightedPath path = next;
        next = null;
        return path;
    }

    private static final class Partial {
        final State state;
        final double cost;
        final List<Label> labels;

        Partial(final State state, final double cost, final List<Label> labels) {
            this.state = state;
            this.cost = cost;
            this.labels = labels;
        }
    }
}
