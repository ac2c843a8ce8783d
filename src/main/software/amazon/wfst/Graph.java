package software.amazon.wfst;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Everything an automaton owns: its alphabet, its states, which of them is initial and which are final, and the
 * counter that hands out state ids. An {@link Fst} points at exactly one Graph, so replacing an automaton's contents
 * is a single reference swap.
 */
@NotThreadSafe
final class Graph {

    final Set<String> alphabet;
    final Set<State> states = new LinkedHashSet<>();
    final Set<State> finalStates = new LinkedHashSet<>();
    State initialState;
    private int nextStateId = 0;

    Graph(final Set<String> alphabet) {
        this.alphabet = new LinkedHashSet<>(alphabet);
        this.initialState = newState(null);
    }

    State newState(final Object name) {
        State state = new State(nextStateId++, name);
        states.add(state);
        return state;
    }
}
