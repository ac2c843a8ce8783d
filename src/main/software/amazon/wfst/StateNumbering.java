package software.amazon.wfst;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

/**
 * Numbers the states of an automaton in a repeatable way: breadth first from the initial state, which gets 0, visiting
 * the transitions of each state sorted by label and then by weight. Two runs over an unchanged automaton give the same
 * numbers, whatever order its sets happen to iterate in, so serializers can rely on them. States that cannot be reached
 * from the initial state get no number.
 */
public final class StateNumbering {

    public static final int NO_NUMBER = -1;

    private StateNumbering() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * @param fst the automaton
     * @return the number of every reachable state; {@link #NO_NUMBER} for any other state
     */
    public static Object2IntMap<State> number(final Fst fst) {
        Object2IntMap<State> numbers = new Object2IntLinkedOpenHashMap<>();
        numbers.defaultReturnValue(NO_NUMBER);
        Queue<State> queue = new ArrayDeque<>();
        queue.add(fst.getInitialState());
        numbers.put(fst.getInitialState(), 0);
        while (!queue.isEmpty()) {
            State state = queue.remove();
            for (Transition transition : state.getSortedTransitions()) {
                State target = transition.getTarget();
                if (!numbers.containsKey(target)) {
                    numbers.put(target, numbers.size());
                    queue.add(target);
                }
            }
        }
        return numbers;
    }

    /**
     * @param fst the automaton
     * @return the reachable states in numbering order
     */
    public static List<State> orderedStates(final Fst fst) {
        return new ArrayList<>(number(fst).keySet());
    }
}
