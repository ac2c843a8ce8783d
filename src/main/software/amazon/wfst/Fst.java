package software.amazon.wfst;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import software.amazon.wfst.input.AlphabetTokenizer;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 *  A weighted finite-state automaton or transducer: an alphabet, a set of states, one initial state and a set of
 *  final states, with weighted, labeled transitions between the states.
 *
 *  Automata are built with the constructors here (a single label, character ranges, a right-linear grammar, a set of
 *  strings) and read with {@link #generate}, {@link #analyze} and {@link #words}. Algorithms that produce a new graph
 *  and want to replace this one with it use {@link #become}.
 *
 *  Reading an automaton never changes it, so a finished automaton can be shared between readers. Changing an
 *  automaton while one of its iterators is in use gives undefined results.
 */
@NotThreadSafe
public class Fst {

    private Graph graph;

    /**
     * Creates an automaton with a single, non-final state and an empty alphabet.
     */
    public Fst() {
        this(Collections.emptySet());
    }

    /**
     * Creates an automaton with a single, non-final state.
     *
     * @param alphabet the symbols to declare; copied
     */
    public Fst(@Nonnull final Set<String> alphabet) {
        this.graph = new Graph(alphabet);
    }

    /**
     * Creates an automaton accepting exactly the given label with cost {@code weight}. The label's non-epsilon symbols
     * form the alphabet. For the epsilon label no second state is created: the initial state is made final instead.
     *
     * @param label the only label to accept
     * @param weight the final weight
     * @return the automaton
     */
    public static Fst fromLabel(@Nonnull final Label label, final double weight) {
        Fst fst = new Fst();
        if (label.equals(Label.EPSILON)) {
            fst.setFinal(fst.getInitialState(), weight);
            return fst;
        }
        for (int i = 0; i < label.size(); i++) {
            if (!label.get(i).isEmpty()) {
                fst.graph.alphabet.add(label.get(i));
            }
        }
        State target = fst.addState();
        fst.setFinal(target, weight);
        fst.getInitialState().addTransition(target, label, 0.0);
        return fst;
    }

    public static Fst fromLabel(@Nonnull final Label label) {
        return fromLabel(label, 0.0);
    }

    /**
     * Creates a two-state acceptor from a list of code point ranges.
     *
     * @param ranges the character class
     * @param complement if true, the class is negated: the automaton gets a single wildcard transition, and the
     *                   symbols of the class, together with the wildcard, make up its alphabet
     * @return the automaton
     */
    public static Fst characterRanges(@Nonnull final List<CharacterRange> ranges, final boolean complement) {
        Fst fst = new Fst();
        State second = fst.addState();
        fst.setFinal(second, 0.0);
        Set<String> alphabet = new LinkedHashSet<>();
        for (CharacterRange range : ranges) {
            for (int codePoint = range.getFirst(); codePoint <= range.getLast(); codePoint++) {
                String symbol = new String(Character.toChars(codePoint));
                if (alphabet.add(symbol) && !complement) {
                    fst.getInitialState().addTransition(second, Label.of(symbol), 0.0);
                }
            }
        }
        if (complement) {
            fst.getInitialState().addTransition(second, Label.of(Constants.WILDCARD), 0.0);
            alphabet.add(Constants.WILDCARD);
        }
        fst.setAlphabet(alphabet);
        return fst;
    }

    /**
     * Compiles a weighted right-linear grammar, see {@link GrammarCompiler}.
     */
    public static Fst rlg(@Nonnull final RightLinearGrammar grammar, @Nonnull final String startSymbol) {
        return GrammarCompiler.compile(grammar, startSymbol, null);
    }

    /**
     * Compiles a weighted right-linear grammar, treating each of {@code multicharSymbols} as a single symbol wherever
     * it occurs unquoted in a rule.
     */
    public static Fst rlg(@Nonnull final RightLinearGrammar grammar, @Nonnull final String startSymbol,
                          @Nullable final Collection<String> multicharSymbols) {
        return GrammarCompiler.compile(grammar, startSymbol, multicharSymbols);
    }

    /**
     * Creates an acceptor for exactly the given strings, each with cost 0. States are named in breadth-first order.
     *
     * @param strings the strings to accept
     * @return the automaton
     */
    public static Fst fromStrings(@Nonnull final Iterable<String> strings) {
        return fromStrings(strings, null, null);
    }

    /**
     * Creates an acceptor for exactly the given strings, each with cost 0, determinized and minimized with the given
     * algebra. States are named in breadth-first order.
     *
     * @param strings the strings to accept
     * @param multicharSymbols symbols longer than one character that the strings may contain, or null
     * @param algebra the operations to determinize and minimize with, or null to keep the grammar's own shape
     * @return the automaton
     */
    public static Fst fromStrings(@Nonnull final Iterable<String> strings,
                                  @Nullable final Collection<String> multicharSymbols,
                                  @Nullable final FstAlgebra algebra) {
        // declared up front so that an empty set of strings still has a start symbol
        RightLinearGrammar.Builder builder = RightLinearGrammar.builder()
                .addRuleSet(Constants.DEFAULT_START_SYMBOL);
        for (String string : strings) {
            builder.addRule(Constants.DEFAULT_START_SYMBOL, GrammarRule.of(string, Constants.FINAL_SYMBOL));
        }
        Fst fst = rlg(builder.build(), Constants.DEFAULT_START_SYMBOL, multicharSymbols);
        if (algebra != null) {
            fst = algebra.minimize(algebra.determinizeAsDfa(fst));
        }
        return fst.labelStatesTopology();
    }

    public State getInitialState() {
        return graph.initialState;
    }

    public void setInitialState(@Nonnull final State state) {
        requireOwnState(state);
        graph.initialState = state;
    }

    public Set<State> getStates() {
        return Collections.unmodifiableSet(graph.states);
    }

    public Set<State> getFinalStates() {
        return Collections.unmodifiableSet(graph.finalStates);
    }

    /**
     * @return the number of states
     */
    public int size() {
        return graph.states.size();
    }

    public Set<String> getAlphabet() {
        return Collections.unmodifiableSet(graph.alphabet);
    }

    public void setAlphabet(@Nonnull final Collection<String> alphabet) {
        graph.alphabet.clear();
        graph.alphabet.addAll(alphabet);
    }

    public void addToAlphabet(@Nonnull final Collection<String> symbols) {
        graph.alphabet.addAll(symbols);
    }

    /**
     * @return a new, non-final state of this automaton
     */
    public State addState() {
        return graph.newState(null);
    }

    /**
     * @param name the display name of the state; it also identifies rule-set states of grammars
     * @return a new, non-final state of this automaton
     */
    public State addState(@Nullable final Object name) {
        return graph.newState(name);
    }

    /**
     * Makes a state final.
     *
     * @param state a state of this automaton
     * @param finalWeight the cost of stopping in it; must be finite
     */
    public void setFinal(@Nonnull final State state, final double finalWeight) {
        requireOwnState(state);
        if (Double.isInfinite(finalWeight) || Double.isNaN(finalWeight)) {
            throw new IllegalArgumentException("Final weight must be finite, got " + finalWeight);
        }
        state.setFinalWeight(finalWeight);
        graph.finalStates.add(state);
    }

    /**
     * Makes a state non-final.
     *
     * @param state a state of this automaton
     */
    public void setNotFinal(@Nonnull final State state) {
        requireOwnState(state);
        state.setFinalWeight(Constants.NOT_FINAL);
        graph.finalStates.remove(state);
    }

    /**
     * Removes states, and every transition into them, from this automaton. The initial state cannot be removed.
     *
     * @param doomed the states to remove
     */
    public void removeStates(@Nonnull final Set<State> doomed) {
        if (doomed.contains(graph.initialState)) {
            throw new IllegalArgumentException("The initial state cannot be removed");
        }
        graph.states.removeAll(doomed);
        graph.finalStates.removeAll(doomed);
        for (State state : graph.states) {
            state.removeTransitionsTo(doomed);
        }
        assert invariantsHold();
    }

    /**
     * Replaces the whole contents of this automaton with the contents of {@code other}. {@code other} is handed this
     * automaton's previous contents in exchange, so the two never share states.
     *
     * @param other the automaton whose graph to take over
     * @return this automaton
     */
    public Fst become(@Nonnull final Fst other) {
        Graph mine = this.graph;
        this.graph = other.graph;
        other.graph = mine;
        assert invariantsHold() && other.invariantsHold();
        return this;
    }

    /**
     * @param states source states
     * @return every transition leaving the given states, together with its source
     */
    public List<StateTransition> allTransitions(@Nonnull final Iterable<State> states) {
        List<StateTransition> all = new ArrayList<>();
        for (State state : states) {
            for (Transition transition : state.getTransitions()) {
                all.add(new StateTransition(state, transition));
            }
        }
        return all;
    }

    /**
     * @param states source states
     * @return every label used by the given states, mapped to all the states reachable over it from any of them
     */
    public Map<Label, Set<State>> allTransitionsByLabel(@Nonnull final Iterable<State> states) {
        Map<Label, Set<State>> byLabel = new LinkedHashMap<>();
        for (State state : states) {
            for (Label label : state.getLabels()) {
                Set<State> targets = byLabel.computeIfAbsent(label, l -> new LinkedHashSet<>());
                for (Transition transition : state.getTransitions(label)) {
                    targets.add(transition.getTarget());
                }
            }
        }
        return byLabel;
    }

    /**
     * Copies this automaton, passing every label and weight through the given functions.
     *
     * @param modLabel computes the new label from the old label and weight
     * @param modWeight computes the new weight from the old label and weight
     * @return the copy
     */
    public Fst copyMod(@Nonnull final BiFunction<Label, Double, Label> modLabel,
                       @Nonnull final BiFunction<Label, Double, Double> modWeight) {
        return copy((label, weight) -> true, modLabel, modWeight);
    }

    /**
     * Copies this automaton, leaving out transitions whose label does not satisfy {@code labelFilter}.
     *
     * @param labelFilter decides which labels to keep
     * @return the copy
     */
    public Fst copyFiltered(@Nonnull final Predicate<Label> labelFilter) {
        return copy((label, weight) -> labelFilter.test(label), (label, weight) -> label, (label, weight) -> weight);
    }

    public Fst copy() {
        return copyFiltered(label -> true);
    }

    private Fst copy(final BiFunction<Label, Double, Boolean> keep,
                     final BiFunction<Label, Double, Label> modLabel,
                     final BiFunction<Label, Double, Double> modWeight) {
        Fst copy = new Fst(graph.alphabet);
        Map<State, State> q1q2 = new HashMap<>();
        for (State state : graph.states) {
            State twin = state == graph.initialState ? copy.getInitialState() : copy.addState();
            twin.setName(state.getName());
            q1q2.put(state, twin);
        }
        for (State state : graph.states) {
            for (Transition t : state.getTransitions()) {
                if (keep.apply(t.getLabel(), t.getWeight())) {
                    q1q2.get(state).addTransition(q1q2.get(t.getTarget()),
                            modLabel.apply(t.getLabel(), t.getWeight()),
                            modWeight.apply(t.getLabel(), t.getWeight()));
                }
            }
        }
        for (State state : graph.finalStates) {
            copy.setFinal(q1q2.get(state), state.getFinalWeight());
        }
        assert copy.invariantsHold();
        return copy;
    }

    /**
     * Drops alphabet symbols no transition uses. If some transition uses the wildcard, the alphabet is kept whole,
     * since it is what the wildcard is defined against.
     *
     * @return this automaton
     */
    public Fst cleanupSigma() {
        Set<String> seen = new HashSet<>();
        for (State state : graph.states) {
            for (Label label : state.getLabels()) {
                for (int i = 0; i < label.size(); i++) {
                    seen.add(label.get(i));
                }
            }
        }
        if (!seen.contains(Constants.WILDCARD)) {
            graph.alphabet.retainAll(seen);
        }
        return this;
    }

    /**
     * Numbers the states that have no name, starting from the initial state.
     *
     * @param force if true, every state is numbered, named or not
     * @return each state's display key: its name, or its number
     */
    public Map<State, Object> numberUnnamedStates(final boolean force) {
        Map<State, Object> keys = new LinkedHashMap<>();
        int counter = 0;
        List<State> ordered = new ArrayList<>();
        ordered.add(graph.initialState);
        for (State state : graph.states) {
            if (state != graph.initialState) {
                ordered.add(state);
            }
        }
        for (State state : ordered) {
            if (state.getName() == null || force) {
                keys.put(state, counter++);
            } else {
                keys.put(state, state.getName());
            }
        }
        return keys;
    }

    /**
     * Renames every state after its position in a breadth-first walk from the initial state, see
     * {@link StateNumbering}. States that cannot be reached are numbered after the reachable ones.
     *
     * @return this automaton
     */
    public Fst labelStatesTopology() {
        Object2IntMap<State> numbers = StateNumbering.number(this);
        int next = numbers.size();
        for (State state : graph.states) {
            if (numbers.containsKey(state)) {
                state.setName(numbers.getInt(state));
            } else {
                state.setName(next++);
            }
        }
        return this;
    }

    /**
     * Splits a string into symbols of this automaton's alphabet, taking the longest alphabet symbol at each position
     * and falling back to a single character.
     *
     * @param word the string
     * @return the symbols
     */
    public List<String> tokenizeAgainstAlphabet(@Nonnull final String word) {
        return AlphabetTokenizer.tokenize(word, graph.alphabet);
    }

    /**
     * Passes {@code word} through the automaton from input to output side.
     *
     * @param word the input string
     * @return the outputs, cheapest first
     */
    public Iterator<String> generate(@Nonnull final String word) {
        return texts(apply(word, false, ApplyConfiguration.DEFAULT));
    }

    public Iterator<ApplyResult> generate(@Nonnull final String word, @Nonnull final ApplyConfiguration configuration) {
        return apply(word, false, configuration);
    }

    /**
     * Passes {@code word} through the automaton from output to input side.
     *
     * @param word the output string
     * @return the inputs, cheapest first
     */
    public Iterator<String> analyze(@Nonnull final String word) {
        return texts(apply(word, true, ApplyConfiguration.DEFAULT));
    }

    public Iterator<ApplyResult> analyze(@Nonnull final String word, @Nonnull final ApplyConfiguration configuration) {
        return apply(word, true, configuration);
    }

    /**
     * Finds every accepting path whose consumed side spells {@code word}, and returns what those paths produce on
     * the other side. Results come lazily and in order of non-decreasing cost.
     *
     * @param word the string to consume
     * @param inverse false to consume the input side and produce the output side, true for the opposite
     * @param configuration result and flag diacritic options
     * @return the results
     */
    public Iterator<ApplyResult> apply(@Nonnull final String word, final boolean inverse,
                                       @Nonnull final ApplyConfiguration configuration) {
        Objects.requireNonNull(word, "word");
        Objects.requireNonNull(configuration, "configuration");
        return PathFinder.find(new SearchTask(this, tokenizeAgainstAlphabet(word), inverse, configuration));
    }

    /**
     * Walks every accepting path, breadth first. Never ends for automata with cycles.
     *
     * @return the paths, each with its total cost
     */
    public Iterator<WeightedPath> words() {
        return new LanguageEnumerator(this);
    }

    /**
     * Checks the structural invariants: the initial and final states belong to the automaton, every transition leads
     * to a state of the automaton, exactly the final states have a finite final weight, and no label maps to an empty
     * set of transitions.
     *
     * @throws IllegalStateException naming the first violation found
     */
    public void checkInvariants() {
        if (!graph.states.contains(graph.initialState)) {
            throw new IllegalStateException("Initial state " + graph.initialState.getId() + " is not in the automaton");
        }
        for (State state : graph.finalStates) {
            if (!graph.states.contains(state)) {
                throw new IllegalStateException("Final state " + state.getId() + " is not in the automaton");
            }
        }
        for (State state : graph.states) {
            if (state.isFinal() != graph.finalStates.contains(state)) {
                throw new IllegalStateException("State " + state.getId() + " has final weight "
                        + state.getFinalWeight() + " but final-state membership " + graph.finalStates.contains(state));
            }
            if (!state.hasNoEmptyLabels()) {
                throw new IllegalStateException("State " + state.getId() + " maps a label to no transitions");
            }
            for (Transition transition : state.getTransitions()) {
                if (!graph.states.contains(transition.getTarget())) {
                    throw new IllegalStateException("Transition " + transition + " from state " + state.getId()
                            + " leaves the automaton");
                }
            }
        }
    }

    private boolean invariantsHold() {
        checkInvariants();
        return true;
    }

    private void requireOwnState(final State state) {
        Objects.requireNonNull(state, "state");
        if (!graph.states.contains(state)) {
            throw new IllegalArgumentException("State " + state.getId() + " does not belong to this automaton");
        }
    }

    private static Iterator<String> texts(final Iterator<ApplyResult> results) {
        return new Iterator<String>() {
            @Override
            public boolean hasNext() {
                return results.hasNext();
            }

            @Override
            public String next() {
                return results.next().getText();
            }
        };
    }

    @Override
    public String toString() {
        return "Fst{" +
                "states=" + graph.states.size() +
                ", finalStates=" + graph.finalStates.size() +
                ", alphabet=" + graph.alphabet +
                '}';
    }
}
