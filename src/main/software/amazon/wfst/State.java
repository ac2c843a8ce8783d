package software.amazon.wfst;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Represents a state in an automaton and maps labels to transitions. One label can have many transitions, with
 * different targets or weights, meaning this is a state of a non-deterministic weighted automaton.
 *
 * A label is only ever mapped to a non-empty set of transitions; removing the last transition of a label removes the
 * label.
 */
@NotThreadSafe
public final class State {

    private static final Comparator<Transition> BY_LABEL_THEN_WEIGHT =
            Comparator.comparing(Transition::getLabel).thenComparingDouble(Transition::getWeight);

    private final int id;

    private Object name;

    private double finalWeight = Constants.NOT_FINAL;

    private final Map<Label, Set<Transition>> transitions = new LinkedHashMap<>();

    /* Transitions keyed by the individual input symbol and by the individual output symbol. Both are rebuilt on first
     * access after any change to this state's transitions; never hand them out without going through the accessors.
     */
    private Map<String, Set<Transition>> transitionsByInput;
    private Map<String, Set<Transition>> transitionsByOutput;
    private boolean indicesStale = true;

    State(final int id, @Nullable final Object name) {
        this.id = id;
        this.name = name;
    }

    /**
     * @return the handle assigned to this state by the automaton that created it. Unique within that automaton.
     */
    public int getId() {
        return id;
    }

    @Nullable
    public Object getName() {
        return name;
    }

    public void setName(@Nullable final Object name) {
        this.name = name;
    }

    /**
     * @return the cost of stopping in this state, or positive infinity if the state is not final
     */
    public double getFinalWeight() {
        return finalWeight;
    }

    /**
     * Changes the cost of stopping in this state. Callers should go through {@link Fst#setFinal} so that the final
     * state set of the automaton stays in step.
     */
    void setFinalWeight(final double finalWeight) {
        this.finalWeight = finalWeight;
    }

    public boolean isFinal() {
        return finalWeight != Constants.NOT_FINAL;
    }

    /**
     * Adds a transition from this state to {@code target}. Adding a transition that is already present, with the same
     * target, label and weight, changes nothing.
     *
     * @param target the state to transfer to
     * @param label the label of the transition
     * @param weight the cost of the transition
     * @return the transition
     */
    public Transition addTransition(@Nonnull final State target, @Nonnull final Label label, final double weight) {
        Transition transition = new Transition(target, label, weight);
        transitions.computeIfAbsent(label, l -> new LinkedHashSet<>()).add(transition);
        indicesStale = true;
        return transition;
    }

    public Transition addTransition(@Nonnull final State target, @Nonnull final Label label) {
        return addTransition(target, label, 0.0);
    }

    /**
     * Removes every transition from this state to any of the given states. Labels left without transitions are
     * dropped.
     *
     * @param targets the states that may no longer be reached from this state
     */
    public void removeTransitionsTo(@Nonnull final Set<State> targets) {
        boolean changed = false;
        Iterator<Map.Entry<Label, Set<Transition>>> entries = transitions.entrySet().iterator();
        while (entries.hasNext()) {
            Set<Transition> bucket = entries.next().getValue();
            changed |= bucket.removeIf(t -> targets.contains(t.getTarget()));
            if (bucket.isEmpty()) {
                entries.remove();
            }
        }
        if (changed) {
            indicesStale = true;
        }
    }

    /**
     * Moves all transitions on label {@code original} to label {@code replacement}, merging them with any transitions
     * already on {@code replacement}. Targets and weights are kept. Nothing happens if there are no transitions on
     * {@code original}.
     *
     * @param original the label to rename
     * @param replacement the new label
     */
    public void renameLabel(@Nonnull final Label original, @Nonnull final Label replacement) {
        Set<Transition> bucket = transitions.remove(original);
        if (bucket == null) {
            return;
        }
        Set<Transition> merged = transitions.computeIfAbsent(replacement, l -> new LinkedHashSet<>());
        for (Transition transition : bucket) {
            merged.add(transition.withLabel(replacement));
        }
        indicesStale = true;
    }

    /**
     * @return true if this state has no outgoing transitions
     */
    public boolean hasNoTransitions() {
        return transitions.isEmpty();
    }

    public Set<Label> getLabels() {
        return Collections.unmodifiableSet(transitions.keySet());
    }

    /**
     * @param label the label
     * @return the transitions on {@code label}; empty if there are none
     */
    public Set<Transition> getTransitions(final Label label) {
        Set<Transition> bucket = transitions.get(label);
        return bucket == null ? Collections.emptySet() : Collections.unmodifiableSet(bucket);
    }

    /**
     * @return every transition leaving this state, grouped by label in insertion order
     */
    public List<Transition> getTransitions() {
        List<Transition> all = new ArrayList<>();
        for (Set<Transition> bucket : transitions.values()) {
            all.addAll(bucket);
        }
        return all;
    }

    /**
     * @return every transition leaving this state, sorted by label and then by weight
     */
    public List<Transition> getSortedTransitions() {
        List<Transition> all = getTransitions();
        all.sort(BY_LABEL_THEN_WEIGHT);
        return all;
    }

    /**
     * @return the states this state has a transition to
     */
    public Set<State> getTargets() {
        Set<State> targets = new LinkedHashSet<>();
        for (Set<Transition> bucket : transitions.values()) {
            for (Transition transition : bucket) {
                targets.add(transition.getTarget());
            }
        }
        return targets;
    }

    /**
     * @return each state reachable in one transition, mapped to the cheapest weight of getting there
     */
    public Map<State, Double> getTargetsCheapest() {
        return cheapestTargets(false);
    }

    /**
     * @return each state reachable in one transition whose label is epsilon on every side, mapped to the cheapest
     * weight of getting there
     */
    public Map<State, Double> getEpsilonTargetsCheapest() {
        return cheapestTargets(true);
    }

    private Map<State, Double> cheapestTargets(final boolean epsilonOnly) {
        Map<State, Double> targets = new LinkedHashMap<>();
        for (Map.Entry<Label, Set<Transition>> entry : transitions.entrySet()) {
            if (epsilonOnly && !entry.getKey().isEpsilon()) {
                continue;
            }
            for (Transition transition : entry.getValue()) {
                targets.merge(transition.getTarget(), transition.getWeight(), Math::min);
            }
        }
        return targets;
    }

    /**
     * Transitions keyed by their input symbol, the first symbol of the label.
     *
     * @return an unmodifiable view, rebuilt if the transitions changed since the last call
     */
    public Map<String, Set<Transition>> getTransitionsByInput() {
        refreshIndices();
        return transitionsByInput;
    }

    /**
     * Transitions keyed by their output symbol, the last symbol of the label.
     *
     * @return an unmodifiable view, rebuilt if the transitions changed since the last call
     */
    public Map<String, Set<Transition>> getTransitionsByOutput() {
        refreshIndices();
        return transitionsByOutput;
    }

    private void refreshIndices() {
        if (!indicesStale) {
            return;
        }
        Map<String, Set<Transition>> byInput = new LinkedHashMap<>();
        Map<String, Set<Transition>> byOutput = new LinkedHashMap<>();
        for (Map.Entry<Label, Set<Transition>> entry : transitions.entrySet()) {
            Label label = entry.getKey();
            byInput.computeIfAbsent(label.getInput(), s -> new LinkedHashSet<>()).addAll(entry.getValue());
            byOutput.computeIfAbsent(label.getOutput(), s -> new LinkedHashSet<>()).addAll(entry.getValue());
        }
        transitionsByInput = frozen(byInput);
        transitionsByOutput = frozen(byOutput);
        indicesStale = false;
    }

    private static Map<String, Set<Transition>> frozen(final Map<String, Set<Transition>> index) {
        index.replaceAll((symbol, bucket) -> Collections.unmodifiableSet(bucket));
        return Collections.unmodifiableMap(index);
    }

    /**
     * @return true if no label maps to an empty set of transitions
     */
    boolean hasNoEmptyLabels() {
        for (Set<Transition> bucket : transitions.values()) {
            if (bucket.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "S" + id + (name == null ? "" : "(" + name + ")") + ": " + transitions.keySet();
    }
}
