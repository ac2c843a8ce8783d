package software.amazon.wfst;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * Represents a transition (on a particular label) from a state to a state. The source state owns the transition;
 * the target may be shared by many transitions.
 */
@Immutable
public final class Transition {

    private final State target;
    private final Label label;
    private final double weight;

    Transition(@Nonnull final State target, @Nonnull final Label label, final double weight) {
        this.target = Objects.requireNonNull(target, "target");
        this.label = Objects.requireNonNull(label, "label");
        this.weight = weight;
    }

    public State getTarget() {
        return target;
    }

    public Label getLabel() {
        return label;
    }

    /**
     * @return the cost of taking this transition; lower is better and 0.0 is neutral
     */
    public double getWeight() {
        return weight;
    }

    Transition withLabel(final Label newLabel) {
        return new Transition(target, newLabel, weight);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return Double.compare(that.weight, weight) == 0 &&
                target == that.target &&
                label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target.getId(), label, weight);
    }

    @Override
    public String toString() {
        return "T: " + label + "/" + weight + " -> " + target.getId();
    }
}
