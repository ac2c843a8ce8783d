package software.amazon.wfst;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * A transition together with the state it leaves from.
 */
@Immutable
public final class StateTransition {

    private final State source;
    private final Transition transition;

    StateTransition(final State source, final Transition transition) {
        this.source = source;
        this.transition = transition;
    }

    public State getSource() {
        return source;
    }

    public Transition getTransition() {
        return transition;
    }

    public Label getLabel() {
        return transition.getLabel();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StateTransition that = (StateTransition) o;
        return source == that.source && transition.equals(that.transition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, transition);
    }

    @Override
    public String toString() {
        return source.getId() + " " + transition;
    }
}
