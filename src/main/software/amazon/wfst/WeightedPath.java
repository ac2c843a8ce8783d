package software.amazon.wfst;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One accepting path of an automaton: the labels along it and its total cost, final weight included.
 */
@Immutable
public final class WeightedPath {

    private final double cost;
    private final List<Label> labels;

    WeightedPath(final double cost, final List<Label> labels) {
        this.cost = cost;
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
    }

    public double getCost() {
        return cost;
    }

    public List<Label> getLabels() {
        return labels;
    }

    /**
     * @return the input side of the path, epsilons dropped
     */
    public String getInput() {
        StringBuilder sb = new StringBuilder();
        for (Label label : labels) {
            sb.append(label.getInput());
        }
        return sb.toString();
    }

    /**
     * @return the output side of the path, epsilons dropped
     */
    public String getOutput() {
        StringBuilder sb = new StringBuilder();
        for (Label label : labels) {
            sb.append(label.getOutput());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WeightedPath that = (WeightedPath) o;
        return Double.compare(that.cost, cost) == 0 && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cost, labels);
    }

    @Override
    public String toString() {
        return "(" + cost + ", " + labels + ")";
    }
}
