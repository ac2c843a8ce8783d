package software.amazon.wfst;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One output of {@link Fst#generate} or {@link Fst#analyze}: the symbols produced along an accepting path and the
 * path's cost. How it renders as a string depends on the {@link ApplyConfiguration} it was produced with.
 */
@Immutable
public final class ApplyResult {

    private final List<String> symbols;
    private final double cost;
    private final boolean renderWeights;
    private final boolean renderTokens;

    ApplyResult(final List<String> symbols, final double cost, final ApplyConfiguration configuration) {
        this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));
        this.cost = cost;
        this.renderWeights = configuration.isWeights();
        this.renderTokens = configuration.isTokenizeOutputs();
    }

    /**
     * @return the produced symbols, one per transition taken, epsilons included as empty strings
     */
    public List<String> getSymbols() {
        return symbols;
    }

    /**
     * @return the produced symbols, concatenated
     */
    public String getText() {
        return String.join("", symbols);
    }

    public double getCost() {
        return cost;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ApplyResult that = (ApplyResult) o;
        return Double.compare(that.cost, cost) == 0 && symbols.equals(that.symbols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols, cost);
    }

    @Override
    public String toString() {
        String rendered = renderTokens ? symbols.toString() : getText();
        return renderWeights ? "(" + rendered + ", " + cost + ")" : rendered;
    }
}
