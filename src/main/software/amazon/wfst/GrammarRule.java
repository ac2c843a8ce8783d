package software.amazon.wfst;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * One rule of a right-linear grammar: read {@code input}, write {@code output} (or {@code input} again, when there is
 * no output), pay {@code weight}, and continue in the rule set named {@code target}.
 *
 * Inputs and outputs are written in lexicon notation, see {@link software.amazon.wfst.input.LexiconTokenizer}.
 */
@Immutable
public final class GrammarRule {

    private final String input;
    private final String output;
    private final String target;
    private final double weight;

    private GrammarRule(final String input, @Nullable final String output, final String target, final double weight) {
        this.input = Objects.requireNonNull(input, "input");
        this.output = output;
        this.target = Objects.requireNonNull(target, "target");
        this.weight = weight;
    }

    public static GrammarRule of(@Nonnull final String input, @Nonnull final String target) {
        return new GrammarRule(input, null, target, 0.0);
    }

    public static GrammarRule of(@Nonnull final String input, @Nonnull final String target, final double weight) {
        return new GrammarRule(input, null, target, weight);
    }

    public static GrammarRule transducing(@Nonnull final String input, @Nonnull final String output,
                                          @Nonnull final String target) {
        return new GrammarRule(input, Objects.requireNonNull(output, "output"), target, 0.0);
    }

    public static GrammarRule transducing(@Nonnull final String input, @Nonnull final String output,
                                          @Nonnull final String target, final double weight) {
        return new GrammarRule(input, Objects.requireNonNull(output, "output"), target, weight);
    }

    public String getInput() {
        return input;
    }

    /**
     * @return the output side, or null if the rule writes what it reads
     */
    @Nullable
    public String getOutput() {
        return output;
    }

    public boolean isTransducing() {
        return output != null;
    }

    public String getTarget() {
        return target;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GrammarRule that = (GrammarRule) o;
        return Double.compare(that.weight, weight) == 0 &&
                input.equals(that.input) &&
                Objects.equals(output, that.output) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, output, target, weight);
    }

    @Override
    public String toString() {
        return "(" + (output == null ? "\"" + input + "\"" : "(\"" + input + "\", \"" + output + "\")")
                + ", " + target + (weight == 0.0 ? "" : ", " + weight) + ")";
    }
}
