package software.amazon.wfst;

import javax.annotation.concurrent.Immutable;

/**
 * Options for passing a string through an automaton with {@link Fst#generate} or {@link Fst#analyze}.
 */
@Immutable
public final class ApplyConfiguration {

    static final ApplyConfiguration DEFAULT = builder().build();

    /**
     * If true, a result renders with its cost, as {@code (text, cost)}. The cost is always available from
     * {@link ApplyResult#getCost()}.
     */
    private final boolean weights;

    /**
     * If true, a result renders as its list of symbols rather than as their concatenation. The symbols are always
     * available from {@link ApplyResult#getSymbols()}.
     */
    private final boolean tokenizeOutputs;

    /**
     * If true, paths whose flag diacritics contradict each other are not reported. Flag diacritics never consume
     * input either way.
     */
    private final boolean obeyFlags;

    /**
     * If true, flag diacritic symbols are kept in the results; otherwise they are stripped.
     */
    private final boolean printFlags;

    private ApplyConfiguration(boolean weights, boolean tokenizeOutputs, boolean obeyFlags, boolean printFlags) {
        this.weights = weights;
        this.tokenizeOutputs = tokenizeOutputs;
        this.obeyFlags = obeyFlags;
        this.printFlags = printFlags;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isWeights() {
        return weights;
    }

    public boolean isTokenizeOutputs() {
        return tokenizeOutputs;
    }

    public boolean isObeyFlags() {
        return obeyFlags;
    }

    public boolean isPrintFlags() {
        return printFlags;
    }

    public static class Builder {

        private boolean weights = false;
        private boolean tokenizeOutputs = false;
        private boolean obeyFlags = true;
        private boolean printFlags = false;

        Builder() {}

        public Builder withWeights(boolean weights) {
            this.weights = weights;
            return this;
        }

        public Builder withTokenizedOutputs(boolean tokenizeOutputs) {
            this.tokenizeOutputs = tokenizeOutputs;
            return this;
        }

        public Builder withObeyFlags(boolean obeyFlags) {
            this.obeyFlags = obeyFlags;
            return this;
        }

        public Builder withPrintFlags(boolean printFlags) {
            this.printFlags = printFlags;
            return this;
        }

        public ApplyConfiguration build() {
            return new ApplyConfiguration(weights, tokenizeOutputs, obeyFlags, printFlags);
        }
    }
}
