package software.amazon.wfst;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.util.Arrays;
import java.util.Objects;

/**
 * The symbols carried by one transition. A label has either one symbol, in which case the transition reads and
 * writes the same symbol (an acceptor arc), or two, in which case the first is the input side and the second the
 * output side. The empty string stands for epsilon on either side.
 *
 * Labels are ordered like tuples: symbol by symbol, and a shorter label before a longer one sharing its prefix.
 */
@Immutable
public final class Label implements Comparable<Label> {

    public static final Label EPSILON = new Label(Constants.EPSILON);

    private final String[] symbols;

    private Label(final String... symbols) {
        this.symbols = symbols;
    }

    /**
     * Creates a one-symbol label, reading and writing {@code symbol}.
     *
     * @param symbol the symbol, or the empty string for epsilon
     * @return the label
     */
    public static Label of(@Nonnull final String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        return symbol.isEmpty() ? EPSILON : new Label(symbol);
    }

    /**
     * Creates a label reading {@code input} and writing {@code output}. When both sides are equal the
     * one-symbol form is returned, so {@code of("a", "a")} equals {@code of("a")}.
     *
     * @param input the input symbol
     * @param output the output symbol
     * @return the label
     */
    public static Label of(@Nonnull final String input, @Nonnull final String output) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        if (input.equals(output)) {
            return of(input);
        }
        return new Label(input, output);
    }

    /**
     * Creates a label from a tuple of one or two symbols, keeping the tuple as given.
     *
     * @param symbols one or two symbols
     * @return the label
     * @throws IllegalArgumentException if there are no symbols or more than two
     */
    public static Label ofSymbols(@Nonnull final String... symbols) {
        if (symbols.length == 0 || symbols.length > 2) {
            throw new IllegalArgumentException("A label has one or two symbols, got " + symbols.length);
        }
        for (String symbol : symbols) {
            Objects.requireNonNull(symbol, "symbol");
        }
        if (symbols.length == 1) {
            return of(symbols[0]);
        }
        return new Label(symbols[0], symbols[1]);
    }

    public String getInput() {
        return symbols[0];
    }

    public String getOutput() {
        return symbols[symbols.length - 1];
    }

    /**
     * The symbol on one side of the label.
     *
     * @param inverse {@code false} for the input side, {@code true} for the output side
     * @return the symbol on that side
     */
    String getSide(final boolean inverse) {
        return inverse ? getOutput() : getInput();
    }

    public int size() {
        return symbols.length;
    }

    public String get(final int index) {
        return symbols[index];
    }

    public boolean isAcceptor() {
        return symbols.length == 1;
    }

    /**
     * @return true if every symbol of the label is epsilon
     */
    public boolean isEpsilon() {
        for (String symbol : symbols) {
            if (!symbol.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(@Nonnull final Label other) {
        int common = Math.min(symbols.length, other.symbols.length);
        for (int i = 0; i < common; i++) {
            int cmp = symbols[i].compareTo(other.symbols[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(symbols.length, other.symbols.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(symbols, ((Label) o).symbols);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(symbols);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < symbols.length; i++) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(symbols[i].isEmpty() ? "ε" : symbols[i]);
        }
        return sb.toString();
    }
}
