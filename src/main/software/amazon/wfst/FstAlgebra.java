package software.amazon.wfst;

/**
 * The algebraic operations over automata. Implementations build their results with the public operations of
 * {@link Fst}, {@link State} and {@link Transition}, and may return one of their arguments, changed in place through
 * {@link Fst#become}, or a new automaton.
 */
public interface FstAlgebra {

    Fst union(Fst first, Fst second);

    Fst intersection(Fst first, Fst second);

    /**
     * @return the strings of {@code first} that are not in {@code second}
     */
    Fst difference(Fst first, Fst second);

    /**
     * @return a transducer pairing every string of {@code first} with every string of {@code second}
     */
    Fst crossProduct(Fst first, Fst second);

    Fst concatenate(Fst first, Fst second);

    Fst compose(Fst first, Fst second);

    /**
     * @return an equivalent automaton with at most one transition per label from each state and no epsilon
     * transitions, treating every label as a single symbol
     */
    Fst determinizeAsDfa(Fst fst);

    Fst minimize(Fst fst);

    Fst kleeneStar(Fst fst);
}
