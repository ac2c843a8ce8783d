package software.amazon.wfst;

/**
 * A RuntimeException that indicates a right-linear grammar cannot be compiled, for instance because a rule continues
 * to a rule set nobody declared.
 */
public class GrammarException extends RuntimeException {

    public GrammarException(String msg) {
        super(msg);
    }

}
