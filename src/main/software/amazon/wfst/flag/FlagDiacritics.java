package software.amazon.wfst.flag;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognizes flag diacritic symbols and removes them from symbol sequences.
 */
public final class FlagDiacritics {

    private FlagDiacritics() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    public static boolean isFlag(final String symbol) {
        return symbol.length() > 4 && symbol.charAt(0) == '@' && symbol.charAt(symbol.length() - 1) == '@'
                && FlagOperation.parse(symbol) != null;
    }

    /**
     * @param symbols a sequence of symbols
     * @return the sequence without its flag diacritics
     */
    public static List<String> filterFlags(final List<String> symbols) {
        final List<String> filtered = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            if (!isFlag(symbol)) {
                filtered.add(symbol);
            }
        }
        return filtered;
    }
}
