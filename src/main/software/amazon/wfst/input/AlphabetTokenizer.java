package software.amazon.wfst.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits a string into symbols of an automaton's alphabet. At each position the longest alphabet symbol that starts
 * there wins; where no alphabet symbol starts, the single character at that position is taken as it is.
 */
public final class AlphabetTokenizer {

    private AlphabetTokenizer() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    public static List<String> tokenize(final String word, final Set<String> alphabet) {
        int longest = 0;
        for (String symbol : alphabet) {
            longest = Math.max(longest, symbol.length());
        }
        final List<String> tokens = new ArrayList<>();
        int start = 0;
        while (start < word.length()) {
            // default is a one-character token unless we find a longer one
            String token = word.substring(start, start + Character.charCount(word.codePointAt(start)));
            final int limit = Math.min(word.length(), start + longest);
            for (int end = limit; end > start + token.length(); end--) {
                final String candidate = word.substring(start, end);
                if (alphabet.contains(candidate)) {
                    token = candidate;
                    break;
                }
            }
            tokens.add(token);
            start += token.length();
        }
        return tokens;
    }
}
