package software.amazon.wfst.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static software.amazon.wfst.input.MulticharSymbols.QUOTE;
import static software.amazon.wfst.input.MulticharSymbols.BACKSLASH;

/**
 * Splits the input or output side of a grammar rule into symbols. Lexicon notation is:
 * <ul>
 *   <li>{@code 'abc'} is the single symbol {@code abc}; inside quotes, {@code \'} stands for a quote. {@code '''} is
 *   the quote symbol itself and {@code ''} is epsilon.</li>
 *   <li>{@code \x} is the character {@code x}, whatever it is. An escaped space is a space.</li>
 *   <li>An unescaped space is epsilon. It lets the shorter side of a rule be padded to line up with the longer one.</li>
 *   <li>Any other character, including a quote that is never closed or a trailing backslash, is a symbol of its own.</li>
 * </ul>
 * The empty string is a single epsilon.
 */
public class LexiconTokenizer {

    private static final int SPACE = ' ';

    private final MulticharSymbols multicharSymbols;

    public LexiconTokenizer() {
        this(MulticharSymbols.NONE);
    }

    public LexiconTokenizer(final MulticharSymbols multicharSymbols) {
        this.multicharSymbols = multicharSymbols;
    }

    public List<String> tokenize(final String value) {
        if (value.isEmpty()) {
            return Collections.singletonList("");
        }
        final String quoted = multicharSymbols.quote(value);
        final List<String> result = new ArrayList<>();
        int i = 0;
        while (i < quoted.length()) {
            final int c = quoted.codePointAt(i);
            final int width = Character.charCount(c);
            if (c == QUOTE) {
                final int close = findClosingQuote(quoted, i);
                if (close >= 0) {
                    result.add(unescapeQuotes(quoted.substring(i + 1, close)));
                    i = close + 1;
                    continue;
                }
            } else if (c == BACKSLASH && i + width < quoted.length()) {
                final int escaped = quoted.codePointAt(i + width);
                result.add(new String(Character.toChars(escaped)));
                i += width + Character.charCount(escaped);
                continue;
            }
            result.add(c == SPACE ? "" : new String(Character.toChars(c)));
            i += width;
        }
        return result;
    }

    /*
     * A quoted symbol runs to the first quote that is not preceded by a backslash. If there is none, the quote of the
     * last backslash-quote pair closes it instead, leaving that backslash inside the symbol. If there is no such pair
     * either, the opening quote is not a quote at all.
     */
    static int findClosingQuote(final String value, final int open) {
        if (value.startsWith("'''", open)) {
            return open + 2;
        }
        int lastEscapedQuote = -1;
        int i = open + 1;
        while (i < value.length()) {
            final char c = value.charAt(i);
            if (c == BACKSLASH && i + 1 < value.length() && value.charAt(i + 1) == QUOTE) {
                lastEscapedQuote = i + 1;
                i += 2;
            } else if (c == QUOTE) {
                return i;
            } else {
                i++;
            }
        }
        return lastEscapedQuote;
    }

    private static String unescapeQuotes(final String symbol) {
        if (symbol.equals("'")) {
            return symbol;
        }
        return symbol.replace("\\'", "'");
    }
}
