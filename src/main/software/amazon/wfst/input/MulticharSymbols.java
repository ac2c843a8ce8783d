package software.amazon.wfst.input;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Symbols longer than one character that should be read as one symbol wherever they appear unquoted in lexicon
 * notation. Quoting rewrites every unquoted occurrence as a quoted run, longest symbol first, and leaves runs that are
 * already quoted untouched.
 */
public final class MulticharSymbols {

    static final char QUOTE = '\'';
    static final char BACKSLASH = '\\';

    public static final MulticharSymbols NONE = new MulticharSymbols(null);

    private static final String QUOTED_RUN = "('(?:\\\\'|[^'])*')";

    // null when there is nothing to quote
    private final Pattern matcher;

    private MulticharSymbols(final Pattern matcher) {
        this.matcher = matcher;
    }

    public static MulticharSymbols of(final Collection<String> symbols) {
        if (symbols == null) {
            return NONE;
        }
        final List<String> ordered = new ArrayList<>();
        for (String symbol : symbols) {
            if (symbol.codePointCount(0, symbol.length()) > 1) {
                ordered.add(symbol);
            }
        }
        if (ordered.isEmpty()) {
            return NONE;
        }
        ordered.sort(Comparator.comparingInt(String::length).reversed());
        final StringBuilder alternatives = new StringBuilder();
        for (String symbol : ordered) {
            if (alternatives.length() > 0) {
                alternatives.append('|');
            }
            alternatives.append(Pattern.quote(symbol));
        }
        return new MulticharSymbols(Pattern.compile(QUOTED_RUN + "|(" + alternatives + ")"));
    }

    /**
     * @param value a string in lexicon notation
     * @return the string with every unquoted multichar symbol quoted
     */
    public String quote(final String value) {
        if (matcher == null) {
            return value;
        }
        final Matcher m = matcher.matcher(value);
        final StringBuilder sb = new StringBuilder();
        while (m.find()) {
            final String replacement = m.group(1) != null
                    ? m.group(1)
                    : QUOTE + m.group(2).replace("'", "\\'") + QUOTE;
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
