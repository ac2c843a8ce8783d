package software.amazon.wfst.input;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AlphabetTokenizerTest {

    private static final Set<String> ALPHABET = new HashSet<>(Arrays.asList("ab", "a", "b", "abc"));

    @Test
    public void longestMatchWins() {
        assertEquals(Collections.singletonList("ab"),
                AlphabetTokenizer.tokenize("ab", new HashSet<>(Arrays.asList("ab", "a", "b"))));
        assertEquals(Arrays.asList("abc", "ab"), AlphabetTokenizer.tokenize("abcab", ALPHABET));
    }

    @Test
    public void unknownCharactersAreSingleTokens() {
        assertEquals(Arrays.asList("x", "ab", "y"), AlphabetTokenizer.tokenize("xaby", ALPHABET));
        assertEquals(Arrays.asList("x", "y"), AlphabetTokenizer.tokenize("xy", Collections.emptySet()));
    }

    @Test
    public void emptyStringHasNoTokens() {
        assertTrue(AlphabetTokenizer.tokenize("", ALPHABET).isEmpty());
    }

    @Test
    public void surrogatePairsStayTogether() {
        assertEquals(Arrays.asList("😀", "a"),
                AlphabetTokenizer.tokenize("😀a", Collections.emptySet()));
    }
}
