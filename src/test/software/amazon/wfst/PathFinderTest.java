package software.amazon.wfst;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PathFinderTest {

    private static final String NOM = "@U.case.nom@";
    private static final String ACC = "@U.case.acc@";

    private static final ApplyConfiguration DONT_OBEY = ApplyConfiguration.builder().withObeyFlags(false).build();
    private static final ApplyConfiguration PRINT = ApplyConfiguration.builder().withPrintFlags(true).build();

    private static List<ApplyResult> all(Iterator<ApplyResult> it) {
        List<ApplyResult> list = new ArrayList<>();
        it.forEachRemaining(list::add);
        return list;
    }

    private static List<String> texts(List<ApplyResult> results) {
        List<String> texts = new ArrayList<>();
        for (ApplyResult result : results) {
            texts.add(result.getText());
        }
        return texts;
    }

    private static Fst fst(String... alphabet) {
        return new Fst(new HashSet<>(Arrays.asList(alphabet)));
    }

    @Test
    public void resultsComeCheapestFirst() {
        Fst fst = fst("a", "x", "y", "z");
        State end = fst.addState();
        fst.setFinal(end, 0.0);
        fst.getInitialState().addTransition(end, Label.of("a", "x"), 3.0);
        fst.getInitialState().addTransition(end, Label.of("a", "y"), 1.0);
        fst.getInitialState().addTransition(end, Label.of("a", "z"), 2.0);

        List<ApplyResult> results = all(fst.generate("a", ApplyConfiguration.DEFAULT));
        assertThat(texts(results), contains("y", "z", "x"));
        assertEquals(1.0, results.get(0).getCost(), 0.0);
        assertEquals(2.0, results.get(1).getCost(), 0.0);
        assertEquals(3.0, results.get(2).getCost(), 0.0);
    }

    @Test
    public void finalWeightsAreCharged() {
        Fst fst = fst("a", "x", "y");
        State cheapArc = fst.addState();
        State cheapStop = fst.addState();
        fst.setFinal(cheapArc, 5.0);
        fst.setFinal(cheapStop, 1.0);
        fst.getInitialState().addTransition(cheapArc, Label.of("a", "x"), 0.0);
        fst.getInitialState().addTransition(cheapStop, Label.of("a", "y"), 2.0);

        List<ApplyResult> results = all(fst.generate("a", ApplyConfiguration.DEFAULT));
        assertThat(texts(results), contains("y", "x"));
        assertEquals(3.0, results.get(0).getCost(), 0.0);
        assertEquals(5.0, results.get(1).getCost(), 0.0);
    }

    @Test
    public void equalCostsComeOutInTheOrderTheyWereFound() {
        Fst fst = fst("a", "x", "y");
        State end = fst.addState();
        fst.setFinal(end, 0.0);
        fst.getInitialState().addTransition(end, Label.of("a", "x"), 1.0);
        fst.getInitialState().addTransition(end, Label.of("a", "y"), 1.0);

        assertThat(texts(all(fst.generate("a", ApplyConfiguration.DEFAULT))), contains("x", "y"));
    }

    @Test
    public void resultsAreProducedLazily() {
        // infinitely many results, each one "a" longer and costlier than the last
        Fst fst = fst("a");
        fst.setFinal(fst.getInitialState(), 0.0);
        fst.getInitialState().addTransition(fst.getInitialState(), Label.of("", "a"), 1.0);

        Iterator<ApplyResult> results = fst.generate("", ApplyConfiguration.DEFAULT);
        for (int i = 0; i < 4; i++) {
            ApplyResult result = results.next();
            assertEquals(String.join("", Collections.nCopies(i, "a")), result.getText());
            assertEquals(i, result.getCost(), 0.0);
        }
        assertTrue(results.hasNext());
    }

    @Test
    public void exhaustedResultsThrow() {
        Iterator<ApplyResult> results = Fst.fromLabel(Label.of("a")).generate("a", ApplyConfiguration.DEFAULT);
        results.next();
        assertFalse(results.hasNext());
        try {
            results.next();
            fail("read past the last result");
        } catch (NoSuchElementException e) {
            // expected
        }
    }

    @Test
    public void wholeInputMustBeConsumed() {
        Fst fst = Fst.fromStrings(Arrays.asList("ab", "a"));
        assertThat(texts(all(fst.generate("ab", ApplyConfiguration.DEFAULT))), contains("ab"));
        assertThat(texts(all(fst.generate("abb", ApplyConfiguration.DEFAULT))), empty());
    }

    @Test
    public void epsilonOutputsAreKeptAsEmptySymbols() {
        Fst fst = Fst.fromLabel(Label.of("a", ""));
        ApplyResult result = fst.generate("a", ApplyConfiguration.DEFAULT).next();
        assertEquals(Collections.singletonList(""), result.getSymbols());
        assertEquals("", result.getText());
    }

    @Test
    public void wildcardCopiesTheSymbolItRead() {
        Fst fst = Fst.fromLabel(Label.of("."));
        assertThat(texts(all(fst.generate("q", ApplyConfiguration.DEFAULT))), contains("q"));
    }

    @Test
    public void wildcardToSymbolWritesTheSymbol() {
        Fst fst = Fst.fromLabel(Label.of(".", "X"));
        assertThat(texts(all(fst.generate("q", ApplyConfiguration.DEFAULT))), contains("X"));
    }

    @Test
    public void symbolsOutsideTheAlphabetOnlyMatchTheWildcard() {
        Fst fst = Fst.fromLabel(Label.of("a"));
        assertThat(all(fst.generate("q", ApplyConfiguration.DEFAULT)), empty());
    }

    @Test
    public void analyzeConsumesTheOutputSide() {
        Fst fst = Fst.fromLabel(Label.of("a", "b"));
        assertThat(texts(all(fst.analyze("b", ApplyConfiguration.DEFAULT))), contains("a"));
        assertThat(all(fst.analyze("a", ApplyConfiguration.DEFAULT)), empty());
    }

    @Test
    public void renderingFollowsTheConfiguration() {
        Fst fst = Fst.fromStrings(Collections.singletonList("cat"));
        ApplyConfiguration configuration = ApplyConfiguration.builder()
                .withWeights(true)
                .withTokenizedOutputs(true)
                .build();
        assertEquals("([c, a, t], 0.0)", fst.generate("cat", configuration).next().toString());
        assertEquals("cat", fst.generate("cat", ApplyConfiguration.DEFAULT).next().toString());
    }

    private static Fst flagged(String first, String second) {
        Fst fst = fst("a", first, second);
        State s1 = fst.addState();
        State s2 = fst.addState();
        State s3 = fst.addState();
        fst.setFinal(s3, 0.0);
        fst.getInitialState().addTransition(s1, Label.of(first));
        s1.addTransition(s2, Label.of("a"));
        s2.addTransition(s3, Label.of(second));
        return fst;
    }

    @Test
    public void conflictingFlagsBlockThePath() {
        Fst fst = flagged(NOM, ACC);
        assertThat(all(fst.generate("a", ApplyConfiguration.DEFAULT)), empty());
        assertThat(texts(all(fst.generate("a", DONT_OBEY))), contains("a"));
    }

    @Test
    public void agreeingFlagsLetThePathThroughAndAreStripped() {
        Fst fst = flagged(NOM, NOM);
        ApplyResult result = fst.generate("a", ApplyConfiguration.DEFAULT).next();
        assertEquals(Collections.singletonList("a"), result.getSymbols());

        ApplyResult printed = fst.generate("a", PRINT).next();
        assertEquals(Arrays.asList(NOM, "a", NOM), printed.getSymbols());
    }

    @Test
    public void requireAfterPositiveSet() {
        assertThat(texts(all(flagged("@P.f.x@", "@R.f.x@").generate("a", ApplyConfiguration.DEFAULT))),
                contains("a"));
        assertThat(all(flagged("@P.f.x@", "@R.f.y@").generate("a", ApplyConfiguration.DEFAULT)), empty());
    }

    @Test
    public void flagsNeverConsumeInput() {
        // with flags ignored they still act as epsilons on the consumed side
        Fst fst = flagged(NOM, ACC);
        assertThat(all(fst.generate("@U.case.nom@a", DONT_OBEY)), empty());
    }
}
