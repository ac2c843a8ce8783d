package software.amazon.wfst.flag;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FlagStringFilterTest {

    private FlagStringFilter filter;

    @Before
    public void setUp() {
        filter = new FlagStringFilter(new HashSet<>(Arrays.asList("a", "@P.f.x@", "@R.f.x@")));
    }

    private boolean accepts(String... symbols) {
        return filter.test(Arrays.asList(symbols));
    }

    @Test
    public void noFlagsIsConsistent() {
        assertTrue(accepts());
        assertTrue(accepts("a", "b"));
    }

    @Test
    public void positiveSetAndRequire() {
        assertTrue(accepts("@P.f.x@", "a", "@R.f.x@"));
        assertFalse(accepts("@P.f.x@", "@R.f.y@"));
        assertTrue(accepts("@P.f.x@", "@R.f@"));
        assertFalse(accepts("@R.f@"));
    }

    @Test
    public void negativeSet() {
        assertFalse(accepts("@N.f.x@", "@R.f.x@"));
        assertTrue(accepts("@N.f.x@", "@R.f.y@"));
        assertTrue(accepts("@N.f.x@", "@D.f.x@"));
    }

    @Test
    public void disallow() {
        assertTrue(accepts("@D.f@"));
        assertFalse(accepts("@P.f.x@", "@D.f@"));
        assertFalse(accepts("@P.f.x@", "@D.f.x@"));
        assertTrue(accepts("@P.f.x@", "@D.f.y@"));
    }

    @Test
    public void clear() {
        assertTrue(accepts("@P.f.x@", "@C.f@", "@D.f@"));
        assertFalse(accepts("@P.f.x@", "@C.f@", "@R.f@"));
    }

    @Test
    public void unify() {
        assertTrue(accepts("@U.f.x@", "@U.f.x@"));
        assertFalse(accepts("@U.f.x@", "@U.f.y@"));
        assertFalse(accepts("@N.f.x@", "@U.f.x@"));
        assertTrue(accepts("@N.f.x@", "@U.f.y@", "@R.f.y@"));
    }

    @Test
    public void equal() {
        assertTrue(accepts("@E.f@"));
        assertTrue(accepts("@P.f.x@", "@E.f.x@"));
        assertFalse(accepts("@E.f.x@"));
        assertFalse(accepts("@P.f.x@", "@E.f@"));
    }

    @Test
    public void featuresAreIndependent() {
        assertTrue(accepts("@P.f.x@", "@P.g.y@", "@R.f.x@", "@R.g.y@"));
    }

    @Test
    public void filterFlags() {
        assertEquals(Arrays.asList("a", "b"), FlagDiacritics.filterFlags(Arrays.asList("@P.f.x@", "a", "@C.f@", "b")));
        assertEquals(Collections.emptyList(), FlagDiacritics.filterFlags(Collections.singletonList("@C.f@")));
    }
}
