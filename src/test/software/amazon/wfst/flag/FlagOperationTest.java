package software.amazon.wfst.flag;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FlagOperationTest {

    @Test
    public void parseFlagWithValue() {
        FlagOperation operation = FlagOperation.parse("@U.case.nom@");
        assertEquals(FlagOperation.Operator.U, operation.getOperator());
        assertEquals("case", operation.getFeature());
        assertEquals("nom", operation.getValue());
        assertEquals("@U.case.nom@", operation.toString());
    }

    @Test
    public void parseFlagWithoutValue() {
        FlagOperation operation = FlagOperation.parse("@C.case@");
        assertEquals(FlagOperation.Operator.C, operation.getOperator());
        assertNull(operation.getValue());
    }

    @Test
    public void ordinarySymbolsAreNotFlags() {
        assertNull(FlagOperation.parse("a"));
        assertNull(FlagOperation.parse("@X.case@"));
        assertNull(FlagOperation.parse("@U.case.nom"));
        assertNull(FlagOperation.parse("@U@"));
    }

    @Test
    public void isFlag() {
        assertTrue(FlagDiacritics.isFlag("@P.f.x@"));
        assertTrue(FlagDiacritics.isFlag("@D.f@"));
        assertFalse(FlagDiacritics.isFlag("@"));
        assertFalse(FlagDiacritics.isFlag("@@"));
        assertFalse(FlagDiacritics.isFlag("+Pl"));
    }
}
