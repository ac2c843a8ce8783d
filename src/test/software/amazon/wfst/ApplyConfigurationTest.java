package software.amazon.wfst;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ApplyConfigurationTest {

    @Test
    public void testDefaults() {
        ApplyConfiguration configuration = ApplyConfiguration.builder().build();
        assertFalse(configuration.isWeights());
        assertFalse(configuration.isTokenizeOutputs());
        assertTrue(configuration.isObeyFlags());
        assertFalse(configuration.isPrintFlags());
    }

    @Test
    public void testWeights() {
        assertTrue(ApplyConfiguration.builder().withWeights(true).build().isWeights());
    }

    @Test
    public void testTokenizedOutputs() {
        assertTrue(ApplyConfiguration.builder().withTokenizedOutputs(true).build().isTokenizeOutputs());
    }

    @Test
    public void testObeyFlagsFalse() {
        assertFalse(ApplyConfiguration.builder().withObeyFlags(false).build().isObeyFlags());
    }

    @Test
    public void testPrintFlags() {
        assertTrue(ApplyConfiguration.builder().withPrintFlags(true).build().isPrintFlags());
    }

    @Test
    public void testRendering() {
        ApplyResult result = new ApplyResult(Arrays.asList("c", "at"), 1.5, ApplyConfiguration.DEFAULT);
        assertEquals("cat", result.toString());
        assertEquals("(cat, 1.5)",
                new ApplyResult(result.getSymbols(), 1.5,
                        ApplyConfiguration.builder().withWeights(true).build()).toString());
        assertEquals("[c, at]",
                new ApplyResult(result.getSymbols(), 1.5,
                        ApplyConfiguration.builder().withTokenizedOutputs(true).build()).toString());
    }
}
