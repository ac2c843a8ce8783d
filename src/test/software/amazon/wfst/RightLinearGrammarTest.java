package software.amazon.wfst;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RightLinearGrammarTest {

    @Test
    public void ruleSetsKeepDeclarationOrder() {
        RightLinearGrammar grammar = RightLinearGrammar.builder()
                .addRuleSet("Start")
                .addRule("Noun", GrammarRule.of("s", "#"))
                .addRule("Start", GrammarRule.of("cat", "Noun"))
                .addRuleSet("Start")
                .build();
        assertEquals(Arrays.asList("Start", "Noun"), Arrays.asList(grammar.getRuleSetNames().toArray()));
        assertEquals(Collections.singletonList(GrammarRule.of("cat", "Noun")), grammar.getRules("Start"));
        assertTrue(grammar.hasRuleSet("Noun"));
        assertFalse(grammar.hasRuleSet("Verb"));
        assertTrue(grammar.getRules("Verb").isEmpty());
    }

    @Test
    public void builtGrammarIsUnaffectedByTheBuilder() {
        RightLinearGrammar.Builder builder = RightLinearGrammar.builder().addRule("Start", GrammarRule.of("a", "#"));
        RightLinearGrammar grammar = builder.build();
        builder.addRule("Start", GrammarRule.of("b", "#"));
        assertEquals(1, grammar.getRules("Start").size());
        try {
            grammar.getRules("Start").clear();
            fail("rules are modifiable");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    @Test
    public void rules() {
        GrammarRule rule = GrammarRule.transducing("go", "went", "#", 1.5);
        assertTrue(rule.isTransducing());
        assertEquals("went", rule.getOutput());
        assertEquals(1.5, rule.getWeight(), 0.0);
        assertFalse(GrammarRule.of("go", "#").isTransducing());
        assertEquals(GrammarRule.of("go", "#"), GrammarRule.of("go", "#", 0.0));
        assertEquals("((\"go\", \"went\"), #, 1.5)", rule.toString());
    }
}
