package software.amazon.wfst;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A weighted right-linear grammar in the style of a lexicon: named rule sets, each an ordered list of rules that read
 * some symbols and continue in another rule set. The reserved rule set {@value #FINAL_SYMBOL} accepts.
 *
 * <pre>
 * {@code
 *   RightLinearGrammar grammar = RightLinearGrammar.builder()
 *       .addRule("Start", GrammarRule.of("cat", "Noun"))
 *       .addRule("Noun", GrammarRule.transducing("s", "+Pl", "#"))
 *       .addRule("Noun", GrammarRule.transducing("", "+Sg", "#"))
 *       .build();
 * }
 * </pre>
 */
@Immutable
public final class RightLinearGrammar {

    public static final String FINAL_SYMBOL = Constants.FINAL_SYMBOL;

    private final Map<String, List<GrammarRule>> ruleSets;

    private RightLinearGrammar(final Map<String, List<GrammarRule>> ruleSets) {
        Map<String, List<GrammarRule>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<GrammarRule>> entry : ruleSets.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.ruleSets = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the declared rule set names, in declaration order
     */
    public Set<String> getRuleSetNames() {
        return ruleSets.keySet();
    }

    public boolean hasRuleSet(final String name) {
        return ruleSets.containsKey(name);
    }

    /**
     * @param name a rule set name
     * @return the rules of that set, in declaration order; empty if there is no such set
     */
    public List<GrammarRule> getRules(final String name) {
        return ruleSets.getOrDefault(name, Collections.emptyList());
    }

    public Map<String, List<GrammarRule>> asMap() {
        return ruleSets;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return ruleSets.equals(((RightLinearGrammar) o).ruleSets);
    }

    @Override
    public int hashCode() {
        return ruleSets.hashCode();
    }

    @Override
    public String toString() {
        return "RightLinearGrammar" + ruleSets;
    }

    public static class Builder {

        private final Map<String, List<GrammarRule>> ruleSets = new LinkedHashMap<>();

        Builder() {}

        /**
         * Declares a rule set, possibly without rules. Declaring a rule set twice is harmless.
         */
        public Builder addRuleSet(@Nonnull final String name) {
            ruleSets.computeIfAbsent(Objects.requireNonNull(name, "name"), n -> new ArrayList<>());
            return this;
        }

        public Builder addRule(@Nonnull final String ruleSet, @Nonnull final GrammarRule rule) {
            Objects.requireNonNull(rule, "rule");
            addRuleSet(ruleSet);
            ruleSets.get(ruleSet).add(rule);
            return this;
        }

        public Builder addRules(@Nonnull final String ruleSet, @Nonnull final GrammarRule... rules) {
            return addRules(ruleSet, Arrays.asList(rules));
        }

        public Builder addRules(@Nonnull final String ruleSet, @Nonnull final Iterable<GrammarRule> rules) {
            addRuleSet(ruleSet);
            for (GrammarRule rule : rules) {
                addRule(ruleSet, rule);
            }
            return this;
        }

        public RightLinearGrammar build() {
            return new RightLinearGrammar(ruleSets);
        }
    }
}
