package software.amazon.wfst;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.wfst.input.LexiconTokenizer;
import software.amazon.wfst.input.MulticharSymbols;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a weighted right-linear grammar into an automaton, much like a lexicon compiler does.
 *
 * Every rule set becomes a state named after it, and {@value Constants#FINAL_SYMBOL} becomes the only final state.
 * A rule becomes a chain of transitions from its rule set's state to its target's state: the input and output sides
 * are tokenized, the shorter one is padded with epsilons at the end, and the two are paired position by position. The
 * intermediate states of the chain are anonymous. The rule's weight goes on the last transition of the chain.
 */
public final class GrammarCompiler {

    private static final Logger logger = LoggerFactory.getLogger(GrammarCompiler.class);

    private GrammarCompiler() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * @param grammar the grammar
     * @param startSymbol the rule set to start in
     * @param multicharSymbols symbols to read as one wherever they appear unquoted, or null
     * @return the automaton
     * @throws GrammarException if the start symbol or a rule's target is not a declared rule set, or if rules are
     * given for {@value Constants#FINAL_SYMBOL}
     */
    static Fst compile(final RightLinearGrammar grammar, final String startSymbol,
                       final Collection<String> multicharSymbols) {
        if (!grammar.hasRuleSet(startSymbol) && !Constants.FINAL_SYMBOL.equals(startSymbol)) {
            throw new GrammarException(String.format("Start symbol \"%s\" is not a declared rule set", startSymbol));
        }
        if (!grammar.getRules(Constants.FINAL_SYMBOL).isEmpty()) {
            throw new GrammarException(String.format("Rule set \"%s\" accepts and cannot have rules",
                    Constants.FINAL_SYMBOL));
        }
        final LexiconTokenizer tokenizer = new LexiconTokenizer(MulticharSymbols.of(multicharSymbols));

        final Fst fst = new Fst();
        final Map<String, State> ruleSetStates = new HashMap<>();
        fst.getInitialState().setName(startSymbol);
        ruleSetStates.put(startSymbol, fst.getInitialState());
        for (String name : grammar.getRuleSetNames()) {
            ruleSetStates.computeIfAbsent(name, fst::addState);
        }
        final State finalState = ruleSetStates.computeIfAbsent(Constants.FINAL_SYMBOL, fst::addState);
        fst.setFinal(finalState, 0.0);

        for (String ruleSet : grammar.getRuleSetNames()) {
            for (GrammarRule rule : grammar.getRules(ruleSet)) {
                final State target = ruleSetStates.get(rule.getTarget());
                if (target == null) {
                    throw new GrammarException(String.format("Rule %s of rule set \"%s\" continues to \"%s\", " +
                            "which is not a declared rule set", rule, ruleSet, rule.getTarget()));
                }
                addRule(fst, tokenizer, ruleSetStates.get(ruleSet), rule, target);
            }
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Compiled {} rule sets starting at \"{}\" into {} states over {} symbols",
                    grammar.getRuleSetNames().size(), startSymbol, fst.size(), fst.getAlphabet().size());
        }
        return fst;
    }

    private static void addRule(final Fst fst, final LexiconTokenizer tokenizer, final State from,
                                final GrammarRule rule, final State target) {
        final List<String> in = tokenizer.tokenize(rule.getInput());
        final List<String> out = rule.isTransducing() ? tokenizer.tokenize(rule.getOutput()) : in;
        for (String symbol : in) {
            addToAlphabet(fst, symbol);
        }
        for (String symbol : out) {
            addToAlphabet(fst, symbol);
        }
        final int length = Math.max(in.size(), out.size());
        State current = from;
        for (int i = 0; i < length; i++) {
            final String inSymbol = i < in.size() ? in.get(i) : Constants.EPSILON;
            final String outSymbol = i < out.size() ? out.get(i) : Constants.EPSILON;
            final Label label = Label.of(inSymbol, outSymbol);
            if (i == length - 1) {
                // weight goes on the last transition, right before the next rule set
                current.addTransition(target, label, rule.getWeight());
            } else {
                final State next = fst.addState();
                current.addTransition(next, label, 0.0);
                current = next;
            }
        }
    }

    private static void addToAlphabet(final Fst fst, final String symbol) {
        if (!symbol.isEmpty()) {
            fst.addToAlphabet(Collections.singleton(symbol));
        }
    }
}
