package software.amazon.wfst;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

/**
 * Compiles right-linear grammars, expressed in JSON, for use with {@link Fst#rlg}. The top level is an object mapping
 * rule set names to arrays of rules. A rule is one of
 * <pre>
 * {@code
 *   "cat"                                  reads and writes "cat", continues to "#"
 *   ["cat", "Noun"]                        reads and writes "cat", continues to "Noun"
 *   [["go", "went"], "#", 1.5]             reads "go", writes "went", costs 1.5, continues to "#"
 *   {"input": "go", "output": "went", "target": "#", "weight": 1.5}
 * }
 * </pre>
 * Only the syntax is checked here; whether targets are declared is checked when the grammar is compiled into an
 * automaton.
 *
 * Is public so clients can call the check() method to syntax-check grammars
 */
public final class JsonGrammarCompiler {

    private static final Logger logger = LoggerFactory.getLogger(JsonGrammarCompiler.class);

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    static final String INPUT = "input";
    static final String OUTPUT = "output";
    static final String TARGET = "target";
    static final String WEIGHT = "weight";

    private JsonGrammarCompiler() {
      throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * Verify the syntax of a grammar
     * @param source grammar, as a Reader
     * @return null if the grammar is valid, otherwise an error message
     */
    public static String check(final Reader source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Verify the syntax of a grammar
     * @param source grammar, as a String
     * @return null if the grammar is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Verify the syntax of a grammar
     * @param source grammar, as a byte array
     * @return null if the grammar is valid, otherwise an error message
     */
    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Verify the syntax of a grammar
     * @param source grammar, as an InputStream
     * @return null if the grammar is valid, otherwise an error message
     */
    public static String check(final InputStream source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Verify the syntax of a grammar
     * @param source grammar, already parsed into a tree, presumably by an ObjectMapper
     * @return null if the grammar is valid, otherwise an error message
     */
    public static String check(final JsonNode source) {
        try {
            doCompile(source.traverse());
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a grammar from its JSON form.
     *
     * @param source grammar, as a Reader
     * @return the grammar
     * @throws IOException if the grammar isn't syntactically valid
     */
    public static RightLinearGrammar compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    /**
     * Compile a grammar from its JSON form.
     *
     * @param source grammar, as a String
     * @return the grammar
     * @throws IOException if the grammar isn't syntactically valid
     */
    public static RightLinearGrammar compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    /**
     * Compile a grammar from its JSON form.
     *
     * @param source grammar, as a byte array
     * @return the grammar
     * @throws IOException if the grammar isn't syntactically valid
     */
    public static RightLinearGrammar compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    /**
     * Compile a grammar from its JSON form.
     *
     * @param source grammar, as an InputStream
     * @return the grammar
     * @throws IOException if the grammar isn't syntactically valid
     */
    public static RightLinearGrammar compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    /**
     * Compile a grammar that has already been parsed into a tree. Errors carry no source location.
     *
     * @param source grammar, as a JsonNode
     * @return the grammar
     * @throws IOException if the grammar isn't syntactically valid
     */
    public static RightLinearGrammar compile(final JsonNode source) throws IOException {
        return doCompile(source.traverse());
    }

    private static RightLinearGrammar doCompile(final JsonParser parser) throws IOException {
        final RightLinearGrammar.Builder builder = RightLinearGrammar.builder();
        if (parser.nextToken() != JsonToken.START_OBJECT) {
            barf(parser, "Grammar is not an object");
        }
        boolean ruleSetsPresent = false;
        int rules = 0;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            ruleSetsPresent = true;
            final String ruleSet = parser.getCurrentName();
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                barf(parser, String.format("Rule set \"%s\" must be an array", ruleSet));
            }
            builder.addRuleSet(ruleSet);
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                builder.addRule(ruleSet, parseRule(parser, token));
                rules++;
            }
        }
        if (!ruleSetsPresent) {
            barf(parser, "Empty grammars are not allowed");
        }
        if (parser.nextToken() != null) {
            barf(parser, "Unexpected content after the grammar");
        }
        parser.close();
        logger.debug("Parsed grammar with {} rules", rules);
        return builder.build();
    }

    private static GrammarRule parseRule(final JsonParser parser, final JsonToken token) throws IOException {
        switch (token) {
        case VALUE_STRING:
            return GrammarRule.of(parser.getText(), Constants.FINAL_SYMBOL);

        case START_ARRAY:
            return parseArrayRule(parser);

        case START_OBJECT:
            return parseObjectRule(parser);

        default:
            barf(parser, "Rule must be a string, an array or an object");
            return null;
        }
    }

    // [lhs, target] or [lhs, target, weight], where lhs is "symbols" or ["input", "output"]
    private static GrammarRule parseArrayRule(final JsonParser parser) throws IOException {
        String input = null;
        String output = null;
        switch (parser.nextToken()) {
        case VALUE_STRING:
            input = parser.getText();
            break;

        case START_ARRAY:
            if (parser.nextToken() != JsonToken.VALUE_STRING) {
                barf(parser, "Rule input must be a string");
            }
            input = parser.getText();
            final JsonToken outputToken = parser.nextToken();
            if (outputToken == JsonToken.VALUE_STRING) {
                output = parser.getText();
                if (parser.nextToken() != JsonToken.END_ARRAY) {
                    barf(parser, "Rule sides must be [input] or [input, output]");
                }
            } else if (outputToken != JsonToken.END_ARRAY) {
                barf(parser, "Rule output must be a string");
            }
            break;

        default:
            barf(parser, "Rule must start with a string or an [input, output] array");
        }

        if (parser.nextToken() != JsonToken.VALUE_STRING) {
            barf(parser, "Rule target must be a string");
        }
        final String target = parser.getText();

        double weight = 0.0;
        JsonToken token = parser.nextToken();
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            weight = parser.getDoubleValue();
            token = parser.nextToken();
        }
        if (token != JsonToken.END_ARRAY) {
            barf(parser, "Rule weight must be a number and must be the last element");
        }
        return output == null ? GrammarRule.of(input, target, weight)
                : GrammarRule.transducing(input, output, target, weight);
    }

    private static GrammarRule parseObjectRule(final JsonParser parser) throws IOException {
        String input = null;
        String output = null;
        String target = null;
        double weight = 0.0;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String field = parser.getCurrentName();
            final JsonToken value = parser.nextToken();
            if (INPUT.equals(field) || OUTPUT.equals(field) || TARGET.equals(field)) {
                if (value != JsonToken.VALUE_STRING) {
                    barf(parser, String.format("\"%s\" must be a string", field));
                }
                if (INPUT.equals(field)) {
                    input = parser.getText();
                } else if (OUTPUT.equals(field)) {
                    output = parser.getText();
                } else {
                    target = parser.getText();
                }
            } else if (WEIGHT.equals(field)) {
                if (value != JsonToken.VALUE_NUMBER_INT && value != JsonToken.VALUE_NUMBER_FLOAT) {
                    barf(parser, "\"weight\" must be a number");
                }
                weight = parser.getDoubleValue();
            } else {
                barf(parser, String.format("Unrecognized rule field \"%s\"", field));
            }
        }
        if (input == null) {
            barf(parser, "Rule has no \"input\"");
        }
        if (target == null) {
            target = Constants.FINAL_SYMBOL;
        }
        return output == null ? GrammarRule.of(input, target, weight)
                : GrammarRule.transducing(input, output, target, weight);
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
