package software.amazon.wfst.flag;

import javax.annotation.concurrent.Immutable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides whether the flag diacritics in a sequence of symbols agree with each other. The flags are replayed in order
 * against an initially empty set of feature settings; the sequence is accepted if no flag fails. Symbols that are not
 * flags are ignored.
 */
@Immutable
public final class FlagStringFilter implements Predicate<List<String>> {

    // flags of the alphabet, parsed once up front
    private final Map<String, FlagOperation> known = new HashMap<>();

    public FlagStringFilter(final Set<String> alphabet) {
        for (String symbol : alphabet) {
            final FlagOperation operation = FlagOperation.parse(symbol);
            if (operation != null) {
                known.put(symbol, operation);
            }
        }
    }

    @Override
    public boolean test(final List<String> symbols) {
        final Map<String, Setting> settings = new HashMap<>();
        for (String symbol : symbols) {
            FlagOperation operation = known.get(symbol);
            if (operation == null) {
                if (!FlagDiacritics.isFlag(symbol)) {
                    continue;
                }
                operation = FlagOperation.parse(symbol);
            }
            if (!apply(operation, settings)) {
                return false;
            }
        }
        return true;
    }

    private static boolean apply(final FlagOperation operation, final Map<String, Setting> settings) {
        final String feature = operation.getFeature();
        final String value = operation.getValue();
        final Setting current = settings.get(feature);
        switch (operation.getOperator()) {
            case P:
                settings.put(feature, new Setting(value, true));
                return true;
            case N:
                settings.put(feature, new Setting(value, false));
                return true;
            case R:
                if (value == null) {
                    return current != null;
                }
                return current != null && current.is(value);
            case D:
                if (value == null) {
                    return current == null;
                }
                return current == null || !current.is(value);
            case C:
                settings.remove(feature);
                return true;
            case U:
                if (current == null || current.is(value)) {
                    settings.put(feature, new Setting(value, true));
                    return true;
                }
                return false;
            case E:
                if (value == null) {
                    return current == null;
                }
                return current != null && current.is(value);
            default:
                throw new IllegalStateException("Unknown flag operator " + operation.getOperator());
        }
    }

    private static final class Setting {
        final String value;
        final boolean positive;

        Setting(final String value, final boolean positive) {
            this.value = value;
            this.positive = positive;
        }

        // true if this setting makes the feature equal to value
        boolean is(final String value) {
            return positive == Objects.equals(this.value, value);
        }
    }
}
