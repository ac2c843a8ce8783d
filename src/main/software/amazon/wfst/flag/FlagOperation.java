package software.amazon.wfst.flag;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One parsed flag diacritic, such as {@code @U.case.nom@}: an operator, a feature, and an optional value.
 */
@Immutable
public final class FlagOperation {

    private static final Pattern FLAG = Pattern.compile("@([PNRDCUE])\\.([^.@]+)(?:\\.([^.@]+))?@");

    /**
     * The flag operators.
     */
    public enum Operator {
        /** Positive set: the feature takes the value. */
        P,
        /** Negative set: the feature takes the complement of the value. */
        N,
        /** Require: the feature must be set, to the value if one is given. */
        R,
        /** Disallow: the feature must not be set, or must not be set to the value if one is given. */
        D,
        /** Clear: the feature becomes unset. */
        C,
        /** Unify: the feature must be unset or compatible with the value, and then takes the value. */
        U,
        /** Equal: the feature must be set to the value, or be unset if no value is given. */
        E
    }

    private final Operator operator;
    private final String feature;
    @Nullable
    private final String value;

    FlagOperation(final Operator operator, final String feature, @Nullable final String value) {
        this.operator = operator;
        this.feature = feature;
        this.value = value;
    }

    /**
     * @param symbol any symbol
     * @return the parsed flag, or null if the symbol is not a flag diacritic
     */
    @Nullable
    public static FlagOperation parse(final String symbol) {
        final Matcher m = FLAG.matcher(symbol);
        if (!m.matches()) {
            return null;
        }
        return new FlagOperation(Operator.valueOf(m.group(1)), m.group(2), m.group(3));
    }

    public Operator getOperator() {
        return operator;
    }

    public String getFeature() {
        return feature;
    }

    @Nullable
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FlagOperation that = (FlagOperation) o;
        return operator == that.operator && feature.equals(that.feature) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, feature, value);
    }

    @Override
    public String toString() {
        return "@" + operator + "." + feature + (value == null ? "" : "." + value) + "@";
    }
}
