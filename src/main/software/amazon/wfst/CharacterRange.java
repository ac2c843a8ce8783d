package software.amazon.wfst;

import javax.annotation.concurrent.Immutable;

/**
 * An inclusive range of Unicode code points, one member of a character class.
 */
@Immutable
public final class CharacterRange {

    private final int first;
    private final int last;

    private CharacterRange(final int first, final int last) {
        this.first = first;
        this.last = last;
    }

    public static CharacterRange between(final int first, final int last) {
        if (!Character.isValidCodePoint(first) || !Character.isValidCodePoint(last)) {
            throw new IllegalArgumentException("Not a code point range: " + first + "-" + last);
        }
        if (first > last) {
            throw new IllegalArgumentException("Bottom must be less than or equal to top, got " + first + "-" + last);
        }
        return new CharacterRange(first, last);
    }

    public static CharacterRange between(final char first, final char last) {
        return between((int) first, (int) last);
    }

    public static CharacterRange single(final int codePoint) {
        return between(codePoint, codePoint);
    }

    public int getFirst() {
        return first;
    }

    public int getLast() {
        return last;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CharacterRange that = (CharacterRange) o;
        return first == that.first && last == that.last;
    }

    @Override
    public int hashCode() {
        return 31 * first + last;
    }

    @Override
    public String toString() {
        return "[" + first + "-" + last + "]";
    }
}
