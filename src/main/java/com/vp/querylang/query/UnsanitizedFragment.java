package com.vp.querylang.query;

import java.util.Objects;

/**
 * Compiled query text meant to be spliced into a git command line or an SQL {@code WHERE} clause.
 *
 * <p>Values are escaped only for the characters the target syntax is known to need. A value with
 * other special characters can still change the meaning of the fragment, so the text is only safe
 * when the queries came from a trusted user (an authenticated administrator). {@link #toString()}
 * deliberately hides the text; use {@link #toTrustedString()} at the point where that trust is
 * established.
 */
public final class UnsanitizedFragment {

    public enum Target {
        GIT_LOG_ARGUMENTS,
        SQL_RESTRICTION
    }

    private final Target target;
    private final String text;

    public UnsanitizedFragment(Target target, String text) {
        this.target = Objects.requireNonNull(target, "target");
        this.text = Objects.requireNonNull(text, "text");
    }

    public static UnsanitizedFragment empty(Target target) {
        return new UnsanitizedFragment(target, "");
    }

    public Target getTarget() {
        return target;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /**
     * Returns the raw fragment. Callers assert that the queries it was built from are trusted.
     */
    public String toTrustedString() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnsanitizedFragment)) return false;
        UnsanitizedFragment that = (UnsanitizedFragment) o;
        return target == that.target && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, text);
    }

    @Override
    public String toString() {
        return "UnsanitizedFragment{target=" + target + ", length=" + text.length() + "}";
    }
}
