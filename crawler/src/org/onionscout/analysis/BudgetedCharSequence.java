package org.onionscout.analysis;

/**
 * A CharSequence that throws after a fixed number of character reads, bounding the work a regex can spend
 * backtracking on hostile input. Matching is deterministic, so the same text always gives up at the same point.
 */
final class BudgetedCharSequence implements CharSequence {
    private final String text;
    private long remaining;

    BudgetedCharSequence(String text, long budget) {
        this.text = text;
        this.remaining = budget;
    }

    @Override
    public char charAt(int index) {
        if (--remaining < 0) {
            throw new MatchTimeoutException("Pattern matching exceeded its budget of character reads");
        }
        return text.charAt(index);
    }

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return text.substring(start, end);
    }

    @Override
    public String toString() {
        return text;
    }
}
