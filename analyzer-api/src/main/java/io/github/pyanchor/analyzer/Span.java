package io.github.pyanchor.analyzer;

/**
 * A half-open range of UTF-8 byte offsets into a source file, together with the literal text it covers.
 *
 * <p>Offsets are bytes, not characters: this is the stable contract with downstream consumers.
 */
public record Span(int start, int end, String text) implements Comparable<Span> {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public int compareTo(Span o) {
        int c = Integer.compare(start, o.start);
        return c != 0 ? c : Integer.compare(end, o.end);
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")'" + text + "'";
    }
}
