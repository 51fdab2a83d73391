package io.shadycss.ast;

/**
 * A half-open range {@code [start, end)} of character offsets into a source text.
 */
public record Range(int start, int end) {

    public Range {
        if (start < 0) {
            throw new IllegalArgumentException("start cannot be negative: " + start);
        }

        if (end < start) {
            throw new IllegalArgumentException("end cannot precede start: [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(Range other) {
        return other.start >= start && other.end <= end;
    }

    public boolean precedes(Range other) {
        return end <= other.start;
    }

    /**
     * Returns the slice of the source text covered by this range.
     */
    public String substring(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
