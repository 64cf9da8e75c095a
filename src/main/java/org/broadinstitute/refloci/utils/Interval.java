package org.broadinstitute.refloci.utils;

import org.broadinstitute.refloci.exceptions.RefLociException;

import java.io.Serializable;

/**
 * Minimal immutable class representing a 0-based half-open range {@code [start, end)} on a single coordinate axis.
 * The interval carries no contig; chromosome-aware comparisons live in {@link org.broadinstitute.refloci.locus.Locus}.
 *
 * Empty intervals ({@code start == end}) are allowed. They overlap nothing that does not strictly straddle them,
 * including themselves.
 */
public final class Interval implements Comparable<Interval>, Serializable {
    private static final long serialVersionUID = 1L;

    private final int start;
    private final int end;

    /**
     * Create a new immutable half-open interval of the form [start, end)
     * @param start 0-based inclusive start position
     * @param end 0-based exclusive end position
     * @throws RefLociException.ValidationException if {@code start > end}
     */
    public Interval(final int start, final int end) {
        if (!isValid(start, end)) {
            throw new RefLociException.ValidationException("Invalid interval. start:" + start + " end:" + end);
        }
        this.start = start;
        this.end = end;
    }

    public static boolean isValid(final int start, final int end) {
        return start <= end;
    }

    /**
     * The symmetric window {@code [position - radius, position + radius)} around a point, clamped to the
     * range of {@code int}.
     * @param radius must be non-negative
     */
    public static Interval window(final int position, final int radius) {
        Utils.validateArg(radius >= 0, () -> "window must be >= 0 but was " + radius);
        return new Interval(clamp((long) position - radius), clamp((long) position + radius));
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * @return number of positions covered by this interval (may be 0)
     */
    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Intervals sharing only a boundary point do not overlap.
     */
    public boolean overlaps(final Interval other) {
        Utils.nonNull(other);
        return start < other.end && other.start < end;
    }

    public boolean contains(final Interval other) {
        Utils.nonNull(other);
        return start <= other.start && other.end <= end;
    }

    /**
     * @return 0 if the intervals overlap or abut, otherwise the number of positions in the gap between the nearer edges
     */
    public int distance(final Interval other) {
        Utils.nonNull(other);
        if (overlaps(other)) {
            return 0;
        }
        return Math.max(0, Math.max(start, other.start) - Math.min(end, other.end));
    }

    /**
     * Returns the minimal interval covering both this and other. The two need not overlap.
     */
    public Interval span(final Interval other) {
        Utils.nonNull(other);
        return new Interval(Math.min(start, other.start), Math.max(end, other.end));
    }

    /**
     * Returns the intersection of the two intervals. The intervals must overlap or IllegalArgumentException will be thrown.
     */
    public Interval intersect(final Interval other) {
        Utils.validateArg(overlaps(other), () -> "Interval::intersect(): The two intervals need to overlap " + this + " " + other);
        return new Interval(Math.max(start, other.start), Math.min(end, other.end));
    }

    /**
     * Returns this interval grown by {@code padding} positions on both sides, clamped to the range of {@code int}.
     */
    public Interval expand(final int padding) {
        Utils.validateArg(padding >= 0, "padding must be >= 0");
        return new Interval(clamp((long) start - padding), clamp((long) end + padding));
    }

    private static int clamp(final long position) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, position));
    }

    @Override
    public int compareTo(final Interval other) {
        final int startCmp = Integer.compare(start, other.start);
        return startCmp == 0 ? Integer.compare(end, other.end) : startCmp;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final Interval that = (Interval) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
