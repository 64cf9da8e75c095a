package org.broadinstitute.refloci.index;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import com.google.common.collect.UnmodifiableListIterator;
import org.broadinstitute.refloci.locus.Direction;
import org.broadinstitute.refloci.locus.Locus;
import org.broadinstitute.refloci.utils.Interval;
import org.broadinstitute.refloci.utils.Utils;
import org.broadinstitute.refloci.utils.param.ParamUtils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Holds many loci in memory, with efficient operations to get the loci that overlap a given query interval
 * and the loci nearest to a position.
 *
 * This version assumes that all the loci lie on the same chromosome.
 */
public final class ContigLocusIndex implements Iterable<Locus> {

    public static final int DEFAULT_TARGET_BUCKETS = 1000;
    public static final int DEFAULT_MIN_BUCKET_SIZE = 32;

    // each bucket contains 2**shift entries.
    private final int shift;

    // input loci, sorted by start then end
    private final List<Locus> byStart;
    private final int[] starts;

    // the same loci sorted by end then start, for upstream searches
    private final List<Locus> byEnd;
    private final int[] ends;

    // the chromosome all the loci are on.
    private final String chromosome;

    // reach: bucket# -> how far that bucket reaches.
    // e.g. bucket 0 contains the first 2**shift loci. reach[0] is the max over their .getEnd()
    //      reach[x] is the max over the .getEnd for that bucket and all the ones before it,
    //      so the array is non-decreasing and can be binary searched.
    private final int[] reach;

    public ContigLocusIndex(final Iterable<Locus> loci) {
        this(loci, DEFAULT_TARGET_BUCKETS, DEFAULT_MIN_BUCKET_SIZE);
    }

    /**
     * Creates an index that holds a copy of the given loci, sorted and indexed.
     *
     * @param loci loci, not necessarily sorted. Will be iterated over exactly once.
     * @param targetBuckets approx number of buckets we're aiming for
     * @param minBucketSize lower bound on the bucket size
     */
    public ContigLocusIndex(final Iterable<Locus> loci, final int targetBuckets, final int minBucketSize) {
        Utils.nonNull(loci);
        ParamUtils.isPositive(targetBuckets, "targetBuckets must be positive");
        ParamUtils.isPositive(minBucketSize, "minBucketSize must be positive");
        byStart = Lists.newArrayList(loci);

        final Set<String> chromosomes = byStart.stream().map(Locus::getChromosome).collect(Collectors.toSet());
        if (chromosomes.size() > 1) {
            throw new IllegalArgumentException("Only one chromosome expected but got " + chromosomes);
        }
        chromosome = byStart.isEmpty() ? "" : byStart.get(0).getChromosome();

        // heuristic: if we have too many small buckets then we're better off instead
        // taking fewer but bigger steps, and then iterating through a few values.
        // Thus, put a lower bound on bucket size.
        shift = floorLog2(Math.max(byStart.size() / targetBuckets, minBucketSize));

        byStart.sort(Comparator.naturalOrder());
        starts = byStart.stream().mapToInt(Locus::getStart).toArray();

        byEnd = new ArrayList<>(byStart);
        byEnd.sort(Comparator.comparingInt(Locus::getEnd).thenComparingInt(Locus::getStart).thenComparing(Locus::getStrand));
        ends = byEnd.stream().mapToInt(Locus::getEnd).toArray();

        reach = buildReach();
    }

    public String getChromosome() {
        return chromosome;
    }

    public int size() {
        return byStart.size();
    }

    /**
     * Returns all the loci that overlap the half-open query interval, in (start, end) order.
     * You may modify the returned list.
     */
    public List<Locus> getOverlapping(final Interval query) {
        Utils.nonNull(query);
        final List<Locus> ret = new ArrayList<>();
        // use index to skip early non-overlapping entries.
        for (int idx = firstPotentiallyReaching(query.getStart()); idx < byStart.size(); idx++) {
            // they are sorted by start location, so if this one starts too late
            // then all of the others will, too.
            if (starts[idx] >= query.getEnd()) {
                break;
            }
            final Locus v = byStart.get(idx);
            if (v.getInterval().overlaps(query)) {
                ret.add(v);
            }
        }
        return ret;
    }

    // returns all the loci that overlap with the query.
    // (use the optimized version instead, unless you're testing it and need something to compare against)
    @VisibleForTesting
    List<Locus> getOverlappingIgnoringIndex(final Interval query) {
        return byStart.stream().filter(v -> v.getInterval().overlaps(query)).collect(Collectors.toList());
    }

    /**
     * Returns the loci lying entirely within the query interval.
     */
    public List<Locus> getContained(final Interval query) {
        Utils.nonNull(query);
        final List<Locus> ret = new ArrayList<>();
        for (int idx = lowerBound(starts, query.getStart()); idx < byStart.size() && starts[idx] <= query.getEnd(); idx++) {
            final Locus v = byStart.get(idx);
            if (v.getEnd() <= query.getEnd()) {
                ret.add(v);
            }
        }
        return ret;
    }

    /**
     * Returns the loci that cover every position of the query interval.
     */
    public List<Locus> getContaining(final Interval query) {
        Utils.nonNull(query);
        final List<Locus> ret = new ArrayList<>();
        // anything whose bucket never reaches query end cannot contain it
        for (int idx = firstPotentiallyReaching(query.getEnd() - 1); idx < byStart.size() && starts[idx] <= query.getStart(); idx++) {
            final Locus v = byStart.get(idx);
            if (v.getInterval().contains(query)) {
                ret.add(v);
            }
        }
        return ret;
    }

    /**
     * DOWNSTREAM: the locus with the smallest start at or after {@code position} (ties go to the shortest).
     * UPSTREAM: the locus with the greatest end at or before {@code position} (ties go to the shortest).
     */
    public Optional<Locus> nearest(final int position, final Direction direction) {
        Utils.nonNull(direction);
        switch (direction) {
            case DOWNSTREAM: {
                final int idx = lowerBound(starts, position);
                return idx < byStart.size() ? Optional.of(byStart.get(idx)) : Optional.empty();
            }
            case UPSTREAM: {
                final int idx = lowerBound(ends, position + 1L) - 1;
                return idx >= 0 ? Optional.of(byEnd.get(idx)) : Optional.empty();
            }
            default:
                throw new IllegalArgumentException("Unsupported direction " + direction);
        }
    }

    /**
     * Loci ending at or before {@code position}, nearest first.
     *
     * @param limit maximum number of loci to return
     * @param maxDistance loci whose end is further than this from {@code position} are not returned
     */
    public List<Locus> getUpstreamOf(final int position, final int limit, final int maxDistance) {
        ParamUtils.isPositiveOrZero(limit, "limit must be >= 0");
        ParamUtils.isPositiveOrZero(maxDistance, "maxDistance must be >= 0");
        final List<Locus> ret = new ArrayList<>();
        for (int idx = lowerBound(ends, position + 1L) - 1; idx >= 0 && ret.size() < limit; idx--) {
            if ((long) position - ends[idx] > maxDistance) {
                break;
            }
            ret.add(byEnd.get(idx));
        }
        return ret;
    }

    /**
     * Loci starting at or after {@code position}, nearest first.
     *
     * @param limit maximum number of loci to return
     * @param maxDistance loci whose start is further than this from {@code position} are not returned
     */
    public List<Locus> getDownstreamOf(final int position, final int limit, final int maxDistance) {
        ParamUtils.isPositiveOrZero(limit, "limit must be >= 0");
        ParamUtils.isPositiveOrZero(maxDistance, "maxDistance must be >= 0");
        final List<Locus> ret = new ArrayList<>();
        for (int idx = lowerBound(starts, position); idx < byStart.size() && ret.size() < limit; idx++) {
            if ((long) starts[idx] - position > maxDistance) {
                break;
            }
            ret.add(byStart.get(idx));
        }
        return ret;
    }

    // returns an index into the byStart array s.t. no entry before that index
    // extends beyond the given position.
    private int firstPotentiallyReaching(final int position) {
        int lo = 0;
        int hi = reach.length;
        while (lo < hi) {
            final int mid = (lo + hi) >>> 1;
            if (reach[mid] > position) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        // lo == reach.length means no one reaches past the given position.
        return Math.min(lo << shift, byStart.size());
    }

    // first index i such that values[i] >= key
    private static int lowerBound(final int[] values, final long key) {
        int lo = 0;
        int hi = values.length;
        while (lo < hi) {
            final int mid = (lo + hi) >>> 1;
            if (values[mid] < key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private int[] buildReach() {
        if (byStart.isEmpty()) {
            return new int[0];
        }
        int max = Integer.MIN_VALUE;
        int key = 0;
        int idx = 0;
        // result: bucket# -> how far that bucket reaches
        final int[] result = new int[((byStart.size() - 1) >> shift) + 1];
        for (final Locus v : byStart) {
            final int k = idx >> shift;
            if (k > key) {
                result[key] = max;
                key = k;
            }
            if (v.getEnd() > max) {
                max = v.getEnd();
            }
            idx++;
        }
        result[key] = max;
        return result;
    }

    private static int floorLog2(final int n) {
        if (n <= 0) {
            throw new IllegalArgumentException();
        }
        // size of int is 32 bits
        return 31 - Integer.numberOfLeadingZeros(n);
    }

    @Override
    public Iterator<Locus> iterator() {
        return new LocusIterator(0);
    }

    public ListIterator<Locus> listIterator() {
        return new LocusIterator(0);
    }

    private class LocusIterator extends UnmodifiableListIterator<Locus> {

        private int nextIndex;

        private LocusIterator(final int nextIndex) {
            this.nextIndex = ParamUtils.inRange(nextIndex, 0, byStart.size(), "start next index");
        }

        @Override
        public boolean hasNext() {
            return nextIndex < byStart.size();
        }

        @Override
        public Locus next() {
            if (hasNext()) {
                return byStart.get(nextIndex++);
            } else {
                throw new NoSuchElementException("reached beyond the end of the list");
            }
        }

        @Override
        public boolean hasPrevious() {
            return nextIndex > 0;
        }

        @Override
        public Locus previous() {
            if (hasPrevious()) {
                return byStart.get(--nextIndex);
            } else {
                throw new NoSuchElementException("reached beyond the start of the list");
            }
        }

        @Override
        public int nextIndex() {
            return nextIndex;
        }

        @Override
        public int previousIndex() {
            return nextIndex - 1;
        }
    }
}
