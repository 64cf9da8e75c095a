package org.broadinstitute.refloci.index;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;
import org.broadinstitute.refloci.locus.Direction;
import org.broadinstitute.refloci.locus.Locus;
import org.broadinstitute.refloci.utils.Interval;
import org.broadinstitute.refloci.utils.Utils;

import java.util.*;
import java.util.function.Function;

/**
 * Holds many loci in memory, with efficient operations to get the loci that overlap a given query interval
 * or lie near a position.
 *
 * This version allows loci to lie on different chromosomes; one {@link ContigLocusIndex} is kept per chromosome.
 * Queries on a chromosome the index has never seen return empty results rather than failing.
 *
 * Instances are immutable once built and may be shared between threads.
 */
public final class LocusIndex extends AbstractCollection<Locus> {

    private final int size;
    private final SortedMap<String, ContigLocusIndex> perChromosome;

    public LocusIndex(final Iterable<Locus> loci) {
        this(loci, ContigLocusIndex.DEFAULT_TARGET_BUCKETS, ContigLocusIndex.DEFAULT_MIN_BUCKET_SIZE);
    }

    /**
     * Creates a LocusIndex that holds a copy of the given loci, sorted and indexed.
     *
     * @param loci loci, not necessarily sorted. Will be iterated over exactly once.
     */
    public LocusIndex(final Iterable<Locus> loci, final int targetBuckets, final int minBucketSize) {
        Utils.nonNull(loci);
        final Map<String, List<Locus>> lociPerChromosome = new LinkedHashMap<>();
        int size = 0;
        for (final Locus v : loci) {
            lociPerChromosome.computeIfAbsent(v.getChromosome(), k -> new ArrayList<>()).add(v);
            size++;
        }
        perChromosome = new TreeMap<>();
        for (final Map.Entry<String, List<Locus>> entry : lociPerChromosome.entrySet()) {
            perChromosome.put(entry.getKey(), new ContigLocusIndex(entry.getValue(), targetBuckets, minBucketSize));
        }
        this.size = size;
    }

    /**
     * Returns all the loci on {@code chromosome} that overlap the half-open query interval.
     * You may modify the returned list.
     */
    public List<Locus> queryOverlap(final String chromosome, final Interval query) {
        Utils.nonNull(query);
        return onChromosome(chromosome, index -> index.getOverlapping(query));
    }

    /**
     * Equivalent to {@code queryOverlap(chromosome, [position - window, position + window))}.
     */
    public List<Locus> queryWindow(final String chromosome, final int position, final int window) {
        return queryOverlap(chromosome, Interval.window(position, window));
    }

    public List<Locus> queryContained(final String chromosome, final Interval query) {
        Utils.nonNull(query);
        return onChromosome(chromosome, index -> index.getContained(query));
    }

    public List<Locus> queryContaining(final String chromosome, final Interval query) {
        Utils.nonNull(query);
        return onChromosome(chromosome, index -> index.getContaining(query));
    }

    /**
     * @return the closest locus on the requested side of {@code position}, or empty if there is none
     * @see ContigLocusIndex#nearest(int, Direction)
     */
    public Optional<Locus> nearest(final String chromosome, final int position, final Direction direction) {
        Utils.nonNull(chromosome);
        final ContigLocusIndex index = perChromosome.get(chromosome);
        return index == null ? Optional.empty() : index.nearest(position, direction);
    }

    /**
     * Loci entirely on one side of {@code position}, nearest first.
     */
    public List<Locus> neighbors(final String chromosome, final int position, final Direction direction,
                                 final int limit, final int maxDistance) {
        Utils.nonNull(direction);
        return onChromosome(chromosome, index -> direction == Direction.UPSTREAM
                ? index.getUpstreamOf(position, limit, maxDistance)
                : index.getDownstreamOf(position, limit, maxDistance));
    }

    private List<Locus> onChromosome(final String chromosome, final Function<ContigLocusIndex, List<Locus>> query) {
        Utils.nonNull(chromosome);
        final ContigLocusIndex index = perChromosome.get(chromosome);
        if (index == null) {
            return new ArrayList<>();
        }
        return query.apply(index);
    }

    /**
     * Iterates chromosome by chromosome (lexicographic order), and by (start, end) within a chromosome.
     */
    @Override
    public Iterator<Locus> iterator() {
        return Iterators.concat(perChromosome.values().stream().map(Iterable::iterator).iterator());
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * Returns the chromosomes for which this index holds loci, in iteration order.
     * The returned set cannot be modified.
     */
    public Set<String> chromosomes() {
        return Collections.unmodifiableSet(perChromosome.keySet());
    }

    /**
     * Returns an iterator over the loci on a particular chromosome.
     * Requests on an unknown chromosome return an iterator without elements.
     */
    public Iterator<Locus> chromosomeIterator(final String chromosome) {
        Utils.nonNull(chromosome);
        final ContigLocusIndex index = perChromosome.get(chromosome);
        if (index == null) {
            return ImmutableSet.<Locus>of().iterator();
        }
        return index.iterator();
    }
}
