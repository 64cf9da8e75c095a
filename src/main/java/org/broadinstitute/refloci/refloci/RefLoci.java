package org.broadinstitute.refloci.refloci;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.refloci.exceptions.RefLociException;
import org.broadinstitute.refloci.index.LocusIndex;
import org.broadinstitute.refloci.locus.Direction;
import org.broadinstitute.refloci.locus.FeatureKind;
import org.broadinstitute.refloci.locus.Locus;
import org.broadinstitute.refloci.storage.SnapshotStore;
import org.broadinstitute.refloci.utils.Interval;
import org.broadinstitute.refloci.utils.Strand;
import org.broadinstitute.refloci.utils.Utils;
import org.broadinstitute.refloci.utils.config.ConfigFactory;
import org.broadinstitute.refloci.utils.config.RefLociConfig;
import org.broadinstitute.refloci.utils.param.ParamUtils;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A named collection of {@link Locus} objects with stable ids, indexed for range and proximity queries and
 * persisted as a single snapshot in a {@link SnapshotStore}.
 *
 * A new collection starts in {@link RefLociState#BUILDING}, where loci may be inserted and removed. {@link #freeze}
 * writes a snapshot and makes the collection read-only; {@link #load} rehydrates a snapshot in
 * {@link RefLociState#LOADED} state. Read-only collections can be shared between threads. A BUILDING collection
 * must only be used by one thread at a time; its index is rebuilt lazily by the first query after a change.
 */
public final class RefLoci implements Iterable<Locus> {
    private static final Logger logger = LogManager.getLogger(RefLoci.class);

    private static final int FIRST_ID = 1;

    /** Attribute keys set on the results of {@link #candidateLoci}. */
    public static final String PARENT_LOCUS_ATTRIBUTE = "parent_locus";
    public static final String PARENT_DISTANCE_ATTRIBUTE = "parent_distance";
    public static final String INTERVENING_RANK_ATTRIBUTE = "intervening_rank";
    public static final String NUM_INTERVENING_ATTRIBUTE = "num_intervening";
    public static final String NUM_SIBLINGS_ATTRIBUTE = "num_siblings";
    public static final String PARENT_ATTRIBUTE_PREFIX = "parent_";

    private final SnapshotStore store;
    private final RefLociConfig config;
    private final RefLociCodec codec;

    private String name;
    private RefLociState state = RefLociState.BUILDING;
    private int nextId = FIRST_ID;

    private final LinkedHashMap<Integer, Locus> loci = new LinkedHashMap<>();
    private final LinkedHashMap<String, Integer> aliases = new LinkedHashMap<>();

    // null when stale; read-only collections build both before leaving freeze or load
    private volatile LocusIndex index;
    private volatile Map<String, Integer> idsByName;

    /**
     * Creates an empty collection using the shared {@link RefLociConfig}.
     */
    public RefLoci(final String name, final SnapshotStore store) {
        this(name, store, ConfigFactory.getInstance().getRefLociConfig());
    }

    public RefLoci(final String name, final SnapshotStore store, final RefLociConfig config) {
        this.name = SnapshotStore.validateName(name);
        this.store = Utils.nonNull(store, "store");
        this.config = Utils.nonNull(config, "config");
        this.codec = new RefLociCodec(config.kryo_buffer_size());
    }

    // ------------------------------------------------------------------------------------------------------------
    // mutation

    /**
     * Adds a locus and returns the id it was assigned. Any id the locus already carries is replaced.
     */
    public int insert(final Locus locus) {
        Utils.nonNull(locus, "locus");
        requireBuilding("insert");
        final int id = nextId++;
        loci.put(id, locus.withId(id));
        invalidate();
        return id;
    }

    /**
     * Adds all the loci, in iteration order. Nothing is added if any element is null.
     *
     * @return the assigned ids, in the same order as the loci
     */
    public List<Integer> insertAll(final Iterable<Locus> toInsert) {
        Utils.nonNull(toInsert, "loci");
        requireBuilding("insert");
        final List<Locus> batch = Utils.stream(toInsert).collect(Collectors.toList());
        Utils.containsNoNull(batch, "loci must not contain null");

        final List<Integer> ids = new ArrayList<>(batch.size());
        for (final Locus locus : batch) {
            final int id = nextId++;
            loci.put(id, locus.withId(id));
            ids.add(id);
        }
        invalidate();
        return ids;
    }

    /**
     * Removes the locus with the given id together with its aliases. Ids are never reused.
     *
     * @return the removed locus
     */
    public Locus remove(final int id) {
        requireBuilding("remove");
        final Locus removed = loci.remove(id);
        if (removed == null) {
            throw new RefLociException.MissingLocus(id, name);
        }
        aliases.values().removeIf(aliasedId -> aliasedId == id);
        invalidate();
        return removed;
    }

    /**
     * Registers an additional name under which {@link #lookup} finds the locus with the given id.
     * Re-registering an alias moves it to the new id.
     */
    public void addAlias(final int id, final String alias) {
        Utils.nonNull(alias, "alias");
        Utils.validateArg(!alias.isEmpty(), "alias must not be empty");
        requireBuilding("add an alias to");
        if (!loci.containsKey(id)) {
            throw new RefLociException.MissingLocus(id, name);
        }
        aliases.put(alias, id);
    }

    private void requireBuilding(final String action) {
        if (state.isReadOnly()) {
            throw new RefLociException.IllegalCollectionState("Cannot " + action + " RefLoci " + name + " while it is " + state + "; reopen it first");
        }
    }

    private void invalidate() {
        index = null;
        idsByName = null;
    }

    // ------------------------------------------------------------------------------------------------------------
    // lookup

    /**
     * @throws RefLociException.MissingLocus if there is no locus with this id
     */
    public Locus getLocus(final int id) {
        final Locus locus = loci.get(id);
        if (locus == null) {
            throw new RefLociException.MissingLocus(id, name);
        }
        return locus;
    }

    /**
     * Finds a locus by its name or by one of its aliases. When several loci share a name, the one inserted
     * first wins. Names take precedence over aliases.
     */
    public Optional<Locus> lookup(final String nameOrAlias) {
        Utils.nonNull(nameOrAlias, "name");
        Integer id = namesToIds().get(nameOrAlias);
        if (id == null) {
            id = aliases.get(nameOrAlias);
        }
        return id == null ? Optional.empty() : Optional.of(loci.get(id));
    }

    private Map<String, Integer> namesToIds() {
        Map<String, Integer> names = idsByName;
        if (names == null) {
            final Map<String, Integer> firstIds = new LinkedHashMap<>();
            loci.forEach((id, locus) -> {
                if (locus.getName() != null) {
                    firstIds.putIfAbsent(locus.getName(), id);
                }
            });
            names = ImmutableMap.copyOf(firstIds);
            idsByName = names;
        }
        return names;
    }

    /**
     * @return true if a locus equal to the given one (same chromosome, interval and strand) is stored
     */
    public boolean contains(final Locus locus) {
        Utils.nonNull(locus, "locus");
        return ensureIndex().queryContaining(locus.getChromosome(), locus.getInterval()).contains(locus);
    }

    public int size() {
        return loci.size();
    }

    public boolean isEmpty() {
        return loci.isEmpty();
    }

    /**
     * @return the chromosomes with at least one locus, in lexicographic order
     */
    public Set<String> chromosomes() {
        return ensureIndex().chromosomes();
    }

    /**
     * @return the aliases, in registration order; cannot be modified
     */
    public Map<String, Integer> getAliases() {
        return Collections.unmodifiableMap(aliases);
    }

    public String getName() {
        return name;
    }

    public RefLociState getState() {
        return state;
    }

    /**
     * Iterates over the loci in insertion order. The iterator does not support removal.
     */
    @Override
    public Iterator<Locus> iterator() {
        return Collections.unmodifiableCollection(loci.values()).iterator();
    }

    // ------------------------------------------------------------------------------------------------------------
    // lifecycle

    /**
     * Writes a snapshot under the collection's own name, failing if one already exists.
     */
    public void freeze() {
        freeze(name, false);
    }

    public void freeze(final boolean overwrite) {
        freeze(name, overwrite);
    }

    /**
     * Writes a snapshot under {@code snapshotName}, after which this collection is FROZEN and carries that name.
     * All checks happen before anything is written; the store commits the snapshot atomically.
     *
     * @throws RefLociException.IllegalCollectionState if the collection is empty, or the name is taken and
     * {@code overwrite} is false
     */
    public void freeze(final String snapshotName, final boolean overwrite) {
        SnapshotStore.validateName(snapshotName);
        if (loci.isEmpty()) {
            throw new RefLociException.IllegalCollectionState("Cannot freeze RefLoci " + snapshotName + ": it holds no loci");
        }
        if (!overwrite && store.exists(snapshotName)) {
            throw new RefLociException.IllegalCollectionState("A RefLoci named " + snapshotName + " already exists; freeze with overwrite to replace it");
        }
        ensureIndex();
        namesToIds();
        final byte[] blob = codec.encode(new RefLociCodec.Snapshot(snapshotName, nextId, loci, aliases));
        verifyReadable(snapshotName, blob);
        store.put(snapshotName, blob);
        name = snapshotName;
        state = RefLociState.FROZEN;
        logger.info("Froze RefLoci " + name + " (" + loci.size() + " loci, " + aliases.size() + " aliases, " + blob.length + " bytes)");
    }

    // a snapshot that cannot be decoded must never reach the store
    private void verifyReadable(final String snapshotName, final byte[] blob) {
        final RefLociCodec.Snapshot decoded = codec.decode(blob);
        if (decoded.loci.size() != loci.size() || decoded.aliases.size() != aliases.size()) {
            throw new RefLociException.StorageException("Snapshot " + snapshotName + " does not read back the loci and aliases it was written with");
        }
    }

    /**
     * Loads the snapshot stored under {@code name}, using the shared {@link RefLociConfig}.
     */
    public static RefLoci load(final SnapshotStore store, final String name) {
        return load(store, name, ConfigFactory.getInstance().getRefLociConfig());
    }

    /**
     * Loads the snapshot stored under {@code name}. Ids and aliases are exactly those of the frozen collection,
     * and the index is built before returning.
     *
     * @throws RefLociException.SnapshotNotFound if there is no such snapshot
     * @throws RefLociException.StorageException if the snapshot cannot be read or decoded
     */
    public static RefLoci load(final SnapshotStore store, final String name, final RefLociConfig config) {
        Utils.nonNull(store, "store");
        SnapshotStore.validateName(name);
        final RefLoci refLoci = new RefLoci(name, store, config);
        ConfigFactory.logConfigFields(config);
        final RefLociCodec.Snapshot snapshot = refLoci.codec.decode(store.get(name));

        for (final Map.Entry<Integer, Locus> entry : snapshot.loci.entrySet()) {
            final int id = entry.getKey();
            if (id < FIRST_ID || id >= snapshot.nextId) {
                throw new RefLociException.StorageException("Snapshot " + name + " holds locus id " + id + " outside of [" + FIRST_ID + ", " + snapshot.nextId + ")");
            }
            refLoci.loci.put(id, entry.getValue().withId(id));
        }
        for (final Map.Entry<String, Integer> alias : snapshot.aliases.entrySet()) {
            if (!refLoci.loci.containsKey(alias.getValue())) {
                throw new RefLociException.StorageException("Snapshot " + name + " has alias " + alias.getKey() + " for unknown id " + alias.getValue());
            }
            refLoci.aliases.put(alias.getKey(), alias.getValue());
        }
        refLoci.nextId = snapshot.nextId;
        refLoci.ensureIndex();
        refLoci.namesToIds();
        refLoci.state = RefLociState.LOADED;
        logger.info("Loaded RefLoci " + name + " (" + refLoci.size() + " loci on " + refLoci.chromosomes().size() + " chromosomes)");
        return refLoci;
    }

    /**
     * Makes a read-only collection mutable again under the same name. The snapshot in the store is left alone
     * until the collection is frozen again with overwrite. Does nothing if the collection is already BUILDING.
     */
    public void reopen() {
        if (state != RefLociState.BUILDING) {
            logger.debug("Reopening RefLoci {} ({})", name, state);
            state = RefLociState.BUILDING;
        }
    }

    /**
     * @return a BUILDING working copy named {@code newName}, with the same loci, ids and aliases
     */
    public RefLoci copy(final String newName) {
        final RefLoci copy = new RefLoci(newName, store, config);
        copy.loci.putAll(loci);
        copy.aliases.putAll(aliases);
        copy.nextId = nextId;
        copy.index = index;
        return copy;
    }

    /**
     * @return the names of the snapshots in the store, sorted
     */
    public static List<String> listNames(final SnapshotStore store) {
        return Utils.nonNull(store, "store").list();
    }

    /**
     * Deletes a snapshot. Collections already loaded from it are not affected.
     *
     * @throws RefLociException.SnapshotNotFound if there is no such snapshot
     */
    public static void delete(final SnapshotStore store, final String name) {
        Utils.nonNull(store, "store");
        if (!store.delete(SnapshotStore.validateName(name))) {
            throw new RefLociException.SnapshotNotFound(name);
        }
        logger.info("Deleted RefLoci " + name);
    }

    // ------------------------------------------------------------------------------------------------------------
    // queries

    private LocusIndex ensureIndex() {
        LocusIndex idx = index;
        if (idx == null) {
            final long startTime = System.currentTimeMillis();
            idx = new LocusIndex(loci.values(), config.index_target_buckets(), config.index_min_bucket_size());
            index = idx;
            logger.debug("Indexed {} loci of RefLoci {} in {} ms", loci.size(), name, System.currentTimeMillis() - startTime);
        }
        return idx;
    }

    /**
     * All loci on {@code chromosome} overlapping the half-open interval, in (start, end) order.
     * An unknown chromosome gives an empty list.
     */
    public List<Locus> queryOverlap(final String chromosome, final Interval interval) {
        return ensureIndex().queryOverlap(chromosome, interval);
    }

    /**
     * All loci overlapping {@code locus}. When {@link RefLociConfig#strand_specific()} is set, loci on the
     * opposite strand are left out.
     */
    public List<Locus> queryOverlap(final Locus locus) {
        Utils.nonNull(locus, "locus");
        final List<Locus> hits = queryOverlap(locus.getChromosome(), locus.getInterval());
        return config.strand_specific() ? sameStrandOnly(hits, locus.getStrand()) : hits;
    }

    /**
     * All loci on {@code chromosome} overlapping {@code [position - window, position + window)}.
     */
    public List<Locus> queryWindow(final String chromosome, final int position, final int window) {
        ParamUtils.isPositiveOrZero(window, "window must be >= 0");
        return ensureIndex().queryWindow(chromosome, position, window);
    }

    /**
     * @see LocusIndex#nearest(String, int, Direction)
     */
    public Optional<Locus> nearest(final String chromosome, final int position, final Direction direction) {
        return ensureIndex().nearest(chromosome, position, direction);
    }

    /**
     * Loci lying in {@code locus}: overlapping it when {@code partial} is true, entirely inside it otherwise.
     * Results run 5' to 3' along the locus, so they are in descending coordinate order for a negative strand.
     *
     * @param sameStrand if true, loci on the opposite strand are left out
     */
    public List<Locus> within(final Locus locus, final boolean partial, final boolean sameStrand) {
        return within(locus, partial, sameStrand, null);
    }

    /**
     * @param featureKind if not null, only loci of this kind are returned
     * @see #within(Locus, boolean, boolean)
     */
    public List<Locus> within(final Locus locus, final boolean partial, final boolean sameStrand, final FeatureKind featureKind) {
        Utils.nonNull(locus, "locus");
        final LocusIndex idx = ensureIndex();
        final List<Locus> hits = partial
                ? idx.queryOverlap(locus.getChromosome(), locus.getInterval())
                : idx.queryContained(locus.getChromosome(), locus.getInterval());
        final List<Locus> filtered = hits.stream()
                .filter(filterFor(locus, sameStrand, featureKind))
                .collect(Collectors.toCollection(ArrayList::new));
        if (locus.getStrand() == Strand.NEGATIVE) {
            Collections.reverse(filtered);
        }
        return filtered;
    }

    /**
     * Loci that cover the whole of {@code locus}.
     */
    public List<Locus> encompassing(final Locus locus) {
        Utils.nonNull(locus, "locus");
        return ensureIndex().queryContaining(locus.getChromosome(), locus.getInterval());
    }

    /**
     * Loci entirely 5' of {@code locus}, relative to its strand, nearest first.
     *
     * @param limit maximum number of loci returned
     * @param maxDistance largest gap allowed between {@code locus} and a returned locus
     * @param sameStrand if true, loci on the opposite strand are left out
     * @throws RefLociException.StrandException if the strand of {@code locus} is unknown
     */
    public List<Locus> upstreamLoci(final Locus locus, final int limit, final int maxDistance, final boolean sameStrand) {
        return upstreamLoci(locus, limit, maxDistance, sameStrand, null);
    }

    /**
     * @param featureKind if not null, only loci of this kind are returned
     * @see #upstreamLoci(Locus, int, int, boolean)
     */
    public List<Locus> upstreamLoci(final Locus locus, final int limit, final int maxDistance, final boolean sameStrand,
                                    final FeatureKind featureKind) {
        Utils.nonNull(locus, "locus");
        switch (locus.getStrand()) {
            case POSITIVE:
                return neighbors(locus, locus.getStart(), Direction.UPSTREAM, limit, maxDistance, filterFor(locus, sameStrand, featureKind));
            case NEGATIVE:
                return neighbors(locus, locus.getEnd(), Direction.DOWNSTREAM, limit, maxDistance, filterFor(locus, sameStrand, featureKind));
            default:
                throw new RefLociException.StrandException("Upstream is undefined for " + locus + ", whose strand is unknown");
        }
    }

    /**
     * Loci entirely 3' of {@code locus}, relative to its strand, nearest first.
     *
     * @see #upstreamLoci(Locus, int, int, boolean)
     */
    public List<Locus> downstreamLoci(final Locus locus, final int limit, final int maxDistance, final boolean sameStrand) {
        return downstreamLoci(locus, limit, maxDistance, sameStrand, null);
    }

    public List<Locus> downstreamLoci(final Locus locus, final int limit, final int maxDistance, final boolean sameStrand,
                                      final FeatureKind featureKind) {
        Utils.nonNull(locus, "locus");
        switch (locus.getStrand()) {
            case POSITIVE:
                return neighbors(locus, locus.getEnd(), Direction.DOWNSTREAM, limit, maxDistance, filterFor(locus, sameStrand, featureKind));
            case NEGATIVE:
                return neighbors(locus, locus.getStart(), Direction.UPSTREAM, limit, maxDistance, filterFor(locus, sameStrand, featureKind));
            default:
                throw new RefLociException.StrandException("Downstream is undefined for " + locus + ", whose strand is unknown");
        }
    }

    /**
     * @return the upstream loci on the left and the downstream loci on the right
     * @see #upstreamLoci(Locus, int, int, boolean)
     */
    public Pair<List<Locus>, List<Locus>> flankingLoci(final Locus locus, final int limit, final int maxDistance, final boolean sameStrand) {
        return flankingLoci(locus, limit, maxDistance, sameStrand, null);
    }

    public Pair<List<Locus>, List<Locus>> flankingLoci(final Locus locus, final int limit, final int maxDistance, final boolean sameStrand,
                                                       final FeatureKind featureKind) {
        return Pair.of(upstreamLoci(locus, limit, maxDistance, sameStrand, featureKind),
                downstreamLoci(locus, limit, maxDistance, sameStrand, featureKind));
    }

    private List<Locus> neighbors(final Locus locus, final int position, final Direction direction,
                                  final int limit, final int maxDistance, final Predicate<Locus> filter) {
        ParamUtils.isPositiveOrZero(limit, "limit must be >= 0");
        ParamUtils.isPositiveOrZero(maxDistance, "maxDistance must be >= 0");
        // the filter runs after the distance cutoff, so the count limit has to be applied last
        return ensureIndex().neighbors(locus.getChromosome(), position, direction, Integer.MAX_VALUE, maxDistance)
                .stream()
                .filter(filter)
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static Predicate<Locus> filterFor(final Locus locus, final boolean sameStrand, final FeatureKind featureKind) {
        Predicate<Locus> filter = hit -> true;
        if (sameStrand) {
            filter = filter.and(hit -> hit.getStrand().isCompatibleWith(locus.getStrand()));
        }
        if (featureKind != null) {
            filter = filter.and(hit -> hit.getFeatureKind() == featureKind);
        }
        return filter;
    }

    // ------------------------------------------------------------------------------------------------------------
    // candidate mapping

    /**
     * Maps a query locus (typically a SNP) to the stored loci near it: every locus overlapping it, plus up to
     * {@code flankLimit} loci entirely to its left and to its right, no further than {@code maxDistance} away.
     * Flanking loci are found in reference coordinates, so the strand of {@code locus} does not matter.
     *
     * Each candidate is returned as a copy, with its id, carrying these attributes:
     * <ul>
     *     <li>{@value #PARENT_LOCUS_ATTRIBUTE}: the name of the query locus, or its coordinates if it has none</li>
     *     <li>{@value #PARENT_DISTANCE_ATTRIBUTE}: the distance between the centers of candidate and query</li>
     *     <li>{@value #INTERVENING_RANK_ATTRIBUTE}: rank of that distance among the candidates, 1 for the
     *     closest; ties share the average of their ranks</li>
     *     <li>{@value #NUM_INTERVENING_ATTRIBUTE}: -1 for candidates overlapping the query, otherwise the number
     *     of closer candidates on the same side</li>
     *     <li>{@value #NUM_SIBLINGS_ATTRIBUTE}: the number of candidates of the query</li>
     * </ul>
     *
     * @param parentAttributes attributes of the query locus to copy onto every candidate, under
     * {@value #PARENT_ATTRIBUTE_PREFIX} followed by the key; keys the query does not carry are skipped
     * @return candidates in ascending locus order
     */
    public List<Locus> candidateLoci(final Locus locus, final int flankLimit, final int maxDistance,
                                     final Collection<String> parentAttributes) {
        Utils.nonNull(locus, "locus");
        Utils.nonNull(parentAttributes, "parentAttributes");
        ParamUtils.isPositiveOrZero(flankLimit, "flankLimit must be >= 0");
        ParamUtils.isPositiveOrZero(maxDistance, "maxDistance must be >= 0");
        final LocusIndex idx = ensureIndex();
        final String chromosome = locus.getChromosome();

        final Set<Locus> found = new TreeSet<>(Comparator.<Locus>naturalOrder().thenComparingInt(l -> l.getId().getAsInt()));
        found.addAll(idx.neighbors(chromosome, locus.getStart(), Direction.UPSTREAM, flankLimit, maxDistance));
        found.addAll(idx.queryOverlap(chromosome, locus.getInterval()));
        found.addAll(idx.neighbors(chromosome, locus.getEnd(), Direction.DOWNSTREAM, flankLimit, maxDistance));
        final List<Locus> candidates = new ArrayList<>(found);

        final int[] distances = candidates.stream().mapToInt(c -> c.centerDistance(locus).getAsInt()).toArray();
        final double[] ranks = averageRanks(distances);
        final int[] intervening = interveningCounts(locus, candidates, distances);
        final String parent = locus.getName() != null ? locus.getName() : locus.getChromosome() + ":" + locus.getInterval();

        final List<Locus> annotated = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            final Locus.Builder builder = candidates.get(i).toBuilder()
                    .attribute(PARENT_LOCUS_ATTRIBUTE, parent)
                    .attribute(PARENT_DISTANCE_ATTRIBUTE, distances[i])
                    .attribute(INTERVENING_RANK_ATTRIBUTE, ranks[i])
                    .attribute(NUM_INTERVENING_ATTRIBUTE, intervening[i])
                    .attribute(NUM_SIBLINGS_ATTRIBUTE, candidates.size());
            for (final String key : parentAttributes) {
                final Object value = locus.getAttribute(key);
                if (value != null) {
                    builder.attribute(PARENT_ATTRIBUTE_PREFIX + key, value);
                }
            }
            annotated.add(builder.build());
        }
        return annotated;
    }

    public List<Locus> candidateLoci(final Locus locus, final int flankLimit, final int maxDistance) {
        return candidateLoci(locus, flankLimit, maxDistance, Collections.emptyList());
    }

    /**
     * Candidates of several query loci, queried in ascending order. A stored locus that is a candidate of more
     * than one query is reported once, annotated for the first of them.
     *
     * @see #candidateLoci(Locus, int, int, Collection)
     */
    public List<Locus> candidateLoci(final Iterable<Locus> queries, final int flankLimit, final int maxDistance,
                                     final Collection<String> parentAttributes) {
        Utils.nonNull(queries, "queries");
        final List<Locus> sorted = Utils.stream(queries).sorted().collect(Collectors.toList());
        Utils.containsNoNull(sorted, "queries must not contain null");
        final Map<Integer, Locus> byId = new LinkedHashMap<>();
        for (final Locus query : sorted) {
            for (final Locus candidate : candidateLoci(query, flankLimit, maxDistance, parentAttributes)) {
                byId.putIfAbsent(candidate.getId().getAsInt(), candidate);
            }
        }
        return new ArrayList<>(byId.values());
    }

    // 1-based ranks of the values, ties sharing the average of the ranks they span
    private static double[] averageRanks(final int[] values) {
        final Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingInt(i -> values[i]));
        final double[] ranks = new double[values.length];
        int first = 0;
        while (first < order.length) {
            int last = first;
            while (last + 1 < order.length && values[order[last + 1]] == values[order[first]]) {
                last++;
            }
            final double rank = (first + last) / 2.0 + 1;
            for (int k = first; k <= last; k++) {
                ranks[order[k]] = rank;
            }
            first = last + 1;
        }
        return ranks;
    }

    private static int[] interveningCounts(final Locus parent, final List<Locus> candidates, final int[] distances) {
        final Integer[] order = new Integer[candidates.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingInt(i -> distances[i]));
        final int[] counts = new int[candidates.size()];
        int left = 0;
        int right = 0;
        for (final int i : order) {
            final Locus candidate = candidates.get(i);
            if (candidate.overlaps(parent)) {
                counts[i] = -1;
            } else if (candidate.center() >= parent.center()) {
                counts[i] = right++;
            } else {
                counts[i] = left++;
            }
        }
        return counts;
    }

    // ------------------------------------------------------------------------------------------------------------
    // feature kinds, sampling and set operations

    /**
     * @return the loci of the given kind, in ascending locus order
     */
    public List<Locus> byFeature(final FeatureKind featureKind) {
        Utils.nonNull(featureKind, "featureKind");
        return loci.values().stream()
                .filter(locus -> locus.getFeatureKind() == featureKind)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * @return the ids of the loci of the given kind, in ascending locus order
     */
    public List<Integer> getFeatureIds(final FeatureKind featureKind) {
        return byFeature(featureKind).stream().map(locus -> locus.getId().getAsInt()).collect(Collectors.toList());
    }

    /**
     * @return the number of loci of each kind present, most frequent kind first, ties in declaration order
     */
    public ImmutableMultiset<FeatureKind> summarizeFeatureKinds() {
        final Multiset<FeatureKind> counts = EnumMultiset.create(FeatureKind.class);
        loci.values().forEach(locus -> counts.add(locus.getFeatureKind()));
        return Multisets.copyHighestCountFirst(counts);
    }

    /**
     * @return a locus drawn uniformly at random, or empty if the collection is empty
     */
    public Optional<Locus> randomLocus(final Random random) {
        Utils.nonNull(random, "random");
        if (loci.isEmpty()) {
            return Optional.empty();
        }
        final int pick = random.nextInt(loci.size());
        return loci.values().stream().skip(pick).findFirst();
    }

    /**
     * Draws {@code n} distinct loci at random, or all of them in random order if there are fewer than {@code n}.
     */
    public List<Locus> randomLoci(final int n, final Random random) {
        ParamUtils.isPositiveOrZero(n, "n must be >= 0");
        Utils.nonNull(random, "random");
        final List<Locus> shuffled = new ArrayList<>(loci.values());
        Collections.shuffle(shuffled, random);
        return new ArrayList<>(shuffled.subList(0, Math.min(n, shuffled.size())));
    }

    /**
     * @return the given loci that are stored in this collection, in the order given
     * @see #contains(Locus)
     */
    public List<Locus> intersection(final Iterable<Locus> candidates) {
        Utils.nonNull(candidates, "candidates");
        return Utils.stream(candidates).filter(this::contains).collect(Collectors.toList());
    }

    private static List<Locus> sameStrandOnly(final List<Locus> hits, final Strand strand) {
        return hits.stream()
                .filter(hit -> hit.getStrand().isCompatibleWith(strand))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public String toString() {
        return "RefLoci(" + name + ", " + state + ", " + loci.size() + " loci)";
    }
}
