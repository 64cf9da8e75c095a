package org.broadinstitute.refloci.locus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import htsjdk.samtools.util.Locatable;
import org.broadinstitute.refloci.exceptions.RefLociException;
import org.broadinstitute.refloci.utils.Interval;
import org.broadinstitute.refloci.utils.Strand;
import org.broadinstitute.refloci.utils.Utils;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Immutable genomic coordinate: a chromosome, a 0-based half-open {@link Interval}, a strand, and optional
 * descriptive fields (name, feature kind, source, frame, attributes, sub-loci).
 *
 * <p>
 *     Equality, hashing and ordering only look at the chromosome, the interval bounds and the strand, so the same
 *     feature loaded twice compares equal no matter which collection it came from, what it is called or which
 *     attributes it carries.
 * </p>
 * <p>
 *     Relational operators between loci on different chromosomes never fail: {@code overlaps} and {@code contains}
 *     answer {@code false} and {@code distance} answers an empty {@link OptionalInt}.
 * </p>
 * <p>
 *     A locus without an id is detached. {@link org.broadinstitute.refloci.refloci.RefLoci} assigns ids when loci
 *     are inserted and keeps its own copy; the id is a lookup handle, nothing else.
 * </p>
 */
public final class Locus implements Comparable<Locus>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_SOURCE = "refloci";

    /**
     * Scalar types allowed as attribute values, alone or nested in lists, sets and maps.
     */
    public static final Set<Class<?>> SCALAR_ATTRIBUTE_TYPES = ImmutableSet.of(
            String.class, Boolean.class, Character.class,
            Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
            BigInteger.class, BigDecimal.class);

    private final Integer id;
    private final String chromosome;
    private final Interval interval;
    private final Strand strand;
    private final String name;
    private final FeatureKind featureKind;
    private final String source;
    private final Integer frame;
    private final Map<String, Object> attributes;
    private final List<Locus> subLoci;

    private Locus(final Builder builder) {
        Utils.nonNull(builder.chromosome, "chromosome");
        if (builder.chromosome.isEmpty()) {
            throw new RefLociException.ValidationException("Invalid locus: chromosome must not be empty");
        }
        this.id = builder.id;
        this.chromosome = builder.chromosome;
        this.interval = Utils.nonNull(builder.interval, "interval");
        this.strand = Utils.nonNull(builder.strand, "strand");
        this.name = builder.name;
        this.featureKind = Utils.nonNull(builder.featureKind, "featureKind");
        this.source = Utils.nonNull(builder.source, "source");
        this.frame = builder.frame;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.subLoci = Collections.unmodifiableList(new ArrayList<>(builder.subLoci));
    }

    /**
     * Shorthand for an unstranded, unnamed locus.
     */
    public Locus(final String chromosome, final int start, final int end) {
        this(builder(chromosome, start, end));
    }

    public Locus(final String chromosome, final int start, final int end, final Strand strand) {
        this(builder(chromosome, start, end).strand(strand));
    }

    public static Builder builder(final String chromosome, final int start, final int end) {
        return new Builder(chromosome, new Interval(start, end));
    }

    public static Builder builder(final String chromosome, final Interval interval) {
        return new Builder(chromosome, interval);
    }

    /**
     * Converts a 1-based closed {@link Locatable} into a locus. Strand and name are kept when the locatable is an
     * htsjdk {@link htsjdk.samtools.util.Interval}.
     */
    public static Locus fromLocatable(final Locatable locatable) {
        Utils.nonNull(locatable);
        final Builder builder = builder(locatable.getContig(), locatable.getStart() - 1, locatable.getEnd());
        if (locatable instanceof htsjdk.samtools.util.Interval) {
            final htsjdk.samtools.util.Interval htsInterval = (htsjdk.samtools.util.Interval) locatable;
            builder.strand(htsInterval.isNegativeStrand() ? Strand.NEGATIVE : Strand.POSITIVE)
                   .name(htsInterval.getName());
        }
        return builder.build();
    }

    /**
     * @return this locus as a 1-based closed htsjdk interval. Unknown strand is reported as positive.
     */
    public htsjdk.samtools.util.Interval toLocatable() {
        return new htsjdk.samtools.util.Interval(chromosome, getStart() + 1, getEnd(), strand == Strand.NEGATIVE, name);
    }

    public Builder toBuilder() {
        final Builder builder = new Builder(chromosome, interval)
                .strand(strand)
                .name(name)
                .featureKind(featureKind)
                .source(source)
                .frame(frame)
                .attributes(attributes)
                .subLoci(subLoci);
        builder.id = id;
        return builder;
    }

    /**
     * @return a copy of this locus carrying a collection-scoped id
     */
    public Locus withId(final int newId) {
        final Builder builder = toBuilder();
        builder.id = newId;
        return builder.build();
    }

    /**
     * @return a copy of this locus without an id
     */
    public Locus detach() {
        if (id == null) {
            return this;
        }
        final Builder builder = toBuilder();
        builder.id = null;
        return builder.build();
    }

    // ------------------------------------------------------------------------------------------------------------
    // accessors

    public OptionalInt getId() {
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    public boolean isDetached() {
        return id == null;
    }

    public String getChromosome() {
        return chromosome;
    }

    public Interval getInterval() {
        return interval;
    }

    public int getStart() {
        return interval.getStart();
    }

    public int getEnd() {
        return interval.getEnd();
    }

    public int length() {
        return interval.length();
    }

    public Strand getStrand() {
        return strand;
    }

    public String getName() {
        return name;
    }

    public FeatureKind getFeatureKind() {
        return featureKind;
    }

    public String getSource() {
        return source;
    }

    public OptionalInt getFrame() {
        return frame == null ? OptionalInt.empty() : OptionalInt.of(frame);
    }

    /**
     * @return unmodifiable view of the attributes, in insertion order. Collection values are immutable copies.
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(final String key) {
        return attributes.get(key);
    }

    public Object getAttributeOrDefault(final String key, final Object defaultValue) {
        return attributes.getOrDefault(key, defaultValue);
    }

    /**
     * @return unmodifiable list of the loci this one was composed from; empty for simple loci
     */
    public List<Locus> getSubLoci() {
        return subLoci;
    }

    public boolean isComposite() {
        return !subLoci.isEmpty();
    }

    // ------------------------------------------------------------------------------------------------------------
    // relational algebra

    public boolean overlaps(final Locus other) {
        return overlaps(other, false);
    }

    /**
     * @param strandSpecific when true, loci on opposite (known) strands never overlap
     */
    public boolean overlaps(final Locus other, final boolean strandSpecific) {
        Utils.nonNull(other);
        return chromosome.equals(other.chromosome)
                && strandsAgree(other, strandSpecific)
                && interval.overlaps(other.interval);
    }

    public boolean overlaps(final String otherChromosome, final Interval otherInterval) {
        return chromosome.equals(otherChromosome) && interval.overlaps(otherInterval);
    }

    /**
     * @return true if this locus covers every position of {@code other}
     */
    public boolean contains(final Locus other) {
        return contains(other, false);
    }

    public boolean contains(final Locus other, final boolean strandSpecific) {
        Utils.nonNull(other);
        return chromosome.equals(other.chromosome)
                && strandsAgree(other, strandSpecific)
                && interval.contains(other.interval);
    }

    /**
     * Number of positions between the nearer edges of the two loci; 0 when they overlap or abut.
     * @return empty if the loci lie on different chromosomes
     */
    public OptionalInt distance(final Locus other) {
        Utils.nonNull(other);
        if (!chromosome.equals(other.chromosome)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(interval.distance(other.interval));
    }

    /**
     * @return the midpoint of the interval; may fall on a half position
     */
    public double center() {
        return interval.getStart() + interval.length() / 2.0;
    }

    /**
     * @return the whole number of positions between the centers of the two loci, or empty across chromosomes
     */
    public OptionalInt centerDistance(final Locus other) {
        Utils.nonNull(other);
        if (!chromosome.equals(other.chromosome)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) Math.floor(Math.abs(center() - other.center())));
    }

    /**
     * @return the 5' boundary of the locus: start on the positive strand, end on the negative strand
     * @throws RefLociException.StrandException if the strand is unknown
     */
    public int strandedStart() {
        switch (strand) {
            case POSITIVE: return getStart();
            case NEGATIVE: return getEnd();
            default: throw new RefLociException.StrandException("cannot determine the 5' end of " + this);
        }
    }

    /**
     * @return the 3' boundary of the locus: end on the positive strand, start on the negative strand
     * @throws RefLociException.StrandException if the strand is unknown
     */
    public int strandedEnd() {
        switch (strand) {
            case POSITIVE: return getEnd();
            case NEGATIVE: return getStart();
            default: throw new RefLociException.StrandException("cannot determine the 3' end of " + this);
        }
    }

    /**
     * @return the position {@code distance} bases 5' of this locus, never below 0
     */
    public int upstream(final int distance) {
        Utils.validateArg(distance >= 0, "distance must be >= 0");
        switch (strand) {
            case POSITIVE: return Math.max(0, getStart() - distance);
            case NEGATIVE: return saturatedAdd(getEnd(), distance);
            default: throw new RefLociException.StrandException("upstream is undefined for " + this);
        }
    }

    /**
     * @return the position {@code distance} bases 3' of this locus, never below 0
     */
    public int downstream(final int distance) {
        Utils.validateArg(distance >= 0, "distance must be >= 0");
        switch (strand) {
            case POSITIVE: return saturatedAdd(getEnd(), distance);
            case NEGATIVE: return Math.max(0, getStart() - distance);
            default: throw new RefLociException.StrandException("downstream is undefined for " + this);
        }
    }

    private static int saturatedAdd(final int position, final int distance) {
        final long sum = (long) position + distance;
        return sum > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) sum;
    }

    private boolean strandsAgree(final Locus other, final boolean strandSpecific) {
        return !strandSpecific || strand.isCompatibleWith(other.strand);
    }

    // ------------------------------------------------------------------------------------------------------------
    // composition

    /**
     * Equivalent to {@code Locus.merge(this, other)}.
     */
    public Locus combine(final Locus other) {
        return merge(Arrays.asList(this, other));
    }

    public static Locus merge(final Locus... loci) {
        return merge(Arrays.asList(Utils.nonNull(loci)));
    }

    /**
     * Builds a composite locus spanning all inputs.
     *
     * The result covers the minimal interval containing every input. Its sub-loci are the inputs themselves,
     * except that a composite input contributes its own sub-loci instead, so repeated merges stay one level deep.
     * The strand is the common strand of the inputs, or {@link Strand#UNKNOWN} if they disagree.
     *
     * @param loci at least two loci on the same chromosome
     * @throws RefLociException.ChromosomeMismatch if the inputs lie on different chromosomes
     */
    public static Locus merge(final Collection<Locus> loci) {
        Utils.containsNoNull(loci, "loci to merge must not be null");
        if (loci.size() < 2) {
            throw new RefLociException.ValidationException("At least two loci are required for a merge but got " + loci.size());
        }
        final Iterator<Locus> it = loci.iterator();
        final Locus first = it.next();
        Interval span = first.interval;
        Strand commonStrand = first.strand;
        while (it.hasNext()) {
            final Locus next = it.next();
            if (!first.chromosome.equals(next.chromosome)) {
                throw new RefLociException.ChromosomeMismatch(first.chromosome, next.chromosome);
            }
            span = span.span(next.interval);
            if (next.strand != commonStrand) {
                commonStrand = Strand.UNKNOWN;
            }
        }

        final List<Locus> parts = new ArrayList<>();
        for (final Locus locus : loci) {
            if (locus.isComposite()) {
                parts.addAll(locus.subLoci);
            } else {
                parts.add(locus.detach());
            }
        }
        return builder(first.chromosome, span).strand(commonStrand).subLoci(parts).build();
    }

    // ------------------------------------------------------------------------------------------------------------

    /**
     * Orders by chromosome (lexicographically), then start, then end, then strand.
     */
    @Override
    public int compareTo(final Locus other) {
        final int chromCmp = chromosome.compareTo(other.chromosome);
        if (chromCmp != 0) {
            return chromCmp;
        }
        final int intervalCmp = interval.compareTo(other.interval);
        return intervalCmp != 0 ? intervalCmp : strand.compareTo(other.strand);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final Locus that = (Locus) o;
        return chromosome.equals(that.chromosome) && interval.equals(that.interval) && strand == that.strand;
    }

    @Override
    public int hashCode() {
        int result = chromosome.hashCode();
        result = 31 * result + interval.hashCode();
        result = 31 * result + strand.hashCode();
        return result;
    }

    /**
     * Compares every field except the id, including attributes and sub-loci. Used where an exact copy is
     * required, e.g. after a snapshot round trip.
     */
    public boolean isIdenticalTo(final Locus other) {
        return equals(other)
                && Objects.equals(name, other.name)
                && featureKind == other.featureKind
                && source.equals(other.source)
                && Objects.equals(frame, other.frame)
                && attributes.equals(other.attributes)
                && subLoci.size() == other.subLoci.size()
                && subLociIdenticalTo(other);
    }

    private boolean subLociIdenticalTo(final Locus other) {
        for (int i = 0; i < subLoci.size(); i++) {
            if (!subLoci.get(i).isIdenticalTo(other.subLoci.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(chromosome).append(':').append(interval).append(strand.getSymbol());
        if (name != null) {
            sb.append(' ').append(name);
        }
        if (isComposite()) {
            sb.append(" subloci=").append(subLoci.size());
        }
        return sb.toString();
    }

    private static Object copyAttributeValue(final String key, final Object value) {
        if (value == null) {
            throw new RefLociException.ValidationException("Attribute " + key + " contains a null value");
        }
        if (value instanceof List) {
            final ImmutableList.Builder<Object> copy = ImmutableList.builder();
            for (final Object element : (List<?>) value) {
                copy.add(copyAttributeValue(key, element));
            }
            return copy.build();
        }
        if (value instanceof Set) {
            final ImmutableSet.Builder<Object> copy = ImmutableSet.builder();
            for (final Object element : (Set<?>) value) {
                copy.add(copyAttributeValue(key, element));
            }
            return copy.build();
        }
        if (value instanceof Map) {
            final Map<Object, Object> copy = new LinkedHashMap<>();
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(copyAttributeValue(key, entry.getKey()), copyAttributeValue(key, entry.getValue()));
            }
            return ImmutableMap.copyOf(copy);
        }
        if (!SCALAR_ATTRIBUTE_TYPES.contains(value.getClass())) {
            throw new RefLociException.ValidationException("Attribute " + key + " has a value of unsupported type " + value.getClass().getName());
        }
        return value;
    }

    /**
     * Mutable builder for {@link Locus}. Attributes and sub-loci are copied on {@link #build()}.
     */
    public static final class Builder {
        private Integer id;
        private final String chromosome;
        private final Interval interval;
        private Strand strand = Strand.UNKNOWN;
        private String name;
        private FeatureKind featureKind = FeatureKind.LOCUS;
        private String source = DEFAULT_SOURCE;
        private Integer frame;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<Locus> subLoci = new ArrayList<>();

        private Builder(final String chromosome, final Interval interval) {
            this.chromosome = chromosome;
            this.interval = Utils.nonNull(interval, "interval");
        }

        public Builder strand(final Strand strand) {
            this.strand = Utils.nonNull(strand, "strand");
            return this;
        }

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder featureKind(final FeatureKind featureKind) {
            this.featureKind = Utils.nonNull(featureKind, "featureKind");
            return this;
        }

        public Builder source(final String source) {
            this.source = Utils.nonNull(source, "source");
            return this;
        }

        public Builder frame(final Integer frame) {
            Utils.validateArg(frame == null || (frame >= 0 && frame <= 2), () -> "frame must be 0, 1 or 2 but was " + frame);
            this.frame = frame;
            return this;
        }

        /**
         * Sets an attribute. Lists, sets and maps are copied deeply into immutable collections, so later changes
         * to {@code value} do not reach the locus.
         *
         * @param value a scalar of one of the {@link Locus#SCALAR_ATTRIBUTE_TYPES}, or a list, set or map of such values
         * @throws RefLociException.ValidationException if the value, or anything nested in it, is null or of
         * another type
         */
        public Builder attribute(final String key, final Object value) {
            Utils.nonNull(key, "attribute key");
            Utils.nonNull(value, () -> "value of attribute " + key);
            attributes.put(key, copyAttributeValue(key, value));
            return this;
        }

        public Builder attributes(final Map<String, ?> values) {
            Utils.nonNull(values, "attributes");
            values.forEach(this::attribute);
            return this;
        }

        public Builder subLocus(final Locus locus) {
            subLoci.add(Utils.nonNull(locus, "sub-locus"));
            return this;
        }

        public Builder subLoci(final Collection<Locus> loci) {
            Utils.containsNoNull(loci, "sub-loci must not be null");
            subLoci.addAll(loci);
            return this;
        }

        public Locus build() {
            return new Locus(this);
        }
    }
}
