package org.broadinstitute.refloci.locus;

/**
 * Closed set of feature types a {@link Locus} can be tagged with. Feature-specific data for a kind
 * (gene symbol, allele, ...) is carried in the locus attributes rather than in a subclass, so the
 * algebra stays defined over a single concrete type.
 */
public enum FeatureKind {
    LOCUS,
    GENE,
    TRANSCRIPT,
    EXON,
    CDS,
    UTR,
    SNP,
    VARIANT,
    REGION;

    /**
     * Case-insensitive lookup that accepts the GFF spellings ("mRNA" is treated as a transcript).
     */
    public static FeatureKind decode(final String value) {
        if (value == null || value.isEmpty()) {
            return LOCUS;
        }
        if (value.equalsIgnoreCase("mRNA")) {
            return TRANSCRIPT;
        }
        for (final FeatureKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unrecognized feature kind: " + value);
    }
}
