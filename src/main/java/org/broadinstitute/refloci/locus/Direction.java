package org.broadinstitute.refloci.locus;

/**
 * Side of a position to search when looking for the nearest locus, in reference coordinates.
 */
public enum Direction {
    /** Towards lower coordinates: loci ending at or before the position. */
    UPSTREAM,
    /** Towards higher coordinates: loci starting at or after the position. */
    DOWNSTREAM
}
