package org.broadinstitute.refloci.utils;

/**
 * Strand of a genomic feature.
 */
public enum Strand {
    POSITIVE('+'),
    NEGATIVE('-'),
    UNKNOWN('.');

    private final char symbol;

    Strand(final char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Two strands are compatible unless both are known and differ.
     */
    public boolean isCompatibleWith(final Strand other) {
        return !isKnown() || !other.isKnown() || this == other;
    }

    /**
     * Parses the usual GFF/BED strand symbols: {@code +}, {@code -}, {@code .} and {@code ?}.
     */
    public static Strand decode(final String symbol) {
        Utils.nonNull(symbol, "strand symbol");
        switch (symbol.trim()) {
            case "+": return POSITIVE;
            case "-": return NEGATIVE;
            case ".":
            case "?":
            case "": return UNKNOWN;
            default:
                throw new IllegalArgumentException("Unrecognized strand symbol: " + symbol);
        }
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
