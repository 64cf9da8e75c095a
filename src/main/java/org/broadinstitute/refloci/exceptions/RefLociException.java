package org.broadinstitute.refloci.exceptions;

/**
 * <p/>
 * Class RefLociException.
 * <p/>
 * Base class for all errors raised by the locus algebra and the RefLoci store.
 * Callers that only care whether an operation failed can catch this type; the nested subtypes
 * distinguish validation failures, illegal lifecycle transitions, missing entries and storage faults.
 */
public class RefLociException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public RefLociException(final String msg) {
        super(msg);
    }

    public RefLociException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /*
      Subtypes of RefLociException for common kinds of errors
     */

    /**
     * <p/>
     * For malformed values, rejected at construction time (e.g. an interval with start > end).
     */
    public static class ValidationException extends RefLociException {
        private static final long serialVersionUID = 0L;

        public ValidationException(final String message) {
            super(message);
        }
    }

    /**
     * <p/>
     * Raised when loci on different chromosomes are combined into one composite locus.
     */
    public static class ChromosomeMismatch extends ValidationException {
        private static final long serialVersionUID = 0L;

        public ChromosomeMismatch(final String expected, final String found) {
            super(String.format("Input chromosomes do not match: expected %s but found %s", expected, found));
        }
    }

    /**
     * <p/>
     * Raised by strand-dependent operations on a locus whose strand is unknown.
     */
    public static class StrandException extends RefLociException {
        private static final long serialVersionUID = 0L;

        public StrandException(final String message) {
            super(String.format("Locus has a bad strand: %s", message));
        }
    }

    /**
     * <p/>
     * For operations that are not permitted in the current lifecycle state of a collection,
     * such as inserting into a frozen collection or freezing an empty one.
     */
    public static class IllegalCollectionState extends RefLociException {
        private static final long serialVersionUID = 0L;

        public IllegalCollectionState(final String message) {
            super(message);
        }
    }

    /**
     * <p/>
     * Base class for lookups of things that do not exist.
     */
    public static class NotFoundException extends RefLociException {
        private static final long serialVersionUID = 0L;

        public NotFoundException(final String message) {
            super(message);
        }
    }

    public static class SnapshotNotFound extends NotFoundException {
        private static final long serialVersionUID = 0L;

        public SnapshotNotFound(final String name) {
            super(String.format("No snapshot named '%s' exists", name));
        }
    }

    public static class MissingLocus extends NotFoundException {
        private static final long serialVersionUID = 0L;

        public MissingLocus(final int id, final String collection) {
            super(String.format("Locus not present in RefLoci %s: no locus with id %d", collection, id));
        }
    }

    /**
     * <p/>
     * For faults of the durable storage layer. The underlying cause is always attached unchanged.
     */
    public static class StorageException extends RefLociException {
        private static final long serialVersionUID = 0L;

        public StorageException(final String message) {
            super(message);
        }

        public StorageException(final String message, final Throwable cause) {
            super(String.format("%s: %s", message, getMessage(cause)), cause);
        }
    }
}
