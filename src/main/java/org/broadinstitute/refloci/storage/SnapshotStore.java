package org.broadinstitute.refloci.storage;

import org.broadinstitute.refloci.exceptions.RefLociException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Durable storage for named, opaque snapshot blobs.
 *
 * <p>
 *     Implementations must make {@link #put(String, byte[])} atomic: a concurrent or later reader either sees the
 *     previous blob under the name (or none) or the complete new one, never a partially written blob.
 *     Failures are reported as {@link RefLociException.StorageException} with the underlying cause attached.
 * </p>
 */
public interface SnapshotStore {

    /**
     * Names are used as file names by some implementations, so they are restricted to a portable character set.
     */
    Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    /**
     * Stores {@code blob} under {@code name}, replacing any previous blob atomically.
     */
    void put(String name, byte[] blob);

    /**
     * @throws RefLociException.SnapshotNotFound if nothing is stored under {@code name}
     */
    byte[] get(String name);

    boolean exists(String name);

    /**
     * @return the stored names in lexicographic order
     */
    List<String> list();

    /**
     * @return true if a blob was removed
     */
    boolean delete(String name);

    static String validateName(final String name) {
        if (name == null || !VALID_NAME.matcher(name).matches() || name.startsWith(".")) {
            throw new RefLociException.ValidationException("Invalid snapshot name: '" + name + "'. Names must match " + VALID_NAME.pattern() + " and not start with '.'");
        }
        return name;
    }
}
