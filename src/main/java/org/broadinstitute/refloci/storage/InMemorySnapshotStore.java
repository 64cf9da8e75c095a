package org.broadinstitute.refloci.storage;

import org.broadinstitute.refloci.exceptions.RefLociException;
import org.broadinstitute.refloci.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link SnapshotStore} that keeps blobs in memory. Nothing survives the JVM.
 * Blobs are copied on the way in and out so callers cannot modify stored snapshots.
 */
public final class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentSkipListMap<String, byte[]> blobs = new ConcurrentSkipListMap<>();

    @Override
    public void put(final String name, final byte[] blob) {
        SnapshotStore.validateName(name);
        Utils.nonNull(blob, "blob");
        blobs.put(name, blob.clone());
    }

    @Override
    public byte[] get(final String name) {
        SnapshotStore.validateName(name);
        final byte[] blob = blobs.get(name);
        if (blob == null) {
            throw new RefLociException.SnapshotNotFound(name);
        }
        return blob.clone();
    }

    @Override
    public boolean exists(final String name) {
        return blobs.containsKey(SnapshotStore.validateName(name));
    }

    @Override
    public List<String> list() {
        return new ArrayList<>(blobs.keySet());
    }

    @Override
    public boolean delete(final String name) {
        return blobs.remove(SnapshotStore.validateName(name)) != null;
    }
}
