package org.broadinstitute.refloci.storage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.refloci.exceptions.RefLociException;
import org.broadinstitute.refloci.utils.Utils;
import org.broadinstitute.refloci.utils.config.RefLociConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link SnapshotStore} backed by one file per snapshot, {@code <directory>/<name>.refloci}.
 *
 * Writes go to a temporary file in the same directory which is then renamed over the target with
 * {@link StandardCopyOption#ATOMIC_MOVE}, so a name never resolves to a partially written file.
 */
public final class FileSystemSnapshotStore implements SnapshotStore {
    private static final Logger logger = LogManager.getLogger(FileSystemSnapshotStore.class);

    public static final String SNAPSHOT_EXTENSION = ".refloci";
    private static final String TEMP_PREFIX = ".tmp-";

    private final Path directory;

    /**
     * @param directory directory holding the snapshots; created if it does not exist
     */
    public FileSystemSnapshotStore(final Path directory) {
        Utils.nonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (final IOException e) {
            throw new RefLociException.StorageException("Could not create snapshot directory " + directory.toAbsolutePath(), e);
        }
        this.directory = directory;
    }

    /**
     * @return a store rooted at {@link RefLociConfig#storage_dir()}
     */
    public static FileSystemSnapshotStore fromConfig(final RefLociConfig config) {
        Utils.nonNull(config, "config");
        return new FileSystemSnapshotStore(Paths.get(config.storage_dir()));
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void put(final String name, final byte[] blob) {
        final Path target = pathFor(name);
        Utils.nonNull(blob, "blob");
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, TEMP_PREFIX + name, null);
            try (final OutputStream out = Files.newOutputStream(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC)) {
                out.write(blob);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            logger.debug("Committed {} bytes to {}", blob.length, target);
        } catch (final IOException e) {
            deleteQuietly(temp);
            throw new RefLociException.StorageException("Could not write snapshot " + name + " to " + target.toAbsolutePath(), e);
        }
    }

    @Override
    public byte[] get(final String name) {
        final Path path = pathFor(name);
        try {
            return Files.readAllBytes(path);
        } catch (final NoSuchFileException e) {
            throw new RefLociException.SnapshotNotFound(name);
        } catch (final IOException e) {
            throw new RefLociException.StorageException("Could not read snapshot " + name + " from " + path.toAbsolutePath(), e);
        }
    }

    @Override
    public boolean exists(final String name) {
        return Files.isRegularFile(pathFor(name));
    }

    @Override
    public List<String> list() {
        final List<String> names = new ArrayList<>();
        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SNAPSHOT_EXTENSION)) {
            for (final Path path : stream) {
                final String fileName = path.getFileName().toString();
                if (!fileName.startsWith(".")) {
                    names.add(fileName.substring(0, fileName.length() - SNAPSHOT_EXTENSION.length()));
                }
            }
        } catch (final IOException e) {
            throw new RefLociException.StorageException("Could not list snapshots in " + directory.toAbsolutePath(), e);
        }
        Collections.sort(names);
        return names;
    }

    @Override
    public boolean delete(final String name) {
        final Path path = pathFor(name);
        try {
            return Files.deleteIfExists(path);
        } catch (final IOException e) {
            throw new RefLociException.StorageException("Could not delete snapshot " + name + " at " + path.toAbsolutePath(), e);
        }
    }

    private Path pathFor(final String name) {
        return directory.resolve(SnapshotStore.validateName(name) + SNAPSHOT_EXTENSION);
    }

    // only used to clean up after a failed write; the original failure is what gets reported
    private static void deleteQuietly(final Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (final IOException e) {
            logger.warn("Could not remove temporary file " + temp.toAbsolutePath(), e);
        }
    }
}
