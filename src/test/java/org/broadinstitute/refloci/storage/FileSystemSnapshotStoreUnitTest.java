package org.broadinstitute.refloci.storage;

import org.broadinstitute.refloci.testutils.RefLociBaseTest;
import org.broadinstitute.refloci.utils.config.ConfigFactory;
import org.broadinstitute.refloci.utils.config.RefLociConfig;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class FileSystemSnapshotStoreUnitTest extends AbstractSnapshotStoreTest {

    private final List<Path> dirs = new ArrayList<>();

    @Override
    protected SnapshotStore newStore() {
        final Path dir = createTempDir("snapshots");
        dirs.add(dir);
        return new FileSystemSnapshotStore(dir);
    }

    @AfterClass
    public void cleanUp() {
        dirs.forEach(RefLociBaseTest::deleteRecursivelyOnExit);
    }

    @Test
    public void testLayoutOnDisk() throws IOException {
        final FileSystemSnapshotStore store = (FileSystemSnapshotStore) newStore();
        store.put("genes", "payload".getBytes(StandardCharsets.UTF_8));
        final Path file = store.getDirectory().resolve("genes" + FileSystemSnapshotStore.SNAPSHOT_EXTENSION);
        Assert.assertTrue(Files.isRegularFile(file));
        Assert.assertEquals(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), "payload");

        // only the committed file is left behind
        try (final java.util.stream.Stream<Path> files = Files.list(store.getDirectory())) {
            Assert.assertEquals(files.count(), 1L);
        }
    }

    @Test
    public void testForeignFilesAreNotListed() throws IOException {
        final FileSystemSnapshotStore store = (FileSystemSnapshotStore) newStore();
        store.put("genes", new byte[]{1, 2, 3});
        Files.write(store.getDirectory().resolve("notes.txt"), new byte[]{1});
        Files.write(store.getDirectory().resolve(".tmp-genes123.refloci"), new byte[]{1});
        Assert.assertEquals(store.list(), Collections.singletonList("genes"));
    }

    @Test
    public void testCreatesMissingDirectory() {
        final Path parent = createTempDir("nested");
        dirs.add(parent);
        final Path dir = parent.resolve("a").resolve("b");
        final FileSystemSnapshotStore store = new FileSystemSnapshotStore(dir);
        Assert.assertTrue(Files.isDirectory(dir));
        store.put("x", new byte[]{42});
        Assert.assertTrue(new FileSystemSnapshotStore(dir).exists("x"), "a second store over the same directory sees the snapshot");
    }

    @Test
    public void testFromConfig() {
        final Path dir = createTempDir("configured");
        dirs.add(dir);
        final RefLociConfig config = ConfigFactory.getInstance().create(RefLociConfig.class);
        config.setProperty("refloci.storage_dir", dir.toString());
        final FileSystemSnapshotStore store = FileSystemSnapshotStore.fromConfig(config);
        Assert.assertEquals(store.getDirectory(), dir);
    }
}
