package org.broadinstitute.refloci.refloci;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import org.broadinstitute.refloci.exceptions.RefLociException;
import org.broadinstitute.refloci.locus.Locus;
import org.broadinstitute.refloci.utils.Utils;
import org.broadinstitute.refloci.utils.param.ParamUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes the durable state of a {@link RefLoci} (name, id counter, id to locus mapping and aliases) as a
 * Kryo blob and back.
 *
 * Layout: magic, format version, name, next id, locus count, (id, locus)*, alias count, (alias, id)*.
 */
final class RefLociCodec {

    static final String MAGIC = "REFLOCI";
    static final int FORMAT_VERSION = 1;

    private final int bufferSize;

    RefLociCodec(final int bufferSize) {
        this.bufferSize = ParamUtils.isPositive(bufferSize, "kryo buffer size must be positive");
    }

    /**
     * Plain holder for the persisted fields.
     */
    static final class Snapshot {
        final String name;
        final int nextId;
        final LinkedHashMap<Integer, Locus> loci;
        final LinkedHashMap<String, Integer> aliases;

        Snapshot(final String name, final int nextId, final Map<Integer, Locus> loci, final Map<String, Integer> aliases) {
            this.name = Utils.nonNull(name);
            this.nextId = nextId;
            this.loci = new LinkedHashMap<>(loci);
            this.aliases = new LinkedHashMap<>(aliases);
        }
    }

    byte[] encode(final Snapshot snapshot) {
        Utils.nonNull(snapshot);
        final Kryo kryo = RefLociKryoRegistrator.newKryo();
        try (final Output output = new Output(bufferSize, -1)) {
            output.writeString(MAGIC);
            output.writeInt(FORMAT_VERSION, true);
            output.writeString(snapshot.name);
            output.writeInt(snapshot.nextId, true);

            output.writeInt(snapshot.loci.size(), true);
            for (final Map.Entry<Integer, Locus> entry : snapshot.loci.entrySet()) {
                output.writeInt(entry.getKey(), true);
                kryo.writeObject(output, entry.getValue());
            }

            output.writeInt(snapshot.aliases.size(), true);
            for (final Map.Entry<String, Integer> alias : snapshot.aliases.entrySet()) {
                output.writeString(alias.getKey());
                output.writeInt(alias.getValue(), true);
            }
            return output.toBytes();
        } catch (final KryoException e) {
            throw new RefLociException.StorageException("Could not encode snapshot " + snapshot.name, e);
        }
    }

    /**
     * @throws RefLociException.StorageException if the blob is not a snapshot or is truncated
     */
    Snapshot decode(final byte[] blob) {
        Utils.nonNull(blob);
        final Kryo kryo = RefLociKryoRegistrator.newKryo();
        try (final Input input = new Input(blob)) {
            final String magic = input.readString();
            if (!MAGIC.equals(magic)) {
                throw new RefLociException.StorageException("Blob is not a RefLoci snapshot");
            }
            final int version = input.readInt(true);
            if (version != FORMAT_VERSION) {
                throw new RefLociException.StorageException("Unsupported snapshot format version " + version);
            }
            final String name = input.readString();
            final int nextId = input.readInt(true);

            final int lociCount = input.readInt(true);
            final LinkedHashMap<Integer, Locus> loci = new LinkedHashMap<>();
            for (int i = 0; i < lociCount; i++) {
                final int id = input.readInt(true);
                loci.put(id, kryo.readObject(input, Locus.class));
            }

            final int aliasCount = input.readInt(true);
            final LinkedHashMap<String, Integer> aliases = new LinkedHashMap<>();
            for (int i = 0; i < aliasCount; i++) {
                final String alias = input.readString();
                aliases.put(alias, input.readInt(true));
            }
            return new Snapshot(name, nextId, loci, aliases);
        } catch (final RefLociException.StorageException e) {
            throw e;
        } catch (final RuntimeException e) {
            // Kryo reports truncated or garbled input through whatever the failing serializer throws
            throw new RefLociException.StorageException("Snapshot is corrupt", e);
        }
    }
}
