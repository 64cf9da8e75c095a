package org.broadinstitute.refloci.refloci;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import org.broadinstitute.refloci.locus.FeatureKind;
import org.broadinstitute.refloci.locus.Locus;
import org.broadinstitute.refloci.utils.Strand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit field-by-field serializer for {@link Locus}, so the snapshot layout does not depend on the
 * private field layout of the class.
 *
 * Sub-loci are written recursively with this serializer. Lists, sets and maps in attribute values are written
 * element by element behind a one-byte tag and read back as mutable JDK collections, which {@link Locus.Builder}
 * then copies. Scalars go through {@link Kryo#writeClassAndObject}.
 */
public final class LocusSerializer extends Serializer<Locus> {

    private static final int NO_FRAME = -1;

    private static final byte SCALAR = 0;
    private static final byte LIST = 1;
    private static final byte SET = 2;
    private static final byte MAP = 3;

    public LocusSerializer() {
        // loci are immutable, so Kryo.copy can return the instance itself
        super(false, true);
    }

    @Override
    public void write(final Kryo kryo, final Output output, final Locus locus) {
        output.writeBoolean(!locus.isDetached());
        if (!locus.isDetached()) {
            output.writeInt(locus.getId().getAsInt(), true);
        }
        output.writeString(locus.getChromosome());
        output.writeInt(locus.getStart());
        output.writeInt(locus.getEnd());
        output.writeString(locus.getStrand().name());
        output.writeString(locus.getName());
        output.writeString(locus.getFeatureKind().name());
        output.writeString(locus.getSource());
        output.writeInt(locus.getFrame().orElse(NO_FRAME));

        output.writeInt(locus.getAttributes().size(), true);
        for (final Map.Entry<String, Object> attribute : locus.getAttributes().entrySet()) {
            output.writeString(attribute.getKey());
            writeValue(kryo, output, attribute.getValue());
        }

        output.writeInt(locus.getSubLoci().size(), true);
        for (final Locus subLocus : locus.getSubLoci()) {
            write(kryo, output, subLocus);
        }
    }

    @Override
    public Locus read(final Kryo kryo, final Input input, final Class<Locus> type) {
        final boolean hasId = input.readBoolean();
        final int id = hasId ? input.readInt(true) : 0;
        final String chromosome = input.readString();
        final int start = input.readInt();
        final int end = input.readInt();
        final Locus.Builder builder = Locus.builder(chromosome, start, end)
                .strand(Strand.valueOf(input.readString()))
                .name(input.readString())
                .featureKind(FeatureKind.valueOf(input.readString()))
                .source(input.readString());
        final int frame = input.readInt();
        builder.frame(frame == NO_FRAME ? null : frame);

        final int attributeCount = input.readInt(true);
        for (int i = 0; i < attributeCount; i++) {
            final String key = input.readString();
            builder.attribute(key, readValue(kryo, input));
        }

        final int subLocusCount = input.readInt(true);
        for (int i = 0; i < subLocusCount; i++) {
            builder.subLocus(read(kryo, input, type));
        }

        final Locus locus = builder.build();
        return hasId ? locus.withId(id) : locus;
    }

    private static void writeValue(final Kryo kryo, final Output output, final Object value) {
        if (value instanceof List) {
            output.writeByte(LIST);
            output.writeInt(((List<?>) value).size(), true);
            for (final Object element : (List<?>) value) {
                writeValue(kryo, output, element);
            }
        } else if (value instanceof Set) {
            output.writeByte(SET);
            output.writeInt(((Set<?>) value).size(), true);
            for (final Object element : (Set<?>) value) {
                writeValue(kryo, output, element);
            }
        } else if (value instanceof Map) {
            output.writeByte(MAP);
            output.writeInt(((Map<?, ?>) value).size(), true);
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                writeValue(kryo, output, entry.getKey());
                writeValue(kryo, output, entry.getValue());
            }
        } else {
            output.writeByte(SCALAR);
            kryo.writeClassAndObject(output, value);
        }
    }

    private static Object readValue(final Kryo kryo, final Input input) {
        final byte tag = input.readByte();
        switch (tag) {
            case SCALAR:
                return kryo.readClassAndObject(input);
            case LIST: {
                final int size = input.readInt(true);
                final List<Object> list = new ArrayList<>();
                for (int i = 0; i < size; i++) {
                    list.add(readValue(kryo, input));
                }
                return list;
            }
            case SET: {
                final int size = input.readInt(true);
                final Set<Object> set = new LinkedHashSet<>();
                for (int i = 0; i < size; i++) {
                    set.add(readValue(kryo, input));
                }
                return set;
            }
            case MAP: {
                final int size = input.readInt(true);
                final Map<Object, Object> map = new LinkedHashMap<>();
                for (int i = 0; i < size; i++) {
                    final Object key = readValue(kryo, input);
                    map.put(key, readValue(kryo, input));
                }
                return map;
            }
            default:
                throw new KryoException("Unknown attribute value tag " + tag);
        }
    }
}
