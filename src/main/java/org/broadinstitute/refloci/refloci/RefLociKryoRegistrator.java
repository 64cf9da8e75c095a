package org.broadinstitute.refloci.refloci;

import com.esotericsoftware.kryo.Kryo;
import org.broadinstitute.refloci.locus.Locus;
import org.objenesis.strategy.StdInstantiatorStrategy;

/**
 * RefLociKryoRegistrator registers the serializers used for RefLoci snapshots.
 * Registration order fixes the class ids written to snapshots, so new registrations must only ever be appended.
 */
public final class RefLociKryoRegistrator {

    public RefLociKryoRegistrator() {}

    public void registerClasses(final Kryo kryo) {
        kryo.register(Locus.class, new LocusSerializer());
    }

    /**
     * @return a new, fully registered Kryo instance. Kryo instances are not thread safe, so each
     * encode or decode gets its own.
     */
    public static Kryo newKryo() {
        final Kryo kryo = new Kryo();
        kryo.setInstantiatorStrategy(new Kryo.DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
        new RefLociKryoRegistrator().registerClasses(kryo);
        return kryo;
    }
}
