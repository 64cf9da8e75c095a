package org.broadinstitute.refloci.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

/**
 * Configuration for the RefLoci store.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   "file:${" + RefLociConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + RefLociConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:RefLociConfig.properties",
 *        4)   "classpath:org/broadinstitute/refloci/utils/config/RefLociConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + RefLociConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "classpath:${" + RefLociConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
        "file:RefLociConfig.properties",
        "classpath:org/broadinstitute/refloci/utils/config/RefLociConfig.properties"
})
public interface RefLociConfig extends Mutable, Accessible {

    /**
     * Name of the variable holding a file system path to a configuration file for {@link RefLociConfig}.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "RefLociConfig.pathToConfig";

    /**
     * Name of the variable holding a class path location of a configuration file for {@link RefLociConfig}.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "RefLociConfig.classPathToConfig";

    // ----------------------------------------------------------
    // Storage Options:
    // ----------------------------------------------------------

    @Key("refloci.storage_dir")
    @DefaultValue(".refloci")
    String storage_dir();

    @Key("refloci.kryo.buffer_size")
    @DefaultValue("4096")
    int kryo_buffer_size();

    // ----------------------------------------------------------
    // Query Options:
    // ----------------------------------------------------------

    /**
     * When true, overlap and containment queries made with a locus ignore loci on the opposite strand.
     */
    @Key("refloci.strand_specific")
    @DefaultValue("false")
    boolean strand_specific();

    @Key("refloci.index.target_buckets")
    @DefaultValue("1000")
    int index_target_buckets();

    @Key("refloci.index.min_bucket_size")
    @DefaultValue("32")
    int index_min_bucket_size();
}
