package org.pharmaguard.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

/**
 * Configuration for the PharmaGuard pipeline.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, so an option not found in the first source is sought in
 * the following sources until a definition is found, falling back to the @DefaultValue.
 *
 * The load order is:
 *        1)   "file:${" + PharmaGuardConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + PharmaGuardConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:PharmaGuardConfig.properties",
 *        4)   "classpath:org/pharmaguard/utils/config/PharmaGuardConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + PharmaGuardConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "classpath:${" + PharmaGuardConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
        "file:PharmaGuardConfig.properties",
        "classpath:org/pharmaguard/utils/config/PharmaGuardConfig.properties"
})
public interface PharmaGuardConfig extends Mutable, Accessible {

    /**
     * Variable naming a config file on disk, consulted before any other source.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "PharmaGuardConfig.pathToConfig";

    /**
     * Variable naming a config file on the class path.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "PharmaGuardConfig.classPathToConfig";

    /**
     * Sentinel for "no file configured" in path-valued keys.
     */
    String NO_PATH = "";

    // ----------------------------------------------------------
    // Pipeline options:
    // ----------------------------------------------------------

    @Key("pgx.min_variant_quality")
    @DefaultValue("20.0")
    double pgx_min_variant_quality();

    /**
     * Rule catalog to load instead of the bundled one. Empty means the bundled catalog.
     */
    @Key("pgx.rules_catalog_path")
    @DefaultValue(NO_PATH)
    String pgx_rules_catalog_path();

    /**
     * PharmGKB clinical annotation TSV. Empty means no dynamic evidence source.
     */
    @Key("pgx.pharmgkb_annotations_path")
    @DefaultValue(NO_PATH)
    String pgx_pharmgkb_annotations_path();

    @Key("pgx.analysis_version")
    @DefaultValue("1.0.0")
    String pgx_analysis_version();

    // ----------------------------------------------------------
    // Miscellaneous Options:
    // ----------------------------------------------------------

    @Key("pgx.stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean pgx_stacktrace_on_user_exception();
}
