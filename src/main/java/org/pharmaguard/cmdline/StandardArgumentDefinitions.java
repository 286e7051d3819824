package org.pharmaguard.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {

    private StandardArgumentDefinitions(){}

    public static final String INPUT_LONG_NAME = "input";
    public static final String OUTPUT_LONG_NAME = "output";
    public static final String VARIANT_LONG_NAME = "variant";
    public static final String DRUG_LONG_NAME = "drug";
    public static final String CONCURRENT_MEDICATION_LONG_NAME = "concurrent-medication";
    public static final String PATIENT_ID_LONG_NAME = "patient-id";
    public static final String RULES_CATALOG_LONG_NAME = "rules-catalog";
    public static final String PHARMGKB_ANNOTATIONS_LONG_NAME = "pharmgkb-annotations";
    public static final String MIN_VARIANT_QUALITY_LONG_NAME = "min-variant-quality";
    public static final String DECISION_TRACE_LONG_NAME = "decision-trace";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";
    public static final String CONFIG_FILE_OPTION = "pharmaguard-config-file";

    public static final String INPUT_SHORT_NAME = "I";
    public static final String OUTPUT_SHORT_NAME = "O";
    public static final String VARIANT_SHORT_NAME = "V";
    public static final String DRUG_SHORT_NAME = "D";
}
