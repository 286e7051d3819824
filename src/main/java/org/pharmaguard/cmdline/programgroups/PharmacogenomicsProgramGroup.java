package org.pharmaguard.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that infer drug risk from pharmacogenes, summarize it over cohorts, or audit its confidence.
 */
public class PharmacogenomicsProgramGroup implements CommandLineProgramGroup {

    public static final String NAME = "Pharmacogenomics";

    @Override
    public String getName() { return NAME; }

    @Override
    public String getDescription() { return "Tools that infer, summarize and audit pharmacogenomic drug risk"; }
}
