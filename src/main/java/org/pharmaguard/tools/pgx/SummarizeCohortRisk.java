package org.pharmaguard.tools.pgx;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.pharmaguard.cmdline.CommandLineProgram;
import org.pharmaguard.cmdline.StandardArgumentDefinitions;
import org.pharmaguard.cmdline.programgroups.PharmacogenomicsProgramGroup;
import org.pharmaguard.tools.pgx.cohort.CohortAggregator;
import org.pharmaguard.tools.pgx.cohort.CohortSummary;
import org.pharmaguard.tools.pgx.cohort.SerializedCohortMember;
import org.pharmaguard.utils.json.JsonUtils;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds the JSON results of {@link AnalyzePharmacogenomics} runs into a cohort risk summary:
 * a drug by risk label matrix and the sorted list of patients needing immediate review.
 */
@CommandLineProgramProperties(
        summary = "Summarizes per-drug risk results of many patients into a cohort risk matrix and high-risk patient list",
        oneLineSummary = "Summarize pharmacogenomic risk over a cohort",
        programGroup = PharmacogenomicsProgramGroup.class
)
public final class SummarizeCohortRisk extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME, shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "JSON result file written by AnalyzePharmacogenomics; may be given more than once")
    public List<File> INPUT = new ArrayList<>();

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME, shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Where to write the cohort summary JSON")
    public File OUTPUT;

    @Override
    protected Object doWork() {
        final List<SerializedCohortMember> members = new ArrayList<>();
        for (final File input : INPUT) {
            members.addAll(SerializedCohortMember.fromJson(input.getPath(), JsonUtils.readTree(input.toPath())));
        }
        final CohortSummary summary = CohortAggregator.summarize(members);
        logger.info(String.format("Cohort of %d patient(s), %d result(s): %s",
                summary.getPatientCount(), summary.getCohortSize(), summary.getAlert()));
        JsonUtils.writeJson(OUTPUT, summary);
        return summary.getHighRiskCount();
    }
}
