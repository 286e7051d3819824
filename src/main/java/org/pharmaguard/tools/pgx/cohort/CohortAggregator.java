package org.pharmaguard.tools.pgx.cohort;

import org.pharmaguard.utils.Utils;

import java.util.Collection;

/**
 * Folds per-drug results into a {@link CohortSummary}. Stateless.
 */
public final class CohortAggregator {

    private CohortAggregator() {}

    public static CohortSummary summarize(final Collection<? extends CohortMember> members) {
        Utils.nonNull(members, "members");
        return members.stream()
                .map(CohortSummary::of)
                .reduce(CohortSummary.empty(), CohortSummary::combine);
    }

    /**
     * Same result as {@link #summarize}, computed over a parallel stream.
     */
    public static CohortSummary summarizeInParallel(final Collection<? extends CohortMember> members) {
        Utils.nonNull(members, "members");
        return members.parallelStream()
                .map(CohortSummary::of)
                .reduce(CohortSummary.empty(), CohortSummary::combine);
    }
}
