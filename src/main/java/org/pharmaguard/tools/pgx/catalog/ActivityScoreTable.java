package org.pharmaguard.tools.pgx.catalog;

import org.pharmaguard.tools.pgx.Phenotype;
import org.pharmaguard.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Per-gene activity scores of star alleles and the breakpoints that turn a summed diplotype score into a
 * metabolizer phenotype.
 */
public final class ActivityScoreTable {

    /**
     * Scores within this distance of a breakpoint count as equal to it.
     */
    static final double BREAKPOINT_TOLERANCE = 1e-9;

    /**
     * Upper-inclusive bound of one phenotype class; a {@code null} bound is open and may only come last.
     */
    public record Breakpoint(Phenotype phenotype, Double maxScore) {
        public boolean isOpen() {
            return maxScore == null;
        }
    }

    private final String gene;
    private final Map<String, Double> alleleScores;
    private final List<Breakpoint> breakpoints;
    private final Phenotype defaultPhenotype;

    public ActivityScoreTable(final String gene, final Map<String, Double> alleleScores,
                              final List<Breakpoint> breakpoints, final Phenotype defaultPhenotype) {
        this.gene = Utils.nonEmpty(gene, "gene");
        this.alleleScores = Collections.unmodifiableMap(new LinkedHashMap<>(Utils.nonNull(alleleScores)));
        this.breakpoints = List.copyOf(Utils.nonEmpty(breakpoints, "breakpoints of " + gene));
        this.defaultPhenotype = Utils.nonNull(defaultPhenotype);
        Utils.validateArg(this.breakpoints.get(this.breakpoints.size() - 1).isOpen(),
                () -> "the last breakpoint of " + gene + " must be open");
        double previous = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < this.breakpoints.size() - 1; i++) {
            final Breakpoint breakpoint = this.breakpoints.get(i);
            Utils.validateArg(!breakpoint.isOpen(), () -> "only the last breakpoint of " + gene + " may be open");
            Utils.validateArg(breakpoint.maxScore() > previous, () -> "breakpoints of " + gene + " must be strictly increasing");
            previous = breakpoint.maxScore();
        }
    }

    public String getGene() {
        return gene;
    }

    public Map<String, Double> getAlleleScores() {
        return alleleScores;
    }

    public List<Breakpoint> getBreakpoints() {
        return breakpoints;
    }

    /**
     * Phenotype reported for a gene whose diplotype was defaulted to wild-type.
     */
    public Phenotype getDefaultPhenotype() {
        return defaultPhenotype;
    }

    public OptionalDouble alleleScore(final String starAllele) {
        final Double score = alleleScores.get(starAllele);
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    /**
     * Classifies a summed activity score: the first breakpoint whose bound is not exceeded wins.
     */
    public Phenotype classify(final double activityScore) {
        for (final Breakpoint breakpoint : breakpoints) {
            if (breakpoint.isOpen() || activityScore <= breakpoint.maxScore() + BREAKPOINT_TOLERANCE) {
                return breakpoint.phenotype();
            }
        }
        throw new IllegalStateException("breakpoints of " + gene + " do not end with an open bound");
    }
}
