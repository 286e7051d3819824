package org.pharmaguard.tools.pgx.evidence;

import org.pharmaguard.tools.pgx.catalog.CpicReference;
import org.pharmaguard.utils.Utils;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Evidence level and citation for a gene-drug pair.
 * <p>
 * Citation fields ({@code authors}, {@code year}, {@code pmid}, {@code doi}, {@code guideline}) are {@code null} when
 * unknown. {@link #formatReference()} only produces a reference when a real citation is on file.
 * </p>
 */
public final class EvidenceAnnotation {

    public static final String NO_EVIDENCE_LEVEL = "none";

    public static final String NO_EVIDENCE_TEXT = "No evidence on file";

    private static final Pattern PMID_PATTERN = Pattern.compile("\\d{6,}");

    private static final Map<String, Integer> TIER_RANKS = Map.of("1A", 1, "1B", 2, "2A", 3, "2B", 4, "3", 5, "4", 6);

    private final String gene;
    private final String drug;
    private final String evidenceLevel;
    private final EvidenceSource source;
    private final String guideline;
    private final String authors;
    private final Integer year;
    private final String pmid;
    private final String doi;
    private final List<String> phenotypeCategories;

    public EvidenceAnnotation(final String gene, final String drug, final String evidenceLevel, final EvidenceSource source,
                              final String guideline, final String authors, final Integer year, final String pmid,
                              final String doi, final List<String> phenotypeCategories) {
        this.gene = Utils.nonNull(gene, "gene");
        this.drug = Utils.nonNull(drug, "drug");
        final String level = Utils.nonEmpty(evidenceLevel, "evidence level").trim();
        this.evidenceLevel = isRecognizedTier(level) ? level.toUpperCase(Locale.ROOT) : level;
        this.source = Utils.nonNull(source, "source");
        this.guideline = guideline;
        this.authors = authors;
        this.year = year;
        this.pmid = pmid;
        this.doi = doi;
        this.phenotypeCategories = List.copyOf(phenotypeCategories);
    }

    /**
     * The explicit sentinel returned when neither a curated nor a dynamic entry exists.
     */
    public static EvidenceAnnotation none(final String gene, final String drug) {
        return new EvidenceAnnotation(gene, drug, NO_EVIDENCE_LEVEL, EvidenceSource.NONE, null, null, null, null, null, List.of());
    }

    public static EvidenceAnnotation fromCpicReference(final CpicReference reference, final List<String> phenotypeCategories) {
        return new EvidenceAnnotation(reference.gene(), reference.drug(), reference.evidenceLevel(), EvidenceSource.CPIC_CURATED,
                reference.guideline(), reference.authors(), reference.year(), reference.pmid(), reference.doi(), phenotypeCategories);
    }

    /**
     * A dynamic row is sparse when it lacks a PMID of at least six digits or a positive publication year.
     */
    public static boolean isSparseCitation(final String pmid, final Integer year) {
        return pmid == null || !PMID_PATTERN.matcher(pmid).matches() || year == null || year <= 0;
    }

    /**
     * Rank of an evidence tier, lower is stronger; unrecognised tiers rank last.
     */
    public static int tierRank(final String level) {
        return level == null ? Integer.MAX_VALUE : TIER_RANKS.getOrDefault(level.trim().toUpperCase(Locale.ROOT), Integer.MAX_VALUE);
    }

    public static boolean isRecognizedTier(final String level) {
        return tierRank(level) != Integer.MAX_VALUE;
    }

    public boolean isSparse() {
        return isSparseCitation(pmid, year);
    }

    public boolean hasEvidence() {
        return source != EvidenceSource.NONE;
    }

    public boolean hasCitation() {
        return authors != null && !isSparse();
    }

    /**
     * Same tier and categories with every citation field dropped.
     */
    public EvidenceAnnotation withoutCitation() {
        return new EvidenceAnnotation(gene, drug, evidenceLevel, source, null, null, null, null, null, phenotypeCategories);
    }

    /**
     * @return e.g. {@code Crews et al. (2014). PMID: 24458010}, or empty when no citation is on file
     */
    public Optional<String> formatReference() {
        return hasCitation() ? Optional.of(String.format("%s (%d). PMID: %s", authors, year, pmid)) : Optional.empty();
    }

    /**
     * FDA pharmacogenomic testing requirement implied by the tier.
     */
    public String getFdaRequirement() {
        switch (evidenceLevel) {
            case "1A":
                return "Required";
            case "1B":
                return "Recommended";
            default:
                return "None";
        }
    }

    public String getGene() {
        return gene;
    }

    public String getDrug() {
        return drug;
    }

    public String getEvidenceLevel() {
        return evidenceLevel;
    }

    public EvidenceSource getSource() {
        return source;
    }

    public String getGuideline() {
        return guideline;
    }

    public String getAuthors() {
        return authors;
    }

    public Integer getYear() {
        return year;
    }

    public String getPmid() {
        return pmid;
    }

    public String getDoi() {
        return doi;
    }

    public List<String> getPhenotypeCategories() {
        return phenotypeCategories;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final EvidenceAnnotation that = (EvidenceAnnotation) o;
        return gene.equals(that.gene) && drug.equals(that.drug) && evidenceLevel.equals(that.evidenceLevel)
                && source == that.source && Objects.equals(guideline, that.guideline) && Objects.equals(authors, that.authors)
                && Objects.equals(year, that.year) && Objects.equals(pmid, that.pmid) && Objects.equals(doi, that.doi)
                && phenotypeCategories.equals(that.phenotypeCategories);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gene, drug, evidenceLevel, source, guideline, authors, year, pmid, doi, phenotypeCategories);
    }

    @Override
    public String toString() {
        return gene + "/" + drug + " " + evidenceLevel + " (" + source.getLabel() + ")";
    }
}
