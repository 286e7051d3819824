package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.utils.Utils;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of checking one gene's genetic phenotype against the concurrent medications.
 */
@JsonPropertyOrder({"gene", "phenoconversion_risk", "genetic_phenotype", "functional_phenotype",
        "strongest_inhibitor", "caused_by", "confidence_penalty", "clinical_note"})
public final class PhenoconversionResult {

    private final String gene;
    private final Phenotype geneticPhenotype;
    private final Phenotype functionalPhenotype;
    private final InhibitorStrength strongestInhibitor;
    private final List<ConcurrentMedication> drivers;
    private final double confidencePenalty;
    private final String clinicalNote;

    public PhenoconversionResult(final String gene,
                                 final Phenotype geneticPhenotype,
                                 final Phenotype functionalPhenotype,
                                 final InhibitorStrength strongestInhibitor,
                                 final List<ConcurrentMedication> drivers,
                                 final double confidencePenalty,
                                 final String clinicalNote) {
        this.gene = Utils.nonNull(gene, "gene");
        this.geneticPhenotype = Utils.nonNull(geneticPhenotype, "genetic phenotype");
        this.functionalPhenotype = Utils.nonNull(functionalPhenotype, "functional phenotype");
        this.strongestInhibitor = Utils.nonNull(strongestInhibitor, "strongest inhibitor");
        this.drivers = List.copyOf(drivers);
        Utils.validateArg(confidencePenalty >= 0.0 && confidencePenalty <= 1.0, () -> "penalty outside [0,1]: " + confidencePenalty);
        this.confidencePenalty = confidencePenalty;
        this.clinicalNote = Utils.nonNull(clinicalNote, "clinical note");
    }

    @JsonProperty("gene")
    public String getGene() {
        return gene;
    }

    /**
     * @return true if at least one concurrent medication inhibits the gene
     */
    @JsonProperty("phenoconversion_risk")
    public boolean hasInhibitorExposure() {
        return !drivers.isEmpty();
    }

    public boolean isPhenotypeShifted() {
        return functionalPhenotype != geneticPhenotype;
    }

    @JsonProperty("genetic_phenotype")
    public Phenotype getGeneticPhenotype() {
        return geneticPhenotype;
    }

    @JsonProperty("functional_phenotype")
    public Phenotype getFunctionalPhenotype() {
        return functionalPhenotype;
    }

    @JsonProperty("strongest_inhibitor")
    public InhibitorStrength getStrongestInhibitor() {
        return strongestInhibitor;
    }

    @JsonProperty("caused_by")
    public List<ConcurrentMedication> getDrivers() {
        return drivers;
    }

    @JsonProperty("confidence_penalty")
    public double getConfidencePenalty() {
        return confidencePenalty;
    }

    @JsonProperty("clinical_note")
    public String getClinicalNote() {
        return clinicalNote;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final PhenoconversionResult that = (PhenoconversionResult) o;
        return Double.compare(that.confidencePenalty, confidencePenalty) == 0 && gene.equals(that.gene)
                && geneticPhenotype == that.geneticPhenotype && functionalPhenotype == that.functionalPhenotype
                && strongestInhibitor == that.strongestInhibitor && drivers.equals(that.drivers)
                && clinicalNote.equals(that.clinicalNote);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gene, geneticPhenotype, functionalPhenotype, strongestInhibitor, drivers, confidencePenalty, clinicalNote);
    }

    @Override
    public String toString() {
        return gene + ": " + geneticPhenotype.getLabel() + " -> " + functionalPhenotype.getLabel() + " (" + strongestInhibitor.getLabel() + ")";
    }
}
