package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.utils.Utils;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A concurrently taken medication and its inhibitor strength against one gene.
 */
@JsonPropertyOrder({"drug", "strength"})
public final class ConcurrentMedication {

    private final String drug;
    private final InhibitorStrength strength;

    public ConcurrentMedication(final String drug, final InhibitorStrength strength) {
        this.drug = Utils.nonEmpty(drug, "drug");
        this.strength = Utils.nonNull(strength, "strength");
    }

    /**
     * Resolves every name of a medication list for a gene. Names are trimmed and lower-cased; names the catalog does
     * not know resolve to {@link InhibitorStrength#NONE}.
     */
    public static List<ConcurrentMedication> resolve(final RuleCatalog catalog, final String gene, final List<String> medications) {
        Utils.nonNull(catalog, "catalog");
        Utils.nonNull(medications, "medications");
        return medications.stream()
                .filter(m -> m != null && !m.isBlank())
                .map(m -> m.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .map(m -> new ConcurrentMedication(m, catalog.inhibitorStrength(gene, m)))
                .collect(Collectors.toList());
    }

    /**
     * Splits free text such as {@code "Fluoxetine, omeprazole"} into medication names.
     */
    public static List<String> parseList(final String text) {
        return text == null ? List.of() : Utils.splitCommaSeparated(text);
    }

    @JsonProperty("drug")
    public String getDrug() {
        return drug;
    }

    @JsonProperty("strength")
    public InhibitorStrength getStrength() {
        return strength;
    }

    public boolean isInhibitor() {
        return strength != InhibitorStrength.NONE;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ConcurrentMedication that = (ConcurrentMedication) o;
        return drug.equals(that.drug) && strength == that.strength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(drug, strength);
    }

    @Override
    public String toString() {
        return drug + " (" + strength.getLabel() + ")";
    }
}
