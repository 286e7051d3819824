package org.pharmaguard.tools.pgx;

import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.utils.Utils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps free-text drug names to the catalog's canonical names.
 * <p>
 * Names are trimmed and upper-cased, then resolved through the alias table ({@code PLAVIX} to {@code CLOPIDOGREL}),
 * then against the supported drugs. Failing both, a longer name that contains an alias or supported drug
 * ({@code CODEINE PHOSPHATE 30MG}) resolves to it, the longest contained name winning. Anything else is returned
 * upper-cased and is unsupported.
 * </p>
 */
public final class DrugNameNormalizer {

    private final RuleCatalog catalog;

    public DrugNameNormalizer(final RuleCatalog catalog) {
        this.catalog = Utils.nonNull(catalog, "catalog");
    }

    public String normalize(final String drugName) {
        Utils.nonNull(drugName, "drug name");
        final String upper = drugName.trim().toUpperCase(Locale.ROOT);
        final Map<String, String> aliases = catalog.getDrugAliases();
        if (aliases.containsKey(upper)) {
            return aliases.get(upper);
        }
        if (catalog.getSupportedDrugs().containsKey(upper)) {
            return upper;
        }

        String bestName = null;
        String bestCanonical = null;
        for (final Map.Entry<String, String> alias : aliases.entrySet()) {
            if (upper.contains(alias.getKey()) && (bestName == null || alias.getKey().length() > bestName.length())) {
                bestName = alias.getKey();
                bestCanonical = alias.getValue();
            }
        }
        for (final String supported : catalog.getSupportedDrugs().keySet()) {
            if (upper.contains(supported) && (bestName == null || supported.length() > bestName.length())) {
                bestName = supported;
                bestCanonical = supported;
            }
        }
        return bestCanonical == null ? upper : bestCanonical;
    }

    /**
     * Normalizes every name, dropping blanks and duplicates of the same canonical drug while keeping input order.
     */
    public List<String> normalizeAll(final List<String> drugNames) {
        Utils.nonNull(drugNames, "drug names");
        final Set<String> canonical = new LinkedHashSet<>();
        for (final String name : drugNames) {
            if (name != null && !name.isBlank()) {
                canonical.add(normalize(name));
            }
        }
        return new ArrayList<>(canonical);
    }

    public boolean isSupported(final String canonicalDrug) {
        return catalog.primaryGene(canonicalDrug).isPresent();
    }
}
