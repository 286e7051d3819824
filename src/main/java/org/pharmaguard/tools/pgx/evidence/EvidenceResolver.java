package org.pharmaguard.tools.pgx.evidence;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pharmaguard.tools.pgx.catalog.CpicReference;
import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.utils.Utils;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the evidence behind a gene-drug pair.
 * <p>
 * A complete row of the dynamic source wins. When that row is sparse or missing, the catalog's curated CPIC
 * reference for the pair is used instead. A sparse row with no curated reference keeps its tier but loses its
 * citation. With neither, the result is {@link EvidenceAnnotation#none}; a citation is never made up.
 * </p>
 */
public final class EvidenceResolver {

    private static final Logger logger = LogManager.getLogger(EvidenceResolver.class);

    private final RuleCatalog catalog;
    private final EvidenceAnnotationSource dynamicSource;

    public EvidenceResolver(final RuleCatalog catalog) {
        this(catalog, EvidenceAnnotationSource.EMPTY);
    }

    public EvidenceResolver(final RuleCatalog catalog, final EvidenceAnnotationSource dynamicSource) {
        this.catalog = Utils.nonNull(catalog, "catalog");
        this.dynamicSource = Utils.nonNull(dynamicSource, "dynamic source");
    }

    public EvidenceAnnotation resolve(final String gene, final String drug) {
        Utils.nonNull(gene, "gene");
        Utils.nonNull(drug, "drug");
        final Optional<EvidenceAnnotation> dynamic = dynamicSource.lookup(gene, drug);
        if (dynamic.isPresent() && !dynamic.get().isSparse()) {
            return dynamic.get();
        }

        final Optional<CpicReference> curated = catalog.cpicReference(gene, drug);
        if (curated.isPresent()) {
            if (dynamic.isPresent()) {
                logger.debug(String.format("Sparse dynamic evidence for %s/%s replaced by curated CPIC reference", gene, drug));
            }
            final List<String> categories = dynamic.map(EvidenceAnnotation::getPhenotypeCategories).orElse(List.of());
            return EvidenceAnnotation.fromCpicReference(curated.get(), categories);
        }
        return dynamic.map(EvidenceAnnotation::withoutCitation).orElseGet(() -> EvidenceAnnotation.none(gene, drug));
    }
}
