package org.pharmaguard.tools.pgx.evidence;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.utils.Utils;
import org.pharmaguard.utils.tsv.DataLine;
import org.pharmaguard.utils.tsv.TableColumnCollection;
import org.pharmaguard.utils.tsv.TableReader;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evidence read from a PharmGKB {@code clinical_annotations.tsv} download.
 * <p>
 * The table must have the columns {@code Gene}, {@code Drug(s)} and {@code Level of Evidence}; {@code Phenotype Category},
 * {@code PMID}, {@code Year} and {@code Authors} are optional. A {@code Drug(s)} cell may list several drugs separated by
 * {@code ;}. For each (gene, drug) pair the row with the strongest tier is kept and the phenotype categories of
 * equally strong or weaker rows are merged into it.
 * </p>
 */
public final class PharmGkbClinicalAnnotationSource implements EvidenceAnnotationSource {

    private static final Logger logger = LogManager.getLogger(PharmGkbClinicalAnnotationSource.class);

    public static final String GENE_COLUMN = "Gene";
    public static final String DRUGS_COLUMN = "Drug(s)";
    public static final String LEVEL_COLUMN = "Level of Evidence";
    public static final String CATEGORY_COLUMN = "Phenotype Category";
    public static final String PMID_COLUMN = "PMID";
    public static final String YEAR_COLUMN = "Year";
    public static final String AUTHORS_COLUMN = "Authors";

    private final Map<String, EvidenceAnnotation> annotations;

    private PharmGkbClinicalAnnotationSource(final Map<String, EvidenceAnnotation> annotations) {
        this.annotations = Collections.unmodifiableMap(annotations);
    }

    public static PharmGkbClinicalAnnotationSource fromPath(final Path path) {
        Utils.nonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromReader(path.toString(), reader);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    public static PharmGkbClinicalAnnotationSource fromReader(final String sourceName, final Reader reader) throws IOException {
        final Map<String, EvidenceAnnotation> best = new LinkedHashMap<>();
        try (ClinicalAnnotationReader tableReader = new ClinicalAnnotationReader(sourceName, reader)) {
            for (final List<EvidenceAnnotation> rowAnnotations : tableReader) {
                rowAnnotations.forEach(annotation -> merge(best, annotation));
            }
        }
        logger.info(String.format("Loaded %d gene-drug evidence pairs from %s", best.size(), sourceName));
        return new PharmGkbClinicalAnnotationSource(best);
    }

    private static void merge(final Map<String, EvidenceAnnotation> best, final EvidenceAnnotation candidate) {
        final String key = key(candidate.getGene(), candidate.getDrug());
        final EvidenceAnnotation existing = best.get(key);
        if (existing == null) {
            best.put(key, candidate);
            return;
        }
        final boolean candidateIsStronger = EvidenceAnnotation.tierRank(candidate.getEvidenceLevel())
                < EvidenceAnnotation.tierRank(existing.getEvidenceLevel());
        final EvidenceAnnotation kept = candidateIsStronger ? candidate : existing;
        final Set<String> categories = new LinkedHashSet<>(kept.getPhenotypeCategories());
        categories.addAll(candidateIsStronger ? existing.getPhenotypeCategories() : candidate.getPhenotypeCategories());
        best.put(key, new EvidenceAnnotation(kept.getGene(), kept.getDrug(), kept.getEvidenceLevel(), kept.getSource(),
                kept.getGuideline(), kept.getAuthors(), kept.getYear(), kept.getPmid(), kept.getDoi(), new ArrayList<>(categories)));
    }

    @Override
    public Optional<EvidenceAnnotation> lookup(final String gene, final String drug) {
        if (gene == null || drug == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(annotations.get(key(gene, drug.trim().toUpperCase(Locale.ROOT))));
    }

    public int size() {
        return annotations.size();
    }

    private static String key(final String gene, final String drug) {
        return gene + "|" + drug;
    }

    private static final class ClinicalAnnotationReader extends TableReader<List<EvidenceAnnotation>> {

        ClinicalAnnotationReader(final String sourceName, final Reader reader) throws IOException {
            super(sourceName, reader);
        }

        @Override
        protected void processColumns(final TableColumnCollection tableColumns) {
            if (!tableColumns.containsAll(GENE_COLUMN, DRUGS_COLUMN, LEVEL_COLUMN)) {
                throw formatException(String.format("missing required column(s); expected %s, %s and %s but found %s",
                        GENE_COLUMN, DRUGS_COLUMN, LEVEL_COLUMN, tableColumns.names()));
            }
        }

        @Override
        protected List<EvidenceAnnotation> createRecord(final DataLine dataLine) {
            final String gene = dataLine.get(GENE_COLUMN);
            final String drugs = dataLine.get(DRUGS_COLUMN);
            final String level = dataLine.get(LEVEL_COLUMN);
            if (gene.isEmpty() || drugs.isEmpty() || level.isEmpty()) {
                return null;
            }
            if (!EvidenceAnnotation.isRecognizedTier(level)) {
                logger.warn(String.format("Skipping evidence row at line %d: unrecognised level of evidence '%s'",
                        dataLine.getLineNumber(), level));
                return null;
            }
            final List<String> categories = Arrays.stream(dataLine.get(CATEGORY_COLUMN, "").split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList());
            final String pmid = emptyToNull(dataLine.get(PMID_COLUMN, ""));
            final int year = dataLine.getInt(YEAR_COLUMN, 0);
            final String authors = emptyToNull(dataLine.get(AUTHORS_COLUMN, ""));

            final List<EvidenceAnnotation> result = new ArrayList<>();
            for (final String drug : drugs.split(";")) {
                final String canonical = drug.trim().toUpperCase(Locale.ROOT);
                if (!canonical.isEmpty()) {
                    result.add(new EvidenceAnnotation(gene, canonical, level, EvidenceSource.PHARMGKB, null, authors,
                            year > 0 ? year : null, pmid, null, categories));
                }
            }
            return result.isEmpty() ? null : result;
        }

        private static String emptyToNull(final String value) {
            return value.isEmpty() ? null : value;
        }
    }
}
