package org.pharmaguard.tools.pgx;

import htsjdk.tribble.TribbleException;
import htsjdk.tribble.readers.LineIteratorImpl;
import htsjdk.tribble.readers.SynchronousLineReader;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.Genotype;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFCodec;
import htsjdk.variant.vcf.VCFHeader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pharmaguard.engine.filters.CountingVariantFilter;
import org.pharmaguard.engine.filters.VariantFilterLibrary;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.tools.pgx.catalog.RuleCatalog;
import org.pharmaguard.tools.pgx.catalog.StarAlleleDefinition;
import org.pharmaguard.utils.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns raw VCF lines into the annotated variants the rest of the pipeline works on.
 * <p>
 * A record is discarded, and counted, when it cannot be decoded, when its QUAL is below the threshold (a missing
 * QUAL counts as 0), when the first sample's genotype is not a diploid hom-ref, het or hom-var call, or when its
 * resolved gene is not a target gene. A single bad line never fails the run. Input without a usable header is
 * wholly unparseable and yields an empty result whose parsing flag is false.
 * </p>
 * <p>
 * Gene and star allele come from the INFO keys {@value #INFO_GENE} and {@value #INFO_STAR} when present, otherwise
 * from the catalog's rsID table using the ID column or INFO {@value #INFO_RS}. Hom-ref records are kept: they count
 * towards quality metrics but never contribute an allele.
 * </p>
 */
public final class VariantQualityFilter {

    private static final Logger logger = LogManager.getLogger(VariantQualityFilter.class);

    public static final double DEFAULT_MIN_QUALITY = 20.0;

    public static final String INFO_GENE = "GENE";
    public static final String INFO_STAR = "STAR";
    public static final String INFO_RS = "RS";

    static final String DEFAULT_FILE_FORMAT_LINE = "##fileformat=VCFv4.2";

    private final RuleCatalog catalog;
    private final double minimumQuality;

    public VariantQualityFilter(final RuleCatalog catalog) {
        this(catalog, DEFAULT_MIN_QUALITY);
    }

    public VariantQualityFilter(final RuleCatalog catalog, final double minimumQuality) {
        this.catalog = Utils.nonNull(catalog, "catalog");
        Utils.validateArg(minimumQuality >= 0, "minimum quality must be non-negative");
        this.minimumQuality = minimumQuality;
    }

    public double getMinimumQuality() {
        return minimumQuality;
    }

    public VariantFilterResult filter(final Path vcf) {
        Utils.nonNull(vcf, "vcf");
        try (final BufferedReader reader = Files.newBufferedReader(vcf, StandardCharsets.UTF_8)) {
            return filter(reader);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(vcf, e);
        } catch (final UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(vcf, e.getCause());
        }
    }

    public VariantFilterResult filter(final Reader reader) {
        final BufferedReader buffered = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        return filter(buffered.lines().collect(Collectors.toList()));
    }

    /**
     * Filters VCF content given as lines (header lines included).
     */
    public VariantFilterResult filter(final List<String> lines) {
        Utils.nonNull(lines, "lines");
        final List<String> headerLines = new ArrayList<>();
        final List<String> dataLines = new ArrayList<>();
        for (final String line : lines) {
            if (line == null || line.trim().isEmpty()) {
                continue;
            }
            if (line.startsWith("#")) {
                if (dataLines.isEmpty()) {
                    headerLines.add(line.trim());
                }
            } else {
                dataLines.add(line);
            }
        }

        final VCFCodec codec = new VCFCodec();
        final Optional<VCFHeader> header = readHeader(codec, headerLines);
        if (header.isEmpty()) {
            logger.warn(String.format("VCF input has no usable header; all %d data line(s) skipped", dataLines.size()));
            return VariantFilterResult.unparseable(dataLines.size());
        }
        final List<String> samples = header.get().getGenotypeSamples();
        final String sampleName = samples.isEmpty() ? null : samples.get(0);

        final CountingVariantFilter qualityFilter = new CountingVariantFilter(new VariantFilterLibrary.MinimumQualityVariantFilter(minimumQuality));
        final CountingVariantFilter genotypeFilter = new CountingVariantFilter(VariantFilterLibrary.CLASSIFIABLE_GENOTYPE);
        final CountingVariantFilter recordFilter = qualityFilter.and(genotypeFilter);

        final List<PgxVariant> retained = new ArrayList<>();
        long malformed = 0;
        long offTarget = 0;
        for (final String line : dataLines) {
            final PgxVariant variant;
            try {
                final VariantContext vc = codec.decode(line);
                if (vc == null) {
                    malformed++;
                    continue;
                }
                if (!recordFilter.test(vc)) {
                    continue;
                }
                variant = annotate(vc);
            } catch (final RuntimeException e) {
                // htsjdk reports bad fields with several unchecked exception types, some only on lazy genotype decoding
                malformed++;
                logger.debug("Skipping malformed VCF record: " + e.getMessage());
                continue;
            }
            if (variant.gene() != null && !catalog.isTargetGene(variant.gene())) {
                offTarget++;
                logger.debug(String.format("Skipping %s: %s is not a target gene", variant.rsid(), variant.gene()));
                continue;
            }
            retained.add(variant);
        }

        final boolean parsingSuccess = dataLines.isEmpty() || malformed < dataLines.size();
        final VariantFilterResult result = new VariantFilterResult(retained, sampleName, parsingSuccess, dataLines.size(),
                malformed, qualityFilter.getFilteredCount(), genotypeFilter.getFilteredCount(), offTarget);
        logger.info("VCF filtering: " + result);
        if (recordFilter.getFilteredCount() > 0) {
            logger.info(recordFilter.getSummaryLine());
        }
        return result;
    }

    private Optional<VCFHeader> readHeader(final VCFCodec codec, final List<String> headerLines) {
        if (headerLines.stream().noneMatch(l -> l.startsWith("#CHROM"))) {
            return Optional.empty();
        }
        final List<String> lines = new ArrayList<>(headerLines);
        if (!lines.get(0).startsWith("##fileformat=VCF")) {
            lines.add(0, DEFAULT_FILE_FORMAT_LINE);
        }
        try {
            final Object header = codec.readActualHeader(new LineIteratorImpl(new SynchronousLineReader(new StringReader(String.join("\n", lines)))));
            return header instanceof VCFHeader ? Optional.of((VCFHeader) header) : Optional.empty();
        } catch (final TribbleException e) {
            logger.warn("Could not parse the VCF header: " + e.getMessage());
            return Optional.empty();
        }
    }

    private PgxVariant annotate(final VariantContext vc) {
        final Genotype genotype = VariantFilterLibrary.firstSampleGenotype(vc);
        final GenotypeCall call = GenotypeCall.classify(genotype)
                .orElseThrow(() -> new IllegalStateException("genotype passed the filter but cannot be classified"));

        String rsid = vc.hasID() ? vc.getID().split(";")[0] : null;
        final String rsFromInfo = infoValue(vc, INFO_RS);
        if (rsid == null && rsFromInfo != null) {
            rsid = rsFromInfo;
        }

        String gene = infoValue(vc, INFO_GENE);
        String star = infoValue(vc, INFO_STAR);
        final Optional<StarAlleleDefinition> byRsid = catalog.starAlleleByRsid(rsid);
        if (byRsid.isPresent()) {
            gene = gene == null ? byRsid.get().gene() : gene;
            star = star == null ? byRsid.get().starAllele() : star;
        }
        final AlleleFunction function;
        if (byRsid.isPresent() && byRsid.get().gene().equals(gene) && byRsid.get().starAllele().equals(star)) {
            function = byRsid.get().function();
        } else if (gene != null && star != null) {
            function = catalog.starAllele(gene, star).map(StarAlleleDefinition::function).orElse(null);
        } else {
            function = null;
        }

        final String contig = vc.getContig();
        final String id = rsid != null ? rsid : (contig.startsWith("chr") ? contig : "chr" + contig) + ":" + vc.getStart();
        final String alt = vc.getAlternateAlleles().stream().map(Allele::getDisplayString).collect(Collectors.joining(","));
        return new PgxVariant(contig, vc.getStart(), id, vc.getReference().getDisplayString(), alt,
                VariantFilterLibrary.qualityOf(vc), call, alleleIndexString(vc, genotype), gene, star, function);
    }

    private static String infoValue(final VariantContext vc, final String key) {
        final String value = vc.getAttributeAsString(key, null);
        if (value == null) {
            return null;
        }
        final String trimmed = value.trim();
        return trimmed.isEmpty() || trimmed.equals(".") ? null : trimmed;
    }

    /**
     * Genotype as allele indices, e.g. {@code 0|1}.
     */
    private static String alleleIndexString(final VariantContext vc, final Genotype genotype) {
        return genotype.getAlleles().stream()
                .map(a -> a.isNoCall() ? "." : String.valueOf(vc.getAlleleIndex(a)))
                .collect(Collectors.joining(genotype.isPhased() ? "|" : "/"));
    }
}
