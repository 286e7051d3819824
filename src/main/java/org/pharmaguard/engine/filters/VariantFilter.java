package org.pharmaguard.engine.filters;

import htsjdk.variant.variantcontext.VariantContext;

import java.util.function.Predicate;

/**
 * A test applied to each decoded VCF record; records for which it returns false are discarded.
 */
@FunctionalInterface
public interface VariantFilter extends Predicate<VariantContext> {
}
