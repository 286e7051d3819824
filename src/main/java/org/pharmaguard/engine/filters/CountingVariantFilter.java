package org.pharmaguard.engine.filters;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.variant.variantcontext.VariantContext;
import org.pharmaguard.utils.Utils;

/**
 * Wraps a {@link VariantFilter} and counts the records it rejects, so that discarded input can be reported
 * instead of silently dropped.
 * <p>
 * Composite filters built with {@link #and(CountingVariantFilter)} evaluate left to right with short-circuiting,
 * so a record rejected by the left filter is never seen, or counted, by the right one.
 * </p>
 */
public class CountingVariantFilter implements VariantFilter {

    @VisibleForTesting
    protected final VariantFilter delegateFilter;

    protected long filteredCount = 0;

    public CountingVariantFilter(final VariantFilter variantFilter) {
        delegateFilter = Utils.nonNull(variantFilter);
    }

    // Used only by the composite subclass, which overrides test without the delegate.
    private CountingVariantFilter() {
        delegateFilter = null;
    }

    public long getFilteredCount() {
        return filteredCount;
    }

    public String getName() {
        return delegateFilter.getClass().getSimpleName();
    }

    public String getSummaryLine() {
        if (0 == filteredCount) {
            return "No variants filtered by: " + getName();
        }
        return filteredCount + " variant(s) filtered by: " + getName();
    }

    public CountingVariantFilter and(final CountingVariantFilter other) {
        Utils.nonNull(other);
        return new CountingAndVariantFilter(this, other);
    }

    @Override
    public boolean test(final VariantContext variant) {
        final boolean accept = delegateFilter.test(variant);
        if (!accept) {
            filteredCount++;
        }
        return accept;
    }

    @VisibleForTesting
    protected static final class CountingAndVariantFilter extends CountingVariantFilter {

        private final CountingVariantFilter lhs;
        private final CountingVariantFilter rhs;

        private CountingAndVariantFilter(final CountingVariantFilter lhs, final CountingVariantFilter rhs) {
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public boolean test(final VariantContext variant) {
            final boolean accept = lhs.test(variant) && rhs.test(variant);
            if (!accept) {
                filteredCount++;
            }
            return accept;
        }

        @Override
        public String getName() {
            return "(" + lhs.getName() + " AND " + rhs.getName() + ")";
        }

        @Override
        public String getSummaryLine() {
            if (0 == filteredCount) {
                return "No variants filtered by: " + getName();
            }
            return filteredCount + " variant(s) filtered by: " + getName() + "\n"
                    + (lhs.getFilteredCount() > 0 ? "  " + lhs.getSummaryLine() + "\n" : "")
                    + (rhs.getFilteredCount() > 0 ? "  " + rhs.getSummaryLine() : "");
        }
    }
}
