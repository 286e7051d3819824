package org.pharmaguard.tools.pgx;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import org.pharmaguard.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only audit log of the pipeline stages that produced a result. Instances are immutable:
 * {@link #append} returns a new trace. A {@link #disabled()} trace ignores appends.
 */
public final class DecisionTrace {

    /**
     * One stage: what went in, what came out, and which table or source decided it.
     */
    @JsonPropertyOrder({"stage", "input", "output", "source"})
    public record Step(@JsonProperty("stage") String stage,
                       @JsonProperty("input") String input,
                       @JsonProperty("output") String output,
                       @JsonProperty("source") String source) {

        public Step {
            Utils.nonEmpty(stage, "stage");
            Utils.nonNull(input, "input");
            Utils.nonNull(output, "output");
            Utils.nonNull(source, "source");
        }
    }

    private static final DecisionTrace DISABLED = new DecisionTrace(false, Collections.emptyList());

    private final boolean enabled;
    private final List<Step> steps;

    private DecisionTrace(final boolean enabled, final List<Step> steps) {
        this.enabled = enabled;
        this.steps = Collections.unmodifiableList(steps);
    }

    public static DecisionTrace empty() {
        return new DecisionTrace(true, Collections.emptyList());
    }

    public static DecisionTrace disabled() {
        return DISABLED;
    }

    public DecisionTrace append(final String stage, final String input, final String output, final String source) {
        if (!enabled) {
            return this;
        }
        final List<Step> next = new ArrayList<>(steps.size() + 1);
        next.addAll(steps);
        next.add(new Step(stage, input, output, source));
        return new DecisionTrace(true, next);
    }

    public boolean isEnabled() {
        return enabled;
    }

    @JsonValue
    public List<Step> getSteps() {
        return steps;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final DecisionTrace that = (DecisionTrace) o;
        return enabled == that.enabled && steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(enabled) + steps.hashCode();
    }
}
