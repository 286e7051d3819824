package org.pharmaguard.tools.pgx.cohort;

import org.pharmaguard.tools.pgx.RiskLabel;
import org.pharmaguard.tools.pgx.Severity;

/**
 * The part of a per-drug result the cohort fold needs.
 */
public interface CohortMember {

    String getPatientId();

    String getDrug();

    RiskLabel getRiskLabel();

    Severity getSeverity();

    /**
     * A member is high risk when its label is Toxic or Ineffective, or its severity is high or critical.
     */
    default boolean isHighRisk() {
        return getRiskLabel() == RiskLabel.TOXIC
                || getRiskLabel() == RiskLabel.INEFFECTIVE
                || getSeverity() == Severity.HIGH
                || getSeverity() == Severity.CRITICAL;
    }
}
